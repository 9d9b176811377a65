package io.fuelpipelines.fuel;

import java.util.ArrayList;
import java.util.List;

/** Store fake that keeps rows in a list and can be told to fail. */
class InMemoryFuelSaleStore implements FuelSaleStore {
    final List<FuelSale> rows = new ArrayList<>();
    final List<Integer> batchSizes = new ArrayList<>();
    int replaceCalls;
    boolean failReplace;
    /** Fails the n-th insert call (1-based); 0 never fails. */
    int failOnBatch;

    @Override
    public void replaceAll() throws StoreUnavailableException {
        replaceCalls++;
        if (failReplace) throw new StoreUnavailableException("store is read-only");
        rows.clear();
    }

    @Override
    public void acceptBatch(List<FuelSale> sales) throws StoreUnavailableException {
        batchSizes.add(sales.size());
        if (failOnBatch == batchSizes.size()) throw new StoreUnavailableException("disk full");
        rows.addAll(sales);
    }
}
