package io.fuelpipelines.fuel;

import io.fuelpipelines.core.BatchSink;

import java.util.List;

/** The {@code vendas_combustivel} table as the loader sees it. */
public interface FuelSaleStore extends BatchSink<FuelSale> {
    String TABLE = "vendas_combustivel";

    /** Discards every stored row, creating the table first if needed. */
    void replaceAll() throws StoreUnavailableException;

    /** Inserts all sales in one transaction, or none of them. */
    @Override
    void acceptBatch(List<FuelSale> sales) throws StoreUnavailableException;
}
