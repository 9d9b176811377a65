package io.fuelpipelines.sink;

import io.fuelpipelines.core.BatchSink;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * JDBC batch writer for one table. Every batch is written with a single prepared statement inside
 * its own transaction: either all rows of the batch commit or none do. A connection is opened per
 * call, which suits embedded single-writer stores; use pooling for anything remote.
 */
public class JdbcBatchWriter<T> implements BatchSink<T> {
    /** Binds one item to the insert statement's parameters, in column order. */
    @FunctionalInterface
    public interface RowBinder<T> {
        void bind(PreparedStatement ps, T item) throws SQLException;
    }

    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final String table;
    private final RowBinder<T> binder;
    private final String insertSql;

    public JdbcBatchWriter(String jdbcUrl, String user, String password, String table,
                           List<String> columns, RowBinder<T> binder) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        this.user = user;
        this.password = password;
        this.table = Objects.requireNonNull(table, "table");
        this.binder = Objects.requireNonNull(binder, "binder");
        if (columns.isEmpty()) throw new IllegalArgumentException("columns must not be empty");
        this.insertSql = "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
                + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
    }

    @Override
    public void acceptBatch(List<T> items) throws SQLException {
        if (items == null || items.isEmpty()) return;
        try (Connection c = connect()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(insertSql)) {
                for (T item : items) {
                    binder.bind(ps, item);
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        }
    }

    /**
     * Makes sure the table exists, then removes every row in one transaction. On failure the
     * delete is rolled back and the previous rows stay in place.
     */
    public void replaceAll(String createTableDdl) throws SQLException {
        try (Connection c = connect()) {
            try (Statement s = c.createStatement()) {
                s.execute(createTableDdl);
            }
            c.setAutoCommit(false);
            try (Statement s = c.createStatement()) {
                s.executeUpdate("DELETE FROM " + table);
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        }
    }

    public Connection connect() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }
}
