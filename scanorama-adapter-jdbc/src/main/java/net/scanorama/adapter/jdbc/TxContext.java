package net.scanorama.adapter.jdbc;

import java.sql.Connection;

/** Connection bound to the current thread by {@link JdbcTxRunner}. */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();
    private TxContext() {}
    public static void set(Connection c) { LOCAL.set(c); }
    public static Connection get() { return LOCAL.get(); }
    public static void clear() { LOCAL.remove(); }

    /** Repositories only run inside a transaction. */
    public static Connection required() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with JdbcTxRunner)");
        return c;
    }
}
