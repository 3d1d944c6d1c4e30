package net.batchq.adapter.jdbc;

import java.sql.Connection;

/**
 * 현재 스레드에 묶인 아카이브 트랜잭션 커넥션.
 * TxRunner 구현체만 bind/unbind 하고, 저장소는 require() 로 꺼내 쓴다.
 */
public final class TxContext {
    private static final ThreadLocal<Connection> BOUND = new ThreadLocal<>();

    private TxContext() {}

    public static void bind(Connection c) {
        Connection prev = BOUND.get();
        if (prev != null && prev != c) {
            throw new IllegalStateException("another connection is already bound to " + Thread.currentThread().getName());
        }
        BOUND.set(c);
    }

    public static void unbind() {
        BOUND.remove();
    }

    /** 없으면 null */
    public static Connection current() {
        return BOUND.get();
    }

    public static boolean active() {
        return BOUND.get() != null;
    }

    public static Connection require() {
        Connection c = BOUND.get();
        if (c == null) throw new IllegalStateException("no archive transaction on this thread (wrap the call with a TxRunner)");
        return c;
    }
}
