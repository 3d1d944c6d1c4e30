package net.batchq.core.spi;

import java.util.concurrent.Callable;

/** 아카이브 접근을 트랜잭션 경계로 감싼다. 진행 중인 트랜잭션이 있으면 참여 */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;

    default void execute(TxBody body) throws Exception {
        required(() -> { body.run(); return null; });
    }

    @FunctionalInterface
    interface TxBody {
        void run() throws Exception;
    }
}
