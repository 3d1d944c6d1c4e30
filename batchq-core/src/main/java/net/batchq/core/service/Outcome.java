package net.batchq.core.service;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/** 호출자에게 보이는 실패는 예외 대신 코드 + 메시지로 돌려준다. */
public final class Outcome<T> {
    private final boolean success;
    private final T value;
    private final ErrorCode error;
    private final String message;

    private Outcome(boolean success, T value, ErrorCode error, String message) {
        this.success = success;
        this.value = value;
        this.error = error;
        this.message = message == null ? "" : message;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(true, value, null, null);
    }

    public static <T> Outcome<T> failure(ErrorCode error, String message) {
        return new Outcome<>(false, null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isSuccess() { return success; }

    public T value() {
        if (!success) throw new NoSuchElementException("no value on failure: " + error + " " + message);
        return value;
    }

    public ErrorCode error() { return error; }

    public String message() { return message; }

    public <R> Outcome<R> map(Function<? super T, ? extends R> f) {
        return success ? success(f.apply(value)) : failure(error, message);
    }

    @Override public String toString() {
        return success ? "Outcome{success, value=" + value + '}'
                : "Outcome{failure, error=" + error + ", message=" + message + '}';
    }
}
