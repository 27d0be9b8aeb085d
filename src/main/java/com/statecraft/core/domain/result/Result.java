package com.statecraft.core.domain.result;

import org.slf4j.Logger;

import java.sql.SQLException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Success payload or {@link EngineError}; the only thing engine operations hand back to callers.
 */
public final class Result<T> {

    private final T value;
    private final EngineError error;

    private Result(T value, EngineError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> fail(EngineError error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public T value() {
        if (error != null) throw new IllegalStateException("Result failed: " + error.message());
        return value;
    }

    public EngineError error() {
        return error;
    }

    public ErrorKind kind() {
        return error == null ? null : error.kind();
    }

    public <R> Result<R> map(Function<? super T, ? extends R> fn) {
        if (error != null) return fail(error);
        return ok(fn.apply(value));
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws SQLException;
    }

    /**
     * Runs {@code body} and folds every failure into a result:
     * domain violations become their own error, storage failures are logged and reported as STORE_ERROR.
     */
    public static <T> Result<T> attempt(Logger log, String operation, Attempt<T> body) {
        try {
            return ok(body.run());
        } catch (EngineException e) {
            log.debug("{} rejected: {}", operation, e.getError().message());
            return fail(e.getError());
        } catch (SQLException e) {
            log.error("❌ {} failed with a storage error", operation, e);
            return fail(EngineError.storeError(operation));
        } catch (RuntimeException e) {
            log.error("❌ {} failed unexpectedly", operation, e);
            return fail(EngineError.storeError(operation));
        }
    }

    @Override
    public String toString() {
        return error == null ? "Ok[" + value + "]" : "Fail[" + error.kind() + ": " + error.message() + "]";
    }
}
