package com.autonomous.gateway.model;

import com.autonomous.gateway.error.AIException;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an operation that reports failures as values instead of throwing.
 * Exactly one of value and error is present.
 */
public final class Result<T> {

    private final T value;
    private final AIException error;

    private Result(T value, AIException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> failure(AIException error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Result is a failure: " + error.getMessage());
        }
        return value;
    }

    public AIException getError() {
        if (error == null) {
            throw new IllegalStateException("Result is a success");
        }
        return error;
    }

    public T getOrThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }

    public T getOrNull() {
        return value;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return new Result<>(null, error);
        }
        return new Result<>(mapper.apply(value), null);
    }

    public Result<T> onSuccess(Consumer<? super T> action) {
        if (error == null) {
            action.accept(value);
        }
        return this;
    }

    public Result<T> onFailure(Consumer<? super AIException> action) {
        if (error != null) {
            action.accept(error);
        }
        return this;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success(" + value + ")" : "Failure(" + error + ")";
    }
}
