package com.nodeproxy.proxy;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Value of a daemon query or the failure that prevented it. Exactly one of the two is present;
 * callers check {@link #isFailure()} before trusting the value.
 */
public final class ProxyResult<T> {

    private final T value;
    private final RpcFailure failure;

    private ProxyResult(T value, RpcFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> ProxyResult<T> success(T value) {
        return new ProxyResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ProxyResult<T> failure(RpcFailure failure) {
        return new ProxyResult<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("No value: " + failure.description());
        }
        return value;
    }

    public Optional<RpcFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    public Optional<String> getFailureDescription() {
        return getFailure().map(RpcFailure::description);
    }

    public <R> ProxyResult<R> map(Function<? super T, ? extends R> mapper) {
        if (failure != null) {
            return failure(failure);
        }
        return success(mapper.apply(value));
    }

    public <R> ProxyResult<R> flatMap(Function<? super T, ProxyResult<R>> mapper) {
        if (failure != null) {
            return failure(failure);
        }
        return mapper.apply(value);
    }

    @Override
    public String toString() {
        return failure != null ? "ProxyResult[failure=" + failure.description() + "]" : "ProxyResult[value=" + value + "]";
    }
}
