package com.goldtracker.api;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a single I/O operation: either a payload or an error description, never both.
 */
public sealed interface FetchResult<T> permits FetchResult.Success, FetchResult.Failure {

    static <T> FetchResult<T> success(T data) {
        return new Success<>(data);
    }

    static <T> FetchResult<T> failure(String error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    /**
     * The payload. Throws IllegalStateException on a failure.
     */
    T data();

    /**
     * The error description. Throws IllegalStateException on a success.
     */
    String error();

    <R> FetchResult<R> map(Function<? super T, ? extends R> mapper);

    record Success<T>(T data) implements FetchResult<T> {
        public Success {
            Objects.requireNonNull(data, "data");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String error() {
            throw new IllegalStateException("Successful result has no error");
        }

        @Override
        public <R> FetchResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(data));
        }
    }

    record Failure<T>(String error) implements FetchResult<T> {
        public Failure {
            error = error == null || error.isBlank() ? "unknown error" : error;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T data() {
            throw new IllegalStateException("Failed result has no data: " + error);
        }

        @Override
        public <R> FetchResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(error);
        }
    }
}
