package com.acme.schedules.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a store operation: either a value or a {@link ScheduleStoreException}.
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(ScheduleStoreException error) {
        return new Err<>(error);
    }

    boolean isOk();

    default boolean isErr() {
        return !isOk();
    }

    /** The success value; throws {@link IllegalStateException} on a failure. */
    T value();

    /** The failure; throws {@link IllegalStateException} on a success. */
    ScheduleStoreException error();

    /** The success value, or the carried exception rethrown. */
    T orElseThrow();

    <U> Result<U> map(Function<? super T, ? extends U> fn);

    <U> Result<U> flatMap(Function<? super T, Result<U>> fn);

    record Ok<T>(T value) implements Result<T> {
        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public ScheduleStoreException error() {
            throw new IllegalStateException("Result is ok");
        }

        @Override
        public T orElseThrow() {
            return value;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> fn) {
            return new Ok<>(fn.apply(value));
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> fn) {
            return fn.apply(value);
        }
    }

    record Err<T>(ScheduleStoreException error) implements Result<T> {
        public Err {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Result is an error: " + error.getMessage(), error);
        }

        @Override
        public T orElseThrow() {
            throw error;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> fn) {
            return new Err<>(error);
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> fn) {
            return new Err<>(error);
        }
    }
}
