package com.dbdoctor.domain.model;

/**
 * Outcome of one health check in a run: the {@link CheckResult} the check ended with, or the
 * error that kept it from being evaluated at all (for example a schema catalog entry lacking
 * a field the check needs). The run report keeps one per check and keeps going after a failure.
 *
 * @param <T> what a check that ran produced
 * @param <E> why a check could not run
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    record Success<T, E>(T value) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public E errorOrNull() {
            return null;
        }
    }

    record Failure<T, E>(E error) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }

        @Override
        public T getOrThrow() {
            throw new IllegalStateException("Cannot get value from Failure: " + error);
        }

        @Override
        public E errorOrNull() {
            return error;
        }
    }

    boolean isSuccess();

    boolean isFailure();

    T getOrThrow();

    E errorOrNull();

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }
}
