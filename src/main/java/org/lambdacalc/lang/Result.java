package org.lambdacalc.lang;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an operation which either produced a value or failed with a {@link Cause}.
 *
 * @param <T> type of the success value
 */
public sealed interface Result<T> {

    static <T> Result<T> success(T value) {
        return new Success<>(Objects.requireNonNull(value, "value"));
    }

    static <T> Result<T> failure(Cause cause) {
        return new Failure<>(Objects.requireNonNull(cause, "cause"));
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Collapse both outcomes into a single value.
     */
    <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return fold(Result::failure, value -> success(mapper.apply(value)));
    }

    default <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        return fold(Result::failure, mapper);
    }

    default Result<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default Result<T> onFailure(Consumer<? super Cause> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.cause());
        }
        return this;
    }

    /**
     * Value of a successful result.
     *
     * @throws NoSuchElementException if this result is a failure
     */
    default T unwrap() {
        return fold(cause -> {
                        throw new NoSuchElementException("Unwrap of failed result: " + cause.message());
                    },
                    Function.identity());
    }

    /**
     * Cause of a failed result.
     *
     * @throws NoSuchElementException if this result is a success
     */
    default Cause cause() {
        return fold(Function.identity(),
                    value -> {
                        throw new NoSuchElementException("Result is not a failure: " + value);
                    });
    }

    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(Cause cause) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }
    }
}
