package org.pragmatica.purify.error;

import java.util.function.Function;

/**
 * Result of a parse - either a value or the error that stopped it.
 * A failure never carries a partial value.
 */
public sealed interface ParseOutcome<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The value of a success. Calling this on a failure is a programming error.
     */
    T unwrap();

    /**
     * The error of a failure. Calling this on a success is a programming error.
     */
    ParseError error();

    <R> R fold(Function<ParseError, R> onFailure, Function<T, R> onSuccess);

    default <R> ParseOutcome<R> map(Function<T, R> mapper) {
        return fold(ParseOutcome::failure, value -> success(mapper.apply(value)));
    }

    default <R> ParseOutcome<R> flatMap(Function<T, ParseOutcome<R>> mapper) {
        return fold(ParseOutcome::failure, mapper);
    }

    static <T> ParseOutcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseOutcome<T> failure(ParseError error) {
        return new Failure<>(error);
    }

    record Success<T>(T value) implements ParseOutcome<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public ParseError error() {
            throw new IllegalStateException("Successful parse has no error");
        }

        @Override
        public <R> R fold(Function<ParseError, R> onFailure, Function<T, R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(ParseError error) implements ParseOutcome<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Parse failed: " + error.message());
        }

        @Override
        public <R> R fold(Function<ParseError, R> onFailure, Function<T, R> onSuccess) {
            return onFailure.apply(error);
        }
    }
}
