package fr.lapetina.llm.broker.batch;

import java.util.NoSuchElementException;

/**
 * Result slot of one batch item: either a value or the error that item ended with.
 *
 * @param index position of the item in the submitted list
 */
public record BatchOutcome<R>(int index, R value, Throwable error) {

    public static <R> BatchOutcome<R> success(int index, R value) {
        return new BatchOutcome<>(index, value, null);
    }

    public static <R> BatchOutcome<R> failure(int index, Throwable error) {
        return new BatchOutcome<>(index, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws NoSuchElementException if the item failed
     */
    public R getOrThrow() {
        if (error != null) {
            throw new NoSuchElementException("Batch item " + index + " failed: " + error.getMessage());
        }
        return value;
    }
}
