package com.pairstream.server.pipeline.concurrent;

/**
 * Outcome of applying a function to one item: either a value or the error the function
 * raised. Carries the item's position in the input.
 */
public final class ItemResult<T, R> {

    private final int index;
    private final T item;
    private final R value;
    private final Throwable error;

    private ItemResult(int index, T item, R value, Throwable error) {
        this.index = index;
        this.item = item;
        this.value = value;
        this.error = error;
    }

    public static <T, R> ItemResult<T, R> success(int index, T item, R value) {
        return new ItemResult<>(index, item, value, null);
    }

    public static <T, R> ItemResult<T, R> failure(int index, T item, Throwable error) {
        return new ItemResult<>(index, item, null, error);
    }

    public int getIndex() {
        return index;
    }

    public T getItem() {
        return item;
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if the item failed
     */
    public R getValue() {
        if (error != null) {
            throw new IllegalStateException("Item " + index + " failed", error);
        }
        return value;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ItemResult{" + index + ", ok}" : "ItemResult{" + index + ", error=" + error + "}";
    }
}
