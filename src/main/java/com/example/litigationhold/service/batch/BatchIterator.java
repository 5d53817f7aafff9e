package com.example.litigationhold.service.batch;

import com.example.litigationhold.domain.model.Batch;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Splits an ordered list into consecutive windows of a fixed size.
 * <p>
 * Batches are produced lazily and each call to {@link #iterator()} starts over,
 * yielding the same batches for the same input. Only the last batch may be shorter.
 */
public class BatchIterator<T> implements Iterable<Batch<T>> {

    private final List<T> items;
    private final int batchSize;

    public BatchIterator(List<T> items, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1, got " + batchSize);
        }
        this.items = List.copyOf(items);
        this.batchSize = batchSize;
    }

    public static <T> BatchIterator<T> of(List<T> items, int batchSize) {
        return new BatchIterator<>(items, batchSize);
    }

    /**
     * Number of batches, ceil(N / batchSize)
     */
    public int batchCount() {
        return (items.size() + batchSize - 1) / batchSize;
    }

    @Override
    public Iterator<Batch<T>> iterator() {
        var total = batchCount();

        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < total;
            }

            @Override
            public Batch<T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                var from = next * batchSize;
                var to = Math.min(from + batchSize, items.size());
                next++;
                return new Batch<>(next, total, items.subList(from, to));
            }
        };
    }
}
