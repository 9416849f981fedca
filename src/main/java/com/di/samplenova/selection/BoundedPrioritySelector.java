package com.di.samplenova.selection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Fixed-capacity queue that keeps the highest-priority items offered to it.
 *
 * <p>Entries are ordered by (priority, insertion sequence); the smallest entry is evicted first.
 * On equal priority the older entry is smaller, so the most recently offered item wins ties.
 * Not thread-safe; each group owns its own instance.
 *
 * @param <T> the retained item type
 */
public class BoundedPrioritySelector<T> {

    private static final Comparator<Entry<?>> EVICTION_ORDER = Comparator
            .<Entry<?>>comparingDouble(Entry::priority)
            .thenComparingLong(Entry::sequence);

    private final int maxSize;
    private final PriorityQueue<Entry<T>> heap;
    private long nextSequence;

    public BoundedPrioritySelector(int maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize cannot be negative: " + maxSize);
        }
        this.maxSize = maxSize;
        this.heap = new PriorityQueue<>(Math.max(1, Math.min(maxSize, 1024)), EVICTION_ORDER);
    }

    /**
     * Offers an item. Below capacity it is always kept; at capacity it replaces the smallest
     * entry unless it is smaller itself.
     *
     * @return number of entries held after the offer
     */
    public int offer(T item, double priority) {
        Entry<T> entry = new Entry<>(priority, nextSequence++, item);
        if (heap.size() < maxSize) {
            heap.add(entry);
        } else if (!heap.isEmpty() && EVICTION_ORDER.compare(entry, heap.peek()) > 0) {
            heap.poll();
            heap.add(entry);
        }
        return heap.size();
    }

    /**
     * Items currently retained, in heap order. Stable between calls when nothing was offered.
     */
    public List<T> items() {
        List<T> items = new ArrayList<>(heap.size());
        for (Entry<T> entry : heap) {
            items.add(entry.item());
        }
        return items;
    }

    public int size() {
        return heap.size();
    }

    public int maxSize() {
        return maxSize;
    }

    private record Entry<T>(double priority, long sequence, T item) {
    }
}
