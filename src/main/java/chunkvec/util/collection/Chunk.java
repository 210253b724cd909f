// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package chunkvec.util.collection;

import java.util.Arrays;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A fixed-capacity slot array holding a contiguous run of a {@link ChunkedVector}'s elements.
 * <p>
 * The slot array is allocated once, at its final length, and never reallocated. Only the first {@link #count}
 * slots hold live elements; the rest are always {@code null}.
 */
final class Chunk<T> {
    Chunk(final int capacity) {
        assert capacity > 0;
        slots = new Object[capacity];
    }

    int count() {
        return count;
    }

    boolean isFull() {
        return count == slots.length;
    }

    void push(final T value) {
        assert count < slots.length : "push into a full chunk";
        slots[count] = value;
        count += 1;
    }

    T pop() {
        assert count > 0 : "pop from an empty chunk";
        count -= 1;
        final var value = elementAt(count);
        slots[count] = null;
        return value;
    }

    T get(final int offset) {
        assert offset < count;
        return elementAt(offset);
    }

    T set(final int offset, final T value) {
        assert offset < count;
        final var previous = elementAt(offset);
        slots[offset] = value;
        return previous;
    }

    void clear() {
        Arrays.fill(slots, 0, count, null);
        count = 0;
    }

    Chunk<T> copy() {
        final var chunk = new Chunk<T>(slots.length);
        System.arraycopy(slots, 0, chunk.slots, 0, count);
        chunk.count = count;
        return chunk;
    }

    @SuppressWarnings("unchecked")
    private T elementAt(final int offset) {
        return (T) slots[offset];
    }

    private int count = 0;
    private final @Nullable Object[] slots;
}
