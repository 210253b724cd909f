// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package chunkvec.util.collection;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A growable, indexable sequence that allocates its storage in fixed-size chunks instead of a single contiguous
 * array.
 * <p>
 * Growing never copies or moves elements that are already stored: when every allocated slot is occupied, one new
 * chunk of exactly {@link #chunkSize()} slots is allocated and appended. The element at logical index {@code i}
 * always lives in chunk {@code i / chunkSize()} at offset {@code i % chunkSize()}. Chunks are never freed or
 * shrunk, so {@link #capacity()} never decreases, not even across {@link #clear()}.
 * <p>
 * Elements can only be added and removed at the end. {@code null} elements are not permitted, which lets the
 * defensive accessors {@link #tryGet(int)}, {@link #trySet(int, Object)} and {@link #pop()} report absence with
 * {@code null}.
 * <p>
 * There are two tiers of element access. The defensive accessors never throw on an out-of-range index. The
 * trusted accessors {@link #get(int)}, {@link #set(int, Object)} and {@link #swap(int, int)} are meant for call
 * sites that have already validated their indices, and treat a bad index as a programming error by throwing
 * {@link IndexOutOfBoundsException}.
 * <p>
 * Instances are not thread-safe. At any point a vector may be used either by any number of readers, or by exactly
 * one writer. Iterators are fail-fast on a best-effort basis: modifying the vector other than through the
 * iterator's own {@link MutableItr#set(Object) set} makes the iterator throw {@link ConcurrentModificationException}.
 * <p>
 * Complexity: {@link #push(Object)} and {@link #pop()} run in amortized constant time, with chunk allocation
 * happening once every {@code chunkSize} pushes. Indexed access and {@link #swap(int, int)} run in constant time.
 *
 * @param <T> the type of elements in this vector
 */
public final class ChunkedVector<T> implements Iterable<T> {
    private ChunkedVector(final int chunkSize, final ArrayList<Chunk<T>> chunks, final int size) {
        this.chunkSize = chunkSize;
        this.chunks = chunks;
        this.size = size;
    }

    /**
     * Returns a new, empty vector that allocates its storage in chunks of {@code chunkSize} elements.
     * <p>
     * No chunk is allocated until the first element is pushed.
     *
     * @throws IllegalArgumentException if {@code chunkSize} is not positive
     */
    public static <T> @NotNull ChunkedVector<T> withChunkSize(final int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
        }
        return new ChunkedVector<>(chunkSize, new ArrayList<>(), 0);
    }

    /**
     * Returns a new vector with the given chunk size, containing the elements of the given iterable in iteration
     * order.
     * <p>
     * Complexity: linear time.
     *
     * @throws IllegalArgumentException if {@code chunkSize} is not positive
     * @throws NullPointerException if the iterable produces a {@code null} element
     */
    public static <T> @NotNull ChunkedVector<T> fromIterable(
        final int chunkSize,
        final @NotNull Iterable<? extends T> iterable
    ) {
        final var vector = ChunkedVector.<T>withChunkSize(chunkSize);
        for (final var element : iterable) {
            vector.push(element);
        }
        return vector;
    }

    /**
     * Returns the number of elements in this vector.
     */
    public int size() {
        return size;
    }

    /**
     * Returns {@code true} iff this vector contains no elements.
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the number of slots in each chunk, as given at construction.
     */
    public int chunkSize() {
        return chunkSize;
    }

    /**
     * Returns the total number of slots allocated so far, occupied or not. This is
     * {@code chunkCount() * chunkSize()}, or {@link Integer#MAX_VALUE} if that product doesn't fit in an {@code int}.
     */
    public int capacity() {
        return saturatedCapacity(chunks.size(), chunkSize);
    }

    /**
     * Returns the number of chunks allocated so far.
     */
    public int chunkCount() {
        return chunks.size();
    }

    /**
     * Returns the element at the given index, or {@code null} if the index is out of range.
     * <p>
     * Complexity: constant time.
     */
    @CheckReturnValue
    public @Nullable T tryGet(final int index) {
        return isInRange(index) ? elementAt(index) : null;
    }

    /**
     * Replaces the element at the given index with the given value and returns the previous element. If the index
     * is out of range, does nothing and returns {@code null}.
     * <p>
     * Complexity: constant time.
     *
     * @throws NullPointerException if the value is {@code null}
     */
    public @Nullable T trySet(final int index, final @NotNull T value) {
        Objects.requireNonNull(value, "ChunkedVector doesn't permit null elements");
        if (!isInRange(index)) {
            return null;
        }
        modCount += 1;
        return chunkOf(index).set(offsetOf(index), value);
    }

    /**
     * Returns the element at the given index.
     * <p>
     * Complexity: constant time.
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    @CheckReturnValue
    public T get(final int index) {
        return elementAt(Objects.checkIndex(index, size));
    }

    /**
     * Replaces the element at the given index with the given value and returns the previous element.
     * <p>
     * Complexity: constant time.
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     * @throws NullPointerException if the value is {@code null}
     */
    public T set(final int index, final @NotNull T value) {
        Objects.requireNonNull(value, "ChunkedVector doesn't permit null elements");
        Objects.checkIndex(index, size);
        modCount += 1;
        return chunkOf(index).set(offsetOf(index), value);
    }

    /**
     * Appends the given element to the end of this vector.
     * <p>
     * If every allocated slot is occupied, a new chunk of {@link #chunkSize()} slots is allocated first. Elements
     * that are already stored are never moved.
     * <p>
     * Complexity: amortized constant time.
     *
     * @throws NullPointerException if the element is {@code null}
     * @throws OutOfMemoryError if this vector already holds {@link Integer#MAX_VALUE} elements
     */
    public void push(final @NotNull T element) {
        Objects.requireNonNull(element, "ChunkedVector doesn't permit null elements");
        checkRoomForOneMore(size);
        if (size == capacity()) {
            chunks.add(new Chunk<>(chunkSize));
        }
        final var chunk = chunks.get(size / chunkSize);
        assert !chunk.isFull();
        chunk.push(element);
        size += 1;
        modCount += 1;
    }

    /**
     * Removes and returns the last element of this vector, or returns {@code null} if it's empty.
     * <p>
     * The chunk the element was stored in stays allocated: popping never changes {@link #capacity()}.
     * <p>
     * Complexity: constant time.
     */
    public @Nullable T pop() {
        if (size == 0) {
            return null;
        }
        size -= 1;
        modCount += 1;
        return chunks.get(size / chunkSize).pop();
    }

    /**
     * Removes all elements from this vector, keeping every allocated chunk for reuse.
     * <p>
     * Complexity: linear in the number of removed elements.
     */
    public void clear() {
        for (final var chunk : chunks) {
            chunk.clear();
        }
        size = 0;
        modCount += 1;
    }

    /**
     * Exchanges the elements at the given indices. No other element is moved and no chunk is reallocated. Swapping
     * an index with itself has no effect.
     * <p>
     * Complexity: constant time.
     *
     * @throws IndexOutOfBoundsException if either index is out of range
     */
    public void swap(final int a, final int b) {
        Objects.checkIndex(a, size);
        Objects.checkIndex(b, size);
        if (a == b) {
            return;
        }
        final var chunkA = chunkOf(a);
        final var offsetA = offsetOf(a);
        final var saved = chunkA.get(offsetA);
        chunkA.set(offsetA, chunkOf(b).set(offsetOf(b), saved));
        modCount += 1;
    }

    /**
     * Returns a new vector with the same chunk size, the same elements in the same order, and the same number of
     * allocated chunks. Later changes to either vector are not visible in the other.
     * <p>
     * Complexity: linear in the capacity.
     */
    @CheckReturnValue
    public @NotNull ChunkedVector<T> copy() {
        final var copiedChunks = new ArrayList<Chunk<T>>(chunks.size());
        for (final var chunk : chunks) {
            copiedChunks.add(chunk.copy());
        }
        return new ChunkedVector<>(chunkSize, copiedChunks, size);
    }

    /**
     * Returns a new iterator over the elements of this vector, from the first element to the last.
     * <p>
     * Complexity: constant time.
     */
    @Override
    public @NotNull Itr<T> iterator() {
        return new Itr<>(this);
    }

    /**
     * Returns a new iterator over the elements of this vector, from the first element to the last, that can replace
     * each element it returned.
     * <p>
     * While the iterator is in use, the vector must not be accessed other than through the iterator.
     * <p>
     * Complexity: constant time.
     */
    public @NotNull MutableItr<T> mutableIterator() {
        return new MutableItr<>(this);
    }

    /**
     * Performs the given action on each element of this vector, in order.
     * <p>
     * Exceptions thrown by the action are passed to the caller.
     *
     * @throws ConcurrentModificationException if the action modifies this vector
     */
    @Override
    public void forEach(final @NotNull Consumer<? super T> action) {
        Objects.requireNonNull(action);
        final var expectedModCount = modCount;
        final var chunkCount = chunks.size();
        for (int c = 0; c < chunkCount; c += 1) {
            final var chunk = chunks.get(c);
            final var count = chunk.count();
            for (int i = 0; i < count; i += 1) {
                action.accept(chunk.get(i));
                checkForComodification(expectedModCount);
            }
            if (count < chunkSize) {
                break;
            }
        }
    }

    /**
     * Replaces each element of this vector with the result of applying the given operator to it, in order.
     * <p>
     * Exceptions thrown by the operator are passed to the caller; elements already replaced stay replaced.
     *
     * @throws NullPointerException if the operator returns {@code null}
     * @throws ConcurrentModificationException if the operator modifies this vector
     */
    public void replaceAll(final @NotNull UnaryOperator<T> operator) {
        Objects.requireNonNull(operator);
        modCount += 1;
        final var expectedModCount = modCount;
        final var chunkCount = chunks.size();
        for (int c = 0; c < chunkCount; c += 1) {
            final var chunk = chunks.get(c);
            final var count = chunk.count();
            for (int i = 0; i < count; i += 1) {
                final var replacement = operator.apply(chunk.get(i));
                checkForComodification(expectedModCount);
                chunk.set(i, Objects.requireNonNull(replacement, "ChunkedVector doesn't permit null elements"));
            }
            if (count < chunkSize) {
                break;
            }
        }
    }

    /**
     * Returns a new spliterator over the elements of this vector.
     * <p>
     * The returned spliterator reports {@link Spliterator#SIZED}, {@link Spliterator#SUBSIZED},
     * {@link Spliterator#ORDERED} and {@link Spliterator#NONNULL}.
     */
    @Override
    public @NotNull Spliterator<T> spliterator() {
        return Spliterators.spliterator(iterator(), size, Spliterator.ORDERED | Spliterator.NONNULL);
    }

    /**
     * Returns {@code true} iff the given object is a {@code ChunkedVector} with the same chunk size, containing
     * equal elements in the same order. Capacity is not compared.
     * <p>
     * Complexity: constant time if the sizes or chunk sizes differ, linear time otherwise.
     */
    @Override
    public boolean equals(final @Nullable Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof ChunkedVector<?> other)) {
            return false;
        }
        if (chunkSize != other.chunkSize || size != other.size) {
            return false;
        }
        for (int i = 0; i < size; i += 1) {
            if (!elementAt(i).equals(other.elementAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the hash code of this vector, derived from its chunk size and its elements in order, consistent with
     * {@link #equals(Object)}.
     */
    @Override
    public int hashCode() {
        int hash = chunkSize;
        for (final var chunk : chunks) {
            final var count = chunk.count();
            for (int i = 0; i < count; i += 1) {
                hash = 31 * hash + chunk.get(i).hashCode();
            }
        }
        return hash;
    }

    /**
     * Returns a string representation of this vector: the string representations of its elements in order,
     * separated by {@code ", "} and enclosed in square brackets.
     */
    @Override
    public @NotNull String toString() {
        if (size == 0) {
            return "[]";
        }

        final var builder = new StringBuilder();
        builder.append('[');
        forEach(element -> builder.append(element).append(", "));
        // Need to remove the final comma and space.
        builder.setLength(builder.length() - 2);
        builder.append(']');
        return builder.toString();
    }

    static int saturatedCapacity(final int chunkCount, final int chunkSize) {
        return (int) Long.min((long) chunkCount * chunkSize, Integer.MAX_VALUE);
    }

    static void checkRoomForOneMore(final int size) {
        if (size == Integer.MAX_VALUE) {
            throw new OutOfMemoryError("ChunkedVector can't hold more than " + Integer.MAX_VALUE + " elements");
        }
    }

    private void checkForComodification(final int expectedModCount) {
        if (modCount != expectedModCount) {
            throw new ConcurrentModificationException();
        }
    }

    private boolean isInRange(final int index) {
        return index >= 0 && index < size;
    }

    private T elementAt(final int index) {
        return chunkOf(index).get(offsetOf(index));
    }

    private Chunk<T> chunkOf(final int index) {
        return chunks.get(index / chunkSize);
    }

    private int offsetOf(final int index) {
        return index % chunkSize;
    }

    private final int chunkSize;
    private final ArrayList<Chunk<T>> chunks;
    private int size;
    // Bumped on every modification made other than through an iterator, checked by iterators.
    private int modCount = 0;

    /**
     * A forward iterator over the elements of a {@link ChunkedVector}.
     * <p>
     * The iterator walks the vector chunk by chunk, keeping a cursor into the current chunk and one into the list
     * of chunks, so chunk boundaries are never visible to the caller.
     */
    public static sealed class Itr<T> implements Iterator<T> permits MutableItr {
        private Itr(final ChunkedVector<T> owner) {
            this.owner = owner;
            expectedModCount = owner.modCount;
        }

        /**
         * Returns {@code true} iff there are more elements to return.
         *
         * @throws ConcurrentModificationException if the vector was modified since this iterator was created
         */
        @Override
        public final boolean hasNext() {
            checkForComodification();
            return advanceIfExhausted();
        }

        /**
         * Returns the next element.
         *
         * @throws NoSuchElementException if there are no more elements
         * @throws ConcurrentModificationException if the vector was modified since this iterator was created
         */
        @Override
        @SuppressFBWarnings(value = "IT_NO_SUCH_ELEMENT", justification = "advanceIfExhausted() guards it")
        public final T next() {
            checkForComodification();
            if (!advanceIfExhausted()) {
                throw new NoSuchElementException("No more elements in the vector");
            }
            final var chunk = current;
            assert chunk != null;
            lastReturnedChunk = chunk;
            lastReturnedOffset = offset;
            offset += 1;
            nextIndex += 1;
            return chunk.get(lastReturnedOffset);
        }

        /**
         * Returns the logical index of the element that would be returned by the next call to {@link #next()}.
         */
        public final int nextIndex() {
            return nextIndex;
        }

        /**
         * Performs the given action on each remaining element, in order.
         *
         * @throws ConcurrentModificationException if the vector was modified since this iterator was created
         */
        @Override
        public final void forEachRemaining(final @NotNull Consumer<? super T> action) {
            Objects.requireNonNull(action);
            while (hasNext()) {
                action.accept(next());
            }
        }

        final Chunk<T> lastReturnedChunk() {
            checkForComodification();
            final var chunk = lastReturnedChunk;
            if (chunk == null) {
                throw new IllegalStateException("next() has not been called yet");
            }
            return chunk;
        }

        final int lastReturnedOffset() {
            return lastReturnedOffset;
        }

        private boolean advanceIfExhausted() {
            final var chunk = current;
            if (chunk != null && offset < chunk.count()) {
                return true;
            }
            // A chunk that isn't full is the last one with any elements, so trying one more chunk is enough.
            if (nextChunk < owner.chunks.size()) {
                final var following = owner.chunks.get(nextChunk);
                current = following;
                nextChunk += 1;
                offset = 0;
                return following.count() > 0;
            }
            return false;
        }

        private void checkForComodification() {
            if (owner.modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }

        private final ChunkedVector<T> owner;
        private final int expectedModCount;
        private @Nullable Chunk<T> current = null;
        private int offset = 0;
        private int nextChunk = 0;
        private int nextIndex = 0;
        private @Nullable Chunk<T> lastReturnedChunk = null;
        private int lastReturnedOffset = -1;
    }

    /**
     * A forward iterator over the elements of a {@link ChunkedVector} that can replace the elements it returns.
     */
    public static final class MutableItr<T> extends Itr<T> {
        private MutableItr(final ChunkedVector<T> owner) {
            super(owner);
        }

        /**
         * Replaces the element last returned by {@link #next()} with the given value.
         * <p>
         * This doesn't invalidate this iterator.
         *
         * @throws IllegalStateException if {@link #next()} has not been called yet
         * @throws NullPointerException if the value is {@code null}
         * @throws ConcurrentModificationException if the vector was modified other than through this iterator
         */
        public void set(final @NotNull T value) {
            Objects.requireNonNull(value, "ChunkedVector doesn't permit null elements");
            lastReturnedChunk().set(lastReturnedOffset(), value);
        }
    }
}
