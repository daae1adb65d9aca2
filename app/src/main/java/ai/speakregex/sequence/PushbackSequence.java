package ai.speakregex.sequence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forward-only sequence that can take values back.
 *
 * <p>Values handed back with {@link #send(Object[])} or {@link #rewind()} sit in a pending buffer and are returned
 * before anything new is pulled from the wrapped source. Query operations such as {@link #atLeast(int)} or
 * {@link #index(int)} pull ahead into the same buffer, so they never lose values: whatever a query has seen is still
 * returned, in order, by later pulls.
 *
 * <p>The sequence is single-threaded and rejects {@code null} values.
 *
 * @param <T> element type
 */
public final class PushbackSequence<T> implements Iterator<T>, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PushbackSequence.class);

    private final LinkedList<T> pending = new LinkedList<>();
    private Iterator<? extends T> source;
    private T lastPulled;
    private boolean rewindable;
    private boolean closed;

    private PushbackSequence(Iterator<? extends T> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public static <T> PushbackSequence<T> over(Iterator<? extends T> source) {
        return new PushbackSequence<>(source);
    }

    public static <T> PushbackSequence<T> of(Iterable<? extends T> source) {
        return new PushbackSequence<>(Objects.requireNonNull(source, "source").iterator());
    }

    @SafeVarargs
    public static <T> PushbackSequence<T> of(T... values) {
        return of(Arrays.asList(values));
    }

    public static <T> PushbackSequence<T> empty() {
        return new PushbackSequence<>(Collections.emptyIterator());
    }

    /**
     * Returns the next value, taking pushed-back values first.
     *
     * @throws SequenceExhaustedException when neither the buffer nor the source has another value
     */
    public T pull() {
        ensureOpen();
        if (!fill(1)) {
            rewindable = false;
            throw new SequenceExhaustedException();
        }
        T value = pending.removeFirst();
        lastPulled = value;
        rewindable = true;
        return value;
    }

    /**
     * Places values on top of the sequence so that the next pulls return them in argument order.
     */
    @SafeVarargs
    public final void send(T... values) {
        ensureOpen();
        Objects.requireNonNull(values, "values");
        for (int i = values.length - 1; i >= 0; i--) {
            pending.addFirst(Objects.requireNonNull(values[i], "pushed value"));
        }
        if (values.length > 0) {
            rewindable = false;
        }
    }

    /**
     * Undoes the most recent pull. Only valid once, directly after a successful pull.
     *
     * @throws NoPreviousValueException when there is no pull to undo
     */
    public void rewind() {
        ensureOpen();
        if (!rewindable) {
            throw new NoPreviousValueException();
        }
        pending.addFirst(lastPulled);
        rewindable = false;
        lastPulled = null;
    }

    /**
     * Returns the next value without consuming it.
     */
    public T peek() {
        return index(0);
    }

    public boolean atLeast(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be zero or greater");
        }
        ensureOpen();
        return fill(count);
    }

    /**
     * Counts every remaining value. The source is drained into the buffer, so later pulls still see all of them.
     */
    public int length() {
        ensureOpen();
        drain();
        return pending.size();
    }

    /**
     * Returns the remaining value at the given position; negative positions count from the end.
     *
     * @throws IndexOutOfBoundsException when fewer values are obtainable
     */
    public T index(int position) {
        ensureOpen();
        if (position < 0) {
            drain();
            int resolved = pending.size() + position;
            if (resolved < 0) {
                throw new IndexOutOfBoundsException("Index " + position + " out of range for " + pending.size() + " remaining values");
            }
            return pending.get(resolved);
        }
        if (!fill(position + 1)) {
            throw new IndexOutOfBoundsException("Index " + position + " out of range for " + pending.size() + " remaining values");
        }
        return pending.get(position);
    }

    /**
     * Copies the remaining values in {@code [from, to)} without consuming them. Negative bounds count from the end and
     * force a full drain; bounds beyond the end are clamped, as for list slicing.
     */
    public List<T> slice(int from, int to) {
        ensureOpen();
        if (from < 0 || to < 0) {
            drain();
        } else {
            fill(to);
        }
        int size = pending.size();
        int start = clamp(from < 0 ? size + from : from, size);
        int end = clamp(to < 0 ? size + to : to, size);
        if (end <= start) {
            return List.of();
        }
        return List.copyOf(pending.subList(start, end));
    }

    public boolean contains(Object value) {
        ensureOpen();
        if (pending.contains(value)) {
            return true;
        }
        while (source.hasNext()) {
            T next = Objects.requireNonNull(source.next(), "source produced a null value");
            pending.addLast(next);
            if (next.equals(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the leading values that satisfy {@code predicate}. The first value that fails it stays at the head of
     * this sequence instead of being dropped, as does any value the caller never asked for. Each call to {@link Iterable#iterator()} resumes from the current
     * position of this sequence.
     */
    public Iterable<T> takeWhile(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return () -> new BoundedIterator(predicate);
    }

    /**
     * Returns the values up to, but excluding, the first one that satisfies {@code predicate}, which stays on this
     * sequence.
     */
    public Iterable<T> takeUntil(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return takeWhile(predicate.negate());
    }

    /**
     * Pulls every remaining value into a list, emptying the sequence.
     */
    public List<T> drainToList() {
        List<T> values = new ArrayList<>();
        while (hasNext()) {
            values.add(pull());
        }
        return values;
    }

    @Override
    public boolean hasNext() {
        return atLeast(1);
    }

    @Override
    public T next() {
        return pull();
    }

    /**
     * Releases the buffer and the source. The sequence cannot be used afterwards.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pending.clear();
        lastPulled = null;
        rewindable = false;
        Iterator<? extends T> released = source;
        source = Collections.emptyIterator();
        if (released instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception ex) {
                LOGGER.warn("Failed to close sequence source: {}", ex.getMessage(), ex);
            }
        }
    }

    private boolean fill(int count) {
        while (pending.size() < count && source.hasNext()) {
            pending.addLast(Objects.requireNonNull(source.next(), "source produced a null value"));
        }
        return pending.size() >= count;
    }

    private void drain() {
        while (source.hasNext()) {
            pending.addLast(Objects.requireNonNull(source.next(), "source produced a null value"));
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("sequence has been closed");
        }
    }

    private static int clamp(int value, int size) {
        return Math.max(0, Math.min(value, size));
    }

    /**
     * Tests candidates in place at the head of the buffer, so a value is only removed by {@link #next()}. Stopping
     * early, or reaching the first rejected value, leaves everything not yet returned on the parent sequence.
     */
    private final class BoundedIterator implements Iterator<T> {

        private final Predicate<? super T> predicate;
        private boolean finished;

        private BoundedIterator(Predicate<? super T> predicate) {
            this.predicate = predicate;
        }

        @Override
        public boolean hasNext() {
            if (finished) {
                return false;
            }
            if (!PushbackSequence.this.hasNext() || !predicate.test(peek())) {
                finished = true;
                return false;
            }
            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pull();
        }
    }
}
