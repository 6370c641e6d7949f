package dumb.polar.kb;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonically increasing ID source. Wraps back to 1 after {@link #MAX_ID}, so every
 * value is exactly representable as an IEEE-754 double.
 *
 * <p>{@link #share()} returns another handle over the same sequence; no two handles
 * ever observe the same value between wraparounds.</p>
 */
public final class Counter {
    public static final long MAX_ID = 1L << 52;

    private final AtomicLong next;

    public Counter() {
        this(1);
    }

    Counter(long start) {
        this(new AtomicLong(checkStart(start)));
    }

    private Counter(AtomicLong next) {
        this.next = next;
    }

    private static long checkStart(long start) {
        if (start < 1 || start > MAX_ID)
            throw new IllegalArgumentException("Counter start out of range [1, 2^52]: " + start);
        return start;
    }

    public long next() {
        return next.getAndUpdate(n -> n >= MAX_ID ? 1 : n + 1);
    }

    public Counter share() {
        return new Counter(next);
    }
}
