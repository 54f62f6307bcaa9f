package io.checkpoint;

/**
 * Position in the global event order.
 *
 * <p>{@code 0} is the initialization sentinel: a checkpoint or subscription at
 * position zero has not processed any event yet.
 *
 * @param value non-negative position
 */
public record SequenceNumber(long value) implements Comparable<SequenceNumber> {

    /**
     * The initialization sentinel.
     */
    public static final SequenceNumber ZERO = new SequenceNumber(0);

    public SequenceNumber {
        if (value < 0) {
            throw new IllegalArgumentException("Sequence number must not be negative: " + value);
        }
    }

    /**
     * Creates a sequence number.
     *
     * @param value the position
     * @return the sequence number
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static SequenceNumber of(long value) {
        return value == 0 ? ZERO : new SequenceNumber(value);
    }

    public boolean isZero() {
        return value == 0;
    }

    public SequenceNumber next() {
        return new SequenceNumber(value + 1);
    }

    public boolean isBefore(SequenceNumber other) {
        return value < other.value;
    }

    @Override
    public int compareTo(SequenceNumber other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
