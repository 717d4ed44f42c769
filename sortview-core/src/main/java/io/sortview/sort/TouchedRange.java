package io.sortview.sort;

/**
 * Contiguous index range {@code [start, start + length)} whose contents a sort operation may
 * have moved.
 */
public record TouchedRange(int start, int length) {
    private static final TouchedRange EMPTY = new TouchedRange(0, 0);

    public TouchedRange {
        if (start < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid range: start=" + start + ", length=" + length);
        }
    }

    public static TouchedRange empty() {
        return EMPTY;
    }

    public static TouchedRange between(int start, int end) {
        if (end <= start) {
            return EMPTY;
        }
        return new TouchedRange(start, end - start);
    }

    public int end() {
        return start + length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /**
     * Smallest range covering both ranges. Empty ranges do not contribute.
     */
    public TouchedRange union(TouchedRange other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return between(Math.min(start, other.start), Math.max(end(), other.end()));
    }

    public TouchedRange union(int otherStart, int otherEnd) {
        return union(between(otherStart, otherEnd));
    }
}
