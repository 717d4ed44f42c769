package io.sortview.sort;

import java.time.Duration;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Stepping TimSort over {@code array[0, to)}.
 * <p>
 * A unit of work is either the discovery of one natural run (extended to {@code minRun}
 * by binary insertion) or one merge of two adjacent runs. The run stack is stored as run
 * end offsets, {@code runEnds[0] == 0}. With a merge cap, a merge that would move more
 * entries than allowed is stopped after producing {@code maxMergeSize} entries; the merged
 * prefix and the two unmerged remainders are left on the stack as three separate runs, so
 * every yield point leaves a valid run stack behind.
 */
final class TimSortSession<E> implements SortSession {

    static final int MINRUN = 32;
    static final int THRESHOLD = 64;
    private static final int INITIAL_STACK_SIZE = 1 + 49;

    private final E[] a;
    private final int to;
    private final Comparator<? super E> comparator;
    private final int minRun;

    private int[] runEnds;
    private int stackSize;
    private Object[] tmp = new Object[0];
    private int maxMergeSize;

    TimSortSession(E[] a, int to, Comparator<? super E> comparator, RunState runs) {
        this.a = a;
        this.to = to;
        this.comparator = comparator;
        this.minRun = to <= THRESHOLD ? to : minRun(to);
        this.runEnds = new int[Math.max(INITIAL_STACK_SIZE, runs.runCount() + 2)];
        for (int i = 0; i < runs.runCount(); i++) {
            pushRunLen(runs.runLength(i));
        }
    }

    static int minRun(int length) {
        int n = length;
        int r = 0;
        while (n >= THRESHOLD) {
            r |= n & 1;
            n >>>= 1;
        }
        return n + r;
    }

    @Override
    public StepResult step(Duration budget) {
        long deadline = System.nanoTime() + budget.toNanos();
        TouchedRange touched = TouchedRange.empty();
        while (hasMoreWork()) {
            touched = touched.union(advance());
            if (System.nanoTime() - deadline >= 0) {
                break;
            }
        }
        return new StepResult(hasMoreWork(), touched);
    }

    @Override
    public TouchedRange finish() {
        TouchedRange touched = TouchedRange.empty();
        while (hasMoreWork()) {
            touched = touched.union(advance());
        }
        return touched;
    }

    @Override
    public boolean hasMoreWork() {
        return stackSize > 1 || runEnds[stackSize] < to;
    }

    @Override
    public RunState saveRuns() {
        int[] lengths = new int[stackSize];
        for (int i = 0; i < stackSize; i++) {
            lengths[i] = runEnds[i + 1] - runEnds[i];
        }
        return RunState.of(lengths);
    }

    @Override
    public void setMaxMergeSize(int maxMergeSize) {
        if (maxMergeSize < 0) {
            throw new IllegalArgumentException("maxMergeSize must not be negative: " + maxMergeSize);
        }
        this.maxMergeSize = maxMergeSize;
    }

    /**
     * Perform one unit of work.
     */
    TouchedRange advance() {
        if (stackSize > 1) {
            int n = collapseCandidate();
            if (n >= 0) {
                return mergeAt(n);
            }
        }
        if (runEnd(0) < to) {
            return pushNextRun();
        }
        if (stackSize > 1) {
            return mergeAt(0);
        }
        return TouchedRange.empty();
    }

    private int collapseCandidate() {
        int runLen0 = runLen(0);
        int runLen1 = runLen(1);
        if (stackSize > 2) {
            int runLen2 = runLen(2);
            if (runLen2 <= runLen1 + runLen0) {
                // merge the smaller of 0 and 2 with 1
                return runLen2 < runLen0 ? 1 : 0;
            }
        }
        return runLen1 <= runLen0 ? 0 : -1;
    }

    private int runLen(int i) {
        int off = stackSize - i;
        return runEnds[off] - runEnds[off - 1];
    }

    private int runBase(int i) {
        return runEnds[stackSize - i - 1];
    }

    private int runEnd(int i) {
        return runEnds[stackSize - i];
    }

    private void pushRunLen(int len) {
        ensureStackCapacity(stackSize + 2);
        runEnds[stackSize + 1] = runEnds[stackSize] + len;
        ++stackSize;
    }

    private void ensureStackCapacity(int capacity) {
        if (runEnds.length < capacity) {
            runEnds = Arrays.copyOf(runEnds, Math.max(capacity, runEnds.length * 2));
        }
    }

    private TouchedRange pushNextRun() {
        int runBase = runEnd(0);
        TouchedRange touched = TouchedRange.empty();
        int runHi;
        if (runBase == to - 1) {
            runHi = to;
        } else {
            int o = runBase + 2;
            if (compare(runBase, runBase + 1) > 0) {
                // run must be strictly descending
                while (o < to && compare(o - 1, o) > 0) {
                    ++o;
                }
                reverse(runBase, o);
                touched = TouchedRange.between(runBase, o);
            } else {
                // run must be non-descending
                while (o < to && compare(o - 1, o) <= 0) {
                    ++o;
                }
            }
            runHi = Math.max(o, Math.min(to, runBase + minRun));
            touched = touched.union(binarySort(runBase, runHi, o));
        }
        pushRunLen(runHi - runBase);
        return touched;
    }

    private TouchedRange binarySort(int lo, int hi, int i) {
        TouchedRange touched = TouchedRange.empty();
        for (; i < hi; ++i) {
            E pivot = a[i];
            int l = upper(lo, i, pivot);
            if (l < i) {
                System.arraycopy(a, l, a, l + 1, i - l);
                a[l] = pivot;
                touched = touched.union(l, i + 1);
            }
        }
        return touched;
    }

    private void reverse(int from, int to) {
        for (--to; from < to; ++from, --to) {
            E swap = a[from];
            a[from] = a[to];
            a[to] = swap;
        }
    }

    /**
     * Merge run {@code n + 1} with run {@code n}.
     */
    private TouchedRange mergeAt(int n) {
        int boundary = stackSize - n - 1;
        int lo = runEnds[boundary - 1];
        int mid = runEnds[boundary];
        int hi = runEnds[boundary + 1];

        if (compare(mid - 1, mid) <= 0) {
            removeBoundary(boundary);
            return TouchedRange.empty();
        }
        lo = upper(lo, mid, a[mid]);
        hi = lower(mid, hi, a[mid - 1]);

        if (maxMergeSize > 0 && hi - lo > maxMergeSize) {
            Progress progress = mergeLo(lo, mid, hi, maxMergeSize);
            if (progress.dest() < progress.pendingStart() && progress.pendingStart() < hi) {
                splitBoundary(boundary, progress.dest(), progress.pendingStart());
                return TouchedRange.between(lo, progress.pendingStart());
            }
        } else if (hi - mid <= mid - lo) {
            mergeHi(lo, mid, hi);
        } else {
            mergeLo(lo, mid, hi, hi - lo);
        }
        removeBoundary(boundary);
        return TouchedRange.between(lo, hi);
    }

    private void removeBoundary(int boundary) {
        System.arraycopy(runEnds, boundary + 1, runEnds, boundary, stackSize - boundary);
        --stackSize;
    }

    private void splitBoundary(int boundary, int first, int second) {
        ensureStackCapacity(stackSize + 2);
        System.arraycopy(runEnds, boundary + 1, runEnds, boundary + 2, stackSize - boundary);
        runEnds[boundary] = first;
        runEnds[boundary + 1] = second;
        ++stackSize;
    }

    /**
     * Merge forwards, producing at most {@code limit} entries. Entries of the left run that
     * were not consumed are copied back into the gap before the unconsumed right run.
     */
    private Progress mergeLo(int lo, int mid, int hi, int limit) {
        int len1 = mid - lo;
        ensureTmpCapacity(len1);
        System.arraycopy(a, lo, tmp, 0, len1);
        int stop = lo + Math.min(limit, hi - lo);
        int i = 0;
        int j = mid;
        int dest = lo;
        while (i < len1 && j < hi && dest < stop) {
            if (comparator.compare(a[j], saved(i)) < 0) {
                a[dest++] = a[j++];
            } else {
                a[dest++] = saved(i++);
            }
        }
        System.arraycopy(tmp, i, a, dest, len1 - i);
        Arrays.fill(tmp, 0, len1, null);
        return new Progress(dest, j);
    }

    private void mergeHi(int lo, int mid, int hi) {
        int len2 = hi - mid;
        ensureTmpCapacity(len2);
        System.arraycopy(a, mid, tmp, 0, len2);
        int i = mid - 1;
        int j = len2 - 1;
        int dest = hi - 1;
        while (i >= lo && j >= 0) {
            if (comparator.compare(saved(j), a[i]) < 0) {
                a[dest--] = a[i--];
            } else {
                a[dest--] = saved(j--);
            }
        }
        System.arraycopy(tmp, 0, a, lo, j + 1);
        Arrays.fill(tmp, 0, len2, null);
    }

    // first index in [from, to) whose entry is greater than val
    private int upper(int from, int to, E val) {
        int len = to - from;
        while (len > 0) {
            int half = len >>> 1;
            int mid = from + half;
            if (comparator.compare(val, a[mid]) < 0) {
                len = half;
            } else {
                from = mid + 1;
                len = len - half - 1;
            }
        }
        return from;
    }

    // first index in [from, to) whose entry is not less than val
    private int lower(int from, int to, E val) {
        int len = to - from;
        while (len > 0) {
            int half = len >>> 1;
            int mid = from + half;
            if (comparator.compare(a[mid], val) < 0) {
                from = mid + 1;
                len = len - half - 1;
            } else {
                len = half;
            }
        }
        return from;
    }

    private int compare(int i, int j) {
        return comparator.compare(a[i], a[j]);
    }

    @SuppressWarnings("unchecked")
    private E saved(int i) {
        return (E) tmp[i];
    }

    private void ensureTmpCapacity(int capacity) {
        if (tmp.length < capacity) {
            tmp = new Object[Math.max(capacity, tmp.length + (tmp.length >>> 1))];
        }
    }

    /**
     * Merge position after an interrupted merge: {@code [.., dest)} is merged,
     * {@code [dest, pendingStart)} holds the unconsumed left entries and
     * {@code [pendingStart, ..)} the unconsumed right entries.
     */
    private record Progress(int dest, int pendingStart) {
    }
}
