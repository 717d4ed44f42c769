package io.sortview.runtime;

import io.sortview.core.SortViewConfiguration;
import io.sortview.core.SortViewException;
import io.sortview.kernel.AbstractObservableSequence;
import io.sortview.kernel.ObservableSequence;
import io.sortview.kernel.SequenceListener;
import io.sortview.kernel.Sorter;
import io.sortview.kernel.SorterChange;
import io.sortview.kernel.SorterListener;
import io.sortview.kernel.SorterOrder;
import io.sortview.schedule.ScheduledStep;
import io.sortview.schedule.Scheduler;
import io.sortview.sort.AdaptiveSorter;
import io.sortview.sort.RunState;
import io.sortview.sort.SortSession;
import io.sortview.sort.StepResult;
import io.sortview.sort.TimSorter;
import io.sortview.sort.TouchedRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.Comparator;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Observable sequence presenting the items of a source sequence in the order of a
 * {@link Sorter}.
 * <p>
 * The projection tracks every source item in an array of tracking entries that is sorted
 * in place. Source splices are folded into that array without rebuilding it: removed
 * entries are dropped, surviving entries keep their relative order, and inserted items are
 * appended and sorted into place by the next sort pass. Each mutation or sort step is
 * republished as a single splice notification covering the range that may have changed.
 * <p>
 * In incremental mode sorting is spread over steps registered with the {@link Scheduler},
 * each bounded by {@link SortViewConfiguration#stepBudget()}. Until the sort completes,
 * readers observe a partially sorted but complete sequence. Switching incremental mode off
 * finishes a pending sort synchronously, however long that takes.
 * <p>
 * Without a sorter, or while the sorter reports {@link SorterOrder#NONE}, the projection
 * is a passthrough view of its source and keeps no tracking entries.
 * <p>
 * Instances are confined to the scheduler's thread and are not thread-safe.
 *
 * @param <T> item type
 */
public final class SortedProjection<T> extends AbstractObservableSequence<T> implements AutoCloseable {

    public static final String PROPERTY_SOURCE = "source";
    public static final String PROPERTY_SORTER = "sorter";
    public static final String PROPERTY_INCREMENTAL = "incremental";

    private static final Logger log = LoggerFactory.getLogger(SortedProjection.class);

    private final Scheduler scheduler;
    private final SortViewConfiguration configuration;
    private final AdaptiveSorter sortAlgorithm;
    private final PropertyChangeSupport properties = new PropertyChangeSupport(this);
    private final TrackingArray<T> items = new TrackingArray<>();
    private final SequenceListener sourceListener = this::sourceChanged;
    private final SorterListener sorterListener = this::sorterChanged;
    private final Comparator<TrackedItem<T>> entryComparator = this::compareEntries;

    private ObservableSequence<T> source;
    private Sorter<? super T> sorter;
    private boolean incremental;

    // present iff a cooperative sort is pending, or transiently while finishing synchronously
    private PendingSort pendingSort;

    public SortedProjection(Scheduler scheduler) {
        this(scheduler, SortViewConfiguration.defaults());
    }

    public SortedProjection(Scheduler scheduler, SortViewConfiguration configuration) {
        this(scheduler, configuration, new TimSorter());
    }

    public SortedProjection(Scheduler scheduler, SortViewConfiguration configuration, AdaptiveSorter sortAlgorithm) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.sortAlgorithm = Objects.requireNonNull(sortAlgorithm, "sortAlgorithm");
        this.incremental = configuration.incremental();
    }

    /**
     * Create a projection of {@code source} ordered by {@code sorter}.
     *
     * @param source the sequence to sort, may be null
     * @param sorter the sorter, may be null for source order
     */
    public static <T> SortedProjection<T> create(ObservableSequence<T> source, Sorter<? super T> sorter,
                                                 Scheduler scheduler, SortViewConfiguration configuration) {
        var projection = new SortedProjection<T>(scheduler, configuration);
        projection.setSource(source);
        projection.setSorter(sorter);
        return projection;
    }

    // ------------------------------------------------------------------
    // ObservableSequence
    // ------------------------------------------------------------------

    @Override
    public int size() {
        return source == null ? 0 : source.size();
    }

    @Override
    public T get(int position) {
        if (source == null) {
            return null;
        }
        if (items.isEmpty()) {
            return source.get(position);
        }
        if (position < 0 || position >= items.size()) {
            return null;
        }
        return items.item(position);
    }

    // ------------------------------------------------------------------
    // Properties
    // ------------------------------------------------------------------

    public ObservableSequence<T> source() {
        return source;
    }

    /**
     * Replace the sequence being sorted. Observers receive one notification replacing all
     * previous items with all new ones.
     *
     * @param newSource the new source, or null
     */
    public void setSource(ObservableSequence<T> newSource) {
        if (source == newSource) {
            return;
        }
        ObservableSequence<T> oldSource = source;
        int removed = size();
        clearSource();

        int added = 0;
        if (newSource != null) {
            source = newSource;
            newSource.addListener(sourceListener);
            added = newSource.size();
            createItems();
            if (shouldSort() && !startSorting(null)) {
                finishSorting();
            }
        }

        if (removed > 0 || added > 0) {
            fireItemsChanged(0, removed, added);
        }
        properties.firePropertyChange(PROPERTY_SOURCE, oldSource, newSource);
        scheduleSortStep();
    }

    public Sorter<? super T> sorter() {
        return sorter;
    }

    /**
     * Replace the sorter. A null sorter reverts the projection to source order.
     */
    public void setSorter(Sorter<? super T> newSorter) {
        Sorter<? super T> oldSorter = sorter;
        clearSorter();

        if (newSorter != null) {
            sorter = newSorter;
            newSorter.addListener(sorterListener);
            sorterChanged(SorterChange.DIFFERENT);
        } else {
            boolean wasSorted = items.size() > 1;
            stopSorting(false);
            items.clear();
            int n = size();
            if (wasSorted && n > 1) {
                fireItemsChanged(0, n, n);
            }
        }
        properties.firePropertyChange(PROPERTY_SORTER, oldSorter, newSorter);
    }

    public boolean isIncremental() {
        return incremental;
    }

    /**
     * Enable or disable incremental sorting. Disabling it while a sort is pending finishes
     * that sort before returning.
     */
    public void setIncremental(boolean newIncremental) {
        if (incremental == newIncremental) {
            return;
        }
        incremental = newIncremental;

        if (!newIncremental && isSorting()) {
            TouchedRange touched = finishSorting();
            if (!touched.isEmpty()) {
                fireItemsChanged(touched.start(), touched.length(), touched.length());
            }
        }
        properties.firePropertyChange(PROPERTY_INCREMENTAL, !newIncremental, newIncremental);
    }

    /**
     * Whether an incremental sort is pending.
     */
    public boolean isSorting() {
        return pendingSort != null;
    }

    public SortViewConfiguration configuration() {
        return configuration;
    }

    public void addPropertyChangeListener(PropertyChangeListener listener) {
        properties.addPropertyChangeListener(listener);
    }

    public void addPropertyChangeListener(String propertyName, PropertyChangeListener listener) {
        properties.addPropertyChangeListener(propertyName, listener);
    }

    public void removePropertyChangeListener(PropertyChangeListener listener) {
        properties.removePropertyChangeListener(listener);
    }

    public void removePropertyChangeListener(String propertyName, PropertyChangeListener listener) {
        properties.removePropertyChangeListener(propertyName, listener);
    }

    /**
     * Detach from source and sorter and cancel any pending sort step. Observers are not
     * notified.
     */
    @Override
    public void close() {
        clearSource();
        clearSorter();
    }

    // ------------------------------------------------------------------
    // Sort lifecycle
    // ------------------------------------------------------------------

    private boolean shouldSort() {
        return sorter != null && source != null && sorter.order() != SorterOrder.NONE;
    }

    private int compareEntries(TrackedItem<T> left, TrackedItem<T> right) {
        return sorter.compare(left.item(), right.item());
    }

    private void createItems() {
        if (!shouldSort()) {
            return;
        }
        int n = source.size();
        items.reserve(n);
        for (int i = 0; i < n; i++) {
            items.append(source.get(i), i);
        }
    }

    /**
     * Pause the pending sort.
     *
     * @param captureRuns whether to return the pending runs
     * @return the runs to resume from if requested, a single run covering the tracking
     * array if no sort was pending, otherwise null
     */
    private RunState stopSorting(boolean captureRuns) {
        PendingSort pending = pendingSort;
        if (pending == null) {
            return captureRuns ? RunState.sorted(items.size()) : null;
        }
        pendingSort = null;
        pending.cancel();
        return captureRuns ? pending.session.saveRuns() : null;
    }

    /**
     * Install a new pending sort. In incremental mode the caller must call
     * {@link #scheduleSortStep()} once its observers have been notified.
     *
     * @param runs pending runs to resume from, or null to sort from scratch
     * @return true if the sort was left for cooperative steps, false if the caller must
     * finish it synchronously
     */
    private boolean startSorting(RunState runs) {
        if (pendingSort != null) {
            throw new IllegalStateException("A sort is already pending");
        }
        SortSession session = runs == null
                ? sortAlgorithm.begin(items.array(), items.size(), entryComparator)
                : sortAlgorithm.resume(items.array(), items.size(), entryComparator, runs);
        pendingSort = new PendingSort(session);
        if (!incremental) {
            return false;
        }
        session.setMaxMergeSize(configuration.maxMergeSize());
        if (log.isDebugEnabled()) {
            log.debug("Starting incremental sort of {} items ({})", items.size(),
                    runs == null ? "from scratch" : "resuming " + runs);
        }
        return true;
    }

    /**
     * Register the step of the pending sort with the scheduler, unless it already is.
     * The scheduler may run the step before {@code schedule} returns.
     */
    private void scheduleSortStep() {
        PendingSort pending = pendingSort;
        if (pending == null || pending.scheduled || !incremental) {
            return;
        }
        pending.scheduled = true;
        ScheduledStep handle = scheduler.schedule(pending);
        if (pendingSort == pending) {
            pending.handle = handle;
        } else {
            // finished or replaced while the scheduler ran it
            handle.cancel();
        }
    }

    private TouchedRange finishSorting() {
        PendingSort pending = pendingSort;
        if (pending == null) {
            return TouchedRange.empty();
        }
        pendingSort = null;
        pending.cancel();
        long started = System.nanoTime();
        pending.session.setMaxMergeSize(0);
        TouchedRange touched = pending.session.finish();
        if (log.isDebugEnabled()) {
            log.debug("Sorted {} items synchronously in {} us, touched {}", items.size(),
                    (System.nanoTime() - started) / 1_000, touched);
        }
        return touched;
    }

    private boolean sortStep(PendingSort pending) {
        if (pendingSort != pending) {
            return false;
        }
        StepResult result = pending.session.step(configuration.stepBudget());
        if (!result.moreWork()) {
            pendingSort = null;
            log.debug("Incremental sort of {} items finished", items.size());
        } else {
            log.trace("Sort step touched {}", result.touched());
        }
        TouchedRange touched = result.touched();
        if (!touched.isEmpty()) {
            fireItemsChanged(touched.start(), touched.length(), touched.length());
        }
        // an observer may have mutated the source and replaced this sort
        return result.moreWork() && pendingSort == pending;
    }

    private TouchedRange clearItems() {
        stopSorting(false);
        TouchedRange displaced = items.displacedRange();
        items.clear();
        return displaced;
    }

    // ------------------------------------------------------------------
    // Change handlers
    // ------------------------------------------------------------------

    private void sourceChanged(int position, int removed, int added) {
        if (removed == 0 && added == 0) {
            return;
        }
        if (!shouldSort()) {
            fireItemsChanged(position, removed, added);
            return;
        }

        boolean wasSorting = isSorting();
        RunState runs = stopSorting(true);

        TrackingArray.Reconciliation reconciliation = items.reconcile(position, removed, added);
        runs = runs.withoutIndices(reconciliation.removedIndices());
        int start = reconciliation.unchangedHead();
        int end = reconciliation.unchangedTail();

        if (added > 0) {
            items.reserve(items.size() + added);
            for (int i = position; i < position + added; i++) {
                T item = source.get(i);
                if (item == null) {
                    throw new SortViewException("Source reported an item added at " + i
                            + " but holds only " + source.size() + " items");
                }
                items.append(item, i);
            }
            end = 0;
            if (!startSorting(null)) {
                TouchedRange touched = finishSorting();
                if (!touched.isEmpty()) {
                    start = Math.min(start, touched.start());
                }
            }
        } else if (wasSorting) {
            // only incremental sorts stay pending, so this resumes cooperatively
            startSorting(runs);
        }

        int n = items.size() - start - end;
        fireItemsChanged(start, n - added + removed, n);
        scheduleSortStep();
    }

    private void sorterChanged(SorterChange change) {
        TouchedRange touched;
        if (sorter.order() == SorterOrder.NONE) {
            touched = clearItems();
        } else {
            if (items.isEmpty()) {
                createItems();
            }
            stopSorting(false);
            if (!shouldSort() || startSorting(null)) {
                touched = TouchedRange.empty();
            } else {
                touched = finishSorting();
            }
        }
        log.trace("Sorter changed ({}), touched {}", change, touched);
        if (!touched.isEmpty()) {
            fireItemsChanged(touched.start(), touched.length(), touched.length());
        }
        scheduleSortStep();
    }

    private void clearSource() {
        if (source == null) {
            return;
        }
        source.removeListener(sourceListener);
        source = null;
        stopSorting(false);
        items.clear();
    }

    private void clearSorter() {
        if (sorter == null) {
            return;
        }
        sorter.removeListener(sorterListener);
        sorter = null;
    }

    /**
     * Sort session awaiting completion, and the step that drives it once scheduled.
     */
    private final class PendingSort implements BooleanSupplier {
        private final SortSession session;
        private boolean scheduled;
        private ScheduledStep handle;

        private PendingSort(SortSession session) {
            this.session = session;
        }

        @Override
        public boolean getAsBoolean() {
            return sortStep(this);
        }

        private void cancel() {
            if (handle != null) {
                handle.cancel();
            }
        }
    }
}
