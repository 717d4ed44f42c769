package io.sortview.runtime;

import io.sortview.core.SortViewConfiguration;
import io.sortview.kernel.SequenceListener;
import io.sortview.schedule.CooperativeScheduler;
import io.sortview.schedule.ExecutorScheduler;
import io.sortview.sorter.ComparatorSorter;
import io.sortview.storage.ArraySequence;
import io.sortview.testutil.ChangeRecorder;
import io.sortview.testutil.ChangeRecorder.Change;
import io.sortview.testutil.ScriptedSequence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class SortedProjectionIncrementalTest {

    private static final SortViewConfiguration ONE_UNIT_PER_STEP = SortViewConfiguration.builder()
            .incremental(true)
            .stepBudget(Duration.ZERO)
            .maxMergeSize(8)
            .build();

    private final CooperativeScheduler scheduler = new CooperativeScheduler();
    private ArraySequence<Integer> source;
    private ComparatorSorter<Integer> sorter;

    @BeforeEach
    void setUp() {
        source = new ArraySequence<>(randomValues(500, new Random(17)));
        sorter = new ComparatorSorter<>(Comparator.naturalOrder());
    }

    @Test
    void sortIsSpreadOverSchedulerPasses() {
        SortedProjection<Integer> projection = SortedProjection.create(source, sorter, scheduler, ONE_UNIT_PER_STEP);
        var recorder = ChangeRecorder.attach(projection);

        assertThat(projection.isSorting()).isTrue();
        assertThat(ChangeRecorder.contents(projection)).containsExactlyElementsOf(source.snapshot());

        int passes = 0;
        while (scheduler.runOnce()) {
            passes++;
            assertThat(recorder.mirror()).isEqualTo(ChangeRecorder.contents(projection));
        }

        assertThat(passes).isGreaterThan(10);
        assertThat(projection.isSorting()).isFalse();
        assertThat(scheduler.pendingCount()).isZero();
        assertThat(ChangeRecorder.contents(projection)).isSorted().containsExactlyInAnyOrderElementsOf(source.snapshot());
    }

    @Test
    void removalDuringSortResumesFromSavedRuns() {
        SortedProjection<Integer> projection = SortedProjection.create(source, sorter, scheduler, ONE_UNIT_PER_STEP);
        var recorder = ChangeRecorder.attach(projection);
        for (int i = 0; i < 20; i++) {
            scheduler.runOnce();
        }

        source.splice(100, 50, List.of());
        source.remove(0);

        assertThat(projection.isSorting()).isTrue();
        assertThat(recorder.mirror()).isEqualTo(ChangeRecorder.contents(projection));
        drain(projection, recorder);
        assertThat(ChangeRecorder.contents(projection)).isSorted().containsExactlyInAnyOrderElementsOf(source.snapshot());
    }

    @Test
    void insertionDuringSortRestartsSort() {
        SortedProjection<Integer> projection = SortedProjection.create(source, sorter, scheduler, ONE_UNIT_PER_STEP);
        var recorder = ChangeRecorder.attach(projection);
        for (int i = 0; i < 20; i++) {
            scheduler.runOnce();
        }

        source.splice(250, 3, List.of(-1, 10_000, 42, 7));

        assertThat(recorder.lastChange().added()).isGreaterThanOrEqualTo(4);
        drain(projection, recorder);
        assertThat(ChangeRecorder.contents(projection)).isSorted().containsExactlyInAnyOrderElementsOf(source.snapshot());
    }

    @Test
    void insertionIntoSortedProjectionIsPublishedBeforeSorting() {
        List<Integer> decades = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            decades.add(i * 10);
        }
        source = new ArraySequence<>(decades);
        SortedProjection<Integer> projection = SortedProjection.create(source, sorter, scheduler, ONE_UNIT_PER_STEP);
        scheduler.runUntilIdle();
        var recorder = ChangeRecorder.attach(projection);

        source.add(505);

        assertThat(recorder.changes()).containsExactly(new Change(100, 0, 1));
        assertThat(projection.get(100)).isEqualTo(505);
        drain(projection, recorder);
        assertThat(projection.get(51)).isEqualTo(505);
    }

    @Test
    void disablingIncrementalFinishesPendingSort() {
        SortedProjection<Integer> projection = SortedProjection.create(source, sorter, scheduler, ONE_UNIT_PER_STEP);
        var recorder = ChangeRecorder.attach(projection);
        scheduler.runOnce();

        projection.setIncremental(false);

        assertThat(projection.isSorting()).isFalse();
        assertThat(scheduler.pendingCount()).isZero();
        assertThat(ChangeRecorder.contents(projection)).isSorted();
        assertThat(recorder.mirror()).isEqualTo(ChangeRecorder.contents(projection));
    }

    @Test
    void sorterChangeDuringSortRestartsWithNewOrder() {
        SortedProjection<Integer> projection = SortedProjection.create(source, sorter, scheduler, ONE_UNIT_PER_STEP);
        var recorder = ChangeRecorder.attach(projection);
        for (int i = 0; i < 30; i++) {
            scheduler.runOnce();
        }

        sorter.setReversed(true);
        drain(projection, recorder);

        assertThat(ChangeRecorder.contents(projection)).isSortedAccordingTo(Comparator.reverseOrder());
    }

    @Test
    void observerMutatingSourceDuringStepIsHandled() {
        SortedProjection<Integer> projection = SortedProjection.create(source, sorter, scheduler, ONE_UNIT_PER_STEP);
        var recorder = ChangeRecorder.attach(projection);
        projection.addListener(new SequenceListener() {
            private boolean fired;

            @Override
            public void itemsChanged(int position, int removed, int added) {
                if (!fired) {
                    fired = true;
                    source.remove(source.size() - 1);
                }
            }
        });

        drain(projection, recorder);

        assertThat(source.size()).isEqualTo(499);
        assertThat(ChangeRecorder.contents(projection)).isSorted().containsExactlyInAnyOrderElementsOf(source.snapshot());
    }

    @Test
    void emptySpliceDoesNotInterruptPendingSort() {
        var scripted = new ScriptedSequence(randomValues(200, new Random(3)));
        SortedProjection<Integer> projection = SortedProjection.create(scripted, sorter, scheduler, ONE_UNIT_PER_STEP);
        var recorder = ChangeRecorder.attach(projection);
        for (int i = 0; i < 5; i++) {
            scheduler.runOnce();
        }
        recorder.reset();

        scripted.fire(7, 0, 0);

        assertThat(recorder.changes()).isEmpty();
        assertThat(projection.isSorting()).isTrue();
        assertThat(scheduler.pendingCount()).isEqualTo(1);
        drain(projection, recorder);
        assertThat(ChangeRecorder.contents(projection)).isSorted();
    }

    @Test
    void closeCancelsPendingStep() {
        SortedProjection<Integer> projection = SortedProjection.create(source, sorter, scheduler, ONE_UNIT_PER_STEP);
        assertThat(scheduler.pendingCount()).isEqualTo(1);

        projection.close();

        assertThat(scheduler.pendingCount()).isZero();
        assertThat(projection.isSorting()).isFalse();
    }

    @Test
    void droppingSorterCancelsPendingStep() {
        SortedProjection<Integer> projection = SortedProjection.create(source, sorter, scheduler, ONE_UNIT_PER_STEP);
        scheduler.runOnce();

        sorter.setComparator(null);

        assertThat(scheduler.pendingCount()).isZero();
        assertThat(ChangeRecorder.contents(projection)).containsExactlyElementsOf(source.snapshot());
    }

    @Test
    void executorSchedulerDrivesSortToCompletion() {
        Queue<Runnable> queue = new ArrayDeque<>();
        SortedProjection<Integer> projection = SortedProjection.create(source, sorter,
                new ExecutorScheduler(queue::add), ONE_UNIT_PER_STEP);
        var recorder = ChangeRecorder.attach(projection);

        Runnable task;
        while ((task = queue.poll()) != null) {
            task.run();
        }

        assertThat(projection.isSorting()).isFalse();
        assertThat(ChangeRecorder.contents(projection)).isSorted();
        assertThat(recorder.mirror()).isEqualTo(ChangeRecorder.contents(projection));
    }

    @Test
    void directExecutorFinishesSortBeforeScheduleReturns() {
        var small = ArraySequence.of(5, 3, 1, 4, 2);
        var projection = new SortedProjection<Integer>(new ExecutorScheduler(Runnable::run), ONE_UNIT_PER_STEP);
        projection.setSource(small);
        var recorder = ChangeRecorder.attach(projection);

        projection.setSorter(sorter);

        assertThat(projection.isSorting()).isFalse();
        assertThat(recorder.mirror()).containsExactly(1, 2, 3, 4, 5);

        small.remove(0);
        small.insert(2, 0);
        small.splice(1, 2, List.of(9, 6, 7));

        assertThat(projection.isSorting()).isFalse();
        assertThat(recorder.mirror()).isEqualTo(ChangeRecorder.contents(projection));
        assertThat(ChangeRecorder.contents(projection)).containsExactly(2, 3, 4, 6, 7, 9);
    }

    @Test
    void directExecutorPublishesSpliceBeforeSortSteps() {
        var projection = new SortedProjection<Integer>(new ExecutorScheduler(Runnable::run), ONE_UNIT_PER_STEP);
        projection.setSource(source);
        projection.setSorter(sorter);
        var recorder = ChangeRecorder.attach(projection);

        source.add(-1);

        assertThat(recorder.changes().get(0)).isEqualTo(new Change(500, 0, 1));
        assertThat(recorder.mirror()).isEqualTo(ChangeRecorder.contents(projection));
        assertThat(projection.get(0)).isEqualTo(-1);
        assertThat(projection.isSorting()).isFalse();
    }

    private void drain(SortedProjection<Integer> projection, ChangeRecorder<Integer> recorder) {
        while (scheduler.runOnce()) {
            assertThat(recorder.mirror()).isEqualTo(ChangeRecorder.contents(projection));
        }
        assertThat(projection.isSorting()).isFalse();
    }

    private static List<Integer> randomValues(int count, Random random) {
        List<Integer> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(random.nextInt(1000));
        }
        return values;
    }
}
