package io.sortview.benchmarks;

import io.sortview.core.SortViewConfiguration;
import io.sortview.runtime.SortedProjection;
import io.sortview.schedule.CooperativeScheduler;
import io.sortview.sorter.ComparatorSorter;
import io.sortview.storage.ArraySequence;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

@State(Scope.Thread)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class SortedProjectionBenchmark {

    @Param({"10000", "100000"})
    public int rows;

    private List<Integer> values;
    private SplittableRandom random;
    private CooperativeScheduler scheduler;
    private ArraySequence<Integer> sortedSource;
    private SortedProjection<Integer> sortedProjection;

    @Setup(Level.Trial)
    public void setup() {
        random = new SplittableRandom(42);
        values = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            values.add(random.nextInt());
        }
        scheduler = new CooperativeScheduler();
        sortedSource = new ArraySequence<>(values);
        sortedProjection = SortedProjection.create(sortedSource, ComparatorSorter.total(Comparator.<Integer>naturalOrder()),
                scheduler, SortViewConfiguration.defaults());
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        sortedProjection.close();
    }

    @Benchmark
    public void fullSort(Blackhole blackhole) {
        var projection = SortedProjection.create(new ArraySequence<>(values),
                ComparatorSorter.total(Comparator.<Integer>naturalOrder()),
                new CooperativeScheduler(), SortViewConfiguration.defaults());
        blackhole.consume(projection.get(0));
        projection.close();
    }

    @Benchmark
    public void incrementalSortDrained(Blackhole blackhole) {
        var incrementalScheduler = new CooperativeScheduler();
        var projection = SortedProjection.create(new ArraySequence<>(values),
                ComparatorSorter.total(Comparator.<Integer>naturalOrder()),
                incrementalScheduler, SortViewConfiguration.builder().incremental(true).build());
        blackhole.consume(incrementalScheduler.runUntilIdle());
        blackhole.consume(projection.get(0));
        projection.close();
    }

    @Benchmark
    public void insertIntoSorted(Blackhole blackhole) {
        int position = random.nextInt(sortedSource.size() + 1);
        sortedSource.insert(position, random.nextInt());
        blackhole.consume(sortedProjection.get(position));
        sortedSource.remove(position);
    }
}
