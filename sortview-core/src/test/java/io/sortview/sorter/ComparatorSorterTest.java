package io.sortview.sorter;

import io.sortview.kernel.SorterChange;
import io.sortview.kernel.SorterListener;
import io.sortview.kernel.SorterOrder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComparatorSorterTest {

    @Test
    void reversedSorterNegatesComparison() {
        var sorter = new ComparatorSorter<Integer>(Comparator.naturalOrder());
        sorter.setReversed(true);

        assertThat(sorter.compare(1, 2)).isPositive();
        assertThat(sorter.compare(2, 1)).isNegative();
        assertThat(sorter.compare(2, 2)).isZero();
    }

    @Test
    void reversingHandlesMinValueResults() {
        var sorter = new ComparatorSorter<Integer>((left, right) -> left.equals(right) ? 0 : Integer.MIN_VALUE);
        sorter.setReversed(true);

        assertThat(sorter.compare(1, 2)).isPositive();
    }

    @Test
    void missingComparatorMeansNoOrder() {
        var sorter = new ComparatorSorter<Integer>(null);

        assertThat(sorter.order()).isEqualTo(SorterOrder.NONE);
        assertThat(sorter.compare(1, 2)).isZero();
    }

    @Test
    void declaredOrderIsReported() {
        assertThat(new ComparatorSorter<Integer>(Comparator.naturalOrder()).order()).isEqualTo(SorterOrder.PARTIAL);
        assertThat(ComparatorSorter.total(Comparator.<Integer>naturalOrder()).order()).isEqualTo(SorterOrder.TOTAL);
        assertThatThrownBy(() -> new ComparatorSorter<Integer>(Comparator.naturalOrder(), SorterOrder.NONE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mutatorsNotifyOnlyOnChange() {
        Comparator<Integer> natural = Comparator.naturalOrder();
        var sorter = new ComparatorSorter<>(natural);
        List<SorterChange> changes = new ArrayList<>();
        sorter.addListener(changes::add);

        sorter.setComparator(natural);
        sorter.setReversed(false);
        sorter.setReversed(true);
        sorter.setComparator(Comparator.<Integer>reverseOrder());
        sorter.changed(SorterChange.MORE_STRICT);

        assertThat(changes).containsExactly(SorterChange.INVERTED, SorterChange.DIFFERENT, SorterChange.MORE_STRICT);
    }

    @Test
    void removedListenerIsNotNotified() {
        var sorter = new ComparatorSorter<Integer>(Comparator.naturalOrder());
        List<SorterChange> changes = new ArrayList<>();
        SorterListener listener = changes::add;
        sorter.addListener(listener);
        sorter.removeListener(listener);

        sorter.setReversed(true);

        assertThat(changes).isEmpty();
    }
}
