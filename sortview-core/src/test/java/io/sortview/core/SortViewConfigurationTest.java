package io.sortview.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SortViewConfigurationTest {

    @Test
    void defaultsSortSynchronouslyWithOneMillisecondSteps() {
        SortViewConfiguration config = SortViewConfiguration.defaults();

        assertThat(config.incremental()).isFalse();
        assertThat(config.stepBudget()).isEqualTo(Duration.ofMillis(1));
        assertThat(config.maxMergeSize()).isEqualTo(1024);
    }

    @Test
    void builderOverridesEveryValue() {
        SortViewConfiguration config = SortViewConfiguration.builder()
                .incremental(true)
                .stepBudget(Duration.ZERO)
                .maxMergeSize(0)
                .build();

        assertThat(config.incremental()).isTrue();
        assertThat(config.stepBudget()).isZero();
        assertThat(config.maxMergeSize()).isZero();
        assertThat(config.toString()).contains("incremental=true", "maxMergeSize=0");
    }

    @Test
    void negativeValuesAreRejected() {
        assertThatThrownBy(() -> SortViewConfiguration.builder().stepBudget(Duration.ofMillis(-1)).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stepBudget");
        assertThatThrownBy(() -> SortViewConfiguration.builder().maxMergeSize(-5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxMergeSize");
    }

    @Test
    void nullStepBudgetIsRejected() {
        assertThatThrownBy(() -> SortViewConfiguration.builder().stepBudget(null))
                .isInstanceOf(NullPointerException.class);
    }
}
