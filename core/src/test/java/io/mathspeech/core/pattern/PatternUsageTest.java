package io.mathspeech.core.pattern;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PatternUsageTest {

    @Test
    void countsPerPatternAndSortsSnapshot() {
        var usage = new PatternUsage();
        usage.recordHit("frac");
        usage.recordMiss("frac");
        usage.recordMiss("frac");
        usage.recordError("alpha");

        assertThat(usage.snapshot("frac")).isEqualTo(new PatternUsage.Snapshot(1, 2, 0));
        assertThat(usage.snapshot("frac").hitRate()).isEqualTo(1.0 / 3.0);
        assertThat(usage.snapshotAll()).containsOnlyKeys("alpha", "frac");
        assertThat(usage.snapshotAll().keySet()).containsExactly("alpha", "frac");
    }

    @Test
    void unknownIdAndResetYieldZeros() {
        var usage = new PatternUsage();
        usage.recordHit("x");
        usage.reset();

        assertThat(usage.snapshot("x")).isEqualTo(new PatternUsage.Snapshot(0, 0, 0));
        assertThat(usage.snapshot("never")).isEqualTo(new PatternUsage.Snapshot(0, 0, 0));
    }
}
