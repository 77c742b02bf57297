package com.harvest.coordinator.crawl.metrics;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RollingSeriesTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void bucketsCombineBySumOrAverage() {
        RollingSeries series = new RollingSeries(SeriesWindow.FIVE_MINUTES);
        series.add(T0, 2.0);
        series.add(T0.plusSeconds(5), 4.0);

        List<SeriesPoint> sums = series.points(T0.plusSeconds(9), Aggregation.SUM);
        List<SeriesPoint> averages = series.points(T0.plusSeconds(9), Aggregation.AVERAGE);

        assertThat(sums).hasSize(SeriesWindow.FIVE_MINUTES.bucketCount());
        SeriesPoint last = sums.get(sums.size() - 1);
        assertThat(last.bucketStart()).isEqualTo(T0);
        assertThat(last.value()).isEqualTo(6.0);
        assertThat(last.samples()).isEqualTo(2);
        assertThat(averages.get(averages.size() - 1).value()).isEqualTo(3.0);
        assertThat(sums.get(0).samples()).isZero();
    }

    @Test
    void slotsAreReusedOnceTheWindowMovesPast() {
        RollingSeries series = new RollingSeries(SeriesWindow.FIVE_MINUTES);
        series.add(T0, 10.0);
        Instant later = T0.plusSeconds(300);
        series.add(later, 1.0);

        assertThat(series.total(later)).isEqualTo(1.0);

        series.add(T0.plusSeconds(1), 50.0);
        assertThat(series.total(later)).isEqualTo(1.0);
    }

    @Test
    void totalCoversOnlyTheWindow() {
        RollingSeries series = new RollingSeries(SeriesWindow.FIVE_MINUTES);
        series.add(T0, 1.0);
        series.add(T0.plusSeconds(60), 2.0);
        series.add(T0.plusSeconds(120), 3.0);

        assertThat(series.total(T0.plusSeconds(120))).isEqualTo(6.0);
        assertThat(series.total(T0.plusSeconds(350))).isEqualTo(5.0);
    }

    @Test
    void parsesWindowLabels() {
        assertThat(SeriesWindow.parse("1h")).isEqualTo(SeriesWindow.ONE_HOUR);
        assertThat(SeriesWindow.parse(" 24H ")).isEqualTo(SeriesWindow.ONE_DAY);
        assertThat(SeriesWindow.parse(null)).isEqualTo(SeriesWindow.FIVE_MINUTES);
        assertThat(SeriesWindow.ONE_DAY.bucketCount()).isEqualTo(96);
        assertThatThrownBy(() -> SeriesWindow.parse("7d")).isInstanceOf(IllegalArgumentException.class);
    }
}
