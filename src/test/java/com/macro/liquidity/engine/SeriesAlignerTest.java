package com.macro.liquidity.engine;

import com.macro.liquidity.config.AlignmentSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.Column;
import com.macro.liquidity.model.RawSeries;
import com.macro.liquidity.model.SeriesFrequency;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeriesAlignerTest {

    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);

    private SeriesAligner aligner;

    @BeforeEach
    void setUp() {
        aligner = new SeriesAligner(AlignmentSettings.builder()
                .dailyFillLimitDays(3)
                .requiredSeries(List.of("TGA_Balance"))
                .build());
    }

    /** A calendar-daily axis series spanning Jan 1..Jan 10. */
    private static RawSeries axis() {
        Map<LocalDate, Double> obs = new LinkedHashMap<>();
        for (int d = 0; d < 10; d++) {
            obs.put(JAN_1.plusDays(d), (double) d);
        }
        return RawSeries.of("Axis", SeriesFrequency.DAILY, obs);
    }

    private static Map<LocalDate, Double> obs(Object... dayValuePairs) {
        Map<LocalDate, Double> obs = new LinkedHashMap<>();
        for (int i = 0; i < dayValuePairs.length; i += 2) {
            obs.put(JAN_1.plusDays((Integer) dayValuePairs[i] - 1), (Double) dayValuePairs[i + 1]);
        }
        return obs;
    }

    private static Map<String, RawSeries> primary(RawSeries... series) {
        Map<String, RawSeries> map = new LinkedHashMap<>();
        for (RawSeries s : series) map.put(s.getName(), s);
        return map;
    }

    @Test
    void dailyGapWithinLimit_isFilled_longerGapIsNotFilledPastLimit() {
        RawSeries sofr = RawSeries.of("SOFR", SeriesFrequency.DAILY, obs(1, 1.0, 4, 4.0, 9, 9.0));

        AlignedTable table = aligner.align(primary(axis(), sofr), JAN_1);
        Column col = table.column("SOFR").orElseThrow();

        // 2-day gap fully bridged
        assertThat(col.get(1)).isEqualTo(1.0);
        assertThat(col.get(2)).isEqualTo(1.0);
        // 4-day gap: Jan 5..Jan 7 bridged, Jan 8 is 4 days past the last observation
        assertThat(col.get(4)).isEqualTo(4.0);
        assertThat(col.get(6)).isEqualTo(4.0);
        assertThat(col.isValid(7)).isFalse();
        assertThat(col.get(8)).isEqualTo(9.0);
    }

    @Test
    void weeklySeries_carriedForwardIndefinitely() {
        RawSeries assets = RawSeries.of("Fed_Total_Assets", SeriesFrequency.WEEKLY, obs(1, 100.0));

        AlignedTable table = aligner.align(primary(axis(), assets), JAN_1);

        assertThat(table.column("Fed_Total_Assets").orElseThrow().toArray())
                .containsOnly(100.0);
    }

    @Test
    void policyDrivenSeries_carriedForwardIndefinitely() {
        RawSeries iorb = RawSeries.of("IORB", SeriesFrequency.POLICY_DRIVEN, obs(2, 5.40));

        AlignedTable table = aligner.align(primary(axis(), iorb), JAN_1);
        Column col = table.column("IORB").orElseThrow();

        assertThat(col.isValid(0)).isFalse();
        assertThat(col.get(9)).isEqualTo(5.40);
    }

    @Test
    void unknownFrequency_isNotFilled() {
        RawSeries other = RawSeries.of("Other", SeriesFrequency.UNKNOWN, obs(1, 1.0, 5, 5.0));

        AlignedTable table = aligner.align(primary(axis(), other), JAN_1);

        assertThat(table.column("Other").orElseThrow().validCount()).isEqualTo(2);
    }

    @Test
    void supplement_fillsOnlyDatesThePrimaryIsMissing() {
        RawSeries sofr = RawSeries.of("SOFR", SeriesFrequency.UNKNOWN, obs(1, 5.30, 3, 5.31));
        RawSeries fast = RawSeries.of("SOFR", SeriesFrequency.DAILY, obs(1, 9.99, 2, 5.29));

        AlignedTable table = aligner.align(primary(sofr), Map.of("SOFR", fast), JAN_1);
        Column col = table.column("SOFR").orElseThrow();

        assertThat(col.get(0)).isEqualTo(5.30);
        assertThat(col.get(1)).isEqualTo(5.29);
        assertThat(col.get(2)).isEqualTo(5.31);
    }

    @Test
    void missingRequiredSeries_becomesAllMissingPlaceholder() {
        AlignedTable table = aligner.align(primary(axis()), JAN_1);

        assertThat(table.hasColumn("TGA_Balance")).isTrue();
        assertThat(table.column("TGA_Balance").orElseThrow().hasAnyValue()).isFalse();
        assertThat(aligner.missingRequired(primary(axis()), Map.of())).containsExactly("TGA_Balance");
    }

    @Test
    void startDate_isAppliedAfterFilling() {
        Map<LocalDate, Double> weeklyObs = new LinkedHashMap<>();
        weeklyObs.put(LocalDate.of(2023, 12, 27), 42.0);
        RawSeries weekly = RawSeries.of("Fed_Total_Assets", SeriesFrequency.WEEKLY, weeklyObs);

        AlignedTable table = aligner.align(primary(axis(), weekly), JAN_1);

        assertThat(table.dateAt(0)).isEqualTo(JAN_1);
        assertThat(table.column("Fed_Total_Assets").orElseThrow().get(0)).isEqualTo(42.0);
    }

    @Test
    void datesAreStrictlyAscendingAndUnique() {
        RawSeries a = RawSeries.of("A", SeriesFrequency.DAILY, obs(3, 1.0, 1, 2.0));
        RawSeries b = RawSeries.of("B", SeriesFrequency.DAILY, obs(1, 1.0, 2, 2.0, 3, 3.0));

        AlignedTable table = aligner.align(primary(a, b), JAN_1);

        assertThat(table.getDates()).containsExactly(JAN_1, JAN_1.plusDays(1), JAN_1.plusDays(2));
    }

    @Test
    void nullStartDate_throws() {
        assertThatThrownBy(() -> aligner.align(primary(axis()), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void alignmentIsDeterministic() {
        RawSeries sofr = RawSeries.of("SOFR", SeriesFrequency.DAILY, obs(1, 1.0, 4, 4.0, 9, 9.0));

        AlignedTable first = aligner.align(primary(axis(), sofr), JAN_1);
        AlignedTable second = aligner.align(primary(axis(), sofr), JAN_1);

        assertThat(first).isEqualTo(second);
    }
}
