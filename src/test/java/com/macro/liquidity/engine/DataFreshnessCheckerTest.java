package com.macro.liquidity.engine;

import com.macro.liquidity.config.MonitoringSettings;
import com.macro.liquidity.model.FreshnessStatus;
import com.macro.liquidity.model.RawSeries;
import com.macro.liquidity.model.SeriesFreshness;
import com.macro.liquidity.model.SeriesFrequency;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DataFreshnessCheckerTest {

    private static final LocalDate REPORT_DATE = LocalDate.of(2025, 5, 20);

    private DataFreshnessChecker checker;

    @BeforeEach
    void setUp() {
        checker = new DataFreshnessChecker(MonitoringSettings.defaults());
    }

    private static RawSeries observedDaysAgo(SeriesFrequency frequency, int daysAgo) {
        return RawSeries.of("S", frequency, Map.of(REPORT_DATE.minusDays(daysAgo), 1.0));
    }

    private FreshnessStatus statusOf(SeriesFrequency frequency, int daysAgo) {
        return checker.check("S", observedDaysAgo(frequency, daysAgo), REPORT_DATE).getStatus();
    }

    @Test
    void dailySeries() {
        assertThat(statusOf(SeriesFrequency.DAILY, 1)).isEqualTo(FreshnessStatus.OK);
        assertThat(statusOf(SeriesFrequency.DAILY, 4)).isEqualTo(FreshnessStatus.OK);
        assertThat(statusOf(SeriesFrequency.DAILY, 5)).isEqualTo(FreshnessStatus.DELAYED);
        assertThat(statusOf(SeriesFrequency.DAILY, 6)).isEqualTo(FreshnessStatus.STALE);
    }

    @Test
    void weeklySeries() {
        assertThat(statusOf(SeriesFrequency.WEEKLY, 7)).isEqualTo(FreshnessStatus.OK);
        assertThat(statusOf(SeriesFrequency.WEEKLY, 10)).isEqualTo(FreshnessStatus.DELAYED);
        assertThat(statusOf(SeriesFrequency.WEEKLY, 15)).isEqualTo(FreshnessStatus.STALE);
    }

    @Test
    void policyDrivenSeries_neverStale() {
        assertThat(statusOf(SeriesFrequency.POLICY_DRIVEN, 400)).isEqualTo(FreshnessStatus.OK);
    }

    @Test
    void noObservations_isStale() {
        RawSeries empty = RawSeries.of("S", SeriesFrequency.DAILY, Map.of());

        SeriesFreshness freshness = checker.check("S", empty, REPORT_DATE);

        assertThat(freshness.getStatus()).isEqualTo(FreshnessStatus.STALE);
        assertThat(freshness.getDaysOld()).isNull();
    }

    @Test
    void suppliedLastUpdated_takesPrecedenceOverLastObservation() {
        RawSeries series = new RawSeries("S", SeriesFrequency.DAILY,
                Map.of(REPORT_DATE.minusDays(10), 1.0), REPORT_DATE.minusDays(1));

        SeriesFreshness freshness = checker.check("S", series, REPORT_DATE);

        assertThat(freshness.getDaysOld()).isEqualTo(1L);
        assertThat(freshness.getStatus()).isEqualTo(FreshnessStatus.OK);
    }

    @Test
    void checkAll_keepsInputOrder() {
        Map<String, RawSeries> series = new LinkedHashMap<>();
        series.put("SOFR", observedDaysAgo(SeriesFrequency.DAILY, 1));
        series.put("Fed_Total_Assets", observedDaysAgo(SeriesFrequency.WEEKLY, 20));

        List<SeriesFreshness> result = checker.check(series, REPORT_DATE);

        assertThat(result).extracting(SeriesFreshness::getSeries).containsExactly("SOFR", "Fed_Total_Assets");
        assertThat(result).extracting(SeriesFreshness::getStatus)
                .containsExactly(FreshnessStatus.OK, FreshnessStatus.STALE);
    }
}
