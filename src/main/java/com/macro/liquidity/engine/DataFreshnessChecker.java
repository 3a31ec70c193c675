package com.macro.liquidity.engine;

import com.macro.liquidity.config.MonitoringSettings;
import com.macro.liquidity.config.MonitoringSettings.FreshnessRule;
import com.macro.liquidity.model.FreshnessStatus;
import com.macro.liquidity.model.RawSeries;
import com.macro.liquidity.model.SeriesFreshness;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies each input series as OK, DELAYED or STALE from its age on the report date.
 */
public class DataFreshnessChecker {

    private final MonitoringSettings settings;

    public DataFreshnessChecker(MonitoringSettings settings) {
        this.settings = settings;
    }

    public List<SeriesFreshness> check(Map<String, RawSeries> series, LocalDate reportDate) {
        List<SeriesFreshness> result = new ArrayList<>();
        series.forEach((name, raw) -> result.add(check(name, raw, reportDate)));
        return result;
    }

    public SeriesFreshness check(String name, RawSeries series, LocalDate reportDate) {
        FreshnessRule rule = settings.freshnessFor(series.getFrequency());
        Optional<LocalDate> lastUpdated = series.effectiveLastUpdated();
        SeriesFreshness.SeriesFreshnessBuilder builder = SeriesFreshness.builder()
                .series(name)
                .frequency(series.getFrequency())
                .expectedLagDays(rule.getExpectedLagDays())
                .lastUpdated(lastUpdated.orElse(null));

        if (lastUpdated.isEmpty()) {
            return builder.status(FreshnessStatus.STALE).build();
        }
        long daysOld = ChronoUnit.DAYS.between(lastUpdated.get(), reportDate);
        builder.daysOld(daysOld);

        FreshnessStatus status;
        if (rule.getStaleAfterDays() == null) {
            status = FreshnessStatus.OK;
        } else if (daysOld > rule.getStaleAfterDays()) {
            status = FreshnessStatus.STALE;
        } else if (daysOld > rule.getExpectedLagDays() + settings.getDelayGraceDays()) {
            status = FreshnessStatus.DELAYED;
        } else {
            status = FreshnessStatus.OK;
        }
        return builder.status(status).build();
    }
}
