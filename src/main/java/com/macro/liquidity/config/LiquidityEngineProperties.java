package com.macro.liquidity.config;

import com.macro.liquidity.model.SeriesFrequency;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized engine configuration bound from {@code liquidity.*}. Components never see
 * this mutable bean; each group is converted into an immutable settings value when the
 * components are wired, so changes at runtime require a new run context.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "liquidity")
public class LiquidityEngineProperties {

    private Alignment alignment = new Alignment();
    private Derivation derivation = new Derivation();
    private Temporal temporal = new Temporal();
    private Spike spike = new Spike();
    private Stress stress = new Stress();
    private Regime regime = new Regime();
    private Composite composite = new Composite();
    private Forecast forecast = new Forecast();
    private Monitoring monitoring = new Monitoring();

    @Data
    public static class Alignment {
        // Calendar days a daily series may be carried past its last observation (covers weekends)
        private int dailyFillLimitDays = 3;
        private List<String> requiredSeries = new ArrayList<>(List.of(
                "Fed_Total_Assets", "RRP_Balance", "TGA_Balance", "SOFR", "EFFR", "IORB"));

        public AlignmentSettings toSettings() {
            return AlignmentSettings.builder()
                    .dailyFillLimitDays(dailyFillLimitDays)
                    .requiredSeries(List.copyOf(requiredSeries))
                    .build();
        }
    }

    @Data
    public static class Derivation {
        private double rrpToMillions = 1000.0;
        private int weeklyLag = 5;
        private int monthlyLag = 22;
        private int quarterlyLag = 65;
        private int yearOverYearLag = 252;
        private int fastWindow = 5;
        private int slowWindow = 20;
        private int volatilityWindow = 5;
        private int volatilityMinPeriods = 2;
        private double stressFlagMargin = 0.05;
        private int fourWeekSessions = 20;
        // Empty means the built-in rate and curve spreads
        private List<Spread> spreads = new ArrayList<>();

        public DerivationSettings toSettings() {
            DerivationSettings.DerivationSettingsBuilder builder = DerivationSettings.builder()
                    .rrpToMillions(rrpToMillions)
                    .weeklyLag(weeklyLag)
                    .monthlyLag(monthlyLag)
                    .quarterlyLag(quarterlyLag)
                    .yearOverYearLag(yearOverYearLag)
                    .fastWindow(fastWindow)
                    .slowWindow(slowWindow)
                    .volatilityWindow(volatilityWindow)
                    .volatilityMinPeriods(volatilityMinPeriods)
                    .stressFlagMargin(stressFlagMargin)
                    .fourWeekSessions(fourWeekSessions);
            if (!spreads.isEmpty()) {
                builder.spreads(spreads.stream().map(Spread::toDefinition).toList());
            }
            return builder.build();
        }
    }

    @Data
    public static class Spread {
        private String name;
        private String minuend;
        private String subtrahend;
        private double multiplier = 100.0;

        SpreadDefinition toDefinition() {
            return SpreadDefinition.builder()
                    .name(name).minuend(minuend).subtrahend(subtrahend).multiplier(multiplier)
                    .build();
        }
    }

    @Data
    public static class Temporal {
        private int rollingWindow = 63;
        private int sessionsPerYear = 252;
        private double maxAbsPercentChange = 500.0;
        private int quarterStartMonth = 1;
        private double trendSlopeThreshold = 1000.0;
        private Map<String, Double> trendSlopeThresholds =
                new LinkedHashMap<>(TemporalSettings.defaultTrendSlopeThresholds());

        public TemporalSettings toSettings() {
            if (quarterStartMonth < 1 || quarterStartMonth > 12) {
                throw new IllegalArgumentException("liquidity.temporal.quarter-start-month must be 1-12");
            }
            return TemporalSettings.builder()
                    .rollingWindow(rollingWindow)
                    .sessionsPerYear(sessionsPerYear)
                    .maxAbsPercentChange(maxAbsPercentChange)
                    .quarterStartMonth(quarterStartMonth)
                    .trendSlopeThreshold(trendSlopeThreshold)
                    .trendSlopeThresholds(Map.copyOf(trendSlopeThresholds))
                    .build();
        }
    }

    @Data
    public static class Spike {
        private int window = 20;
        private int minPeriods = 10;
        private double thresholdStd = 2.0;
        private double absoluteThresholdBps = 10.0;
        private int percentileWindow = 63;
        private int percentileMinPeriods = 40;
        private double percentile = 0.95;
        private int minObservations = 20;

        public SpikeSettings toSettings() {
            return SpikeSettings.builder()
                    .window(window)
                    .minPeriods(minPeriods)
                    .thresholdStd(thresholdStd)
                    .absoluteThresholdBps(absoluteThresholdBps)
                    .percentileWindow(percentileWindow)
                    .percentileMinPeriods(percentileMinPeriods)
                    .percentile(percentile)
                    .minObservations(minObservations)
                    .build();
        }
    }

    @Data
    public static class Stress {
        private Map<String, Double> weights = new LinkedHashMap<>(StressSettings.defaultWeights());
        private double sofrSpreadCapBps = 20.0;
        private double effrSpreadFloorBps = -5.0;
        private double effrSpreadCapBps = 15.0;
        private double volatilityCap = 0.10;
        private double repoUsageCap = 100_000.0;
        private double moderateAt = 25.0;
        private double elevatedAt = 50.0;
        private double highAt = 75.0;

        public StressSettings toSettings() {
            if (!(moderateAt < elevatedAt && elevatedAt < highAt)) {
                throw new IllegalArgumentException("liquidity.stress level cut points must be ascending");
            }
            return StressSettings.builder()
                    .weights(Map.copyOf(weights))
                    .sofrSpreadCapBps(sofrSpreadCapBps)
                    .effrSpreadFloorBps(effrSpreadFloorBps)
                    .effrSpreadCapBps(effrSpreadCapBps)
                    .volatilityCap(volatilityCap)
                    .repoUsageCap(repoUsageCap)
                    .moderateAt(moderateAt)
                    .elevatedAt(elevatedAt)
                    .highAt(highAt)
                    .build();
        }
    }

    @Data
    public static class Regime {
        private int lookback = 20;
        private double assetTrendThreshold = 10_000.0;
        private double reserveDrainThreshold = 50.0;
        private double paceThreshold = 5_000.0;

        public RegimeSettings toSettings() {
            return RegimeSettings.builder()
                    .lookback(lookback)
                    .assetTrendThreshold(assetTrendThreshold)
                    .reserveDrainThreshold(reserveDrainThreshold)
                    .paceThreshold(paceThreshold)
                    .build();
        }
    }

    @Data
    public static class Composite {
        // Empty means the built-in fiscal / monetary / plumbing definitions
        private List<SubIndex> subIndices = new ArrayList<>();
        private int fastWindow = 5;
        private int slowWindow = 20;
        private List<Double> bandCutPoints = new ArrayList<>(List.of(-1.0, -0.5, 0.5, 1.0));

        public CompositeSettings toSettings() {
            if (bandCutPoints.size() != 4) {
                throw new IllegalArgumentException("liquidity.composite.band-cut-points needs exactly 4 values");
            }
            CompositeSettings.CompositeSettingsBuilder builder = CompositeSettings.builder()
                    .fastWindow(fastWindow)
                    .slowWindow(slowWindow)
                    .bandCutPoints(bandCutPoints.stream().mapToDouble(Double::doubleValue).toArray());
            if (!subIndices.isEmpty()) {
                builder.subIndices(subIndices.stream().map(SubIndex::toDefinition).toList());
            }
            return builder.build();
        }
    }

    @Data
    public static class SubIndex {
        private String name;
        private double weight;
        private List<Term> terms = new ArrayList<>();

        SubIndexDefinition toDefinition() {
            return SubIndexDefinition.builder()
                    .name(name)
                    .weight(weight)
                    .terms(terms.stream().map(Term::toTerm).toList())
                    .build();
        }
    }

    @Data
    public static class Term {
        private String column;
        private double weight;
        private TermTransform transform = TermTransform.LEVEL;

        CompositeTerm toTerm() {
            return CompositeTerm.builder().column(column).weight(weight).transform(transform).build();
        }
    }

    @Data
    public static class Forecast {
        private int window = 20;
        private int minPoints = 10;
        private int horizon = 5;
        private double flatTolerance = 1e-9;
        private List<String> columns = new ArrayList<>(List.of("Net_Liquidity", "RRP_Balance", "Spread_SOFR_IORB"));

        public ForecastSettings toSettings() {
            return ForecastSettings.builder()
                    .window(window)
                    .minPoints(minPoints)
                    .horizon(horizon)
                    .flatTolerance(flatTolerance)
                    .columns(List.copyOf(columns))
                    .build();
        }
    }

    @Data
    public static class Monitoring {
        private int correlationWindow = 63;
        private int correlationMinRows = 30;
        private double impulseToleranceAbs = 10_000.0;
        private double impulseTolerancePct = 1.0;
        private int delayGraceDays = 2;
        private double stressCriticalAt = 75.0;
        private double stressWarningAt = 50.0;
        private double qtPaceAnnualizedFloor = -1_000_000.0;
        private double netLiquidityLowPercentile = 10.0;
        private double netLiquidityHighPercentile = 90.0;
        private double swapLinesThreshold = 1_000.0;

        public MonitoringSettings toSettings() {
            Map<SeriesFrequency, MonitoringSettings.FreshnessRule> freshness =
                    new EnumMap<>(MonitoringSettings.defaultFreshness());
            return MonitoringSettings.builder()
                    .correlationWindow(correlationWindow)
                    .correlationMinRows(correlationMinRows)
                    .impulseToleranceAbs(impulseToleranceAbs)
                    .impulseTolerancePct(impulseTolerancePct)
                    .freshness(freshness)
                    .delayGraceDays(delayGraceDays)
                    .stressCriticalAt(stressCriticalAt)
                    .stressWarningAt(stressWarningAt)
                    .qtPaceAnnualizedFloor(qtPaceAnnualizedFloor)
                    .netLiquidityLowPercentile(netLiquidityLowPercentile)
                    .netLiquidityHighPercentile(netLiquidityHighPercentile)
                    .swapLinesThreshold(swapLinesThreshold)
                    .build();
        }
    }
}
