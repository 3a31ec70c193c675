package com.macro.liquidity.engine;

import com.macro.liquidity.config.ForecastSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.TrendDirection;
import com.macro.liquidity.model.TrendForecast;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.macro.liquidity.testutil.TestSeriesFactory.constant;
import static com.macro.liquidity.testutil.TestSeriesFactory.createTable;
import static com.macro.liquidity.testutil.TestSeriesFactory.linear;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrendForecasterTest {

    private TrendForecaster forecaster;

    @BeforeEach
    void setUp() {
        forecaster = new TrendForecaster(ForecastSettings.defaults());
    }

    @Test
    void linearSeries_extrapolatesFromRecentWindow() {
        AlignedTable table = createTable(30, "Net_Liquidity", linear(30, 5, 2));

        TrendForecast forecast = forecaster.forecast(table, "Net_Liquidity").orElseThrow();

        assertThat(forecast.getPoints()).isEqualTo(20);
        assertThat(forecast.getSlope()).isCloseTo(2.0, within(1e-9));
        assertThat(forecast.getCurrent()).isEqualTo(63.0);
        assertThat(forecast.getForecast()).hasSize(5);
        assertThat(forecast.getForecast().get(0)).isCloseTo(65.0, within(1e-9));
        assertThat(forecast.getForecastAtHorizon()).isCloseTo(73.0, within(1e-9));
        assertThat(forecast.getRSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(forecast.getDirection()).isEqualTo(TrendDirection.RISING);
    }

    @Test
    void constantSeries_isFlatWithZeroRSquared() {
        AlignedTable table = createTable(20, "X", constant(20, 100.0));

        TrendForecast forecast = forecaster.forecast(table, "X").orElseThrow();

        assertThat(forecast.getSlope()).isCloseTo(0.0, within(1e-12));
        assertThat(forecast.getDirection()).isEqualTo(TrendDirection.FLAT);
        assertThat(forecast.getRSquared()).isEqualTo(0.0);
    }

    @Test
    void constantSeriesWithInexactMean_isStillFlat() {
        AlignedTable table = createTable(20, "X", constant(20, 0.1));

        TrendForecast forecast = forecaster.forecast(table, "X").orElseThrow();

        assertThat(forecast.getDirection()).isEqualTo(TrendDirection.FLAT);
        assertThat(forecast.getRSquared()).isEqualTo(0.0);
    }

    @Test
    void decliningSeries() {
        AlignedTable table = createTable(20, "RRP_Balance", linear(20, 400, -3));

        assertThat(forecaster.forecast(table, "RRP_Balance").orElseThrow().getDirection())
                .isEqualTo(TrendDirection.DECLINING);
    }

    @Test
    void tooFewValidPoints_isEmpty() {
        double[] values = linear(20, 0, 1);
        for (int i = 0; i < 11; i++) values[i] = Double.NaN;
        AlignedTable table = createTable(20, "X", values);

        assertThat(forecaster.forecast(table, "X")).isEmpty();
        assertThat(forecaster.forecast(table, "Missing")).isEmpty();
    }

    @Test
    void missingPointsAreSkippedNotZeroed() {
        double[] values = linear(20, 10, 1);
        values[5] = Double.NaN;
        AlignedTable table = createTable(20, "X", values);

        TrendForecast forecast = forecaster.forecast(table, "X").orElseThrow();

        assertThat(forecast.getPoints()).isEqualTo(19);
        assertThat(forecast.getCurrent()).isEqualTo(29.0);
        assertThat(forecast.getSlope()).isGreaterThan(0.9);
    }

    @Test
    void forecastAll_onlyConfiguredColumnsWithData() {
        AlignedTable table = createTable(20,
                "Net_Liquidity", linear(20, 6_000_000, 1_000),
                "Spread_SOFR_IORB", constant(20, -7.0),
                "Other", linear(20, 0, 1));

        Map<String, TrendForecast> forecasts = forecaster.forecastAll(table);

        assertThat(forecasts).containsOnlyKeys("Net_Liquidity", "Spread_SOFR_IORB");
    }
}
