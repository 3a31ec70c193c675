package com.macro.liquidity.engine;

import com.macro.liquidity.config.ForecastSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.Column;
import com.macro.liquidity.model.TrendDirection;
import com.macro.liquidity.model.TrendForecast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Least-squares line through the valid points of the recent window, extrapolated a few
 * sessions ahead.
 */
public class TrendForecaster {

    private final ForecastSettings settings;

    public TrendForecaster(ForecastSettings settings) {
        this.settings = settings;
    }

    /** Forecasts for every configured column that has enough recent data. */
    public Map<String, TrendForecast> forecastAll(AlignedTable table) {
        Map<String, TrendForecast> forecasts = new LinkedHashMap<>();
        for (String column : settings.getColumns()) {
            forecast(table, column).ifPresent(f -> forecasts.put(column, f));
        }
        return forecasts;
    }

    public Optional<TrendForecast> forecast(AlignedTable table, String column) {
        Optional<Column> source = table.column(column);
        if (source.isEmpty()) {
            return Optional.empty();
        }
        int from = Math.max(0, table.size() - settings.getWindow());
        double[] points = SeriesMath.validSlice(source.get().toArray(), from, table.size());
        if (points.length < Math.max(2, settings.getMinPoints())) {
            return Optional.empty();
        }

        SeriesMath.LinearFit fit = SeriesMath.fitLine(points);
        List<Double> forecast = new ArrayList<>(settings.getHorizon());
        for (int step = 0; step < settings.getHorizon(); step++) {
            forecast.add(fit.valueAt(points.length + step));
        }

        double scale = Math.max(1.0, Math.abs(SeriesMath.mean(points)));
        TrendDirection direction = TrendDirection.fromSlope(fit.slope(), settings.getFlatTolerance() * scale);

        return Optional.of(TrendForecast.builder()
                .column(column)
                .slope(fit.slope())
                .intercept(fit.intercept())
                .current(points[points.length - 1])
                .forecast(forecast)
                .forecastAtHorizon(forecast.isEmpty() ? points[points.length - 1] : forecast.get(forecast.size() - 1))
                .direction(direction)
                .rSquared(fit.rSquared())
                .points(points.length)
                .build());
    }
}
