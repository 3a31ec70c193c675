package com.macro.liquidity.engine.regime;

import com.macro.liquidity.config.RegimeSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.MetricNames;
import com.macro.liquidity.model.RegimeSignal;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Latest weekly asset change. Only a strong pace votes; a moderate one abstains.
 */
public class RunoffPaceDetector implements RegimeSignalDetector {

    @Override
    public String getName() {
        return "runoff-pace";
    }

    @Override
    public Optional<RegimeSignal> detect(AlignedTable table, int from, RegimeSettings settings) {
        OptionalDouble pace = table.column(MetricNames.QT_PACE_ASSETS_WEEKLY)
                .map(c -> c.latest())
                .orElse(OptionalDouble.empty());
        if (pace.isEmpty()) return Optional.empty();
        double threshold = settings.getPaceThreshold();
        if (pace.getAsDouble() < -threshold) return Optional.of(RegimeSignal.QT);
        if (pace.getAsDouble() > threshold) return Optional.of(RegimeSignal.QE);
        return Optional.empty();
    }
}
