package com.macro.liquidity.engine.derivations;

import com.macro.liquidity.config.DerivationSettings;
import com.macro.liquidity.engine.MetricDerivation;
import com.macro.liquidity.engine.MetricInputs;
import com.macro.liquidity.engine.SeriesMath;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.macro.liquidity.model.MetricNames.*;

/**
 * Short-window SOFR volatility and a binary flag for SOFR printing above IORB plus margin.
 */
public class VolatilityDerivation implements MetricDerivation {

    private final DerivationSettings settings;

    public VolatilityDerivation(DerivationSettings settings) {
        this.settings = settings;
    }

    @Override
    public String getName() {
        return "sofr-volatility";
    }

    @Override
    public List<String> getRequiredInputs() {
        return List.of(SOFR);
    }

    @Override
    public List<String> getOptionalInputs() {
        return List.of(IORB);
    }

    @Override
    public Map<String, double[]> derive(MetricInputs inputs) {
        double[] sofr = inputs.require(SOFR);
        Map<String, double[]> out = new LinkedHashMap<>();
        out.put(SOFR_VOL_5D, SeriesMath.rollingStd(sofr,
                settings.getVolatilityWindow(), settings.getVolatilityMinPeriods()));

        inputs.get(IORB).ifPresent(iorbColumn -> {
            double[] iorb = iorbColumn.toArray();
            double[] flag = SeriesMath.missing(sofr.length);
            for (int i = 0; i < sofr.length; i++) {
                if (!Double.isNaN(sofr[i]) && !Double.isNaN(iorb[i])) {
                    flag[i] = sofr[i] > iorb[i] + settings.getStressFlagMargin() ? 1.0 : 0.0;
                }
            }
            out.put(STRESS_FLAG, flag);
        });
        return out;
    }
}
