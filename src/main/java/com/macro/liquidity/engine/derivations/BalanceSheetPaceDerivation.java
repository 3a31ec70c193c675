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
 * Weekly run-off pace of the balance sheet and its Treasury and bill holdings.
 */
public class BalanceSheetPaceDerivation implements MetricDerivation {

    private final int lag;

    public BalanceSheetPaceDerivation(DerivationSettings settings) {
        this.lag = settings.getWeeklyLag();
    }

    @Override
    public String getName() {
        return "balance-sheet-pace";
    }

    @Override
    public List<String> getRequiredInputs() {
        return List.of(FED_TOTAL_ASSETS);
    }

    @Override
    public List<String> getOptionalInputs() {
        return List.of(TREASURY_HOLDINGS, BILLS_HOLDINGS);
    }

    @Override
    public Map<String, double[]> derive(MetricInputs inputs) {
        Map<String, double[]> out = new LinkedHashMap<>();
        out.put(QT_PACE_ASSETS_WEEKLY, SeriesMath.diff(inputs.require(FED_TOTAL_ASSETS), lag));
        inputs.get(TREASURY_HOLDINGS)
                .ifPresent(c -> out.put(QT_PACE_TREASURY_WEEKLY, SeriesMath.diff(c.toArray(), lag)));
        inputs.get(BILLS_HOLDINGS)
                .ifPresent(c -> out.put(BILL_BUYING_PACE_WEEKLY, SeriesMath.diff(c.toArray(), lag)));
        return out;
    }
}
