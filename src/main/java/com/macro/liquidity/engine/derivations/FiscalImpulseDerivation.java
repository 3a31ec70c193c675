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
 * Fiscal impulse from daily Treasury cash flows: gross and net impulse averages, the
 * sliding four-week cumulative impulse, the household share of spending and the
 * cash-account drawdown.
 */
public class FiscalImpulseDerivation implements MetricDerivation {

    private final DerivationSettings settings;

    public FiscalImpulseDerivation(DerivationSettings settings) {
        this.settings = settings;
    }

    @Override
    public String getName() {
        return "fiscal-impulse";
    }

    @Override
    public List<String> getRequiredInputs() {
        return List.of(TOTAL_SPENDING);
    }

    @Override
    public List<String> getOptionalInputs() {
        return List.of(TOTAL_TAXES, HOUSEHOLD_SPENDING, TGA_BALANCE);
    }

    @Override
    public Map<String, double[]> derive(MetricInputs inputs) {
        int fast = settings.getFastWindow();
        int slow = settings.getSlowWindow();
        int fourWeek = settings.getFourWeekSessions();
        double[] spending = inputs.require(TOTAL_SPENDING);

        Map<String, double[]> out = new LinkedHashMap<>();
        out.put(MA20_IMPULSE, SeriesMath.rollingMean(spending, slow, settings.minPeriodsFor(slow)));
        out.put(MA5_IMPULSE, SeriesMath.rollingMean(spending, fast, settings.minPeriodsFor(fast)));
        out.put(FOUR_WEEK_CUM_IMPULSE, SeriesMath.rollingSum(spending, fourWeek, fourWeek));

        inputs.get(TOTAL_TAXES).ifPresent(taxColumn -> {
            double[] taxes = taxColumn.toArray();
            double[] net = new double[spending.length];
            for (int i = 0; i < net.length; i++) {
                net[i] = spending[i] - taxes[i];
            }
            out.put(NET_IMPULSE, net);
            out.put(MA20_NET_IMPULSE, SeriesMath.rollingMean(net, slow, settings.minPeriodsFor(slow)));
            out.put(FOUR_WEEK_CUM_NET, SeriesMath.rollingSum(net, fourWeek, fourWeek));
        });

        inputs.get(HOUSEHOLD_SPENDING)
                .ifPresent(c -> out.put(HOUSEHOLD_SHARE_PCT, householdShare(c.toArray(), spending)));

        inputs.get(TGA_BALANCE)
                .ifPresent(c -> out.put(TGA_DRAWDOWN, SeriesMath.negate(SeriesMath.diff(c.toArray(), 1))));
        return out;
    }

    /** Household share of total spending in [0, 100]; 0 when total spending is not positive. */
    static double[] householdShare(double[] household, double[] total) {
        double[] out = SeriesMath.missing(total.length);
        for (int i = 0; i < total.length; i++) {
            if (Double.isNaN(household[i]) || Double.isNaN(total[i])) continue;
            if (total[i] <= 0) {
                out[i] = 0.0;
            } else {
                out[i] = Math.max(0.0, Math.min(100.0, household[i] / total[i] * 100.0));
            }
        }
        return out;
    }
}
