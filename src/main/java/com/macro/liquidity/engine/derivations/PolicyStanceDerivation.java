package com.macro.liquidity.engine.derivations;

import com.macro.liquidity.config.DerivationSettings;
import com.macro.liquidity.engine.MetricDerivation;
import com.macro.liquidity.engine.MetricInputs;
import com.macro.liquidity.engine.SeriesMath;
import com.macro.liquidity.model.Column;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.macro.liquidity.model.MetricNames.*;

/**
 * Splits the policy stance into a quantity figure and a quality figure.
 *
 * <p>Quantity is the signed weekly change of total assets ({@code Net_Balance_Sheet_Flow}).
 * Quality is reinvestment of MBS run-off into bills plus repo facility usage
 * ({@code Qualitative_Easing_Support}). Reinvestment already moves total assets, so the
 * two figures are reported side by side and never added together.
 */
public class PolicyStanceDerivation implements MetricDerivation {

    private final int lag;

    public PolicyStanceDerivation(DerivationSettings settings) {
        this.lag = settings.getWeeklyLag();
    }

    @Override
    public String getName() {
        return "policy-stance";
    }

    @Override
    public List<String> getRequiredInputs() {
        return List.of(FED_TOTAL_ASSETS);
    }

    @Override
    public List<String> getOptionalInputs() {
        return List.of(MBS_HOLDINGS, BILLS_HOLDINGS, REPO_OPS_BALANCE);
    }

    @Override
    public Map<String, double[]> derive(MetricInputs inputs) {
        Map<String, double[]> out = new LinkedHashMap<>();

        double[] flow = SeriesMath.diff(inputs.require(FED_TOTAL_ASSETS), lag);
        out.put(NET_BALANCE_SHEET_FLOW, flow);
        out.put(QT_PACE_NOMINAL, SeriesMath.negate(flow));

        Optional<double[]> runoff = inputs.get(MBS_HOLDINGS)
                .map(c -> SeriesMath.negate(SeriesMath.diff(c.toArray(), lag)));
        Optional<double[]> purchases = inputs.get(BILLS_HOLDINGS)
                .map(c -> SeriesMath.diff(c.toArray(), lag));
        runoff.ifPresent(r -> out.put(MBS_RUNOFF_WEEKLY, r));
        purchases.ifPresent(p -> out.put(BILL_PURCHASES_WEEKLY, p));

        double[] reinvestment = null;
        if (runoff.isPresent() && purchases.isPresent()) {
            reinvestment = reinvestment(runoff.get(), purchases.get());
            out.put(MBS_TO_BILLS_REINVESTMENT, reinvestment);
        }

        double[] repo = inputs.get(REPO_OPS_BALANCE).map(Column::toArray).orElse(null);
        if (reinvestment != null || repo != null) {
            out.put(QUALITATIVE_EASING_SUPPORT, sumPresent(reinvestment, repo, inputs.size()));
        }
        return out;
    }

    /** Bills bought with MBS run-off: the smaller of the two, only when both are positive. */
    private static double[] reinvestment(double[] runoff, double[] purchases) {
        double[] out = SeriesMath.missing(runoff.length);
        for (int i = 0; i < runoff.length; i++) {
            if (Double.isNaN(runoff[i]) || Double.isNaN(purchases[i])) continue;
            out[i] = runoff[i] > 0 && purchases[i] > 0 ? Math.min(runoff[i], purchases[i]) : 0.0;
        }
        return out;
    }

    private static double[] sumPresent(double[] a, double[] b, int length) {
        double[] out = SeriesMath.missing(length);
        for (int i = 0; i < length; i++) {
            boolean hasA = a != null && !Double.isNaN(a[i]);
            boolean hasB = b != null && !Double.isNaN(b[i]);
            if (hasA || hasB) {
                out[i] = (hasA ? a[i] : 0.0) + (hasB ? b[i] : 0.0);
            }
        }
        return out;
    }
}
