package com.macro.liquidity.engine.derivations;

import com.macro.liquidity.engine.MetricDerivation;
import com.macro.liquidity.engine.MetricInputs;
import com.macro.liquidity.engine.SeriesMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static com.macro.liquidity.model.MetricNames.*;

/**
 * {@code Net_Liquidity = assets - reverse repo - Treasury cash account}, all in millions.
 * Without any cash-account data the two-term result is written to
 * {@code Net_Liquidity_No_TGA} instead, so it is never mistaken for the full figure.
 */
public class NetLiquidityDerivation implements MetricDerivation {

    private static final Logger log = LoggerFactory.getLogger(NetLiquidityDerivation.class);

    @Override
    public String getName() {
        return "net-liquidity";
    }

    @Override
    public List<String> getRequiredInputs() {
        return List.of(FED_TOTAL_ASSETS, RRP_BALANCE_M);
    }

    @Override
    public List<String> getOptionalInputs() {
        return List.of(TGA_BALANCE);
    }

    @Override
    public Map<String, double[]> derive(MetricInputs inputs) {
        double[] assets = inputs.require(FED_TOTAL_ASSETS);
        double[] rrp = inputs.require(RRP_BALANCE_M);

        if (!inputs.isPresent(TGA_BALANCE)) {
            log.warn("TGA balance unavailable; reporting {} (assets - RRP only)", NET_LIQUIDITY_NO_TGA);
            return Map.of(NET_LIQUIDITY_NO_TGA, subtract(assets, rrp));
        }
        double[] tga = inputs.require(TGA_BALANCE);
        return Map.of(NET_LIQUIDITY, subtract(subtract(assets, rrp), tga));
    }

    private static double[] subtract(double[] a, double[] b) {
        double[] out = SeriesMath.missing(a.length);
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i] - b[i];
        }
        return out;
    }
}
