package com.macro.liquidity.engine.derivations;

import com.macro.liquidity.config.DerivationSettings;
import com.macro.liquidity.config.SpreadDefinition;
import com.macro.liquidity.engine.MetricDerivation;
import com.macro.liquidity.engine.derivations.MonthToDateDerivation.Mode;

import java.util.ArrayList;
import java.util.List;

import static com.macro.liquidity.model.MetricNames.*;

/**
 * The built-in derivation chain in dependency order: unit conversion first, then
 * combinations, then changes and averages of the combined columns.
 */
public final class StandardDerivations {

    private StandardDerivations() {}

    public static List<MetricDerivation> create(DerivationSettings settings) {
        int fast = settings.getFastWindow();
        int slow = settings.getSlowWindow();
        int fastMin = settings.minPeriodsFor(fast);
        int slowMin = settings.minPeriodsFor(slow);

        List<MetricDerivation> chain = new ArrayList<>();
        chain.add(new UnitNormalizationDerivation(RRP_BALANCE, RRP_BALANCE_M, settings.getRrpToMillions()));
        chain.add(new PolicyStanceDerivation(settings));
        chain.add(new NetLiquidityDerivation());
        for (SpreadDefinition spread : settings.getSpreads()) {
            chain.add(new SpreadDerivation(spread));
        }

        chain.add(new MultiHorizonChangeDerivation(RRP_BALANCE, "RRP", settings));
        chain.add(new MultiHorizonChangeDerivation(NET_LIQUIDITY, "Net_Liq", settings));
        chain.add(new MultiHorizonChangeDerivation(TGA_BALANCE, "TGA", settings));
        chain.add(new BalanceSheetPaceDerivation(settings));
        chain.add(new VolatilityDerivation(settings));

        chain.add(new MovingAverageDerivation(RRP_BALANCE, MA20_RRP, slow, slowMin));
        chain.add(new MovingAverageDerivation(RRP_BALANCE, MA5_RRP, fast, fastMin));
        chain.add(new MovingAverageDerivation(FED_TOTAL_ASSETS, MA20_ASSETS, slow, slowMin));
        chain.add(new MovingAverageDerivation(SPREAD_SOFR_IORB, MA20_SPREAD_SOFR_IORB, slow, slowMin));
        chain.add(new MovingAverageDerivation(NET_LIQUIDITY, MA20_NET_LIQ, slow, slowMin));
        chain.add(new MovingAverageDerivation(NET_LIQUIDITY, MA5_NET_LIQ, fast, fastMin));

        int yoy = settings.getYearOverYearLag();
        chain.add(new YearOverYearDerivation(RRP_BALANCE, YOY_RRP_CHANGE, yoy));
        chain.add(new YearOverYearDerivation(FED_TOTAL_ASSETS, YOY_ASSETS_CHANGE, yoy));
        chain.add(new YearOverYearDerivation(NET_LIQUIDITY, YOY_NET_LIQ_CHANGE, yoy));

        chain.add(new MonthToDateDerivation(FED_TOTAL_ASSETS, MTD_ASSETS_CHANGE, Mode.LEVEL));
        chain.add(new MonthToDateDerivation(NET_LIQUIDITY, MTD_NET_LIQ_CHANGE, Mode.LEVEL));
        chain.add(new MonthToDateDerivation(RRP_CHANGE, MTD_RRP_FLOW, Mode.FLOW));

        chain.add(new FiscalImpulseDerivation(settings));
        return chain;
    }
}
