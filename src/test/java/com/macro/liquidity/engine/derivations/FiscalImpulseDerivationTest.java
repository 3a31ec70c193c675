package com.macro.liquidity.engine.derivations;

import com.macro.liquidity.config.DerivationSettings;
import com.macro.liquidity.engine.MetricInputs;
import com.macro.liquidity.model.AlignedTable;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.macro.liquidity.model.MetricNames.*;
import static com.macro.liquidity.testutil.TestSeriesFactory.constant;
import static com.macro.liquidity.testutil.TestSeriesFactory.createTable;
import static org.assertj.core.api.Assertions.assertThat;

class FiscalImpulseDerivationTest {

    private final FiscalImpulseDerivation derivation = new FiscalImpulseDerivation(DerivationSettings.defaults());

    @Test
    void householdShare_isBoundedAndZeroForNonPositiveTotal() {
        double[] share = FiscalImpulseDerivation.householdShare(
                new double[]{50, 150, 10, -5, Double.NaN},
                new double[]{100, 100, 0, 100, 100});

        assertThat(share[0]).isEqualTo(50.0);
        assertThat(share[1]).isEqualTo(100.0);
        assertThat(share[2]).isEqualTo(0.0);
        assertThat(share[3]).isEqualTo(0.0);
        assertThat(share[4]).isNaN();
    }

    @Test
    void fourWeekCumulative_needsFullWindow() {
        AlignedTable table = createTable(25, TOTAL_SPENDING, constant(25, 1_000));

        Map<String, double[]> out = derivation.derive(new MetricInputs(table));
        double[] cumulative = out.get(FOUR_WEEK_CUM_IMPULSE);

        assertThat(cumulative[18]).isNaN();
        assertThat(cumulative[19]).isEqualTo(20_000.0);
        assertThat(cumulative[24]).isEqualTo(20_000.0);
    }

    @Test
    void netImpulse_onlyWhenTaxesPresent() {
        AlignedTable withoutTaxes = createTable(3, TOTAL_SPENDING, constant(3, 1_000));
        AlignedTable withTaxes = createTable(3,
                TOTAL_SPENDING, constant(3, 1_000),
                TOTAL_TAXES, constant(3, 400));

        assertThat(derivation.derive(new MetricInputs(withoutTaxes))).doesNotContainKey(NET_IMPULSE);
        assertThat(derivation.derive(new MetricInputs(withTaxes)).get(NET_IMPULSE)).containsOnly(600.0);
    }

    @Test
    void tgaDrawdown_isNegatedDailyChange() {
        AlignedTable table = createTable(3,
                TOTAL_SPENDING, constant(3, 1_000),
                TGA_BALANCE, new double[]{700, 650, 690});

        double[] drawdown = derivation.derive(new MetricInputs(table)).get(TGA_DRAWDOWN);

        assertThat(drawdown[0]).isNaN();
        assertThat(drawdown[1]).isEqualTo(50.0);
        assertThat(drawdown[2]).isEqualTo(-40.0);
    }
}
