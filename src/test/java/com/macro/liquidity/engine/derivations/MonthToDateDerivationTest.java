package com.macro.liquidity.engine.derivations;

import com.macro.liquidity.engine.MetricInputs;
import com.macro.liquidity.engine.derivations.MonthToDateDerivation.Mode;
import com.macro.liquidity.model.AlignedTable;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.macro.liquidity.testutil.TestSeriesFactory.createTable;
import static org.assertj.core.api.Assertions.assertThat;

class MonthToDateDerivationTest {

    private static final List<LocalDate> DATES = List.of(
            LocalDate.of(2025, 3, 28), LocalDate.of(2025, 3, 31),
            LocalDate.of(2025, 4, 1), LocalDate.of(2025, 4, 2), LocalDate.of(2025, 4, 3));

    @Test
    void levelMode_measuresAgainstFirstValidValueOfMonth() {
        AlignedTable table = createTable(DATES, "X", new double[]{10, 12, Double.NaN, 20, 25});

        double[] mtd = new MonthToDateDerivation("X", "MTD_X", Mode.LEVEL)
                .derive(new MetricInputs(table)).get("MTD_X");

        assertThat(mtd[0]).isEqualTo(0.0);
        assertThat(mtd[1]).isEqualTo(2.0);
        assertThat(mtd[2]).isNaN();
        assertThat(mtd[3]).isEqualTo(0.0);
        assertThat(mtd[4]).isEqualTo(5.0);
    }

    @Test
    void flowMode_accumulatesAndResetsEachMonth() {
        AlignedTable table = createTable(DATES, "dX", new double[]{1, 2, 3, Double.NaN, 4});

        double[] mtd = new MonthToDateDerivation("dX", "MTD_dX", Mode.FLOW)
                .derive(new MetricInputs(table)).get("MTD_dX");

        assertThat(mtd[1]).isEqualTo(3.0);
        assertThat(mtd[2]).isEqualTo(3.0);
        assertThat(mtd[4]).isEqualTo(7.0);
    }
}
