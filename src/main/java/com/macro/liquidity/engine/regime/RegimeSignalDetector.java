package com.macro.liquidity.engine.regime;

import com.macro.liquidity.config.RegimeSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.RegimeSignal;

import java.util.Optional;

/**
 * One directional vote over the lookback rows {@code [from, table.size())}.
 */
public interface RegimeSignalDetector {

    String getName();

    /**
     * @return the vote, or empty when the detector abstains (missing input or no clear move)
     */
    Optional<RegimeSignal> detect(AlignedTable table, int from, RegimeSettings settings);
}
