package com.macro.liquidity.engine;

import com.macro.liquidity.config.RegimeSettings;
import com.macro.liquidity.engine.regime.BalanceSheetTrendDetector;
import com.macro.liquidity.engine.regime.RegimeSignalDetector;
import com.macro.liquidity.engine.regime.ReserveDrainTrendDetector;
import com.macro.liquidity.engine.regime.RunoffPaceDetector;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.MonetaryRegime;
import com.macro.liquidity.model.RegimeAssessment;
import com.macro.liquidity.model.RegimeSignal;

import java.util.ArrayList;
import java.util.List;

/**
 * Majority vote across directional detectors. QT and TIGHTENING pool into one count,
 * QE and EASING into the other; NEUTRAL votes only enlarge the denominator.
 */
public class RegimeClassifier {

    private final RegimeSettings settings;
    private final List<RegimeSignalDetector> detectors;

    public RegimeClassifier(RegimeSettings settings) {
        this(settings, List.of(
                new BalanceSheetTrendDetector(),
                new ReserveDrainTrendDetector(),
                new RunoffPaceDetector()));
    }

    public RegimeClassifier(RegimeSettings settings, List<RegimeSignalDetector> detectors) {
        this.settings = settings;
        this.detectors = List.copyOf(detectors);
    }

    public RegimeAssessment classify(AlignedTable table) {
        if (table.size() < settings.getLookback()) {
            return RegimeAssessment.unknown();
        }
        int from = table.size() - settings.getLookback();
        List<RegimeSignal> signals = new ArrayList<>();
        for (RegimeSignalDetector detector : detectors) {
            detector.detect(table, from, settings).ifPresent(signals::add);
        }
        return vote(signals);
    }

    public static RegimeAssessment vote(List<RegimeSignal> signals) {
        long contraction = signals.stream().filter(RegimeSignal::isContractionary).count();
        long expansion = signals.stream().filter(RegimeSignal::isExpansionary).count();

        MonetaryRegime regime;
        double confidence;
        if (contraction > expansion) {
            regime = MonetaryRegime.QT;
            confidence = Math.min(100.0, (double) contraction / signals.size() * 100.0);
        } else if (expansion > contraction) {
            regime = MonetaryRegime.QE;
            confidence = Math.min(100.0, (double) expansion / signals.size() * 100.0);
        } else {
            regime = MonetaryRegime.NEUTRAL;
            confidence = 50.0;
        }
        return RegimeAssessment.builder()
                .regime(regime)
                .confidence(confidence)
                .signals(List.copyOf(signals))
                .build();
    }
}
