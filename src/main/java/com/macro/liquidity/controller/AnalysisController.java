package com.macro.liquidity.controller;

import com.macro.liquidity.config.LiquidityEngineProperties;
import com.macro.liquidity.model.AnalysisRequest;
import com.macro.liquidity.model.AnalysisResponse;
import com.macro.liquidity.model.AnalysisRun;
import com.macro.liquidity.model.TableSnapshot;
import com.macro.liquidity.service.LiquidityAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/liquidity")
@Tag(name = "Liquidity Analysis", description = "Run the liquidity analytics engine over a batch of raw series")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final LiquidityAnalysisService analysisService;
    private final LiquidityEngineProperties properties;

    public AnalysisController(LiquidityAnalysisService analysisService, LiquidityEngineProperties properties) {
        this.analysisService = analysisService;
        this.properties = properties;
    }

    @Operation(summary = "Analyse a batch of raw series",
            description = "Aligns the submitted series, derives liquidity metrics and returns the run summary " +
                    "(temporal windows, spread spikes, stress index, regime, correlations, forecasts, alerts) " +
                    "together with the composite liquidity index. Set includeTable to also receive every column.")
    @PostMapping("/analysis")
    public ResponseEntity<?> analyze(@RequestBody AnalysisRequest request) {
        if (request.getStartDate() == null) {
            return badRequest("startDate is required", "startDate");
        }
        boolean noSeries = request.getSeries() == null || request.getSeries().isEmpty();
        boolean noRecords = request.getRecords() == null || request.getRecords().isEmpty();
        if (noSeries && noRecords) {
            return badRequest("At least one series or record is required", "series");
        }

        AnalysisRun run;
        try {
            run = analysisService.analyze(request);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected analysis request: {}", e.getMessage());
            return badRequest(e.getMessage(), "series");
        }

        return ResponseEntity.ok(AnalysisResponse.builder()
                .summary(run.getSummary())
                .compositeIndex(run.getCompositeIndex())
                .table(request.isIncludeTable() ? TableSnapshot.from(run.getTable()) : null)
                .build());
    }

    @Operation(summary = "Get engine configuration",
            description = "Stress weights and level cut points, spike thresholds, regime thresholds and " +
                    "composite sub-index weights currently in effect.")
    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> getConfig() {
        LiquidityEngineProperties.Stress stress = properties.getStress();
        LiquidityEngineProperties.Spike spike = properties.getSpike();
        LiquidityEngineProperties.Regime regime = properties.getRegime();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dailyFillLimitDays", properties.getAlignment().getDailyFillLimitDays());
        body.put("stressWeights", stress.getWeights());
        body.put("stressLevels", Map.of(
                "moderateAt", stress.getModerateAt(),
                "elevatedAt", stress.getElevatedAt(),
                "highAt", stress.getHighAt()));
        body.put("spike", Map.of(
                "thresholdStd", spike.getThresholdStd(),
                "absoluteThresholdBps", spike.getAbsoluteThresholdBps(),
                "percentile", spike.getPercentile()));
        body.put("regime", Map.of(
                "lookback", regime.getLookback(),
                "assetTrendThreshold", regime.getAssetTrendThreshold(),
                "reserveDrainThreshold", regime.getReserveDrainThreshold(),
                "paceThreshold", regime.getPaceThreshold()));
        Map<String, Double> subIndexWeights = new LinkedHashMap<>();
        properties.getComposite().toSettings().getSubIndices()
                .forEach(s -> subIndexWeights.put(s.getName(), s.getWeight()));
        body.put("compositeWeights", subIndexWeights);
        return ResponseEntity.ok(body);
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
