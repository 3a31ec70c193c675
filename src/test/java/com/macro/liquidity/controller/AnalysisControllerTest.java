package com.macro.liquidity.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.macro.liquidity.config.LiquidityEngineProperties;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.AnalysisRequest;
import com.macro.liquidity.model.AnalysisRun;
import com.macro.liquidity.model.LiquiditySummary;
import com.macro.liquidity.model.LongRecord;
import com.macro.liquidity.model.MonetaryRegime;
import com.macro.liquidity.model.NetLiquidityBasis;
import com.macro.liquidity.model.ObservationPayload;
import com.macro.liquidity.model.RegimeAssessment;
import com.macro.liquidity.model.SeriesPayload;
import com.macro.liquidity.model.StressIndexResult;
import com.macro.liquidity.model.StressLevel;
import com.macro.liquidity.service.LiquidityAnalysisService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static com.macro.liquidity.testutil.TestSeriesFactory.createTable;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalysisController.class)
class AnalysisControllerTest {

    private static final LocalDate START = LocalDate.of(2025, 4, 21);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private LiquidityAnalysisService analysisService;

    @MockBean
    private LiquidityEngineProperties properties;

    private static AnalysisRequest request(boolean includeTable) {
        return AnalysisRequest.builder()
                .startDate(START)
                .series(List.of(SeriesPayload.builder()
                        .name("SOFR")
                        .frequency("daily")
                        .observations(List.of(new ObservationPayload(START, 5.33)))
                        .build()))
                .includeTable(includeTable)
                .build();
    }

    private static AnalysisRun run() {
        AlignedTable table = createTable(2, "SOFR", new double[]{5.33, Double.NaN});
        LiquiditySummary summary = LiquiditySummary.builder()
                .asOf(table.lastDate().orElseThrow())
                .rows(2)
                .netLiquidityBasis(NetLiquidityBasis.UNAVAILABLE)
                .stress(StressIndexResult.builder().score(12.5).level(StressLevel.LOW).components(List.of()).build())
                .regime(RegimeAssessment.builder().regime(MonetaryRegime.NEUTRAL).confidence(50.0)
                        .signals(List.of()).build())
                .alerts(List.of())
                .build();
        return AnalysisRun.builder().table(table).summary(summary).compositeIndex(List.of()).build();
    }

    // ── Analysis ──

    @Test
    void analyze_success() throws Exception {
        when(analysisService.analyze(any(AnalysisRequest.class))).thenReturn(run());

        mockMvc.perform(post("/api/v1/liquidity/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request(false))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.rows").value(2))
                .andExpect(jsonPath("$.summary.netLiquidityBasis").value("UNAVAILABLE"))
                .andExpect(jsonPath("$.summary.stress.score").value(12.5))
                .andExpect(jsonPath("$.summary.regime.regime").value("NEUTRAL"))
                .andExpect(jsonPath("$.table").doesNotExist());
    }

    @Test
    void analyze_includeTable_exportsMissingAsNull() throws Exception {
        when(analysisService.analyze(any(AnalysisRequest.class))).thenReturn(run());

        mockMvc.perform(post("/api/v1/liquidity/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request(true))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.table.dates", hasSize(2)))
                .andExpect(jsonPath("$.table.columns.SOFR[0]").value(5.33))
                .andExpect(jsonPath("$.table.columns.SOFR[1]").value(nullValue()));
    }

    @Test
    void analyze_missingStartDate_returns400() throws Exception {
        AnalysisRequest request = request(false);
        request.setStartDate(null);

        mockMvc.perform(post("/api/v1/liquidity/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("startDate"));

        verifyNoInteractions(analysisService);
    }

    @Test
    void analyze_noSeries_returns400() throws Exception {
        AnalysisRequest request = request(false);
        request.setSeries(List.of());

        mockMvc.perform(post("/api/v1/liquidity/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("series"));
    }

    @Test
    void analyze_recordsWithoutSeries_isAccepted() throws Exception {
        when(analysisService.analyze(any(AnalysisRequest.class))).thenReturn(run());
        AnalysisRequest request = request(false);
        request.setSeries(null);
        request.setRecords(List.of(new LongRecord(START, "SOFR", 5.33)));
        request.setRecordFrequency("daily");

        mockMvc.perform(post("/api/v1/liquidity/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.rows").value(2));

        verify(analysisService).analyze(any(AnalysisRequest.class));
    }

    @Test
    void analyze_rejectedByService_returns400() throws Exception {
        when(analysisService.analyze(any(AnalysisRequest.class)))
                .thenThrow(new IllegalArgumentException("Duplicate series name: SOFR"));

        mockMvc.perform(post("/api/v1/liquidity/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request(false))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Duplicate series name: SOFR"));
    }

    // ── Config ──

    @Test
    void getConfig_success() throws Exception {
        when(properties.getAlignment()).thenReturn(new LiquidityEngineProperties.Alignment());
        when(properties.getStress()).thenReturn(new LiquidityEngineProperties.Stress());
        when(properties.getSpike()).thenReturn(new LiquidityEngineProperties.Spike());
        when(properties.getRegime()).thenReturn(new LiquidityEngineProperties.Regime());
        when(properties.getComposite()).thenReturn(new LiquidityEngineProperties.Composite());

        mockMvc.perform(get("/api/v1/liquidity/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dailyFillLimitDays").value(3))
                .andExpect(jsonPath("$.stressWeights.sofr_spread").value(0.30))
                .andExpect(jsonPath("$.stressLevels.highAt").value(75.0))
                .andExpect(jsonPath("$.spike.absoluteThresholdBps").value(10.0))
                .andExpect(jsonPath("$.regime.lookback").value(20))
                .andExpect(jsonPath("$.compositeWeights.fiscal").value(0.40))
                .andExpect(jsonPath("$.compositeWeights.monetary").value(0.35))
                .andExpect(jsonPath("$.compositeWeights.plumbing").value(0.25));
    }
}
