package com.macro.liquidity.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A raw series as submitted by a data collaborator")
public class SeriesPayload {

    @Schema(description = "Series name", example = "SOFR")
    private String name;

    @Schema(description = "Publication frequency: daily, weekly, policy or unknown", example = "daily")
    private String frequency;

    @Schema(description = "When the source last published this series", nullable = true)
    private LocalDate lastUpdated;

    private List<ObservationPayload> observations;

    public RawSeries toRawSeries() {
        Map<LocalDate, Double> values = new LinkedHashMap<>();
        if (observations != null) {
            for (ObservationPayload obs : observations) {
                if (obs != null && obs.getDate() != null) {
                    values.putIfAbsent(obs.getDate(), obs.getValue());
                }
            }
        }
        return new RawSeries(name, SeriesFrequency.fromLabel(frequency), values, lastUpdated);
    }
}
