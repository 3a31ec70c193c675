package com.macro.liquidity.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A named, date-indexed sequence of observations as delivered by a data collaborator.
 * Null or non-finite observations are dropped on construction.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RawSeries {

    private final String name;
    private final SeriesFrequency frequency;
    private final NavigableMap<LocalDate, Double> observations;
    private final LocalDate lastUpdated;

    public RawSeries(String name, SeriesFrequency frequency,
                     Map<LocalDate, Double> observations, LocalDate lastUpdated) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Series name must not be blank");
        }
        this.name = name;
        this.frequency = frequency != null ? frequency : SeriesFrequency.UNKNOWN;
        TreeMap<LocalDate, Double> copy = new TreeMap<>();
        if (observations != null) {
            observations.forEach((date, value) -> {
                if (date != null && value != null && Double.isFinite(value)) {
                    copy.put(date, value);
                }
            });
        }
        this.observations = Collections.unmodifiableNavigableMap(copy);
        this.lastUpdated = lastUpdated;
    }

    public static RawSeries of(String name, SeriesFrequency frequency, Map<LocalDate, Double> observations) {
        return new RawSeries(name, frequency, observations, null);
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public Optional<LocalDate> lastObservationDate() {
        return observations.isEmpty() ? Optional.empty() : Optional.of(observations.lastKey());
    }

    /** Last-updated timestamp if supplied, else the date of the latest observation. */
    public Optional<LocalDate> effectiveLastUpdated() {
        return lastUpdated != null ? Optional.of(lastUpdated) : lastObservationDate();
    }
}
