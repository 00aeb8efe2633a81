package com.geomaps.location.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Matrix tables with {@code null} for unreachable pairs.
 * {@code distances} and {@code durations} are meters and seconds;
 * {@code displayDistances} is in {@code displayUnit}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DistanceMatrixResponseDto {

    @JsonProperty("sources")
    private List<CoordinateDto> sources;

    @JsonProperty("targets")
    private List<CoordinateDto> targets;

    @JsonProperty("distances")
    private List<List<Double>> distances;

    @JsonProperty("durations")
    private List<List<Double>> durations;

    @JsonProperty("displayUnit")
    private String displayUnit;

    @JsonProperty("displayDistances")
    private List<List<Double>> displayDistances;
}
