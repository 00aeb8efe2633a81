package com.geomaps.location.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RouteResponseDto {

    @JsonProperty("mode")
    private String mode;

    @JsonProperty("distanceMeters")
    private Double distanceMeters;

    @JsonProperty("durationSeconds")
    private Double durationSeconds;

    @JsonProperty("distanceKilometers")
    private Double distanceKilometers;

    @JsonProperty("durationMinutes")
    private Double durationMinutes;
}
