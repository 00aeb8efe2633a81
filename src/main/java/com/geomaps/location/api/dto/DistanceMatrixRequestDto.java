package com.geomaps.location.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.geomaps.location.domain.model.DistanceUnit;
import com.geomaps.location.domain.model.TravelMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Body of POST /api/v1/distance-matrix. Size limits are enforced by the provider.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DistanceMatrixRequestDto {

    @NotNull(message = "sources is required")
    @JsonProperty("sources")
    private List<@Valid @NotNull CoordinateDto> sources;

    @NotNull(message = "targets is required")
    @JsonProperty("targets")
    private List<@Valid @NotNull CoordinateDto> targets;

    @JsonProperty("mode")
    private TravelMode mode = TravelMode.DRIVING;

    @JsonProperty("units")
    private DistanceUnit units = DistanceUnit.KILOMETERS;
}
