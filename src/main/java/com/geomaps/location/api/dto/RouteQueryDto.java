package com.geomaps.location.api.dto;

import com.geomaps.location.domain.model.TravelMode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RouteQueryDto {

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double fromLat;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double fromLng;

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double toLat;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double toLng;

    private TravelMode mode = TravelMode.DRIVING;
}
