package com.geomaps.location.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AutocompleteResultDto {

    @JsonProperty("rank")
    private Integer rank;

    @JsonProperty("address")
    private AddressDto address;

    @JsonProperty("lat")
    private Double lat;

    @JsonProperty("lng")
    private Double lng;

    @JsonProperty("confidence")
    private Double confidence;

    @JsonProperty("matchType")
    private String matchType;
}
