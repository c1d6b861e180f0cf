package com.example.weatheretl.weather.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class MainDTO {
    private Double temp;      // units 파라미터에 따라 K / °C / °F
    private Integer humidity; // %
}
