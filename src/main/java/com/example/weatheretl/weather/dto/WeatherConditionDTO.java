package com.example.weatheretl.weather.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class WeatherConditionDTO {

    // "light rain" 같은 짧은 설명
    private String description;
}
