package com.example.weatheretl.weather.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class OpenWeatherResponse {

    private Long dt;          // 관측 시각 (Unix time, 초 단위)
    private String name;      // API 가 돌려준 도시명. 저장은 설정값 기준

    private MainDTO main;

    private List<WeatherConditionDTO> weather;
}
