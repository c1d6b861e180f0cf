package com.example.weatheretl.weather.dto;

import com.example.weatheretl.weather.config.City;

/**
 * 한 도시에 대한 API 응답 원본. 저장되지 않음
 *
 * @param units 요청에 사용한 units 파라미터 (standard / metric / imperial)
 */
public record RawObservation(City city, String units, OpenWeatherResponse payload) {
}
