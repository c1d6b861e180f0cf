package com.example.weatheretl.weather.config;

/**
 * 수집 대상 도시.
 * name 은 weather.city_name 에 저장되는 값, query 는 API 에 넘기는 값 (예: London,GB)
 */
public record City(String name, String query) {
}
