package com.example.weatheretl.weather.service;

import com.example.weatheretl.weather.dto.LoadResult;
import com.example.weatheretl.weather.entity.WeatherReading;
import com.example.weatheretl.weather.exception.LoadException;

import java.util.List;

public interface WeatherLoader {

    /**
     * 배치 전체를 하나의 트랜잭션으로 저장.
     * (city_name, observed_at) 가 이미 있으면 건너뜀. 실패하면 배치 전체 롤백
     *
     * @throws LoadException 저장소 접근 불가, 제약 조건 위반, 스키마 불일치 등
     */
    LoadResult load(List<WeatherReading> readings);
}
