package com.example.weatheretl.weather.client;

import com.example.weatheretl.weather.config.City;
import com.example.weatheretl.weather.dto.RawObservation;
import com.example.weatheretl.weather.exception.FetchException;

public interface WeatherFetcher {

    /**
     * 도시 1곳의 현재 날씨를 한 번 요청함. 재시도는 하지 않음
     *
     * @throws FetchException 시간 초과, HTTP 오류, 인증 실패, 해석 불가 응답
     */
    RawObservation fetch(City city);
}
