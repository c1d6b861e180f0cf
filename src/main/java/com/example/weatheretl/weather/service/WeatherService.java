package com.example.weatheretl.weather.service;

import com.example.weatheretl.weather.dto.RunResult;

public interface WeatherService {

    /**
     * 설정된 모든 도시에 대해 fetch → transform 후 한 번에 저장.
     * 어떤 경우에도 RunResult 를 돌려주며, 이미 실행 중이면 RunInProgressException
     */
    RunResult runDailyEtl();

}
