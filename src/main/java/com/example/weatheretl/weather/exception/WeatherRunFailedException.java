package com.example.weatheretl.weather.exception;

import com.example.weatheretl.weather.dto.RunResult;
import lombok.Getter;

@Getter
public class WeatherRunFailedException extends RuntimeException {

    private final transient RunResult result;

    public WeatherRunFailedException(RunResult result) {
        super("Weather ETL run finished with status " + result.status() + ": " + result.message());
        this.result = result;
    }
}
