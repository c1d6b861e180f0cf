package com.example.weatheretl.weather.exception;

public enum FetchErrorKind {
    TIMEOUT,
    CONNECTION,
    HTTP,
    UNAUTHORIZED,
    INVALID_RESPONSE
}
