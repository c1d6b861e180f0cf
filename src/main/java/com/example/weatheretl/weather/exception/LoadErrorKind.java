package com.example.weatheretl.weather.exception;

public enum LoadErrorKind {
    STORE_UNAVAILABLE,
    CONSTRAINT_VIOLATION,
    SCHEMA_MISMATCH,
    TIMEOUT,
    STORE_ERROR
}
