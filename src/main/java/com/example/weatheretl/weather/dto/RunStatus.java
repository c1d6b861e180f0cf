package com.example.weatheretl.weather.dto;

public enum RunStatus {
    SUCCESS,
    PARTIAL,
    FAILED,
    FATAL,
    CANCELLED;

    public boolean isFailure() {
        return this != SUCCESS && this != PARTIAL;
    }
}
