package com.example.weatheretl.weather.exception;

public class RunInProgressException extends IllegalStateException {

    public RunInProgressException() {
        super("A weather ETL run is already in progress");
    }
}
