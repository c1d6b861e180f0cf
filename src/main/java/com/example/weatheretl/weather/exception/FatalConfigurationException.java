package com.example.weatheretl.weather.exception;

public class FatalConfigurationException extends RuntimeException {

    public FatalConfigurationException(String message) {
        super(message);
    }
}
