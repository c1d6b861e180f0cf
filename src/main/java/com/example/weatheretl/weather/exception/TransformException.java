package com.example.weatheretl.weather.exception;

import lombok.Getter;

@Getter
public class TransformException extends RuntimeException {

    private final String field;
    private final String reason;

    public TransformException(String field, String reason) {
        super(field + ": " + reason);
        this.field = field;
        this.reason = reason;
    }
}
