package com.example.weatheretl.weather.dto;

public record CityOutcome(Outcome outcome, String errorKind, String detail, int attempts) {

    public enum Outcome {
        SUCCESS,
        FETCH_FAILED,
        TRANSFORM_FAILED,
        LOAD_FAILED,
        SKIPPED
    }

    public static CityOutcome success(int attempts) {
        return new CityOutcome(Outcome.SUCCESS, null, null, attempts);
    }

    public static CityOutcome failed(Outcome outcome, String errorKind, String detail, int attempts) {
        return new CityOutcome(outcome, errorKind, detail, attempts);
    }

    public static CityOutcome skipped(String detail) {
        return new CityOutcome(Outcome.SKIPPED, null, detail, 0);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
