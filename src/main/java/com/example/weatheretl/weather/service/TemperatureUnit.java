package com.example.weatheretl.weather.service;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * OpenWeather units 파라미터별 온도 단위. 저장은 항상 섭씨
 */
public enum TemperatureUnit {

    STANDARD("standard", kelvin -> kelvin - 273.15),
    METRIC("metric", celsius -> celsius),
    IMPERIAL("imperial", fahrenheit -> (fahrenheit - 32.0) * 5.0 / 9.0);

    private final String providerName;
    private final DoubleUnaryOperator toCelsius;

    TemperatureUnit(String providerName, DoubleUnaryOperator toCelsius) {
        this.providerName = providerName;
        this.toCelsius = toCelsius;
    }

    public double toCelsius(double value) {
        return toCelsius.applyAsDouble(value);
    }

    public static Optional<TemperatureUnit> fromProviderUnits(String units) {
        if (units == null) {
            return Optional.empty();
        }
        String normalized = units.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(unit -> unit.providerName.equals(normalized))
                .findFirst();
    }
}
