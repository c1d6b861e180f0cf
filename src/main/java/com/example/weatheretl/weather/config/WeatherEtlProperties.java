package com.example.weatheretl.weather.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * weather.etl.* 설정. 기동 시 한 번 바인딩되고 이후 바뀌지 않음
 */
@ConfigurationProperties(prefix = "weather.etl")
public record WeatherEtlProperties(
        @DefaultValue Provider provider,
        List<City> cities,
        @DefaultValue Retry retry,
        @DefaultValue("10m") Duration runTimeout,
        @DefaultValue("30s") Duration loadTimeout,
        @DefaultValue("1") int fetchConcurrency,
        @DefaultValue("false") boolean failOnPartial,
        @DefaultValue("true") boolean loadCollectedOnAbort
) {

    public WeatherEtlProperties {
        cities = cities == null ? List.of() : List.copyOf(cities);
    }

    public record Provider(
            @DefaultValue("https://api.openweathermap.org/data/2.5/weather") String baseUrl,
            String apiKey,
            @DefaultValue("metric") String units,
            @DefaultValue("10s") Duration timeout
    ) {
    }

    public record Retry(
            @DefaultValue("3") int maxRetries,
            @DefaultValue("2s") Duration initialBackoff,
            @DefaultValue("2.0") double multiplier,
            @DefaultValue("30s") Duration maxBackoff
    ) {
    }
}
