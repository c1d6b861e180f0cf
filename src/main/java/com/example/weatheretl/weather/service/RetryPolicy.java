package com.example.weatheretl.weather.service;

import com.example.weatheretl.weather.config.WeatherEtlProperties;

import java.time.Duration;

/**
 * 도시별 fetch 재시도 정책.
 * n 번째 재시도 전 대기 = initialBackoff * multiplier^(n-1), 최대 maxBackoff
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
    }

    public static RetryPolicy from(WeatherEtlProperties.Retry retry) {
        return new RetryPolicy(retry.maxRetries(), retry.initialBackoff(), retry.multiplier(), retry.maxBackoff());
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public Duration backoffBefore(int retryNumber) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, retryNumber - 1);
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }
}
