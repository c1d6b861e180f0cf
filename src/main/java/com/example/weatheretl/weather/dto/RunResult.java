package com.example.weatheretl.weather.dto;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 런 1회의 결과. outcomes 는 설정된 도시 순서를 유지함
 */
public record RunResult(
        Instant startedAt,
        Instant finishedAt,
        RunStatus status,
        String message,
        Map<String, CityOutcome> outcomes,
        int inserted,
        int skippedDuplicates
) {

    public RunResult {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public boolean isFatal() {
        return status == RunStatus.FATAL;
    }

    public long successCount() {
        return outcomes.values().stream().filter(CityOutcome::isSuccess).count();
    }

    public CityOutcome outcomeOf(String cityName) {
        return outcomes.get(cityName);
    }
}
