package com.example.weatheretl.weather.scheduler;

import com.example.weatheretl.weather.dto.CityOutcome;
import com.example.weatheretl.weather.dto.CityOutcome.Outcome;
import com.example.weatheretl.weather.dto.RunResult;
import com.example.weatheretl.weather.dto.RunStatus;
import com.example.weatheretl.weather.exception.RunInProgressException;
import com.example.weatheretl.weather.exception.WeatherRunFailedException;
import com.example.weatheretl.weather.service.WeatherService;
import com.example.weatheretl.weather.support.TestProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WeatherSchedulerTest {

    @Mock
    private WeatherService weatherService;

    private static RunResult result(RunStatus status) {
        Map<String, CityOutcome> outcomes = new LinkedHashMap<>();
        outcomes.put("London", CityOutcome.success(1));
        if (status != RunStatus.SUCCESS) {
            outcomes.put("Manchester", CityOutcome.failed(Outcome.FETCH_FAILED, "TIMEOUT", "timed out", 4));
        }
        Instant start = Instant.parse("2025-01-01T06:00:00Z");
        return new RunResult(start, start.plusSeconds(3), status, "test", outcomes, 1, 0);
    }

    @Test
    void collectDaily_success_completesNormally() {
        when(weatherService.runDailyEtl()).thenReturn(result(RunStatus.SUCCESS));
        WeatherScheduler scheduler = new WeatherScheduler(weatherService, TestProperties.defaults().build());

        assertDoesNotThrow(scheduler::collectDaily);
        verify(weatherService, times(1)).runDailyEtl();
    }

    @Test
    void collectDaily_partial_isToleratedByDefault() {
        when(weatherService.runDailyEtl()).thenReturn(result(RunStatus.PARTIAL));
        WeatherScheduler scheduler = new WeatherScheduler(weatherService, TestProperties.defaults().build());

        assertDoesNotThrow(scheduler::collectDaily);
    }

    @Test
    void collectDaily_partial_failsWhenConfigured() {
        when(weatherService.runDailyEtl()).thenReturn(result(RunStatus.PARTIAL));
        WeatherScheduler scheduler = new WeatherScheduler(weatherService,
                TestProperties.defaults().failOnPartial(true).build());

        WeatherRunFailedException e = assertThrows(WeatherRunFailedException.class, scheduler::collectDaily);
        assertEquals(RunStatus.PARTIAL, e.getResult().status());
    }

    @Test
    void collectDaily_fatal_isSurfaced() {
        when(weatherService.runDailyEtl()).thenReturn(result(RunStatus.FATAL));
        WeatherScheduler scheduler = new WeatherScheduler(weatherService, TestProperties.defaults().build());

        assertThrows(WeatherRunFailedException.class, scheduler::collectDaily);
    }

    @Test
    void collectDaily_runAlreadyActive_isSkipped() {
        when(weatherService.runDailyEtl()).thenThrow(new RunInProgressException());
        WeatherScheduler scheduler = new WeatherScheduler(weatherService, TestProperties.defaults().build());

        assertDoesNotThrow(scheduler::collectDaily);
    }
}
