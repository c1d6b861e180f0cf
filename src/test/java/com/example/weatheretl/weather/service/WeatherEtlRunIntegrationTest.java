package com.example.weatheretl.weather.service;

import com.example.weatheretl.weather.client.WeatherFetcher;
import com.example.weatheretl.weather.config.City;
import com.example.weatheretl.weather.config.WeatherEtlProperties;
import com.example.weatheretl.weather.dto.CityOutcome.Outcome;
import com.example.weatheretl.weather.dto.RawObservation;
import com.example.weatheretl.weather.dto.RunResult;
import com.example.weatheretl.weather.dto.RunStatus;
import com.example.weatheretl.weather.entity.WeatherReading;
import com.example.weatheretl.weather.exception.FetchErrorKind;
import com.example.weatheretl.weather.exception.FetchException;
import com.example.weatheretl.weather.repository.WeatherReadingRepository;
import com.example.weatheretl.weather.support.MutableClock;
import com.example.weatheretl.weather.support.RecordingSleeper;
import com.example.weatheretl.weather.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 가짜 fetcher + 실제 JPA 로더로 한 런 전체를 돌림
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class WeatherEtlRunIntegrationTest {

    private static final City LONDON = new City("London", "London,GB");
    private static final City MANCHESTER = new City("Manchester", "Manchester,GB");
    private static final OffsetDateTime T0 = OffsetDateTime.parse("2023-11-14T22:13:20Z");

    @Autowired
    private WeatherReadingRepository repository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    private RunResult run(WeatherFetcher fetcher) {
        WeatherEtlProperties properties = TestProperties.defaults().cities(LONDON, MANCHESTER).build();
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T06:00:00Z"));
        WeatherServiceImpl service = new WeatherServiceImpl(
                fetcher,
                new WeatherTransformer(),
                new JpaWeatherLoader(repository, transactionManager, properties),
                properties,
                clock,
                new RecordingSleeper(clock));
        return service.runDailyEtl();
    }

    private static RawObservation londonRain() {
        return new RawObservation(LONDON, "standard",
                WeatherTransformerTest.payload(280.1, 81, "light rain", T0.toEpochSecond()));
    }

    @Test
    void unauthorizedSecondCity_abortsButKeepsFirstCityReading() {
        RunResult result = run(city -> {
            if (city.equals(LONDON)) {
                return londonRain();
            }
            throw new FetchException(FetchErrorKind.UNAUTHORIZED, 401, "Provider rejected the API key (HTTP 401)", null);
        });

        assertEquals(RunStatus.FATAL, result.status());
        assertEquals(Outcome.SUCCESS, result.outcomeOf("London").outcome());
        assertEquals("UNAUTHORIZED", result.outcomeOf("Manchester").errorKind());

        List<WeatherReading> rows = repository.findAll();
        assertEquals(1, rows.size());
        assertEquals("London", rows.get(0).getCityName());
        assertEquals(T0.toInstant(), rows.get(0).getObservedAt().toInstant());
        assertEquals(6.95, rows.get(0).getTemperature(), 1e-9);
    }

    @Test
    void retryableFailure_otherCityStillStored() {
        RunResult result = run(city -> {
            if (city.equals(MANCHESTER)) {
                throw new FetchException(FetchErrorKind.HTTP, 503, "Provider returned HTTP 503", null);
            }
            return londonRain();
        });

        assertEquals(RunStatus.PARTIAL, result.status());
        assertEquals(Outcome.FETCH_FAILED, result.outcomeOf("Manchester").outcome());
        assertEquals(Outcome.SUCCESS, result.outcomeOf("London").outcome());
        assertEquals(1, repository.countByCityName("London"));
        assertEquals(0, repository.countByCityName("Manchester"));
    }

    @Test
    void rerunWithSameObservation_doesNotDuplicate() {
        WeatherFetcher fetcher = city -> new RawObservation(city, "metric",
                WeatherTransformerTest.payload(7.0, 80, "overcast clouds", T0.toEpochSecond()));

        RunResult first = run(fetcher);
        RunResult second = run(fetcher);

        assertEquals(RunStatus.SUCCESS, first.status());
        assertEquals(2, first.inserted());
        assertEquals(RunStatus.SUCCESS, second.status());
        assertEquals(0, second.inserted());
        assertEquals(2, second.skippedDuplicates());
        assertEquals(2, repository.count());
    }
}
