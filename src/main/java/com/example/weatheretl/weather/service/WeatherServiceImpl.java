package com.example.weatheretl.weather.service;

import com.example.weatheretl.weather.client.WeatherFetcher;
import com.example.weatheretl.weather.config.City;
import com.example.weatheretl.weather.config.WeatherEtlProperties;
import com.example.weatheretl.weather.dto.CityOutcome;
import com.example.weatheretl.weather.dto.CityOutcome.Outcome;
import com.example.weatheretl.weather.dto.LoadResult;
import com.example.weatheretl.weather.dto.RawObservation;
import com.example.weatheretl.weather.dto.RunResult;
import com.example.weatheretl.weather.dto.RunStatus;
import com.example.weatheretl.weather.entity.WeatherReading;
import com.example.weatheretl.weather.exception.FatalConfigurationException;
import com.example.weatheretl.weather.exception.FetchErrorKind;
import com.example.weatheretl.weather.exception.FetchException;
import com.example.weatheretl.weather.exception.LoadException;
import com.example.weatheretl.weather.exception.RunInProgressException;
import com.example.weatheretl.weather.exception.TransformException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@Service
@RequiredArgsConstructor
public class WeatherServiceImpl implements WeatherService {

    private final WeatherFetcher weatherFetcher;
    private final WeatherTransformer weatherTransformer;
    private final WeatherLoader weatherLoader;
    private final WeatherEtlProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;

    private final ReentrantLock runLock = new ReentrantLock();

    @Override
    public RunResult runDailyEtl() {
        if (!runLock.tryLock()) {
            throw new RunInProgressException();
        }
        try {
            return execute();
        } finally {
            runLock.unlock();
        }
    }

    private RunResult execute() {
        Instant startedAt = clock.instant();
        List<City> cities = properties.cities();

        RetryPolicy retryPolicy;
        try {
            retryPolicy = validate();
        } catch (FatalConfigurationException e) {
            log.error("설정 오류로 런 중단: {}", e.getMessage());
            return finish(startedAt, RunStatus.FATAL, e.getMessage(), skipAll(cities, "configuration invalid"), LoadResult.empty());
        }

        log.info("날씨 ETL 시작: 도시 {}개", cities.size());
        RunState state = new RunState(startedAt.plus(properties.runTimeout()), retryPolicy);

        List<CityResult> results;
        try {
            results = processCities(cities, state);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("런이 인터럽트됨. 저장하지 않음");
            return finish(startedAt, RunStatus.CANCELLED, "Run interrupted", skipAll(cities, "run interrupted"), LoadResult.empty());
        }

        List<CityResult> collected = results.stream().filter(r -> r.reading() != null).toList();
        Map<String, CityOutcome> loadOutcomes = new HashMap<>();
        LoadResult loadResult = LoadResult.empty();
        LoadException loadFailure = null;

        if (Thread.currentThread().isInterrupted()) {
            state.cancel("Run interrupted");
        }

        if (state.isCancelled()) {
            collected.forEach(r -> loadOutcomes.put(r.city().name(), CityOutcome.skipped("not loaded: run cancelled")));
        } else if (state.isAborted() && !properties.loadCollectedOnAbort()) {
            collected.forEach(r -> loadOutcomes.put(r.city().name(), CityOutcome.skipped("not loaded: run aborted")));
        } else if (!collected.isEmpty()) {
            try {
                loadResult = weatherLoader.load(collected.stream().map(CityResult::reading).toList());
                collected.forEach(r -> loadOutcomes.put(r.city().name(), CityOutcome.success(r.attempts())));
            } catch (LoadException e) {
                loadFailure = e;
                log.error("{}건 저장 실패 ({}): {}", collected.size(), e.getKind(), e.getDetail());
                collected.forEach(r -> loadOutcomes.put(r.city().name(),
                        CityOutcome.failed(Outcome.LOAD_FAILED, e.getKind().name(), e.getDetail(), r.attempts())));
            }
        }

        Map<String, CityOutcome> outcomes = new LinkedHashMap<>();
        for (CityResult result : results) {
            CityOutcome outcome = result.reading() != null ? loadOutcomes.get(result.city().name()) : result.outcome();
            outcomes.put(result.city().name(), outcome);
        }

        if (state.isCancelled()) {
            return finish(startedAt, RunStatus.CANCELLED, state.reason(), outcomes, loadResult);
        }
        if (state.isAborted()) {
            return finish(startedAt, RunStatus.FATAL, state.reason(), outcomes, loadResult);
        }

        long successes = outcomes.values().stream().filter(CityOutcome::isSuccess).count();
        if (successes == cities.size()) {
            return finish(startedAt, RunStatus.SUCCESS, "All " + successes + " cities loaded", outcomes, loadResult);
        }
        if (successes > 0) {
            return finish(startedAt, RunStatus.PARTIAL, successes + " of " + cities.size() + " cities loaded", outcomes, loadResult);
        }
        String message = loadFailure != null
                ? "Load failed (" + loadFailure.getKind() + "): " + loadFailure.getDetail()
                : "No city could be fetched and transformed";
        return finish(startedAt, RunStatus.FAILED, message, outcomes, loadResult);
    }

    private List<CityResult> processCities(List<City> cities, RunState state) throws InterruptedException {
        int concurrency = Math.min(properties.fetchConcurrency(), cities.size());
        if (concurrency <= 1) {
            List<CityResult> results = new ArrayList<>();
            for (City city : cities) {
                results.add(processCity(city, state));
            }
            return results;
        }

        ExecutorService pool = Executors.newFixedThreadPool(concurrency);
        try {
            List<Future<CityResult>> futures = new ArrayList<>();
            for (City city : cities) {
                futures.add(pool.submit(() -> processCity(city, state)));
            }
            List<CityResult> results = new ArrayList<>();
            for (int i = 0; i < cities.size(); i++) {
                City city = cities.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    log.error("{} 처리 중 예상치 못한 오류", city.name(), e.getCause());
                    results.add(CityResult.failed(city, CityOutcome.failed(Outcome.FETCH_FAILED, "UNEXPECTED",
                            String.valueOf(e.getCause()), 0)));
                }
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private CityResult processCity(City city, RunState state) throws InterruptedException {
        RetryPolicy retryPolicy = state.retryPolicy();
        RawObservation raw = null;
        int attempt = 0;

        while (raw == null) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Run interrupted before fetching " + city.name());
            }
            if (state.isAborted()) {
                return CityResult.failed(city, CityOutcome.skipped("run aborted: " + state.reason()));
            }
            if (!clock.instant().isBefore(state.deadline())) {
                state.cancel("Run deadline of " + properties.runTimeout() + " exceeded");
                return CityResult.failed(city, CityOutcome.skipped("run deadline exceeded"));
            }

            attempt++;
            try {
                raw = weatherFetcher.fetch(city);
            } catch (FetchException e) {
                if (e.getKind() == FetchErrorKind.UNAUTHORIZED) {
                    state.abort("Provider rejected credentials while fetching " + city.name());
                    log.error("인증 실패로 런 중단: {}", e.getMessage());
                    return CityResult.failed(city,
                            CityOutcome.failed(Outcome.FETCH_FAILED, e.getKind().name(), e.getMessage(), attempt));
                }
                if (!e.isRetryable() || attempt >= retryPolicy.maxAttempts()) {
                    log.warn("{} 조회 실패 ({}회 시도): {}", city.name(), attempt, e.getMessage());
                    return CityResult.failed(city,
                            CityOutcome.failed(Outcome.FETCH_FAILED, e.getKind().name(), e.getMessage(), attempt));
                }
                Duration backoff = retryPolicy.backoffBefore(attempt);
                Duration remaining = Duration.between(clock.instant(), state.deadline());
                log.warn("{} 조회 실패 ({}), {}ms 후 재시도 {}/{}",
                        city.name(), e.getKind(), backoff.toMillis(), attempt, retryPolicy.maxRetries());
                // 대기는 런 마감 시각을 넘기지 않음
                Duration wait = backoff.compareTo(remaining) < 0 ? backoff : remaining;
                if (!wait.isNegative()) {
                    sleeper.sleep(wait);
                }
            } catch (RuntimeException e) {
                log.error("{} 조회 중 예상치 못한 오류", city.name(), e);
                return CityResult.failed(city,
                        CityOutcome.failed(Outcome.FETCH_FAILED, "UNEXPECTED", e.toString(), attempt));
            }
        }

        try {
            return CityResult.transformed(city, weatherTransformer.transform(raw), attempt);
        } catch (TransformException e) {
            log.warn("{} 관측값 버림: {}", city.name(), e.getMessage());
            return CityResult.failed(city,
                    CityOutcome.failed(Outcome.TRANSFORM_FAILED, e.getField(), e.getReason(), attempt));
        }
    }

    private RetryPolicy validate() {
        WeatherEtlProperties.Provider provider = properties.provider();
        if (isBlank(provider.apiKey())) {
            throw new FatalConfigurationException("weather.etl.provider.api-key is not set");
        }
        if (isBlank(provider.baseUrl())) {
            throw new FatalConfigurationException("weather.etl.provider.base-url is not set");
        }
        if (TemperatureUnit.fromProviderUnits(provider.units()).isEmpty()) {
            throw new FatalConfigurationException("Unknown unit system: " + provider.units());
        }
        if (properties.cities().isEmpty()) {
            throw new FatalConfigurationException("No cities configured under weather.etl.cities");
        }
        Set<String> names = new HashSet<>();
        for (City city : properties.cities()) {
            if (isBlank(city.name())) {
                throw new FatalConfigurationException("A configured city has no name");
            }
            if (isBlank(city.query())) {
                throw new FatalConfigurationException("City " + city.name() + " has no query");
            }
            if (!names.add(city.name())) {
                throw new FatalConfigurationException("Duplicate city name: " + city.name());
            }
        }
        try {
            return RetryPolicy.from(properties.retry());
        } catch (IllegalArgumentException e) {
            throw new FatalConfigurationException("Invalid retry settings: " + e.getMessage());
        }
    }

    private RunResult finish(Instant startedAt, RunStatus status, String message,
                             Map<String, CityOutcome> outcomes, LoadResult loadResult) {
        RunResult result = new RunResult(startedAt, clock.instant(), status, message, outcomes,
                loadResult.inserted(), loadResult.skipped());
        log.info("날씨 ETL 종료: {} ({})", status, message);
        return result;
    }

    private static Map<String, CityOutcome> skipAll(List<City> cities, String detail) {
        Map<String, CityOutcome> outcomes = new LinkedHashMap<>();
        for (City city : cities) {
            if (city != null && !isBlank(city.name())) {
                outcomes.putIfAbsent(city.name(), CityOutcome.skipped(detail));
            }
        }
        return outcomes;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record CityResult(City city, WeatherReading reading, CityOutcome outcome, int attempts) {

        static CityResult transformed(City city, WeatherReading reading, int attempts) {
            return new CityResult(city, reading, null, attempts);
        }

        static CityResult failed(City city, CityOutcome outcome) {
            return new CityResult(city, null, outcome, outcome.attempts());
        }
    }

    /**
     * 런 전체에서 공유되는 상태. 병렬 fetch 시 여러 스레드가 함께 봄
     */
    private static final class RunState {

        private final Instant deadline;
        private final RetryPolicy retryPolicy;
        private final AtomicReference<RunStatus> terminal = new AtomicReference<>();
        private volatile String reason;

        RunState(Instant deadline, RetryPolicy retryPolicy) {
            this.deadline = deadline;
            this.retryPolicy = retryPolicy;
        }

        Instant deadline() {
            return deadline;
        }

        RetryPolicy retryPolicy() {
            return retryPolicy;
        }

        void abort(String reason) {
            if (terminal.compareAndSet(null, RunStatus.FATAL)) {
                this.reason = reason;
            }
        }

        void cancel(String reason) {
            if (terminal.compareAndSet(null, RunStatus.CANCELLED)) {
                this.reason = reason;
            }
        }

        boolean isAborted() {
            return terminal.get() == RunStatus.FATAL;
        }

        boolean isCancelled() {
            return terminal.get() == RunStatus.CANCELLED;
        }

        String reason() {
            return reason;
        }
    }
}
