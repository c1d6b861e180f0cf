package com.example.weatheretl.weather.service;

import com.example.weatheretl.weather.config.WeatherEtlProperties;
import com.example.weatheretl.weather.dto.LoadResult;
import com.example.weatheretl.weather.entity.WeatherReading;
import com.example.weatheretl.weather.exception.LoadErrorKind;
import com.example.weatheretl.weather.exception.LoadException;
import com.example.weatheretl.weather.repository.WeatherReadingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedRuntimeException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
public class JpaWeatherLoader implements WeatherLoader {

    private final WeatherReadingRepository weatherReadingRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaWeatherLoader(WeatherReadingRepository weatherReadingRepository,
                            PlatformTransactionManager transactionManager,
                            WeatherEtlProperties properties) {
        this.weatherReadingRepository = weatherReadingRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout((int) Math.max(1, properties.loadTimeout().toSeconds()));
    }

    @Override
    public LoadResult load(List<WeatherReading> readings) {
        if (readings.isEmpty()) {
            return LoadResult.empty();
        }
        try {
            LoadResult result = transactionTemplate.execute(status -> insertMissing(readings));
            log.info("저장 완료: {}건 저장, {}건 이미 있음", result.inserted(), result.skipped());
            return result;
        } catch (DataIntegrityViolationException e) {
            throw failure(LoadErrorKind.CONSTRAINT_VIOLATION, e);
        } catch (InvalidDataAccessResourceUsageException e) {
            throw failure(LoadErrorKind.SCHEMA_MISMATCH, e);
        } catch (QueryTimeoutException | TransactionTimedOutException e) {
            throw failure(LoadErrorKind.TIMEOUT, e);
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw failure(LoadErrorKind.STORE_UNAVAILABLE, e);
        } catch (DataAccessException | TransactionException e) {
            throw failure(LoadErrorKind.STORE_ERROR, e);
        }
    }

    private LoadResult insertMissing(List<WeatherReading> readings) {
        Set<Key> seen = new HashSet<>();
        int inserted = 0;
        int skipped = 0;

        for (WeatherReading reading : readings) {
            Key key = new Key(reading.getCityName(), reading.getObservedAt());

            // 같은 배치 안의 중복 또는 이전 런에서 이미 저장된 관측
            if (!seen.add(key)
                    || weatherReadingRepository.existsByCityNameAndObservedAt(key.cityName(), key.observedAt())) {
                skipped++;
                continue;
            }

            weatherReadingRepository.save(reading);
            inserted++;
        }
        weatherReadingRepository.flush();
        return new LoadResult(inserted, skipped);
    }

    private LoadException failure(LoadErrorKind kind, NestedRuntimeException e) {
        log.error("배치 롤백 ({}): {}", kind, e.getMessage());
        return new LoadException(kind, e.getMostSpecificCause().getMessage(), e);
    }

    private record Key(String cityName, OffsetDateTime observedAt) {
    }
}
