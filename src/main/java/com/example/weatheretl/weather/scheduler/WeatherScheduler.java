package com.example.weatheretl.weather.scheduler;

import com.example.weatheretl.weather.config.WeatherEtlProperties;
import com.example.weatheretl.weather.dto.CityOutcome;
import com.example.weatheretl.weather.dto.RunResult;
import com.example.weatheretl.weather.dto.RunStatus;
import com.example.weatheretl.weather.exception.RunInProgressException;
import com.example.weatheretl.weather.exception.WeatherRunFailedException;
import com.example.weatheretl.weather.service.WeatherService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class WeatherScheduler {

    private final WeatherService weatherService;
    private final WeatherEtlProperties properties;

    // 기본: 매일 06:00 UTC 에 설정된 도시들의 현재 날씨 저장
    @Scheduled(cron = "${weather.etl.cron:0 0 6 * * *}", zone = "${weather.etl.zone:UTC}")
    public void collectDaily() {
        log.info("Scheduler 실행");
        RunResult result;
        try {
            result = weatherService.runDailyEtl();
        } catch (RunInProgressException e) {
            log.warn("이미 실행 중이라 이번 스케줄은 건너뜀: {}", e.getMessage());
            return;
        }

        report(result);

        if (result.status().isFailure() || (properties.failOnPartial() && result.status() == RunStatus.PARTIAL)) {
            throw new WeatherRunFailedException(result);
        }
    }

    private void report(RunResult result) {
        long millis = Duration.between(result.startedAt(), result.finishedAt()).toMillis();
        String summary = "날씨 ETL " + result.status() + " (" + millis + "ms): 도시 "
                + result.successCount() + "/" + result.outcomes().size() + " 성공, "
                + result.inserted() + "건 저장, " + result.skippedDuplicates() + "건 중복";

        if (result.isFatal()) {
            log.error("{} - {}", summary, result.message());
        } else if (result.status() == RunStatus.SUCCESS) {
            log.info(summary);
        } else {
            log.warn("{} - {}", summary, result.message());
        }

        for (Map.Entry<String, CityOutcome> entry : result.outcomes().entrySet()) {
            CityOutcome outcome = entry.getValue();
            if (!outcome.isSuccess()) {
                log.warn("  {}: {} [{}] {}", entry.getKey(), outcome.outcome(), outcome.errorKind(), outcome.detail());
            }
        }
    }
}
