package com.example.weatheretl.weather.controller;

import com.example.weatheretl.weather.dto.RunResult;
import com.example.weatheretl.weather.entity.WeatherReading;
import com.example.weatheretl.weather.exception.RunInProgressException;
import com.example.weatheretl.weather.repository.WeatherReadingRepository;
import com.example.weatheretl.weather.service.WeatherService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/weather")
@RequiredArgsConstructor
public class WeatherController {

    static final int MAX_LIMIT = 500;

    private final WeatherService weatherService;
    private final WeatherReadingRepository weatherReadingRepository;

    /**
     * 설정된 도시 전체를 즉시 수집
     * POST /api/weather/runs
     */
    @PostMapping("/runs")
    public ResponseEntity<RunResult> runNow() {
        RunResult result = weatherService.runDailyEtl();
        HttpStatus status = result.status().isFailure() ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    /**
     * 도시별 최근 관측값 (최신순)
     * GET /api/weather/readings?city=London&limit=24
     */
    @GetMapping("/readings")
    public List<WeatherReading> readings(@RequestParam String city,
                                         @RequestParam(defaultValue = "24") int limit) {
        int size = Math.max(1, Math.min(limit, MAX_LIMIT));
        return weatherReadingRepository.findByCityNameOrderByObservedAtDesc(city, PageRequest.of(0, size));
    }

    @ExceptionHandler(RunInProgressException.class)
    public ResponseEntity<Map<String, String>> runInProgress(RunInProgressException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }
}
