package com.example.weatheretl.weather.service;

import com.example.weatheretl.weather.dto.MainDTO;
import com.example.weatheretl.weather.dto.OpenWeatherResponse;
import com.example.weatheretl.weather.dto.RawObservation;
import com.example.weatheretl.weather.dto.WeatherConditionDTO;
import com.example.weatheretl.weather.entity.WeatherReading;
import com.example.weatheretl.weather.exception.TransformException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * API 응답 원본을 WeatherReading 으로 변환.
 * I/O 없음, 같은 입력이면 항상 같은 결과. 범위를 벗어난 값은 보정하지 않고 거부함
 */
@Component
public class WeatherTransformer {

    static final int MAX_DESCRIPTION_LENGTH = 255;

    public WeatherReading transform(RawObservation raw) {
        OpenWeatherResponse payload = raw.payload();
        if (payload == null) {
            throw new TransformException("payload", "missing");
        }

        TemperatureUnit unit = TemperatureUnit.fromProviderUnits(raw.units())
                .orElseThrow(() -> new TransformException("units", "unknown unit system '" + raw.units() + "'"));

        MainDTO main = payload.getMain();
        if (main == null) {
            throw new TransformException("main", "missing");
        }

        Double temp = main.getTemp();
        if (temp == null) {
            throw new TransformException("temperature", "missing");
        }
        if (!Double.isFinite(temp)) {
            throw new TransformException("temperature", "not a finite number: " + temp);
        }

        Integer humidity = main.getHumidity();
        if (humidity == null) {
            throw new TransformException("humidity", "missing");
        }
        if (humidity < 0 || humidity > 100) {
            throw new TransformException("humidity", "out of range 0-100: " + humidity);
        }

        String description = firstDescription(payload.getWeather());
        if (description.isEmpty()) {
            throw new TransformException("description", "missing or empty");
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new TransformException("description", "longer than " + MAX_DESCRIPTION_LENGTH + " characters");
        }

        Long dt = payload.getDt();
        if (dt == null || dt <= 0) {
            throw new TransformException("observedAt", "missing or non-positive timestamp: " + dt);
        }
        OffsetDateTime observedAt = OffsetDateTime.ofInstant(Instant.ofEpochSecond(dt), ZoneOffset.UTC);

        return WeatherReading.builder()
                .cityName(raw.city().name())
                .observedAt(observedAt)
                .temperature(round2(unit.toCelsius(temp)))
                .humidity(humidity)
                .description(description)
                .build();
    }

    private static String firstDescription(List<WeatherConditionDTO> conditions) {
        if (conditions == null || conditions.isEmpty() || conditions.get(0) == null) {
            return "";
        }
        String description = conditions.get(0).getDescription();
        return description == null ? "" : description.trim();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
