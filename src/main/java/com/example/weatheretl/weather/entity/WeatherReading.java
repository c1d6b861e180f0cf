package com.example.weatheretl.weather.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;

/**
 * 정규화된 관측값. (city_name, observed_at) 유니크, 저장 후 수정/삭제하지 않음
 */
@Entity
@Immutable
@Table(name = "weather",
        uniqueConstraints = @UniqueConstraint(name = "uk_weather_city_observed_at",
                columnNames = {"city_name", "observed_at"}))
@Getter
@Builder
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WeatherReading {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "city_name", nullable = false)
    private String cityName;

    // API 가 알려준 관측 시각 (UTC). 수집 시각 아님
    @Column(name = "observed_at", nullable = false)
    private OffsetDateTime observedAt;

    // 섭씨, 소수 둘째 자리
    @Column(nullable = false, columnDefinition = "numeric(7, 2)")
    private Double temperature;

    @Column(nullable = false)
    private Integer humidity;

    @Column(nullable = false, columnDefinition = "text")
    private String description;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
