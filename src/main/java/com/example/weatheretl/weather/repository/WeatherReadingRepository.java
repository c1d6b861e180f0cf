package com.example.weatheretl.weather.repository;

import com.example.weatheretl.weather.entity.WeatherReading;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface WeatherReadingRepository extends JpaRepository<WeatherReading, Long> {

    boolean existsByCityNameAndObservedAt(String cityName, OffsetDateTime observedAt);

    List<WeatherReading> findByCityNameOrderByObservedAtDesc(String cityName, Pageable pageable);

    long countByCityName(String cityName);
}
