package com.example.weatheretl.weather.config;

import com.example.weatheretl.weather.service.Sleeper;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class WeatherEtlConfig {

    // 요청 하나당 connect/read 모두 provider.timeout 으로 제한
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, WeatherEtlProperties properties) {
        return builder
                .connectTimeout(properties.provider().timeout())
                .readTimeout(properties.provider().timeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}
