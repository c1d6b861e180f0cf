package com.example.weatheretl;

import com.example.weatheretl.weather.config.City;
import com.example.weatheretl.weather.config.WeatherEtlProperties;
import com.example.weatheretl.weather.service.WeatherService;
import com.example.weatheretl.weather.service.WeatherServiceImpl;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:weather-etl;DB_CLOSE_DELAY=-1",
        "weather.etl.cron=-",
        "weather.etl.provider.api-key=test-key"
})
class WeatherEtlApplicationTests {

    @Autowired
    private WeatherService weatherService;

    @Autowired
    private WeatherEtlProperties properties;

    @Test
    void contextLoads_andBindsRunConfiguration() {
        assertInstanceOf(WeatherServiceImpl.class, weatherService);
        assertEquals("test-key", properties.provider().apiKey());
        assertEquals("metric", properties.provider().units());
        assertEquals(Duration.ofSeconds(10), properties.provider().timeout());
        assertEquals(3, properties.retry().maxRetries());
        assertEquals(Duration.ofMinutes(10), properties.runTimeout());
        assertTrue(properties.loadCollectedOnAbort());
        assertEquals(new City("London", "London,GB"), properties.cities().get(0));
        assertEquals(5, properties.cities().size());
    }
}
