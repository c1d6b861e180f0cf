package com.example.weatheretl.weather.client;

import com.example.weatheretl.weather.config.City;
import com.example.weatheretl.weather.config.WeatherEtlProperties;
import com.example.weatheretl.weather.dto.OpenWeatherResponse;
import com.example.weatheretl.weather.dto.RawObservation;
import com.example.weatheretl.weather.exception.FetchErrorKind;
import com.example.weatheretl.weather.exception.FetchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;

@Slf4j
@Component
public class OpenWeatherFetcher implements WeatherFetcher {

    private final RestTemplate restTemplate;
    private final WeatherEtlProperties.Provider provider;
    // 습도 81.7 같은 값을 81 로 잘라 받지 않음
    private final ObjectMapper objectMapper = new ObjectMapper()
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    public OpenWeatherFetcher(RestTemplate restTemplate, WeatherEtlProperties properties) {
        this.restTemplate = restTemplate;
        this.provider = properties.provider();
    }

    @Override
    public RawObservation fetch(City city) {
        URI uri = UriComponentsBuilder.fromUriString(provider.baseUrl())
                .queryParam("q", city.query())
                .queryParam("units", provider.units())
                .queryParam("appid", provider.apiKey())
                .build()
                .encode()
                .toUri();

        log.debug("{} 현재 날씨 조회 (q={})", city.name(), city.query());

        String body;
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            body = response.getBody();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
                throw new FetchException(FetchErrorKind.UNAUTHORIZED, status,
                        "Provider rejected the API key (HTTP " + status + ")", e);
            }
            throw new FetchException(FetchErrorKind.HTTP, status,
                    "Provider returned HTTP " + status + " for " + city.name(), e);
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                throw new FetchException(FetchErrorKind.TIMEOUT,
                        "Request for " + city.name() + " timed out after " + provider.timeout(), e);
            }
            throw new FetchException(FetchErrorKind.CONNECTION,
                    "Could not reach provider for " + city.name() + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new FetchException(FetchErrorKind.INVALID_RESPONSE,
                    "Unreadable response for " + city.name() + ": " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new FetchException(FetchErrorKind.INVALID_RESPONSE, "Empty response body for " + city.name());
        }

        try {
            OpenWeatherResponse payload = objectMapper.readValue(body, OpenWeatherResponse.class);
            if (payload == null) {
                throw new FetchException(FetchErrorKind.INVALID_RESPONSE, "Null JSON document for " + city.name());
            }
            return new RawObservation(city, provider.units(), payload);
        } catch (JsonProcessingException e) {
            throw new FetchException(FetchErrorKind.INVALID_RESPONSE,
                    "Malformed JSON for " + city.name() + ": " + e.getOriginalMessage(), e);
        }
    }

    private boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
