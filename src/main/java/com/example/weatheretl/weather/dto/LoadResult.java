package com.example.weatheretl.weather.dto;

/**
 * @param inserted 새로 저장된 행 수
 * @param skipped  (city_name, observed_at) 가 이미 있어서 건너뛴 수
 */
public record LoadResult(int inserted, int skipped) {

    public static LoadResult empty() {
        return new LoadResult(0, 0);
    }
}
