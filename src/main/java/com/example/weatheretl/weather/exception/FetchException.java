package com.example.weatheretl.weather.exception;

import lombok.Getter;

/**
 * 날씨 API 호출 실패.
 * HTTP 응답이 있었던 경우에만 status 가 채워짐
 */
@Getter
public class FetchException extends RuntimeException {

    private final FetchErrorKind kind;
    private final Integer status;

    public FetchException(FetchErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public FetchException(FetchErrorKind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    public FetchException(FetchErrorKind kind, Integer status, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
    }

    /**
     * 같은 런 안에서 다시 시도할지. 인증 실패만 제외 (런 전체를 중단시킴)
     */
    public boolean isRetryable() {
        return kind != FetchErrorKind.UNAUTHORIZED;
    }
}
