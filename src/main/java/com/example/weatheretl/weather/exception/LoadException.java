package com.example.weatheretl.weather.exception;

import lombok.Getter;

/**
 * 배치 저장 실패. 던져지는 시점에 트랜잭션은 이미 롤백된 상태
 */
@Getter
public class LoadException extends RuntimeException {

    private final LoadErrorKind kind;

    public LoadException(LoadErrorKind kind, String detail, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
    }

    public String getDetail() {
        return getMessage();
    }
}
