package com.storemock.commerce.application.idempotency;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 멱등 처리 대상 응답 (HTTP 상태 + 응답 본문)
 * 같은 키로 재요청하면 이 객체가 그대로 다시 직렬화됩니다.
 */
@Getter
@AllArgsConstructor
public class IdempotentResponse {

    private final int status;
    private final Object body;

    public static IdempotentResponse ok(Object body) {
        return new IdempotentResponse(200, body);
    }

    public static IdempotentResponse created(Object body) {
        return new IdempotentResponse(201, body);
    }
}
