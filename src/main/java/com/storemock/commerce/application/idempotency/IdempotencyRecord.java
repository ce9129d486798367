package com.storemock.commerce.application.idempotency;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 멱등성 키 저장 항목 (요청 해시 + 최초 응답)
 */
@Getter
@AllArgsConstructor
public class IdempotencyRecord {

    private final String requestHash;
    private final IdempotentResponse response;

    public boolean matches(String requestHash) {
        return this.requestHash.equals(requestHash);
    }
}
