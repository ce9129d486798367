package com.storemock.commerce.domain.webhook;

/**
 * 웹훅 전송 결과
 * - DELIVERED: 2xx 응답
 * - FAILED: 비정상 응답 또는 전송 오류
 * - SKIPPED: 에이전트 참조 또는 웹훅 URL 없음
 */
public enum DeliveryOutcome {
    DELIVERED,
    FAILED,
    SKIPPED
}
