package com.storemock.commerce.common.exception;

/**
 * ErrorKind - 호출자가 구분할 수 있는 에러 종류
 *
 * 메시지 문자열이 아니라 이 값으로 실패 유형을 판별합니다.
 */
public enum ErrorKind {
    NOT_FOUND,
    VALIDATION_ERROR,
    FULFILLMENT_REQUIRED,
    PAYMENT_FAILURE,
    IDEMPOTENCY_CONFLICT,
    INVALID_STATE,
    FORBIDDEN,
    SYSTEM
}
