package com.storemock.commerce.application.idempotency;

import com.storemock.commerce.common.exception.ApplicationException;
import com.storemock.commerce.common.exception.ErrorCode;

/**
 * 같은 멱등성 키를 다른 요청 본문으로 재사용한 경우
 */
public class IdempotencyConflictException extends ApplicationException {

    public IdempotencyConflictException(String idempotencyKey) {
        super(ErrorCode.IDEMPOTENCY_CONFLICT, "key=" + idempotencyKey);
    }
}
