package com.storemock.commerce.domain.checkout;

import com.storemock.commerce.common.exception.DomainException;
import com.storemock.commerce.common.exception.ErrorCode;

/**
 * 현재 상태에서 허용되지 않는 체크아웃 요청
 * (종료 상태의 체크아웃 변경, 중복 완료/취소 등)
 */
public class InvalidCheckoutStatusException extends DomainException {

    public InvalidCheckoutStatusException(String checkoutId, CheckoutStatus status, String action) {
        super(ErrorCode.INVALID_CHECKOUT_STATUS,
                String.format("checkoutId=%s, status=%s, action=%s", checkoutId, status.getValue(), action));
    }
}
