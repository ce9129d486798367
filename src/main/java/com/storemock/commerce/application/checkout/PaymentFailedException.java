package com.storemock.commerce.application.checkout;

import com.storemock.commerce.common.exception.ApplicationException;
import com.storemock.commerce.common.exception.ErrorCode;

/**
 * 결제 승인 실패 (실패 유도용 결제수단 사용 시)
 * 체크아웃은 incomplete 상태로 남으며 다른 결제수단으로 재시도할 수 있습니다.
 */
public class PaymentFailedException extends ApplicationException {

    public PaymentFailedException(String checkoutId, String instrumentId) {
        super(ErrorCode.PAYMENT_FAILED, "checkoutId=" + checkoutId + ", instrumentId=" + instrumentId);
    }
}
