package com.storemock.commerce.domain.fulfillment;

import com.storemock.commerce.common.exception.DomainException;
import com.storemock.commerce.common.exception.ErrorCode;

/**
 * 배송지와 배송 옵션이 선택되지 않은 상태로 완료를 시도한 경우
 */
public class FulfillmentRequiredException extends DomainException {

    public FulfillmentRequiredException(String checkoutId) {
        super(ErrorCode.FULFILLMENT_REQUIRED, "checkoutId=" + checkoutId);
    }
}
