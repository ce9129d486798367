package com.storemock.commerce.domain.fulfillment;

import com.storemock.commerce.common.exception.DomainException;
import com.storemock.commerce.common.exception.ErrorCode;

/**
 * 알 수 없는 배송 방법/요율을 선택한 경우 (ValidationError)
 */
public class InvalidFulfillmentMethodException extends DomainException {

    public InvalidFulfillmentMethodException(String detail) {
        super(ErrorCode.INVALID_FULFILLMENT_METHOD, detail);
    }
}
