package com.storemock.commerce.domain.order;

import com.storemock.commerce.common.exception.DomainException;
import com.storemock.commerce.common.exception.ErrorCode;

public class InvalidOrderStatusException extends DomainException {

    public InvalidOrderStatusException(String orderId, String detail) {
        super(ErrorCode.INVALID_ORDER_STATUS, "orderId=" + orderId + ", " + detail);
    }
}
