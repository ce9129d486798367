package com.storemock.commerce.domain.order;

import com.storemock.commerce.common.exception.DomainException;
import com.storemock.commerce.common.exception.ErrorCode;

public class OrderNotFoundException extends DomainException {

    public OrderNotFoundException(String orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "orderId=" + orderId);
    }
}
