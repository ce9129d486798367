package com.storemock.commerce.domain.product;

import com.storemock.commerce.common.exception.DomainException;
import com.storemock.commerce.common.exception.ErrorCode;

public class InvalidQuantityException extends DomainException {

    public InvalidQuantityException(int quantity) {
        super(ErrorCode.INVALID_QUANTITY, "quantity=" + quantity);
    }
}
