package com.storemock.commerce.domain.checkout;

import com.storemock.commerce.common.exception.DomainException;
import com.storemock.commerce.common.exception.ErrorCode;

public class EmptyCheckoutException extends DomainException {

    public EmptyCheckoutException(String checkoutId) {
        super(ErrorCode.EMPTY_CHECKOUT, "checkoutId=" + checkoutId);
    }
}
