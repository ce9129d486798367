package com.storemock.commerce.domain.checkout;

import com.storemock.commerce.common.exception.DomainException;
import com.storemock.commerce.common.exception.ErrorCode;

public class CheckoutNotFoundException extends DomainException {

    public CheckoutNotFoundException(String checkoutId) {
        super(ErrorCode.CHECKOUT_NOT_FOUND, "checkoutId=" + checkoutId);
    }
}
