package com.storemock.commerce.domain.checkout;

import com.storemock.commerce.common.exception.DomainException;
import com.storemock.commerce.common.exception.ErrorCode;

public class LineItemNotFoundException extends DomainException {

    public LineItemNotFoundException(String checkoutId, String lineItemId) {
        super(ErrorCode.LINE_ITEM_NOT_FOUND, "checkoutId=" + checkoutId + ", lineItemId=" + lineItemId);
    }
}
