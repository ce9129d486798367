package com.storemock.commerce.domain.product;

import com.storemock.commerce.common.exception.DomainException;
import com.storemock.commerce.common.exception.ErrorCode;

public class InsufficientStockException extends DomainException {

    public InsufficientStockException(String productId, int requested, int available) {
        super(ErrorCode.INSUFFICIENT_STOCK,
                String.format("Insufficient stock for %s: requested %d, available %d", productId, requested, available));
    }
}
