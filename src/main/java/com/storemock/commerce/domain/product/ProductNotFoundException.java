package com.storemock.commerce.domain.product;

import com.storemock.commerce.common.exception.DomainException;
import com.storemock.commerce.common.exception.ErrorCode;

/**
 * 카탈로그에 없는 상품을 참조한 경우 (ValidationError)
 */
public class ProductNotFoundException extends DomainException {

    public ProductNotFoundException(String productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "productId=" + productId);
    }
}
