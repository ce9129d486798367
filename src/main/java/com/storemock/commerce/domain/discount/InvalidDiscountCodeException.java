package com.storemock.commerce.domain.discount;

import com.storemock.commerce.common.exception.DomainException;
import com.storemock.commerce.common.exception.ErrorCode;

/**
 * 존재하지 않거나 비활성화된 할인 코드 (ValidationError)
 */
public class InvalidDiscountCodeException extends DomainException {

    public InvalidDiscountCodeException(String code) {
        super(ErrorCode.INVALID_DISCOUNT_CODE, "code=" + code);
    }
}
