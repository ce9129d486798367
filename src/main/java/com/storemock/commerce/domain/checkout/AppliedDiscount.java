package com.storemock.commerce.domain.checkout;

import com.storemock.commerce.domain.discount.Discount;
import com.storemock.commerce.domain.discount.DiscountType;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 체크아웃에 적용된 할인 스냅샷 (코드, 유형, 값)
 * 적용 순서가 곧 할인 계산 순서입니다.
 */
@Getter
@AllArgsConstructor
public class AppliedDiscount {

    private final String code;
    private final DiscountType type;
    private final long value;

    public static AppliedDiscount from(Discount discount) {
        return new AppliedDiscount(discount.getCode(), discount.getType(), discount.getValue());
    }
}
