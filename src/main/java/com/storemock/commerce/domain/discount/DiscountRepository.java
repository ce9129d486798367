package com.storemock.commerce.domain.discount;

import java.util.Optional;

/**
 * DiscountRepository - 할인 코드 카탈로그 저장소 인터페이스 (Port)
 */
public interface DiscountRepository {

    /**
     * 코드로 할인 조회 (대소문자 구분 없음, 비활성 코드 포함)
     */
    Optional<Discount> findByCode(String code);

    Discount save(Discount discount);
}
