package com.storemock.commerce.domain.fulfillment;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * ShippingRateRepository - 배송 요율 저장소 인터페이스 (Port)
 */
public interface ShippingRateRepository {

    /**
     * 주어진 국가 코드 중 하나에 해당하는 활성 요율 조회 (등록 순서 유지)
     */
    List<ShippingRate> findActiveByCountryCodes(Collection<String> countryCodes);

    Optional<ShippingRate> findById(String rateId);

    ShippingRate save(ShippingRate rate);
}
