package com.storemock.commerce.domain.fulfillment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * ShippingRate - 배송 요율 참조 데이터
 *
 * countryCode가 "default"인 요율은 국가별 요율이 없을 때 사용됩니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingRate {

    public static final String DEFAULT_COUNTRY = "default";
    public static final String STANDARD_LEVEL = "standard";

    private String id;
    private String title;
    private FulfillmentMethodType type;
    private long price;

    @Builder.Default
    private String countryCode = DEFAULT_COUNTRY;

    @Builder.Default
    private String serviceLevel = STANDARD_LEVEL;

    @Builder.Default
    private boolean active = true;

    public boolean isDefaultCountry() {
        return DEFAULT_COUNTRY.equals(countryCode);
    }

    public boolean isStandardLevel() {
        return STANDARD_LEVEL.equals(serviceLevel);
    }
}
