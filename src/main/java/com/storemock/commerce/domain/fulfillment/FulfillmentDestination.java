package com.storemock.commerce.domain.fulfillment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 배송지 (체크아웃 fulfillment method의 destination)
 *
 * address_country가 비어 있으면 옵션 계산 시 "US"로 간주합니다.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FulfillmentDestination {

    public static final String DEFAULT_COUNTRY = "US";

    private String id;
    private String streetAddress;
    private String addressLocality;
    private String addressRegion;
    private String postalCode;
    private String addressCountry;
    private String fullName;

    public String countryOrDefault() {
        return (addressCountry == null || addressCountry.isBlank()) ? DEFAULT_COUNTRY : addressCountry;
    }

    /**
     * 저장된 고객 주소와 같은 주소인지 비교 (도로명, 우편번호, 국가 - 대소문자 무시)
     */
    public boolean sameAddressAs(FulfillmentDestination other) {
        return normalize(streetAddress).equals(normalize(other.streetAddress))
                && normalize(postalCode).equals(normalize(other.postalCode))
                && normalize(addressCountry).equals(normalize(other.addressCountry));
    }

    public FulfillmentDestination copy() {
        return toBuilder().build();
    }

    private static String normalize(String value) {
        return value == null ? "" : value.toLowerCase();
    }
}
