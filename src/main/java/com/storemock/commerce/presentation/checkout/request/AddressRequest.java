package com.storemock.commerce.presentation.checkout.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 배송지 요청 DTO (id가 없으면 서버에서 발급)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddressRequest {

    private String id;

    @JsonProperty("street_address")
    private String streetAddress;

    @JsonProperty("address_locality")
    private String addressLocality;

    @JsonProperty("address_region")
    private String addressRegion;

    @JsonProperty("postal_code")
    private String postalCode;

    @JsonProperty("address_country")
    private String addressCountry;

    @JsonProperty("full_name")
    private String fullName;
}
