package com.storemock.commerce.application.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 배송지 응답 (체크아웃 destination, 주문 expectation destination 공용)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AddressView {

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

    public static AddressView from(FulfillmentDestination destination, boolean includeId) {
        return AddressView.builder()
                .id(includeId ? destination.getId() : null)
                .streetAddress(nullToEmpty(destination.getStreetAddress()))
                .addressLocality(nullToEmpty(destination.getAddressLocality()))
                .addressRegion(nullToEmpty(destination.getAddressRegion()))
                .postalCode(nullToEmpty(destination.getPostalCode()))
                .addressCountry(destination.countryOrDefault())
                .fullName(destination.getFullName())
                .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
