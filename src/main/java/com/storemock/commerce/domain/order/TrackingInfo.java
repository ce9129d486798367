package com.storemock.commerce.domain.order;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TrackingInfo {

    private final String carrier;
    private final String trackingNumber;
    private final String trackingUrl;
}
