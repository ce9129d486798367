package com.storemock.commerce.domain.fulfillment;

import lombok.Getter;

@Getter
public enum FulfillmentMethodType {
    SHIPPING("shipping"),
    PICKUP("pickup");

    private final String value;

    FulfillmentMethodType(String value) {
        this.value = value;
    }

    public static FulfillmentMethodType fromString(String value) {
        for (FulfillmentMethodType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new InvalidFulfillmentMethodException("type=" + value);
    }
}
