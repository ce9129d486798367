package com.storemock.commerce.domain.fulfillment;

public enum PromotionType {
    FREE_SHIPPING
}
