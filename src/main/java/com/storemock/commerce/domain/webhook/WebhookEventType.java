package com.storemock.commerce.domain.webhook;

import lombok.Getter;

@Getter
public enum WebhookEventType {
    ORDER_PLACED("order_placed"),
    ORDER_SHIPPED("order_shipped");

    private final String value;

    WebhookEventType(String value) {
        this.value = value;
    }
}
