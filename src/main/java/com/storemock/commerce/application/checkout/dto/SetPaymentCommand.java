package com.storemock.commerce.application.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

@Getter
@AllArgsConstructor
public class SetPaymentCommand {

    private final String handlerId;
    private final Map<String, Object> instrument;
}
