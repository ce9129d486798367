package com.storemock.commerce.application.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 금액 항목 {type, display_text, amount}
 * type: subtotal, discount, fulfillment, total
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TotalLine {

    public static final String SUBTOTAL = "subtotal";
    public static final String DISCOUNT = "discount";
    public static final String FULFILLMENT = "fulfillment";
    public static final String TOTAL = "total";

    private String type;

    @JsonProperty("display_text")
    private String displayText;

    private long amount;

    public static TotalLine of(String type, String displayText, long amount) {
        return new TotalLine(type, displayText, amount);
    }

    public static TotalLine of(String type, long amount) {
        return new TotalLine(type, null, amount);
    }
}
