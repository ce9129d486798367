package com.storemock.commerce.application.order.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.storemock.commerce.application.common.dto.AddressView;
import com.storemock.commerce.application.common.dto.TotalLine;
import com.storemock.commerce.application.common.dto.UcpMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 주문 응답 DTO (API 응답, 웹훅 payload의 order 필드 공용)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderResponse {

    private UcpMetadata ucp;
    private String id;

    @JsonProperty("checkout_id")
    private String checkoutId;

    private String status;

    @JsonProperty("permalink_url")
    private String permalinkUrl;

    private String currency;

    @JsonProperty("line_items")
    private List<LineItem> lineItems;

    private Fulfillment fulfillment;
    private List<TotalLine> totals;
    private List<Adjustment> adjustments;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LineItem {
        private String id;
        private Item item;
        private Quantity quantity;
        private List<TotalLine> totals;
        private String status;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        private String id;
        private String title;
        private long price;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Quantity {
        private int total;
        private int fulfilled;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Fulfillment {
        private List<Expectation> expectations;
        private List<Event> events;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Expectation {
        private String id;

        @JsonProperty("line_items")
        private List<ExpectedItem> lineItems;

        @JsonProperty("method_type")
        private String methodType;

        private AddressView destination;
        private String description;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExpectedItem {
        private String id;
        private int quantity;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Event {
        private String id;
        private String type;
        private Instant timestamp;

        @JsonProperty("line_item_ids")
        private List<String> lineItemIds;

        private Tracking tracking;
        private String description;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tracking {
        private String carrier;

        @JsonProperty("tracking_number")
        private String trackingNumber;

        @JsonProperty("tracking_url")
        private String trackingUrl;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Adjustment {
        private String id;
        private String type;
        private long amount;
        private String status;
        private String description;
        private Instant timestamp;
    }
}
