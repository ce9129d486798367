package com.storemock.commerce.application.checkout.dto;

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
import java.util.Map;

/**
 * 체크아웃 응답 DTO
 *
 * 책임:
 * - HTTP API 응답 직렬화 (@JsonProperty, snake_case)
 * - 멱등성 재응답 시 캐시된 이 객체를 그대로 다시 직렬화
 *
 * 변환은 CheckoutResponseAssembler에서 처리합니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckoutResponse {

    private UcpMetadata ucp;
    private String id;
    private String status;
    private String currency;
    private Map<String, Object> buyer;

    @JsonProperty("line_items")
    private List<LineItem> lineItems;

    private List<TotalLine> totals;
    private Discounts discounts;
    private Fulfillment fulfillment;
    private Payment payment;
    private List<Link> links;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    private OrderSummary order;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LineItem {
        private String id;
        private Item item;
        private int quantity;
        private List<TotalLine> totals;
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
    public static class Discounts {
        private List<String> codes;
        private List<AppliedDiscount> applied;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AppliedDiscount {
        private String code;
        private String title;
        private long amount;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Fulfillment {
        private List<Method> methods;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Method {
        private String id;
        private String type;

        @JsonProperty("line_item_ids")
        private List<String> lineItemIds;

        private List<AddressView> destinations;

        @JsonProperty("selected_destination_id")
        private String selectedDestinationId;

        private List<Group> groups;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class Group {
        private String id;

        @JsonProperty("line_item_ids")
        private List<String> lineItemIds;

        private List<Option> options;

        @JsonProperty("selected_option_id")
        private String selectedOptionId;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Option {
        private String id;
        private String title;
        private List<TotalLine> totals;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class Payment {
        private List<PaymentHandler> handlers;
        private List<Object> instruments;

        @JsonProperty("selected_instrument_id")
        private String selectedInstrumentId;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PaymentHandler {
        private String id;
        private String name;
        private String version;
        private String spec;

        @JsonProperty("config_schema")
        private String configSchema;

        @JsonProperty("instrument_schemas")
        private List<String> instrumentSchemas;

        private Map<String, Object> config;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Link {
        private String type;
        private String url;
        private String title;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrderSummary {
        private String id;
        private String status;

        @JsonProperty("permalink_url")
        private String permalinkUrl;
    }
}
