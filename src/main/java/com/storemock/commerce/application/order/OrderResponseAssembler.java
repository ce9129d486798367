package com.storemock.commerce.application.order;

import com.storemock.commerce.application.common.dto.AddressView;
import com.storemock.commerce.application.common.dto.TotalLine;
import com.storemock.commerce.application.common.dto.UcpMetadata;
import com.storemock.commerce.application.order.dto.OrderResponse;
import com.storemock.commerce.common.protocol.UcpProtocol;
import com.storemock.commerce.config.CommerceProperties;
import com.storemock.commerce.domain.order.FulfillmentEvent;
import com.storemock.commerce.domain.order.FulfillmentExpectation;
import com.storemock.commerce.domain.order.Order;
import com.storemock.commerce.domain.order.OrderAdjustment;
import com.storemock.commerce.domain.order.OrderLineItem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Order → OrderResponse 변환 (API 응답, 웹훅 payload 공용)
 */
@Component
@RequiredArgsConstructor
public class OrderResponseAssembler {

    static final String LINE_ITEM_STATUS = "processing";

    private final CommerceProperties properties;

    public OrderResponse toResponse(Order order) {
        return OrderResponse.builder()
                .ucp(UcpMetadata.of(UcpProtocol.ORDER_CAPABILITY))
                .id(order.getOrderId())
                .checkoutId(order.getCheckoutId())
                .status(order.getStatus().getValue())
                .permalinkUrl(properties.getPublicBaseUrl() + "/orders/" + order.getOrderId())
                .currency(order.getCurrency())
                .lineItems(order.getLineItems().stream()
                        .map(this::toLineItem)
                        .collect(Collectors.toList()))
                .fulfillment(new OrderResponse.Fulfillment(
                        order.getExpectations().stream().map(this::toExpectation).collect(Collectors.toList()),
                        order.getEvents().stream().map(this::toEvent).collect(Collectors.toList())))
                .totals(toTotals(order))
                .adjustments(order.getAdjustments().isEmpty()
                        ? null
                        : order.getAdjustments().stream().map(this::toAdjustment).collect(Collectors.toList()))
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }

    private OrderResponse.LineItem toLineItem(OrderLineItem item) {
        return OrderResponse.LineItem.builder()
                .id(item.getLineItemId())
                .item(new OrderResponse.Item(item.getProductId(), item.getTitle(), item.getPrice()))
                .quantity(new OrderResponse.Quantity(item.getQuantity(), 0))
                .totals(List.of(
                        TotalLine.of(TotalLine.SUBTOTAL, item.lineTotal()),
                        TotalLine.of(TotalLine.TOTAL, item.lineTotal())))
                .status(LINE_ITEM_STATUS)
                .build();
    }

    private OrderResponse.Expectation toExpectation(FulfillmentExpectation expectation) {
        return OrderResponse.Expectation.builder()
                .id(expectation.getExpectationId())
                .lineItems(expectation.getLineItems().stream()
                        .map(item -> new OrderResponse.ExpectedItem(item.getLineItemId(), item.getQuantity()))
                        .collect(Collectors.toList()))
                .methodType(expectation.getMethodType() == null ? null : expectation.getMethodType().getValue())
                .destination(expectation.getDestination() == null
                        ? null
                        : AddressView.from(expectation.getDestination(), false))
                .description(expectation.getDescription())
                .build();
    }

    private OrderResponse.Event toEvent(FulfillmentEvent event) {
        return OrderResponse.Event.builder()
                .id(event.getEventId())
                .type(event.getType())
                .timestamp(event.getOccurredAt())
                .lineItemIds(event.getLineItemIds())
                .tracking(event.getTracking() == null
                        ? null
                        : new OrderResponse.Tracking(event.getTracking().getCarrier(),
                        event.getTracking().getTrackingNumber(), event.getTracking().getTrackingUrl()))
                .description(event.getDescription())
                .build();
    }

    private OrderResponse.Adjustment toAdjustment(OrderAdjustment adjustment) {
        return OrderResponse.Adjustment.builder()
                .id(adjustment.getAdjustmentId())
                .type(adjustment.getType())
                .amount(adjustment.getAmount())
                .status(adjustment.getStatus())
                .description(adjustment.getDescription())
                .timestamp(adjustment.getOccurredAt())
                .build();
    }

    /**
     * subtotal, (할인), (배송비), total
     */
    private List<TotalLine> toTotals(Order order) {
        List<TotalLine> totals = new ArrayList<>();
        totals.add(TotalLine.of(TotalLine.SUBTOTAL, order.getSubtotal()));
        if (order.getDiscountAmount() > 0) {
            totals.add(TotalLine.of(TotalLine.DISCOUNT, order.getDiscountAmount()));
        }
        if (order.getFulfillmentAmount() > 0) {
            totals.add(TotalLine.of(TotalLine.FULFILLMENT, order.getFulfillmentAmount()));
        }
        totals.add(TotalLine.of(TotalLine.TOTAL, order.getTotal()));
        return totals;
    }
}
