package com.storemock.commerce.presentation.order.mapper;

import com.storemock.commerce.application.order.dto.UpdateOrderCommand;
import com.storemock.commerce.domain.order.FulfillmentEvent;
import com.storemock.commerce.domain.order.OrderAdjustment;
import com.storemock.commerce.domain.order.TrackingInfo;
import com.storemock.commerce.presentation.order.request.AdjustmentRequest;
import com.storemock.commerce.presentation.order.request.FulfillmentEventRequest;
import com.storemock.commerce.presentation.order.request.UpdateOrderRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * OrderMapper - Presentation ↔ Application 계층 간 DTO 변환
 *
 * 클라이언트가 id를 생략한 이벤트/조정 내역에는 event_, adj_ 접두어 id를 발급하고
 * timestamp가 없으면 현재 시각을 사용합니다.
 */
@Component
public class OrderMapper {

    public UpdateOrderCommand toUpdateCommand(UpdateOrderRequest request) {
        List<FulfillmentEvent> events = null;
        if (request.getFulfillment() != null && request.getFulfillment().getEvents() != null) {
            events = request.getFulfillment().getEvents().stream()
                    .map(this::toEvent)
                    .collect(Collectors.toList());
        }

        List<OrderAdjustment> adjustments = null;
        if (request.getAdjustments() != null) {
            adjustments = request.getAdjustments().stream()
                    .map(this::toAdjustment)
                    .collect(Collectors.toList());
        }

        return UpdateOrderCommand.builder()
                .events(events)
                .adjustments(adjustments)
                .status(request.getStatus())
                .build();
    }

    private FulfillmentEvent toEvent(FulfillmentEventRequest request) {
        TrackingInfo tracking = request.getTracking() == null
                ? null
                : new TrackingInfo(request.getTracking().getCarrier(),
                request.getTracking().getTrackingNumber(),
                request.getTracking().getTrackingUrl());

        return FulfillmentEvent.builder()
                .eventId(request.getId() != null ? request.getId() : "event_" + shortId())
                .type(request.getType())
                .occurredAt(request.getTimestamp() != null ? request.getTimestamp() : Instant.now())
                .lineItemIds(request.getLineItemIds() == null ? List.of() : List.copyOf(request.getLineItemIds()))
                .tracking(tracking)
                .description(request.getDescription())
                .build();
    }

    private OrderAdjustment toAdjustment(AdjustmentRequest request) {
        return OrderAdjustment.builder()
                .adjustmentId(request.getId() != null ? request.getId() : "adj_" + shortId())
                .type(request.getType())
                .amount(request.getAmount())
                .status(request.getStatus())
                .description(request.getDescription())
                .occurredAt(request.getTimestamp() != null ? request.getTimestamp() : Instant.now())
                .build();
    }

    private String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
