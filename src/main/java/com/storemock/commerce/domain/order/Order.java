package com.storemock.commerce.domain.order;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Order 도메인 엔티티
 *
 * 책임:
 * - 완료된 체크아웃의 불변 스냅샷 (라인 아이템, 배송 예정, 금액)
 * - 배송 이벤트와 조정 내역의 추가 (append-only)
 * - 주문 상태 전환
 *
 * 핵심 비즈니스 규칙:
 * - 라인 아이템과 금액은 생성 이후 변경 불가
 * - CONFIRMED 또는 PENDING 상태에서만 취소 가능
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    private String orderId;
    private String checkoutId;
    private String buyerId;
    private OrderStatus status;
    private String currency;

    @Builder.Default
    private List<OrderLineItem> lineItems = new ArrayList<>();

    @Builder.Default
    private List<FulfillmentExpectation> expectations = new ArrayList<>();

    @Builder.Default
    private List<FulfillmentEvent> events = new ArrayList<>();

    @Builder.Default
    private List<OrderAdjustment> adjustments = new ArrayList<>();

    private long subtotal;
    private long discountAmount;
    private long fulfillmentAmount;
    private long total;

    private Instant createdAt;
    private Instant updatedAt;

    public void appendEvent(FulfillmentEvent event) {
        events.add(event);
        touch();
    }

    public void appendAdjustment(OrderAdjustment adjustment) {
        adjustments.add(adjustment);
        touch();
    }

    public void changeStatus(OrderStatus status) {
        this.status = status;
        touch();
    }

    /**
     * 상태 전환: 배송 (→ SHIPPED), 배송 이벤트 추가
     */
    public void markShipped(FulfillmentEvent event) {
        if (status == OrderStatus.CANCELED) {
            throw new InvalidOrderStatusException(orderId, "취소된 주문은 배송할 수 없습니다");
        }
        events.add(event);
        this.status = OrderStatus.SHIPPED;
        touch();
    }

    /**
     * 상태 전환: 취소 (PENDING/CONFIRMED → CANCELED)
     *
     * @throws InvalidOrderStatusException 취소 불가능한 상태
     */
    public void cancel() {
        if (!status.isCancellable()) {
            throw new InvalidOrderStatusException(orderId, "취소할 수 없습니다. 현재 상태: " + status.getValue());
        }
        this.status = OrderStatus.CANCELED;
        touch();
    }

    public List<OrderLineItem> getLineItems() {
        return Collections.unmodifiableList(lineItems);
    }

    public List<FulfillmentExpectation> getExpectations() {
        return Collections.unmodifiableList(expectations);
    }

    public List<FulfillmentEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<OrderAdjustment> getAdjustments() {
        return Collections.unmodifiableList(adjustments);
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }
}
