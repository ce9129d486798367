package com.storemock.commerce.application.order;

import com.storemock.commerce.application.checkout.PriceBreakdown;
import com.storemock.commerce.domain.checkout.Checkout;
import com.storemock.commerce.domain.checkout.CheckoutLineItem;
import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import com.storemock.commerce.domain.fulfillment.FulfillmentGroup;
import com.storemock.commerce.domain.fulfillment.FulfillmentMethod;
import com.storemock.commerce.domain.order.FulfillmentExpectation;
import com.storemock.commerce.domain.order.FulfillmentExpectation.ExpectedItem;
import com.storemock.commerce.domain.order.Order;
import com.storemock.commerce.domain.order.OrderLineItem;
import com.storemock.commerce.domain.order.OrderStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * OrderFactory - 완료된 체크아웃으로부터 주문 스냅샷 생성
 *
 * 역할:
 * - 라인 아이템을 새 ID로 복사 (상품 ID, 제목, 단가, 수량)
 * - 배송지와 옵션이 모두 선택된 method마다 fulfillment expectation 1개 생성
 * - 금액은 스냅샷 라인 아이템 기준 subtotal + 체크아웃 계산 결과의 할인/배송비
 *
 * 생성된 주문은 CONFIRMED 상태이며 배송 이벤트는 비어 있습니다.
 */
@Component
public class OrderFactory {

    public Order createFromCheckout(Checkout checkout, PriceBreakdown pricing) {
        String orderId = UUID.randomUUID().toString();

        // 체크아웃 라인 아이템 ID → 주문 라인 아이템 ID
        Map<String, String> lineItemIdMapping = new HashMap<>();
        List<OrderLineItem> lineItems = new ArrayList<>();
        for (CheckoutLineItem item : checkout.getLineItems()) {
            String lineItemId = UUID.randomUUID().toString();
            lineItemIdMapping.put(item.getLineItemId(), lineItemId);
            lineItems.add(new OrderLineItem(lineItemId, item.getProductId(), item.getTitle(),
                    item.getPrice(), item.getQuantity()));
        }

        List<FulfillmentExpectation> expectations = createExpectations(checkout, lineItems, lineItemIdMapping);

        long subtotal = lineItems.stream().mapToLong(OrderLineItem::lineTotal).sum();
        long total = Math.max(0L, Math.max(0L, subtotal - pricing.getDiscountAmount()) + pricing.getFulfillmentPrice());

        Instant now = Instant.now();
        return Order.builder()
                .orderId(orderId)
                .checkoutId(checkout.getCheckoutId())
                .buyerId(checkout.getBuyerId())
                .status(OrderStatus.CONFIRMED)
                .currency(checkout.getCurrency())
                .lineItems(lineItems)
                .expectations(expectations)
                .events(new ArrayList<>())
                .adjustments(new ArrayList<>())
                .subtotal(subtotal)
                .discountAmount(pricing.getDiscountAmount())
                .fulfillmentAmount(pricing.getFulfillmentPrice())
                .total(total)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private List<FulfillmentExpectation> createExpectations(Checkout checkout,
                                                            List<OrderLineItem> lineItems,
                                                            Map<String, String> lineItemIdMapping) {
        List<FulfillmentExpectation> expectations = new ArrayList<>();
        for (FulfillmentMethod method : checkout.getFulfillment().getMethods()) {
            Optional<FulfillmentDestination> destination = method.selectedDestination();
            Optional<FulfillmentGroup> group = method.selectedGroup();
            if (destination.isEmpty() || group.isEmpty()) {
                continue;
            }

            List<ExpectedItem> items = new ArrayList<>();
            for (CheckoutLineItem item : checkout.getLineItems()) {
                if (method.getLineItemIds().isEmpty() || method.getLineItemIds().contains(item.getLineItemId())) {
                    items.add(new ExpectedItem(lineItemIdMapping.get(item.getLineItemId()), item.getQuantity()));
                }
            }
            if (items.isEmpty()) {
                lineItems.forEach(item -> items.add(new ExpectedItem(item.getLineItemId(), item.getQuantity())));
            }

            expectations.add(new FulfillmentExpectation(
                    "exp_" + (expectations.size() + 1),
                    items,
                    method.getType(),
                    destination.get().copy(),
                    group.get().getSelectedOptionTitle()));
        }
        return expectations;
    }
}
