package com.storemock.commerce.application.order;

import com.storemock.commerce.common.exception.ApplicationException;
import com.storemock.commerce.common.exception.ErrorCode;
import com.storemock.commerce.config.CommerceProperties;
import com.storemock.commerce.domain.order.FulfillmentEvent;
import com.storemock.commerce.domain.order.Order;
import com.storemock.commerce.domain.order.OrderLineItem;
import com.storemock.commerce.domain.order.OrderNotFoundException;
import com.storemock.commerce.domain.order.OrderRepository;
import com.storemock.commerce.domain.order.TrackingInfo;
import com.storemock.commerce.domain.order.event.OrderShippedEvent;
import com.storemock.commerce.infrastructure.lock.KeyedLock;
import com.storemock.commerce.infrastructure.lock.LockKeyGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * ShipmentSimulationService - 테스트용 배송 시뮬레이션
 *
 * 역할:
 * - shipped 배송 이벤트(모의 운송장 포함) 추가, 주문 상태 shipped
 * - OrderShippedEvent 발행 (order_shipped 웹훅)
 *
 * commerce.simulation.secret이 설정되어 있으면 Simulation-Secret 헤더가 일치해야 합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShipmentSimulationService {

    static final String MOCK_CARRIER = "Mock Carrier";
    static final String TRACKING_URL_PREFIX = "https://example.com/track/";

    private final OrderRepository orderRepository;
    private final CommerceProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    @KeyedLock(key = LockKeyGenerator.ORDER_KEY_TEMPLATE)
    public Order simulateShipping(String orderId, String providedSecret, String agentReference) {
        verifySecret(providedSecret);

        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        String trackingNumber = "MOCK" + orderId.substring(0, Math.min(8, orderId.length())).toUpperCase(Locale.ROOT);
        FulfillmentEvent event = FulfillmentEvent.builder()
                .eventId("event_" + orderId + "_shipped")
                .type(FulfillmentEvent.TYPE_SHIPPED)
                .occurredAt(Instant.now())
                .lineItemIds(order.getLineItems().stream()
                        .map(OrderLineItem::getLineItemId)
                        .collect(Collectors.toList()))
                .tracking(new TrackingInfo(MOCK_CARRIER, trackingNumber, TRACKING_URL_PREFIX + trackingNumber))
                .build();

        order.markShipped(event);
        orderRepository.save(order);

        eventPublisher.publishEvent(OrderShippedEvent.of(order.getCheckoutId(), orderId, agentReference));
        log.info("[ShipmentSimulationService] 배송 시뮬레이션 - orderId={}, trackingNumber={}", orderId, trackingNumber);
        return order;
    }

    private void verifySecret(String providedSecret) {
        CommerceProperties.Simulation simulation = properties.getSimulation();
        if (!simulation.isSecretConfigured()) {
            return;
        }
        byte[] expected = simulation.getSecret().getBytes(StandardCharsets.UTF_8);
        byte[] provided = providedSecret == null ? new byte[0] : providedSecret.getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, provided)) {
            log.warn("[ShipmentSimulationService] 시뮬레이션 시크릿 불일치");
            throw new ApplicationException(ErrorCode.SIMULATION_FORBIDDEN);
        }
    }
}
