package com.storemock.commerce.application.order;

import com.storemock.commerce.application.order.dto.UpdateOrderCommand;
import com.storemock.commerce.domain.order.Order;
import com.storemock.commerce.domain.order.OrderNotFoundException;
import com.storemock.commerce.domain.order.OrderRepository;
import com.storemock.commerce.domain.order.OrderStatus;
import com.storemock.commerce.infrastructure.lock.KeyedLock;
import com.storemock.commerce.infrastructure.lock.LockKeyGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * OrderService - 주문 조회/업데이트/취소
 *
 * 비즈니스 규칙:
 * - 라인 아이템과 금액은 변경 불가
 * - 배송 이벤트와 조정 내역은 기존 목록 뒤에 추가만 가능
 * - 취소는 pending/confirmed 상태에서만 가능
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    static final int DEFAULT_LIMIT = 20;

    private final OrderRepository orderRepository;

    public Order getOrder(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    /**
     * 주문 목록 조회 (최신순)
     *
     * @param buyerId 구매자 ID 필터 (null이면 전체)
     * @param limit 최대 개수 (null 또는 1 미만이면 20)
     * @param offset 건너뛸 개수 (null 또는 음수면 0)
     */
    public List<Order> listOrders(String buyerId, Integer limit, Integer offset) {
        int effectiveLimit = (limit == null || limit < 1) ? DEFAULT_LIMIT : limit;
        int effectiveOffset = (offset == null || offset < 0) ? 0 : offset;
        return orderRepository.findAll(buyerId, effectiveLimit, effectiveOffset);
    }

    /**
     * 주문 업데이트 (상태 검증 후 이벤트/조정 내역 추가, 상태 변경)
     */
    @KeyedLock(key = LockKeyGenerator.ORDER_KEY_TEMPLATE)
    public Order updateOrder(String orderId, UpdateOrderCommand command) {
        Order order = getOrder(orderId);
        OrderStatus status = command.getStatus() == null ? null : OrderStatus.fromString(command.getStatus());

        if (command.getEvents() != null) {
            command.getEvents().forEach(order::appendEvent);
        }
        if (command.getAdjustments() != null) {
            command.getAdjustments().forEach(order::appendAdjustment);
        }
        if (status != null) {
            order.changeStatus(status);
        }
        orderRepository.save(order);

        log.info("[OrderService] 주문 업데이트 - orderId={}, status={}, events={}, adjustments={}",
                orderId, order.getStatus().getValue(), order.getEvents().size(), order.getAdjustments().size());
        return order;
    }

    @KeyedLock(key = LockKeyGenerator.ORDER_KEY_TEMPLATE)
    public Order cancelOrder(String orderId) {
        Order order = getOrder(orderId);
        order.cancel();
        orderRepository.save(order);

        log.info("[OrderService] 주문 취소 - orderId={}", orderId);
        return order;
    }
}
