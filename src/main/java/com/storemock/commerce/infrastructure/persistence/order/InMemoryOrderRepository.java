package com.storemock.commerce.infrastructure.persistence.order;

import com.storemock.commerce.domain.order.Order;
import com.storemock.commerce.domain.order.OrderRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * InMemoryOrderRepository - Order 저장소 구현체 (인메모리)
 * ConcurrentHashMap을 사용하여 스레드 안전성 제공
 */
@Repository
public class InMemoryOrderRepository implements OrderRepository {

    private final ConcurrentHashMap<String, Order> orders = new ConcurrentHashMap<>();

    @Override
    public Order save(Order order) {
        orders.put(order.getOrderId(), order);
        return order;
    }

    @Override
    public Optional<Order> findById(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public List<Order> findAll(String buyerId, int limit, int offset) {
        return orders.values().stream()
                .filter(order -> buyerId == null || buyerId.equals(order.getBuyerId()))
                .sorted(Comparator.comparing(Order::getCreatedAt).reversed())
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }
}
