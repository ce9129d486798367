package com.storemock.commerce.domain.order;

import java.util.List;
import java.util.Optional;

/**
 * OrderRepository - Order 도메인의 저장소 인터페이스 (Port)
 *
 * 구현체: infrastructure.persistence.order.InMemoryOrderRepository
 */
public interface OrderRepository {

    Order save(Order order);

    Optional<Order> findById(String orderId);

    /**
     * 주문 목록 조회 (최신순)
     *
     * @param buyerId 구매자 ID (null이면 전체)
     * @param limit 최대 개수
     * @param offset 건너뛸 개수
     */
    List<Order> findAll(String buyerId, int limit, int offset);
}
