package com.storemock.commerce.domain.checkout;

import java.util.Optional;

/**
 * CheckoutRepository - Checkout 저장소 인터페이스 (Port)
 *
 * 역할:
 * - 체크아웃 세션 영속성 추상화
 * - 조회 결과는 스냅샷이며 save() 전까지 저장 상태에 반영되지 않음
 *
 * 구현체: infrastructure.persistence.checkout.InMemoryCheckoutRepository
 */
public interface CheckoutRepository {

    Optional<Checkout> findById(String checkoutId);

    Checkout save(Checkout checkout);

    long count();
}
