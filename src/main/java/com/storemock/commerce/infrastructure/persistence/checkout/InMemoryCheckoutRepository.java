package com.storemock.commerce.infrastructure.persistence.checkout;

import com.storemock.commerce.domain.checkout.Checkout;
import com.storemock.commerce.domain.checkout.CheckoutRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemoryCheckoutRepository - Checkout 저장소 구현체 (인메모리)
 *
 * 저장/조회 모두 깊은 복사본을 사용합니다.
 * 서비스에서 변경 도중 예외가 발생하면 save()가 호출되지 않으므로 저장 상태는 그대로 유지됩니다.
 */
@Repository
public class InMemoryCheckoutRepository implements CheckoutRepository {

    private final ConcurrentHashMap<String, Checkout> checkouts = new ConcurrentHashMap<>();

    @Override
    public Optional<Checkout> findById(String checkoutId) {
        Checkout stored = checkouts.get(checkoutId);
        return stored == null ? Optional.empty() : Optional.of(stored.copy());
    }

    @Override
    public Checkout save(Checkout checkout) {
        checkouts.put(checkout.getCheckoutId(), checkout.copy());
        return checkout;
    }

    @Override
    public long count() {
        return checkouts.size();
    }
}
