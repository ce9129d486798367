package com.storemock.commerce.infrastructure.persistence.fulfillment;

import com.storemock.commerce.domain.fulfillment.Promotion;
import com.storemock.commerce.domain.fulfillment.PromotionRepository;
import com.storemock.commerce.domain.fulfillment.PromotionType;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * InMemoryPromotionRepository - 프로모션 참조 데이터 (인메모리)
 */
@Repository
public class InMemoryPromotionRepository implements PromotionRepository {

    private final Map<String, Promotion> promotions = new ConcurrentHashMap<>();

    public InMemoryPromotionRepository() {
        initializeData();
    }

    private void initializeData() {
        save(Promotion.builder()
                .id("promo_free_shipping_threshold")
                .type(PromotionType.FREE_SHIPPING)
                .minSubtotal(5000L)
                .build());
        save(Promotion.builder()
                .id("promo_free_shipping_gift_cards")
                .type(PromotionType.FREE_SHIPPING)
                .eligibleItemIds(Set.of("gift_card_50"))
                .build());
    }

    @Override
    public List<Promotion> findActiveByType(PromotionType type) {
        return promotions.values().stream()
                .filter(Promotion::isActive)
                .filter(promotion -> promotion.getType() == type)
                .collect(Collectors.toList());
    }

    @Override
    public Promotion save(Promotion promotion) {
        promotions.put(promotion.getId(), promotion);
        return promotion;
    }
}
