package com.storemock.commerce.domain.fulfillment;

import java.util.List;

public interface PromotionRepository {

    List<Promotion> findActiveByType(PromotionType type);

    Promotion save(Promotion promotion);
}
