package com.storemock.commerce.infrastructure.persistence.discount;

import com.storemock.commerce.domain.discount.Discount;
import com.storemock.commerce.domain.discount.DiscountRepository;
import com.storemock.commerce.domain.discount.DiscountType;
import org.springframework.stereotype.Repository;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemoryDiscountRepository - 할인 코드 카탈로그 (인메모리)
 * 코드는 대문자로 정규화하여 저장합니다.
 */
@Repository
public class InMemoryDiscountRepository implements DiscountRepository {

    private final Map<String, Discount> discounts = new ConcurrentHashMap<>();

    public InMemoryDiscountRepository() {
        initializeData();
    }

    private void initializeData() {
        save(Discount.builder().code("10OFF").type(DiscountType.PERCENTAGE).value(10).active(true).build());
        save(Discount.builder().code("20OFF").type(DiscountType.PERCENTAGE).value(20).active(true).build());
        save(Discount.builder().code("SAVE5").type(DiscountType.FIXED).value(500).active(true).build());
        save(Discount.builder().code("EXPIRED").type(DiscountType.PERCENTAGE).value(50).active(false).build());
    }

    @Override
    public Optional<Discount> findByCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(discounts.get(normalize(code)));
    }

    @Override
    public Discount save(Discount discount) {
        discounts.put(normalize(discount.getCode()), discount);
        return discount;
    }

    private static String normalize(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
