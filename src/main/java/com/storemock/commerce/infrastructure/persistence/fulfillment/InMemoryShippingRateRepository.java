package com.storemock.commerce.infrastructure.persistence.fulfillment;

import com.storemock.commerce.domain.fulfillment.FulfillmentMethodType;
import com.storemock.commerce.domain.fulfillment.ShippingRate;
import com.storemock.commerce.domain.fulfillment.ShippingRateRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * InMemoryShippingRateRepository - 배송 요율 참조 데이터 (인메모리)
 *
 * 조회 결과는 등록 순서를 유지합니다. 옵션 정렬(가격 동률)의 기준이 됩니다.
 */
@Repository
public class InMemoryShippingRateRepository implements ShippingRateRepository {

    private final List<ShippingRate> rates = new CopyOnWriteArrayList<>();
    private final Map<String, ShippingRate> ratesById = new ConcurrentHashMap<>();

    public InMemoryShippingRateRepository() {
        initializeData();
    }

    private void initializeData() {
        save(rate("std-ship", "Standard Shipping", 500, ShippingRate.DEFAULT_COUNTRY, "standard"));
        save(rate("express-ship", "Express Shipping", 2500, ShippingRate.DEFAULT_COUNTRY, "express"));
        save(rate("express-ship-us", "Express Shipping (US)", 1500, "US", "express"));
        save(rate("std-ship-ca", "Standard Shipping (Canada)", 900, "CA", "standard"));
        save(rate("overnight-ship-us", "Overnight Shipping", 4000, "US", "overnight"));
    }

    private static ShippingRate rate(String id, String title, long price, String country, String level) {
        return ShippingRate.builder()
                .id(id)
                .title(title)
                .type(FulfillmentMethodType.SHIPPING)
                .price(price)
                .countryCode(country)
                .serviceLevel(level)
                .active(true)
                .build();
    }

    @Override
    public List<ShippingRate> findActiveByCountryCodes(Collection<String> countryCodes) {
        return rates.stream()
                .filter(ShippingRate::isActive)
                .filter(rate -> countryCodes.contains(rate.getCountryCode()))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<ShippingRate> findById(String rateId) {
        return Optional.ofNullable(ratesById.get(rateId));
    }

    @Override
    public synchronized ShippingRate save(ShippingRate rate) {
        ShippingRate previous = ratesById.put(rate.getId(), rate);
        if (previous != null) {
            rates.replaceAll(existing -> existing.getId().equals(rate.getId()) ? rate : existing);
        } else {
            rates.add(rate);
        }
        return rate;
    }
}
