package com.storemock.commerce.application.fulfillment;

import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import com.storemock.commerce.domain.fulfillment.FulfillmentGroup;
import com.storemock.commerce.domain.fulfillment.FulfillmentMethod;
import com.storemock.commerce.domain.fulfillment.FulfillmentMethodType;
import com.storemock.commerce.domain.fulfillment.FulfillmentOption;
import com.storemock.commerce.domain.fulfillment.FulfillmentState;
import com.storemock.commerce.domain.fulfillment.PromotionRepository;
import com.storemock.commerce.domain.fulfillment.PromotionType;
import com.storemock.commerce.domain.fulfillment.ShippingRate;
import com.storemock.commerce.domain.fulfillment.ShippingRateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FulfillmentResolver - 배송지 국가별 배송 옵션 계산
 *
 * 계산 순서:
 * 1. 목적지 국가 또는 "default" 국가의 활성 요율 조회
 * 2. service level별로 묶음 (국가별 요율이 default보다 우선)
 * 3. 무료배송 프로모션이 적용되면 standard 레벨만 가격 0, 제목에 " (Free)" 추가
 * 4. 최종 가격 오름차순 정렬 (동률은 요율 등록 순서 유지)
 *
 * 국가 코드가 비어 있으면 빈 목록, 알 수 없는 국가는 default 요율만 사용합니다.
 */
@Component
@RequiredArgsConstructor
public class FulfillmentResolver {

    static final String FREE_SUFFIX = " (Free)";

    private final ShippingRateRepository shippingRateRepository;
    private final PromotionRepository promotionRepository;

    public List<FulfillmentOption> calculateOptions(String countryCode, Collection<String> productIds, long subtotal) {
        if (countryCode == null || countryCode.isBlank()) {
            return new ArrayList<>();
        }

        List<ShippingRate> rates = shippingRateRepository.findActiveByCountryCodes(
                List.of(countryCode, ShippingRate.DEFAULT_COUNTRY));

        Map<String, ShippingRate> byLevel = new LinkedHashMap<>();
        for (ShippingRate rate : rates) {
            ShippingRate current = byLevel.get(rate.getServiceLevel());
            if (current == null || (current.isDefaultCountry() && !rate.isDefaultCountry())) {
                byLevel.put(rate.getServiceLevel(), rate);
            }
        }

        boolean freeShipping = isFreeShippingEligible(productIds, subtotal);

        List<FulfillmentOption> options = new ArrayList<>();
        for (ShippingRate rate : byLevel.values()) {
            options.add(toOption(rate, freeShipping));
        }
        // List.sort는 안정 정렬: 가격이 같으면 요율 등록 순서 유지
        options.sort(Comparator.comparingLong(FulfillmentOption::getPrice));
        return options;
    }

    /**
     * 요율 ID로 단일 옵션 계산 (그룹에 아직 옵션 목록이 없을 때 사용)
     */
    public Optional<FulfillmentOption> resolveRate(String rateId, Collection<String> productIds, long subtotal) {
        return shippingRateRepository.findById(rateId)
                .filter(ShippingRate::isActive)
                .map(rate -> toOption(rate, isFreeShippingEligible(productIds, subtotal)));
    }

    public boolean isFreeShippingEligible(Collection<String> productIds, long subtotal) {
        return promotionRepository.findActiveByType(PromotionType.FREE_SHIPPING).stream()
                .anyMatch(promotion -> promotion.matches(subtotal, productIds));
    }

    /**
     * 배송 상태의 옵션 목록을 현재 배송지/금액 기준으로 갱신
     *
     * - method가 없으면 기본 shipping method(shipping_method_0) 생성
     * - 선택된 배송지가 있는 method는 그룹이 없으면 group_{i}_0 생성, 있으면 옵션만 갱신
     * - 이미 선택된 옵션은 갱신된 가격/제목으로 다시 기록 (목록에서 사라졌으면 선택 해제)
     */
    public FulfillmentState refresh(FulfillmentState state, List<String> lineItemIds,
                                    Collection<String> productIds, long subtotal) {
        FulfillmentState refreshed = state.copy();
        if (refreshed.isEmpty()) {
            refreshed.getMethods().add(FulfillmentMethod.builder()
                    .id("shipping_method_0")
                    .type(FulfillmentMethodType.SHIPPING)
                    .lineItemIds(new ArrayList<>(lineItemIds))
                    .build());
            return refreshed;
        }

        List<FulfillmentMethod> methods = refreshed.getMethods();
        for (int i = 0; i < methods.size(); i++) {
            FulfillmentMethod method = methods.get(i);
            if (method.getId() == null) {
                method.setId("shipping_method_" + i);
            }
            if (method.getType() == null) {
                method.setType(FulfillmentMethodType.SHIPPING);
            }
            if (method.getLineItemIds().isEmpty()) {
                method.setLineItemIds(new ArrayList<>(lineItemIds));
            }

            Optional<FulfillmentDestination> destination = method.selectedDestination();
            if (destination.isEmpty()) {
                continue;
            }

            List<FulfillmentOption> options = calculateOptions(destination.get().countryOrDefault(), productIds, subtotal);
            if (method.getGroups().isEmpty()) {
                method.getGroups().add(FulfillmentGroup.builder()
                        .id("group_" + i + "_0")
                        .lineItemIds(new ArrayList<>(method.getLineItemIds()))
                        .options(options)
                        .build());
                continue;
            }

            List<FulfillmentGroup> groups = method.getGroups();
            for (int j = 0; j < groups.size(); j++) {
                FulfillmentGroup group = groups.get(j);
                if (group.getId() == null) {
                    group.setId("group_" + i + "_" + j);
                }
                if (group.getLineItemIds().isEmpty()) {
                    group.setLineItemIds(new ArrayList<>(method.getLineItemIds()));
                }
                group.setOptions(new ArrayList<>(options));
                if (group.hasSelectedOption()) {
                    Optional<FulfillmentOption> selected = group.findOption(group.getSelectedOptionId());
                    if (selected.isPresent()) {
                        group.select(selected.get());
                    } else {
                        group.clearSelection();
                    }
                }
            }
        }
        return refreshed;
    }

    private static FulfillmentOption toOption(ShippingRate rate, boolean freeShipping) {
        if (freeShipping && rate.isStandardLevel()) {
            return new FulfillmentOption(rate.getId(), rate.getTitle() + FREE_SUFFIX, 0L);
        }
        return new FulfillmentOption(rate.getId(), rate.getTitle(), rate.getPrice());
    }
}
