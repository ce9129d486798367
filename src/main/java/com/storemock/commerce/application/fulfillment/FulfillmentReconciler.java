package com.storemock.commerce.application.fulfillment;

import com.storemock.commerce.application.checkout.dto.FulfillmentUpdateCommand;
import com.storemock.commerce.application.checkout.dto.FulfillmentUpdateCommand.GroupUpdate;
import com.storemock.commerce.application.checkout.dto.FulfillmentUpdateCommand.MethodUpdate;
import com.storemock.commerce.domain.customer.Customer;
import com.storemock.commerce.domain.customer.CustomerRepository;
import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import com.storemock.commerce.domain.fulfillment.FulfillmentGroup;
import com.storemock.commerce.domain.fulfillment.FulfillmentMethod;
import com.storemock.commerce.domain.fulfillment.FulfillmentMethodType;
import com.storemock.commerce.domain.fulfillment.FulfillmentOption;
import com.storemock.commerce.domain.fulfillment.FulfillmentState;
import com.storemock.commerce.domain.fulfillment.InvalidFulfillmentMethodException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * FulfillmentReconciler - 배송 정보 업데이트 병합
 *
 * 병합 규칙:
 * - 업데이트 method는 id 또는 type이 같은 기존 method에 병합, 없으면 추가
 * - 업데이트에 destinations / selected_destination_id가 없으면 기존 값 유지
 * - groups가 있으면 그룹 단위로 교체하되 기존 그룹의 옵션 목록은 유지
 * - ID 없는 배송지는 저장된 고객 주소와 일치하면 그 ID, 아니면 dest_xxxxxxxx 발급
 * - 구매자 이메일이 등록된 고객이고 요청에 배송지가 없으면 저장된 주소를 주입
 * - 선택된 옵션은 그룹 옵션 목록에서 찾고, 없으면 배송 요율에서 직접 계산
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FulfillmentReconciler {

    private final CustomerRepository customerRepository;
    private final FulfillmentResolver fulfillmentResolver;

    public ReconciledFulfillment reconcile(FulfillmentState existing,
                                           FulfillmentUpdateCommand update,
                                           String buyerEmail,
                                           Collection<String> productIds,
                                           long subtotal) {
        FulfillmentState merged = merge(existing, update);

        List<FulfillmentDestination> storedAddresses = customerRepository.findByEmail(buyerEmail)
                .map(Customer::getAddresses)
                .orElse(Collections.emptyList());

        if (!storedAddresses.isEmpty() && !update.hasClientDestinations()) {
            injectStoredAddresses(merged, storedAddresses);
        }

        List<FulfillmentDestination> newAddresses = assignDestinationIds(merged, storedAddresses);
        validateSelectedDestinations(merged);
        applyOptionSelections(merged, productIds, subtotal);

        return new ReconciledFulfillment(merged, buyerEmail == null ? List.of() : newAddresses);
    }

    /**
     * 기존 배송 상태에 업데이트 method 병합 (기존 상태는 변경하지 않음)
     */
    public FulfillmentState merge(FulfillmentState existing, FulfillmentUpdateCommand update) {
        FulfillmentState merged = existing.copy();
        if (update == null || update.getMethods() == null) {
            return merged;
        }

        for (MethodUpdate methodUpdate : update.getMethods()) {
            FulfillmentMethod target = findMatchingMethod(merged, methodUpdate)
                    .orElseGet(() -> {
                        FulfillmentMethod created = FulfillmentMethod.builder()
                                .id(methodUpdate.getId() != null
                                        ? methodUpdate.getId()
                                        : "shipping_method_" + merged.getMethods().size())
                                .type(FulfillmentMethodType.SHIPPING)
                                .build();
                        merged.getMethods().add(created);
                        return created;
                    });

            if (methodUpdate.getType() != null) {
                target.setType(FulfillmentMethodType.fromString(methodUpdate.getType()));
            }
            if (methodUpdate.getLineItemIds() != null) {
                target.setLineItemIds(new ArrayList<>(methodUpdate.getLineItemIds()));
            }
            if (methodUpdate.getDestinations() != null) {
                List<FulfillmentDestination> destinations = new ArrayList<>();
                methodUpdate.getDestinations().forEach(destination -> destinations.add(destination.copy()));
                target.setDestinations(destinations);
            }
            if (methodUpdate.getSelectedDestinationId() != null) {
                target.setSelectedDestinationId(methodUpdate.getSelectedDestinationId());
            }
            if (methodUpdate.getGroups() != null) {
                target.setGroups(mergeGroups(target, methodUpdate.getGroups()));
            }
        }
        return merged;
    }

    /**
     * 새로 발급된 배송지를 구매자 주소록에 기록 (고객이 없으면 생성)
     */
    public void rememberAddresses(String buyerEmail, List<FulfillmentDestination> newAddresses) {
        if (buyerEmail == null || newAddresses.isEmpty()) {
            return;
        }
        Customer customer = customerRepository.findByEmail(buyerEmail)
                .orElseGet(() -> Customer.create(buyerEmail));
        newAddresses.forEach(customer::addAddress);
        customerRepository.save(customer);
        log.info("[FulfillmentReconciler] 고객 배송지 저장 - customerId={}, count={}",
                customer.getCustomerId(), newAddresses.size());
    }

    private Optional<FulfillmentMethod> findMatchingMethod(FulfillmentState state, MethodUpdate update) {
        return state.getMethods().stream()
                .filter(method -> (update.getId() != null && update.getId().equals(method.getId()))
                        || (update.getType() != null && method.getType() != null
                        && method.getType().getValue().equalsIgnoreCase(update.getType())))
                .findFirst();
    }

    private List<FulfillmentGroup> mergeGroups(FulfillmentMethod method, List<GroupUpdate> updates) {
        List<FulfillmentGroup> groups = new ArrayList<>();
        for (int j = 0; j < updates.size(); j++) {
            GroupUpdate groupUpdate = updates.get(j);
            Optional<FulfillmentGroup> existing = groupUpdate.getId() != null
                    ? method.findGroup(groupUpdate.getId())
                    : (j < method.getGroups().size() ? Optional.of(method.getGroups().get(j)) : Optional.empty());

            FulfillmentGroup group = existing.map(FulfillmentGroup::copy)
                    .orElseGet(() -> FulfillmentGroup.builder().id(groupUpdate.getId()).build());
            if (groupUpdate.getLineItemIds() != null) {
                group.setLineItemIds(new ArrayList<>(groupUpdate.getLineItemIds()));
            }
            if (groupUpdate.getSelectedOptionId() == null) {
                group.clearSelection();
            } else {
                group.setSelectedOptionId(groupUpdate.getSelectedOptionId());
            }
            groups.add(group);
        }
        return groups;
    }

    private void injectStoredAddresses(FulfillmentState state, List<FulfillmentDestination> storedAddresses) {
        for (FulfillmentMethod method : state.getMethods()) {
            Set<String> existingIds = method.getDestinations().stream()
                    .map(FulfillmentDestination::getId)
                    .filter(id -> id != null)
                    .collect(Collectors.toSet());
            for (FulfillmentDestination stored : storedAddresses) {
                if (!existingIds.contains(stored.getId())) {
                    method.getDestinations().add(stored.copy());
                }
            }
        }
    }

    private List<FulfillmentDestination> assignDestinationIds(FulfillmentState state,
                                                              List<FulfillmentDestination> storedAddresses) {
        List<FulfillmentDestination> newAddresses = new ArrayList<>();
        for (FulfillmentMethod method : state.getMethods()) {
            for (FulfillmentDestination destination : method.getDestinations()) {
                if (destination.getId() != null && !destination.getId().isBlank()) {
                    continue;
                }
                Optional<FulfillmentDestination> matched = storedAddresses.stream()
                        .filter(stored -> stored.sameAddressAs(destination))
                        .findFirst();
                if (matched.isPresent()) {
                    destination.setId(matched.get().getId());
                } else {
                    destination.setId("dest_" + UUID.randomUUID().toString().substring(0, 8));
                    newAddresses.add(destination.copy());
                }
            }
        }
        return newAddresses;
    }

    private void validateSelectedDestinations(FulfillmentState state) {
        for (FulfillmentMethod method : state.getMethods()) {
            if (method.getSelectedDestinationId() != null && method.selectedDestination().isEmpty()) {
                throw new InvalidFulfillmentMethodException(
                        "unknown destination: " + method.getSelectedDestinationId());
            }
        }
    }

    private void applyOptionSelections(FulfillmentState state, Collection<String> productIds, long subtotal) {
        for (FulfillmentMethod method : state.getMethods()) {
            for (FulfillmentGroup group : method.getGroups()) {
                if (!group.hasSelectedOption()) {
                    continue;
                }
                String optionId = group.getSelectedOptionId();
                FulfillmentOption option = resolveOption(method, group, optionId, productIds, subtotal)
                        .orElseThrow(() -> new InvalidFulfillmentMethodException("unknown option: " + optionId));
                group.select(option);
            }
        }
    }

    /**
     * 배송지가 선택된 method는 해당 국가에서 제공되는 옵션만 허용
     */
    private Optional<FulfillmentOption> resolveOption(FulfillmentMethod method, FulfillmentGroup group, String optionId,
                                                      Collection<String> productIds, long subtotal) {
        Optional<FulfillmentDestination> destination = method.selectedDestination();
        if (destination.isPresent()) {
            return fulfillmentResolver.calculateOptions(destination.get().countryOrDefault(), productIds, subtotal)
                    .stream()
                    .filter(option -> option.getId().equals(optionId))
                    .findFirst();
        }
        return group.findOption(optionId)
                .or(() -> fulfillmentResolver.resolveRate(optionId, productIds, subtotal));
    }
}
