package com.storemock.commerce.domain.fulfillment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 배송 방법 (shipping / pickup)
 *
 * 구조:
 * method → destinations[] + selectedDestinationId
 *        → groups[] → options[] + selectedOptionId
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FulfillmentMethod {

    private String id;
    private FulfillmentMethodType type;

    @Builder.Default
    private List<String> lineItemIds = new ArrayList<>();

    @Builder.Default
    private List<FulfillmentDestination> destinations = new ArrayList<>();

    private String selectedDestinationId;

    @Builder.Default
    private List<FulfillmentGroup> groups = new ArrayList<>();

    public Optional<FulfillmentDestination> selectedDestination() {
        if (selectedDestinationId == null) {
            return Optional.empty();
        }
        return destinations.stream()
                .filter(destination -> selectedDestinationId.equals(destination.getId()))
                .findFirst();
    }

    public boolean hasSelectedDestination() {
        return selectedDestination().isPresent();
    }

    public Optional<FulfillmentGroup> selectedGroup() {
        return groups.stream()
                .filter(FulfillmentGroup::hasSelectedOption)
                .findFirst();
    }

    public Optional<FulfillmentGroup> findGroup(String groupId) {
        return groups.stream()
                .filter(group -> group.getId() != null && group.getId().equals(groupId))
                .findFirst();
    }

    public FulfillmentMethod copy() {
        List<FulfillmentDestination> copiedDestinations = new ArrayList<>();
        destinations.forEach(destination -> copiedDestinations.add(destination.copy()));
        List<FulfillmentGroup> copiedGroups = new ArrayList<>();
        groups.forEach(group -> copiedGroups.add(group.copy()));

        return FulfillmentMethod.builder()
                .id(id)
                .type(type)
                .lineItemIds(new ArrayList<>(lineItemIds))
                .destinations(copiedDestinations)
                .selectedDestinationId(selectedDestinationId)
                .groups(copiedGroups)
                .build();
    }
}
