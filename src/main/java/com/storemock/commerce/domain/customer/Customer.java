package com.storemock.commerce.domain.customer;

import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Customer - 이메일로 식별되는 기존 고객과 저장된 배송지 목록
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Customer {

    private String customerId;
    private String email;

    @Builder.Default
    private List<FulfillmentDestination> addresses = new ArrayList<>();

    public static Customer create(String email) {
        return Customer.builder()
                .customerId("cust_" + UUID.randomUUID().toString().substring(0, 8))
                .email(email)
                .build();
    }

    public Optional<FulfillmentDestination> findMatchingAddress(FulfillmentDestination destination) {
        return addresses.stream()
                .filter(stored -> stored.sameAddressAs(destination))
                .findFirst();
    }

    public void addAddress(FulfillmentDestination destination) {
        addresses.add(destination.copy());
    }
}
