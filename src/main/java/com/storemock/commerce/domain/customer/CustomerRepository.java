package com.storemock.commerce.domain.customer;

import java.util.Optional;

/**
 * CustomerRepository - 기존 고객 저장소 인터페이스 (Port)
 */
public interface CustomerRepository {

    Optional<Customer> findByEmail(String email);

    Customer save(Customer customer);
}
