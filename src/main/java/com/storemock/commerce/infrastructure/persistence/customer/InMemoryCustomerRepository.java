package com.storemock.commerce.infrastructure.persistence.customer;

import com.storemock.commerce.domain.customer.Customer;
import com.storemock.commerce.domain.customer.CustomerRepository;
import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import org.springframework.stereotype.Repository;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemoryCustomerRepository - 기존 고객/저장 배송지 (인메모리, 이메일 기준)
 */
@Repository
public class InMemoryCustomerRepository implements CustomerRepository {

    private final Map<String, Customer> customersByEmail = new ConcurrentHashMap<>();

    public InMemoryCustomerRepository() {
        initializeData();
    }

    private void initializeData() {
        Customer customer = Customer.builder()
                .customerId("cust_jane")
                .email("jane.doe@example.com")
                .build();
        customer.addAddress(FulfillmentDestination.builder()
                .id("addr_jane_home")
                .streetAddress("123 Main St")
                .addressLocality("Springfield")
                .addressRegion("IL")
                .postalCode("62701")
                .addressCountry("US")
                .fullName("Jane Doe")
                .build());
        save(customer);
    }

    @Override
    public Optional<Customer> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(customersByEmail.get(email.toLowerCase(Locale.ROOT)));
    }

    @Override
    public Customer save(Customer customer) {
        customersByEmail.put(customer.getEmail().toLowerCase(Locale.ROOT), customer);
        return customer;
    }
}
