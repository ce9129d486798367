package com.storemock.commerce.application.fulfillment;

import com.storemock.commerce.application.checkout.dto.FulfillmentUpdateCommand;
import com.storemock.commerce.application.checkout.dto.FulfillmentUpdateCommand.GroupUpdate;
import com.storemock.commerce.application.checkout.dto.FulfillmentUpdateCommand.MethodUpdate;
import com.storemock.commerce.domain.customer.Customer;
import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import com.storemock.commerce.domain.fulfillment.FulfillmentGroup;
import com.storemock.commerce.domain.fulfillment.FulfillmentMethod;
import com.storemock.commerce.domain.fulfillment.FulfillmentMethodType;
import com.storemock.commerce.domain.fulfillment.FulfillmentOption;
import com.storemock.commerce.domain.fulfillment.FulfillmentState;
import com.storemock.commerce.domain.fulfillment.InvalidFulfillmentMethodException;
import com.storemock.commerce.infrastructure.persistence.customer.InMemoryCustomerRepository;
import com.storemock.commerce.infrastructure.persistence.fulfillment.InMemoryPromotionRepository;
import com.storemock.commerce.infrastructure.persistence.fulfillment.InMemoryShippingRateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FulfillmentReconciler 테스트")
class FulfillmentReconcilerTest {

    private static final String JANE = "jane.doe@example.com";

    private InMemoryCustomerRepository customerRepository;
    private FulfillmentReconciler reconciler;

    @BeforeEach
    void setUp() {
        customerRepository = new InMemoryCustomerRepository();
        FulfillmentResolver resolver = new FulfillmentResolver(
                new InMemoryShippingRateRepository(), new InMemoryPromotionRepository());
        reconciler = new FulfillmentReconciler(customerRepository, resolver);
    }

    @Test
    @DisplayName("ID 없는 배송지는 dest_ ID를 발급받고 새 주소로 반환")
    void testReconcile_AssignsDestinationId() {
        // Given
        FulfillmentUpdateCommand update = update(MethodUpdate.builder()
                .type("shipping")
                .destinations(List.of(address(null, "9 Elm St", "30301", "US")))
                .build());

        // When
        ReconciledFulfillment result = reconciler.reconcile(new FulfillmentState(), update,
                "new.buyer@example.com", List.of("vase_glass"), 1200L);

        // Then
        FulfillmentDestination destination = result.getState().getMethods().get(0).getDestinations().get(0);
        assertTrue(destination.getId().startsWith("dest_"));
        assertEquals(1, result.getNewAddresses().size());
        assertEquals(destination.getId(), result.getNewAddresses().get(0).getId());
    }

    @Test
    @DisplayName("구매자 이메일이 없으면 새 주소를 기록하지 않음")
    void testReconcile_NoBuyerEmail() {
        FulfillmentUpdateCommand update = update(MethodUpdate.builder()
                .type("shipping")
                .destinations(List.of(address(null, "9 Elm St", "30301", "US")))
                .build());

        ReconciledFulfillment result = reconciler.reconcile(new FulfillmentState(), update,
                null, List.of("vase_glass"), 1200L);

        assertTrue(result.getNewAddresses().isEmpty());
    }

    @Test
    @DisplayName("저장된 고객 주소와 같은 배송지는 저장된 ID 재사용 (대소문자 무시)")
    void testReconcile_ReusesStoredAddressId() {
        FulfillmentUpdateCommand update = update(MethodUpdate.builder()
                .type("shipping")
                .destinations(List.of(address(null, "123 MAIN ST", "62701", "us")))
                .build());

        ReconciledFulfillment result = reconciler.reconcile(new FulfillmentState(), update,
                JANE, List.of("vase_glass"), 1200L);

        FulfillmentDestination destination = result.getState().getMethods().get(0).getDestinations().get(0);
        assertEquals("addr_jane_home", destination.getId());
        assertTrue(result.getNewAddresses().isEmpty());
    }

    @Test
    @DisplayName("기존 고객이 배송지를 보내지 않으면 저장된 주소를 주입")
    void testReconcile_InjectsStoredAddresses() {
        FulfillmentUpdateCommand update = update(MethodUpdate.builder()
                .type("shipping")
                .selectedDestinationId("addr_jane_home")
                .build());

        ReconciledFulfillment result = reconciler.reconcile(new FulfillmentState(), update,
                JANE, List.of("vase_glass"), 1200L);

        FulfillmentMethod method = result.getState().getMethods().get(0);
        assertEquals(1, method.getDestinations().size());
        assertTrue(method.hasSelectedDestination());
    }

    @Test
    @DisplayName("존재하지 않는 배송지 선택 시 예외")
    void testReconcile_UnknownDestination() {
        FulfillmentUpdateCommand update = update(MethodUpdate.builder()
                .type("shipping")
                .destinations(List.of(address("dest_a", "9 Elm St", "30301", "US")))
                .selectedDestinationId("dest_missing")
                .build());

        assertThrows(InvalidFulfillmentMethodException.class, () -> reconciler.reconcile(
                new FulfillmentState(), update, null, List.of("vase_glass"), 1200L));
    }

    @Test
    @DisplayName("배송지가 선택되면 해당 국가 옵션 목록에서 선택")
    void testReconcile_SelectsOptionForDestinationCountry() {
        FulfillmentUpdateCommand update = update(MethodUpdate.builder()
                .type("shipping")
                .destinations(List.of(address("dest_a", "9 Elm St", "30301", "US")))
                .selectedDestinationId("dest_a")
                .groups(List.of(GroupUpdate.builder().selectedOptionId("express-ship-us").build()))
                .build());

        ReconciledFulfillment result = reconciler.reconcile(new FulfillmentState(), update,
                null, List.of("vase_glass"), 1200L);

        FulfillmentGroup group = result.getState().getMethods().get(0).getGroups().get(0);
        assertEquals("express-ship-us", group.getSelectedOptionId());
        assertEquals(1500L, group.getSelectedOptionPrice());
        assertEquals("Express Shipping (US)", group.getSelectedOptionTitle());
    }

    @Test
    @DisplayName("활성 요율이라도 배송지 국가에서 제공하지 않으면 예외")
    void testReconcile_RateNotOfferedForDestinationCountry() {
        FulfillmentUpdateCommand update = update(MethodUpdate.builder()
                .type("shipping")
                .destinations(List.of(address("dest_a", "9 Elm St", "30301", "US")))
                .selectedDestinationId("dest_a")
                .groups(List.of(GroupUpdate.builder().selectedOptionId("express-ship").build()))
                .build());

        assertThrows(InvalidFulfillmentMethodException.class, () -> reconciler.reconcile(
                new FulfillmentState(), update, null, List.of("vase_glass"), 1200L));
    }

    @Test
    @DisplayName("알 수 없는 옵션 선택 시 예외")
    void testReconcile_UnknownOption() {
        FulfillmentUpdateCommand update = update(MethodUpdate.builder()
                .type("shipping")
                .groups(List.of(GroupUpdate.builder().selectedOptionId("warp-drive").build()))
                .build());

        assertThrows(InvalidFulfillmentMethodException.class, () -> reconciler.reconcile(
                new FulfillmentState(), update, null, List.of("vase_glass"), 1200L));
    }

    @Test
    @DisplayName("merge - 같은 type의 기존 method에 병합하고 selected_option_id가 없으면 선택 해제")
    void testMerge_ClearsSelection() {
        // Given
        FulfillmentGroup group = FulfillmentGroup.builder().id("group_0_0").build();
        group.select(new FulfillmentOption("std-ship", "Standard Shipping", 500L));
        FulfillmentMethod method = FulfillmentMethod.builder()
                .id("shipping_method_0")
                .type(FulfillmentMethodType.SHIPPING)
                .build();
        method.getGroups().add(group);
        FulfillmentState existing = new FulfillmentState(List.of(method));

        FulfillmentUpdateCommand update = update(MethodUpdate.builder()
                .type("shipping")
                .groups(List.of(GroupUpdate.builder().id("group_0_0").build()))
                .build());

        // When
        FulfillmentState merged = reconciler.merge(existing, update);

        // Then
        assertEquals(1, merged.getMethods().size());
        assertFalse(merged.getMethods().get(0).getGroups().get(0).hasSelectedOption());
        assertTrue(existing.getMethods().get(0).getGroups().get(0).hasSelectedOption());
    }

    @Test
    @DisplayName("rememberAddresses - 고객이 없으면 생성 후 주소 저장")
    void testRememberAddresses_CreatesCustomer() {
        reconciler.rememberAddresses("someone@example.com",
                List.of(address("dest_x", "1 Oak Rd", "73301", "US")));

        Customer customer = customerRepository.findByEmail("someone@example.com").orElseThrow();
        assertEquals(1, customer.getAddresses().size());
        assertEquals("dest_x", customer.getAddresses().get(0).getId());
    }

    private static FulfillmentUpdateCommand update(MethodUpdate method) {
        return new FulfillmentUpdateCommand(List.of(method));
    }

    private static FulfillmentDestination address(String id, String street, String postalCode, String country) {
        return FulfillmentDestination.builder()
                .id(id)
                .streetAddress(street)
                .postalCode(postalCode)
                .addressCountry(country)
                .fullName("Test Buyer")
                .build();
    }
}
