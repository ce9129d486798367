package com.storemock.commerce.application.checkout;

import com.storemock.commerce.application.checkout.dto.CheckoutResult;
import com.storemock.commerce.application.checkout.dto.CompleteCheckoutCommand;
import com.storemock.commerce.application.checkout.dto.CreateCheckoutCommand;
import com.storemock.commerce.application.checkout.dto.LineItemCommand;
import com.storemock.commerce.application.checkout.dto.LineItemQuantityCommand;
import com.storemock.commerce.application.checkout.dto.SetFulfillmentCommand;
import com.storemock.commerce.application.checkout.dto.SetPaymentCommand;
import com.storemock.commerce.application.checkout.dto.UpdateCheckoutCommand;
import com.storemock.commerce.application.fulfillment.FulfillmentReconciler;
import com.storemock.commerce.application.fulfillment.FulfillmentResolver;
import com.storemock.commerce.application.order.OrderFactory;
import com.storemock.commerce.common.exception.ErrorKind;
import com.storemock.commerce.config.CommerceProperties;
import com.storemock.commerce.domain.checkout.Checkout;
import com.storemock.commerce.domain.checkout.CheckoutLineItem;
import com.storemock.commerce.domain.checkout.CheckoutNotFoundException;
import com.storemock.commerce.domain.checkout.CheckoutStatus;
import com.storemock.commerce.domain.checkout.EmptyCheckoutException;
import com.storemock.commerce.domain.checkout.InvalidCheckoutStatusException;
import com.storemock.commerce.domain.checkout.LineItemNotFoundException;
import com.storemock.commerce.domain.discount.InvalidDiscountCodeException;
import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import com.storemock.commerce.domain.fulfillment.FulfillmentGroup;
import com.storemock.commerce.domain.fulfillment.FulfillmentOption;
import com.storemock.commerce.domain.fulfillment.FulfillmentRequiredException;
import com.storemock.commerce.domain.fulfillment.InvalidFulfillmentMethodException;
import com.storemock.commerce.domain.order.Order;
import com.storemock.commerce.domain.order.OrderStatus;
import com.storemock.commerce.domain.order.event.CheckoutCompletedEvent;
import com.storemock.commerce.domain.product.InsufficientStockException;
import com.storemock.commerce.domain.product.InvalidQuantityException;
import com.storemock.commerce.domain.product.ProductNotFoundException;
import com.storemock.commerce.infrastructure.persistence.checkout.InMemoryCheckoutRepository;
import com.storemock.commerce.infrastructure.persistence.customer.InMemoryCustomerRepository;
import com.storemock.commerce.infrastructure.persistence.discount.InMemoryDiscountRepository;
import com.storemock.commerce.infrastructure.persistence.fulfillment.InMemoryPromotionRepository;
import com.storemock.commerce.infrastructure.persistence.fulfillment.InMemoryShippingRateRepository;
import com.storemock.commerce.infrastructure.persistence.order.InMemoryOrderRepository;
import com.storemock.commerce.infrastructure.persistence.product.InMemoryProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * CheckoutServiceTest - 체크아웃 상태 머신 테스트
 *
 * 인메모리 저장소(기본 카탈로그 데이터)와 실제 계산 컴포넌트를 사용하고
 * 이벤트 발행만 Mock으로 검증합니다.
 *
 * 카탈로그:
 * - bouquet_roses 3500 (재고 50), bouquet_sunflowers 2500 (재고 30)
 * - orchid_white 4500 (재고 10), seasonal_wreath 6000 (재고 0)
 * 할인: 10OFF(10%), 20OFF(20%), SAVE5($5), EXPIRED(비활성)
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CheckoutService 테스트")
class CheckoutServiceTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private InMemoryCheckoutRepository checkoutRepository;
    private InMemoryOrderRepository orderRepository;
    private CheckoutService checkoutService;

    @BeforeEach
    void setUp() {
        checkoutRepository = new InMemoryCheckoutRepository();
        orderRepository = new InMemoryOrderRepository();
        PricingEngine pricingEngine = new PricingEngine();
        FulfillmentResolver resolver = new FulfillmentResolver(
                new InMemoryShippingRateRepository(), new InMemoryPromotionRepository());
        FulfillmentReconciler reconciler = new FulfillmentReconciler(new InMemoryCustomerRepository(), resolver);

        checkoutService = new CheckoutService(
                checkoutRepository,
                new InMemoryProductRepository(),
                new InMemoryDiscountRepository(),
                orderRepository,
                pricingEngine,
                resolver,
                reconciler,
                new OrderFactory(),
                new CommerceProperties(),
                eventPublisher);
    }

    // ========== 생성 ==========

    @Test
    @DisplayName("생성 - incomplete 상태, 카탈로그 가격으로 subtotal 계산, 기본 배송 method 생성")
    void testCreate_Success() {
        // When
        CheckoutResult result = checkoutService.create(createCommand(line("bouquet_roses", 2)));

        // Then
        Checkout checkout = result.getCheckout();
        assertEquals(CheckoutStatus.INCOMPLETE, checkout.getStatus());
        assertEquals("USD", checkout.getCurrency());
        assertEquals("Bouquet of Red Roses", checkout.getLineItems().get(0).getTitle());
        assertEquals(7000L, checkout.getSubtotal());
        assertEquals(7000L, checkout.getTotal());
        assertEquals("shipping_method_0", checkout.getFulfillment().getMethods().get(0).getId());
        assertEquals(1L, checkoutRepository.count());
    }

    @Test
    @DisplayName("생성 - 카탈로그에 없는 상품이면 저장하지 않음")
    void testCreate_UnknownProduct() {
        ProductNotFoundException exception = assertThrows(ProductNotFoundException.class,
                () -> checkoutService.create(createCommand(line("unicorn", 1))));

        assertEquals(ErrorKind.VALIDATION_ERROR, exception.getErrorKind());
        assertEquals(0L, checkoutRepository.count());
    }

    @Test
    @DisplayName("생성 - 같은 상품 라인의 합산 수량이 재고를 넘으면 실패")
    void testCreate_MergedQuantityExceedsStock() {
        assertThrows(InsufficientStockException.class,
                () -> checkoutService.create(createCommand(line("orchid_white", 6), line("orchid_white", 5))));
        assertEquals(0L, checkoutRepository.count());
    }

    @Test
    @DisplayName("생성 - 재고 0인 상품과 0 이하 수량은 거부")
    void testCreate_OutOfStockAndInvalidQuantity() {
        assertThrows(InsufficientStockException.class,
                () -> checkoutService.create(createCommand(line("seasonal_wreath", 1))));
        assertThrows(InvalidQuantityException.class,
                () -> checkoutService.create(createCommand(line("bouquet_roses", 0))));
    }

    @Test
    @DisplayName("조회 - 없는 체크아웃은 NOT_FOUND")
    void testGet_NotFound() {
        CheckoutNotFoundException exception = assertThrows(CheckoutNotFoundException.class,
                () -> checkoutService.get("missing"));

        assertEquals(ErrorKind.NOT_FOUND, exception.getErrorKind());
    }

    // ========== 라인 아이템 ==========

    @Test
    @DisplayName("라인 아이템 추가 - 같은 상품은 수량 합산, 재고 초과 시 기존 수량 유지")
    void testAddLineItem_MergesAndValidatesStock() {
        // Given
        String checkoutId = checkoutService.create(createCommand(line("orchid_white", 6))).getCheckout().getCheckoutId();

        // When
        CheckoutResult merged = checkoutService.addLineItem(checkoutId, new LineItemCommand("orchid_white", null, 2));

        // Then
        assertEquals(1, merged.getCheckout().getLineItems().size());
        assertEquals(8, merged.getCheckout().getLineItems().get(0).getQuantity());

        assertThrows(InsufficientStockException.class,
                () -> checkoutService.addLineItem(checkoutId, new LineItemCommand("orchid_white", null, 3)));
        assertEquals(8, checkoutService.get(checkoutId).getCheckout().getLineItems().get(0).getQuantity());
    }

    @Test
    @DisplayName("라인 아이템 수량 0 변경 시 삭제, subtotal은 항상 라인 합계와 일치")
    void testUpdateLineItem_ZeroRemoves() {
        // Given
        Checkout created = checkoutService.create(createCommand(line("bouquet_roses", 1), line("vase_glass", 2)))
                .getCheckout();
        String vaseLineId = created.getLineItems().get(1).getLineItemId();

        // When
        Checkout updated = checkoutService.updateLineItem(created.getCheckoutId(), vaseLineId, 0).getCheckout();

        // Then
        assertEquals(1, updated.getLineItems().size());
        assertEquals(3500L, updated.getSubtotal());
        assertEquals(sumOfLines(updated), updated.getSubtotal());
    }

    @Test
    @DisplayName("라인 아이템 삭제 - 없는 라인 아이템이면 NOT_FOUND")
    void testRemoveLineItem_NotFound() {
        String checkoutId = checkoutService.create(createCommand(line("bouquet_roses", 1))).getCheckout().getCheckoutId();

        assertThrows(LineItemNotFoundException.class, () -> checkoutService.removeLineItem(checkoutId, "li_missing"));
    }

    // ========== 할인 ==========

    @Test
    @DisplayName("할인 적용 - 10% 할인")
    void testApplyDiscount_Success() {
        String checkoutId = checkoutService.create(createCommand(line("bouquet_roses", 2))).getCheckout().getCheckoutId();

        CheckoutResult result = checkoutService.applyDiscount(checkoutId, "10off");

        assertEquals(700L, result.getCheckout().getDiscountAmount());
        assertEquals(6300L, result.getCheckout().getTotal());
        assertEquals("10% Off", result.getPricing().getDiscounts().get(0).getTitle());
    }

    @Test
    @DisplayName("할인 적용 - 비활성/없는 코드는 거부하고 체크아웃은 변경되지 않음")
    void testApplyDiscount_InvalidCodeLeavesCheckoutUnchanged() {
        String checkoutId = checkoutService.create(createCommand(line("bouquet_roses", 2))).getCheckout().getCheckoutId();

        assertThrows(InvalidDiscountCodeException.class, () -> checkoutService.applyDiscount(checkoutId, "EXPIRED"));
        assertThrows(InvalidDiscountCodeException.class, () -> checkoutService.applyDiscount(checkoutId, "NOPE"));

        Checkout stored = checkoutService.get(checkoutId).getCheckout();
        assertTrue(stored.getAppliedDiscounts().isEmpty());
        assertEquals(7000L, stored.getTotal());
    }

    @Test
    @DisplayName("일반 업데이트 - 할인 코드 중 하나라도 잘못되면 아무 코드도 적용하지 않음")
    void testUpdate_DiscountCodesAllOrNothing() {
        String checkoutId = checkoutService.create(createCommand(line("bouquet_roses", 2))).getCheckout().getCheckoutId();
        UpdateCheckoutCommand command = UpdateCheckoutCommand.builder()
                .discountCodes(List.of("10OFF", "BOGUS"))
                .build();

        assertThrows(InvalidDiscountCodeException.class, () -> checkoutService.update(checkoutId, command));
        assertTrue(checkoutService.get(checkoutId).getCheckout().getAppliedDiscounts().isEmpty());
    }

    @Test
    @DisplayName("일반 업데이트 - 없는 라인 아이템 ID는 거부")
    void testUpdate_UnknownLineItem() {
        String checkoutId = checkoutService.create(createCommand(line("bouquet_roses", 2))).getCheckout().getCheckoutId();
        UpdateCheckoutCommand command = UpdateCheckoutCommand.builder()
                .lineItems(List.of(new LineItemQuantityCommand("li_missing", 3)))
                .build();

        assertThrows(LineItemNotFoundException.class, () -> checkoutService.update(checkoutId, command));
    }

    // ========== 배송 ==========

    @Test
    @DisplayName("배송 방법 지정 - 배송비 포함 total, 무료배송 기준 이상이면 standard 0원")
    void testSetFulfillment_PricesShipping() {
        // Given
        String cheapId = checkoutService.create(createCommand(line("bouquet_sunflowers", 1))).getCheckout().getCheckoutId();
        String freeId = checkoutService.create(createCommand(line("bouquet_roses", 2))).getCheckout().getCheckoutId();

        // When
        Checkout cheap = checkoutService.setFulfillment(cheapId, new SetFulfillmentCommand("std-ship", usAddress()))
                .getCheckout();
        Checkout free = checkoutService.setFulfillment(freeId, new SetFulfillmentCommand("std-ship", usAddress()))
                .getCheckout();

        // Then
        assertEquals(500L, cheap.getFulfillmentPrice());
        assertEquals(3000L, cheap.getTotal());
        assertEquals(0L, free.getFulfillmentPrice());
        assertEquals(7000L, free.getTotal());
        assertTrue(free.getFulfillment().hasSelectedDestination());
    }

    @Test
    @DisplayName("배송 방법 지정 - 배송지 국가에서 제공하지 않는 요율은 거부, 기존 상태 유지")
    void testSetFulfillment_RateNotOfferedForCountry() {
        // Given
        String checkoutId = checkoutService.create(createCommand(line("bouquet_roses", 1))).getCheckout().getCheckoutId();

        // When
        InvalidFulfillmentMethodException exception = assertThrows(InvalidFulfillmentMethodException.class,
                () -> checkoutService.setFulfillment(checkoutId, new SetFulfillmentCommand("std-ship-ca", usAddress())));

        // Then
        assertEquals(ErrorKind.VALIDATION_ERROR, exception.getErrorKind());
        Checkout checkout = checkoutService.get(checkoutId).getCheckout();
        assertFalse(checkout.getFulfillment().hasSelectedOption());
        assertEquals(3500L, checkout.getTotal());
    }

    @Test
    @DisplayName("선택된 옵션이 배송지 옵션 목록에서 사라지면 선택 해제, 완료는 FULFILLMENT_REQUIRED")
    void testComplete_StaleOptionSelectionCleared() {
        // Given
        String checkoutId = readyCheckout();
        Checkout stored = checkoutRepository.findById(checkoutId).orElseThrow();
        FulfillmentGroup group = stored.getFulfillment().getMethods().get(0).getGroups().get(0);
        group.select(new FulfillmentOption("std-ship-ca", "Standard Shipping (Canada)", 900L));
        checkoutRepository.save(stored);

        // When
        Checkout refreshed = checkoutService.get(checkoutId).getCheckout();

        // Then
        assertFalse(refreshed.getFulfillment().hasSelectedOption());
        assertEquals(0L, refreshed.getFulfillmentPrice());
        assertThrows(FulfillmentRequiredException.class,
                () -> checkoutService.complete(checkoutId, CompleteCheckoutCommand.empty()));
        assertEquals(0, orderRepository.findAll(null, 10, 0).size());
    }

    // ========== 완료 ==========

    @Test
    @DisplayName("완료 - 배송 정보 미선택이면 FULFILLMENT_REQUIRED, 상태 유지")
    void testComplete_FulfillmentRequired() {
        String checkoutId = checkoutService.create(createCommand(line("bouquet_roses", 1))).getCheckout().getCheckoutId();

        FulfillmentRequiredException exception = assertThrows(FulfillmentRequiredException.class,
                () -> checkoutService.complete(checkoutId, CompleteCheckoutCommand.empty()));

        assertEquals(ErrorKind.FULFILLMENT_REQUIRED, exception.getErrorKind());
        assertEquals(CheckoutStatus.INCOMPLETE, checkoutService.get(checkoutId).getCheckout().getStatus());
        verify(eventPublisher, never()).publishEvent(any(CheckoutCompletedEvent.class));
    }

    @Test
    @DisplayName("완료 - 라인 아이템이 없으면 거부")
    void testComplete_Empty() {
        String checkoutId = checkoutService.create(createCommand()).getCheckout().getCheckoutId();

        assertThrows(EmptyCheckoutException.class,
                () -> checkoutService.complete(checkoutId, CompleteCheckoutCommand.empty()));
    }

    @Test
    @DisplayName("완료 - 실패 유도 결제수단은 PAYMENT_FAILURE, 다른 결제수단으로 재시도하면 주문 생성")
    void testComplete_PaymentFailureThenRetry() {
        // Given
        String checkoutId = readyCheckout();

        // When: 실패 유도 결제수단
        PaymentFailedException failure = assertThrows(PaymentFailedException.class,
                () -> checkoutService.complete(checkoutId, new CompleteCheckoutCommand("instr_fail", null)));

        // Then
        assertEquals(ErrorKind.PAYMENT_FAILURE, failure.getErrorKind());
        assertEquals(CheckoutStatus.INCOMPLETE, checkoutService.get(checkoutId).getCheckout().getStatus());

        // When: 재시도
        CheckoutResult result = checkoutService.complete(checkoutId, new CompleteCheckoutCommand("instr_visa", null));

        // Then
        assertEquals(CheckoutStatus.COMPLETED, result.getCheckout().getStatus());
        Order order = result.getOrder();
        assertNotNull(order);
        assertEquals(OrderStatus.CONFIRMED, order.getStatus());
        assertEquals(order.getOrderId(), result.getCheckout().getOrderId());
        assertEquals(3000L, order.getTotal());
        assertEquals("Standard Shipping", order.getExpectations().get(0).getDescription());
        assertTrue(orderRepository.findById(order.getOrderId()).isPresent());
        verify(eventPublisher).publishEvent(any(CheckoutCompletedEvent.class));
    }

    @Test
    @DisplayName("완료 - 저장된 결제수단이 실패 유도 ID이면 거부")
    void testComplete_StoredPaymentFailure() {
        String checkoutId = readyCheckout();
        checkoutService.setPayment(checkoutId, new SetPaymentCommand(null, Map.of("id", "instr_fail")));

        assertThrows(PaymentFailedException.class,
                () -> checkoutService.complete(checkoutId, CompleteCheckoutCommand.empty()));
    }

    // ========== 종료 상태 ==========

    @Test
    @DisplayName("완료된 체크아웃은 취소/변경 불가, 조회는 가능")
    void testTerminal_CompletedRejectsMutations() {
        // Given
        String checkoutId = readyCheckout();
        checkoutService.complete(checkoutId, CompleteCheckoutCommand.empty());

        // When & Then
        InvalidCheckoutStatusException exception = assertThrows(InvalidCheckoutStatusException.class,
                () -> checkoutService.cancel(checkoutId));
        assertEquals(ErrorKind.INVALID_STATE, exception.getErrorKind());
        assertThrows(InvalidCheckoutStatusException.class,
                () -> checkoutService.addLineItem(checkoutId, new LineItemCommand("vase_glass", null, 1)));
        assertThrows(InvalidCheckoutStatusException.class,
                () -> checkoutService.complete(checkoutId, CompleteCheckoutCommand.empty()));

        CheckoutResult fetched = checkoutService.get(checkoutId);
        assertEquals(CheckoutStatus.COMPLETED, fetched.getCheckout().getStatus());
        assertNotNull(fetched.getOrder());
    }

    @Test
    @DisplayName("취소 - incomplete → canceled, 이후 변경 불가")
    void testCancel_ThenRejectsMutations() {
        String checkoutId = checkoutService.create(createCommand(line("bouquet_roses", 1))).getCheckout().getCheckoutId();

        CheckoutResult canceled = checkoutService.cancel(checkoutId);

        assertEquals(CheckoutStatus.CANCELED, canceled.getCheckout().getStatus());
        assertThrows(InvalidCheckoutStatusException.class, () -> checkoutService.applyDiscount(checkoutId, "10OFF"));
        assertThrows(InvalidCheckoutStatusException.class, () -> checkoutService.cancel(checkoutId));
    }

    // ========== 헬퍼 ==========

    private String readyCheckout() {
        String checkoutId = checkoutService.create(createCommand(line("bouquet_sunflowers", 1)))
                .getCheckout().getCheckoutId();
        checkoutService.setFulfillment(checkoutId, new SetFulfillmentCommand("std-ship", usAddress()));
        return checkoutId;
    }

    private static CreateCheckoutCommand createCommand(LineItemCommand... lines) {
        return CreateCheckoutCommand.builder()
                .buyer(Map.of("email", "buyer@example.com"))
                .lineItems(List.of(lines))
                .build();
    }

    private static LineItemCommand line(String productId, int quantity) {
        return new LineItemCommand(productId, null, quantity);
    }

    private static FulfillmentDestination usAddress() {
        return FulfillmentDestination.builder()
                .streetAddress("500 Market St")
                .addressLocality("San Francisco")
                .addressRegion("CA")
                .postalCode("94105")
                .addressCountry("US")
                .fullName("Test Buyer")
                .build();
    }

    private static long sumOfLines(Checkout checkout) {
        return checkout.getLineItems().stream().mapToLong(CheckoutLineItem::lineTotal).sum();
    }
}
