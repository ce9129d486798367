package com.storemock.commerce.application.checkout;

import com.storemock.commerce.application.checkout.dto.CheckoutResult;
import com.storemock.commerce.application.checkout.dto.CompleteCheckoutCommand;
import com.storemock.commerce.application.checkout.dto.CreateCheckoutCommand;
import com.storemock.commerce.application.checkout.dto.FulfillmentUpdateCommand;
import com.storemock.commerce.application.checkout.dto.FulfillmentUpdateCommand.GroupUpdate;
import com.storemock.commerce.application.checkout.dto.FulfillmentUpdateCommand.MethodUpdate;
import com.storemock.commerce.application.checkout.dto.LineItemCommand;
import com.storemock.commerce.application.checkout.dto.LineItemQuantityCommand;
import com.storemock.commerce.application.checkout.dto.SetFulfillmentCommand;
import com.storemock.commerce.application.checkout.dto.SetPaymentCommand;
import com.storemock.commerce.application.checkout.dto.UpdateCheckoutCommand;
import com.storemock.commerce.application.fulfillment.FulfillmentReconciler;
import com.storemock.commerce.application.fulfillment.FulfillmentResolver;
import com.storemock.commerce.application.fulfillment.ReconciledFulfillment;
import com.storemock.commerce.application.order.OrderFactory;
import com.storemock.commerce.config.CommerceProperties;
import com.storemock.commerce.domain.checkout.Checkout;
import com.storemock.commerce.domain.checkout.CheckoutLineItem;
import com.storemock.commerce.domain.checkout.CheckoutNotFoundException;
import com.storemock.commerce.domain.checkout.CheckoutRepository;
import com.storemock.commerce.domain.checkout.EmptyCheckoutException;
import com.storemock.commerce.domain.checkout.PaymentSelection;
import com.storemock.commerce.domain.discount.Discount;
import com.storemock.commerce.domain.discount.DiscountRepository;
import com.storemock.commerce.domain.discount.InvalidDiscountCodeException;
import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import com.storemock.commerce.domain.fulfillment.FulfillmentMethodType;
import com.storemock.commerce.domain.fulfillment.FulfillmentRequiredException;
import com.storemock.commerce.domain.fulfillment.FulfillmentState;
import com.storemock.commerce.domain.order.Order;
import com.storemock.commerce.domain.order.OrderRepository;
import com.storemock.commerce.domain.order.event.CheckoutCompletedEvent;
import com.storemock.commerce.domain.product.InsufficientStockException;
import com.storemock.commerce.domain.product.InvalidQuantityException;
import com.storemock.commerce.domain.product.Product;
import com.storemock.commerce.domain.product.ProductNotFoundException;
import com.storemock.commerce.domain.product.ProductRepository;
import com.storemock.commerce.infrastructure.lock.KeyedLock;
import com.storemock.commerce.infrastructure.lock.LockKeyGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * CheckoutService - 체크아웃 상태 머신 (Application 계층)
 *
 * 역할:
 * - 체크아웃 생성/조회/변경/완료/취소 유스케이스 처리
 * - 모든 변경 후 배송 옵션 갱신과 금액 재계산
 * - 완료 시 주문 생성 및 CheckoutCompletedEvent 발행
 *
 * 비즈니스 규칙:
 * - incomplete 상태에서만 변경/완료/취소 가능 (종료 상태는 모든 변경 거부)
 * - 모든 검증은 저장 전에 수행 (실패 시 저장 상태 변경 없음)
 * - 재고 검증은 같은 상품의 합산 수량 기준
 * - 완료 검증 순서: 라인 아이템 → 배송지/배송 옵션 → 결제수단
 *
 * 동시성:
 * - 체크아웃 ID 단위로 @KeyedLock 적용 (같은 체크아웃에 대한 변경 직렬화)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutService {

    private final CheckoutRepository checkoutRepository;
    private final ProductRepository productRepository;
    private final DiscountRepository discountRepository;
    private final OrderRepository orderRepository;
    private final PricingEngine pricingEngine;
    private final FulfillmentResolver fulfillmentResolver;
    private final FulfillmentReconciler fulfillmentReconciler;
    private final OrderFactory orderFactory;
    private final CommerceProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * 체크아웃 생성 (incomplete)
     *
     * @throws ProductNotFoundException 카탈로그에 없는 상품
     * @throws InsufficientStockException 합산 수량이 재고 초과
     */
    public CheckoutResult create(CreateCheckoutCommand command) {
        List<LineItemCommand> items = command.getLineItems() == null ? List.of() : command.getLineItems();

        // 1. 라인 아이템 검증 (같은 상품+variant는 합산 수량 기준)
        Map<String, Integer> mergedQuantities = new LinkedHashMap<>();
        Map<String, Product> products = new LinkedHashMap<>();
        for (LineItemCommand item : items) {
            validateQuantity(item.getQuantity());
            Product product = getProduct(item.getProductId());
            products.put(product.getProductId(), product);
            mergedQuantities.merge(product.getProductId(), item.getQuantity(), Integer::sum);
        }
        mergedQuantities.forEach((productId, quantity) -> validateStock(products.get(productId), quantity));

        // 2. 체크아웃 생성
        Checkout checkout = Checkout.create(command.getCurrency(), command.getBuyer());
        for (LineItemCommand item : items) {
            checkout.addLineItem(products.get(item.getProductId()), item.getVariantId(), item.getQuantity());
        }
        if (command.getPayment() != null) {
            checkout.selectPayment(toPaymentSelection(command.getPayment()));
        }

        // 3. 배송 정보 병합
        List<FulfillmentDestination> newAddresses = List.of();
        if (command.getFulfillment() != null) {
            newAddresses = applyFulfillmentUpdate(checkout, command.getFulfillment());
        }

        PriceBreakdown pricing = reprice(checkout);
        checkoutRepository.save(checkout);
        fulfillmentReconciler.rememberAddresses(checkout.getBuyerEmail(), newAddresses);

        log.info("[CheckoutService] 체크아웃 생성 - checkoutId={}, lineItems={}, total={}",
                checkout.getCheckoutId(), checkout.getLineItems().size(), checkout.getTotal());
        return toResult(checkout, pricing);
    }

    /**
     * 체크아웃 조회 (배송 옵션과 금액을 현재 기준으로 다시 계산, 저장하지 않음)
     */
    public CheckoutResult get(String checkoutId) {
        Checkout checkout = getCheckout(checkoutId);
        PriceBreakdown pricing = checkout.getStatus().isMutable()
                ? reprice(checkout)
                : pricingEngine.recalculate(checkout);
        return toResult(checkout, pricing);
    }

    /**
     * 일반 업데이트 (부분 업데이트)
     *
     * 처리 순서: 통화 → 구매자 → 라인 아이템 수량 → 할인 코드 → 결제 → 배송
     */
    @KeyedLock(key = LockKeyGenerator.CHECKOUT_KEY_TEMPLATE)
    public CheckoutResult update(String checkoutId, UpdateCheckoutCommand command) {
        Checkout checkout = getCheckout(checkoutId);
        checkout.ensureMutable("update");

        if (command.getCurrency() != null) {
            checkout.changeCurrency(command.getCurrency());
        }
        if (command.getBuyer() != null) {
            checkout.changeBuyer(command.getBuyer());
        }
        if (command.getLineItems() != null) {
            for (LineItemQuantityCommand change : command.getLineItems()) {
                changeQuantity(checkout, change.getLineItemId(), change.getQuantity());
            }
        }
        if (command.getDiscountCodes() != null) {
            List<Discount> discounts = new ArrayList<>();
            for (String code : command.getDiscountCodes()) {
                discounts.add(getActiveDiscount(code));
            }
            discounts.forEach(checkout::applyDiscount);
        }
        if (command.getPayment() != null) {
            checkout.selectPayment(toPaymentSelection(command.getPayment()));
        }

        List<FulfillmentDestination> newAddresses = List.of();
        if (command.getFulfillment() != null) {
            newAddresses = applyFulfillmentUpdate(checkout, command.getFulfillment());
        }

        PriceBreakdown pricing = reprice(checkout);
        checkoutRepository.save(checkout);
        fulfillmentReconciler.rememberAddresses(checkout.getBuyerEmail(), newAddresses);

        log.info("[CheckoutService] 체크아웃 업데이트 - checkoutId={}, total={}", checkoutId, checkout.getTotal());
        return toResult(checkout, pricing);
    }

    /**
     * 라인 아이템 추가 (같은 상품+variant가 있으면 수량 합산)
     */
    @KeyedLock(key = LockKeyGenerator.CHECKOUT_KEY_TEMPLATE)
    public CheckoutResult addLineItem(String checkoutId, LineItemCommand command) {
        Checkout checkout = getCheckout(checkoutId);
        checkout.ensureMutable("add_line_item");

        validateQuantity(command.getQuantity());
        Product product = getProduct(command.getProductId());
        int existingQuantity = checkout.findLineItemByProduct(product.getProductId(), command.getVariantId())
                .map(CheckoutLineItem::getQuantity)
                .orElse(0);
        validateStock(product, existingQuantity + command.getQuantity());

        checkout.addLineItem(product, command.getVariantId(), command.getQuantity());
        return saveAndReprice(checkout);
    }

    /**
     * 라인 아이템 수량 변경 (0 이하이면 삭제)
     */
    @KeyedLock(key = LockKeyGenerator.CHECKOUT_KEY_TEMPLATE)
    public CheckoutResult updateLineItem(String checkoutId, String lineItemId, int quantity) {
        Checkout checkout = getCheckout(checkoutId);
        checkout.ensureMutable("update_line_item");

        changeQuantity(checkout, lineItemId, quantity);
        return saveAndReprice(checkout);
    }

    @KeyedLock(key = LockKeyGenerator.CHECKOUT_KEY_TEMPLATE)
    public CheckoutResult removeLineItem(String checkoutId, String lineItemId) {
        Checkout checkout = getCheckout(checkoutId);
        checkout.ensureMutable("remove_line_item");

        checkout.removeLineItem(lineItemId);
        return saveAndReprice(checkout);
    }

    /**
     * 할인 코드 적용
     *
     * @throws InvalidDiscountCodeException 존재하지 않거나 비활성 코드
     */
    @KeyedLock(key = LockKeyGenerator.CHECKOUT_KEY_TEMPLATE)
    public CheckoutResult applyDiscount(String checkoutId, String code) {
        Checkout checkout = getCheckout(checkoutId);
        checkout.ensureMutable("apply_discount");

        checkout.applyDiscount(getActiveDiscount(code));
        return saveAndReprice(checkout);
    }

    /**
     * 배송 방법 직접 지정 (methodId = 배송 요율 ID, 배송지 1개)
     */
    @KeyedLock(key = LockKeyGenerator.CHECKOUT_KEY_TEMPLATE)
    public CheckoutResult setFulfillment(String checkoutId, SetFulfillmentCommand command) {
        Checkout checkout = getCheckout(checkoutId);
        checkout.ensureMutable("set_fulfillment");

        FulfillmentDestination address = command.getAddress().copy();
        if (address.getId() == null || address.getId().isBlank()) {
            address.setId("dest_" + UUID.randomUUID().toString().substring(0, 8));
        }

        FulfillmentState current = checkout.getFulfillment();
        String methodId = current.isEmpty() ? null : current.getMethods().get(0).getId();
        MethodUpdate methodUpdate = MethodUpdate.builder()
                .id(methodId)
                .type(FulfillmentMethodType.SHIPPING.getValue())
                .destinations(List.of(address))
                .selectedDestinationId(address.getId())
                .groups(List.of(GroupUpdate.builder().selectedOptionId(command.getMethodId()).build()))
                .build();

        List<FulfillmentDestination> newAddresses =
                applyFulfillmentUpdate(checkout, new FulfillmentUpdateCommand(List.of(methodUpdate)));

        PriceBreakdown pricing = reprice(checkout);
        checkoutRepository.save(checkout);
        fulfillmentReconciler.rememberAddresses(checkout.getBuyerEmail(), newAddresses);

        log.info("[CheckoutService] 배송 방법 지정 - checkoutId={}, rateId={}, fulfillment={}",
                checkoutId, command.getMethodId(), checkout.getFulfillmentPrice());
        return toResult(checkout, pricing);
    }

    @KeyedLock(key = LockKeyGenerator.CHECKOUT_KEY_TEMPLATE)
    public CheckoutResult setPayment(String checkoutId, SetPaymentCommand command) {
        Checkout checkout = getCheckout(checkoutId);
        checkout.ensureMutable("set_payment");

        checkout.selectPayment(toPaymentSelection(command));
        return saveAndReprice(checkout);
    }

    /**
     * 체크아웃 완료 (incomplete → completed, 주문 생성)
     *
     * @throws EmptyCheckoutException 라인 아이템 없음
     * @throws FulfillmentRequiredException 배송지 또는 배송 옵션 미선택
     * @throws PaymentFailedException 실패 유도용 결제수단 (체크아웃은 incomplete 유지)
     */
    @KeyedLock(key = LockKeyGenerator.CHECKOUT_KEY_TEMPLATE)
    public CheckoutResult complete(String checkoutId, CompleteCheckoutCommand command) {
        Checkout checkout = getCheckout(checkoutId);
        checkout.ensureMutable("complete");

        if (!checkout.hasLineItems()) {
            throw new EmptyCheckoutException(checkoutId);
        }

        PriceBreakdown pricing = reprice(checkout);
        FulfillmentState fulfillment = checkout.getFulfillment();
        if (!fulfillment.hasSelectedDestination() || !fulfillment.hasSelectedOption()) {
            log.warn("[CheckoutService] 배송 정보 미선택 - checkoutId={}", checkoutId);
            throw new FulfillmentRequiredException(checkoutId);
        }

        String instrumentId = resolveInstrumentId(checkout, command);
        if (properties.getPayment().getFailureInstrumentId().equals(instrumentId)) {
            log.warn("[CheckoutService] 결제 실패 - checkoutId={}, instrumentId={}", checkoutId, instrumentId);
            throw new PaymentFailedException(checkoutId, instrumentId);
        }

        Order order = orderFactory.createFromCheckout(checkout, pricing);
        orderRepository.save(order);

        checkout.complete(order.getOrderId());
        checkoutRepository.save(checkout);

        eventPublisher.publishEvent(CheckoutCompletedEvent.of(checkoutId, order.getOrderId(),
                command.getAgentReference()));

        log.info("[CheckoutService] 체크아웃 완료 - checkoutId={}, orderId={}, total={}",
                checkoutId, order.getOrderId(), order.getTotal());
        return new CheckoutResult(checkout, pricing, order);
    }

    /**
     * 체크아웃 취소 (incomplete → canceled)
     */
    @KeyedLock(key = LockKeyGenerator.CHECKOUT_KEY_TEMPLATE)
    public CheckoutResult cancel(String checkoutId) {
        Checkout checkout = getCheckout(checkoutId);
        checkout.cancel();

        PriceBreakdown pricing = pricingEngine.recalculate(checkout);
        checkoutRepository.save(checkout);

        log.info("[CheckoutService] 체크아웃 취소 - checkoutId={}", checkoutId);
        return toResult(checkout, pricing);
    }

    // ========== 내부 처리 ==========

    /**
     * 배송 옵션 갱신 후 금액 재계산
     *
     * 1. 라인 아이템 기준 subtotal 계산 (무료배송 판정용)
     * 2. 배송 옵션 갱신 (선택된 옵션 가격/제목 재기록)
     * 3. 갱신된 배송비 포함 최종 금액 계산
     */
    private PriceBreakdown reprice(Checkout checkout) {
        long subtotal = pricingEngine.recalculate(checkout).getSubtotal();
        checkout.refreshFulfillment(fulfillmentResolver.refresh(
                checkout.getFulfillment(), checkout.lineItemIds(), checkout.productIds(), subtotal));

        PriceBreakdown pricing = pricingEngine.recalculate(checkout);
        checkout.applyPricing(pricing.getSubtotal(), pricing.getDiscountAmount(),
                pricing.getFulfillmentPrice(), pricing.getTotal());
        return pricing;
    }

    private CheckoutResult saveAndReprice(Checkout checkout) {
        PriceBreakdown pricing = reprice(checkout);
        checkoutRepository.save(checkout);
        log.debug("[CheckoutService] 금액 재계산 - checkoutId={}, subtotal={}, discount={}, fulfillment={}, total={}",
                checkout.getCheckoutId(), pricing.getSubtotal(), pricing.getDiscountAmount(),
                pricing.getFulfillmentPrice(), pricing.getTotal());
        return toResult(checkout, pricing);
    }

    private List<FulfillmentDestination> applyFulfillmentUpdate(Checkout checkout, FulfillmentUpdateCommand update) {
        long subtotal = pricingEngine.recalculate(checkout).getSubtotal();
        ReconciledFulfillment reconciled = fulfillmentReconciler.reconcile(
                checkout.getFulfillment(), update, checkout.getBuyerEmail(), checkout.productIds(), subtotal);
        checkout.replaceFulfillment(reconciled.getState());
        return reconciled.getNewAddresses();
    }

    private void changeQuantity(Checkout checkout, String lineItemId, int quantity) {
        CheckoutLineItem item = checkout.getLineItem(lineItemId);
        if (quantity > 0) {
            validateStock(getProduct(item.getProductId()), quantity);
        }
        checkout.changeLineItemQuantity(lineItemId, quantity);
    }

    private String resolveInstrumentId(Checkout checkout, CompleteCheckoutCommand command) {
        if (command.getPaymentInstrumentId() != null) {
            return command.getPaymentInstrumentId();
        }
        return checkout.getPayment() == null ? null : checkout.getPayment().getInstrumentId();
    }

    private PaymentSelection toPaymentSelection(SetPaymentCommand command) {
        String handlerId = command.getHandlerId() == null
                ? properties.getPayment().getHandlerId()
                : command.getHandlerId();
        return PaymentSelection.of(handlerId, command.getInstrument());
    }

    private Checkout getCheckout(String checkoutId) {
        return checkoutRepository.findById(checkoutId)
                .orElseThrow(() -> new CheckoutNotFoundException(checkoutId));
    }

    private Product getProduct(String productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    private Discount getActiveDiscount(String code) {
        return discountRepository.findByCode(code)
                .filter(Discount::isActive)
                .orElseThrow(() -> new InvalidDiscountCodeException(code));
    }

    private void validateQuantity(int quantity) {
        if (quantity < 1) {
            throw new InvalidQuantityException(quantity);
        }
    }

    private void validateStock(Product product, int quantity) {
        if (!product.hasStock(quantity)) {
            throw new InsufficientStockException(product.getProductId(), quantity, product.getStock());
        }
    }

    private CheckoutResult toResult(Checkout checkout, PriceBreakdown pricing) {
        Order order = checkout.getOrderId() == null
                ? null
                : orderRepository.findById(checkout.getOrderId()).orElse(null);
        return new CheckoutResult(checkout, pricing, order);
    }
}
