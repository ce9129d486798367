package com.storemock.commerce.domain.checkout;

import com.storemock.commerce.domain.discount.Discount;
import com.storemock.commerce.domain.fulfillment.FulfillmentState;
import com.storemock.commerce.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Checkout 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 라인 아이템, 적용 할인, 배송 상태, 결제 선택 관리
 * - 상태 전환 (INCOMPLETE → COMPLETED / CANCELED)
 * - 가격 계산 결과(subtotal, discount, fulfillment, total) 보관
 *
 * 핵심 비즈니스 규칙:
 * - INCOMPLETE 상태에서만 변경 가능
 * - 같은 할인 코드를 다시 적용하면 기존 항목을 대체하고 적용 순서의 맨 뒤로 이동
 * - 같은 상품(+variant)을 다시 추가하면 수량을 합산
 * - 수량 0 이하로 변경하면 라인 아이템 삭제
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Checkout {

    public static final String DEFAULT_CURRENCY = "USD";

    private String checkoutId;
    private CheckoutStatus status;
    private String currency;
    private Map<String, Object> buyer;

    @Builder.Default
    private List<CheckoutLineItem> lineItems = new ArrayList<>();

    @Builder.Default
    private List<AppliedDiscount> appliedDiscounts = new ArrayList<>();

    @Builder.Default
    private FulfillmentState fulfillment = new FulfillmentState();

    private PaymentSelection payment;

    private long subtotal;
    private long discountAmount;
    private long fulfillmentPrice;
    private long total;

    private String orderId;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * 체크아웃 생성 팩토리 메서드
     */
    public static Checkout create(String currency, Map<String, Object> buyer) {
        Instant now = Instant.now();
        return Checkout.builder()
                .checkoutId(UUID.randomUUID().toString())
                .status(CheckoutStatus.INCOMPLETE)
                .currency(currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency)
                .buyer(buyer == null ? null : new LinkedHashMap<>(buyer))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public String getBuyerId() {
        return buyerAttribute("id");
    }

    public String getBuyerEmail() {
        return buyerAttribute("email");
    }

    private String buyerAttribute(String key) {
        if (buyer == null || buyer.get(key) == null) {
            return null;
        }
        return buyer.get(key).toString();
    }

    /**
     * 변경 가능 상태 검증
     *
     * @throws InvalidCheckoutStatusException INCOMPLETE가 아닌 경우
     */
    public void ensureMutable(String action) {
        if (!status.isMutable()) {
            throw new InvalidCheckoutStatusException(checkoutId, status, action);
        }
    }

    public void changeCurrency(String currency) {
        this.currency = currency;
        touch();
    }

    public void changeBuyer(Map<String, Object> buyer) {
        this.buyer = buyer == null ? null : new LinkedHashMap<>(buyer);
        touch();
    }

    public Optional<CheckoutLineItem> findLineItem(String lineItemId) {
        return lineItems.stream()
                .filter(item -> item.getLineItemId().equals(lineItemId))
                .findFirst();
    }

    public CheckoutLineItem getLineItem(String lineItemId) {
        return findLineItem(lineItemId)
                .orElseThrow(() -> new LineItemNotFoundException(checkoutId, lineItemId));
    }

    public Optional<CheckoutLineItem> findLineItemByProduct(String productId, String variantId) {
        return lineItems.stream()
                .filter(item -> item.isSameProduct(productId, variantId))
                .findFirst();
    }

    /**
     * 라인 아이템 추가 (같은 상품+variant가 있으면 수량 합산)
     * 재고 검증은 호출 측(CheckoutService) 책임입니다.
     */
    public CheckoutLineItem addLineItem(Product product, String variantId, int quantity) {
        Optional<CheckoutLineItem> existing = findLineItemByProduct(product.getProductId(), variantId);
        CheckoutLineItem item;
        if (existing.isPresent()) {
            item = existing.get();
            item.changeQuantity(item.getQuantity() + quantity);
        } else {
            item = CheckoutLineItem.of(product, variantId, quantity);
            lineItems.add(item);
        }
        touch();
        return item;
    }

    /**
     * 수량 변경 (0 이하이면 삭제)
     */
    public void changeLineItemQuantity(String lineItemId, int quantity) {
        CheckoutLineItem item = getLineItem(lineItemId);
        if (quantity <= 0) {
            lineItems.remove(item);
        } else {
            item.changeQuantity(quantity);
        }
        touch();
    }

    public void removeLineItem(String lineItemId) {
        CheckoutLineItem item = getLineItem(lineItemId);
        lineItems.remove(item);
        touch();
    }

    /**
     * 할인 적용 (같은 코드는 대체 후 맨 뒤로 이동)
     */
    public void applyDiscount(Discount discount) {
        appliedDiscounts.removeIf(applied -> applied.getCode().equalsIgnoreCase(discount.getCode()));
        appliedDiscounts.add(AppliedDiscount.from(discount));
        touch();
    }

    public void replaceFulfillment(FulfillmentState fulfillment) {
        this.fulfillment = fulfillment;
        touch();
    }

    /**
     * 조회/재계산 시 갱신된 배송 옵션 반영 (updatedAt 변경 없음)
     */
    public void refreshFulfillment(FulfillmentState fulfillment) {
        this.fulfillment = fulfillment;
    }

    public void selectPayment(PaymentSelection payment) {
        this.payment = payment;
        touch();
    }

    /**
     * 가격 계산 결과 반영
     */
    public void applyPricing(long subtotal, long discountAmount, long fulfillmentPrice, long total) {
        this.subtotal = subtotal;
        this.discountAmount = discountAmount;
        this.fulfillmentPrice = fulfillmentPrice;
        this.total = total;
    }

    /**
     * 상태 전환: 완료 (INCOMPLETE → COMPLETED)
     */
    public void complete(String orderId) {
        ensureMutable("complete");
        this.status = CheckoutStatus.COMPLETED;
        this.orderId = orderId;
        touch();
    }

    /**
     * 상태 전환: 취소 (INCOMPLETE → CANCELED)
     */
    public void cancel() {
        ensureMutable("cancel");
        this.status = CheckoutStatus.CANCELED;
        touch();
    }

    public boolean hasLineItems() {
        return !lineItems.isEmpty();
    }

    public List<String> lineItemIds() {
        return lineItems.stream().map(CheckoutLineItem::getLineItemId).collect(Collectors.toList());
    }

    public List<String> productIds() {
        return lineItems.stream().map(CheckoutLineItem::getProductId).collect(Collectors.toList());
    }

    public List<CheckoutLineItem> getLineItems() {
        return Collections.unmodifiableList(lineItems);
    }

    public List<AppliedDiscount> getAppliedDiscounts() {
        return Collections.unmodifiableList(appliedDiscounts);
    }

    /**
     * 저장소 스냅샷용 깊은 복사
     */
    public Checkout copy() {
        List<CheckoutLineItem> copiedItems = new ArrayList<>();
        lineItems.forEach(item -> copiedItems.add(item.copy()));

        return Checkout.builder()
                .checkoutId(checkoutId)
                .status(status)
                .currency(currency)
                .buyer(buyer == null ? null : new LinkedHashMap<>(buyer))
                .lineItems(copiedItems)
                .appliedDiscounts(new ArrayList<>(appliedDiscounts))
                .fulfillment(fulfillment.copy())
                .payment(payment)
                .subtotal(subtotal)
                .discountAmount(discountAmount)
                .fulfillmentPrice(fulfillmentPrice)
                .total(total)
                .orderId(orderId)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }
}
