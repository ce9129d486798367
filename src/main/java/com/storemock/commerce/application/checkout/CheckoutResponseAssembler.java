package com.storemock.commerce.application.checkout;

import com.storemock.commerce.application.checkout.dto.CheckoutResponse;
import com.storemock.commerce.application.checkout.dto.CheckoutResult;
import com.storemock.commerce.application.common.dto.AddressView;
import com.storemock.commerce.application.common.dto.TotalLine;
import com.storemock.commerce.application.common.dto.UcpMetadata;
import com.storemock.commerce.common.protocol.UcpProtocol;
import com.storemock.commerce.config.CommerceProperties;
import com.storemock.commerce.domain.checkout.Checkout;
import com.storemock.commerce.domain.checkout.CheckoutLineItem;
import com.storemock.commerce.domain.checkout.CheckoutStatus;
import com.storemock.commerce.domain.fulfillment.FulfillmentGroup;
import com.storemock.commerce.domain.fulfillment.FulfillmentMethod;
import com.storemock.commerce.domain.fulfillment.FulfillmentOption;
import com.storemock.commerce.domain.order.Order;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * CheckoutResult → CheckoutResponse 변환
 *
 * totals 순서: subtotal, discount, fulfillment, total
 * (total 외에는 금액이 0보다 클 때만 포함)
 */
@Component
@RequiredArgsConstructor
public class CheckoutResponseAssembler {

    static final String PAYMENT_HANDLER_NAME = "dev.ucp.mock_payment";
    static final String PAYMENT_HANDLER_SPEC = "https://ucp.dev/handlers/mock-payment";

    private final CommerceProperties properties;

    public CheckoutResponse toResponse(CheckoutResult result) {
        Checkout checkout = result.getCheckout();
        PriceBreakdown pricing = result.getPricing();

        return CheckoutResponse.builder()
                .ucp(UcpMetadata.of(UcpProtocol.CHECKOUT_CAPABILITY))
                .id(checkout.getCheckoutId())
                .status(CheckoutStatus.toExternal(checkout.getStatus().getValue()))
                .currency(checkout.getCurrency())
                .buyer(checkout.getBuyer())
                .lineItems(checkout.getLineItems().stream()
                        .map(this::toLineItem)
                        .collect(Collectors.toList()))
                .totals(toTotals(pricing))
                .discounts(toDiscounts(pricing))
                .fulfillment(new CheckoutResponse.Fulfillment(checkout.getFulfillment().getMethods().stream()
                        .map(this::toMethod)
                        .collect(Collectors.toList())))
                .payment(new CheckoutResponse.Payment(
                        List.of(paymentHandler()),
                        new ArrayList<>(),
                        checkout.getPayment() == null ? null : checkout.getPayment().getInstrumentId()))
                .links(links())
                .createdAt(checkout.getCreatedAt())
                .updatedAt(checkout.getUpdatedAt())
                .order(toOrderSummary(result.getOrder()))
                .build();
    }

    private CheckoutResponse.LineItem toLineItem(CheckoutLineItem item) {
        long lineTotal = item.lineTotal();
        return CheckoutResponse.LineItem.builder()
                .id(item.getLineItemId())
                .item(new CheckoutResponse.Item(item.getProductId(), item.getTitle(), item.getPrice()))
                .quantity(item.getQuantity())
                .totals(List.of(
                        TotalLine.of(TotalLine.SUBTOTAL, "Subtotal", lineTotal),
                        TotalLine.of(TotalLine.TOTAL, "Total", lineTotal)))
                .build();
    }

    private List<TotalLine> toTotals(PriceBreakdown pricing) {
        List<TotalLine> totals = new ArrayList<>();
        if (pricing.getSubtotal() > 0) {
            totals.add(TotalLine.of(TotalLine.SUBTOTAL, "Subtotal", pricing.getSubtotal()));
        }
        if (pricing.getDiscountAmount() > 0) {
            totals.add(TotalLine.of(TotalLine.DISCOUNT, "Discount", pricing.getDiscountAmount()));
        }
        if (pricing.getFulfillmentPrice() > 0) {
            totals.add(TotalLine.of(TotalLine.FULFILLMENT, "Shipping", pricing.getFulfillmentPrice()));
        }
        totals.add(TotalLine.of(TotalLine.TOTAL, "Total", pricing.getTotal()));
        return totals;
    }

    private CheckoutResponse.Discounts toDiscounts(PriceBreakdown pricing) {
        if (pricing.getDiscounts().isEmpty()) {
            return null;
        }
        List<String> codes = new ArrayList<>();
        List<CheckoutResponse.AppliedDiscount> applied = new ArrayList<>();
        for (PriceBreakdown.DiscountLine line : pricing.getDiscounts()) {
            codes.add(line.getCode());
            applied.add(new CheckoutResponse.AppliedDiscount(line.getCode(), line.getTitle(), line.getAmount()));
        }
        return new CheckoutResponse.Discounts(codes, applied);
    }

    private CheckoutResponse.Method toMethod(FulfillmentMethod method) {
        return CheckoutResponse.Method.builder()
                .id(method.getId())
                .type(method.getType() == null ? null : method.getType().getValue())
                .lineItemIds(method.getLineItemIds())
                .destinations(method.getDestinations().stream()
                        .map(destination -> AddressView.from(destination, true))
                        .collect(Collectors.toList()))
                .selectedDestinationId(method.getSelectedDestinationId())
                .groups(method.getGroups().stream()
                        .map(this::toGroup)
                        .collect(Collectors.toList()))
                .build();
    }

    private CheckoutResponse.Group toGroup(FulfillmentGroup group) {
        return CheckoutResponse.Group.builder()
                .id(group.getId())
                .lineItemIds(group.getLineItemIds())
                .options(group.getOptions().stream()
                        .map(this::toOption)
                        .collect(Collectors.toList()))
                .selectedOptionId(group.getSelectedOptionId())
                .build();
    }

    private CheckoutResponse.Option toOption(FulfillmentOption option) {
        return new CheckoutResponse.Option(option.getId(), option.getTitle(), List.of(
                TotalLine.of(TotalLine.SUBTOTAL, option.getPrice()),
                TotalLine.of(TotalLine.TOTAL, option.getPrice())));
    }

    private CheckoutResponse.PaymentHandler paymentHandler() {
        return CheckoutResponse.PaymentHandler.builder()
                .id(properties.getPayment().getHandlerId())
                .name(PAYMENT_HANDLER_NAME)
                .version(UcpProtocol.VERSION)
                .spec(PAYMENT_HANDLER_SPEC)
                .configSchema(PAYMENT_HANDLER_SPEC + "/config.json")
                .instrumentSchemas(List.of(PAYMENT_HANDLER_SPEC + "/instrument.json"))
                .config(Map.of("auto_approve", true))
                .build();
    }

    private List<CheckoutResponse.Link> links() {
        String baseUrl = properties.getPublicBaseUrl();
        boolean hasBase = baseUrl != null && !baseUrl.isBlank();
        return List.of(
                new CheckoutResponse.Link("privacy_policy",
                        hasBase ? baseUrl + "/legal/privacy" : "https://example.com/privacy", "Privacy Policy"),
                new CheckoutResponse.Link("terms_of_service",
                        hasBase ? baseUrl + "/legal/terms" : "https://example.com/terms", "Terms of Service"));
    }

    private CheckoutResponse.OrderSummary toOrderSummary(Order order) {
        if (order == null) {
            return null;
        }
        return new CheckoutResponse.OrderSummary(order.getOrderId(), order.getStatus().getValue(),
                properties.getPublicBaseUrl() + "/orders/" + order.getOrderId());
    }
}
