package com.storemock.commerce.presentation.checkout.mapper;

import com.storemock.commerce.application.checkout.dto.CompleteCheckoutCommand;
import com.storemock.commerce.application.checkout.dto.CreateCheckoutCommand;
import com.storemock.commerce.application.checkout.dto.FulfillmentUpdateCommand;
import com.storemock.commerce.application.checkout.dto.LineItemCommand;
import com.storemock.commerce.application.checkout.dto.LineItemQuantityCommand;
import com.storemock.commerce.application.checkout.dto.SetFulfillmentCommand;
import com.storemock.commerce.application.checkout.dto.SetPaymentCommand;
import com.storemock.commerce.application.checkout.dto.UpdateCheckoutCommand;
import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import com.storemock.commerce.presentation.checkout.request.AddLineItemRequest;
import com.storemock.commerce.presentation.checkout.request.AddressRequest;
import com.storemock.commerce.presentation.checkout.request.CompleteCheckoutRequest;
import com.storemock.commerce.presentation.checkout.request.CreateCheckoutRequest;
import com.storemock.commerce.presentation.checkout.request.FulfillmentRequest;
import com.storemock.commerce.presentation.checkout.request.PaymentRequest;
import com.storemock.commerce.presentation.checkout.request.SetFulfillmentRequest;
import com.storemock.commerce.presentation.checkout.request.SetPaymentRequest;
import com.storemock.commerce.presentation.checkout.request.UpdateCheckoutRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * CheckoutMapper - Presentation 요청 DTO → Application Command 변환
 */
@Component
public class CheckoutMapper {

    private static final int DEFAULT_QUANTITY = 1;

    public CreateCheckoutCommand toCreateCommand(CreateCheckoutRequest request) {
        List<LineItemCommand> lineItems = request.getLineItems() == null
                ? List.of()
                : request.getLineItems().stream()
                .map(item -> LineItemCommand.builder()
                        .productId(item.getItem().getId())
                        .quantity(quantityOrDefault(item.getQuantity()))
                        .build())
                .collect(Collectors.toList());

        return CreateCheckoutCommand.builder()
                .currency(request.getCurrency())
                .buyer(request.getBuyer())
                .lineItems(lineItems)
                .payment(toPaymentCommand(request.getPayment()))
                .fulfillment(toFulfillmentCommand(request.getFulfillment()))
                .build();
    }

    public UpdateCheckoutCommand toUpdateCommand(UpdateCheckoutRequest request) {
        return UpdateCheckoutCommand.builder()
                .currency(request.getCurrency())
                .buyer(request.getBuyer())
                .lineItems(request.getLineItems() == null
                        ? null
                        : request.getLineItems().stream()
                        .map(item -> new LineItemQuantityCommand(item.getId(), item.getQuantity()))
                        .collect(Collectors.toList()))
                .fulfillment(toFulfillmentCommand(request.getFulfillment()))
                .discountCodes(request.getDiscounts() == null ? null : request.getDiscounts().getCodes())
                .payment(toPaymentCommand(request.getPayment()))
                .build();
    }

    public LineItemCommand toLineItemCommand(AddLineItemRequest request) {
        return LineItemCommand.builder()
                .productId(request.getProductId())
                .variantId(request.getVariantId())
                .quantity(quantityOrDefault(request.getQuantity()))
                .build();
    }

    public SetFulfillmentCommand toSetFulfillmentCommand(SetFulfillmentRequest request) {
        return new SetFulfillmentCommand(request.getMethodId(), toDestination(request.getAddress()));
    }

    public SetPaymentCommand toSetPaymentCommand(SetPaymentRequest request) {
        return new SetPaymentCommand(request.getHandlerId(), request.getInstrument());
    }

    public CompleteCheckoutCommand toCompleteCommand(CompleteCheckoutRequest request, String agentReference) {
        if (request == null) {
            return new CompleteCheckoutCommand(null, agentReference);
        }
        String instrumentId = null;
        Map<String, Object> paymentData = request.getPaymentData();
        if (paymentData != null && paymentData.get("id") != null) {
            instrumentId = paymentData.get("id").toString();
        } else if (request.getPayment() != null) {
            instrumentId = request.getPayment().getSelectedInstrumentId();
        }
        return new CompleteCheckoutCommand(instrumentId, agentReference);
    }

    private SetPaymentCommand toPaymentCommand(PaymentRequest request) {
        if (request == null) {
            return null;
        }
        Map<String, Object> instrument = request.getInstrument();
        if (instrument == null && request.getSelectedInstrumentId() != null) {
            instrument = Map.of("id", request.getSelectedInstrumentId());
        }
        return new SetPaymentCommand(request.getHandlerId(), instrument);
    }

    private FulfillmentUpdateCommand toFulfillmentCommand(FulfillmentRequest request) {
        if (request == null) {
            return null;
        }
        if (request.getMethods() == null) {
            return new FulfillmentUpdateCommand(null);
        }
        return new FulfillmentUpdateCommand(request.getMethods().stream()
                .map(this::toMethodUpdate)
                .collect(Collectors.toList()));
    }

    private FulfillmentUpdateCommand.MethodUpdate toMethodUpdate(FulfillmentRequest.MethodRequest method) {
        return FulfillmentUpdateCommand.MethodUpdate.builder()
                .id(method.getId())
                .type(method.getType())
                .lineItemIds(method.getLineItemIds())
                .destinations(method.getDestinations() == null
                        ? null
                        : method.getDestinations().stream().map(this::toDestination).collect(Collectors.toList()))
                .selectedDestinationId(method.getSelectedDestinationId())
                .groups(method.getGroups() == null
                        ? null
                        : method.getGroups().stream()
                        .map(group -> FulfillmentUpdateCommand.GroupUpdate.builder()
                                .id(group.getId())
                                .lineItemIds(group.getLineItemIds())
                                .selectedOptionId(group.getSelectedOptionId())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    private FulfillmentDestination toDestination(AddressRequest address) {
        return FulfillmentDestination.builder()
                .id(address.getId())
                .streetAddress(address.getStreetAddress())
                .addressLocality(address.getAddressLocality())
                .addressRegion(address.getAddressRegion())
                .postalCode(address.getPostalCode())
                .addressCountry(address.getAddressCountry())
                .fullName(address.getFullName())
                .build();
    }

    private int quantityOrDefault(Integer quantity) {
        return quantity == null ? DEFAULT_QUANTITY : quantity;
    }
}
