package com.storemock.commerce.presentation.checkout;

import com.storemock.commerce.application.checkout.CheckoutResponseAssembler;
import com.storemock.commerce.application.checkout.CheckoutService;
import com.storemock.commerce.application.checkout.dto.CheckoutResponse;
import com.storemock.commerce.application.checkout.dto.CheckoutResult;
import com.storemock.commerce.application.idempotency.IdempotencyGuard;
import com.storemock.commerce.application.idempotency.IdempotentResponse;
import com.storemock.commerce.common.protocol.UcpProtocol;
import com.storemock.commerce.presentation.checkout.mapper.CheckoutMapper;
import com.storemock.commerce.presentation.checkout.request.AddLineItemRequest;
import com.storemock.commerce.presentation.checkout.request.ApplyDiscountRequest;
import com.storemock.commerce.presentation.checkout.request.CompleteCheckoutRequest;
import com.storemock.commerce.presentation.checkout.request.CreateCheckoutRequest;
import com.storemock.commerce.presentation.checkout.request.SetFulfillmentRequest;
import com.storemock.commerce.presentation.checkout.request.SetPaymentRequest;
import com.storemock.commerce.presentation.checkout.request.UpdateCheckoutRequest;
import com.storemock.commerce.presentation.checkout.request.UpdateLineItemRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CheckoutController - 체크아웃 세션 API 엔드포인트
 *
 * 멱등성 적용 (Idempotency-Key 헤더):
 * - 생성, 일반 업데이트, 완료, 취소
 * - 같은 키 + 같은 요청은 최초 응답(상태 코드 포함)을 그대로 반환
 */
@RestController
@RequestMapping("/checkout-sessions")
public class CheckoutController {

    private final CheckoutService checkoutService;
    private final CheckoutResponseAssembler responseAssembler;
    private final IdempotencyGuard idempotencyGuard;
    private final CheckoutMapper checkoutMapper;

    public CheckoutController(CheckoutService checkoutService,
                              CheckoutResponseAssembler responseAssembler,
                              IdempotencyGuard idempotencyGuard,
                              CheckoutMapper checkoutMapper) {
        this.checkoutService = checkoutService;
        this.responseAssembler = responseAssembler;
        this.idempotencyGuard = idempotencyGuard;
        this.checkoutMapper = checkoutMapper;
    }

    /**
     * 체크아웃 생성 (POST /api/checkout-sessions) → 201
     */
    @PostMapping
    public ResponseEntity<Object> createCheckout(
            @RequestHeader(value = UcpProtocol.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CreateCheckoutRequest request) {
        IdempotentResponse response = idempotencyGuard.execute(idempotencyKey, request,
                () -> IdempotentResponse.created(toResponse(
                        checkoutService.create(checkoutMapper.toCreateCommand(request)))));
        return toResponseEntity(response);
    }

    /**
     * 체크아웃 조회 (GET /api/checkout-sessions/{checkout_id})
     */
    @GetMapping("/{checkout_id}")
    public ResponseEntity<CheckoutResponse> getCheckout(@PathVariable("checkout_id") String checkoutId) {
        return ResponseEntity.ok(toResponse(checkoutService.get(checkoutId)));
    }

    /**
     * 일반 업데이트 (PUT /api/checkout-sessions/{checkout_id})
     */
    @PutMapping("/{checkout_id}")
    public ResponseEntity<Object> updateCheckout(
            @PathVariable("checkout_id") String checkoutId,
            @RequestHeader(value = UcpProtocol.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody UpdateCheckoutRequest request) {
        IdempotentResponse response = idempotencyGuard.execute(idempotencyKey, fingerprint(checkoutId, request),
                () -> IdempotentResponse.ok(toResponse(
                        checkoutService.update(checkoutId, checkoutMapper.toUpdateCommand(request)))));
        return toResponseEntity(response);
    }

    @PostMapping("/{checkout_id}/line-items")
    public ResponseEntity<CheckoutResponse> addLineItem(
            @PathVariable("checkout_id") String checkoutId,
            @Valid @RequestBody AddLineItemRequest request) {
        return ResponseEntity.ok(toResponse(
                checkoutService.addLineItem(checkoutId, checkoutMapper.toLineItemCommand(request))));
    }

    @PatchMapping("/{checkout_id}/line-items/{line_item_id}")
    public ResponseEntity<CheckoutResponse> updateLineItem(
            @PathVariable("checkout_id") String checkoutId,
            @PathVariable("line_item_id") String lineItemId,
            @Valid @RequestBody UpdateLineItemRequest request) {
        return ResponseEntity.ok(toResponse(
                checkoutService.updateLineItem(checkoutId, lineItemId, request.getQuantity())));
    }

    @DeleteMapping("/{checkout_id}/line-items/{line_item_id}")
    public ResponseEntity<CheckoutResponse> removeLineItem(
            @PathVariable("checkout_id") String checkoutId,
            @PathVariable("line_item_id") String lineItemId) {
        return ResponseEntity.ok(toResponse(checkoutService.removeLineItem(checkoutId, lineItemId)));
    }

    @PostMapping("/{checkout_id}/discounts")
    public ResponseEntity<CheckoutResponse> applyDiscount(
            @PathVariable("checkout_id") String checkoutId,
            @Valid @RequestBody ApplyDiscountRequest request) {
        return ResponseEntity.ok(toResponse(checkoutService.applyDiscount(checkoutId, request.getCode())));
    }

    @PostMapping("/{checkout_id}/fulfillment")
    public ResponseEntity<CheckoutResponse> setFulfillment(
            @PathVariable("checkout_id") String checkoutId,
            @Valid @RequestBody SetFulfillmentRequest request) {
        return ResponseEntity.ok(toResponse(
                checkoutService.setFulfillment(checkoutId, checkoutMapper.toSetFulfillmentCommand(request))));
    }

    @PostMapping("/{checkout_id}/payment")
    public ResponseEntity<CheckoutResponse> setPayment(
            @PathVariable("checkout_id") String checkoutId,
            @Valid @RequestBody SetPaymentRequest request) {
        return ResponseEntity.ok(toResponse(
                checkoutService.setPayment(checkoutId, checkoutMapper.toSetPaymentCommand(request))));
    }

    /**
     * 체크아웃 완료 (POST /api/checkout-sessions/{checkout_id}/complete)
     *
     * UCP-Agent 헤더가 있으면 주문 생성 후 order_placed 웹훅을 비동기로 전송합니다.
     */
    @PostMapping("/{checkout_id}/complete")
    public ResponseEntity<Object> completeCheckout(
            @PathVariable("checkout_id") String checkoutId,
            @RequestHeader(value = UcpProtocol.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = UcpProtocol.AGENT_HEADER, required = false) String agentReference,
            @RequestBody(required = false) CompleteCheckoutRequest request) {
        IdempotentResponse response = idempotencyGuard.execute(idempotencyKey, fingerprint(checkoutId, request),
                () -> IdempotentResponse.ok(toResponse(checkoutService.complete(checkoutId,
                        checkoutMapper.toCompleteCommand(request, agentReference)))));
        return toResponseEntity(response);
    }

    @PostMapping("/{checkout_id}/cancel")
    public ResponseEntity<Object> cancelCheckout(
            @PathVariable("checkout_id") String checkoutId,
            @RequestHeader(value = UcpProtocol.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("checkout_id", checkoutId);
        payload.put("action", "cancel");

        IdempotentResponse response = idempotencyGuard.execute(idempotencyKey, payload,
                () -> IdempotentResponse.ok(toResponse(checkoutService.cancel(checkoutId))));
        return toResponseEntity(response);
    }

    private CheckoutResponse toResponse(CheckoutResult result) {
        return responseAssembler.toResponse(result);
    }

    private Map<String, Object> fingerprint(String checkoutId, Object body) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("checkout_id", checkoutId);
        payload.put("body", body);
        return payload;
    }

    private ResponseEntity<Object> toResponseEntity(IdempotentResponse response) {
        return ResponseEntity.status(response.getStatus()).body(response.getBody());
    }
}
