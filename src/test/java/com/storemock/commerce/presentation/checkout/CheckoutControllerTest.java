package com.storemock.commerce.presentation.checkout;

import com.fasterxml.jackson.databind.JsonNode;
import com.storemock.commerce.domain.checkout.CheckoutRepository;
import com.storemock.commerce.presentation.BaseApiTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

import java.util.Map;

import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@DisplayName("체크아웃 API 테스트")
class CheckoutControllerTest extends BaseApiTest {

    @Autowired
    private CheckoutRepository checkoutRepository;

    // ========== 생성/조회 ==========

    @Test
    @DisplayName("체크아웃 생성 - 201, 카탈로그 가격, totals 마지막은 total")
    void testCreateCheckout_Success() throws Exception {
        mockMvc.perform(post(CHECKOUT_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(createRequest("bouquet_roses", 2))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").exists())
                .andExpect(jsonPath("$.status").value("incomplete"))
                .andExpect(jsonPath("$.currency").value("USD"))
                .andExpect(jsonPath("$.line_items[0].item.id").value("bouquet_roses"))
                .andExpect(jsonPath("$.line_items[0].item.price").value(3500))
                .andExpect(jsonPath("$.line_items[0].quantity").value(2))
                .andExpect(jsonPath("$.totals[0].type").value("subtotal"))
                .andExpect(jsonPath("$.totals[0].amount").value(7000))
                .andExpect(jsonPath("$.totals[-1:].type").value(hasItem("total")))
                .andExpect(jsonPath("$.ucp.version").exists());
    }

    @Test
    @DisplayName("같은 Idempotency-Key로 재요청 - 같은 응답 본문, 체크아웃은 하나만 생성")
    void testCreateCheckout_IdempotentReplay() throws Exception {
        // Given
        String requestBody = toJson(createRequest("vase_glass", 1));
        long before = checkoutRepository.count();

        // When
        String first = mockMvc.perform(post(CHECKOUT_URL)
                        .header("Idempotency-Key", "create-replay-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String second = mockMvc.perform(post(CHECKOUT_URL)
                        .header("Idempotency-Key", "create-replay-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();

        // Then
        assertEquals(first, second);
        assertEquals(before + 1, checkoutRepository.count());
    }

    @Test
    @DisplayName("같은 Idempotency-Key + 다른 요청 - 409 idempotency_conflict")
    void testCreateCheckout_IdempotencyConflict() throws Exception {
        mockMvc.perform(post(CHECKOUT_URL)
                        .header("Idempotency-Key", "create-conflict-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(createRequest("vase_glass", 1))))
                .andExpect(status().isCreated());

        mockMvc.perform(post(CHECKOUT_URL)
                        .header("Idempotency-Key", "create-conflict-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(createRequest("vase_glass", 2))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_kind").value("idempotency_conflict"))
                .andExpect(jsonPath("$.error_code").value("APP_IDEMPOTENCY_CONFLICT"));
    }

    @Test
    @DisplayName("없는 체크아웃 조회 - 404 not_found")
    void testGetCheckout_NotFound() throws Exception {
        mockMvc.perform(get(CHECKOUT_URL + "/no-such-checkout"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_kind").value("not_found"))
                .andExpect(jsonPath("$.request_id").exists());
    }

    @Test
    @DisplayName("잘못된 요청 - 재고 초과, 알 수 없는 상품, 깨진 JSON은 400")
    void testCreateCheckout_ValidationErrors() throws Exception {
        mockMvc.perform(post(CHECKOUT_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(createRequest("seasonal_wreath", 1))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_PRODUCT_INSUFFICIENT_STOCK"));

        mockMvc.perform(post(CHECKOUT_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(createRequest("unicorn", 1))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_kind").value("validation_error"));

        mockMvc.perform(post(CHECKOUT_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"line_items\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CHECKOUT_INVALID_REQUEST"));
    }

    // ========== 할인/배송 ==========

    @Test
    @DisplayName("할인 코드 적용 - 소문자 입력도 대문자로 정규화, 10% 할인")
    void testApplyDiscount() throws Exception {
        String checkoutId = createCheckout("bouquet_roses", 2);

        mockMvc.perform(post(CHECKOUT_URL + "/" + checkoutId + "/discounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(Map.of("code", "10off"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.discounts.codes[0]").value("10OFF"))
                .andExpect(jsonPath("$.discounts.applied[0].amount").value(700))
                .andExpect(jsonPath("$.totals[?(@.type == 'total')].amount").value(hasItem(6300)));

        mockMvc.perform(post(CHECKOUT_URL + "/" + checkoutId + "/discounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(Map.of("code", "EXPIRED"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_DISCOUNT_INVALID_CODE"));
    }

    @Test
    @DisplayName("배송 지정 - 선택 옵션 가격이 totals에 반영")
    void testSetFulfillment() throws Exception {
        String checkoutId = createCheckout("bouquet_roses", 1);

        mockMvc.perform(post(CHECKOUT_URL + "/" + checkoutId + "/fulfillment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(Map.of("method_id", "express-ship-us", "address", usAddress()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fulfillment.methods[0].selected_destination_id").exists())
                .andExpect(jsonPath("$.fulfillment.methods[0].groups[0].selected_option_id").value("express-ship-us"))
                .andExpect(jsonPath("$.totals[?(@.type == 'fulfillment')].amount").value(hasItem(1500)))
                .andExpect(jsonPath("$.totals[?(@.type == 'total')].amount").value(hasItem(5000)));
    }

    // ========== 완료/취소 ==========

    @Test
    @DisplayName("배송 미선택 완료 - 400 fulfillment_required")
    void testComplete_FulfillmentRequired() throws Exception {
        String checkoutId = createCheckout("bouquet_roses", 1);

        mockMvc.perform(post(CHECKOUT_URL + "/" + checkoutId + "/complete"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_kind").value("fulfillment_required"));
    }

    @Test
    @DisplayName("결제 실패 후 다른 결제수단으로 재시도 - 402 이후 완료")
    void testComplete_PaymentFailureThenRetry() throws Exception {
        // Given
        String checkoutId = createCheckout("orchid_white", 1);
        selectShipping(checkoutId, "std-ship");

        // When & Then
        mockMvc.perform(post(CHECKOUT_URL + "/" + checkoutId + "/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(Map.of("payment_data", Map.of("id", "instr_fail")))))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.error_kind").value("payment_failure"));

        mockMvc.perform(get(CHECKOUT_URL + "/" + checkoutId))
                .andExpect(jsonPath("$.status").value("incomplete"));

        mockMvc.perform(post(CHECKOUT_URL + "/" + checkoutId + "/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(Map.of("payment_data", Map.of("id", "instr_ok")))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.order.id").exists())
                .andExpect(jsonPath("$.order.permalink_url").exists());
    }

    @Test
    @DisplayName("완료 요청 재전송(같은 키) - 같은 주문, 이후 변경 요청은 409")
    void testComplete_IdempotentAndTerminal() throws Exception {
        // Given
        String checkoutId = createCheckout("bouquet_sunflowers", 1);
        selectShipping(checkoutId, "std-ship");

        // When
        String first = mockMvc.perform(post(CHECKOUT_URL + "/" + checkoutId + "/complete")
                        .header("Idempotency-Key", "complete-" + checkoutId))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String second = mockMvc.perform(post(CHECKOUT_URL + "/" + checkoutId + "/complete")
                        .header("Idempotency-Key", "complete-" + checkoutId))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        // Then
        JsonNode firstJson = objectMapper.readTree(first);
        assertEquals(firstJson.path("order").path("id").asText(),
                objectMapper.readTree(second).path("order").path("id").asText());

        mockMvc.perform(post(CHECKOUT_URL + "/" + checkoutId + "/line-items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(Map.of("product_id", "vase_glass"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_kind").value("invalid_state"));
    }

    @Test
    @DisplayName("체크아웃 취소 - canceled, 두 번째 취소는 409")
    void testCancelCheckout() throws Exception {
        String checkoutId = createCheckout("vase_glass", 1);

        mockMvc.perform(post(CHECKOUT_URL + "/" + checkoutId + "/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("canceled"));

        mockMvc.perform(post(CHECKOUT_URL + "/" + checkoutId + "/cancel"))
                .andExpect(status().isConflict());
    }

    // ========== 라인 아이템 ==========

    @Test
    @DisplayName("라인 아이템 추가/수량 변경/삭제")
    void testLineItems() throws Exception {
        String checkoutId = createCheckout("vase_glass", 1);

        String body = mockMvc.perform(post(CHECKOUT_URL + "/" + checkoutId + "/line-items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(Map.of("product_id", "bouquet_roses", "quantity", 2))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.line_items.length()").value(2))
                .andReturn().getResponse().getContentAsString();
        String lineItemId = objectMapper.readTree(body).path("line_items").get(1).path("id").asText();

        mockMvc.perform(patch(CHECKOUT_URL + "/" + checkoutId + "/line-items/" + lineItemId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(Map.of("quantity", 3))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.line_items[1].quantity").value(3));

        mockMvc.perform(delete(CHECKOUT_URL + "/" + checkoutId + "/line-items/" + lineItemId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.line_items.length()").value(1));

        mockMvc.perform(delete(CHECKOUT_URL + "/" + checkoutId + "/line-items/missing"))
                .andExpect(status().isNotFound());
    }
}
