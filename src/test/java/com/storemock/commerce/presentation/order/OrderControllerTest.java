package com.storemock.commerce.presentation.order;

import com.storemock.commerce.presentation.BaseApiTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@DisplayName("주문 API 테스트")
class OrderControllerTest extends BaseApiTest {

    private static final String ORDER_URL = "/api/orders";

    // ========== 조회 ==========

    @Test
    @DisplayName("주문 조회 - 체크아웃 스냅샷과 금액")
    void testGetOrder_Success() throws Exception {
        String orderId = placeOrder("bouquet_roses");

        mockMvc.perform(get(ORDER_URL + "/" + orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(orderId))
                .andExpect(jsonPath("$.status").value("confirmed"))
                .andExpect(jsonPath("$.checkout_id").exists())
                .andExpect(jsonPath("$.permalink_url").value("http://localhost/orders/" + orderId))
                .andExpect(jsonPath("$.line_items[0].item.id").value("bouquet_roses"))
                .andExpect(jsonPath("$.line_items[0].status").value("processing"))
                .andExpect(jsonPath("$.fulfillment.expectations[0].method_type").value("shipping"))
                .andExpect(jsonPath("$.fulfillment.events.length()").value(0));
    }

    @Test
    @DisplayName("없는 주문 조회 - 404")
    void testGetOrder_NotFound() throws Exception {
        mockMvc.perform(get(ORDER_URL + "/no-such-order"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_ORDER_NOT_FOUND"));
    }

    @Test
    @DisplayName("주문 목록 조회 - limit 적용, total은 반환된 건수")
    void testListOrders() throws Exception {
        placeOrder("vase_glass");
        placeOrder("vase_glass");

        mockMvc.perform(get(ORDER_URL).param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orders.length()").value(1))
                .andExpect(jsonPath("$.total").value(1));

        mockMvc.perform(get(ORDER_URL))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(greaterThanOrEqualTo(2)));
    }

    // ========== 변경 ==========

    @Test
    @DisplayName("주문 업데이트 - 배송 이벤트와 조정 내역 추가")
    void testUpdateOrder_AppendsEventsAndAdjustments() throws Exception {
        // Given
        String orderId = placeOrder("bouquet_sunflowers");
        Map<String, Object> request = Map.of(
                "fulfillment", Map.of("events", List.of(Map.of(
                        "type", "delivered",
                        "description", "Left at front door"))),
                "adjustments", List.of(Map.of(
                        "type", "refund",
                        "amount", 500,
                        "status", "completed")));

        // When & Then
        mockMvc.perform(put(ORDER_URL + "/" + orderId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fulfillment.events[0].type").value("delivered"))
                .andExpect(jsonPath("$.fulfillment.events[0].id").exists())
                .andExpect(jsonPath("$.adjustments[0].type").value("refund"))
                .andExpect(jsonPath("$.adjustments[0].amount").value(500));
    }

    @Test
    @DisplayName("주문 업데이트 - 이벤트 type 누락은 400")
    void testUpdateOrder_MissingEventType() throws Exception {
        String orderId = placeOrder("bouquet_sunflowers");

        mockMvc.perform(put(ORDER_URL + "/" + orderId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(Map.of("fulfillment", Map.of("events", List.of(Map.of("description", "x")))))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_kind").value("validation_error"));
    }

    @Test
    @DisplayName("주문 취소 - canceled, 다시 취소하면 400 invalid_state")
    void testCancelOrder() throws Exception {
        String orderId = placeOrder("vase_glass");

        mockMvc.perform(post(ORDER_URL + "/" + orderId + "/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("canceled"));

        mockMvc.perform(post(ORDER_URL + "/" + orderId + "/cancel"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_kind").value("invalid_state"));
    }
}
