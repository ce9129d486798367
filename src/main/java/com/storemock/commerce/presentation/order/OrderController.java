package com.storemock.commerce.presentation.order;

import com.storemock.commerce.application.order.OrderResponseAssembler;
import com.storemock.commerce.application.order.OrderService;
import com.storemock.commerce.application.order.dto.OrderListResponse;
import com.storemock.commerce.application.order.dto.OrderResponse;
import com.storemock.commerce.domain.order.Order;
import com.storemock.commerce.presentation.order.mapper.OrderMapper;
import com.storemock.commerce.presentation.order.request.UpdateOrderRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderController - 주문 API 엔드포인트
 *
 * 주문은 체크아웃 완료 시에만 생성되며 라인 아이템과 금액은 변경할 수 없습니다.
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;
    private final OrderResponseAssembler responseAssembler;
    private final OrderMapper orderMapper;

    public OrderController(OrderService orderService,
                           OrderResponseAssembler responseAssembler,
                           OrderMapper orderMapper) {
        this.orderService = orderService;
        this.responseAssembler = responseAssembler;
        this.orderMapper = orderMapper;
    }

    /**
     * 주문 상세 조회 (GET /api/orders/{order_id})
     */
    @GetMapping("/{order_id}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable("order_id") String orderId) {
        return ResponseEntity.ok(responseAssembler.toResponse(orderService.getOrder(orderId)));
    }

    /**
     * 주문 목록 조회 (GET /api/orders?buyer_id=&limit=&offset=)
     */
    @GetMapping
    public ResponseEntity<OrderListResponse> listOrders(
            @RequestParam(value = "buyer_id", required = false) String buyerId,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset) {
        List<Order> orders = orderService.listOrders(buyerId, limit, offset);
        List<OrderResponse> responses = orders.stream()
                .map(responseAssembler::toResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(new OrderListResponse(responses, responses.size()));
    }

    /**
     * 주문 업데이트 (PUT /api/orders/{order_id})
     */
    @PutMapping("/{order_id}")
    public ResponseEntity<OrderResponse> updateOrder(
            @PathVariable("order_id") String orderId,
            @Valid @RequestBody UpdateOrderRequest request) {
        Order order = orderService.updateOrder(orderId, orderMapper.toUpdateCommand(request));
        return ResponseEntity.ok(responseAssembler.toResponse(order));
    }

    /**
     * 주문 취소 (POST /api/orders/{order_id}/cancel)
     */
    @PostMapping("/{order_id}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(@PathVariable("order_id") String orderId) {
        return ResponseEntity.ok(responseAssembler.toResponse(orderService.cancelOrder(orderId)));
    }
}
