package com.storemock.commerce.presentation.testing;

import com.storemock.commerce.application.order.OrderResponseAssembler;
import com.storemock.commerce.application.order.ShipmentSimulationService;
import com.storemock.commerce.application.order.dto.OrderResponse;
import com.storemock.commerce.common.protocol.UcpProtocol;
import com.storemock.commerce.domain.order.Order;
import com.storemock.commerce.presentation.testing.response.SimulateShippingResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * SimulationController - 테스트용 배송 시뮬레이션 엔드포인트
 */
@RestController
@RequestMapping("/testing")
public class SimulationController {

    private final ShipmentSimulationService simulationService;
    private final OrderResponseAssembler responseAssembler;

    public SimulationController(ShipmentSimulationService simulationService,
                                OrderResponseAssembler responseAssembler) {
        this.simulationService = simulationService;
        this.responseAssembler = responseAssembler;
    }

    /**
     * 배송 시뮬레이션 (POST /api/testing/simulate-shipping/{order_id})
     */
    @PostMapping("/simulate-shipping/{order_id}")
    public ResponseEntity<SimulateShippingResponse> simulateShipping(
            @PathVariable("order_id") String orderId,
            @RequestHeader(value = UcpProtocol.SIMULATION_SECRET_HEADER, required = false) String secret,
            @RequestHeader(value = UcpProtocol.AGENT_HEADER, required = false) String agentReference) {
        Order order = simulationService.simulateShipping(orderId, secret, agentReference);

        List<OrderResponse.Event> events = responseAssembler.toResponse(order).getFulfillment().getEvents();
        OrderResponse.Event shipped = events.get(events.size() - 1);
        return ResponseEntity.ok(new SimulateShippingResponse(true, orderId, order.getStatus().getValue(), shipped));
    }
}
