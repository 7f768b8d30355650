package com.hhplus.storefront.presentation.order;

import com.hhplus.storefront.application.order.OrderService;
import com.hhplus.storefront.presentation.order.mapper.OrderMapper;
import com.hhplus.storefront.presentation.order.request.CheckoutRequest;
import com.hhplus.storefront.presentation.order.response.CheckoutResponse;
import com.hhplus.storefront.presentation.order.response.OrderDetailResponse;
import com.hhplus.storefront.presentation.order.response.OrderSummaryResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * OrderController - 주문 API 엔드포인트 (고객용)
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;
    private final OrderMapper orderMapper;

    public OrderController(OrderService orderService, OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderMapper = orderMapper;
    }

    /**
     * 체크아웃 (POST /api/orders)
     *
     * @return 201 Created: 주문 생성, 200 OK: 빈 장바구니 (order_id = 0)
     */
    @PostMapping
    public ResponseEntity<CheckoutResponse> checkout(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody CheckoutRequest request) {
        var command = orderMapper.toCheckoutCommand(request);
        var appResponse = orderService.checkout(userId, command);

        CheckoutResponse response = orderMapper.toCheckoutResponse(appResponse);
        HttpStatus status = appResponse.isPlaced() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    /**
     * 내 주문 목록 (GET /api/orders) - 최신 20건
     */
    @GetMapping
    public ResponseEntity<List<OrderSummaryResponse>> getMyOrders(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(orderMapper.toOrderSummaryResponses(orderService.getMyOrders(userId)));
    }

    /**
     * 내 주문 상세 (GET /api/orders/{order_id})
     */
    @GetMapping("/{order_id}")
    public ResponseEntity<OrderDetailResponse> getMyOrderDetail(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId) {
        var appResponse = orderService.getMyOrderDetail(userId, orderId);
        return ResponseEntity.ok(orderMapper.toOrderDetailResponse(appResponse));
    }
}
