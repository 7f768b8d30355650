package com.hhplus.storefront.presentation.admin;

import com.hhplus.storefront.application.order.OrderService;
import com.hhplus.storefront.application.order.OrderStatusService;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.presentation.admin.mapper.AdminMapper;
import com.hhplus.storefront.presentation.admin.request.ChangeOrderStatusRequest;
import com.hhplus.storefront.presentation.admin.response.StatusChangeResponse;
import com.hhplus.storefront.presentation.order.mapper.OrderMapper;
import com.hhplus.storefront.presentation.order.response.OrderDetailResponse;
import com.hhplus.storefront.presentation.order.response.OrderSummaryResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * AdminOrderController - 운영자 주문 관리 API
 * 모든 요청은 X-USER-ID가 운영자 허용 목록에 있어야 한다 (아니면 403 UNAUTHORIZED).
 */
@RestController
@RequestMapping("/admin/orders")
public class AdminOrderController {

    private final OrderService orderService;
    private final OrderStatusService orderStatusService;
    private final OrderMapper orderMapper;
    private final AdminMapper adminMapper;

    public AdminOrderController(OrderService orderService,
                                OrderStatusService orderStatusService,
                                OrderMapper orderMapper,
                                AdminMapper adminMapper) {
        this.orderService = orderService;
        this.orderStatusService = orderStatusService;
        this.orderMapper = orderMapper;
        this.adminMapper = adminMapper;
    }

    /**
     * 최근 주문 목록 (GET /api/admin/orders) - 최신 50건
     */
    @GetMapping
    public ResponseEntity<List<OrderSummaryResponse>> getRecentOrders(@RequestHeader("X-USER-ID") Long operatorId) {
        return ResponseEntity.ok(orderMapper.toOrderSummaryResponses(orderService.getRecentOrders(operatorId)));
    }

    /**
     * 주문 상세 (GET /api/admin/orders/{order_id})
     */
    @GetMapping("/{order_id}")
    public ResponseEntity<OrderDetailResponse> getOrderDetail(
            @RequestHeader("X-USER-ID") Long operatorId,
            @PathVariable("order_id") Long orderId) {
        var appResponse = orderService.getOrderDetailForOperator(operatorId, orderId);
        return ResponseEntity.ok(orderMapper.toOrderDetailResponse(appResponse));
    }

    /**
     * 주문 상태 변경 (PATCH /api/admin/orders/{order_id}/status)
     */
    @PatchMapping("/{order_id}/status")
    public ResponseEntity<StatusChangeResponse> changeStatus(
            @RequestHeader("X-USER-ID") Long operatorId,
            @PathVariable("order_id") Long orderId,
            @RequestBody ChangeOrderStatusRequest request) {
        OrderStatus newStatus = adminMapper.toOrderStatus(request);
        var appResponse = orderStatusService.changeStatus(operatorId, orderId, newStatus);
        return ResponseEntity.ok(adminMapper.toStatusChangeResponse(appResponse));
    }
}
