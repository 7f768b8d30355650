package com.hhplus.storefront.application.order.dto;

import com.hhplus.storefront.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 주문 목록의 한 줄 요약
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderSummaryResponse {
    private Long orderId;
    private Long userId;
    private Long totalAmount;
    private String orderStatus;
    private LocalDateTime createdAt;

    public static OrderSummaryResponse fromOrder(Order order) {
        return OrderSummaryResponse.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .totalAmount(order.getTotalAmount())
                .orderStatus(order.getOrderStatus().name())
                .createdAt(order.getCreatedAt())
                .build();
    }
}
