package com.hhplus.storefront.application.order.dto;

import com.hhplus.storefront.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 상세 (Application layer 내부 DTO)
 * 주문자 연락처와 결제 증빙을 포함한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderDetailResponse {
    private Long orderId;
    private Long userId;
    private String customerName;
    private String phone;
    private String address;
    private String note;
    private Long totalAmount;
    private String orderStatus;
    private String paymentMethod;
    private String paymentReference;
    private String paymentProofReference;
    private List<OrderItemResponse> orderItems;
    private LocalDateTime createdAt;

    public static OrderDetailResponse fromOrder(Order order) {
        return OrderDetailResponse.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .customerName(order.getCustomerName())
                .phone(order.getPhone())
                .address(order.getAddress())
                .note(order.getNote())
                .totalAmount(order.getTotalAmount())
                .orderStatus(order.getOrderStatus().name())
                .paymentMethod(order.getPaymentMethod())
                .paymentReference(order.getPaymentReference())
                .paymentProofReference(order.getPaymentProofReference())
                .orderItems(order.getOrderItems().stream()
                        .map(OrderItemResponse::fromOrderItem)
                        .collect(Collectors.toList()))
                .createdAt(order.getCreatedAt())
                .build();
    }
}
