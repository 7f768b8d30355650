package com.hhplus.storefront.presentation.order.mapper;

import com.hhplus.storefront.application.order.dto.CheckoutCommand;
import com.hhplus.storefront.presentation.order.request.CheckoutRequest;
import com.hhplus.storefront.presentation.order.response.CheckoutResponse;
import com.hhplus.storefront.presentation.order.response.OrderDetailResponse;
import com.hhplus.storefront.presentation.order.response.OrderItemResponse;
import com.hhplus.storefront.presentation.order.response.OrderSummaryResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderMapper - Presentation layer와 Application layer 간의 DTO 변환
 *
 * 책임:
 * - Presentation Request DTO → Application Command 변환 (메모 "-" 정규화 포함)
 * - Application Response DTO → Presentation Response DTO 변환
 */
@Component
public class OrderMapper {

    private static final String NO_NOTE = "-";

    public CheckoutCommand toCheckoutCommand(CheckoutRequest request) {
        String note = request.getNote();
        if (note != null && note.trim().equals(NO_NOTE)) {
            note = "";
        }
        return CheckoutCommand.builder()
                .customerName(request.getCustomerName())
                .phone(request.getPhone())
                .address(request.getAddress())
                .note(note)
                .build();
    }

    public CheckoutResponse toCheckoutResponse(com.hhplus.storefront.application.order.dto.CheckoutResponse appResponse) {
        return CheckoutResponse.builder()
                .orderId(appResponse.getOrderId())
                .placed(appResponse.isPlaced())
                .totalAmount(appResponse.getTotalAmount())
                .itemCount(appResponse.getItemCount())
                .orderStatus(appResponse.getOrderStatus())
                .build();
    }

    public List<OrderSummaryResponse> toOrderSummaryResponses(
            List<com.hhplus.storefront.application.order.dto.OrderSummaryResponse> appResponses) {
        return appResponses.stream()
                .map(summary -> OrderSummaryResponse.builder()
                        .orderId(summary.getOrderId())
                        .userId(summary.getUserId())
                        .totalAmount(summary.getTotalAmount())
                        .orderStatus(summary.getOrderStatus())
                        .createdAt(summary.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }

    public OrderDetailResponse toOrderDetailResponse(
            com.hhplus.storefront.application.order.dto.OrderDetailResponse appResponse) {
        return OrderDetailResponse.builder()
                .orderId(appResponse.getOrderId())
                .userId(appResponse.getUserId())
                .customerName(appResponse.getCustomerName())
                .phone(appResponse.getPhone())
                .address(appResponse.getAddress())
                .note(appResponse.getNote())
                .totalAmount(appResponse.getTotalAmount())
                .orderStatus(appResponse.getOrderStatus())
                .paymentMethod(appResponse.getPaymentMethod())
                .paymentReference(appResponse.getPaymentReference())
                .paymentProofReference(appResponse.getPaymentProofReference())
                .orderItems(appResponse.getOrderItems().stream()
                        .map(item -> OrderItemResponse.builder()
                                .orderItemId(item.getOrderItemId())
                                .productId(item.getProductId())
                                .productName(item.getProductName())
                                .unitPrice(item.getUnitPrice())
                                .quantity(item.getQuantity())
                                .subtotal(item.getSubtotal())
                                .build())
                        .collect(Collectors.toList()))
                .createdAt(appResponse.getCreatedAt())
                .build();
    }
}
