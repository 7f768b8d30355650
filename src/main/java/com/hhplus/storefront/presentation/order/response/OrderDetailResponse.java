package com.hhplus.storefront.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 상세 응답 DTO (고객/운영자 공용)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderDetailResponse {
    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("user_id")
    private Long userId;

    @JsonProperty("customer_name")
    private String customerName;

    private String phone;

    private String address;

    private String note;

    @JsonProperty("total_amount")
    private Long totalAmount;

    @JsonProperty("order_status")
    private String orderStatus;

    @JsonProperty("payment_method")
    private String paymentMethod;

    @JsonProperty("payment_reference")
    private String paymentReference;

    @JsonProperty("payment_proof_reference")
    private String paymentProofReference;

    @JsonProperty("order_items")
    private List<OrderItemResponse> orderItems;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;
}
