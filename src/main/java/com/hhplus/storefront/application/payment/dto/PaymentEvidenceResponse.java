package com.hhplus.storefront.application.payment.dto;

import com.hhplus.storefront.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 증빙 기록 결과 (상태는 변경되지 않은 현재 상태)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentEvidenceResponse {
    private Long orderId;
    private String paymentMethod;
    private String paymentReference;
    private String paymentProofReference;
    private String orderStatus;

    public static PaymentEvidenceResponse fromOrder(Order order) {
        return PaymentEvidenceResponse.builder()
                .orderId(order.getOrderId())
                .paymentMethod(order.getPaymentMethod())
                .paymentReference(order.getPaymentReference())
                .paymentProofReference(order.getPaymentProofReference())
                .orderStatus(order.getOrderStatus().name())
                .build();
    }
}
