package com.hhplus.storefront.domain.order.event;

import com.hhplus.storefront.domain.order.OrderStatus;
import lombok.Getter;
import lombok.ToString;

/**
 * 결제 증빙 제출 이벤트
 *
 * 용도: 운영자에게 결제 확인 요청 알림 (트랜잭션 커밋 후 비동기 처리)
 * 발행 시점: PaymentService.submitPayment() / submitProof() 트랜잭션 내부
 * 리스너: OrderNotificationEventListener
 */
@Getter
@ToString
public class PaymentEvidenceSubmittedEvent {

    private final Long orderId;
    private final Long userId;
    private final Long totalAmount;
    private final EvidenceType evidenceType;
    private final String paymentMethod;
    private final String paymentReference;
    private final String proofReference;
    private final OrderStatus status;

    public PaymentEvidenceSubmittedEvent(Long orderId, Long userId, Long totalAmount, EvidenceType evidenceType,
                                         String paymentMethod, String paymentReference,
                                         String proofReference, OrderStatus status) {
        this.orderId = orderId;
        this.userId = userId;
        this.totalAmount = totalAmount;
        this.evidenceType = evidenceType;
        this.paymentMethod = paymentMethod;
        this.paymentReference = paymentReference;
        this.proofReference = proofReference;
        this.status = status;
    }
}
