package com.hhplus.storefront.application.order.listener;

import com.hhplus.storefront.config.StorefrontProperties;
import com.hhplus.storefront.domain.notification.Notifier;
import com.hhplus.storefront.domain.operator.OperatorIdentity;
import com.hhplus.storefront.domain.order.event.EvidenceType;
import com.hhplus.storefront.domain.order.event.OrderStatusChangedEvent;
import com.hhplus.storefront.domain.order.event.PaymentEvidenceSubmittedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 주문 알림 이벤트 리스너
 *
 * 역할:
 * - 상태 변경 → 주문 고객에게 알림
 * - 결제 증빙 제출 → 모든 운영자에게 확인 요청 알림
 *
 * 이벤트 처리 시점: AFTER_COMMIT
 * - 변경이 커밋된 뒤에만 알림 (롤백된 변경은 알리지 않음)
 *
 * 실패 처리:
 * - 수신자별로 try-catch, 실패는 로깅만 하고 전파하지 않음
 * - 주문 상태가 원본이며 알림은 best-effort
 */
@Component
public class OrderNotificationEventListener {

    private static final Logger log = LoggerFactory.getLogger(OrderNotificationEventListener.class);

    private final Notifier notifier;
    private final OperatorIdentity operatorIdentity;
    private final StorefrontProperties properties;

    public OrderNotificationEventListener(Notifier notifier,
                                          OperatorIdentity operatorIdentity,
                                          StorefrontProperties properties) {
        this.notifier = notifier;
        this.operatorIdentity = operatorIdentity;
        this.properties = properties;
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderStatusChanged(OrderStatusChangedEvent event) {
        log.info("[OrderNotificationEventListener] 상태 변경 이벤트 수신 - orderId={}, {} → {}",
                event.getOrderId(), event.getOldStatus(), event.getNewStatus());

        String text = String.format("주문 #%d 상태가 변경되었습니다: %s → %s",
                event.getOrderId(),
                event.getOldStatus().getDisplayName(),
                event.getNewStatus().getDisplayName());
        deliver(event.getUserId(), text, event.getOrderId());
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handlePaymentEvidenceSubmitted(PaymentEvidenceSubmittedEvent event) {
        log.info("[OrderNotificationEventListener] 결제 증빙 이벤트 수신 - orderId={}, type={}",
                event.getOrderId(), event.getEvidenceType());

        String text = buildEvidenceText(event);
        for (Long operatorId : operatorIdentity.operatorIds()) {
            deliver(operatorId, text, event.getOrderId());
        }
    }

    private String buildEvidenceText(PaymentEvidenceSubmittedEvent event) {
        String amount = String.format("%,d %s", event.getTotalAmount(), properties.getCurrency());
        if (event.getEvidenceType() == EvidenceType.PROOF) {
            return String.format("[결제 확인 요청] 주문 #%d (고객 %d, %s) 결제 사진 증빙: %s / 상태: %s",
                    event.getOrderId(), event.getUserId(), amount,
                    event.getProofReference(), event.getStatus());
        }
        return String.format("[결제 확인 요청] 주문 #%d (고객 %d, %s) 결제 수단: %s, 거래 참조: %s / 상태: %s",
                event.getOrderId(), event.getUserId(), amount,
                event.getPaymentMethod(), event.getPaymentReference(), event.getStatus());
    }

    private void deliver(Long recipientId, String text, Long orderId) {
        try {
            notifier.notify(recipientId, text);
        } catch (Exception e) {
            log.error("[OrderNotificationEventListener] 알림 발송 실패 (무시됨) - orderId={}, recipient={}, error={}",
                    orderId, recipientId, e.getMessage(), e);
        }
    }
}
