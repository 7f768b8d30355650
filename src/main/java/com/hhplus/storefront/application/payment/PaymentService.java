package com.hhplus.storefront.application.payment;

import com.hhplus.storefront.application.payment.dto.PaymentEvidenceResponse;
import com.hhplus.storefront.application.payment.dto.SubmitPaymentCommand;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderNotFoundException;
import com.hhplus.storefront.domain.order.OrderRepository;
import com.hhplus.storefront.domain.order.event.EvidenceType;
import com.hhplus.storefront.domain.order.event.PaymentEvidenceSubmittedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * PaymentService - 결제 증빙 기록 (Application 계층)
 *
 * 책임:
 * - 고객이 제출한 결제 수단/거래 참조, 사진 증빙을 주문에 기록
 * - 기록 후 운영자 알림 이벤트 발행 (커밋 후 전달)
 *
 * 비즈니스 규칙:
 * - 주문자 본인만 제출 가능 (NotOrderOwnerException)
 * - 증빙 제출은 주문 상태를 바꾸지 않음 (결제 확인은 운영자가 상태 변경으로 처리)
 * - 사진 증빙은 기존 결제 수단/참조를 지우지 않고, 결제 수단/참조 제출은 사진 증빙을 지우지 않음
 *
 * 동시성 제어:
 * - 주문을 FOR UPDATE로 조회하여 운영자의 상태 변경과 동시에 일어나도 서로의 변경을 덮어쓰지 않음
 */
@Slf4j
@Service
public class PaymentService {

    private final OrderRepository orderRepository;
    private final ApplicationEventPublisher eventPublisher;

    public PaymentService(OrderRepository orderRepository,
                          ApplicationEventPublisher eventPublisher) {
        this.orderRepository = orderRepository;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 결제 수단 + 거래 참조 제출
     */
    @Transactional(rollbackFor = Exception.class)
    @Retryable(
        retryFor = PessimisticLockingFailureException.class,
        maxAttempts = 3,
        backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 1000, random = true)
    )
    public PaymentEvidenceResponse submitPayment(Long orderId, Long requesterUserId, SubmitPaymentCommand command) {
        Order order = loadOwnedOrder(orderId, requesterUserId);

        order.recordPayment(trimToEmpty(command.getMethod()), trimToEmpty(command.getReference()));
        orderRepository.save(order);

        publishEvidence(order, EvidenceType.REFERENCE);
        log.info("[PaymentService] 결제 정보 제출 - orderId={}, userId={}, method={}",
                orderId, requesterUserId, order.getPaymentMethod());
        return PaymentEvidenceResponse.fromOrder(order);
    }

    /**
     * 사진 증빙 제출
     *
     * @throws IllegalArgumentException 증빙 참조가 비어 있음
     */
    @Transactional(rollbackFor = Exception.class)
    @Retryable(
        retryFor = PessimisticLockingFailureException.class,
        maxAttempts = 3,
        backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 1000, random = true)
    )
    public PaymentEvidenceResponse submitProof(Long orderId, Long requesterUserId, String proofReference) {
        if (proofReference == null || proofReference.isBlank()) {
            throw new IllegalArgumentException("결제 증빙 참조는 필수입니다");
        }
        Order order = loadOwnedOrder(orderId, requesterUserId);

        order.attachProof(proofReference.trim());
        orderRepository.save(order);

        publishEvidence(order, EvidenceType.PROOF);
        log.info("[PaymentService] 결제 증빙 사진 제출 - orderId={}, userId={}", orderId, requesterUserId);
        return PaymentEvidenceResponse.fromOrder(order);
    }

    private Order loadOwnedOrder(Long orderId, Long requesterUserId) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        order.verifyOwner(requesterUserId);
        return order;
    }

    private void publishEvidence(Order order, EvidenceType evidenceType) {
        eventPublisher.publishEvent(new PaymentEvidenceSubmittedEvent(
                order.getOrderId(),
                order.getUserId(),
                order.getTotalAmount(),
                evidenceType,
                order.getPaymentMethod(),
                order.getPaymentReference(),
                order.getPaymentProofReference(),
                order.getOrderStatus()));
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
