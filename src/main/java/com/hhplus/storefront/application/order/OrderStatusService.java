package com.hhplus.storefront.application.order;

import com.hhplus.storefront.application.order.dto.StatusChangeResponse;
import com.hhplus.storefront.domain.operator.OperatorIdentity;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderNotFoundException;
import com.hhplus.storefront.domain.order.OrderRepository;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.domain.order.OrderTransitionPolicy;
import com.hhplus.storefront.domain.order.event.OrderStatusChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * OrderStatusService - 주문 상태 머신 (Application 계층)
 *
 * 검증 순서:
 * 1. 운영자 권한 (UnauthorizedException)
 * 2. 주문 존재 (OrderNotFoundException)
 * 3. 종료 상태 여부 (OrderAlreadyTerminalException)
 * 4. 전환 정책 (FORWARD_ONLY일 때만 InvalidStatusTransitionException)
 *
 * 동시성 제어:
 * - SELECT ... FOR UPDATE 로 주문을 잠근 뒤 현재 상태 확인과 변경을 같은 트랜잭션에서 처리
 *   (같은 주문에 대한 동시 변경은 직렬화되어 뒤의 요청이 앞의 결과를 보게 됨)
 * - 락 획득 실패(PessimisticLockingFailureException)는 최대 3회, jitter backoff로 재시도
 *
 * 알림:
 * - OrderStatusChangedEvent를 트랜잭션 안에서 발행, 커밋 후 리스너가 고객에게 전달
 * - 알림 실패는 상태 변경을 되돌리지 않음
 */
@Service
public class OrderStatusService {

    private static final Logger log = LoggerFactory.getLogger(OrderStatusService.class);

    private final OrderRepository orderRepository;
    private final OperatorIdentity operatorIdentity;
    private final OrderTransitionPolicy transitionPolicy;
    private final ApplicationEventPublisher eventPublisher;

    public OrderStatusService(OrderRepository orderRepository,
                              OperatorIdentity operatorIdentity,
                              OrderTransitionPolicy transitionPolicy,
                              ApplicationEventPublisher eventPublisher) {
        this.orderRepository = orderRepository;
        this.operatorIdentity = operatorIdentity;
        this.transitionPolicy = transitionPolicy;
        this.eventPublisher = eventPublisher;
    }

    @Transactional(rollbackFor = Exception.class)
    @Retryable(
        retryFor = PessimisticLockingFailureException.class,
        maxAttempts = 3,
        backoff = @Backoff(
            delay = 50,
            multiplier = 2,
            maxDelay = 1000,
            random = true
        )
    )
    public StatusChangeResponse changeStatus(Long actorUserId, Long orderId, OrderStatus newStatus) {
        operatorIdentity.requireOperator(actorUserId);

        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        OrderStatus oldStatus = order.changeStatus(newStatus, transitionPolicy);
        orderRepository.save(order);

        eventPublisher.publishEvent(
                new OrderStatusChangedEvent(order.getOrderId(), order.getUserId(), oldStatus, newStatus));

        log.info("[OrderStatusService] 상태 변경 - orderId={}, {} → {}, operatorId={}, policy={}",
                orderId, oldStatus, newStatus, actorUserId, transitionPolicy);

        return StatusChangeResponse.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .oldStatus(oldStatus.name())
                .newStatus(newStatus.name())
                .build();
    }
}
