package com.hhplus.storefront.application.order;

import com.hhplus.storefront.application.order.dto.CheckoutCommand;
import com.hhplus.storefront.application.order.dto.CheckoutResponse;
import com.hhplus.storefront.application.order.dto.OrderDetailResponse;
import com.hhplus.storefront.application.order.dto.OrderSummaryResponse;
import com.hhplus.storefront.domain.operator.OperatorIdentity;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderConstants;
import com.hhplus.storefront.domain.order.OrderNotFoundException;
import com.hhplus.storefront.domain.order.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * OrderService - 주문 생성/조회 조정자 (Application 계층)
 *
 * 책임:
 * 1. 체크아웃 플로우 조정 (트랜잭션 구간은 OrderTransactionService에 위임)
 * 2. 고객 주문 조회 (최근 20건, 상세 + 소유자 확인)
 * 3. 운영자 주문 조회 (최근 50건, 상세)
 *
 * 플로우 (체크아웃):
 * OrderController
 *     ↓
 * OrderService.checkout()
 *     ├─ OrderTransactionService.placeOrder()  (@Transactional)
 *     └─ 결과 변환 (빈 장바구니 → orderId 0)
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;
    private final OrderTransactionService orderTransactionService;
    private final OperatorIdentity operatorIdentity;

    public OrderService(OrderRepository orderRepository,
                        OrderTransactionService orderTransactionService,
                        OperatorIdentity operatorIdentity) {
        this.orderRepository = orderRepository;
        this.orderTransactionService = orderTransactionService;
        this.operatorIdentity = operatorIdentity;
    }

    /**
     * 체크아웃
     *
     * 빈 장바구니는 예외가 아니라 orderId = 0 인 결과로 반환한다.
     */
    public CheckoutResponse checkout(Long userId, CheckoutCommand command) {
        Optional<Order> placed = orderTransactionService.placeOrder(userId, command);
        if (placed.isEmpty()) {
            log.info("[OrderService] 빈 장바구니 체크아웃 - userId={}", userId);
            return CheckoutResponse.emptyCart();
        }

        Order order = placed.get();
        log.info("[OrderService] 주문 생성 완료 - orderId={}, userId={}, totalAmount={}, items={}",
                order.getOrderId(), userId, order.getTotalAmount(), order.getOrderItems().size());
        return CheckoutResponse.fromOrder(order);
    }

    /**
     * 내 주문 목록 (최신순 20건)
     */
    @Transactional(readOnly = true)
    public List<OrderSummaryResponse> getMyOrders(Long userId) {
        return orderRepository.findLatestByUserId(userId, OrderConstants.MY_ORDERS_LIMIT).stream()
                .map(OrderSummaryResponse::fromOrder)
                .collect(Collectors.toList());
    }

    /**
     * 내 주문 상세
     * orderItems를 lazy load하기 위해 readOnly 트랜잭션 안에서 변환한다.
     */
    @Transactional(readOnly = true)
    public OrderDetailResponse getMyOrderDetail(Long userId, Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        order.verifyOwner(userId);
        return OrderDetailResponse.fromOrder(order);
    }

    /**
     * 운영자 주문 목록 (최신순 50건)
     */
    @Transactional(readOnly = true)
    public List<OrderSummaryResponse> getRecentOrders(Long operatorId) {
        operatorIdentity.requireOperator(operatorId);
        return orderRepository.findLatest(OrderConstants.OPERATOR_ORDERS_LIMIT).stream()
                .map(OrderSummaryResponse::fromOrder)
                .collect(Collectors.toList());
    }

    /**
     * 운영자 주문 상세 (주문자 연락처, 결제 증빙 포함)
     */
    @Transactional(readOnly = true)
    public OrderDetailResponse getOrderDetailForOperator(Long operatorId, Long orderId) {
        operatorIdentity.requireOperator(operatorId);
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        return OrderDetailResponse.fromOrder(order);
    }
}
