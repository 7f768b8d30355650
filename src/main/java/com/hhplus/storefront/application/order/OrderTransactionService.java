package com.hhplus.storefront.application.order;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.application.cart.dto.CartResponse;
import com.hhplus.storefront.application.order.dto.CheckoutCommand;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderItem;
import com.hhplus.storefront.domain.order.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * OrderTransactionService - 체크아웃 트랜잭션 처리 서비스 (Application 계층)
 *
 * 역할:
 * - OrderService와 분리된 독립적인 서비스
 * - 장바구니 → 주문 변환의 원자적 구간만 담당
 * - OrderService에서 같은 클래스의 @Transactional 메서드를 호출하면 프록시를 거치지 않으므로 분리
 *
 * 하나의 트랜잭션으로 처리되는 작업:
 * - 장바구니 조회 (현재 카탈로그 가격 조인)
 * - 주문 저장 + 주문 항목 스냅샷 저장 (cascade PERSIST)
 * - 장바구니 비우기
 *
 * 어느 단계에서든 예외가 발생하면 세 작업 모두 롤백된다.
 */
@Service
public class OrderTransactionService {

    private static final Logger log = LoggerFactory.getLogger(OrderTransactionService.class);

    private final OrderRepository orderRepository;
    private final CartService cartService;

    public OrderTransactionService(OrderRepository orderRepository,
                                   CartService cartService) {
        this.orderRepository = orderRepository;
        this.cartService = cartService;
    }

    /**
     * 장바구니를 주문으로 변환
     *
     * @return 생성된 주문, 장바구니가 비어 있으면 Optional.empty()
     * @throws com.hhplus.storefront.domain.order.InvalidCheckoutDetailsException 주문자 정보 재검증 실패
     */
    @Transactional(
        propagation = Propagation.REQUIRED,
        rollbackFor = Exception.class
    )
    public Optional<Order> placeOrder(Long userId, CheckoutCommand command) {
        CartResponse cart = cartService.getCart(userId);
        if (cart.isEmpty()) {
            return Optional.empty();
        }

        List<OrderItem> snapshots = cart.getItems().stream()
                .map(line -> OrderItem.snapshot(
                        line.getProductId(),
                        line.getProductName(),
                        line.getUnitPrice(),
                        line.getQuantity()))
                .collect(Collectors.toList());

        Order order = Order.createOrder(
                userId,
                command.getCustomerName(),
                command.getPhone(),
                command.getAddress(),
                command.getNote(),
                snapshots);
        Order savedOrder = orderRepository.save(order);

        int cleared = cartService.clearCart(userId);
        log.debug("[OrderTransactionService] 장바구니 비움 - userId={}, lines={}", userId, cleared);

        return Optional.of(savedOrder);
    }
}
