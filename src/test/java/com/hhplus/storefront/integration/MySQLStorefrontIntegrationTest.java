package com.hhplus.storefront.integration;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.application.cart.dto.AddCartItemCommand;
import com.hhplus.storefront.application.cart.dto.CartItemResponse;
import com.hhplus.storefront.application.order.OrderService;
import com.hhplus.storefront.application.order.OrderStatusService;
import com.hhplus.storefront.application.order.dto.CheckoutCommand;
import com.hhplus.storefront.application.order.dto.CheckoutResponse;
import com.hhplus.storefront.domain.order.OrderAlreadyTerminalException;
import com.hhplus.storefront.domain.order.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MySQL 8.0 통합 테스트
 * - 운영 스키마 + validate 로 컨텍스트가 뜨는지
 * - 첫 담기 동시 경합 (갭 락 교착 / 유니크 제약) 재시도 후 수량 누적
 * - 같은 주문에 대한 동시 취소 직렬화
 */
@DisplayName("MySQL 통합 테스트")
class MySQLStorefrontIntegrationTest extends BaseMySQLIntegrationTest {

    private static final Long CUSTOMER_ID = 100L;

    @Autowired
    private CartService cartService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private OrderStatusService orderStatusService;

    private final CheckoutCommand details = CheckoutCommand.builder()
            .customerName("Aung")
            .phone("09 1234 5678")
            .address("Mandalay")
            .note("")
            .build();

    // ========== 스키마 ==========

    @Test
    @DisplayName("운영 스키마 - order_status 는 ENUM 컬럼이고 엔티티 검증을 통과한다")
    void testProductionSchemaMatchesEntities() {
        String columnType = jdbcTemplate.queryForObject(
                "SELECT COLUMN_TYPE FROM information_schema.COLUMNS "
                        + "WHERE TABLE_SCHEMA = DATABASE() AND TABLE_NAME = 'orders' AND COLUMN_NAME = 'order_status'",
                String.class);

        assertNotNull(columnType);
        assertTrue(columnType.toLowerCase().startsWith("enum("));
    }

    @Test
    @DisplayName("체크아웃 후 상태 변경 - MySQL 에 저장/조회된다")
    void testCheckoutAndChangeStatus() {
        // Given
        Long productId = createProduct("Longyi", 15000L);
        cartService.addItem(CUSTOMER_ID, AddCartItemCommand.builder().productId(productId).quantity(2).build());

        // When
        CheckoutResponse response = orderService.checkout(CUSTOMER_ID, details);
        orderStatusService.changeStatus(OPERATOR_ID, response.getOrderId(), OrderStatus.PAID);

        // Then
        assertEquals(30000L, response.getTotalAmount());
        assertEquals("PAID", orderService.getOrderDetailForOperator(OPERATOR_ID, response.getOrderId())
                .getOrderStatus());
        assertTrue(cartService.getCart(CUSTOMER_ID).isEmpty());
    }

    // ========== 동시성 ==========

    @Test
    @DisplayName("첫 담기 동시 요청 - 모두 성공하고 한 라인에 수량이 누적된다")
    void testAddItem_ConcurrentFirstAdd() throws InterruptedException {
        // Given
        Long productId = createProduct("Longyi", 1000L);
        int threads = 4;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(threads);
        AtomicInteger failureCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        // When
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    cartService.addItem(CUSTOMER_ID,
                            AddCartItemCommand.builder().productId(productId).quantity(1).build());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    failureCount.incrementAndGet();
                } finally {
                    endLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(endLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        // Then
        List<CartItemResponse> items = cartService.getCart(CUSTOMER_ID).getItems();
        assertEquals(0, failureCount.get());
        assertEquals(1, items.size());
        assertEquals(threads, items.get(0).getQuantity());
        assertEquals(threads * 1000L, cartService.getTotal(CUSTOMER_ID));
    }

    @Test
    @DisplayName("동시 취소 - 하나만 성공하고 나머지는 종료 상태 예외")
    void testChangeStatus_ConcurrentCancel() throws InterruptedException {
        // Given
        Long productId = createProduct("Longyi", 15000L);
        cartService.addItem(CUSTOMER_ID, AddCartItemCommand.builder().productId(productId).build());
        Long orderId = orderService.checkout(CUSTOMER_ID, details).getOrderId();

        int threads = 5;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(threads);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger terminalCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        // When
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    orderStatusService.changeStatus(OPERATOR_ID, orderId, OrderStatus.CANCELED);
                    successCount.incrementAndGet();
                } catch (OrderAlreadyTerminalException e) {
                    terminalCount.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    endLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(endLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        // Then
        assertEquals(1, successCount.get());
        assertEquals(threads - 1, terminalCount.get());
        assertEquals("CANCELED", orderService.getOrderDetailForOperator(OPERATOR_ID, orderId).getOrderStatus());
    }
}
