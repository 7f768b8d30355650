package com.hhplus.storefront.domain.order;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Order 도메인 엔티티 단위 테스트
 * - 생성 규칙 (주문자 정보 재검증, 총액 계산)
 * - 상태 전환 (종료 상태, 전환 정책)
 * - 결제 증빙 기록
 */
@DisplayName("Order 도메인 엔티티 테스트")
class OrderTest {

    private static final Long USER_ID = 100L;
    private static final Long ORDER_ID = 1L;

    private Order order;

    @BeforeEach
    void setUp() {
        order = Order.createOrder(USER_ID, "Aung", "09 1234 5678", "Yangon", "", List.of(
                OrderItem.snapshot(1L, "A", 1000L, 2),
                OrderItem.snapshot(2L, "B", 500L, 1)));
        ReflectionTestUtils.setField(order, "orderId", ORDER_ID);
    }

    // ========== 주문 생성 (createOrder) ==========

    @Test
    @DisplayName("주문 생성 - 총액은 항목 소계의 합이고 상태는 WAIT_PAYMENT")
    void testCreateOrder_TotalAndInitialStatus() {
        // Then
        assertEquals(2500L, order.getTotalAmount());
        assertEquals(OrderStatus.WAIT_PAYMENT, order.getOrderStatus());
        assertEquals(2, order.getOrderItems().size());
    }

    @Test
    @DisplayName("주문 생성 - 주문자 이름이 비어 있으면 InvalidCheckoutDetailsException")
    void testCreateOrder_BlankName() {
        List<OrderItem> items = List.of(OrderItem.snapshot(1L, "A", 1000L, 1));

        assertThrows(InvalidCheckoutDetailsException.class,
                () -> Order.createOrder(USER_ID, "  ", "0912345678", "Yangon", "", items));
    }

    @Test
    @DisplayName("주문 생성 - 연락처에 7자리 연속 숫자가 없으면 InvalidCheckoutDetailsException")
    void testCreateOrder_InvalidPhone() {
        List<OrderItem> items = List.of(OrderItem.snapshot(1L, "A", 1000L, 1));

        assertThrows(InvalidCheckoutDetailsException.class,
                () -> Order.createOrder(USER_ID, "Aung", "123-456", "Yangon", "", items));
        assertThrows(InvalidCheckoutDetailsException.class,
                () -> Order.createOrder(USER_ID, "Aung", null, "Yangon", "", items));
    }

    @Test
    @DisplayName("주문 생성 - 항목이 없으면 IllegalArgumentException")
    void testCreateOrder_NoItems() {
        assertThrows(IllegalArgumentException.class,
                () -> Order.createOrder(USER_ID, "Aung", "0912345678", "Yangon", "", List.of()));
    }

    @Test
    @DisplayName("주문 항목 목록은 외부에서 수정할 수 없다")
    void testGetOrderItems_Unmodifiable() {
        assertThrows(UnsupportedOperationException.class,
                () -> order.getOrderItems().add(OrderItem.snapshot(3L, "C", 1L, 1)));
    }

    // ========== 소유자 확인 ==========

    @Test
    @DisplayName("소유자 확인 - 주문자가 아니면 NotOrderOwnerException")
    void testVerifyOwner() {
        assertDoesNotThrow(() -> order.verifyOwner(USER_ID));
        NotOrderOwnerException exception = assertThrows(NotOrderOwnerException.class,
                () -> order.verifyOwner(999L));
        assertEquals("DOMAIN_ORDER_NOT_OWNER", exception.getErrorCodeValue());
    }

    // ========== 상태 전환 (changeStatus) ==========

    @Test
    @DisplayName("상태 전환 - PERMISSIVE는 PAID를 건너뛰고 PACKING으로 변경 가능")
    void testChangeStatus_PermissiveSkip() {
        // When
        OrderStatus old = order.changeStatus(OrderStatus.PACKING, OrderTransitionPolicy.PERMISSIVE);

        // Then
        assertEquals(OrderStatus.WAIT_PAYMENT, old);
        assertEquals(OrderStatus.PACKING, order.getOrderStatus());
    }

    @Test
    @DisplayName("상태 전환 - PERMISSIVE는 되돌리기도 허용")
    void testChangeStatus_PermissiveBackward() {
        order.changeStatus(OrderStatus.SHIPPED, OrderTransitionPolicy.PERMISSIVE);

        OrderStatus old = order.changeStatus(OrderStatus.WAIT_PAYMENT, OrderTransitionPolicy.PERMISSIVE);

        assertEquals(OrderStatus.SHIPPED, old);
        assertEquals(OrderStatus.WAIT_PAYMENT, order.getOrderStatus());
    }

    @Test
    @DisplayName("상태 전환 - 종료 상태에서는 어떤 정책이든 OrderAlreadyTerminalException")
    void testChangeStatus_FromTerminal() {
        // Given
        order.changeStatus(OrderStatus.DONE, OrderTransitionPolicy.PERMISSIVE);

        // When & Then
        assertThrows(OrderAlreadyTerminalException.class,
                () -> order.changeStatus(OrderStatus.CANCELED, OrderTransitionPolicy.PERMISSIVE));
        assertThrows(OrderAlreadyTerminalException.class,
                () -> order.changeStatus(OrderStatus.CANCELED, OrderTransitionPolicy.FORWARD_ONLY));
        assertEquals(OrderStatus.DONE, order.getOrderStatus());
    }

    @Test
    @DisplayName("상태 전환 - FORWARD_ONLY에서 되돌리면 InvalidStatusTransitionException, 상태 유지")
    void testChangeStatus_ForwardOnlyRejectsBackward() {
        order.changeStatus(OrderStatus.PACKING, OrderTransitionPolicy.FORWARD_ONLY);

        assertThrows(InvalidStatusTransitionException.class,
                () -> order.changeStatus(OrderStatus.PAID, OrderTransitionPolicy.FORWARD_ONLY));
        assertEquals(OrderStatus.PACKING, order.getOrderStatus());
    }

    @Test
    @DisplayName("상태 전환 - null 상태는 IllegalArgumentException")
    void testChangeStatus_Null() {
        assertThrows(IllegalArgumentException.class,
                () -> order.changeStatus(null, OrderTransitionPolicy.PERMISSIVE));
    }

    // ========== 결제 증빙 ==========

    @Test
    @DisplayName("결제 정보 기록 - 상태는 변하지 않는다")
    void testRecordPayment_KeepsStatus() {
        order.recordPayment("KBZPay", "TX-1");

        assertEquals("KBZPay", order.getPaymentMethod());
        assertEquals("TX-1", order.getPaymentReference());
        assertEquals(OrderStatus.WAIT_PAYMENT, order.getOrderStatus());
    }

    @Test
    @DisplayName("사진 증빙 - 결제 정보가 없으면 UNKNOWN / PHOTO_PROOF로 채운다")
    void testAttachProof_FillsSentinels() {
        order.attachProof("photo-123");

        assertEquals("photo-123", order.getPaymentProofReference());
        assertEquals(OrderConstants.UNKNOWN_PAYMENT_METHOD, order.getPaymentMethod());
        assertEquals(OrderConstants.PHOTO_PROOF_REFERENCE, order.getPaymentReference());
        assertEquals(OrderStatus.WAIT_PAYMENT, order.getOrderStatus());
    }

    @Test
    @DisplayName("사진 증빙 - 이미 제출된 결제 정보는 유지한다")
    void testAttachProof_KeepsExistingPayment() {
        order.recordPayment("WavePay", "TX-9");

        order.attachProof("photo-456");

        assertEquals("WavePay", order.getPaymentMethod());
        assertEquals("TX-9", order.getPaymentReference());
        assertEquals("photo-456", order.getPaymentProofReference());
    }

    @Test
    @DisplayName("결제 정보 재제출 - 사진 증빙은 지우지 않는다")
    void testRecordPayment_KeepsProof() {
        order.attachProof("photo-1");

        order.recordPayment("COD", "");

        assertEquals("COD", order.getPaymentMethod());
        assertEquals("", order.getPaymentReference());
        assertEquals("photo-1", order.getPaymentProofReference());
    }
}
