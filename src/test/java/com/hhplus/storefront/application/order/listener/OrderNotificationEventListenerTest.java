package com.hhplus.storefront.application.order.listener;

import com.hhplus.storefront.config.StorefrontProperties;
import com.hhplus.storefront.domain.notification.NotificationException;
import com.hhplus.storefront.domain.notification.Notifier;
import com.hhplus.storefront.domain.operator.OperatorIdentity;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.domain.order.event.EvidenceType;
import com.hhplus.storefront.domain.order.event.OrderStatusChangedEvent;
import com.hhplus.storefront.domain.order.event.PaymentEvidenceSubmittedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * OrderNotificationEventListener 단위 테스트
 * - 수신자별 알림 문구
 * - 알림 실패가 전파되지 않는지
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderNotificationEventListener 단위 테스트")
class OrderNotificationEventListenerTest {

    @Mock
    private Notifier notifier;

    @Mock
    private OperatorIdentity operatorIdentity;

    private OrderNotificationEventListener listener;

    @BeforeEach
    void setUp() {
        StorefrontProperties properties = new StorefrontProperties();
        properties.setOperatorIds(List.of(9001L, 9002L));
        listener = new OrderNotificationEventListener(notifier, operatorIdentity, properties);
    }

    private PaymentEvidenceSubmittedEvent referenceEvent() {
        return new PaymentEvidenceSubmittedEvent(7L, 100L, 2500L, EvidenceType.REFERENCE,
                "KBZPay", "TX-1", null, OrderStatus.WAIT_PAYMENT);
    }

    // ========== 상태 변경 알림 ==========

    @Test
    @DisplayName("상태 변경 - 주문 고객에게 이전/새 상태를 알린다")
    void testHandleOrderStatusChanged() {
        listener.handleOrderStatusChanged(
                new OrderStatusChangedEvent(7L, 100L, OrderStatus.WAIT_PAYMENT, OrderStatus.PACKING));

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(notifier).notify(eq(100L), text.capture());
        assertTrue(text.getValue().contains("#7"));
        assertTrue(text.getValue().contains(OrderStatus.WAIT_PAYMENT.getDisplayName()));
        assertTrue(text.getValue().contains(OrderStatus.PACKING.getDisplayName()));
    }

    @Test
    @DisplayName("상태 변경 - 알림 실패는 전파되지 않는다")
    void testHandleOrderStatusChanged_NotifierFails() {
        doThrow(new NotificationException("blocked")).when(notifier).notify(eq(100L), anyString());

        assertDoesNotThrow(() -> listener.handleOrderStatusChanged(
                new OrderStatusChangedEvent(7L, 100L, OrderStatus.PAID, OrderStatus.SHIPPED)));
    }

    // ========== 결제 증빙 알림 ==========

    @Test
    @DisplayName("결제 증빙 - 모든 운영자에게 금액/결제 수단 포함 알림")
    void testHandlePaymentEvidence_AllOperators() {
        when(operatorIdentity.operatorIds()).thenReturn(new LinkedHashSet<>(List.of(9001L, 9002L)));

        listener.handlePaymentEvidenceSubmitted(referenceEvent());

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(notifier).notify(eq(9001L), text.capture());
        verify(notifier).notify(eq(9002L), anyString());
        assertTrue(text.getValue().contains("2,500 MMK"));
        assertTrue(text.getValue().contains("KBZPay"));
        assertTrue(text.getValue().contains("TX-1"));
    }

    @Test
    @DisplayName("결제 증빙 - 한 운영자 알림이 실패해도 나머지 운영자에게 전달")
    void testHandlePaymentEvidence_OneOperatorFails() {
        when(operatorIdentity.operatorIds()).thenReturn(new LinkedHashSet<>(List.of(9001L, 9002L)));
        doThrow(new NotificationException("blocked")).when(notifier).notify(eq(9001L), anyString());

        assertDoesNotThrow(() -> listener.handlePaymentEvidenceSubmitted(referenceEvent()));
        verify(notifier).notify(eq(9002L), anyString());
    }

    @Test
    @DisplayName("사진 증빙 - 증빙 참조를 포함")
    void testHandlePaymentEvidence_Proof() {
        when(operatorIdentity.operatorIds()).thenReturn(new LinkedHashSet<>(List.of(9001L)));

        listener.handlePaymentEvidenceSubmitted(new PaymentEvidenceSubmittedEvent(7L, 100L, 2500L,
                EvidenceType.PROOF, "UNKNOWN", "PHOTO_PROOF", "photo-9", OrderStatus.WAIT_PAYMENT));

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(notifier).notify(eq(9001L), text.capture());
        assertTrue(text.getValue().contains("photo-9"));
    }
}
