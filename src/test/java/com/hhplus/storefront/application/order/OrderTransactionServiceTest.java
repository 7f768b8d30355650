package com.hhplus.storefront.application.order;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.application.cart.dto.CartItemResponse;
import com.hhplus.storefront.application.cart.dto.CartResponse;
import com.hhplus.storefront.application.order.dto.CheckoutCommand;
import com.hhplus.storefront.domain.order.InvalidCheckoutDetailsException;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderItem;
import com.hhplus.storefront.domain.order.OrderRepository;
import com.hhplus.storefront.domain.order.OrderStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderTransactionService 단위 테스트")
class OrderTransactionServiceTest {

    private static final Long USER_ID = 100L;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private CartService cartService;

    private OrderTransactionService orderTransactionService;

    private final CheckoutCommand command = CheckoutCommand.builder()
            .customerName("Aung")
            .phone("09 1234567")
            .address("Yangon")
            .note("")
            .build();

    @BeforeEach
    void setUp() {
        orderTransactionService = new OrderTransactionService(orderRepository, cartService);
    }

    private CartItemResponse line(Long productId, String name, Long price, int quantity) {
        return CartItemResponse.builder()
                .productId(productId)
                .productName(name)
                .unitPrice(price)
                .quantity(quantity)
                .subtotal(price * quantity)
                .build();
    }

    @Test
    @DisplayName("주문 생성 - 장바구니 스냅샷으로 주문을 만들고 장바구니를 비운다")
    void testPlaceOrder_Success() {
        // Given
        when(cartService.getCart(USER_ID)).thenReturn(CartResponse.of(USER_ID, List.of(
                line(2L, "B", 500L, 1),
                line(1L, "A", 1000L, 2))));
        when(orderRepository.save(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        Optional<Order> placed = orderTransactionService.placeOrder(USER_ID, command);

        // Then
        assertTrue(placed.isPresent());
        Order order = placed.get();
        assertEquals(2500L, order.getTotalAmount());
        assertEquals(OrderStatus.WAIT_PAYMENT, order.getOrderStatus());
        assertEquals(List.of(2L, 1L), order.getOrderItems().stream().map(OrderItem::getProductId).collect(Collectors.toList()));

        InOrder inOrder = inOrder(orderRepository, cartService);
        inOrder.verify(orderRepository).save(order);
        inOrder.verify(cartService).clearCart(USER_ID);
    }

    @Test
    @DisplayName("주문 생성 - 빈 장바구니는 저장 없이 Optional.empty()")
    void testPlaceOrder_EmptyCart() {
        when(cartService.getCart(USER_ID)).thenReturn(CartResponse.of(USER_ID, List.of()));

        assertTrue(orderTransactionService.placeOrder(USER_ID, command).isEmpty());
        verifyNoInteractions(orderRepository);
        verify(cartService, never()).clearCart(any());
    }

    @Test
    @DisplayName("주문 생성 - 주문자 정보 재검증 실패 시 장바구니를 비우지 않는다")
    void testPlaceOrder_InvalidDetails() {
        when(cartService.getCart(USER_ID)).thenReturn(CartResponse.of(USER_ID, List.of(line(1L, "A", 1000L, 1))));
        CheckoutCommand invalid = CheckoutCommand.builder().customerName("Aung").phone("12-34").build();

        assertThrows(InvalidCheckoutDetailsException.class,
                () -> orderTransactionService.placeOrder(USER_ID, invalid));
        verify(orderRepository, never()).save(any());
        verify(cartService, never()).clearCart(any());
    }
}
