package com.hhplus.storefront.application.order.dto;

import com.hhplus.storefront.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 체크아웃 결과
 *
 * 빈 장바구니는 예외가 아닌 결과로 표현한다: orderId = 0, placed = false.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutResponse {

    public static final long NO_ORDER_ID = 0L;

    private Long orderId;
    private boolean placed;
    private Long totalAmount;
    private Integer itemCount;
    private String orderStatus;

    public static CheckoutResponse fromOrder(Order order) {
        return CheckoutResponse.builder()
                .orderId(order.getOrderId())
                .placed(true)
                .totalAmount(order.getTotalAmount())
                .itemCount(order.getOrderItems().size())
                .orderStatus(order.getOrderStatus().name())
                .build();
    }

    public static CheckoutResponse emptyCart() {
        return CheckoutResponse.builder()
                .orderId(NO_ORDER_ID)
                .placed(false)
                .totalAmount(0L)
                .itemCount(0)
                .build();
    }
}
