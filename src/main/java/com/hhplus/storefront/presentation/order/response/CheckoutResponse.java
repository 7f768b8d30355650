package com.hhplus.storefront.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 체크아웃 응답 DTO
 * 빈 장바구니: order_id = 0, placed = false
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutResponse {
    @JsonProperty("order_id")
    private Long orderId;

    private boolean placed;

    @JsonProperty("total_amount")
    private Long totalAmount;

    @JsonProperty("item_count")
    private Integer itemCount;

    @JsonProperty("order_status")
    private String orderStatus;
}
