package com.hhplus.storefront.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 장바구니 조회 응답 DTO (현재 카탈로그 가격 기준)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {
    @JsonProperty("user_id")
    private Long userId;

    private List<CartItemResponse> items;

    @JsonProperty("total_quantity")
    private Integer totalQuantity;

    @JsonProperty("total_amount")
    private Long totalAmount;
}
