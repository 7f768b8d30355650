package com.hhplus.storefront.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 담기 커맨드 (quantity 미지정 시 1)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemCommand {
    private Long productId;
    private Integer quantity;
}
