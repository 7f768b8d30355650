package com.hhplus.storefront.presentation.cart.mapper;

import com.hhplus.storefront.application.cart.dto.AddCartItemCommand;
import com.hhplus.storefront.presentation.cart.request.AddCartItemRequest;
import com.hhplus.storefront.presentation.cart.response.CartItemResponse;
import com.hhplus.storefront.presentation.cart.response.CartResponse;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * CartMapper - Presentation layer와 Application layer 간의 DTO 변환
 */
@Component
public class CartMapper {

    public AddCartItemCommand toAddCartItemCommand(AddCartItemRequest request) {
        if (request.getProductId() == null) {
            throw new IllegalArgumentException("product_id는 필수입니다");
        }
        return AddCartItemCommand.builder()
                .productId(request.getProductId())
                .quantity(request.getQuantity())
                .build();
    }

    public CartItemResponse toCartItemResponse(com.hhplus.storefront.application.cart.dto.CartItemResponse item) {
        return CartItemResponse.builder()
                .productId(item.getProductId())
                .productName(item.getProductName())
                .unitPrice(item.getUnitPrice())
                .quantity(item.getQuantity())
                .subtotal(item.getSubtotal())
                .build();
    }

    public CartResponse toCartResponse(com.hhplus.storefront.application.cart.dto.CartResponse appResponse) {
        return CartResponse.builder()
                .userId(appResponse.getUserId())
                .items(appResponse.getItems().stream()
                        .map(this::toCartItemResponse)
                        .collect(Collectors.toList()))
                .totalQuantity(appResponse.getTotalQuantity())
                .totalAmount(appResponse.getTotalAmount())
                .build();
    }
}
