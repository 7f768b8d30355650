package com.hhplus.storefront.application.catalog.dto;

import com.hhplus.storefront.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 상품 응답 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {
    private Long productId;
    private String name;
    private Long price;
    private String description;
    private String photoReference;
    private boolean active;

    public static ProductResponse fromProduct(Product product) {
        return ProductResponse.builder()
                .productId(product.getProductId())
                .name(product.getName())
                .price(product.getPrice())
                .description(product.getDescription())
                .photoReference(product.getPhotoReference())
                .active(product.isActive())
                .build();
    }
}
