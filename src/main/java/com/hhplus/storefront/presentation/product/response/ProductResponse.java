package com.hhplus.storefront.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 상품 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {
    @JsonProperty("product_id")
    private Long productId;

    private String name;

    private Long price;

    private String description;

    @JsonProperty("photo_reference")
    private String photoReference;

    private boolean active;
}
