package com.hhplus.storefront.presentation.product.mapper;

import com.hhplus.storefront.presentation.product.response.ProductResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ProductMapper - Application ProductResponse → Presentation ProductResponse 변환
 */
@Component
public class ProductMapper {

    public ProductResponse toProductResponse(com.hhplus.storefront.application.catalog.dto.ProductResponse appResponse) {
        return ProductResponse.builder()
                .productId(appResponse.getProductId())
                .name(appResponse.getName())
                .price(appResponse.getPrice())
                .description(appResponse.getDescription())
                .photoReference(appResponse.getPhotoReference())
                .active(appResponse.isActive())
                .build();
    }

    public List<ProductResponse> toProductResponses(
            List<com.hhplus.storefront.application.catalog.dto.ProductResponse> appResponses) {
        return appResponses.stream()
                .map(this::toProductResponse)
                .collect(Collectors.toList());
    }
}
