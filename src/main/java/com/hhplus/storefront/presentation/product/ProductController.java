package com.hhplus.storefront.presentation.product;

import com.hhplus.storefront.application.catalog.CatalogService;
import com.hhplus.storefront.presentation.product.mapper.ProductMapper;
import com.hhplus.storefront.presentation.product.response.ProductResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * ProductController - 카탈로그 조회 API
 */
@RestController
@RequestMapping("/products")
public class ProductController {

    private final CatalogService catalogService;
    private final ProductMapper productMapper;

    public ProductController(CatalogService catalogService, ProductMapper productMapper) {
        this.catalogService = catalogService;
        this.productMapper = productMapper;
    }

    /**
     * 판매 중 상품 목록 (GET /api/products)
     */
    @GetMapping
    public ResponseEntity<List<ProductResponse>> getProducts() {
        return ResponseEntity.ok(productMapper.toProductResponses(catalogService.getActiveProducts()));
    }

    /**
     * 상품 상세 (GET /api/products/{product_id})
     * 판매 중지 상품은 PRODUCT_UNAVAILABLE
     */
    @GetMapping("/{product_id}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable("product_id") Long productId) {
        return ResponseEntity.ok(productMapper.toProductResponse(catalogService.getProduct(productId)));
    }
}
