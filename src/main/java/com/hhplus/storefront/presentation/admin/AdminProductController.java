package com.hhplus.storefront.presentation.admin;

import com.hhplus.storefront.application.catalog.CatalogService;
import com.hhplus.storefront.presentation.admin.mapper.AdminMapper;
import com.hhplus.storefront.presentation.admin.request.CreateProductRequest;
import com.hhplus.storefront.presentation.admin.request.UpdateProductFieldRequest;
import com.hhplus.storefront.presentation.product.mapper.ProductMapper;
import com.hhplus.storefront.presentation.product.response.ProductResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * AdminProductController - 운영자 상품 관리 API
 */
@RestController
@RequestMapping("/admin/products")
public class AdminProductController {

    private final CatalogService catalogService;
    private final ProductMapper productMapper;
    private final AdminMapper adminMapper;

    public AdminProductController(CatalogService catalogService,
                                  ProductMapper productMapper,
                                  AdminMapper adminMapper) {
        this.catalogService = catalogService;
        this.productMapper = productMapper;
        this.adminMapper = adminMapper;
    }

    @PostMapping
    public ResponseEntity<ProductResponse> createProduct(
            @RequestHeader("X-USER-ID") Long operatorId,
            @RequestBody CreateProductRequest request) {
        var appResponse = catalogService.createProduct(operatorId, adminMapper.toCreateProductCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(productMapper.toProductResponse(appResponse));
    }

    @PatchMapping("/{product_id}")
    public ResponseEntity<ProductResponse> updateProductField(
            @RequestHeader("X-USER-ID") Long operatorId,
            @PathVariable("product_id") Long productId,
            @RequestBody UpdateProductFieldRequest request) {
        var appResponse = catalogService.updateProductField(operatorId, productId, request.getField(), request.getValue());
        return ResponseEntity.ok(productMapper.toProductResponse(appResponse));
    }

    /**
     * 소프트 삭제 (DELETE /api/admin/products/{product_id})
     */
    @DeleteMapping("/{product_id}")
    public ResponseEntity<Void> deactivateProduct(
            @RequestHeader("X-USER-ID") Long operatorId,
            @PathVariable("product_id") Long productId) {
        catalogService.deactivateProduct(operatorId, productId);
        return ResponseEntity.noContent().build();
    }
}
