package com.hhplus.storefront.application.catalog;

import com.hhplus.storefront.application.catalog.dto.CreateProductCommand;
import com.hhplus.storefront.application.catalog.dto.ProductResponse;
import com.hhplus.storefront.domain.operator.OperatorIdentity;
import com.hhplus.storefront.domain.product.InvalidProductException;
import com.hhplus.storefront.domain.product.Product;
import com.hhplus.storefront.domain.product.ProductConstants;
import com.hhplus.storefront.domain.product.ProductNotFoundException;
import com.hhplus.storefront.domain.product.ProductRepository;
import com.hhplus.storefront.domain.product.ProductUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * CatalogService - 카탈로그 조회 및 운영자 상품 관리 (Application 계층)
 *
 * 책임:
 * - 판매 중 상품 목록/상세 조회 (고객용)
 * - 상품 등록, 단일 필드 수정, 소프트 삭제 (운영자 전용)
 *
 * 비즈니스 규칙:
 * - 운영자 여부는 OperatorIdentity 포트로만 판단
 * - 삭제는 항상 소프트 삭제 (과거 주문 항목이 상품을 참조)
 */
@Service
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final ProductRepository productRepository;
    private final OperatorIdentity operatorIdentity;

    public CatalogService(ProductRepository productRepository,
                          OperatorIdentity operatorIdentity) {
        this.productRepository = productRepository;
        this.operatorIdentity = operatorIdentity;
    }

    /**
     * 판매 중 상품 목록 (최신 등록순)
     */
    @Transactional(readOnly = true)
    public List<ProductResponse> getActiveProducts() {
        return productRepository.findAllActive().stream()
                .map(ProductResponse::fromProduct)
                .collect(Collectors.toList());
    }

    /**
     * 상품 상세 조회
     *
     * @throws ProductNotFoundException    상품 없음
     * @throws ProductUnavailableException 판매 중지 상품
     */
    @Transactional(readOnly = true)
    public ProductResponse getProduct(Long productId) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        if (!product.isAvailable()) {
            throw new ProductUnavailableException(productId);
        }
        return ProductResponse.fromProduct(product);
    }

    @Transactional
    public ProductResponse createProduct(Long operatorId, CreateProductCommand command) {
        operatorIdentity.requireOperator(operatorId);

        Product product = Product.createProduct(
                command.getName(),
                command.getPrice(),
                command.getDescription(),
                command.getPhotoReference());
        Product saved = productRepository.save(product);

        log.info("[CatalogService] 상품 등록 - operatorId={}, productId={}, name={}, price={}",
                operatorId, saved.getProductId(), saved.getName(), saved.getPrice());
        return ProductResponse.fromProduct(saved);
    }

    /**
     * 상품 단일 필드 수정
     *
     * @param field name, price, description, photo 중 하나
     * @param value 새 값 (price는 0 이상의 정수 문자열)
     * @throws InvalidProductException 알 수 없는 필드 또는 잘못된 값
     */
    @Transactional
    public ProductResponse updateProductField(Long operatorId, Long productId, String field, String value) {
        operatorIdentity.requireOperator(operatorId);

        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));

        String normalizedField = field == null ? "" : field.trim().toLowerCase();
        switch (normalizedField) {
            case ProductConstants.FIELD_NAME:
                product.rename(value);
                break;
            case ProductConstants.FIELD_PRICE:
                product.updatePrice(parsePrice(value));
                break;
            case ProductConstants.FIELD_DESCRIPTION:
                product.updateDescription(value);
                break;
            case ProductConstants.FIELD_PHOTO:
                product.updatePhoto(value);
                break;
            default:
                throw new InvalidProductException("수정할 수 없는 필드입니다: " + field);
        }
        Product saved = productRepository.save(product);

        log.info("[CatalogService] 상품 수정 - operatorId={}, productId={}, field={}",
                operatorId, productId, normalizedField);
        return ProductResponse.fromProduct(saved);
    }

    /**
     * 상품 소프트 삭제 (이미 판매 중지된 상품이면 그대로 둔다)
     */
    @Transactional
    public void deactivateProduct(Long operatorId, Long productId) {
        operatorIdentity.requireOperator(operatorId);

        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        product.deactivate();
        productRepository.save(product);

        log.info("[CatalogService] 상품 판매 중지 - operatorId={}, productId={}", operatorId, productId);
    }

    private Long parsePrice(String value) {
        try {
            return Long.parseLong(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidProductException("가격은 정수여야 합니다 (입력값: " + value + ")");
        }
    }
}
