package com.hhplus.storefront.infrastructure.persistence.product;

import com.hhplus.storefront.domain.product.Product;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Product JPA Repository
 */
public interface ProductJpaRepository extends JpaRepository<Product, Long> {

    /**
     * 판매 중 상품 (최신 등록순)
     */
    List<Product> findByActiveTrueOrderByProductIdDesc();
}
