package com.hhplus.storefront.infrastructure.persistence.product;

import com.hhplus.storefront.domain.product.Product;
import com.hhplus.storefront.domain.product.ProductRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Product Repository 구현 (카탈로그 조회 포트 겸용)
 */
@Repository
@Primary
public class MySQLProductRepository implements ProductRepository {

    private final ProductJpaRepository productJpaRepository;

    public MySQLProductRepository(ProductJpaRepository productJpaRepository) {
        this.productJpaRepository = productJpaRepository;
    }

    @Override
    public Optional<Product> findById(Long productId) {
        return productJpaRepository.findById(productId);
    }

    @Override
    public List<Product> findAllActive() {
        return productJpaRepository.findByActiveTrueOrderByProductIdDesc();
    }

    @Override
    public List<Product> findAllByIds(Collection<Long> productIds) {
        if (productIds == null || productIds.isEmpty()) {
            return List.of();
        }
        return productJpaRepository.findAllById(productIds);
    }

    @Override
    public Product save(Product product) {
        return productJpaRepository.save(product);
    }
}
