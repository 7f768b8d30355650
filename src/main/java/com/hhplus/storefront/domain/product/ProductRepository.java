package com.hhplus.storefront.domain.product;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Product Repository Interface (Domain Layer - Port)
 * 장바구니/주문이 참조하는 카탈로그 조회 포트를 겸한다.
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface ProductRepository {

    /**
     * ID로 상품 조회 (판매 중지 상품 포함)
     */
    Optional<Product> findById(Long productId);

    /**
     * 판매 중인 상품 목록 (최신 등록순)
     */
    List<Product> findAllActive();

    /**
     * 여러 상품을 한 번에 조회 (장바구니 조인용)
     */
    List<Product> findAllByIds(Collection<Long> productIds);

    /**
     * 상품 저장 (생성 또는 수정)
     */
    Product save(Product product);
}
