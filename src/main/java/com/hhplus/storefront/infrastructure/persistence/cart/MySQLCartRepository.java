package com.hhplus.storefront.infrastructure.persistence.cart;

import com.hhplus.storefront.domain.cart.CartItem;
import com.hhplus.storefront.domain.cart.CartRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Cart Repository 구현
 * cart_items 테이블의 (user_id, product_id) 유니크 제약이 사용자+상품당 1라인을 보장한다.
 */
@Repository
@Primary
public class MySQLCartRepository implements CartRepository {

    private final CartItemJpaRepository cartItemJpaRepository;

    public MySQLCartRepository(CartItemJpaRepository cartItemJpaRepository) {
        this.cartItemJpaRepository = cartItemJpaRepository;
    }

    @Override
    public List<CartItem> findByUserId(Long userId) {
        return cartItemJpaRepository.findByUserId(userId);
    }

    @Override
    public Optional<CartItem> findByUserIdAndProductIdForUpdate(Long userId, Long productId) {
        return cartItemJpaRepository.findByUserIdAndProductIdForUpdate(userId, productId);
    }

    @Override
    public CartItem save(CartItem cartItem) {
        // IDENTITY 전략이므로 신규 라인은 즉시 INSERT (유니크 제약 위반도 여기서 드러남)
        return cartItemJpaRepository.saveAndFlush(cartItem);
    }

    @Override
    public int deleteByUserIdAndProductId(Long userId, Long productId) {
        return cartItemJpaRepository.deleteByUserIdAndProductId(userId, productId);
    }

    @Override
    public int deleteAllByUserId(Long userId) {
        return cartItemJpaRepository.deleteAllByUserId(userId);
    }
}
