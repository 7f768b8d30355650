package com.hhplus.storefront.domain.cart;

import java.util.List;
import java.util.Optional;

/**
 * Cart Repository Interface (Domain Layer - Port)
 * 장바구니는 사용자 ID로 식별되는 CartItem 집합이다.
 */
public interface CartRepository {

    /**
     * 사용자의 모든 장바구니 라인 조회
     */
    List<CartItem> findByUserId(Long userId);

    /**
     * 사용자 + 상품 조합으로 라인 조회 (비관적 락)
     * 같은 상품을 동시에 담을 때 수량 누적이 유실되지 않도록 한다.
     */
    Optional<CartItem> findByUserIdAndProductIdForUpdate(Long userId, Long productId);

    /**
     * 라인 저장 (생성 또는 수정)
     */
    CartItem save(CartItem cartItem);

    /**
     * 라인 삭제 (없으면 아무 것도 하지 않음)
     *
     * @return 삭제된 라인 수
     */
    int deleteByUserIdAndProductId(Long userId, Long productId);

    /**
     * 사용자의 모든 라인 삭제 (주문 완료 시)
     *
     * @return 삭제된 라인 수
     */
    int deleteAllByUserId(Long userId);
}
