package com.hhplus.storefront.infrastructure.persistence.cart;

import com.hhplus.storefront.domain.cart.CartItem;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * CartItem JPA Repository
 */
public interface CartItemJpaRepository extends JpaRepository<CartItem, Long> {

    List<CartItem> findByUserId(Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT ci FROM CartItem ci WHERE ci.userId = :userId AND ci.productId = :productId")
    Optional<CartItem> findByUserIdAndProductIdForUpdate(@Param("userId") Long userId,
                                                        @Param("productId") Long productId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM CartItem ci WHERE ci.userId = :userId AND ci.productId = :productId")
    int deleteByUserIdAndProductId(@Param("userId") Long userId, @Param("productId") Long productId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM CartItem ci WHERE ci.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);
}
