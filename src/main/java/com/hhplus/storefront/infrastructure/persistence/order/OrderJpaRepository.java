package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.Order;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Order JPA Repository
 *
 * FetchType 정책:
 * - Order.orderItems는 LAZY
 * - 상세 조회는 fetch join, 목록 조회는 항목 없이 요약만
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    /**
     * 주문 ID로 조회 (orderItems 함께 로드)
     */
    @Query("SELECT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems oi " +
           "WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithItems(@Param("orderId") Long orderId);

    /**
     * 주문 ID로 조회 (비관적 락 - SELECT ... FOR UPDATE)
     *
     * - 상태 변경, 결제 증빙 기록 전에 사용
     * - 잠금은 트랜잭션 종료(commit/rollback) 시 해제
     * - 컬렉션 fetch join 없이 orders 행만 잠근다
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.orderId = :orderId")
    Optional<Order> findByIdForUpdate(@Param("orderId") Long orderId);

    @Query("SELECT o FROM Order o WHERE o.userId = :userId ORDER BY o.orderId DESC")
    List<Order> findLatestByUserId(@Param("userId") Long userId, Pageable pageable);

    @Query("SELECT o FROM Order o ORDER BY o.orderId DESC")
    List<Order> findLatest(Pageable pageable);

    long countByUserId(Long userId);
}
