package com.hhplus.storefront.domain.order;

import java.util.List;
import java.util.Optional;

/**
 * Order Repository Interface (Domain Layer - Port)
 * 주문 데이터의 저장 및 조회를 담당
 */
public interface OrderRepository {

    /**
     * 주문 저장 (항목은 cascade로 함께 저장)
     */
    Order save(Order order);

    Optional<Order> findById(Long orderId);

    /**
     * 주문 ID로 조회 (비관적 락, SELECT ... FOR UPDATE)
     * 상태 변경/결제 증빙 기록처럼 읽고-쓰기가 원자적이어야 하는 작업에서 사용
     */
    Optional<Order> findByIdForUpdate(Long orderId);

    /**
     * 사용자의 최근 주문 (최신순)
     */
    List<Order> findLatestByUserId(Long userId, int limit);

    /**
     * 전체 최근 주문 (최신순, 운영자용)
     */
    List<Order> findLatest(int limit);

    long countByUserId(Long userId);
}
