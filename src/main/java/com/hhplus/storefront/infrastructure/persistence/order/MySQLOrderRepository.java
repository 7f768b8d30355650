package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 * Port(OrderRepository) 인터페이스를 Spring Data JPA로 구현
 */
@Repository
@Primary
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
    }

    @Override
    public Order save(Order order) {
        return orderJpaRepository.save(order);
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findByIdWithItems(orderId);
    }

    @Override
    @Transactional
    public Optional<Order> findByIdForUpdate(Long orderId) {
        // 호출자의 트랜잭션에 참여해야 잠금이 의미를 가짐 (단독 호출 시 즉시 해제)
        return orderJpaRepository.findByIdForUpdate(orderId);
    }

    @Override
    public List<Order> findLatestByUserId(Long userId, int limit) {
        return orderJpaRepository.findLatestByUserId(userId, PageRequest.of(0, limit));
    }

    @Override
    public List<Order> findLatest(int limit) {
        return orderJpaRepository.findLatest(PageRequest.of(0, limit));
    }

    @Override
    public long countByUserId(Long userId) {
        return orderJpaRepository.countByUserId(userId);
    }
}
