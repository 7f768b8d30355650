package com.hhplus.storefront.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * OrderItem 도메인 엔티티
 *
 * 책임:
 * - 주문 시점의 상품명/단가/수량 스냅샷 보존
 * - 항목별 소계 계산
 *
 * 핵심 비즈니스 규칙:
 * - 생성 후 변경 불가 (setter 없음, 모든 컬럼 updatable = false)
 * - 이후 카탈로그 가격/이름이 바뀌어도 주문 이력은 그대로 유지
 * - 소계 = 단가 × 수량
 */
@Entity
@Table(name = "order_items")
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_item_id")
    private Long orderItemId;

    @Column(name = "product_id", nullable = false, updatable = false)
    private Long productId;

    @Column(name = "product_name", nullable = false, updatable = false)
    private String productName;

    @Column(name = "unit_price", nullable = false, updatable = false)
    private Long unitPrice;

    @Column(name = "quantity", nullable = false, updatable = false)
    private Integer quantity;

    @Column(name = "subtotal", nullable = false, updatable = false)
    private Long subtotal;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 주문 항목 스냅샷 생성
     *
     * @param productId   상품 ID
     * @param productName 주문 시점의 상품명
     * @param unitPrice   주문 시점의 단가
     * @param quantity    수량 (1 이상)
     */
    public static OrderItem snapshot(Long productId, String productName, Long unitPrice, Integer quantity) {
        if (productId == null) {
            throw new IllegalArgumentException("상품 ID는 필수입니다");
        }
        if (unitPrice == null || unitPrice < 0) {
            throw new IllegalArgumentException("단가는 0 이상이어야 합니다");
        }
        if (quantity == null || quantity < 1) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다");
        }
        return OrderItem.builder()
                .productId(productId)
                .productName(productName)
                .unitPrice(unitPrice)
                .quantity(quantity)
                .subtotal(Math.multiplyExact(unitPrice, (long) quantity))
                .createdAt(LocalDateTime.now())
                .build();
    }
}
