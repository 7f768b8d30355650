package com.hhplus.storefront.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CartItem 도메인 엔티티
 * 사용자별 장바구니의 라인 항목 (사용자 + 상품 조합당 1건)
 *
 * 핵심 비즈니스 규칙:
 * - 수량은 항상 1 이상 (0 이하 수량은 거부)
 * - 가격은 보관하지 않음: 결제 전까지 장바구니는 항상 현재 카탈로그 가격을 따른다
 * - 주문 완료 시 해당 사용자의 라인은 모두 삭제된다
 */
@Entity
@Table(name = "cart_items", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"user_id", "product_id"})
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_item_id")
    private Long cartItemId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 장바구니 라인 생성 팩토리 메서드
     *
     * @throws InvalidQuantityException 수량이 허용 범위를 벗어남
     */
    public static CartItem create(Long userId, Long productId, int quantity) {
        validateQuantity(quantity);
        LocalDateTime now = LocalDateTime.now();
        return CartItem.builder()
                .userId(userId)
                .productId(productId)
                .quantity(quantity)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 기존 라인에 수량 누적
     *
     * @throws InvalidQuantityException 추가 수량이 1 미만이거나 누적 결과가 최대치를 초과
     */
    public void increase(int additionalQuantity) {
        if (additionalQuantity < CartConstants.MIN_CART_QUANTITY) {
            throw new InvalidQuantityException(additionalQuantity);
        }
        int newQuantity = this.quantity + additionalQuantity;
        validateQuantity(newQuantity);
        this.quantity = newQuantity;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 현재 단가 기준 소계
     */
    public long subtotal(long currentUnitPrice) {
        return Math.multiplyExact(currentUnitPrice, (long) this.quantity);
    }

    private static void validateQuantity(int quantity) {
        if (quantity < CartConstants.MIN_CART_QUANTITY || quantity > CartConstants.MAX_CART_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
    }
}
