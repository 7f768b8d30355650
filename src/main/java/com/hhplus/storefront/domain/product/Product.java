package com.hhplus.storefront.domain.product;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Product 도메인 엔티티 (카탈로그 상품)
 *
 * 책임:
 * - 상품 정보(이름, 단가, 설명, 사진 참조) 관리
 * - 판매 여부(active) 관리
 *
 * 핵심 비즈니스 규칙:
 * - 단가는 최소 통화 단위의 정수이며 0 이상
 * - 삭제는 소프트 삭제(active=false)만 허용
 *   (과거 주문이 참조하므로 물리 삭제하지 않음)
 * - 가격/이름 변경은 이미 생성된 주문에 영향을 주지 않음 (OrderItem 스냅샷)
 */
@Entity
@Table(name = "products")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "price", nullable = false)
    private Long price;

    @Column(name = "description", nullable = false)
    private String description;

    @Column(name = "photo_reference", nullable = false)
    private String photoReference;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 상품 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 상품명은 필수
     * - 가격은 0 이상 MAX_PRICE 이하
     * - 초기 상태는 판매 중(active)
     */
    public static Product createProduct(String name, Long price, String description, String photoReference) {
        validateName(name);
        validatePrice(price);

        LocalDateTime now = LocalDateTime.now();
        return Product.builder()
                .name(name.trim())
                .price(price)
                .description(description == null ? "" : description)
                .photoReference(photoReference == null ? "" : photoReference)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void rename(String newName) {
        validateName(newName);
        this.name = newName.trim();
        this.updatedAt = LocalDateTime.now();
    }

    public void updatePrice(Long newPrice) {
        validatePrice(newPrice);
        this.price = newPrice;
        this.updatedAt = LocalDateTime.now();
    }

    public void updateDescription(String newDescription) {
        this.description = newDescription == null ? "" : newDescription;
        this.updatedAt = LocalDateTime.now();
    }

    public void updatePhoto(String newPhotoReference) {
        this.photoReference = newPhotoReference == null ? "" : newPhotoReference;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 소프트 삭제 (판매 중지)
     */
    public void deactivate() {
        this.active = false;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 장바구니에 담을 수 있는 상태인지 확인
     */
    public boolean isAvailable() {
        return this.active;
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidProductException("상품명은 필수입니다");
        }
    }

    private static void validatePrice(Long price) {
        if (price == null || price < ProductConstants.MIN_PRICE || price > ProductConstants.MAX_PRICE) {
            throw new InvalidProductException("가격은 " + ProductConstants.MIN_PRICE + " 이상 "
                    + ProductConstants.MAX_PRICE + " 이하여야 합니다 (입력값: " + price + ")");
        }
    }
}
