package com.hhplus.storefront.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 장바구니 스냅샷으로부터 생성된 주문 정보 보관
 * - 결제 증빙(결제 수단, 참조, 사진 증빙) 관리
 * - 주문 상태 전환 규칙 적용
 *
 * 핵심 비즈니스 규칙:
 * - 주문은 항상 WAIT_PAYMENT 상태로 생성
 * - totalAmount == Σ(항목 단가 × 수량), 생성 시 고정
 * - 결제 증빙 제출은 상태를 바꾸지 않음 (상태는 운영자만 변경)
 * - 종료 상태(DONE, CANCELED)에서는 상태 변경 불가
 */
@Entity
@Table(name = "orders")
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Order {

    private static final Pattern PHONE_DIGITS =
            Pattern.compile("\\d{" + OrderConstants.MIN_PHONE_DIGITS + ",}");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "customer_name", nullable = false, updatable = false)
    private String customerName;

    @Column(name = "phone", nullable = false, updatable = false)
    private String phone;

    @Column(name = "address", nullable = false, updatable = false)
    private String address;

    @Column(name = "note", nullable = false, updatable = false)
    private String note;

    @Column(name = "total_amount", nullable = false, updatable = false)
    private Long totalAmount;

    @Column(name = "order_status", nullable = false)
    @Enumerated(EnumType.STRING)
    private OrderStatus orderStatus;

    @Column(name = "payment_method")
    private String paymentMethod;

    @Column(name = "payment_reference")
    private String paymentReference;

    @Column(name = "payment_proof_reference")
    private String paymentProofReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 주문 항목 관계
     * cascade = PERSIST: 주문 생성 시 항목도 같은 트랜잭션에서 저장된다.
     */
    @OneToMany(cascade = CascadeType.PERSIST, fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    @OrderBy("orderItemId ASC")
    @Builder.Default
    private List<OrderItem> orderItems = new ArrayList<>();

    /**
     * 주문 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 항목은 1개 이상
     * - 주문자 이름은 필수, 연락처에는 7자리 이상 연속된 숫자가 포함되어야 함
     * - 총액은 항목 소계의 합으로 계산
     *
     * @throws InvalidCheckoutDetailsException 주문자 정보 재검증 실패
     */
    public static Order createOrder(Long userId, String customerName, String phone,
                                    String address, String note, List<OrderItem> items) {
        validateCheckoutDetails(customerName, phone);
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("주문 항목은 최소 1개 이상이어야 합니다");
        }

        long total = items.stream()
                .mapToLong(OrderItem::getSubtotal)
                .reduce(0L, Math::addExact);

        LocalDateTime now = LocalDateTime.now();
        Order order = Order.builder()
                .userId(userId)
                .customerName(customerName.trim())
                .phone(phone.trim())
                .address(address == null ? "" : address.trim())
                .note(note == null ? "" : note.trim())
                .totalAmount(total)
                .orderStatus(OrderStatus.WAIT_PAYMENT)
                .createdAt(now)
                .updatedAt(now)
                .build();
        order.orderItems.addAll(items);
        return order;
    }

    public List<OrderItem> getOrderItems() {
        return Collections.unmodifiableList(orderItems);
    }

    public boolean isOwnedBy(Long requesterUserId) {
        return this.userId.equals(requesterUserId);
    }

    /**
     * 주문 소유자 검증
     *
     * @throws NotOrderOwnerException 요청자가 주문자가 아님
     */
    public void verifyOwner(Long requesterUserId) {
        if (!isOwnedBy(requesterUserId)) {
            throw new NotOrderOwnerException(this.orderId, requesterUserId);
        }
    }

    public boolean isTerminal() {
        return this.orderStatus.isTerminal();
    }

    /**
     * 상태 전환
     *
     * @param newStatus 변경할 상태
     * @param policy    전환 허용 규칙
     * @return 변경 전 상태
     * @throws OrderAlreadyTerminalException     현재 상태가 종료 상태
     * @throws InvalidStatusTransitionException 정책상 허용되지 않는 전환
     */
    public OrderStatus changeStatus(OrderStatus newStatus, OrderTransitionPolicy policy) {
        if (newStatus == null) {
            throw new IllegalArgumentException("변경할 상태는 필수입니다");
        }
        if (isTerminal()) {
            throw new OrderAlreadyTerminalException(this.orderId, this.orderStatus);
        }
        if (!policy.allows(this.orderStatus, newStatus)) {
            throw new InvalidStatusTransitionException(this.orderId, this.orderStatus, newStatus);
        }

        OrderStatus oldStatus = this.orderStatus;
        this.orderStatus = newStatus;
        this.updatedAt = LocalDateTime.now();
        return oldStatus;
    }

    /**
     * 결제 수단/참조 기록 (덮어쓰기). 사진 증빙은 건드리지 않는다.
     */
    public void recordPayment(String method, String reference) {
        this.paymentMethod = method;
        this.paymentReference = reference;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 사진 증빙 첨부
     * 결제 수단/참조가 비어 있으면 기본값(UNKNOWN / PHOTO_PROOF)으로 채우고, 이미 있으면 유지한다.
     */
    public void attachProof(String proofReference) {
        this.paymentProofReference = proofReference;
        if (isBlank(this.paymentMethod)) {
            this.paymentMethod = OrderConstants.UNKNOWN_PAYMENT_METHOD;
        }
        if (isBlank(this.paymentReference)) {
            this.paymentReference = OrderConstants.PHOTO_PROOF_REFERENCE;
        }
        this.updatedAt = LocalDateTime.now();
    }

    private static void validateCheckoutDetails(String customerName, String phone) {
        if (customerName == null || customerName.isBlank()) {
            throw new InvalidCheckoutDetailsException("주문자 이름은 필수입니다");
        }
        if (phone == null || !PHONE_DIGITS.matcher(phone).find()) {
            throw new InvalidCheckoutDetailsException("연락처에 " + OrderConstants.MIN_PHONE_DIGITS
                    + "자리 이상 연속된 숫자가 필요합니다");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
