package com.hhplus.storefront.application.cart;

import com.hhplus.storefront.application.cart.dto.AddCartItemCommand;
import com.hhplus.storefront.application.cart.dto.CartItemResponse;
import com.hhplus.storefront.application.cart.dto.CartResponse;
import com.hhplus.storefront.domain.cart.CartConstants;
import com.hhplus.storefront.domain.cart.CartItem;
import com.hhplus.storefront.domain.cart.CartRepository;
import com.hhplus.storefront.domain.product.Product;
import com.hhplus.storefront.domain.product.ProductRepository;
import com.hhplus.storefront.domain.product.ProductUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * CartService - 장바구니 (Application 계층)
 *
 * 아키텍처:
 * - Domain 계층의 CartRepository, ProductRepository 인터페이스에만 의존 (Port)
 * - Infrastructure 계층의 구현체는 DI를 통해 주입됨 (Adapter)
 *
 * 비즈니스 규칙:
 * - 담기는 판매 중인 상품만 가능
 * - 같은 상품을 다시 담으면 수량이 누적됨
 * - 조회/합계는 항상 현재 카탈로그 가격 기준 (체크아웃 전까지 가격을 고정하지 않음)
 * - 삭제는 멱등 (없는 라인 삭제는 오류가 아님)
 */
@Slf4j
@Service
public class CartService {

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;

    public CartService(CartRepository cartRepository,
                       ProductRepository productRepository) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
    }

    /**
     * 장바구니에 상품 담기
     *
     * 동시성:
     * - 기존 라인은 비관적 락으로 조회 후 수량 누적
     * - 첫 담기가 동시에 일어나 (user_id, product_id) 유니크 제약에 걸리거나
     *   InnoDB 갭 락 교착으로 락 획득에 실패하면 새 트랜잭션으로 재시도하여 기존 라인에 누적
     *
     * @throws ProductUnavailableException 상품이 없거나 판매 중지
     */
    @Transactional
    @Retryable(
        retryFor = {DataIntegrityViolationException.class, PessimisticLockingFailureException.class},
        maxAttempts = 4,
        backoff = @Backoff(
            delay = 20,
            multiplier = 2,
            maxDelay = 500,
            random = true
        )
    )
    public CartItemResponse addItem(Long userId, AddCartItemCommand command) {
        Long productId = command.getProductId();
        int quantity = command.getQuantity() == null
                ? CartConstants.DEFAULT_ADD_QUANTITY
                : command.getQuantity();

        Product product = productRepository.findById(productId)
                .filter(Product::isAvailable)
                .orElseThrow(() -> new ProductUnavailableException(productId));

        Optional<CartItem> existing = cartRepository.findByUserIdAndProductIdForUpdate(userId, productId);
        CartItem cartItem;
        if (existing.isPresent()) {
            cartItem = existing.get();
            cartItem.increase(quantity);
        } else {
            cartItem = CartItem.create(userId, productId, quantity);
        }
        CartItem saved = cartRepository.save(cartItem);

        log.info("[CartService] 장바구니 담기 - userId={}, productId={}, quantity={}",
                userId, productId, saved.getQuantity());
        return CartItemResponse.of(saved, product);
    }

    /**
     * 장바구니에서 상품 제거 (멱등)
     */
    @Transactional
    public void removeItem(Long userId, Long productId) {
        int deleted = cartRepository.deleteByUserIdAndProductId(userId, productId);
        log.debug("[CartService] 장바구니 제거 - userId={}, productId={}, deleted={}", userId, productId, deleted);
    }

    /**
     * 장바구니 조회 - 현재 카탈로그 가격으로 조인, 상품 ID 내림차순
     * 카탈로그에서 사라진 상품의 라인은 제외된다.
     */
    @Transactional(readOnly = true)
    public CartResponse getCart(Long userId) {
        List<CartItem> cartItems = cartRepository.findByUserId(userId);
        if (cartItems.isEmpty()) {
            return CartResponse.of(userId, List.of());
        }

        Map<Long, Product> products = productRepository.findAllByIds(
                        cartItems.stream().map(CartItem::getProductId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));

        List<CartItemResponse> items = cartItems.stream()
                .filter(item -> products.containsKey(item.getProductId()))
                .sorted(Comparator.comparing(CartItem::getProductId).reversed())
                .map(item -> CartItemResponse.of(item, products.get(item.getProductId())))
                .collect(Collectors.toList());

        return CartResponse.of(userId, items);
    }

    /**
     * 장바구니 합계 (현재 단가 × 수량의 합)
     */
    @Transactional(readOnly = true)
    public long getTotal(Long userId) {
        return getCart(userId).getTotalAmount();
    }

    /**
     * 장바구니 비우기 - 체크아웃 트랜잭션 안에서만 호출된다 (호출자 트랜잭션에 참여)
     */
    @Transactional
    public int clearCart(Long userId) {
        return cartRepository.deleteAllByUserId(userId);
    }
}
