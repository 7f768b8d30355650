package com.hhplus.storefront.presentation.cart;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.presentation.cart.mapper.CartMapper;
import com.hhplus.storefront.presentation.cart.request.AddCartItemRequest;
import com.hhplus.storefront.presentation.cart.response.CartItemResponse;
import com.hhplus.storefront.presentation.cart.response.CartResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CartController - 장바구니 API 엔드포인트
 */
@RestController
@RequestMapping("/carts")
public class CartController {

    private final CartService cartService;
    private final CartMapper cartMapper;

    public CartController(CartService cartService, CartMapper cartMapper) {
        this.cartService = cartService;
        this.cartMapper = cartMapper;
    }

    /**
     * 장바구니 조회 (GET /api/carts)
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.getCart(userId)));
    }

    /**
     * 장바구니 담기 (POST /api/carts/items)
     */
    @PostMapping("/items")
    public ResponseEntity<CartItemResponse> addItem(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody AddCartItemRequest request) {
        var command = cartMapper.toAddCartItemCommand(request);
        var appResponse = cartService.addItem(userId, command);
        return ResponseEntity.status(HttpStatus.CREATED).body(cartMapper.toCartItemResponse(appResponse));
    }

    /**
     * 장바구니 제거 (DELETE /api/carts/items/{product_id}) - 없는 라인이어도 204
     */
    @DeleteMapping("/items/{product_id}")
    public ResponseEntity<Void> removeItem(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("product_id") Long productId) {
        cartService.removeItem(userId, productId);
        return ResponseEntity.noContent().build();
    }
}
