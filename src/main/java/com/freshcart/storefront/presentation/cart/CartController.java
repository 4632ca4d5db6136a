package com.freshcart.storefront.presentation.cart;

import com.freshcart.storefront.application.cart.CartService;
import com.freshcart.storefront.presentation.cart.response.CartActionResponse;
import com.freshcart.storefront.presentation.cart.response.CartResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CartController - Presentation 계층
 * 장바구니 요청 처리
 */
@RestController
public class CartController {

    private final CartService cartService;

    public CartController(CartService cartService) {
        this.cartService = cartService;
    }

    /**
     * GET /cart/ - 장바구니 조회
     */
    @GetMapping("/cart/")
    public ResponseEntity<CartResponse> getCart(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(cartService.getCart(userId));
    }

    /**
     * GET /add-to-cart/{slug}/ - 상품 1개 담기
     */
    @GetMapping("/add-to-cart/{slug}/")
    public ResponseEntity<CartActionResponse> addToCart(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("slug") String slug) {
        return ResponseEntity.ok(cartService.addItem(userId, slug));
    }

    /**
     * GET /update-cart/{cart_item_id}/{action}/ - 수량 증감 (increment | decrement)
     */
    @GetMapping("/update-cart/{cart_item_id}/{action}/")
    public ResponseEntity<CartActionResponse> updateCart(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("cart_item_id") Long cartItemId,
            @PathVariable("action") String action) {
        return ResponseEntity.ok(cartService.updateItemQuantity(userId, cartItemId, action));
    }

    /**
     * GET /remove-from-cart/{cart_item_id}/ - 장바구니 아이템 제거
     */
    @GetMapping("/remove-from-cart/{cart_item_id}/")
    public ResponseEntity<CartActionResponse> removeFromCart(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("cart_item_id") Long cartItemId) {
        return ResponseEntity.ok(cartService.removeItem(userId, cartItemId));
    }
}
