package com.freshcart.storefront.domain.cart;

import java.util.List;
import java.util.Optional;

/**
 * Cart Repository Interface (Domain Layer - Port)
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface CartRepository {
    /**
     * 사용자의 장바구니 조회 또는 생성
     */
    Cart findOrCreateByUserId(Long userId);

    /**
     * 사용자의 장바구니 조회
     */
    Optional<Cart> findByUserId(Long userId);

    /**
     * 장바구니 아이템 ID로 조회
     */
    Optional<CartItem> findCartItemById(Long cartItemId);

    /**
     * 장바구니 아이템 저장 (생성 또는 수정)
     */
    CartItem saveCartItem(CartItem cartItem);

    /**
     * 장바구니 아이템 삭제
     */
    void deleteCartItem(Long cartItemId);

    /**
     * 특정 장바구니의 모든 아이템 조회 (담은 순서)
     *
     * @param cartId 장바구니 ID
     * @return 해당 장바구니의 모든 아이템 리스트
     */
    List<CartItem> getCartItems(Long cartId);

    /**
     * 장바구니에서 특정 상품 아이템 조회
     * 중복 항목 확인 및 수량 누적 처리용
     */
    Optional<CartItem> findCartItem(Long cartId, Long productId);

    /**
     * 장바구니 비우기 (주문 완료 시)
     *
     * @return 삭제된 아이템 수
     */
    int deleteCartItemsByCartId(Long cartId);

    /**
     * 모든 장바구니에서 특정 상품 아이템 삭제 (상품 삭제/판매 중단 시)
     *
     * @return 삭제된 아이템 수
     */
    int deleteCartItemsByProductId(Long productId);
}
