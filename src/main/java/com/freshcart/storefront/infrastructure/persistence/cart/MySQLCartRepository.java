package com.freshcart.storefront.infrastructure.persistence.cart;

import com.freshcart.storefront.domain.cart.Cart;
import com.freshcart.storefront.domain.cart.CartItem;
import com.freshcart.storefront.domain.cart.CartRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Cart Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(CartRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
@Primary
public class MySQLCartRepository implements CartRepository {

    private final CartJpaRepository cartJpaRepository;
    private final CartItemJpaRepository cartItemJpaRepository;

    public MySQLCartRepository(CartJpaRepository cartJpaRepository, CartItemJpaRepository cartItemJpaRepository) {
        this.cartJpaRepository = cartJpaRepository;
        this.cartItemJpaRepository = cartItemJpaRepository;
    }

    @Override
    public Cart findOrCreateByUserId(Long userId) {
        return cartJpaRepository.findByUserId(userId)
                .orElseGet(() -> cartJpaRepository.save(Cart.create(userId)));
    }

    @Override
    public Optional<Cart> findByUserId(Long userId) {
        return cartJpaRepository.findByUserId(userId);
    }

    @Override
    public Optional<CartItem> findCartItemById(Long cartItemId) {
        return cartItemJpaRepository.findById(cartItemId);
    }

    @Override
    public CartItem saveCartItem(CartItem cartItem) {
        return cartItemJpaRepository.save(cartItem);
    }

    @Override
    public void deleteCartItem(Long cartItemId) {
        cartItemJpaRepository.deleteById(cartItemId);
    }

    @Override
    public List<CartItem> getCartItems(Long cartId) {
        return cartItemJpaRepository.findByCartIdOrderByCartItemIdAsc(cartId);
    }

    @Override
    public Optional<CartItem> findCartItem(Long cartId, Long productId) {
        return cartItemJpaRepository.findByCartIdAndProductId(cartId, productId);
    }

    @Override
    public int deleteCartItemsByCartId(Long cartId) {
        return cartItemJpaRepository.deleteAllByCartId(cartId);
    }

    @Override
    public int deleteCartItemsByProductId(Long productId) {
        return cartItemJpaRepository.deleteAllByProductId(productId);
    }
}
