package com.freshcart.storefront.infrastructure.persistence.cart;

import com.freshcart.storefront.domain.cart.Cart;
import com.freshcart.storefront.domain.cart.CartItem;
import com.freshcart.storefront.domain.cart.CartRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * InMemory Cart Repository 구현
 * ConcurrentHashMap 기반의 인메모리 저장소 (DB 없이 서비스 로직을 검증할 때 사용)
 */
public class InMemoryCartRepository implements CartRepository {

    private final ConcurrentHashMap<Long, Cart> carts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, CartItem> cartItems = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Long> userCartMap = new ConcurrentHashMap<>(); // userId -> cartId 매핑

    private final AtomicLong cartIdGenerator = new AtomicLong(0);
    private final AtomicLong cartItemIdGenerator = new AtomicLong(0);

    @Override
    public Cart findOrCreateByUserId(Long userId) {
        Long cartId = userCartMap.computeIfAbsent(userId, id -> {
            Cart cart = Cart.create(id);
            cart.setCartId(cartIdGenerator.incrementAndGet());
            carts.put(cart.getCartId(), cart);
            return cart.getCartId();
        });
        return carts.get(cartId);
    }

    @Override
    public Optional<Cart> findByUserId(Long userId) {
        Long cartId = userCartMap.get(userId);
        return cartId == null ? Optional.empty() : Optional.ofNullable(carts.get(cartId));
    }

    @Override
    public Optional<CartItem> findCartItemById(Long cartItemId) {
        return Optional.ofNullable(cartItems.get(cartItemId));
    }

    @Override
    public CartItem saveCartItem(CartItem cartItem) {
        if (cartItem.getCartItemId() == null) {
            boolean duplicated = cartItems.values().stream()
                    .anyMatch(item -> item.getCartId().equals(cartItem.getCartId())
                            && item.getProductId().equals(cartItem.getProductId()));
            if (duplicated) {
                throw new IllegalStateException("동일 상품의 장바구니 항목이 이미 존재합니다");
            }
            cartItem.setCartItemId(cartItemIdGenerator.incrementAndGet());
        }
        cartItems.put(cartItem.getCartItemId(), cartItem);
        return cartItem;
    }

    @Override
    public void deleteCartItem(Long cartItemId) {
        cartItems.remove(cartItemId);
    }

    @Override
    public List<CartItem> getCartItems(Long cartId) {
        return cartItems.values().stream()
                .filter(item -> item.getCartId().equals(cartId))
                .sorted(Comparator.comparing(CartItem::getCartItemId))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<CartItem> findCartItem(Long cartId, Long productId) {
        return cartItems.values().stream()
                .filter(item -> item.getCartId().equals(cartId) && item.getProductId().equals(productId))
                .findFirst();
    }

    @Override
    public int deleteCartItemsByCartId(Long cartId) {
        List<Long> ids = getCartItems(cartId).stream()
                .map(CartItem::getCartItemId)
                .collect(Collectors.toList());
        ids.forEach(cartItems::remove);
        return ids.size();
    }

    @Override
    public int deleteCartItemsByProductId(Long productId) {
        List<Long> ids = cartItems.values().stream()
                .filter(item -> item.getProductId().equals(productId))
                .map(CartItem::getCartItemId)
                .collect(Collectors.toList());
        ids.forEach(cartItems::remove);
        return ids.size();
    }
}
