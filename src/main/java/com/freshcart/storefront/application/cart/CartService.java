package com.freshcart.storefront.application.cart;

import com.freshcart.storefront.common.exception.ValidationException;
import com.freshcart.storefront.domain.cart.*;
import com.freshcart.storefront.domain.common.vo.Money;
import com.freshcart.storefront.domain.product.Product;
import com.freshcart.storefront.domain.product.ProductNotFoundException;
import com.freshcart.storefront.domain.product.ProductRepository;
import com.freshcart.storefront.domain.user.UserNotFoundException;
import com.freshcart.storefront.domain.user.UserRepository;
import com.freshcart.storefront.domain.vendor.Vendor;
import com.freshcart.storefront.domain.vendor.VendorRepository;
import com.freshcart.storefront.presentation.cart.response.CartActionResponse;
import com.freshcart.storefront.presentation.cart.response.CartItemResponse;
import com.freshcart.storefront.presentation.cart.response.CartResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * CartService - Application 계층
 *
 * 아키텍처:
 * - Domain 계층의 CartRepository 인터페이스에만 의존 (Port)
 * - Infrastructure 계층의 구현체는 DI를 통해 주입됨 (Adapter)
 *
 * 장바구니는 가격 스냅샷을 저장하지 않는다. 조회할 때마다 현재 표시 가격으로 합계를 다시 계산한다.
 */
@Service
public class CartService {

    private static final Logger log = LoggerFactory.getLogger(CartService.class);

    private final CartRepository cartRepository;
    private final UserRepository userRepository;
    private final ProductRepository productRepository;
    private final VendorRepository vendorRepository;

    public CartService(CartRepository cartRepository,
                       UserRepository userRepository,
                       ProductRepository productRepository,
                       VendorRepository vendorRepository) {
        this.cartRepository = cartRepository;
        this.userRepository = userRepository;
        this.productRepository = productRepository;
        this.vendorRepository = vendorRepository;
    }

    /**
     * 사용자의 장바구니 조회 (담은 순서, 현재 가격 기준)
     */
    @Transactional(readOnly = true)
    public CartResponse getCart(Long userId) {
        validateUser(userId);

        Optional<Cart> cart = cartRepository.findByUserId(userId);
        List<CartItem> cartItems = cart
                .map(c -> cartRepository.getCartItems(c.getCartId()))
                .orElse(Collections.emptyList());

        Map<Long, Product> productsById = productRepository.findAllById(
                        cartItems.stream().map(CartItem::getProductId).collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));
        Map<Long, String> shopNames = vendorRepository.findAllById(
                        productsById.values().stream().map(Product::getVendorId).distinct().collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(Vendor::getVendorId, Vendor::getShopName));

        List<CartItemResponse> itemResponses = new ArrayList<>();
        Money totalPrice = Money.ZERO;
        int totalItems = 0;
        for (CartItem item : cartItems) {
            Product product = productsById.get(item.getProductId());
            if (product == null) {
                continue;
            }
            CartItemResponse response = CartItemResponse.from(item, product, shopNames.get(product.getVendorId()));
            itemResponses.add(response);
            totalPrice = totalPrice.add(Money.of(response.getLineTotal()));
            totalItems += item.getQuantity();
        }

        return CartResponse.builder()
                .cartId(cart.map(Cart::getCartId).orElse(null))
                .userId(userId)
                .items(itemResponses)
                .totalItems(totalItems)
                .totalPrice(totalPrice.getAmount())
                .build();
    }

    /**
     * 장바구니에 상품 1개 담기
     * 같은 상품이 이미 있으면 새 행을 만들지 않고 수량만 1 늘린다.
     *
     * @throws ProductNotFoundException 슬러그가 없거나 비활성/판매 중지/미승인 판매자 상품인 경우
     * @throws InvalidQuantityException 최대 수량(1000)을 넘는 경우
     */
    @Transactional
    public CartActionResponse addItem(Long userId, String productSlug) {
        validateUser(userId);

        Product product = productRepository.findBySlug(productSlug)
                .filter(Product::isPurchasable)
                .orElseThrow(() -> new ProductNotFoundException(productSlug));
        boolean vendorApproved = vendorRepository.findById(product.getVendorId())
                .map(Vendor::isApproved)
                .orElse(false);
        if (!vendorApproved) {
            throw new ProductNotFoundException(productSlug);
        }

        Cart cart = cartRepository.findOrCreateByUserId(userId);
        CartItem cartItem = cartRepository.findCartItem(cart.getCartId(), product.getProductId())
                .orElseGet(() -> CartItem.create(cart.getCartId(), product.getProductId()));
        cartItem.increase();
        CartItem savedItem = cartRepository.saveCartItem(cartItem);

        log.debug("[CartService] 장바구니 담기 - userId={}, productId={}, quantity={}",
                userId, product.getProductId(), savedItem.getQuantity());

        return CartActionResponse.builder()
                .cartItemId(savedItem.getCartItemId())
                .productName(product.getName())
                .quantity(savedItem.getQuantity())
                .removed(false)
                .message(String.format("%s을(를) 장바구니에 담았습니다", product.getName()))
                .build();
    }

    /**
     * 장바구니 아이템 수량 변경 (increment | decrement)
     * 수량이 0이 되면 항목을 삭제한다.
     *
     * @throws ValidationException 지원하지 않는 action
     * @throws CartItemNotFoundException 항목이 없거나 다른 사용자의 장바구니 항목인 경우
     */
    @Transactional
    public CartActionResponse updateItemQuantity(Long userId, Long cartItemId, String action) {
        validateUser(userId);
        if (!CartConstants.ACTION_INCREMENT.equals(action) && !CartConstants.ACTION_DECREMENT.equals(action)) {
            throw new ValidationException("action", "action은 increment 또는 decrement여야 합니다");
        }

        CartItem cartItem = findOwnedCartItem(userId, cartItemId);

        if (CartConstants.ACTION_INCREMENT.equals(action)) {
            cartItem.increase();
            cartRepository.saveCartItem(cartItem);
            return CartActionResponse.builder()
                    .cartItemId(cartItem.getCartItemId())
                    .quantity(cartItem.getQuantity())
                    .removed(false)
                    .message("수량을 변경했습니다")
                    .build();
        }

        if (cartItem.decrease()) {
            cartRepository.saveCartItem(cartItem);
            return CartActionResponse.builder()
                    .cartItemId(cartItem.getCartItemId())
                    .quantity(cartItem.getQuantity())
                    .removed(false)
                    .message("수량을 변경했습니다")
                    .build();
        }

        cartRepository.deleteCartItem(cartItemId);
        return CartActionResponse.builder()
                .removed(true)
                .message("장바구니에서 삭제했습니다")
                .build();
    }

    /**
     * 장바구니 아이템 삭제
     *
     * @throws CartItemNotFoundException 항목이 없거나 다른 사용자의 장바구니 항목인 경우
     */
    @Transactional
    public CartActionResponse removeItem(Long userId, Long cartItemId) {
        validateUser(userId);
        findOwnedCartItem(userId, cartItemId);
        cartRepository.deleteCartItem(cartItemId);
        return CartActionResponse.builder()
                .removed(true)
                .message("장바구니에서 삭제했습니다")
                .build();
    }

    private CartItem findOwnedCartItem(Long userId, Long cartItemId) {
        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> new CartItemNotFoundException(cartItemId));
        return cartRepository.findCartItemById(cartItemId)
                .filter(item -> item.belongsTo(cart.getCartId()))
                .orElseThrow(() -> new CartItemNotFoundException(cartItemId));
    }

    private void validateUser(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
    }
}
