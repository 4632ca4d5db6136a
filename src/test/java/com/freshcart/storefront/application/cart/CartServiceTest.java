package com.freshcart.storefront.application.cart;

import com.freshcart.storefront.common.exception.ValidationException;
import com.freshcart.storefront.config.TestDataFactory;
import com.freshcart.storefront.domain.cart.Cart;
import com.freshcart.storefront.domain.cart.CartItem;
import com.freshcart.storefront.domain.cart.CartItemNotFoundException;
import com.freshcart.storefront.domain.cart.CartRepository;
import com.freshcart.storefront.domain.cart.InvalidQuantityException;
import com.freshcart.storefront.domain.product.Product;
import com.freshcart.storefront.domain.product.ProductNotFoundException;
import com.freshcart.storefront.domain.product.ProductRepository;
import com.freshcart.storefront.domain.user.UserNotFoundException;
import com.freshcart.storefront.domain.user.UserRepository;
import com.freshcart.storefront.domain.vendor.VendorRepository;
import com.freshcart.storefront.domain.vendor.VendorStatus;
import com.freshcart.storefront.presentation.cart.response.CartActionResponse;
import com.freshcart.storefront.presentation.cart.response.CartResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * CartServiceTest - Application 계층 단위 테스트
 *
 * 테스트 대상: CartService
 * - 장바구니 조회 (현재 가격 기준 합계)
 * - 상품 담기 / 수량 증감 / 삭제
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CartService 단위 테스트")
class CartServiceTest {

    private CartService cartService;

    @Mock
    private CartRepository cartRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private VendorRepository vendorRepository;

    private static final Long TEST_USER_ID = 1L;
    private static final Long TEST_CART_ID = 100L;
    private static final Long TEST_VENDOR_ID = 10L;

    @BeforeEach
    void setup() {
        cartService = new CartService(cartRepository, userRepository, productRepository, vendorRepository);
    }

    // ========== 장바구니 조회 (getCart) ==========

    @Test
    @DisplayName("장바구니 조회 - 현재 표시 가격으로 라인 합계와 총액 계산")
    void testGetCart_Success() {
        // Given
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(cartRepository.findByUserId(TEST_USER_ID)).thenReturn(Optional.of(TestDataFactory.createCart(TEST_CART_ID, TEST_USER_ID)));
        when(cartRepository.getCartItems(TEST_CART_ID)).thenReturn(List.of(
                TestDataFactory.createCartItem(1L, TEST_CART_ID, 1L, 2),
                TestDataFactory.createCartItem(2L, TEST_CART_ID, 2L, 1)));
        Product milk = TestDataFactory.createProduct(1L, TEST_VENDOR_ID, 5L, "Fresh Milk", "60.00", "50.00", 20);
        Product bread = TestDataFactory.createProduct(2L, TEST_VENDOR_ID, 5L, "Brown Bread", "40.00", null, 20);
        when(productRepository.findAllById(any())).thenReturn(List.of(milk, bread));
        when(vendorRepository.findAllById(any())).thenReturn(List.of(TestDataFactory.createApprovedVendor(TEST_VENDOR_ID, 9L)));

        // When
        CartResponse result = cartService.getCart(TEST_USER_ID);

        // Then
        assertEquals(TEST_CART_ID, result.getCartId());
        assertEquals(2, result.getItems().size());
        assertEquals(3, result.getTotalItems());
        assertEquals(0, new BigDecimal("140.00").compareTo(result.getTotalPrice()));
        assertEquals(0, new BigDecimal("100.00").compareTo(result.getItems().get(0).getLineTotal()));
        assertEquals("Green Basket 10", result.getItems().get(0).getShopName());
    }

    @Test
    @DisplayName("장바구니 조회 - 장바구니가 없으면 빈 결과 (생성하지 않음)")
    void testGetCart_NoCart() {
        // Given
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(cartRepository.findByUserId(TEST_USER_ID)).thenReturn(Optional.empty());

        // When
        CartResponse result = cartService.getCart(TEST_USER_ID);

        // Then
        assertTrue(result.isEmpty());
        assertEquals(0, result.getTotalItems());
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getTotalPrice()));
        verify(cartRepository, never()).findOrCreateByUserId(anyLong());
    }

    @Test
    @DisplayName("장바구니 조회 - 사용자 없음")
    void testGetCart_UserNotFound() {
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(false);

        assertThrows(UserNotFoundException.class, () -> cartService.getCart(TEST_USER_ID));
    }

    // ========== 상품 담기 (addItem) ==========

    @Test
    @DisplayName("상품 담기 - 새 라인 생성, 수량 1")
    void testAddItem_NewLine() {
        // Given
        Product milk = TestDataFactory.createProduct(1L, TEST_VENDOR_ID, 5L, "Fresh Milk", "60.00", null, 20);
        Cart cart = TestDataFactory.createCart(TEST_CART_ID, TEST_USER_ID);
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(productRepository.findBySlug("fresh-milk")).thenReturn(Optional.of(milk));
        when(vendorRepository.findById(TEST_VENDOR_ID)).thenReturn(Optional.of(TestDataFactory.createApprovedVendor(TEST_VENDOR_ID, 9L)));
        when(cartRepository.findOrCreateByUserId(TEST_USER_ID)).thenReturn(cart);
        when(cartRepository.findCartItem(TEST_CART_ID, 1L)).thenReturn(Optional.empty());
        when(cartRepository.saveCartItem(any(CartItem.class))).thenAnswer(invocation -> {
            CartItem item = invocation.getArgument(0);
            item.setCartItemId(500L);
            return item;
        });

        // When
        CartActionResponse result = cartService.addItem(TEST_USER_ID, "fresh-milk");

        // Then
        assertEquals(500L, result.getCartItemId());
        assertEquals(1, result.getQuantity());
        assertFalse(result.isRemoved());
    }

    @Test
    @DisplayName("상품 담기 - 기존 라인이 있으면 수량만 증가")
    void testAddItem_ExistingLine() {
        // Given
        Product milk = TestDataFactory.createProduct(1L, TEST_VENDOR_ID, 5L, "Fresh Milk", "60.00", null, 20);
        CartItem existing = TestDataFactory.createCartItem(7L, TEST_CART_ID, 1L, 3);
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(productRepository.findBySlug("fresh-milk")).thenReturn(Optional.of(milk));
        when(vendorRepository.findById(TEST_VENDOR_ID)).thenReturn(Optional.of(TestDataFactory.createApprovedVendor(TEST_VENDOR_ID, 9L)));
        when(cartRepository.findOrCreateByUserId(TEST_USER_ID)).thenReturn(TestDataFactory.createCart(TEST_CART_ID, TEST_USER_ID));
        when(cartRepository.findCartItem(TEST_CART_ID, 1L)).thenReturn(Optional.of(existing));
        when(cartRepository.saveCartItem(existing)).thenReturn(existing);

        // When
        CartActionResponse result = cartService.addItem(TEST_USER_ID, "fresh-milk");

        // Then
        assertEquals(7L, result.getCartItemId());
        assertEquals(4, result.getQuantity());
    }

    @Test
    @DisplayName("상품 담기 - 판매 중지 상품은 없는 상품으로 처리, 장바구니 변경 없음")
    void testAddItem_UnavailableProduct() {
        // Given
        Product milk = TestDataFactory.createProduct(1L, TEST_VENDOR_ID, 5L, "Fresh Milk", "60.00", null, 20);
        milk.toggleAvailability();
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(productRepository.findBySlug("fresh-milk")).thenReturn(Optional.of(milk));

        // When & Then
        assertThrows(ProductNotFoundException.class, () -> cartService.addItem(TEST_USER_ID, "fresh-milk"));
        verify(cartRepository, never()).saveCartItem(any());
    }

    @Test
    @DisplayName("상품 담기 - 미승인 판매자 상품 거부")
    void testAddItem_VendorNotApproved() {
        // Given
        Product milk = TestDataFactory.createProduct(1L, TEST_VENDOR_ID, 5L, "Fresh Milk", "60.00", null, 20);
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(productRepository.findBySlug("fresh-milk")).thenReturn(Optional.of(milk));
        when(vendorRepository.findById(TEST_VENDOR_ID))
                .thenReturn(Optional.of(TestDataFactory.createVendor(TEST_VENDOR_ID, 9L, VendorStatus.PENDING, "560001")));

        // When & Then
        assertThrows(ProductNotFoundException.class, () -> cartService.addItem(TEST_USER_ID, "fresh-milk"));
        verify(cartRepository, never()).findOrCreateByUserId(anyLong());
    }

    @Test
    @DisplayName("상품 담기 - 최대 수량 초과")
    void testAddItem_OverMaxQuantity() {
        // Given
        Product milk = TestDataFactory.createProduct(1L, TEST_VENDOR_ID, 5L, "Fresh Milk", "60.00", null, 20);
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(productRepository.findBySlug("fresh-milk")).thenReturn(Optional.of(milk));
        when(vendorRepository.findById(TEST_VENDOR_ID)).thenReturn(Optional.of(TestDataFactory.createApprovedVendor(TEST_VENDOR_ID, 9L)));
        when(cartRepository.findOrCreateByUserId(TEST_USER_ID)).thenReturn(TestDataFactory.createCart(TEST_CART_ID, TEST_USER_ID));
        when(cartRepository.findCartItem(TEST_CART_ID, 1L))
                .thenReturn(Optional.of(TestDataFactory.createCartItem(7L, TEST_CART_ID, 1L, 1000)));

        // When & Then
        assertThrows(InvalidQuantityException.class, () -> cartService.addItem(TEST_USER_ID, "fresh-milk"));
        verify(cartRepository, never()).saveCartItem(any());
    }

    // ========== 수량 변경 (updateItemQuantity) ==========

    @Test
    @DisplayName("수량 감소 - 0이 되면 삭제")
    void testDecrement_RemovesAtZero() {
        // Given
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(cartRepository.findByUserId(TEST_USER_ID)).thenReturn(Optional.of(TestDataFactory.createCart(TEST_CART_ID, TEST_USER_ID)));
        when(cartRepository.findCartItemById(7L)).thenReturn(Optional.of(TestDataFactory.createCartItem(7L, TEST_CART_ID, 1L, 1)));

        // When
        CartActionResponse result = cartService.updateItemQuantity(TEST_USER_ID, 7L, "decrement");

        // Then
        assertTrue(result.isRemoved());
        verify(cartRepository).deleteCartItem(7L);
        verify(cartRepository, never()).saveCartItem(any());
    }

    @Test
    @DisplayName("수량 증가 - 성공")
    void testIncrement() {
        // Given
        CartItem item = TestDataFactory.createCartItem(7L, TEST_CART_ID, 1L, 2);
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(cartRepository.findByUserId(TEST_USER_ID)).thenReturn(Optional.of(TestDataFactory.createCart(TEST_CART_ID, TEST_USER_ID)));
        when(cartRepository.findCartItemById(7L)).thenReturn(Optional.of(item));

        // When
        CartActionResponse result = cartService.updateItemQuantity(TEST_USER_ID, 7L, "increment");

        // Then
        assertEquals(3, result.getQuantity());
        verify(cartRepository).saveCartItem(item);
    }

    @Test
    @DisplayName("수량 변경 - 알 수 없는 action")
    void testUpdate_InvalidAction() {
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);

        ValidationException exception = assertThrows(ValidationException.class,
                () -> cartService.updateItemQuantity(TEST_USER_ID, 7L, "double"));
        assertTrue(exception.getFieldErrors().containsKey("action"));
    }

    @Test
    @DisplayName("수량 변경 - 다른 사용자의 장바구니 항목")
    void testUpdate_ForeignItem() {
        // Given
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(cartRepository.findByUserId(TEST_USER_ID)).thenReturn(Optional.of(TestDataFactory.createCart(TEST_CART_ID, TEST_USER_ID)));
        when(cartRepository.findCartItemById(7L)).thenReturn(Optional.of(TestDataFactory.createCartItem(7L, 999L, 1L, 2)));

        // When & Then
        assertThrows(CartItemNotFoundException.class,
                () -> cartService.updateItemQuantity(TEST_USER_ID, 7L, "increment"));
    }

    // ========== 삭제 (removeItem) ==========

    @Test
    @DisplayName("삭제 - 성공")
    void testRemoveItem() {
        // Given
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(cartRepository.findByUserId(TEST_USER_ID)).thenReturn(Optional.of(TestDataFactory.createCart(TEST_CART_ID, TEST_USER_ID)));
        when(cartRepository.findCartItemById(7L)).thenReturn(Optional.of(TestDataFactory.createCartItem(7L, TEST_CART_ID, 1L, 2)));

        // When
        CartActionResponse result = cartService.removeItem(TEST_USER_ID, 7L);

        // Then
        assertTrue(result.isRemoved());
        verify(cartRepository).deleteCartItem(7L);
    }

    @Test
    @DisplayName("삭제 - 장바구니가 없으면 항목 없음")
    void testRemoveItem_NoCart() {
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(cartRepository.findByUserId(TEST_USER_ID)).thenReturn(Optional.empty());

        assertThrows(CartItemNotFoundException.class, () -> cartService.removeItem(TEST_USER_ID, 7L));
        verify(cartRepository, never()).deleteCartItem(anyLong());
    }
}
