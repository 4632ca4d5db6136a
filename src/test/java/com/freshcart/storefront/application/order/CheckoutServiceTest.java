package com.freshcart.storefront.application.order;

import com.freshcart.storefront.application.cart.CartService;
import com.freshcart.storefront.application.order.CheckoutValidator.ValidatedCheckout;
import com.freshcart.storefront.common.exception.ValidationException;
import com.freshcart.storefront.config.TestDataFactory;
import com.freshcart.storefront.domain.cart.EmptyCartException;
import com.freshcart.storefront.domain.common.vo.Money;
import com.freshcart.storefront.domain.order.Order;
import com.freshcart.storefront.domain.order.OrderItem;
import com.freshcart.storefront.domain.order.OrderRepository;
import com.freshcart.storefront.domain.order.PaymentMethod;
import com.freshcart.storefront.domain.user.UserNotFoundException;
import com.freshcart.storefront.domain.user.UserRepository;
import com.freshcart.storefront.presentation.cart.response.CartItemResponse;
import com.freshcart.storefront.presentation.cart.response.CartResponse;
import com.freshcart.storefront.presentation.order.request.CheckoutRequest;
import com.freshcart.storefront.presentation.order.response.CheckoutSummaryResponse;
import com.freshcart.storefront.presentation.order.response.PlaceOrderResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * CheckoutServiceTest - Application 계층 단위 테스트
 *
 * 테스트 대상: CheckoutService
 * - 결제 화면 조회
 * - 주문 생성 (검증 → 트랜잭션 → 예외 변환)
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CheckoutService 단위 테스트")
class CheckoutServiceTest {

    private CheckoutService checkoutService;

    @Mock
    private UserRepository userRepository;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private CartService cartService;

    @Mock
    private CheckoutValidator checkoutValidator;

    @Mock
    private OrderTransactionService orderTransactionService;

    private static final Long TEST_USER_ID = 7L;

    @BeforeEach
    void setup() {
        checkoutService = new CheckoutService(
                userRepository, orderRepository, cartService, checkoutValidator, orderTransactionService);
    }

    // ========== 결제 화면 (getCheckoutSummary) ==========

    @Test
    @DisplayName("결제 화면 - 세션 우편번호와 결제 수단 포함")
    void testGetCheckoutSummary() {
        // Given
        CartResponse cart = CartResponse.builder()
                .userId(TEST_USER_ID)
                .items(List.of(CartItemResponse.builder().cartItemId(1L).quantity(1).build()))
                .totalItems(1)
                .totalPrice(new BigDecimal("50.00"))
                .build();
        when(cartService.getCart(TEST_USER_ID)).thenReturn(cart);

        // When
        CheckoutSummaryResponse result = checkoutService.getCheckoutSummary(TEST_USER_ID, "560001");

        // Then
        assertEquals("560001", result.getDeliveryPincode());
        assertEquals(List.of("cod", "online", "upi", "card"), result.getPaymentMethods());
        assertSame(cart, result.getCart());
    }

    @Test
    @DisplayName("결제 화면 - 빈 장바구니")
    void testGetCheckoutSummary_EmptyCart() {
        when(cartService.getCart(TEST_USER_ID)).thenReturn(CartResponse.builder()
                .items(Collections.emptyList())
                .build());

        assertThrows(EmptyCartException.class, () -> checkoutService.getCheckoutSummary(TEST_USER_ID, null));
    }

    // ========== 주문 생성 (placeOrder) ==========

    @Test
    @DisplayName("주문 생성 - 성공")
    void testPlaceOrder_Success() {
        // Given
        CheckoutRequest request = CheckoutRequest.builder().build();
        ValidatedCheckout checkout = new ValidatedCheckout(TestDataFactory.createContact(), PaymentMethod.CARD);
        Order order = Order.builder()
                .orderId(900L)
                .userId(TEST_USER_ID)
                .deliveryPincode("560001")
                .paymentMethod(PaymentMethod.CARD)
                .totalAmount(BigDecimal.ZERO)
                .build();
        order.addOrderItem(OrderItem.createOrderItem(1L, 10L, "Fresh Milk", 2, Money.of("50.00")));

        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(checkoutValidator.validate(request)).thenReturn(checkout);
        when(orderTransactionService.placeOrder(TEST_USER_ID, checkout)).thenReturn(order);

        // When
        PlaceOrderResponse result = checkoutService.placeOrder(TEST_USER_ID, request);

        // Then
        assertEquals(900L, result.getOrderId());
        assertEquals(1, result.getItemCount());
        assertEquals(0, new BigDecimal("100.00").compareTo(result.getTotalAmount()));
        assertEquals("card", result.getPaymentMethod());
    }

    @Test
    @DisplayName("주문 생성 - 검증 실패 시 트랜잭션 호출 없음")
    void testPlaceOrder_ValidationFailure() {
        // Given
        CheckoutRequest request = CheckoutRequest.builder().build();
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(checkoutValidator.validate(request)).thenThrow(new ValidationException(Map.of("name", "이름을 입력해주세요")));

        // When & Then
        assertThrows(ValidationException.class, () -> checkoutService.placeOrder(TEST_USER_ID, request));
        verify(orderTransactionService, never()).placeOrder(anyLong(), any());
    }

    @Test
    @DisplayName("주문 생성 - 저장소 오류는 OrderPersistenceException으로 변환")
    void testPlaceOrder_PersistenceFailure() {
        // Given
        CheckoutRequest request = CheckoutRequest.builder().build();
        ValidatedCheckout checkout = new ValidatedCheckout(TestDataFactory.createContact(), PaymentMethod.COD);
        DataAccessResourceFailureException cause = new DataAccessResourceFailureException("connection lost");
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(checkoutValidator.validate(request)).thenReturn(checkout);
        when(orderTransactionService.placeOrder(TEST_USER_ID, checkout)).thenThrow(cause);

        // When
        OrderPersistenceException exception = assertThrows(OrderPersistenceException.class,
                () -> checkoutService.placeOrder(TEST_USER_ID, request));

        // Then
        assertSame(cause, exception.getCause());
        assertEquals(TEST_USER_ID, exception.getUserId());
        assertEquals(500, exception.getStatusCode());
    }

    @Test
    @DisplayName("주문 생성 - 빈 장바구니 예외는 그대로 전달")
    void testPlaceOrder_EmptyCart() {
        // Given
        CheckoutRequest request = CheckoutRequest.builder().build();
        ValidatedCheckout checkout = new ValidatedCheckout(TestDataFactory.createContact(), PaymentMethod.COD);
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(true);
        when(checkoutValidator.validate(request)).thenReturn(checkout);
        when(orderTransactionService.placeOrder(TEST_USER_ID, checkout)).thenThrow(new EmptyCartException(TEST_USER_ID));

        // When & Then
        assertThrows(EmptyCartException.class, () -> checkoutService.placeOrder(TEST_USER_ID, request));
    }

    @Test
    @DisplayName("주문 생성 - 사용자 없음")
    void testPlaceOrder_UserNotFound() {
        when(userRepository.existsById(TEST_USER_ID)).thenReturn(false);

        assertThrows(UserNotFoundException.class,
                () -> checkoutService.placeOrder(TEST_USER_ID, CheckoutRequest.builder().build()));
        verifyNoInteractions(checkoutValidator, orderTransactionService);
    }
}
