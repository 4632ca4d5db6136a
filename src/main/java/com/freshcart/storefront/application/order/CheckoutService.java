package com.freshcart.storefront.application.order;

import com.freshcart.storefront.application.cart.CartService;
import com.freshcart.storefront.application.order.CheckoutValidator.ValidatedCheckout;
import com.freshcart.storefront.domain.cart.EmptyCartException;
import com.freshcart.storefront.domain.order.Order;
import com.freshcart.storefront.domain.order.OrderRepository;
import com.freshcart.storefront.domain.order.PaymentMethod;
import com.freshcart.storefront.domain.user.UserNotFoundException;
import com.freshcart.storefront.domain.user.UserRepository;
import com.freshcart.storefront.presentation.cart.response.CartResponse;
import com.freshcart.storefront.presentation.order.request.CheckoutRequest;
import com.freshcart.storefront.presentation.order.response.CheckoutSummaryResponse;
import com.freshcart.storefront.presentation.order.response.OrderResponse;
import com.freshcart.storefront.presentation.order.response.PlaceOrderResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CheckoutService - 결제 및 주문 조회 (Application 계층)
 *
 * 주문 생성 흐름:
 * 1. 입력값 검증 (CheckoutValidator) - 실패 시 쓰기 없음
 * 2. OrderTransactionService로 주문 저장 + 장바구니 비우기 (단일 트랜잭션)
 * 3. 저장소 오류는 OrderPersistenceException으로 변환
 */
@Service
public class CheckoutService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final UserRepository userRepository;
    private final OrderRepository orderRepository;
    private final CartService cartService;
    private final CheckoutValidator checkoutValidator;
    private final OrderTransactionService orderTransactionService;

    public CheckoutService(UserRepository userRepository,
                           OrderRepository orderRepository,
                           CartService cartService,
                           CheckoutValidator checkoutValidator,
                           OrderTransactionService orderTransactionService) {
        this.userRepository = userRepository;
        this.orderRepository = orderRepository;
        this.cartService = cartService;
        this.checkoutValidator = checkoutValidator;
        this.orderTransactionService = orderTransactionService;
    }

    /**
     * 결제 화면 정보 조회
     *
     * @param userId 사용자 ID
     * @param sessionPincode 세션에 저장된 배송 우편번호 (없으면 null)
     * @throws EmptyCartException 장바구니가 비어 있는 경우
     */
    public CheckoutSummaryResponse getCheckoutSummary(Long userId, String sessionPincode) {
        CartResponse cart = cartService.getCart(userId);
        if (cart.isEmpty()) {
            throw new EmptyCartException(userId);
        }
        return CheckoutSummaryResponse.builder()
                .cart(cart)
                .deliveryPincode(sessionPincode)
                .paymentMethods(Arrays.stream(PaymentMethod.values())
                        .map(PaymentMethod::getValue)
                        .collect(Collectors.toList()))
                .build();
    }

    /**
     * 주문 생성
     *
     * @param userId 주문자 ID
     * @param request 이름, 전화번호, 주소, 결제 수단
     * @return 생성된 주문 요약
     * @throws com.freshcart.storefront.common.exception.ValidationException 입력값 오류 (필드별 메시지)
     * @throws EmptyCartException 장바구니가 비어 있는 경우
     * @throws OrderPersistenceException 저장 실패 (롤백됨, 장바구니 유지)
     */
    public PlaceOrderResponse placeOrder(Long userId, CheckoutRequest request) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }

        ValidatedCheckout checkout = checkoutValidator.validate(request);

        Order order;
        try {
            order = orderTransactionService.placeOrder(userId, checkout);
        } catch (DataAccessException | TransactionException e) {
            log.error("[CheckoutService] 주문 저장 실패 - 트랜잭션 롤백: userId={}", userId, e);
            throw new OrderPersistenceException(userId, e);
        }

        log.info("[CheckoutService] 주문 생성 완료 - orderId={}, userId={}, items={}, total={}",
                order.getOrderId(), userId, order.getOrderItemCount(), order.getTotalAmount());
        return PlaceOrderResponse.from(order);
    }

    /**
     * 사용자 주문 목록 (최신순, 항목별 처리 상태 포함)
     */
    @Transactional(readOnly = true)
    public List<OrderResponse> getOrders(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
        return orderRepository.findByUserIdWithItems(userId).stream()
                .map(OrderResponse::from)
                .collect(Collectors.toList());
    }
}
