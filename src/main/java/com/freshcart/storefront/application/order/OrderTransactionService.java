package com.freshcart.storefront.application.order;

import com.freshcart.storefront.application.order.CheckoutValidator.ValidatedCheckout;
import com.freshcart.storefront.domain.cart.Cart;
import com.freshcart.storefront.domain.cart.CartItem;
import com.freshcart.storefront.domain.cart.CartRepository;
import com.freshcart.storefront.domain.cart.EmptyCartException;
import com.freshcart.storefront.domain.order.Order;
import com.freshcart.storefront.domain.order.OrderDomainService;
import com.freshcart.storefront.domain.order.OrderRepository;
import com.freshcart.storefront.domain.product.Product;
import com.freshcart.storefront.domain.product.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * OrderTransactionService - 주문 트랜잭션 처리 서비스 (Application 계층)
 *
 * 역할:
 * - CheckoutService와 분리된 독립적인 서비스
 * - 주문 헤더/항목 저장과 장바구니 비우기를 하나의 트랜잭션으로 처리
 *
 * CheckoutService 내부에서 @Transactional 메서드를 직접 호출하면
 * 프록시를 거치지 않아 트랜잭션이 적용되지 않으므로 별도 빈으로 둔다.
 *
 * 아키텍처:
 * CheckoutService (입력 검증, 예외 변환)
 *     ↓ (의존성 주입)
 * OrderTransactionService (@Transactional 처리)
 */
@Service
public class OrderTransactionService {

    private static final Logger log = LoggerFactory.getLogger(OrderTransactionService.class);

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;
    private final OrderDomainService orderDomainService;

    public OrderTransactionService(CartRepository cartRepository,
                                   ProductRepository productRepository,
                                   OrderRepository orderRepository,
                                   OrderDomainService orderDomainService) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
        this.orderRepository = orderRepository;
        this.orderDomainService = orderDomainService;
    }

    /**
     * 장바구니로 주문 생성 (원자적 처리)
     *
     * 하나의 트랜잭션으로 처리되는 작업:
     * 1. 장바구니 항목 조회
     * 2. 항목별 가격/판매자/상품명 스냅샷으로 주문 항목 생성 (상태 PLACED)
     * 3. 주문 + 주문 항목 저장
     * 4. 장바구니 항목 삭제
     *
     * 어느 단계에서든 실패하면 모두 롤백되어 주문은 남지 않고 장바구니는 그대로 유지된다.
     *
     * @param userId 주문자 ID
     * @param checkout 검증 완료된 배송 연락처/결제 수단
     * @return 저장된 주문
     * @throws EmptyCartException 장바구니가 없거나 비어 있는 경우
     */
    @Transactional(rollbackFor = Exception.class)
    public Order placeOrder(Long userId, ValidatedCheckout checkout) {
        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> new EmptyCartException(userId));
        List<CartItem> cartItems = cartRepository.getCartItems(cart.getCartId());
        if (cartItems.isEmpty()) {
            throw new EmptyCartException(userId);
        }

        List<Long> productIds = cartItems.stream()
                .map(CartItem::getProductId)
                .collect(Collectors.toList());
        Map<Long, Product> productsById = productRepository.findAllById(productIds).stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));

        Order order = orderDomainService.createOrder(
                userId, checkout.getContact(), checkout.getPaymentMethod(), cartItems, productsById);
        Order savedOrder = orderRepository.save(order);

        int cleared = cartRepository.deleteCartItemsByCartId(cart.getCartId());
        log.debug("[OrderTransactionService] 주문 저장 및 장바구니 비우기 - orderId={}, items={}, clearedCartItems={}",
                savedOrder.getOrderId(), savedOrder.getOrderItemCount(), cleared);
        return savedOrder;
    }
}
