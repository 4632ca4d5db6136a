package com.freshcart.storefront.domain.order;

import com.freshcart.storefront.domain.cart.CartItem;
import com.freshcart.storefront.domain.product.Product;
import com.freshcart.storefront.domain.product.ProductNotFoundException;

import java.util.List;
import java.util.Map;

/**
 * Order 관련 도메인 서비스
 * 장바구니 항목을 주문 항목 스냅샷으로 변환한다. (Repository 의존성 없음)
 *
 * 재고는 차감하거나 다시 검증하지 않는다.
 */
public class OrderDomainService {

    /**
     * 장바구니 항목으로 주문 생성
     *
     * 각 항목의 단가는 현재 표시 가격(할인가 우선), 판매자와 상품명은 주문 시점 값으로 고정된다.
     *
     * @param userId 주문자 ID
     * @param contact 배송 연락처
     * @param paymentMethod 결제 수단
     * @param cartItems 장바구니 항목 (담은 순서)
     * @param productsById 장바구니 항목이 참조하는 상품
     * @return 저장 전 주문 (항목 포함, 모든 항목 PLACED)
     * @throws IllegalArgumentException 장바구니 항목이 없는 경우
     * @throws ProductNotFoundException 장바구니 항목의 상품이 더 이상 존재하지 않는 경우
     */
    public Order createOrder(Long userId, DeliveryContact contact, PaymentMethod paymentMethod,
                             List<CartItem> cartItems, Map<Long, Product> productsById) {
        if (cartItems == null || cartItems.isEmpty()) {
            throw new IllegalArgumentException("주문할 장바구니 항목이 없습니다");
        }

        Order order = Order.createOrder(userId, contact, paymentMethod);
        for (CartItem cartItem : cartItems) {
            Product product = productsById.get(cartItem.getProductId());
            if (product == null) {
                throw new ProductNotFoundException(cartItem.getProductId());
            }
            order.addOrderItem(OrderItem.createOrderItem(
                    product.getProductId(),
                    product.getVendorId(),
                    product.getName(),
                    cartItem.getQuantity(),
                    product.getDisplayPrice()
            ));
        }
        return order;
    }
}
