package com.freshcart.storefront.integration;

import com.freshcart.storefront.application.cart.CartService;
import com.freshcart.storefront.application.earnings.EarningsFilter;
import com.freshcart.storefront.application.earnings.EarningsService;
import com.freshcart.storefront.application.fulfillment.FulfillmentService;
import com.freshcart.storefront.application.order.CheckoutService;
import com.freshcart.storefront.common.exception.InvalidStatusTransitionException;
import com.freshcart.storefront.config.AbstractIntegrationTest;
import com.freshcart.storefront.domain.category.Category;
import com.freshcart.storefront.domain.order.Order;
import com.freshcart.storefront.domain.order.OrderItem;
import com.freshcart.storefront.domain.order.OrderItemStatus;
import com.freshcart.storefront.domain.order.OrderRepository;
import com.freshcart.storefront.domain.user.User;
import com.freshcart.storefront.presentation.order.request.CheckoutRequest;
import com.freshcart.storefront.presentation.order.response.PlaceOrderResponse;
import com.freshcart.storefront.presentation.vendor.response.EarningsReportResponse;
import com.freshcart.storefront.presentation.vendor.response.VendorProductResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 장바구니 → 주문 → 판매자 처리 → 매출 집계 통합 테스트
 */
@DisplayName("주문 흐름 통합 테스트")
class CheckoutFlowIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private CartService cartService;

    @Autowired
    private CheckoutService checkoutService;

    @Autowired
    private FulfillmentService fulfillmentService;

    @Autowired
    private EarningsService earningsService;

    @Autowired
    private OrderRepository orderRepository;

    private User customer;
    private User dairyVendor;
    private User bakeryVendor;
    private VendorProductResponse milk;
    private VendorProductResponse bread;

    @BeforeEach
    void setup() {
        customer = createUser("customer");
        Category category = createCategory("Groceries");
        dairyVendor = createApprovedVendorUser("Dairy Farm", "560001");
        bakeryVendor = createApprovedVendorUser("Daily Bakery", "560001, 560034");
        milk = createProduct(dairyVendor, category, "Fresh Milk", "50.00");
        bread = createProduct(bakeryVendor, category, "Brown Bread", "40.00");
    }

    private CheckoutRequest checkoutRequest() {
        return CheckoutRequest.builder()
                .name("Asha")
                .phone("9000000000")
                .address("221 Lake View, Bengaluru 560001")
                .paymentMethod("cod")
                .build();
    }

    @Test
    @DisplayName("주문 생성 - 판매자별 항목 스냅샷 저장, 장바구니 비움")
    void testPlaceOrder_MultiVendor() {
        // Given
        cartService.addItem(customer.getUserId(), milk.getSlug());
        cartService.addItem(customer.getUserId(), milk.getSlug());
        cartService.addItem(customer.getUserId(), bread.getSlug());

        // When
        PlaceOrderResponse response = checkoutService.placeOrder(customer.getUserId(), checkoutRequest());

        // Then
        assertEquals(0, new BigDecimal("140.00").compareTo(response.getTotalAmount()));
        assertEquals("560001", response.getDeliveryPincode());
        assertTrue(cartService.getCart(customer.getUserId()).isEmpty());

        List<Order> orders = orderRepository.findByUserIdWithItems(customer.getUserId());
        assertEquals(1, orders.size());
        List<OrderItem> items = orders.get(0).getOrderItems();
        assertEquals(2, items.size());
        assertTrue(items.stream().allMatch(item -> item.getStatus() == OrderItemStatus.PLACED));
        OrderItem milkItem = items.stream()
                .filter(item -> item.getProductId().equals(milk.getProductId()))
                .findFirst()
                .orElseThrow();
        assertEquals("Fresh Milk", milkItem.getProductName());
        assertEquals(2, milkItem.getQuantity());
    }

    @Test
    @DisplayName("배송 완료 항목만 해당 판매자 매출에 집계")
    void testEarnings_OnlyDeliveredItemsOfOwnVendor() {
        // Given
        cartService.addItem(customer.getUserId(), milk.getSlug());
        cartService.addItem(customer.getUserId(), milk.getSlug());
        cartService.addItem(customer.getUserId(), bread.getSlug());
        checkoutService.placeOrder(customer.getUserId(), checkoutRequest());

        List<OrderItem> items = orderRepository.findByUserIdWithItems(customer.getUserId()).get(0).getOrderItems();
        Long milkItemId = items.stream()
                .filter(item -> item.getProductId().equals(milk.getProductId()))
                .findFirst()
                .map(OrderItem::getOrderItemId)
                .orElseThrow();

        // When
        for (String status : List.of("confirmed", "preparing", "out_for_delivery", "delivered")) {
            fulfillmentService.updateStatus(dairyVendor.getUserId(), milkItemId, status);
        }

        // Then
        EarningsReportResponse dairyReport = earningsService.getReport(dairyVendor.getUserId(), EarningsFilter.empty());
        assertEquals(0, new BigDecimal("100.00").compareTo(dairyReport.getTotalRevenue()));
        assertEquals(2, dairyReport.getTotalItemsSold());

        EarningsReportResponse bakeryReport = earningsService.getReport(bakeryVendor.getUserId(), EarningsFilter.empty());
        assertEquals(0, BigDecimal.ZERO.compareTo(bakeryReport.getTotalRevenue()));
        assertEquals(0, bakeryReport.getTotalItemsSold());
    }

    @Test
    @DisplayName("배송 완료 후 상태 변경 불가")
    void testDeliveredIsTerminal() {
        // Given
        cartService.addItem(customer.getUserId(), milk.getSlug());
        checkoutService.placeOrder(customer.getUserId(), checkoutRequest());
        Long itemId = orderRepository.findByUserIdWithItems(customer.getUserId()).get(0)
                .getOrderItems().get(0).getOrderItemId();
        for (String status : List.of("confirmed", "preparing", "out_for_delivery", "delivered")) {
            fulfillmentService.updateStatus(dairyVendor.getUserId(), itemId, status);
        }

        // When & Then
        assertThrows(InvalidStatusTransitionException.class,
                () -> fulfillmentService.updateStatus(dairyVendor.getUserId(), itemId, "cancelled"));
    }
}
