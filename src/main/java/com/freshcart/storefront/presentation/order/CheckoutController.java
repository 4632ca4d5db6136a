package com.freshcart.storefront.presentation.order;

import com.freshcart.storefront.application.delivery.DeliveryAvailabilityService;
import com.freshcart.storefront.application.order.CheckoutService;
import com.freshcart.storefront.presentation.order.request.CheckoutRequest;
import com.freshcart.storefront.presentation.order.response.CheckoutSummaryResponse;
import com.freshcart.storefront.presentation.order.response.OrderResponse;
import com.freshcart.storefront.presentation.order.response.PlaceOrderResponse;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * CheckoutController - 결제 / 주문 요청 처리
 */
@RestController
public class CheckoutController {

    private final CheckoutService checkoutService;

    public CheckoutController(CheckoutService checkoutService) {
        this.checkoutService = checkoutService;
    }

    /**
     * GET /checkout/ - 결제 화면 (장바구니 + 저장된 우편번호 + 결제 수단)
     */
    @GetMapping("/checkout/")
    public ResponseEntity<CheckoutSummaryResponse> checkout(
            @RequestHeader("X-USER-ID") Long userId,
            HttpSession session) {
        String sessionPincode = (String) session.getAttribute(DeliveryAvailabilityService.SESSION_PINCODE_KEY);
        return ResponseEntity.ok(checkoutService.getCheckoutSummary(userId, sessionPincode));
    }

    /**
     * POST /process-checkout/ - 주문 생성
     */
    @PostMapping("/process-checkout/")
    public ResponseEntity<PlaceOrderResponse> processCheckout(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody CheckoutRequest request) {
        PlaceOrderResponse response = checkoutService.placeOrder(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * GET /track-orders/ - 내 주문 목록 (최신순)
     */
    @GetMapping("/track-orders/")
    public ResponseEntity<List<OrderResponse>> trackOrders(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(checkoutService.getOrders(userId));
    }
}
