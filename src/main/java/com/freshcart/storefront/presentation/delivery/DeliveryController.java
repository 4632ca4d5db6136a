package com.freshcart.storefront.presentation.delivery;

import com.freshcart.storefront.application.delivery.DeliveryAvailabilityService;
import com.freshcart.storefront.presentation.delivery.request.SetDeliveryPincodeRequest;
import com.freshcart.storefront.presentation.delivery.response.DeliveryAvailabilityResponse;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * DeliveryController - 배송 가능 우편번호 확인 / 저장
 *
 * 저장한 우편번호는 HTTP 세션(delivery_pincode)에만 보관하고 결제 화면에서 다시 보여준다.
 */
@RestController
public class DeliveryController {

    private final DeliveryAvailabilityService deliveryAvailabilityService;

    public DeliveryController(DeliveryAvailabilityService deliveryAvailabilityService) {
        this.deliveryAvailabilityService = deliveryAvailabilityService;
    }

    /**
     * GET /check-pincode/?pincode= - 배송 가능 여부 확인
     */
    @GetMapping("/check-pincode/")
    public ResponseEntity<DeliveryAvailabilityResponse> checkPincode(
            @RequestParam(value = "pincode", required = false) String pincode) {
        return ResponseEntity.ok(deliveryAvailabilityService.check(pincode));
    }

    /**
     * POST /set-delivery-pincode/ - 배송 우편번호 저장
     */
    @PostMapping("/set-delivery-pincode/")
    public ResponseEntity<DeliveryAvailabilityResponse> setDeliveryPincode(
            @RequestBody SetDeliveryPincodeRequest request,
            HttpSession session) {
        DeliveryAvailabilityResponse response = deliveryAvailabilityService.check(request.getPincode());
        session.setAttribute(DeliveryAvailabilityService.SESSION_PINCODE_KEY, response.getPincode());
        return ResponseEntity.ok(response);
    }
}
