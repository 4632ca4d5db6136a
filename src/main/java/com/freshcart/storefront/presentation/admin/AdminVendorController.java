package com.freshcart.storefront.presentation.admin;

import com.freshcart.storefront.application.vendor.VendorOnboardingService;
import com.freshcart.storefront.presentation.vendor.response.VendorResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * AdminVendorController - 플랫폼 관리자용 판매자 승인 / 거절
 * 관리자 인증은 외부 관리 도구가 담당한다.
 */
@RestController
@RequestMapping("/admin/vendors")
public class AdminVendorController {

    private final VendorOnboardingService vendorOnboardingService;

    public AdminVendorController(VendorOnboardingService vendorOnboardingService) {
        this.vendorOnboardingService = vendorOnboardingService;
    }

    @PostMapping("/{vendor_id}/approve/")
    public ResponseEntity<VendorResponse> approve(@PathVariable("vendor_id") Long vendorId) {
        return ResponseEntity.ok(vendorOnboardingService.approve(vendorId));
    }

    /**
     * 거절은 최종 상태 (재신청 불가)
     */
    @PostMapping("/{vendor_id}/reject/")
    public ResponseEntity<VendorResponse> reject(@PathVariable("vendor_id") Long vendorId) {
        return ResponseEntity.ok(vendorOnboardingService.reject(vendorId));
    }
}
