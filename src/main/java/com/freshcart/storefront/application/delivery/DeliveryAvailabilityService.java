package com.freshcart.storefront.application.delivery;

import com.freshcart.storefront.common.exception.ValidationException;
import com.freshcart.storefront.domain.vendor.ServiceablePincodes;
import com.freshcart.storefront.domain.vendor.VendorRepository;
import com.freshcart.storefront.domain.vendor.VendorStatus;
import com.freshcart.storefront.presentation.delivery.response.DeliveryAvailabilityResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 배송 가능 우편번호 확인 서비스
 *
 * 승인된 판매자 중 한 곳이라도 해당 우편번호를 배송 가능 목록에 갖고 있으면 배송 가능하다.
 * 세션 저장은 Presentation 계층에서 처리하며 이 서비스는 DB에 쓰지 않는다.
 */
@Service
public class DeliveryAvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(DeliveryAvailabilityService.class);

    public static final String SESSION_PINCODE_KEY = "delivery_pincode";

    private final VendorRepository vendorRepository;

    public DeliveryAvailabilityService(VendorRepository vendorRepository) {
        this.vendorRepository = vendorRepository;
    }

    /**
     * @param rawPincode 입력 우편번호 (앞뒤 공백 허용)
     * @throws ValidationException 6자리 숫자가 아닌 경우
     */
    @Transactional(readOnly = true)
    public DeliveryAvailabilityResponse check(String rawPincode) {
        String pincode = normalize(rawPincode);

        // 문자열 포함 조회는 후보일 뿐이므로 파싱된 목록으로 다시 확인
        boolean available = vendorRepository
                .findCandidatesByStatusAndPincode(VendorStatus.APPROVED, pincode).stream()
                .anyMatch(vendor -> vendor.servesPincode(pincode));

        log.debug("[DeliveryAvailabilityService] pincode={}, available={}", pincode, available);

        return DeliveryAvailabilityResponse.builder()
                .available(available)
                .pincode(pincode)
                .message(available
                        ? String.format("%s 지역으로 배송 가능합니다", pincode)
                        : String.format("%s 지역은 아직 배송하지 않습니다", pincode))
                .build();
    }

    /**
     * 입력값을 검증하고 공백을 제거한 우편번호를 반환한다.
     *
     * @throws ValidationException 6자리 숫자가 아닌 경우
     */
    public String normalize(String rawPincode) {
        String pincode = rawPincode == null ? "" : rawPincode.trim();
        if (!ServiceablePincodes.isValidPincode(pincode)) {
            throw new ValidationException("pincode", "6자리 숫자 우편번호를 입력해 주세요");
        }
        return pincode;
    }
}
