package com.freshcart.storefront.application.order;

import com.freshcart.storefront.common.exception.ValidationException;
import com.freshcart.storefront.domain.order.DeliveryContact;
import com.freshcart.storefront.domain.order.PaymentMethod;
import com.freshcart.storefront.presentation.order.request.CheckoutRequest;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CheckoutValidator - 결제 입력값 검증 전담
 *
 * 검증 항목:
 * - name, phone, address, payment_method 필수
 * - phone 15자 이하
 * - address에 다른 숫자와 붙어 있지 않은 6자리 우편번호 포함
 * - payment_method ∈ {cod, online, upi, card} (대소문자 무시)
 *
 * 모든 위반 사항을 모아 하나의 ValidationException으로 던진다. (부수 효과 없음)
 */
@Component
public class CheckoutValidator {

    static final int MAX_PHONE_LENGTH = 15;
    private static final Pattern ADDRESS_PINCODE = Pattern.compile("(?<!\\d)(\\d{6})(?!\\d)");

    /**
     * @return 정규화된 배송 연락처와 결제 수단
     * @throws ValidationException 하나 이상의 필드가 유효하지 않은 경우
     */
    public ValidatedCheckout validate(CheckoutRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();

        String name = trim(request.getName());
        String phone = trim(request.getPhone());
        String address = trim(request.getAddress());
        String paymentValue = trim(request.getPaymentMethod());

        if (name.isEmpty()) {
            errors.put("name", "이름을 입력해주세요");
        }

        if (phone.isEmpty()) {
            errors.put("phone", "전화번호를 입력해주세요");
        } else if (phone.length() > MAX_PHONE_LENGTH) {
            errors.put("phone", String.format("전화번호는 %d자 이하여야 합니다", MAX_PHONE_LENGTH));
        }

        String pincode = null;
        if (address.isEmpty()) {
            errors.put("address", "배송지 주소를 입력해주세요");
        } else {
            Matcher matcher = ADDRESS_PINCODE.matcher(address);
            if (matcher.find()) {
                pincode = matcher.group(1);
            } else {
                errors.put("address", "주소에 6자리 우편번호를 포함해주세요");
            }
        }

        PaymentMethod paymentMethod = null;
        if (paymentValue.isEmpty()) {
            errors.put("payment_method", "결제 수단을 선택해주세요");
        } else {
            paymentMethod = PaymentMethod.fromValue(paymentValue).orElse(null);
            if (paymentMethod == null) {
                errors.put("payment_method", "지원하지 않는 결제 수단입니다: " + paymentValue);
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        DeliveryContact contact = DeliveryContact.builder()
                .name(name)
                .phone(phone)
                .address(address)
                .pincode(pincode)
                .build();
        return new ValidatedCheckout(contact, paymentMethod);
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }

    @Getter
    @AllArgsConstructor
    public static class ValidatedCheckout {
        private final DeliveryContact contact;
        private final PaymentMethod paymentMethod;
    }
}
