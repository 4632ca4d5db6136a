package com.freshcart.storefront.domain.order;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 결제 수단 (결제 연동 없이 기록만 한다)
 */
public enum PaymentMethod {
    COD("cod"),
    ONLINE("online"),
    UPI("upi"),
    CARD("card");

    private final String value;

    PaymentMethod(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 요청 값을 결제 수단으로 변환 (대소문자 무시)
     */
    public static Optional<PaymentMethod> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(method -> method.value.equals(normalized))
                .findFirst();
    }
}
