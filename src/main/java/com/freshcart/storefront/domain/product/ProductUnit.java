package com.freshcart.storefront.domain.product;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 상품 판매 단위
 */
public enum ProductUnit {
    KG("kg"),
    G("g"),
    L("l"),
    ML("ml"),
    PIECE("piece"),
    PACK("pack");

    private final String value;

    ProductUnit(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 요청 값("kg", "Piece" 등)을 단위로 변환 (대소문자 무시)
     */
    public static Optional<ProductUnit> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(unit -> unit.value.equals(normalized))
                .findFirst();
    }
}
