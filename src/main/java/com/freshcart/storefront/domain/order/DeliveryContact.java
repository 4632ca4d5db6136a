package com.freshcart.storefront.domain.order;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 주문 배송 연락처 (이름, 전화번호, 주소, 주소에서 추출한 우편번호)
 */
@Getter
@Builder
@AllArgsConstructor
public class DeliveryContact {
    private final String name;
    private final String phone;
    private final String address;
    private final String pincode;
}
