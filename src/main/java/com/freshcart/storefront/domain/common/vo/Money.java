package com.freshcart.storefront.domain.common.vo;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Money Value Object
 *
 * 금액을 나타내는 값 객체입니다. 소수점 둘째 자리(DECIMAL(10,2))까지 다루며
 * 음수 금액을 허용하지 않습니다.
 *
 * 사용처:
 * - 장바구니 라인 합계 / 총액
 * - 주문 총액
 * - 판매자 매출 집계
 *
 * 특징:
 * - Immutable: 생성 후 변경 불가능
 * - 연산 결과는 새로운 Money 객체 반환
 * - equals/hashCode는 scale을 맞춘 값 기준
 */
public final class Money implements Comparable<Money>, Serializable {
    private static final long serialVersionUID = 1L;
    private static final int SCALE = 2;

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private final BigDecimal amount;

    /**
     * @param amount 금액 (0 이상)
     * @throws IllegalArgumentException amount가 null이거나 음수인 경우
     */
    public Money(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("금액은 null이 될 수 없습니다");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("금액은 음수가 될 수 없습니다: " + amount);
        }
        this.amount = amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static Money of(BigDecimal amount) {
        return new Money(amount);
    }

    public static Money of(String amount) {
        return new Money(new BigDecimal(amount));
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public Money add(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return new Money(this.amount.add(other.amount));
    }

    /**
     * 단가 × 수량
     *
     * @param quantity 수량 (음수 불가)
     */
    public Money multiply(int quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("수량은 음수가 될 수 없습니다: " + quantity);
        }
        return new Money(this.amount.multiply(BigDecimal.valueOf(quantity)));
    }

    public boolean isLessThan(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return this.amount.compareTo(other.amount) < 0;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    @Override
    public int compareTo(Money other) {
        return this.amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Money money = (Money) o;
        return amount.compareTo(money.amount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount);
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
