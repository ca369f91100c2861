package kr.hhplus.be.staking.domain.common;

import java.util.Objects;

/**
 * 스테이킹 금액을 나타내는 Value Object
 * 배포 단위당 한 가지 가치 단위만 다루며, 음수는 허용하지 않는다
 */
public final class Money {

    private static final Money ZERO = new Money(0L);

    private final long amount; // 최소 단위 (정수)

    public Money(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("금액은 0 이상이어야 합니다");
        }
        this.amount = amount;
    }

    public static Money zero() {
        return ZERO;
    }

    public static Money of(long amount) {
        return new Money(amount);
    }

    // 금액 연산
    public Money add(Money other) {
        return new Money(Math.addExact(this.amount, other.amount));
    }

    public Money subtract(Money other) {
        long result = this.amount - other.amount;
        if (result < 0) {
            throw new IllegalArgumentException("결과 금액이 음수가 될 수 없습니다");
        }
        return new Money(result);
    }

    // 비교 연산
    public boolean isLessThan(Money other) {
        return this.amount < other.amount;
    }

    public boolean isZero() {
        return this.amount == 0;
    }

    public boolean isPositive() {
        return this.amount > 0;
    }

    public long amount() {
        return amount;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Money money = (Money) obj;
        return amount == money.amount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount);
    }

    @Override
    public String toString() {
        return String.format("%,d", amount);
    }
}
