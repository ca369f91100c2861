package kr.hhplus.be.staking.domain.common;

import java.util.Objects;

/**
 * 호출자(참가자/주최자) 식별자
 * - 인증은 외부 계층 책임이므로 내용은 해석하지 않는 불투명한 문자열
 */
public final class ParticipantId {
    private final String value;

    private ParticipantId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("참가자 ID는 비어있을 수 없습니다");
        }
        this.value = value;
    }

    public static ParticipantId of(String value) {
        return new ParticipantId(value);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        return (this == obj) || (obj instanceof ParticipantId other && value.equals(other.value));
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
