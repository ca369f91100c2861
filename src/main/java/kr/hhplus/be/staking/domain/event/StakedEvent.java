package kr.hhplus.be.staking.domain.event;

import kr.hhplus.be.staking.domain.common.Money;
import kr.hhplus.be.staking.domain.common.ParticipantId;
import kr.hhplus.be.staking.domain.exception.EventWindowOverflowException;
import kr.hhplus.be.staking.domain.exception.MissingCapacityException;
import kr.hhplus.be.staking.domain.exception.MissingDurationException;
import kr.hhplus.be.staking.domain.exception.MissingPriceException;
import kr.hhplus.be.staking.domain.exception.MissingStartTimeException;

import java.util.Objects;

/**
 * 스테이킹 이벤트 레코드
 * - 생성 이후 정원/참가비/시간 정보는 변경되지 않는다
 * - 예치금 잔액은 {@link kr.hhplus.be.staking.domain.staking.EventLedger}가 따로 관리
 */
public final class StakedEvent {

    private final long id;
    private final ParticipantId owner;
    private final String name;
    private final long capacity;
    private final Money price;
    private final EventWindow window;

    private StakedEvent(long id, ParticipantId owner, String name, long capacity, Money price, EventWindow window) {
        this.id = id;
        this.owner = Objects.requireNonNull(owner, "주최자는 필수입니다");
        this.name = name == null ? "" : name;
        this.capacity = capacity;
        this.price = price;
        this.window = window;
    }

    /**
     * 검증을 통과한 입력으로 이벤트 생성
     * 식별자는 검증 이후에 발급되어야 하므로 호출자가 {@link #validate}를 먼저 수행한다
     */
    public static StakedEvent create(long id, ParticipantId owner, String name,
                                     long capacity, long price, long startTime, long duration) {
        validate(capacity, price, startTime, duration);
        if (id < 1) {
            throw new IllegalArgumentException("이벤트 ID는 1 이상이어야 합니다");
        }
        return new StakedEvent(id, owner, name, capacity, Money.of(price), new EventWindow(startTime, duration));
    }

    /**
     * 생성 입력 검증 - 정원, 참가비, 시작 시간, 진행 시간, 종료 시각 순서로 검사하고 첫 실패만 보고
     */
    public static void validate(long capacity, long price, long startTime, long duration) {
        if (capacity < 1) throw new MissingCapacityException();
        if (price < 1) throw new MissingPriceException();
        if (startTime < 1) throw new MissingStartTimeException();
        if (duration < 1) throw new MissingDurationException();
        if (startTime > Long.MAX_VALUE - duration) throw new EventWindowOverflowException(startTime, duration);
    }

    public boolean isOwnedBy(ParticipantId caller) {
        return owner.equals(caller);
    }

    public EventMetadata metadata() {
        return new EventMetadata(name, owner.value());
    }

    public long getId() { return id; }
    public ParticipantId getOwner() { return owner; }
    public String getName() { return name; }
    public long getCapacity() { return capacity; }
    public Money getPrice() { return price; }
    public EventWindow getWindow() { return window; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return id == ((StakedEvent) obj).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return String.format("StakedEvent{id=%d, name=%s, owner=%s, capacity=%d, price=%s}",
                id, name, owner, capacity, price);
    }
}
