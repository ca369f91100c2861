package kr.hhplus.be.staking.domain.staking;

import kr.hhplus.be.staking.domain.common.Money;
import kr.hhplus.be.staking.domain.common.ParticipantId;
import kr.hhplus.be.staking.domain.event.StakedEvent;
import kr.hhplus.be.staking.domain.exception.AlreadyCheckedInException;
import kr.hhplus.be.staking.domain.exception.AlreadyReservedException;
import kr.hhplus.be.staking.domain.exception.NothingToWithdrawException;
import kr.hhplus.be.staking.domain.exception.OverbookedException;
import kr.hhplus.be.staking.domain.exception.PriceNotMetException;
import kr.hhplus.be.staking.domain.exception.ReservationNotFoundException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 이벤트 하나의 예약 원장
 * - 참가자별 예약 상태와 이벤트 전체 예치금 잔액을 함께 관리
 * - 스레드 안전하지 않음: 호출자는 이벤트 단위 락을 잡은 상태에서만 접근해야 한다
 *
 * 불변식: escrowedBalance == 정산되지 않은 STAKED 예약들의 예치금 합계
 */
public class EventLedger {

    private final long eventId;
    private final Map<ParticipantId, Rsvp> rsvps = new HashMap<>();

    private Money escrowedBalance = Money.zero();
    private long stakedCount;

    public EventLedger(long eventId) {
        this.eventId = eventId;
    }

    // === 예약 ===

    /**
     * 예약 가능 여부 검증 - 금액, 기존 상태, 정원 순서로 검사
     */
    public void checkReservable(StakedEvent event, ParticipantId participant, Money amountSent) {
        if (amountSent.isLessThan(event.getPrice())) {
            throw new PriceNotMetException(event.getPrice().amount(), amountSent.amount());
        }

        RsvpStatus current = statusOf(participant);
        if (current == RsvpStatus.STAKED) throw new AlreadyReservedException();
        if (current == RsvpStatus.SETTLED) throw new AlreadyCheckedInException();

        if (stakedCount >= event.getCapacity()) {
            throw new OverbookedException(eventId, event.getCapacity());
        }
    }

    /**
     * 예치 기록 - 보낸 금액 전부를 예치한다
     */
    public Rsvp reserve(StakedEvent event, ParticipantId participant, Money amountSent) {
        checkReservable(event, participant, amountSent);

        Rsvp rsvp = Rsvp.stake(eventId, participant, amountSent);
        rsvps.put(participant, rsvp);
        escrowedBalance = escrowedBalance.add(amountSent);
        stakedCount++;
        return rsvp;
    }

    // === 체크인 ===

    /**
     * 체크인 대상 예약 조회 - 이미 체크인했는지 먼저 확인하고, 예약이 없으면 실패
     */
    public Rsvp findSettleable(ParticipantId participant) {
        Rsvp rsvp = rsvps.get(participant);
        if (rsvp != null && rsvp.getStatus() == RsvpStatus.SETTLED) {
            throw new AlreadyCheckedInException();
        }
        if (rsvp == null) {
            throw new ReservationNotFoundException(eventId, participant.value());
        }
        return rsvp;
    }

    /**
     * 체크인 기록 후 돌려줄 금액 반환
     */
    public Money settle(ParticipantId participant) {
        Rsvp rsvp = findSettleable(participant);
        rsvp.settle();

        escrowedBalance = escrowedBalance.subtract(rsvp.getStake());
        stakedCount--;
        return rsvp.getStake();
    }

    public void revertSettlement(ParticipantId participant) {
        Rsvp rsvp = rsvps.get(participant);
        if (rsvp == null) {
            throw new IllegalStateException("되돌릴 예약이 없습니다: " + participant);
        }
        rsvp.revertSettlement();

        escrowedBalance = escrowedBalance.add(rsvp.getStake());
        stakedCount++;
    }

    // === 정산 ===

    /**
     * 남은 예치금 전부를 인출 처리하고 노쇼 예약을 정산 완료로 표시
     */
    public Withdrawal drain() {
        if (!escrowedBalance.isPositive()) {
            throw new NothingToWithdrawException();
        }

        List<Rsvp> forfeited = new ArrayList<>();
        for (Rsvp rsvp : rsvps.values()) {
            if (rsvp.isEscrowed()) {
                rsvp.forfeit();
                forfeited.add(rsvp);
            }
        }

        Money amount = escrowedBalance;
        escrowedBalance = Money.zero();
        return new Withdrawal(amount, List.copyOf(forfeited));
    }

    public void revertDrain(Withdrawal withdrawal) {
        withdrawal.forfeited().forEach(Rsvp::revertForfeit);
        escrowedBalance = escrowedBalance.add(withdrawal.amount());
    }

    // === 조회 ===

    public RsvpStatus statusOf(ParticipantId participant) {
        Rsvp rsvp = rsvps.get(participant);
        return rsvp == null ? RsvpStatus.NONE : rsvp.getStatus();
    }

    public Optional<Rsvp> find(ParticipantId participant) {
        return Optional.ofNullable(rsvps.get(participant));
    }

    /**
     * 회계 불변식 확인
     */
    public boolean isBalanced() {
        Money escrowed = rsvps.values().stream()
                .filter(Rsvp::isEscrowed)
                .map(Rsvp::getStake)
                .reduce(Money.zero(), Money::add);
        long staked = rsvps.values().stream()
                .filter(r -> r.getStatus() == RsvpStatus.STAKED)
                .count();
        return escrowed.equals(escrowedBalance) && staked == stakedCount;
    }

    public Money getEscrowedBalance() { return escrowedBalance; }
    public long getStakedCount() { return stakedCount; }

    /**
     * 정산 결과 - 인출 금액과 이번에 정산된 노쇼 예약 목록
     */
    public record Withdrawal(Money amount, List<Rsvp> forfeited) {}
}
