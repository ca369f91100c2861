package kr.hhplus.be.staking.domain.staking;

import kr.hhplus.be.staking.domain.common.Money;
import kr.hhplus.be.staking.domain.common.ParticipantId;

import java.util.Objects;

/**
 * 한 참가자의 이벤트 예약(예치) 기록
 * - 예치 금액은 참가자별로 기록하며 체크인 시 정확히 이 금액을 돌려준다
 * - 노쇼 참가자의 예치금이 주최자에게 정산되면 forfeited 로 표시된다 (상태는 STAKED 유지)
 */
public class Rsvp {

    private final long eventId;
    private final ParticipantId participant;
    private final Money stake;

    private RsvpStatus status;
    private boolean forfeited;

    private Rsvp(long eventId, ParticipantId participant, Money stake) {
        this.eventId = eventId;
        this.participant = Objects.requireNonNull(participant, "참가자는 필수입니다");
        this.stake = Objects.requireNonNull(stake, "예치 금액은 필수입니다");
        this.status = RsvpStatus.STAKED;
    }

    /**
     * 예치로 새 예약 생성
     * NONE → STAKED
     */
    static Rsvp stake(long eventId, ParticipantId participant, Money stake) {
        if (!stake.isPositive()) {
            throw new IllegalArgumentException("예치 금액은 0보다 커야 합니다");
        }
        return new Rsvp(eventId, participant, stake);
    }

    /**
     * 체크인 처리
     * STAKED → SETTLED
     */
    void settle() {
        if (!status.canTransitionTo(RsvpStatus.SETTLED)) {
            throw new IllegalStateException(
                    String.format("현재 상태[%s]에서는 체크인할 수 없습니다", status.getDisplayName())
            );
        }
        if (forfeited) {
            throw new IllegalStateException("이미 주최자에게 정산된 예치금입니다");
        }
        this.status = RsvpStatus.SETTLED;
    }

    // 환급 실패 시 되돌리기
    void revertSettlement() {
        if (status != RsvpStatus.SETTLED) {
            throw new IllegalStateException("체크인되지 않은 예약은 되돌릴 수 없습니다");
        }
        this.status = RsvpStatus.STAKED;
    }

    void forfeit() {
        if (!isEscrowed()) {
            throw new IllegalStateException("예치 중인 예약만 정산할 수 있습니다");
        }
        this.forfeited = true;
    }

    void revertForfeit() {
        this.forfeited = false;
    }

    /**
     * 예치금이 아직 이벤트 잔액에 남아 있는지 여부
     */
    public boolean isEscrowed() {
        return status == RsvpStatus.STAKED && !forfeited;
    }

    public Money getStake() { return stake; }
    public RsvpStatus getStatus() { return status; }
    public boolean isForfeited() { return forfeited; }

    @Override
    public String toString() {
        return String.format("Rsvp{eventId=%d, participant=%s, stake=%s, status=%s, forfeited=%s}",
                eventId, participant, stake, status, forfeited);
    }
}
