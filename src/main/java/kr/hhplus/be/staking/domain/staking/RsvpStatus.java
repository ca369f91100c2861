package kr.hhplus.be.staking.domain.staking;

/**
 * 참가자별 예약 상태
 * NONE → STAKED → SETTLED 순서로만 진행되며 SETTLED가 최종 상태
 */
public enum RsvpStatus {

    NONE("미예약"),          // 예약 기록 없음
    STAKED("예치"),          // 참가비를 예치하고 자리를 확보
    SETTLED("체크인");       // 현장 체크인으로 예치금을 돌려받음

    private final String displayName;

    RsvpStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    // 상태 전환 가능 여부 체크
    public boolean canTransitionTo(RsvpStatus targetStatus) {
        return switch (this) {
            case NONE -> targetStatus == STAKED;
            case STAKED -> targetStatus == SETTLED;
            case SETTLED -> false; // 최종 상태
        };
    }
}
