package kr.hhplus.be.staking.domain.event;

/**
 * 이벤트 진행 구간 [startTime, startTime + duration)
 * 시간 단위는 epoch 초
 */
public record EventWindow(long startTime, long duration) {

    public EventWindow {
        if (startTime < 1 || duration < 1) {
            throw new IllegalArgumentException("시작 시간과 진행 시간은 1 이상이어야 합니다");
        }
        Math.addExact(startTime, duration);
    }

    public long endTime() {
        return startTime + duration;
    }

    // 체크인 가능 구간 여부
    public boolean isInProgress(long now) {
        return now >= startTime && now < endTime();
    }

    public boolean hasEnded(long now) {
        return now >= endTime();
    }
}
