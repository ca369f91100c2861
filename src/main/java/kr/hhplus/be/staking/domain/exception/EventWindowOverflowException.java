package kr.hhplus.be.staking.domain.exception;

// 시작 시간 + 진행 시간이 epoch 초 범위를 넘을 때
public class EventWindowOverflowException extends StakingException {
    public EventWindowOverflowException(long startTime, long duration) {
        super(StakingErrorCode.EVENT_WINDOW_OVERFLOW,
                String.format("종료 시각이 표현 가능한 범위를 넘습니다. 시작: %d, 진행: %d", startTime, duration));
    }
}
