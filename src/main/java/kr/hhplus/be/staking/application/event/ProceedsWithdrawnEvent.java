package kr.hhplus.be.staking.application.event;

/**
 * 주최자 정산 완료 알림
 */
public record ProceedsWithdrawnEvent(long eventId, long amount) {

    public static ProceedsWithdrawnEvent of(long eventId, long amount) {
        return new ProceedsWithdrawnEvent(eventId, amount);
    }
}
