package kr.hhplus.be.staking.application.event;

/**
 * 체크인 완료 알림 - 환급 이체까지 끝난 뒤 발행
 */
public record CheckedInEvent(long eventId, String participant) {

    public static CheckedInEvent of(long eventId, String participant) {
        return new CheckedInEvent(eventId, participant);
    }
}
