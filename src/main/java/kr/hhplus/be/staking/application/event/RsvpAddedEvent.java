package kr.hhplus.be.staking.application.event;

/**
 * 예약(예치) 완료 알림
 */
public record RsvpAddedEvent(long eventId, String participant, long amount) {

    public static RsvpAddedEvent of(long eventId, String participant, long amount) {
        return new RsvpAddedEvent(eventId, participant, amount);
    }
}
