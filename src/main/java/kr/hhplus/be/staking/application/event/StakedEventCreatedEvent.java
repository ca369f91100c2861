package kr.hhplus.be.staking.application.event;

import kr.hhplus.be.staking.domain.event.StakedEvent;

/**
 * 이벤트 등록 완료 알림
 */
public record StakedEventCreatedEvent(
        long eventId,
        String owner,
        String name,
        long capacity,
        long price,
        long startTime,
        long duration
) {
    public static StakedEventCreatedEvent from(StakedEvent event) {
        return new StakedEventCreatedEvent(
                event.getId(),
                event.getOwner().value(),
                event.getName(),
                event.getCapacity(),
                event.getPrice().amount(),
                event.getWindow().startTime(),
                event.getWindow().duration()
        );
    }
}
