package kr.hhplus.be.staking.application.port.in;

import kr.hhplus.be.staking.domain.event.EventMetadata;

public interface EventRegistryUseCase {

    record CreateEventCommand(
            String owner,
            String name,
            long capacity,
            long price,
            long startTime,
            long duration
    ) {}

    record CreateEventResult(long eventId) {}

    CreateEventResult createEvent(CreateEventCommand command);

    // 존재하지 않는 이벤트는 빈 메타데이터 반환 (실패하지 않음)
    EventMetadata getEventMetadata(long eventId);

    boolean eventExists(long eventId);
}
