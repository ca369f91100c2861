package kr.hhplus.be.staking.application.service;

import kr.hhplus.be.staking.application.event.StakedEventCreatedEvent;
import kr.hhplus.be.staking.application.port.in.EventRegistryUseCase;
import kr.hhplus.be.staking.application.port.out.StakedEventPort;
import kr.hhplus.be.staking.domain.common.ParticipantId;
import kr.hhplus.be.staking.domain.event.EventMetadata;
import kr.hhplus.be.staking.domain.event.StakedEvent;
import kr.hhplus.be.staking.domain.payment.Wallet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class EventRegistryService implements EventRegistryUseCase {

    private final StakedEventPort events;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * 이벤트 등록
     * - 검증을 모두 통과한 뒤에만 ID를 발급하므로 실패한 등록은 ID를 소모하지 않는다
     * - 주최자 ID로 예치 계정 ID는 쓸 수 없다
     */
    @Override
    public CreateEventResult createEvent(CreateEventCommand command) {
        ParticipantId owner = ParticipantId.of(command.owner());
        // 예치 계정 ID로 등록하면 정산 지급이 항상 거절된다
        if (Wallet.isReservedId(owner.value())) {
            throw new IllegalArgumentException("예치 계정은 이벤트를 등록할 수 없습니다");
        }

        StakedEvent.validate(command.capacity(), command.price(), command.startTime(), command.duration());

        StakedEvent event = StakedEvent.create(
                events.nextId(),
                owner,
                command.name(),
                command.capacity(),
                command.price(),
                command.startTime(),
                command.duration()
        );
        events.save(event);

        log.info("[Registry] 이벤트 등록 - eventId: {}, owner: {}, capacity: {}, price: {}",
                event.getId(), owner, event.getCapacity(), event.getPrice());

        eventPublisher.publishEvent(StakedEventCreatedEvent.from(event));
        return new CreateEventResult(event.getId());
    }

    @Override
    public EventMetadata getEventMetadata(long eventId) {
        return events.findById(eventId)
                .map(StakedEvent::metadata)
                .orElse(EventMetadata.empty());
    }

    @Override
    public boolean eventExists(long eventId) {
        return events.exists(eventId);
    }
}
