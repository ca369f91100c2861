package kr.hhplus.be.staking.infrastructure.web.event;

import kr.hhplus.be.staking.application.port.in.EventRegistryUseCase;
import kr.hhplus.be.staking.domain.event.EventMetadata;
import kr.hhplus.be.staking.infrastructure.web.common.Headers;
import kr.hhplus.be.staking.infrastructure.web.event.dto.CreateEventRequest;
import kr.hhplus.be.staking.infrastructure.web.event.dto.CreateEventResponse;
import kr.hhplus.be.staking.infrastructure.web.event.dto.EventMetadataResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Validated
public class EventController {

    private final EventRegistryUseCase eventRegistryUseCase;

    // 이벤트 등록 API
    @PostMapping
    public ResponseEntity<CreateEventResponse> createEvent(
            @RequestHeader(Headers.USER_ID) String userId,
            @RequestBody @Validated CreateEventRequest request) {

        var command = new EventRegistryUseCase.CreateEventCommand(
                userId,
                request.name(),
                request.capacity(),
                request.price(),
                request.startTime(),
                request.duration()
        );

        var result = eventRegistryUseCase.createEvent(command);

        return ResponseEntity.status(HttpStatus.CREATED).body(new CreateEventResponse(result.eventId()));
    }

    // 이벤트 메타데이터 조회 API - 없는 이벤트도 200과 빈 값으로 응답
    @GetMapping("/{eventId}")
    public ResponseEntity<EventMetadataResponse> getEventMetadata(@PathVariable long eventId) {
        EventMetadata metadata = eventRegistryUseCase.getEventMetadata(eventId);
        return ResponseEntity.ok(new EventMetadataResponse(metadata.name(), metadata.owner()));
    }
}
