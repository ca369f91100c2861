package kr.hhplus.be.staking.infrastructure.web.staking;

import kr.hhplus.be.staking.application.port.in.StakingQueryUseCase;
import kr.hhplus.be.staking.application.port.in.StakingUseCase;
import kr.hhplus.be.staking.infrastructure.web.common.Headers;
import kr.hhplus.be.staking.infrastructure.web.staking.dto.*;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/events/{eventId}")
@RequiredArgsConstructor
@Validated
public class StakingController {

    private final StakingUseCase stakingUseCase;
    private final StakingQueryUseCase stakingQueryUseCase;

    // 예약(예치) API
    @PostMapping("/rsvp")
    public ResponseEntity<RsvpResponse> rsvp(
            @PathVariable long eventId,
            @RequestHeader(Headers.USER_ID) String userId,
            @RequestBody @Validated RsvpRequest request) {

        var result = stakingUseCase.reserve(
                new StakingUseCase.ReserveCommand(eventId, userId, request.amount()));

        return ResponseEntity.status(201).body(new RsvpResponse(
                result.eventId(),
                result.participant(),
                result.stakedAmount(),
                result.escrowedBalance()
        ));
    }

    // 현장 체크인 API
    @PostMapping("/check-in")
    public ResponseEntity<CheckInResponse> checkIn(
            @PathVariable long eventId,
            @RequestHeader(Headers.USER_ID) String userId) {

        var result = stakingUseCase.checkIn(new StakingUseCase.CheckInCommand(eventId, userId));

        return ResponseEntity.ok(new CheckInResponse(result.eventId(), result.participant(), result.refundedAmount()));
    }

    // 주최자 정산 API
    @PostMapping("/withdraw")
    public ResponseEntity<WithdrawResponse> withdraw(
            @PathVariable long eventId,
            @RequestHeader(Headers.USER_ID) String userId) {

        var result = stakingUseCase.withdrawProceeds(new StakingUseCase.WithdrawCommand(eventId, userId));

        return ResponseEntity.ok(new WithdrawResponse(result.eventId(), result.amount()));
    }

    @GetMapping("/ledger")
    public ResponseEntity<LedgerResponse> getLedger(@PathVariable long eventId) {
        var view = stakingQueryUseCase.getLedger(eventId);
        return ResponseEntity.ok(new LedgerResponse(
                view.eventId(), view.escrowedBalance(), view.participantCount(), view.capacity()));
    }

    @GetMapping("/rsvps/{participantId}")
    public ResponseEntity<RsvpStatusResponse> getRsvpStatus(
            @PathVariable long eventId,
            @PathVariable String participantId) {

        var status = stakingQueryUseCase.getRsvpStatus(eventId, participantId);
        return ResponseEntity.ok(new RsvpStatusResponse(eventId, participantId, status.name()));
    }
}
