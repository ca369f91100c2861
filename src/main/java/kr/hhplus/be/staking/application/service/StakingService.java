package kr.hhplus.be.staking.application.service;

import kr.hhplus.be.staking.application.event.CheckedInEvent;
import kr.hhplus.be.staking.application.event.ProceedsWithdrawnEvent;
import kr.hhplus.be.staking.application.event.RsvpAddedEvent;
import kr.hhplus.be.staking.application.port.in.StakingQueryUseCase;
import kr.hhplus.be.staking.application.port.in.StakingUseCase;
import kr.hhplus.be.staking.application.port.out.CustodyPort;
import kr.hhplus.be.staking.application.port.out.EventLedgerPort;
import kr.hhplus.be.staking.application.port.out.EventLockPort;
import kr.hhplus.be.staking.application.port.out.StakedEventPort;
import kr.hhplus.be.staking.domain.common.Money;
import kr.hhplus.be.staking.domain.common.ParticipantId;
import kr.hhplus.be.staking.domain.event.EventWindow;
import kr.hhplus.be.staking.domain.event.StakedEvent;
import kr.hhplus.be.staking.domain.exception.EventNotEndedException;
import kr.hhplus.be.staking.domain.exception.EventNotFoundException;
import kr.hhplus.be.staking.domain.exception.EventNotInProgressException;
import kr.hhplus.be.staking.domain.exception.NotCreatorException;
import kr.hhplus.be.staking.domain.payment.WalletReason;
import kr.hhplus.be.staking.domain.staking.EventLedger;
import kr.hhplus.be.staking.domain.staking.RsvpStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * 예치/환급/정산 상태 머신
 *
 * 모든 연산은 이벤트 락 안에서 "검증 → 원장 반영 → 외부 이체" 순서로 실행된다.
 * 등록되지 않은 이벤트 ID는 락을 잡기 전에 거절한다 (이벤트는 삭제되지 않으므로 이후에도 존재).
 * 이체가 실패하면 원장 반영을 되돌린 뒤 예외를 그대로 전파한다.
 * 예약은 들어오는 자금이라 수령을 먼저 하고 원장에 반영한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StakingService implements StakingUseCase, StakingQueryUseCase {

    private final StakedEventPort events;
    private final EventLedgerPort ledgers;
    private final EventLockPort eventLock;
    private final CustodyPort custody;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public ReserveResult reserve(ReserveCommand command) {
        final ParticipantId participant = ParticipantId.of(command.participant());
        final Money amount = Money.of(command.amount());

        requireRegistered(command.eventId());

        ReserveResult result = eventLock.executeWithLock(command.eventId(), () -> {
            StakedEvent event = loadEvent(command.eventId());
            EventLedger ledger = ledgers.getOrCreate(event.getId());

            ledger.checkReservable(event, participant, amount);

            // 수령 실패 시 원장은 아직 변경되지 않은 상태
            custody.collect(participant, amount, reference(event.getId(), participant));
            ledger.reserve(event, participant, amount);

            return new ReserveResult(event.getId(), participant.value(),
                    amount.amount(), ledger.getEscrowedBalance().amount());
        });

        log.info("[Staking] 예약 완료 - eventId: {}, participant: {}, amount: {}, escrowed: {}",
                result.eventId(), result.participant(), result.stakedAmount(), result.escrowedBalance());

        eventPublisher.publishEvent(RsvpAddedEvent.of(result.eventId(), result.participant(), result.stakedAmount()));
        return result;
    }

    @Override
    public CheckInResult checkIn(CheckInCommand command) {
        final ParticipantId participant = ParticipantId.of(command.participant());

        requireRegistered(command.eventId());

        CheckInResult result = eventLock.executeWithLock(command.eventId(), () -> {
            StakedEvent event = loadEvent(command.eventId());
            EventLedger ledger = ledgers.getOrCreate(event.getId());

            ledger.findSettleable(participant);

            long now = now();
            EventWindow window = event.getWindow();
            if (!window.isInProgress(now)) {
                throw new EventNotInProgressException(window.startTime(), window.endTime(), now);
            }

            // 원장 반영이 이체보다 먼저: 이체 중 재진입해도 이미 체크인된 상태가 보인다
            Money refund = ledger.settle(participant);
            try {
                custody.payout(participant, refund, WalletReason.REFUND, reference(event.getId(), participant));
            } catch (RuntimeException e) {
                ledger.revertSettlement(participant);
                log.warn("[Staking] 환급 실패로 체크인 취소 - eventId: {}, participant: {}, error: {}",
                        event.getId(), participant, e.getMessage());
                throw e;
            }

            return new CheckInResult(event.getId(), participant.value(), refund.amount());
        });

        log.info("[Staking] 체크인 완료 - eventId: {}, participant: {}, refunded: {}",
                result.eventId(), result.participant(), result.refundedAmount());

        eventPublisher.publishEvent(CheckedInEvent.of(result.eventId(), result.participant()));
        return result;
    }

    @Override
    public WithdrawResult withdrawProceeds(WithdrawCommand command) {
        final ParticipantId caller = ParticipantId.of(command.caller());

        requireRegistered(command.eventId());

        WithdrawResult result = eventLock.executeWithLock(command.eventId(), () -> {
            StakedEvent event = loadEvent(command.eventId());

            if (!event.isOwnedBy(caller)) {
                throw new NotCreatorException(event.getId(), caller.value());
            }

            long now = now();
            EventWindow window = event.getWindow();
            if (!window.hasEnded(now)) {
                throw new EventNotEndedException(window.endTime(), now);
            }

            EventLedger ledger = ledgers.getOrCreate(event.getId());
            EventLedger.Withdrawal withdrawal = ledger.drain();
            try {
                custody.payout(event.getOwner(), withdrawal.amount(), WalletReason.PROCEEDS,
                        reference(event.getId(), event.getOwner()));
            } catch (RuntimeException e) {
                ledger.revertDrain(withdrawal);
                log.warn("[Staking] 정산 이체 실패로 정산 취소 - eventId: {}, amount: {}, error: {}",
                        event.getId(), withdrawal.amount(), e.getMessage());
                throw e;
            }

            return new WithdrawResult(event.getId(), withdrawal.amount().amount());
        });

        log.info("[Staking] 정산 완료 - eventId: {}, amount: {}", result.eventId(), result.amount());

        eventPublisher.publishEvent(ProceedsWithdrawnEvent.of(result.eventId(), result.amount()));
        return result;
    }

    // === 조회 ===

    @Override
    public LedgerView getLedger(long eventId) {
        return events.findById(eventId)
                .map(event -> eventLock.executeWithLock(eventId, () -> {
                    EventLedger ledger = ledgers.getOrCreate(eventId);
                    return new LedgerView(eventId, ledger.getEscrowedBalance().amount(),
                            ledger.getStakedCount(), event.getCapacity());
                }))
                .orElse(new LedgerView(eventId, 0, 0, 0));
    }

    @Override
    public RsvpStatus getRsvpStatus(long eventId, String participant) {
        if (!events.exists(eventId)) {
            return RsvpStatus.NONE;
        }
        ParticipantId id = ParticipantId.of(participant);
        return eventLock.executeWithLock(eventId, () -> ledgers.find(eventId)
                .map(ledger -> ledger.statusOf(id))
                .orElse(RsvpStatus.NONE));
    }

    // === Private 메서드들 ===

    private void requireRegistered(long eventId) {
        if (!events.exists(eventId)) {
            throw new EventNotFoundException(eventId);
        }
    }

    private StakedEvent loadEvent(long eventId) {
        return events.findById(eventId)
                .orElseThrow(() -> new EventNotFoundException(eventId));
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static String reference(long eventId, ParticipantId participant) {
        return "event:" + eventId + ":" + participant.value();
    }
}
