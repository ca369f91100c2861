package kr.hhplus.be.staking.application.service;

import kr.hhplus.be.staking.application.event.CheckedInEvent;
import kr.hhplus.be.staking.application.event.ProceedsWithdrawnEvent;
import kr.hhplus.be.staking.application.event.RsvpAddedEvent;
import kr.hhplus.be.staking.application.port.in.EventRegistryUseCase.CreateEventCommand;
import kr.hhplus.be.staking.application.port.in.StakingUseCase.CheckInCommand;
import kr.hhplus.be.staking.application.port.in.StakingUseCase.ReserveCommand;
import kr.hhplus.be.staking.application.port.in.StakingUseCase.WithdrawCommand;
import kr.hhplus.be.staking.application.port.in.WalletUseCase.ChargeCommand;
import kr.hhplus.be.staking.domain.exception.*;
import kr.hhplus.be.staking.domain.payment.InsufficientBalanceException;
import kr.hhplus.be.staking.domain.staking.RsvpStatus;
import kr.hhplus.be.staking.infrastructure.custody.WalletCustodyAdapter;
import kr.hhplus.be.staking.infrastructure.lock.EventLockManager;
import kr.hhplus.be.staking.infrastructure.persistence.memory.InMemoryEventLedgerAdapter;
import kr.hhplus.be.staking.infrastructure.persistence.memory.InMemoryStakedEventAdapter;
import kr.hhplus.be.staking.infrastructure.persistence.memory.InMemoryWalletAdapter;
import kr.hhplus.be.staking.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * 예치/체크인/정산 상태 머신 테스트
 * 인메모리 어댑터와 지갑 커스터디를 실제로 연결해서 자금 이동까지 확인한다
 */
@DisplayName("스테이킹 서비스 테스트")
class StakingServiceTest {

    static final long START = 1000;
    static final long DURATION = 2000;

    MutableClock clock = new MutableClock(500);
    ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);

    InMemoryStakedEventAdapter events = new InMemoryStakedEventAdapter();
    InMemoryEventLedgerAdapter ledgers = new InMemoryEventLedgerAdapter();
    InMemoryWalletAdapter walletStore = new InMemoryWalletAdapter();
    WalletCustodyAdapter custody = new WalletCustodyAdapter(walletStore, clock);

    EventRegistryService registry = new EventRegistryService(events, publisher);
    WalletService wallets = new WalletService(walletStore, custody, clock);
    EventLockManager lockManager = new EventLockManager(Duration.ofSeconds(1));
    StakingService sut = new StakingService(events, ledgers, lockManager, custody, publisher, clock);

    @BeforeEach
    void setUp() {
        wallets.charge(new ChargeCommand("alice", 100));
        wallets.charge(new ChargeCommand("bob", 100));
    }

    private long createEvent(long capacity, long price) {
        return registry.createEvent(
                new CreateEventCommand("organizer", "yakult event", capacity, price, START, DURATION)).eventId();
    }

    private void assertAccountingInvariant(long eventId) {
        var view = sut.getLedger(eventId);
        assertThat(ledgers.find(eventId)).hasValueSatisfying(ledger -> assertThat(ledger.isBalanced()).isTrue());
        assertThat(wallets.escrowBalance()).isEqualTo(view.escrowedBalance());
    }

    @Nested
    @DisplayName("reserve")
    class Reserve {

        @Test
        @DisplayName("없는 이벤트 - EventNotFound")
        void reserve_EventNotFound() {
            assertThatThrownBy(() -> sut.reserve(new ReserveCommand(1L, "alice", 2)))
                    .isInstanceOf(EventNotFoundException.class);
        }

        @Test
        @DisplayName("성공 - 예치금이 지갑에서 빠지고 알림 발행")
        void reserve_Success() {
            long eventId = createEvent(1, 2);

            var result = sut.reserve(new ReserveCommand(eventId, "alice", 2));

            assertThat(result.escrowedBalance()).isEqualTo(2L);
            assertThat(sut.getRsvpStatus(eventId, "alice")).isEqualTo(RsvpStatus.STAKED);
            assertThat(wallets.balanceOf("alice")).isEqualTo(98L);
            verify(publisher).publishEvent(RsvpAddedEvent.of(eventId, "alice", 2));
            assertAccountingInvariant(eventId);
        }

        @Test
        @DisplayName("금액 부족 - PriceNotMet")
        void reserve_PriceNotMet() {
            long eventId = createEvent(1, 2);

            assertThatThrownBy(() -> sut.reserve(new ReserveCommand(eventId, "alice", 1)))
                    .isInstanceOf(PriceNotMetException.class);
            assertThat(wallets.balanceOf("alice")).isEqualTo(100L);
        }

        @Test
        @DisplayName("두 번 예약 - AlreadyReserved, 이중 예치 없음")
        void reserve_Twice() {
            long eventId = createEvent(2, 2);
            sut.reserve(new ReserveCommand(eventId, "alice", 2));

            assertThatThrownBy(() -> sut.reserve(new ReserveCommand(eventId, "alice", 2)))
                    .isInstanceOf(AlreadyReservedException.class);

            assertThat(sut.getLedger(eventId).escrowedBalance()).isEqualTo(2L);
            assertThat(wallets.balanceOf("alice")).isEqualTo(98L);
        }

        @Test
        @DisplayName("정원 1에서 두 번째 참가자 - Overbooked, 잔액 2 유지")
        void reserve_Overbooked() {
            long eventId = createEvent(1, 2);
            sut.reserve(new ReserveCommand(eventId, "alice", 2));

            assertThatThrownBy(() -> sut.reserve(new ReserveCommand(eventId, "bob", 2)))
                    .isInstanceOf(OverbookedException.class);

            assertThat(sut.getLedger(eventId).escrowedBalance()).isEqualTo(2L);
            assertThat(sut.getRsvpStatus(eventId, "bob")).isEqualTo(RsvpStatus.NONE);
            assertThat(wallets.balanceOf("bob")).isEqualTo(100L);
            assertAccountingInvariant(eventId);
        }

        @Test
        @DisplayName("지갑 잔액 부족 - 연산 전체 취소")
        void reserve_InsufficientWallet() {
            long eventId = createEvent(1, 200);

            assertThatThrownBy(() -> sut.reserve(new ReserveCommand(eventId, "alice", 200)))
                    .isInstanceOf(InsufficientBalanceException.class);

            assertThat(sut.getRsvpStatus(eventId, "alice")).isEqualTo(RsvpStatus.NONE);
            assertThat(sut.getLedger(eventId).participantCount()).isZero();
            verify(publisher, never()).publishEvent(any(RsvpAddedEvent.class));
        }

        @Test
        @DisplayName("지갑이 없는 참가자 - 잔액 부족으로 실패")
        void reserve_NoWallet() {
            long eventId = createEvent(1, 2);

            assertThatThrownBy(() -> sut.reserve(new ReserveCommand(eventId, "carol", 2)))
                    .isInstanceOf(InsufficientBalanceException.class);
        }
    }

    @Nested
    @DisplayName("checkIn")
    class CheckIn {

        @Test
        @DisplayName("없는 이벤트 - EventNotFound")
        void checkIn_EventNotFound() {
            assertThatThrownBy(() -> sut.checkIn(new CheckInCommand(1L, "alice")))
                    .isInstanceOf(EventNotFoundException.class);
        }

        @Test
        @DisplayName("예약 없이 체크인 - ReservationNotFound")
        void checkIn_WithoutReservation() {
            long eventId = createEvent(1, 2);
            clock.setEpochSecond(START);

            assertThatThrownBy(() -> sut.checkIn(new CheckInCommand(eventId, "alice")))
                    .isInstanceOf(ReservationNotFoundException.class);
        }

        @Test
        @DisplayName("구간 안에서 체크인 - 2 환급, 잔액 0, SETTLED")
        void checkIn_Success() {
            long eventId = createEvent(1, 2);
            sut.reserve(new ReserveCommand(eventId, "alice", 2));
            clock.setEpochSecond(START + 10);

            var result = sut.checkIn(new CheckInCommand(eventId, "alice"));

            assertThat(result.refundedAmount()).isEqualTo(2L);
            assertThat(wallets.balanceOf("alice")).isEqualTo(100L);
            assertThat(sut.getLedger(eventId).escrowedBalance()).isZero();
            assertThat(sut.getRsvpStatus(eventId, "alice")).isEqualTo(RsvpStatus.SETTLED);
            verify(publisher).publishEvent(CheckedInEvent.of(eventId, "alice"));
            assertAccountingInvariant(eventId);
        }

        @Test
        @DisplayName("두 번째 체크인 - AlreadyCheckedIn")
        void checkIn_Twice() {
            long eventId = createEvent(1, 2);
            sut.reserve(new ReserveCommand(eventId, "alice", 2));
            clock.setEpochSecond(START);
            sut.checkIn(new CheckInCommand(eventId, "alice"));

            assertThatThrownBy(() -> sut.checkIn(new CheckInCommand(eventId, "alice")))
                    .isInstanceOf(AlreadyCheckedInException.class);
            assertThat(wallets.balanceOf("alice")).isEqualTo(100L);
        }

        @Test
        @DisplayName("시작 전 체크인 - EventNotInProgress")
        void checkIn_BeforeStart() {
            long eventId = createEvent(1, 2);
            sut.reserve(new ReserveCommand(eventId, "alice", 2));
            clock.setEpochSecond(START - 1);

            assertThatThrownBy(() -> sut.checkIn(new CheckInCommand(eventId, "alice")))
                    .isInstanceOf(EventNotInProgressException.class);
            assertThat(sut.getRsvpStatus(eventId, "alice")).isEqualTo(RsvpStatus.STAKED);
        }

        @Test
        @DisplayName("종료 시각 정각 체크인 - EventNotInProgress")
        void checkIn_AtEnd() {
            long eventId = createEvent(1, 2);
            sut.reserve(new ReserveCommand(eventId, "alice", 2));
            clock.setEpochSecond(START + DURATION);

            assertThatThrownBy(() -> sut.checkIn(new CheckInCommand(eventId, "alice")))
                    .isInstanceOf(EventNotInProgressException.class);
            assertThat(sut.getLedger(eventId).escrowedBalance()).isEqualTo(2L);
        }

        @Test
        @DisplayName("초과 납부한 참가자는 자기가 낸 금액을 그대로 환급")
        void checkIn_RefundsOwnStake() {
            long eventId = createEvent(2, 2);
            sut.reserve(new ReserveCommand(eventId, "alice", 5));
            sut.reserve(new ReserveCommand(eventId, "bob", 2));
            clock.setEpochSecond(START);

            var result = sut.checkIn(new CheckInCommand(eventId, "alice"));

            assertThat(result.refundedAmount()).isEqualTo(5L);
            assertThat(sut.getLedger(eventId).escrowedBalance()).isEqualTo(2L);
            assertAccountingInvariant(eventId);
        }

        @Test
        @DisplayName("체크인으로 자리가 비면 다른 참가자가 예약 가능")
        void checkIn_FreesSlot() {
            long eventId = createEvent(1, 2);
            sut.reserve(new ReserveCommand(eventId, "alice", 2));
            clock.setEpochSecond(START);
            sut.checkIn(new CheckInCommand(eventId, "alice"));

            var result = sut.reserve(new ReserveCommand(eventId, "bob", 2));

            assertThat(result.escrowedBalance()).isEqualTo(2L);
            assertThat(sut.getLedger(eventId).participantCount()).isEqualTo(1L);
        }
    }

    @Nested
    @DisplayName("withdrawProceeds")
    class Withdraw {

        @Test
        @DisplayName("없는 이벤트 - EventNotFound")
        void withdraw_EventNotFound() {
            assertThatThrownBy(() -> sut.withdrawProceeds(new WithdrawCommand(1L, "organizer")))
                    .isInstanceOf(EventNotFoundException.class);
        }

        @Test
        @DisplayName("예치금 없이 종료된 이벤트 - NothingToWithdraw")
        void withdraw_NothingStaked() {
            long eventId = createEvent(1, 1);
            clock.setEpochSecond(START + DURATION);

            assertThatThrownBy(() -> sut.withdrawProceeds(new WithdrawCommand(eventId, "organizer")))
                    .isInstanceOf(NothingToWithdrawException.class);
        }

        @Test
        @DisplayName("주최자가 아닌 호출자 - NotCreator")
        void withdraw_NotCreator() {
            long eventId = createEvent(10, 2);
            sut.reserve(new ReserveCommand(eventId, "alice", 2));
            clock.setEpochSecond(START + DURATION);

            assertThatThrownBy(() -> sut.withdrawProceeds(new WithdrawCommand(eventId, "bob")))
                    .isInstanceOf(NotCreatorException.class);
        }

        @Test
        @DisplayName("종료 전 정산 - EventNotEnded")
        void withdraw_BeforeEnd() {
            long eventId = createEvent(10, 2);
            sut.reserve(new ReserveCommand(eventId, "alice", 2));
            clock.setEpochSecond(START + DURATION - 1);

            assertThatThrownBy(() -> sut.withdrawProceeds(new WithdrawCommand(eventId, "organizer")))
                    .isInstanceOf(EventNotEndedException.class);
            assertThat(sut.getLedger(eventId).escrowedBalance()).isEqualTo(2L);
        }

        @Test
        @DisplayName("노쇼 2명 - 주최자가 4 수령, 두 번째 정산은 NothingToWithdraw")
        void withdraw_NoShows() {
            long eventId = createEvent(2, 2);
            sut.reserve(new ReserveCommand(eventId, "alice", 2));
            sut.reserve(new ReserveCommand(eventId, "bob", 2));
            assertThat(sut.getLedger(eventId).escrowedBalance()).isEqualTo(4L);
            clock.setEpochSecond(START + DURATION);

            var result = sut.withdrawProceeds(new WithdrawCommand(eventId, "organizer"));

            assertThat(result.amount()).isEqualTo(4L);
            assertThat(wallets.balanceOf("organizer")).isEqualTo(4L);
            assertThat(sut.getLedger(eventId).escrowedBalance()).isZero();
            verify(publisher).publishEvent(ProceedsWithdrawnEvent.of(eventId, 4));
            assertAccountingInvariant(eventId);

            assertThatThrownBy(() -> sut.withdrawProceeds(new WithdrawCommand(eventId, "organizer")))
                    .isInstanceOf(NothingToWithdrawException.class);
            assertThat(wallets.balanceOf("organizer")).isEqualTo(4L);
        }

        @Test
        @DisplayName("체크인한 참가자 몫은 정산되지 않는다")
        void withdraw_OnlyNoShowStakes() {
            long eventId = createEvent(2, 2);
            sut.reserve(new ReserveCommand(eventId, "alice", 2));
            sut.reserve(new ReserveCommand(eventId, "bob", 2));
            clock.setEpochSecond(START);
            sut.checkIn(new CheckInCommand(eventId, "alice"));
            clock.setEpochSecond(START + DURATION + 60);

            var result = sut.withdrawProceeds(new WithdrawCommand(eventId, "organizer"));

            assertThat(result.amount()).isEqualTo(2L);
            assertThat(wallets.balanceOf("alice")).isEqualTo(100L);
            assertThat(wallets.balanceOf("bob")).isEqualTo(98L);
            assertThat(wallets.escrowBalance()).isZero();
        }

        @Test
        @DisplayName("정산 후 노쇼 참가자의 체크인은 구간 밖이라 실패")
        void withdraw_ThenLateCheckIn() {
            long eventId = createEvent(1, 2);
            sut.reserve(new ReserveCommand(eventId, "alice", 2));
            clock.setEpochSecond(START + DURATION);
            sut.withdrawProceeds(new WithdrawCommand(eventId, "organizer"));

            assertThatThrownBy(() -> sut.checkIn(new CheckInCommand(eventId, "alice")))
                    .isInstanceOf(EventNotInProgressException.class);
        }
    }

    @Test
    @DisplayName("여러 이벤트에 걸쳐 예치 계정 잔액 == 이벤트 잔액 합계")
    void globalAccountingInvariant() {
        long first = createEvent(2, 2);
        long second = createEvent(2, 3);
        sut.reserve(new ReserveCommand(first, "alice", 2));
        sut.reserve(new ReserveCommand(first, "bob", 4));
        sut.reserve(new ReserveCommand(second, "alice", 3));
        clock.setEpochSecond(START);
        sut.checkIn(new CheckInCommand(first, "bob"));

        long total = sut.getLedger(first).escrowedBalance() + sut.getLedger(second).escrowedBalance();
        assertThat(total).isEqualTo(5L);
        assertThat(wallets.escrowBalance()).isEqualTo(total);
    }

    @Test
    @DisplayName("없는 이벤트 원장 조회는 실패하지 않는다")
    void query_UnknownEvent() {
        assertThat(sut.getLedger(99L).escrowedBalance()).isZero();
        assertThat(sut.getRsvpStatus(99L, "alice")).isEqualTo(RsvpStatus.NONE);
    }

    @Test
    @DisplayName("없는 이벤트 ID로 반복 호출 - 락을 만들지 않고 EventNotFound")
    void unknownEvents_DoNotCreateLocks() {
        for (long id = 1_000; id < 2_000; id++) {
            final long eventId = id;
            assertThatThrownBy(() -> sut.withdrawProceeds(new WithdrawCommand(eventId, "organizer")))
                    .isInstanceOf(EventNotFoundException.class);
            assertThatThrownBy(() -> sut.checkIn(new CheckInCommand(eventId, "alice")))
                    .isInstanceOf(EventNotFoundException.class);
            assertThatThrownBy(() -> sut.reserve(new ReserveCommand(eventId, "alice", 2)))
                    .isInstanceOf(EventNotFoundException.class);
        }
        sut.getLedger(1_500L);
        sut.getRsvpStatus(1_500L, "alice");

        assertThat(lockManager.lockCount()).isZero();
        assertThat(wallets.balanceOf("alice")).isEqualTo(100L);

        long eventId = createEvent(1, 2);
        sut.reserve(new ReserveCommand(eventId, "alice", 2));
        assertThat(lockManager.lockCount()).isEqualTo(1);
    }
}
