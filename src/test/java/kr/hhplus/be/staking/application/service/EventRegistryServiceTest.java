package kr.hhplus.be.staking.application.service;

import kr.hhplus.be.staking.application.event.StakedEventCreatedEvent;
import kr.hhplus.be.staking.application.port.in.EventRegistryUseCase.CreateEventCommand;
import kr.hhplus.be.staking.domain.event.EventMetadata;
import kr.hhplus.be.staking.domain.exception.EventWindowOverflowException;
import kr.hhplus.be.staking.domain.exception.MissingCapacityException;
import kr.hhplus.be.staking.domain.exception.MissingDurationException;
import kr.hhplus.be.staking.domain.exception.MissingPriceException;
import kr.hhplus.be.staking.domain.exception.MissingStartTimeException;
import kr.hhplus.be.staking.domain.payment.Wallet;
import kr.hhplus.be.staking.infrastructure.persistence.memory.InMemoryStakedEventAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("이벤트 등록 서비스 테스트")
class EventRegistryServiceTest {

    ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
    EventRegistryService sut;

    @BeforeEach
    void setUp() {
        sut = new EventRegistryService(new InMemoryStakedEventAdapter(), publisher);
    }

    private CreateEventCommand command(String name, long capacity, long price, long start, long duration) {
        return new CreateEventCommand("user1", name, capacity, price, start, duration);
    }

    @Test
    @DisplayName("등록 후 첫 ID는 1, 메타데이터는 (이름, 주최자)")
    void createEvent_FirstIdIsOne() {
        var result = sut.createEvent(command("yakult event", 1, 1, 1000, 2000));

        assertThat(result.eventId()).isEqualTo(1L);
        assertThat(sut.getEventMetadata(1L)).isEqualTo(new EventMetadata("yakult event", "user1"));
        assertThat(sut.eventExists(1L)).isTrue();
    }

    @Test
    @DisplayName("등록 알림에 모든 필드와 ID가 담긴다")
    void createEvent_PublishesCreatedEvent() {
        sut.createEvent(command("yakult event", 1, 1, 1000, 2000));

        verify(publisher).publishEvent(new StakedEventCreatedEvent(1L, "user1", "yakult event", 1, 1, 1000, 2000));
    }

    @Test
    @DisplayName("두 번째 등록은 ID 2")
    void createEvent_IncrementsId() {
        sut.createEvent(command("yakult event", 1, 1, 1000, 2000));
        var second = sut.createEvent(command("another event", 1, 1, 1000, 2000));

        assertThat(second.eventId()).isEqualTo(2L);
        assertThat(sut.getEventMetadata(2L)).isEqualTo(new EventMetadata("another event", "user1"));
    }

    @Test
    @DisplayName("실패한 등록은 ID를 소모하지 않고 알림도 없다")
    void createEvent_FailureDoesNotConsumeId() {
        sut.createEvent(command("first", 1, 1, 1000, 2000));

        assertThatThrownBy(() -> sut.createEvent(command("broken", 0, 1, 1000, 2000)))
                .isInstanceOf(MissingCapacityException.class);

        var next = sut.createEvent(command("second", 1, 1, 1000, 2000));
        assertThat(next.eventId()).isEqualTo(2L);
        verify(publisher, times(2)).publishEvent(any(StakedEventCreatedEvent.class));
    }

    @Test
    @DisplayName("필드별 누락 오류")
    void createEvent_ValidationErrors() {
        assertThatThrownBy(() -> sut.createEvent(command("e", 0, 1, 1000, 2000)))
                .isInstanceOf(MissingCapacityException.class);
        assertThatThrownBy(() -> sut.createEvent(command("e", 1, 0, 1000, 2000)))
                .isInstanceOf(MissingPriceException.class);
        assertThatThrownBy(() -> sut.createEvent(command("e", 1, 1, 0, 2000)))
                .isInstanceOf(MissingStartTimeException.class);
        assertThatThrownBy(() -> sut.createEvent(command("e", 1, 1, 1000, 0)))
                .isInstanceOf(MissingDurationException.class);

        assertThat(sut.eventExists(1L)).isFalse();
        verifyNoInteractions(publisher);
    }

    @Test
    @DisplayName("없는 이벤트 조회는 실패하지 않고 빈 값")
    void getEventMetadata_Unknown() {
        EventMetadata metadata = sut.getEventMetadata(42L);

        assertThat(metadata.isEmpty()).isTrue();
        assertThat(sut.eventExists(42L)).isFalse();
    }

    @Test
    @DisplayName("주최자 없이 등록 - 잘못된 인자")
    void createEvent_BlankOwner() {
        assertThatThrownBy(() -> sut.createEvent(new CreateEventCommand(" ", "e", 1, 1, 1000, 2000)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("종료 시각 범위 초과 - 검증 오류, ID 소모 없음")
    void createEvent_WindowOverflow_DoesNotConsumeId() {
        assertThatThrownBy(() -> sut.createEvent(command("overflow", 1, 1, Long.MAX_VALUE, 1)))
                .isInstanceOf(EventWindowOverflowException.class);

        var next = sut.createEvent(command("valid", 1, 1, 1000, 2000));
        assertThat(next.eventId()).isEqualTo(1L);
    }

    @Test
    @DisplayName("예치 계정 ID로 등록 - 잘못된 인자, ID 소모 없음")
    void createEvent_EscrowOwnerRejected() {
        assertThatThrownBy(() -> sut.createEvent(
                new CreateEventCommand(Wallet.ESCROW_WALLET_ID, "e", 1, 1, 1000, 2000)))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(sut.eventExists(1L)).isFalse();
        assertThat(sut.createEvent(command("valid", 1, 1, 1000, 2000)).eventId()).isEqualTo(1L);
        verify(publisher, times(1)).publishEvent(any(StakedEventCreatedEvent.class));
    }
}
