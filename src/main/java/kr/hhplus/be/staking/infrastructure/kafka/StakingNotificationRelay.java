package kr.hhplus.be.staking.infrastructure.kafka;

import kr.hhplus.be.staking.application.event.CheckedInEvent;
import kr.hhplus.be.staking.application.event.ProceedsWithdrawnEvent;
import kr.hhplus.be.staking.application.event.RsvpAddedEvent;
import kr.hhplus.be.staking.application.event.StakedEventCreatedEvent;
import kr.hhplus.be.staking.infrastructure.kafka.message.StakingNotificationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * 스테이킹 알림을 외부(Kafka)로 중계
 * - 연산은 이미 완료된 뒤이므로 발행 실패는 로그만 남기고 삼킨다
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "staking.notification.kafka", name = "enabled", havingValue = "true")
public class StakingNotificationRelay {

    private final StakingKafkaProducer producer;
    private final Clock clock;

    @EventListener
    public void onEventCreated(StakedEventCreatedEvent event) {
        relay(StakingNotificationMessage.created(event, now()));
    }

    @EventListener
    public void onRsvpAdded(RsvpAddedEvent event) {
        relay(StakingNotificationMessage.rsvpAdded(event, now()));
    }

    @EventListener
    public void onCheckedIn(CheckedInEvent event) {
        relay(StakingNotificationMessage.checkedIn(event, now()));
    }

    @EventListener
    public void onProceedsWithdrawn(ProceedsWithdrawnEvent event) {
        relay(StakingNotificationMessage.withdrawn(event, now()));
    }

    private void relay(StakingNotificationMessage message) {
        try {
            producer.send(message);
        } catch (Exception e) {
            log.error("⚠️ [Kafka] 알림 중계 실패 - eventType: {}, eventId: {}, error: {}",
                    message.eventType(), message.eventId(), e.getMessage(), e);
        }
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
