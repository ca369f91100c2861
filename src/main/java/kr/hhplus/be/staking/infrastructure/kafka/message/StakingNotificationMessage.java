package kr.hhplus.be.staking.infrastructure.kafka.message;

import kr.hhplus.be.staking.application.event.CheckedInEvent;
import kr.hhplus.be.staking.application.event.ProceedsWithdrawnEvent;
import kr.hhplus.be.staking.application.event.RsvpAddedEvent;
import kr.hhplus.be.staking.application.event.StakedEventCreatedEvent;

import java.time.Instant;

public record StakingNotificationMessage(
        String eventType,      // "EVENT_CREATED" | "RSVP_ADDED" | "CHECKED_IN" | "PROCEEDS_WITHDRAWN"
        long eventId,
        String participant,    // 참가자 또는 주최자
        String name,
        Long amount,
        Long capacity,
        Long price,
        Long startTime,
        Long duration,
        Instant occurredAt
) {
    public static StakingNotificationMessage created(StakedEventCreatedEvent event, Instant occurredAt) {
        return new StakingNotificationMessage(
                "EVENT_CREATED",
                event.eventId(),
                event.owner(),
                event.name(),
                null,
                event.capacity(),
                event.price(),
                event.startTime(),
                event.duration(),
                occurredAt
        );
    }

    public static StakingNotificationMessage rsvpAdded(RsvpAddedEvent event, Instant occurredAt) {
        return new StakingNotificationMessage(
                "RSVP_ADDED",
                event.eventId(),
                event.participant(),
                null,
                event.amount(),
                null, null, null, null,
                occurredAt
        );
    }

    public static StakingNotificationMessage checkedIn(CheckedInEvent event, Instant occurredAt) {
        return new StakingNotificationMessage(
                "CHECKED_IN",
                event.eventId(),
                event.participant(),
                null,
                null,
                null, null, null, null,
                occurredAt
        );
    }

    public static StakingNotificationMessage withdrawn(ProceedsWithdrawnEvent event, Instant occurredAt) {
        return new StakingNotificationMessage(
                "PROCEEDS_WITHDRAWN",
                event.eventId(),
                null,
                null,
                event.amount(),
                null, null, null, null,
                occurredAt
        );
    }
}
