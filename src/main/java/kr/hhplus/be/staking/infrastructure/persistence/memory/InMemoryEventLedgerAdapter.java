package kr.hhplus.be.staking.infrastructure.persistence.memory;

import kr.hhplus.be.staking.application.port.out.EventLedgerPort;
import kr.hhplus.be.staking.domain.staking.EventLedger;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Component
public class InMemoryEventLedgerAdapter implements EventLedgerPort {

    private final ConcurrentMap<Long, EventLedger> ledgers = new ConcurrentHashMap<>();

    @Override
    public EventLedger getOrCreate(long eventId) {
        return ledgers.computeIfAbsent(eventId, EventLedger::new);
    }

    @Override
    public Optional<EventLedger> find(long eventId) {
        return Optional.ofNullable(ledgers.get(eventId));
    }
}
