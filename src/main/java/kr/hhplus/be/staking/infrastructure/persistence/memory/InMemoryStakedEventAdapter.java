package kr.hhplus.be.staking.infrastructure.persistence.memory;

import kr.hhplus.be.staking.application.port.out.StakedEventPort;
import kr.hhplus.be.staking.domain.event.StakedEvent;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 이벤트 레코드 인메모리 저장소
 * 영속화는 외부 협력자 몫이라 프로세스 수명 동안만 보관한다
 */
@Component
public class InMemoryStakedEventAdapter implements StakedEventPort {

    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentMap<Long, StakedEvent> store = new ConcurrentHashMap<>();

    @Override
    public long nextId() {
        return sequence.incrementAndGet();
    }

    @Override
    public void save(StakedEvent event) {
        StakedEvent previous = store.putIfAbsent(event.getId(), event);
        if (previous != null) {
            throw new IllegalStateException("이미 등록된 이벤트 ID입니다: " + event.getId());
        }
    }

    @Override
    public Optional<StakedEvent> findById(long eventId) {
        return Optional.ofNullable(store.get(eventId));
    }

    @Override
    public boolean exists(long eventId) {
        return store.containsKey(eventId);
    }
}
