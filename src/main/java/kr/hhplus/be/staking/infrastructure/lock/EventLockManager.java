package kr.hhplus.be.staking.infrastructure.lock;

import kr.hhplus.be.staking.application.port.out.EventLockPort;
import kr.hhplus.be.staking.infrastructure.config.StakingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 프로세스 내 이벤트 단위 락
 * - 이벤트 ID마다 ReentrantLock 하나
 * - 대기 시간 안에 획득하지 못하면 LockAcquisitionException
 * - 락은 등록된 이벤트에 대해서만 만들어진다 (호출자가 먼저 존재를 확인)
 * - 이벤트는 삭제되지 않으므로 락도 제거하지 않는다
 */
@Slf4j
@Component
public class EventLockManager implements EventLockPort {

    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration waitTimeout;

    @Autowired
    public EventLockManager(StakingProperties properties) {
        this(properties.getLock().getWaitTimeout());
    }

    public EventLockManager(Duration waitTimeout) {
        this.waitTimeout = waitTimeout;
    }

    /**
     * 락을 획득하고 작업을 실행
     *
     * @param eventId 이벤트 ID
     * @param action 실행할 작업
     * @return 작업 결과
     */
    @Override
    public <T> T executeWithLock(long eventId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(eventId, id -> new ReentrantLock());

        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("락 대기 중 인터럽트 발생: eventId = " + eventId, e);
        }

        if (!acquired) {
            throw LockAcquisitionException.of(eventId, waitTimeout.toMillis());
        }

        try {
            log.debug("락 획득 성공: eventId={}, holdCount={}", eventId, lock.getHoldCount());
            return action.get();
        } finally {
            lock.unlock();
            log.debug("락 해제: eventId={}", eventId);
        }
    }

    public int lockCount() {
        return locks.size();
    }

    public boolean isLocked(long eventId) {
        ReentrantLock lock = locks.get(eventId);
        return lock != null && lock.isLocked();
    }
}
