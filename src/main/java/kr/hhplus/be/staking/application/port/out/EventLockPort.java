package kr.hhplus.be.staking.application.port.out;

import java.util.function.Supplier;

/**
 * 이벤트 단위 배타 락 포트
 * - 같은 이벤트에 대한 예약/체크인/정산은 직렬화되어 실행된다
 * - 같은 스레드의 재진입은 허용된다
 */
public interface EventLockPort {

    <T> T executeWithLock(long eventId, Supplier<T> action);
}
