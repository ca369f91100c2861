package kr.hhplus.be.staking.application.port.out;

import kr.hhplus.be.staking.domain.staking.EventLedger;

import java.util.Optional;

/**
 * 이벤트별 예약 원장 저장소 포트
 * 반환된 원장은 이벤트 락을 잡은 상태에서만 변경한다
 */
public interface EventLedgerPort {

    EventLedger getOrCreate(long eventId);

    Optional<EventLedger> find(long eventId);
}
