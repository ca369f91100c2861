package kr.hhplus.be.staking.application.port.out;

import kr.hhplus.be.staking.domain.event.StakedEvent;

import java.util.Optional;

/**
 * 이벤트 레코드 저장소 포트
 */
public interface StakedEventPort {

    // 다음 이벤트 ID 발급 (1부터 단조 증가, 재사용 없음)
    long nextId();

    void save(StakedEvent event);

    Optional<StakedEvent> findById(long eventId);

    boolean exists(long eventId);
}
