package kr.hhplus.be.staking.domain.event;

/**
 * 이벤트 조회용 메타데이터 (이름, 주최자)
 * 존재하지 않는 이벤트는 예외 대신 빈 값으로 표현한다
 */
public record EventMetadata(String name, String owner) {

    private static final EventMetadata EMPTY = new EventMetadata("", "");

    public static EventMetadata empty() {
        return EMPTY;
    }

    // 주최자가 비어 있으면 등록되지 않은 이벤트
    public boolean isEmpty() {
        return owner.isEmpty();
    }
}
