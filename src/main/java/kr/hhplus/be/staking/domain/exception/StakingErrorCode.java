package kr.hhplus.be.staking.domain.exception;

public enum StakingErrorCode {

    // 조회 실패
    EVENT_NOT_FOUND(ErrorCategory.NOT_FOUND, "이벤트를 찾을 수 없습니다"),
    RESERVATION_NOT_FOUND(ErrorCategory.NOT_FOUND, "예약 내역이 없습니다"),

    // 입력 검증
    MISSING_CAPACITY(ErrorCategory.VALIDATION, "최대 참가 인원은 1 이상이어야 합니다"),
    MISSING_PRICE(ErrorCategory.VALIDATION, "무료 이벤트는 등록할 수 없습니다"),
    MISSING_START_TIME(ErrorCategory.VALIDATION, "시작 시간은 필수입니다"),
    MISSING_DURATION(ErrorCategory.VALIDATION, "진행 시간은 필수입니다"),
    EVENT_WINDOW_OVERFLOW(ErrorCategory.VALIDATION, "종료 시각이 표현 가능한 범위를 넘습니다"),
    PRICE_NOT_MET(ErrorCategory.VALIDATION, "예약 금액이 참가비보다 적습니다"),

    // 상태 충돌
    ALREADY_RESERVED(ErrorCategory.STATE_CONFLICT, "이미 예약한 이벤트입니다"),
    ALREADY_CHECKED_IN(ErrorCategory.STATE_CONFLICT, "이미 체크인했습니다"),
    OVERBOOKED(ErrorCategory.STATE_CONFLICT, "정원이 가득 찼습니다"),

    // 시간 구간
    EVENT_NOT_IN_PROGRESS(ErrorCategory.TIME_WINDOW, "진행 중인 이벤트가 아닙니다"),
    EVENT_NOT_ENDED(ErrorCategory.TIME_WINDOW, "아직 종료되지 않은 이벤트입니다"),

    // 권한
    NOT_CREATOR(ErrorCategory.AUTHORIZATION, "이벤트 주최자만 정산할 수 있습니다"),

    // 정산
    NOTHING_TO_WITHDRAW(ErrorCategory.ACCOUNTING, "정산할 금액이 없습니다");

    private final ErrorCategory category;
    private final String defaultMessage;

    StakingErrorCode(ErrorCategory category, String defaultMessage) {
        this.category = category;
        this.defaultMessage = defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
