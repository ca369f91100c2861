package kr.hhplus.be.staking.infrastructure.web.common;

public final class Headers {

    // 인증 계층이 채워 넣는 호출자 식별자
    public static final String USER_ID = "X-User-Id";

    private Headers() {
    }
}
