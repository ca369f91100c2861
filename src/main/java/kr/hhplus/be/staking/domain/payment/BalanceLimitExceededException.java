package kr.hhplus.be.staking.domain.payment;

/**
 * 입금 후 잔액이 표현 가능한 최대 금액을 넘는 경우 - 입금이 거절되고 잔액은 바뀌지 않는다
 */
public class BalanceLimitExceededException extends RuntimeException {

    private final String walletId;

    private BalanceLimitExceededException(String walletId, String message) {
        super(message);
        this.walletId = walletId;
    }

    public static BalanceLimitExceededException of(String walletId, long depositAmount, long currentBalance) {
        return new BalanceLimitExceededException(walletId,
                String.format("지갑 잔액 한도를 초과합니다. 지갑: %s, 입금액: %,d, 현재잔액: %,d",
                        walletId, depositAmount, currentBalance));
    }

    public String getWalletId() { return walletId; }
}
