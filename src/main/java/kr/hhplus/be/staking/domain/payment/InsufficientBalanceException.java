package kr.hhplus.be.staking.domain.payment;

/**
 * 지갑 잔액 부족 - 출금이 거절되고 잔액은 바뀌지 않는다
 */
public class InsufficientBalanceException extends RuntimeException {

    private final String walletId;
    private final long requestedAmount;
    private final long currentBalance;

    public InsufficientBalanceException(String walletId, long requestedAmount, long currentBalance) {
        super(String.format("잔액이 부족합니다. 지갑: %s, 요청금액: %,d, 현재잔액: %,d",
                walletId, requestedAmount, currentBalance));
        this.walletId = walletId;
        this.requestedAmount = requestedAmount;
        this.currentBalance = currentBalance;
    }

    public static InsufficientBalanceException of(String walletId, long requestedAmount, long currentBalance) {
        return new InsufficientBalanceException(walletId, requestedAmount, currentBalance);
    }

    public String getWalletId() { return walletId; }
    public long getRequestedAmount() { return requestedAmount; }
    public long getCurrentBalance() { return currentBalance; }
}
