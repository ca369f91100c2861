package kr.hhplus.be.staking.domain.payment;

import kr.hhplus.be.staking.domain.common.Money;

/**
 * 참가자 지갑 또는 엔진 소유 예치 계정
 * - 입출금은 한도 검사를 통과한 경우에만 잔액을 바꾼다 (실패 시 잔액 그대로)
 */
public class Wallet {

    /** 이벤트 예치금을 보관하는 엔진 소유 계정 */
    public static final String ESCROW_WALLET_ID = "__escrow__";

    private final String id;
    private Money balance = Money.zero();

    private Wallet(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("지갑 ID는 비어있을 수 없습니다");
        }
        this.id = id;
    }

    public static Wallet create(String id) {
        return new Wallet(id);
    }

    public static boolean isReservedId(String id) {
        return ESCROW_WALLET_ID.equals(id);
    }

    // 같은 지갑에 대한 동시 입출금은 직렬화
    public synchronized void deposit(Money amount) {
        requirePositive(amount);
        if (amount.amount() > Long.MAX_VALUE - balance.amount()) {
            throw BalanceLimitExceededException.of(id, amount.amount(), balance.amount());
        }
        this.balance = balance.add(amount);
    }

    public synchronized void withdraw(Money amount) {
        requirePositive(amount);
        if (balance.isLessThan(amount)) {
            throw InsufficientBalanceException.of(id, amount.amount(), balance.amount());
        }
        this.balance = balance.subtract(amount);
    }

    public String getId() { return id; }
    public synchronized Money getBalance() { return balance; }

    private static void requirePositive(Money amount) {
        if (!amount.isPositive()) {
            throw new IllegalArgumentException("입출금 금액은 0보다 커야 합니다");
        }
    }
}
