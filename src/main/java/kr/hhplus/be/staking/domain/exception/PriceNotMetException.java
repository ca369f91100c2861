package kr.hhplus.be.staking.domain.exception;

public class PriceNotMetException extends StakingException {

    public PriceNotMetException(long price, long amountSent) {
        super(StakingErrorCode.PRICE_NOT_MET,
                String.format("예약 금액이 참가비보다 적습니다. 참가비: %,d, 보낸 금액: %,d", price, amountSent));
    }
}
