package kr.hhplus.be.staking.application.port.in;

public interface WalletUseCase {

    record ChargeCommand(String participant, long amount) {}
    record ChargeResult(String participant, long balance) {}

    ChargeResult charge(ChargeCommand command);

    long balanceOf(String participant);

    // 엔진이 보관 중인 전체 예치금
    long escrowBalance();
}
