package kr.hhplus.be.staking.infrastructure.web.wallet;

import kr.hhplus.be.staking.application.port.in.WalletUseCase;
import kr.hhplus.be.staking.infrastructure.web.wallet.dto.ChargeRequest;
import kr.hhplus.be.staking.infrastructure.web.wallet.dto.WalletBalanceResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/wallets")
@RequiredArgsConstructor
@Validated
public class WalletController {

    private final WalletUseCase walletUseCase;

    @PostMapping("/charge")
    public ResponseEntity<WalletBalanceResponse> charge(@RequestBody @Validated ChargeRequest request) {
        var result = walletUseCase.charge(
                new WalletUseCase.ChargeCommand(request.participantId(), request.amount()));
        return ResponseEntity.ok(new WalletBalanceResponse(result.participant(), result.balance()));
    }

    @GetMapping("/{participantId}")
    public ResponseEntity<WalletBalanceResponse> getBalance(@PathVariable String participantId) {
        return ResponseEntity.ok(new WalletBalanceResponse(participantId, walletUseCase.balanceOf(participantId)));
    }
}
