package kr.hhplus.be.staking.infrastructure.persistence.memory;

import kr.hhplus.be.staking.application.port.out.WalletPort;
import kr.hhplus.be.staking.domain.payment.Wallet;
import kr.hhplus.be.staking.domain.payment.WalletLedgerEntry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryWalletAdapter implements WalletPort {

    private final ConcurrentMap<String, Wallet> wallets = new ConcurrentHashMap<>();
    private final List<WalletLedgerEntry> ledger = new CopyOnWriteArrayList<>();

    @Override
    public Optional<Wallet> findById(String walletId) {
        return Optional.ofNullable(wallets.get(walletId));
    }

    @Override
    public Wallet getOrCreate(String walletId) {
        return wallets.computeIfAbsent(walletId, Wallet::create);
    }

    @Override
    public void saveLedgerEntry(WalletLedgerEntry entry) {
        ledger.add(entry);
    }

    @Override
    public List<WalletLedgerEntry> ledgerOf(String walletId) {
        return ledger.stream()
                .filter(entry -> entry.walletId().equals(walletId))
                .toList();
    }
}
