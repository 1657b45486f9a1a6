package com.capacityengine.api.controller;

import com.capacityengine.api.dto.CreateWalletRequest;
import com.capacityengine.currency.Wallet;
import com.capacityengine.currency.WalletService;
import com.capacityengine.ledger.LedgerEntry;
import com.capacityengine.ledger.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for wallets.
 */
@RestController
@RequestMapping("/api/v1/wallets")
@RequiredArgsConstructor
@Tag(name = "Wallets", description = "Wallet management API")
public class WalletController {

    private final WalletService walletService;
    private final LedgerService ledgerService;

    @PostMapping
    @Operation(summary = "Open a wallet")
    public ResponseEntity<Wallet> createWallet(@Valid @RequestBody CreateWalletRequest request) {
        Wallet wallet = walletService.createWallet(request.getAccountId(), request.getInitialBalance());
        return ResponseEntity.status(HttpStatus.CREATED).body(wallet);
    }

    @GetMapping
    @Operation(summary = "List wallets")
    public ResponseEntity<List<Wallet>> getWallets() {
        return ResponseEntity.ok(walletService.getAllWallets());
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "Get wallet balances")
    public ResponseEntity<Wallet> getWallet(@PathVariable String accountId) {
        return ResponseEntity.ok(walletService.getWallet(accountId));
    }

    @PostMapping("/{accountId}/deposits")
    @Operation(summary = "Deposit funds to a wallet")
    public ResponseEntity<Wallet> deposit(@PathVariable String accountId, @RequestParam long amount) {
        return ResponseEntity.ok(walletService.deposit(accountId, amount));
    }

    @GetMapping("/{accountId}/ledger")
    @Operation(summary = "Get ledger entries for a wallet")
    public ResponseEntity<List<LedgerEntry>> getLedger(@PathVariable String accountId) {
        return ResponseEntity.ok(ledgerService.getAccountLedger(accountId));
    }
}
