package com.flagship.trade_ledger.report;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/balance-sheet")
@RequiredArgsConstructor
public class BalanceSheetController {

    private final BalanceSheetService balanceSheetService;
    private final ReconciliationService reconciliationService;

    @GetMapping
    public ResponseEntity<BalanceSheet> getBalanceSheet(
            @RequestParam(name = "as_of", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return ResponseEntity.ok(balanceSheetService.balanceSheet(asOf));
    }

    @GetMapping("/reconciliation")
    public ResponseEntity<ReconciliationReport> getReconciliation() {
        return ResponseEntity.ok(reconciliationService.reconcile());
    }
}
