package com.flagship.trade_ledger.voucher;

import com.flagship.trade_ledger.exception.VoucherValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape checks for a voucher draft, run before anything is stored or posted.
 *
 * Payment/Receipt: at least one party, each with an id, a type and a positive
 * amount, plus the cash/bank account; no entries.
 * Journal/Contra: at least one entry, each naming an account with
 * non-negative amounts and a non-zero amount on at least one side; no
 * parties; total debit equals total credit within 0.01.
 */
@Component
public class VoucherValidator {

    static final BigDecimal BALANCE_TOLERANCE = new BigDecimal("0.01");

    public void validate(VoucherDraft draft) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (draft.getVoucherType() == null) {
            errors.put("voucher_type", "Voucher type is required");
            throw new VoucherValidationException("Invalid voucher", errors);
        }

        if (draft.getVoucherType().isPartyBased()) {
            validateParties(draft, errors);
        } else {
            validateEntries(draft, errors);
        }

        if (!errors.isEmpty()) {
            throw new VoucherValidationException("Invalid " + draft.getVoucherType() + " voucher", errors);
        }
    }

    private void validateParties(VoucherDraft draft, Map<String, String> errors) {
        if (draft.getAccountId() == null) {
            errors.put("account_id", "Cash/bank account is required for " + draft.getVoucherType());
        }
        if (!draft.getEntries().isEmpty()) {
            errors.put("entries", draft.getVoucherType() + " vouchers cannot carry entries");
        }
        List<VoucherParty> parties = draft.getParties();
        if (parties.isEmpty()) {
            errors.put("parties", "At least one party is required");
            return;
        }
        for (int i = 0; i < parties.size(); i++) {
            VoucherParty party = parties.get(i);
            String prefix = "parties[" + i + "]";
            if (party.getPartyId() == null) {
                errors.put(prefix + ".party_id", "Party id is required");
            }
            if (party.getPartyType() == null) {
                errors.put(prefix + ".party_type", "Party type is required");
            }
            if (party.getAmount() == null || party.getAmount().signum() <= 0) {
                errors.put(prefix + ".amount", "Amount must be greater than 0");
            }
        }
    }

    private void validateEntries(VoucherDraft draft, Map<String, String> errors) {
        if (!draft.getParties().isEmpty()) {
            errors.put("parties", draft.getVoucherType() + " vouchers cannot carry parties");
        }
        List<VoucherEntry> entries = draft.getEntries();
        if (entries.isEmpty()) {
            errors.put("entries", "At least one entry is required");
            return;
        }
        for (int i = 0; i < entries.size(); i++) {
            VoucherEntry entry = entries.get(i);
            String prefix = "entries[" + i + "]";
            if (entry.getAccount() == null || entry.getAccount().isBlank()) {
                errors.put(prefix + ".account", "Account is required");
            }
            if (isNegative(entry.getDebitAmount())) {
                errors.put(prefix + ".debit_amount", "Debit amount cannot be negative");
            }
            if (isNegative(entry.getCreditAmount())) {
                errors.put(prefix + ".credit_amount", "Credit amount cannot be negative");
            }
            if (entry.debitOrZero().signum() == 0 && entry.creditOrZero().signum() == 0) {
                errors.put(prefix, "Entry needs a debit or a credit amount");
            }
        }
        if (errors.isEmpty()) {
            BigDecimal difference = draft.totalDebit().subtract(draft.totalCredit());
            if (difference.abs().compareTo(BALANCE_TOLERANCE) > 0) {
                errors.put("entries", String.format("Total debit %s does not equal total credit %s",
                    draft.totalDebit().toPlainString(), draft.totalCredit().toPlainString()));
            }
        }
    }

    private static boolean isNegative(BigDecimal amount) {
        return amount != null && amount.signum() < 0;
    }
}
