package com.flagship.trade_ledger.voucher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_ledger.posting.BalanceUpdateReport;
import com.flagship.trade_ledger.posting.BalanceUpdateResult;
import com.flagship.trade_ledger.voucher.PostedVoucher;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * A voucher plus the per-account outcome of its balance updates.
 */
@Value
public class PostedVoucherResponse {

    @JsonProperty("voucher")
    VoucherResponse voucher;

    @JsonProperty("balance_updates")
    BalanceUpdates balanceUpdates;

    @JsonProperty("reversed_updates")
    BalanceUpdates reversedUpdates;

    public static PostedVoucherResponse from(PostedVoucher posted) {
        return new PostedVoucherResponse(
            VoucherResponse.from(posted.getVoucher()),
            BalanceUpdates.from(posted.getApplied()),
            BalanceUpdates.from(posted.getReversed()));
    }

    @Value
    public static class BalanceUpdates {

        @JsonProperty("applied")
        List<Update> applied;

        @JsonProperty("skipped")
        List<Update> skipped;

        @JsonProperty("failed")
        List<Update> failed;

        static BalanceUpdates from(BalanceUpdateReport report) {
            return new BalanceUpdates(
                report.getApplied().stream().map(Update::from).toList(),
                report.getSkipped().stream().map(Update::from).toList(),
                report.getFailed().stream().map(Update::from).toList());
        }
    }

    @Value
    public static class Update {

        @JsonProperty("account_kind")
        String accountKind;

        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("account_name")
        String accountName;

        @JsonProperty("balance")
        BigDecimal balance;

        @JsonProperty("balance_side")
        String balanceSide;

        @JsonProperty("reason")
        String reason;

        static Update from(BalanceUpdateResult result) {
            return new Update(
                result.getKind().name(),
                result.getAccountId(),
                result.getAccountName(),
                result.getAfter() != null ? result.getAfter().getMagnitude() : null,
                result.getAfter() != null ? result.getAfter().getSide().name() : null,
                result.getReason());
        }
    }
}
