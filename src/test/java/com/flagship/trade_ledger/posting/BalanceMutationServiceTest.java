package com.flagship.trade_ledger.posting;

import com.flagship.trade_ledger.account.AccountKind;
import com.flagship.trade_ledger.balance.BalanceComputationException;
import com.flagship.trade_ledger.balance.SignedBalance;
import com.flagship.trade_ledger.exception.AccountNotFoundException;
import com.flagship.trade_ledger.observability.LedgerMetrics;
import com.flagship.trade_ledger.voucher.PartyType;
import com.flagship.trade_ledger.voucher.Voucher;
import com.flagship.trade_ledger.voucher.VoucherEntry;
import com.flagship.trade_ledger.voucher.VoucherParty;
import com.flagship.trade_ledger.voucher.VoucherType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Per-account balance updates for posted, edited and deactivated vouchers.
 * Resolution and persistence are mocked; only the delta logic is under test.
 */
@ExtendWith(MockitoExtension.class)
class BalanceMutationServiceTest {

    private static final String ACTOR = "tester";

    @Mock
    private AccountResolver accountResolver;

    @Mock
    private AccountBalanceWriter balanceWriter;

    private SimpleMeterRegistry registry;
    private BalanceMutationService service;

    private final UUID cashLedgerId = UUID.randomUUID();
    private final ResolvedAccount cash = ResolvedAccount.ledger(cashLedgerId, "Cash");

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = new BalanceMutationService(accountResolver, balanceWriter, new LedgerMetrics(registry));
    }

    private static BigDecimal amountOf(String value) {
        BigDecimal expected = new BigDecimal(value);
        return argThat(actual -> actual != null && actual.compareTo(expected) == 0);
    }

    private static AccountBalanceWriter.BalanceChange change() {
        return new AccountBalanceWriter.BalanceChange(SignedBalance.ZERO, SignedBalance.ZERO);
    }

    private Voucher partyVoucher(VoucherType type, VoucherParty... parties) {
        return Voucher.builder()
            .id(UUID.randomUUID())
            .voucherNumber(1)
            .voucherType(type)
            .date(Instant.parse("2024-03-01T10:00:00Z"))
            .parties(List.of(parties))
            .accountId(cashLedgerId)
            .entries(List.of())
            .active(true)
            .build();
    }

    private Voucher journal(VoucherEntry... entries) {
        return Voucher.builder()
            .id(UUID.randomUUID())
            .voucherNumber(2)
            .voucherType(VoucherType.JOURNAL)
            .date(Instant.parse("2024-03-01T10:00:00Z"))
            .parties(List.of())
            .entries(List.of(entries))
            .active(true)
            .build();
    }

    private double counter(String name) {
        return registry.get(name).counter().count();
    }

    @Nested
    @DisplayName("Payment and Receipt")
    class PartyVouchers {

        @Test
        @DisplayName("Payment debits the party and credits the cash account for the party total")
        void testPaymentPolarity() {
            // Given: a vendor paid 300 and another paid 200 from Cash
            UUID vendorA = UUID.randomUUID();
            UUID vendorB = UUID.randomUUID();
            UUID ledgerA = UUID.randomUUID();
            UUID ledgerB = UUID.randomUUID();
            when(accountResolver.resolveParty(PartyType.VENDOR, vendorA)).thenReturn(ResolvedAccount.ledger(ledgerA, "A"));
            when(accountResolver.resolveParty(PartyType.VENDOR, vendorB)).thenReturn(ResolvedAccount.ledger(ledgerB, "B"));
            when(accountResolver.resolveParty(PartyType.LEDGER, cashLedgerId)).thenReturn(cash);
            when(balanceWriter.apply(any(), any(), any(), any(), any())).thenReturn(change());

            // When
            BalanceUpdateReport report = service.apply(partyVoucher(VoucherType.PAYMENT,
                new VoucherParty(vendorA, PartyType.VENDOR, new BigDecimal("300")),
                new VoucherParty(vendorB, PartyType.VENDOR, new BigDecimal("200"))), ACTOR);

            // Then
            assertEquals(3, report.getApplied().size());
            assertFalse(report.hasFailures());
            verify(balanceWriter).apply(eq(AccountKind.LEDGER), eq(ledgerA), amountOf("300"), amountOf("0"), eq(ACTOR));
            verify(balanceWriter).apply(eq(AccountKind.LEDGER), eq(ledgerB), amountOf("200"), amountOf("0"), eq(ACTOR));
            verify(balanceWriter).apply(eq(AccountKind.LEDGER), eq(cashLedgerId), amountOf("0"), amountOf("500"), eq(ACTOR));
        }

        @Test
        @DisplayName("Receipt credits the party and debits the cash account")
        void testReceiptPolarity() {
            UUID customerId = UUID.randomUUID();
            when(accountResolver.resolveParty(PartyType.CUSTOMER, customerId))
                .thenReturn(ResolvedAccount.customer(customerId, "Shop"));
            when(accountResolver.resolveParty(PartyType.LEDGER, cashLedgerId)).thenReturn(cash);
            when(balanceWriter.apply(any(), any(), any(), any(), any())).thenReturn(change());

            service.apply(partyVoucher(VoucherType.RECEIPT,
                new VoucherParty(customerId, PartyType.CUSTOMER, new BigDecimal("150"))), ACTOR);

            verify(balanceWriter).apply(eq(AccountKind.CUSTOMER), eq(customerId), amountOf("0"), amountOf("150"), eq(ACTOR));
            verify(balanceWriter).apply(eq(AccountKind.LEDGER), eq(cashLedgerId), amountOf("150"), amountOf("0"), eq(ACTOR));
        }

        @Test
        @DisplayName("Reversal swaps the debit and credit of every account")
        void testReversal() {
            UUID customerId = UUID.randomUUID();
            when(accountResolver.resolveParty(PartyType.CUSTOMER, customerId))
                .thenReturn(ResolvedAccount.customer(customerId, "Shop"));
            when(accountResolver.resolveParty(PartyType.LEDGER, cashLedgerId)).thenReturn(cash);
            when(balanceWriter.apply(any(), any(), any(), any(), any())).thenReturn(change());

            service.reverse(partyVoucher(VoucherType.RECEIPT,
                new VoucherParty(customerId, PartyType.CUSTOMER, new BigDecimal("150"))), ACTOR);

            verify(balanceWriter).apply(eq(AccountKind.CUSTOMER), eq(customerId), amountOf("150"), amountOf("0"), eq(ACTOR));
            verify(balanceWriter).apply(eq(AccountKind.LEDGER), eq(cashLedgerId), amountOf("0"), amountOf("150"), eq(ACTOR));
        }

        @Test
        @DisplayName("A party that cannot be resolved is skipped while the rest is applied")
        void testUnresolvedPartySkipped() {
            UUID unknown = UUID.randomUUID();
            when(accountResolver.resolveParty(PartyType.VENDOR, unknown))
                .thenReturn(ResolvedAccount.unresolved(unknown.toString()));
            when(accountResolver.resolveParty(PartyType.LEDGER, cashLedgerId)).thenReturn(cash);
            when(balanceWriter.apply(any(), any(), any(), any(), any())).thenReturn(change());

            BalanceUpdateReport report = service.apply(partyVoucher(VoucherType.PAYMENT,
                new VoucherParty(unknown, PartyType.VENDOR, new BigDecimal("80"))), ACTOR);

            assertEquals(1, report.getSkipped().size());
            assertEquals(1, report.getApplied().size());
            assertEquals(cashLedgerId, report.getApplied().get(0).getAccountId());
        }

        @Test
        @DisplayName("A resolver failure is treated as an unresolved account")
        void testResolverExceptionSkipped() {
            UUID vendorId = UUID.randomUUID();
            when(accountResolver.resolveParty(PartyType.VENDOR, vendorId))
                .thenThrow(new IllegalStateException("connection reset"));
            when(accountResolver.resolveParty(PartyType.LEDGER, cashLedgerId)).thenReturn(cash);
            when(balanceWriter.apply(any(), any(), any(), any(), any())).thenReturn(change());

            BalanceUpdateReport report = assertDoesNotThrow(() -> service.apply(partyVoucher(VoucherType.PAYMENT,
                new VoucherParty(vendorId, PartyType.VENDOR, new BigDecimal("80"))), ACTOR));

            assertEquals(1, report.getSkipped().size());
            assertEquals(1, report.getApplied().size());
        }
    }

    @Nested
    @DisplayName("Journal and Contra")
    class EntryVouchers {

        @Test
        @DisplayName("Entries on the same account are netted into one write")
        void testNettingPerAccount() {
            UUID capitalId = UUID.randomUUID();
            when(accountResolver.resolveByName("Cash")).thenReturn(cash);
            when(accountResolver.resolveByName("cash ")).thenReturn(ResolvedAccount.ledger(cashLedgerId, "cash "));
            when(accountResolver.resolveByName("Capital")).thenReturn(ResolvedAccount.ledger(capitalId, "Capital"));
            when(balanceWriter.apply(any(), any(), any(), any(), any())).thenReturn(change());

            BalanceUpdateReport report = service.apply(journal(
                new VoucherEntry("Cash", new BigDecimal("100"), null, null),
                new VoucherEntry("cash ", null, new BigDecimal("40"), null),
                new VoucherEntry("Capital", null, new BigDecimal("60"), null)), ACTOR);

            assertEquals(2, report.getApplied().size());
            verify(balanceWriter, times(1)).apply(eq(AccountKind.LEDGER), eq(cashLedgerId),
                amountOf("100"), amountOf("40"), eq(ACTOR));
            verify(balanceWriter).apply(eq(AccountKind.LEDGER), eq(capitalId), amountOf("0"), amountOf("60"), eq(ACTOR));
        }

        @Test
        @DisplayName("An entry with both amounts applies both sides")
        void testBothSides() {
            when(accountResolver.resolveByName("Cash")).thenReturn(cash);
            when(balanceWriter.apply(any(), any(), any(), any(), any())).thenReturn(change());

            service.apply(journal(new VoucherEntry("Cash", new BigDecimal("70"), new BigDecimal("20"), null)), ACTOR);

            verify(balanceWriter).apply(eq(AccountKind.LEDGER), eq(cashLedgerId), amountOf("70"), amountOf("20"), eq(ACTOR));
        }

        @Test
        @DisplayName("Unknown account names are skipped without writing")
        void testUnknownName() {
            when(accountResolver.resolveByName("Nowhere")).thenReturn(ResolvedAccount.unresolved("Nowhere"));

            BalanceUpdateReport report = service.apply(journal(
                new VoucherEntry("Nowhere", new BigDecimal("10"), null, null)), ACTOR);

            assertEquals(1, report.getSkipped().size());
            assertEquals("Nowhere", report.getSkipped().get(0).getAccountName());
            verify(balanceWriter, never()).apply(any(), any(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("Write failures")
    class WriteFailures {

        private final UUID capitalId = UUID.randomUUID();

        private Voucher cashToCapital() {
            return journal(
                new VoucherEntry("Cash", new BigDecimal("25"), null, null),
                new VoucherEntry("Capital", null, new BigDecimal("25"), null));
        }

        @BeforeEach
        void resolveBoth() {
            when(accountResolver.resolveByName("Cash")).thenReturn(cash);
            when(accountResolver.resolveByName("Capital")).thenReturn(ResolvedAccount.ledger(capitalId, "Capital"));
        }

        @Test
        @DisplayName("Missing account is skipped and the other account is still written")
        void testAccountNotFound() {
            when(balanceWriter.apply(eq(AccountKind.LEDGER), eq(cashLedgerId), any(), any(), any()))
                .thenThrow(new AccountNotFoundException(AccountKind.LEDGER, cashLedgerId));
            when(balanceWriter.apply(eq(AccountKind.LEDGER), eq(capitalId), any(), any(), any()))
                .thenReturn(change());

            BalanceUpdateReport report = service.apply(cashToCapital(), ACTOR);

            assertEquals(1, report.getSkipped().size());
            assertEquals(1, report.getApplied().size());
            assertFalse(report.hasFailures());
        }

        @Test
        @DisplayName("Computation error is reported as failed and counted")
        void testComputationError() {
            when(balanceWriter.apply(eq(AccountKind.LEDGER), eq(cashLedgerId), any(), any(), any()))
                .thenThrow(new BalanceComputationException("Balance magnitude cannot be negative: -1"));
            when(balanceWriter.apply(eq(AccountKind.LEDGER), eq(capitalId), any(), any(), any()))
                .thenReturn(change());

            BalanceUpdateReport report = service.apply(cashToCapital(), ACTOR);

            assertTrue(report.hasFailures());
            assertEquals(cashLedgerId, report.getFailed().get(0).getAccountId());
            assertEquals(1, report.getApplied().size());
            assertEquals(1.0, counter("ledger.computation.errors"));
        }

        @Test
        @DisplayName("Unexpected write error is reported as failed without stopping the voucher")
        void testUnexpectedError() {
            when(balanceWriter.apply(eq(AccountKind.LEDGER), eq(cashLedgerId), any(), any(), any()))
                .thenThrow(new IllegalStateException("deadlock detected"));
            when(balanceWriter.apply(eq(AccountKind.LEDGER), eq(capitalId), any(), any(), any()))
                .thenReturn(change());

            BalanceUpdateReport report = assertDoesNotThrow(() -> service.apply(cashToCapital(), ACTOR));

            assertEquals(1, report.getFailed().size());
            assertEquals("deadlock detected", report.getFailed().get(0).getReason());
            assertEquals(1, report.getApplied().size());
            assertEquals(2, report.total());
        }
    }
}
