package com.flagship.trade_ledger.voucher;

import com.flagship.trade_ledger.account.LedgerEntity;
import com.flagship.trade_ledger.account.LedgerRepository;
import com.flagship.trade_ledger.balance.SignedBalance;
import com.flagship.trade_ledger.exception.AccountNotFoundException;
import com.flagship.trade_ledger.exception.VoucherNotFoundException;
import com.flagship.trade_ledger.exception.VoucherValidationException;
import com.flagship.trade_ledger.observability.LedgerMetrics;
import com.flagship.trade_ledger.posting.BalanceMutationService;
import com.flagship.trade_ledger.posting.BalanceUpdateReport;
import com.flagship.trade_ledger.sequence.SequenceAllocator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Voucher lifecycle ordering: what is validated, stored and reversed, and when.
 */
@ExtendWith(MockitoExtension.class)
class VoucherServiceTest {

    private static final String ACTOR = "clerk";

    @Mock
    private VoucherPersistenceService persistenceService;

    @Mock
    private BalanceMutationService balanceMutationService;

    @Mock
    private LedgerRepository ledgerRepository;

    @Mock
    private SequenceAllocator sequenceAllocator;

    private SimpleMeterRegistry registry;
    private VoucherService voucherService;

    private final UUID cashLedgerId = UUID.randomUUID();
    private final UUID vendorId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        voucherService = new VoucherService(new VoucherValidator(), persistenceService, balanceMutationService,
            ledgerRepository, sequenceAllocator, new LedgerMetrics(registry));
        ReflectionTestUtils.setField(voucherService, "zone", "UTC");
    }

    private VoucherDraft paymentDraft(String amount) {
        return VoucherDraft.builder()
            .voucherType(VoucherType.PAYMENT)
            .date(Instant.parse("2024-05-02T10:00:00Z"))
            .accountId(cashLedgerId)
            .parties(List.of(new VoucherParty(vendorId, PartyType.VENDOR, new BigDecimal(amount))))
            .build();
    }

    private Voucher stored(long number, VoucherType type, String total, boolean active) {
        BigDecimal amount = new BigDecimal(total);
        return Voucher.builder()
            .id(UUID.randomUUID())
            .voucherNumber(number)
            .voucherType(type)
            .date(Instant.parse("2024-05-02T10:00:00Z"))
            .parties(List.of(new VoucherParty(vendorId, PartyType.VENDOR, amount)))
            .accountId(cashLedgerId)
            .entries(List.of())
            .totalDebit(amount)
            .totalCredit(amount)
            .active(active)
            .createdBy(ACTOR)
            .updatedBy(ACTOR)
            .build();
    }

    private void cashLedgerExists() {
        when(ledgerRepository.findByIdAndActiveTrue(cashLedgerId))
            .thenReturn(Optional.of(LedgerEntity.register("Cash", null, SignedBalance.ZERO, ACTOR)));
    }

    @Nested
    @DisplayName("postVoucher")
    class Post {

        @Test
        @DisplayName("Invalid draft is rejected before anything is stored")
        void testInvalidDraftTouchesNothing() {
            VoucherDraft draft = VoucherDraft.builder().voucherType(VoucherType.JOURNAL).build();

            assertThrows(VoucherValidationException.class, () -> voucherService.postVoucher(draft, ACTOR));

            verify(persistenceService, never()).create(any(), anyString());
            verify(balanceMutationService, never()).apply(any(), anyString());
        }

        @Test
        @DisplayName("Missing cash account is rejected before a number is allocated")
        void testMissingCashAccount() {
            when(ledgerRepository.findByIdAndActiveTrue(cashLedgerId)).thenReturn(Optional.empty());

            assertThrows(AccountNotFoundException.class, () -> voucherService.postVoucher(paymentDraft("300"), ACTOR));

            verify(persistenceService, never()).create(any(), anyString());
        }

        @Test
        @DisplayName("Stored voucher is applied to balances and the outcome returned")
        void testPostAppliesBalances() {
            cashLedgerExists();
            Voucher saved = stored(7, VoucherType.PAYMENT, "300", true);
            when(persistenceService.create(any(VoucherDraft.class), eq(ACTOR))).thenReturn(saved);
            when(balanceMutationService.apply(saved, ACTOR)).thenReturn(BalanceUpdateReport.EMPTY);

            PostedVoucher posted = voucherService.postVoucher(paymentDraft("300"), ACTOR);

            assertSame(saved, posted.getVoucher());
            assertSame(BalanceUpdateReport.EMPTY, posted.getApplied());
            assertEquals(0, posted.getReversed().total());
            assertEquals(1.0, registry.get("ledger.voucher.posted")
                .tag("type", "PAYMENT").tag("operation", "create").counter().count());
        }
    }

    @Nested
    @DisplayName("updateVoucher")
    class Update {

        @Test
        @DisplayName("Old effect is reversed before the new effect is applied")
        void testReverseThenApply() {
            cashLedgerExists();
            Voucher previous = stored(3, VoucherType.PAYMENT, "300", true);
            Voucher updated = previous.toBuilder().totalDebit(new BigDecimal("450")).build();
            when(persistenceService.findById(previous.getId())).thenReturn(Optional.of(previous));
            when(persistenceService.update(eq(previous.getId()), any(VoucherDraft.class), eq(ACTOR))).thenReturn(updated);
            when(balanceMutationService.reverse(previous, ACTOR)).thenReturn(BalanceUpdateReport.EMPTY);
            when(balanceMutationService.apply(updated, ACTOR)).thenReturn(BalanceUpdateReport.EMPTY);

            PostedVoucher result = voucherService.updateVoucher(previous.getId(), paymentDraft("450"), ACTOR);

            assertSame(updated, result.getVoucher());
            InOrder order = inOrder(persistenceService, balanceMutationService);
            order.verify(persistenceService).update(eq(previous.getId()), any(VoucherDraft.class), eq(ACTOR));
            order.verify(balanceMutationService).reverse(previous, ACTOR);
            order.verify(balanceMutationService).apply(updated, ACTOR);
        }

        @Test
        @DisplayName("Inactive voucher cannot be edited")
        void testInactiveVoucher() {
            cashLedgerExists();
            Voucher inactive = stored(3, VoucherType.PAYMENT, "300", false);
            when(persistenceService.findById(inactive.getId())).thenReturn(Optional.of(inactive));

            assertThrows(VoucherNotFoundException.class,
                () -> voucherService.updateVoucher(inactive.getId(), paymentDraft("450"), ACTOR));

            verify(balanceMutationService, never()).reverse(any(), anyString());
        }
    }

    @Nested
    @DisplayName("deactivateVoucher")
    class Deactivate {

        @Test
        @DisplayName("Active voucher is soft-deleted and its effect reversed")
        void testDeactivate() {
            Voucher active = stored(9, VoucherType.PAYMENT, "120", true);
            Voucher deactivated = active.toBuilder().active(false).build();
            when(persistenceService.findById(active.getId())).thenReturn(Optional.of(active));
            when(persistenceService.deactivate(active.getId(), ACTOR)).thenReturn(deactivated);
            when(balanceMutationService.reverse(active, ACTOR)).thenReturn(BalanceUpdateReport.EMPTY);

            PostedVoucher result = voucherService.deactivateVoucher(active.getId(), ACTOR);

            assertFalse(result.getVoucher().isActive());
            verify(balanceMutationService).reverse(active, ACTOR);
        }

        @Test
        @DisplayName("Deactivating twice reverses only once")
        void testIdempotent() {
            Voucher inactive = stored(9, VoucherType.PAYMENT, "120", false);
            when(persistenceService.findById(inactive.getId())).thenReturn(Optional.of(inactive));

            PostedVoucher result = voucherService.deactivateVoucher(inactive.getId(), ACTOR);

            assertSame(inactive, result.getVoucher());
            verify(persistenceService, never()).deactivate(any(), anyString());
            verify(balanceMutationService, never()).reverse(any(), anyString());
        }

        @Test
        @DisplayName("Unknown voucher is reported as not found")
        void testUnknown() {
            UUID unknown = UUID.randomUUID();
            when(persistenceService.findById(unknown)).thenReturn(Optional.empty());

            assertThrows(VoucherNotFoundException.class, () -> voucherService.deactivateVoucher(unknown, ACTOR));
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("Stats are grouped by type and debits equal credits")
        void testStats() {
            Voucher payment = stored(1, VoucherType.PAYMENT, "300", true);
            Voucher receipt = stored(2, VoucherType.RECEIPT, "125.50", true);
            Voucher secondPayment = stored(3, VoucherType.PAYMENT, "50", true);
            when(persistenceService.findActiveBetween(any(Instant.class), any(Instant.class)))
                .thenReturn(List.of(payment, receipt, secondPayment));

            VoucherStats stats = voucherService.voucherStats(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 31));

            assertEquals(3, stats.getCount());
            assertEquals(2, stats.getByType().get(VoucherType.PAYMENT).getCount());
            assertEquals(0, stats.getByType().get(VoucherType.PAYMENT).getTotalDebit().compareTo(new BigDecimal("350")));
            assertEquals(0, stats.getByType().get(VoucherType.JOURNAL).getCount());
            assertEquals(0, stats.balance().signum());
        }

        @Test
        @DisplayName("Date range covers whole days in the report zone")
        void testListRange() {
            when(persistenceService.findActiveBetween(
                Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-05-31T23:59:59.999Z")))
                .thenReturn(List.of(stored(1, VoucherType.PAYMENT, "10", true), stored(2, VoucherType.RECEIPT, "5", true)));

            List<Voucher> receipts = voucherService.listVouchers(VoucherType.RECEIPT,
                LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 31));

            assertEquals(1, receipts.size());
            assertEquals(2, receipts.get(0).getVoucherNumber());
        }

        @Test
        @DisplayName("Next number is peeked from the voucher sequence")
        void testPeekNextNumber() {
            when(sequenceAllocator.peek(SequenceAllocator.VOUCHER_NUMBER)).thenReturn(42L);

            assertEquals(42L, voucherService.peekNextVoucherNumber());
        }
    }
}
