package com.flagship.trade_ledger.voucher;

import com.flagship.trade_ledger.account.CustomerEntity;
import com.flagship.trade_ledger.account.CustomerRepository;
import com.flagship.trade_ledger.account.LedgerEntity;
import com.flagship.trade_ledger.account.LedgerRepository;
import com.flagship.trade_ledger.account.VendorEntity;
import com.flagship.trade_ledger.account.VendorRepository;
import com.flagship.trade_ledger.balance.SignedBalance;
import com.flagship.trade_ledger.posting.BalanceUpdateResult;
import com.flagship.trade_ledger.report.AccountDrift;
import com.flagship.trade_ledger.report.ReconciliationReport;
import com.flagship.trade_ledger.report.ReconciliationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end voucher posting: the voucher is stored and live outstanding
 * balances move on the right side.
 *
 * Polarity under test:
 * - Payment debits each party and credits the cash/bank ledger
 * - Receipt credits each party and debits the cash/bank ledger
 * - Edits and deactivations back out the earlier effect exactly
 */
@SpringBootTest
@Testcontainers
class VoucherPostingIntegrationTest {

    private static final String ACTOR = "accountant";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_vouchers")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private VoucherService voucherService;

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private LedgerRepository ledgerRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private VendorRepository vendorRepository;

    private String suffix;
    private LedgerEntity cash;
    private LedgerEntity expenses;
    private CustomerEntity customer;

    @BeforeEach
    void setUp() {
        suffix = UUID.randomUUID().toString().substring(0, 8);
        cash = ledgerRepository.save(LedgerEntity.register("Cash " + suffix, null, SignedBalance.ZERO, ACTOR));
        expenses = ledgerRepository.save(LedgerEntity.register("Office Expenses " + suffix, null, SignedBalance.ZERO, ACTOR));
        customer = customerRepository.save(CustomerEntity.register("Green Mart " + suffix, "R. Iyer", null,
            SignedBalance.ZERO, ACTOR));
    }

    private SignedBalance ledgerBalance(LedgerEntity ledger) {
        return ledgerRepository.findById(ledger.getId()).orElseThrow().getOutstanding();
    }

    private SignedBalance customerBalance(CustomerEntity entity) {
        return customerRepository.findById(entity.getId()).orElseThrow().getOutstanding();
    }

    private static SignedBalance debit(String amount) {
        return SignedBalance.debit(new BigDecimal(amount));
    }

    private static SignedBalance credit(String amount) {
        return SignedBalance.credit(new BigDecimal(amount));
    }

    private VoucherDraft payment(PartyType partyType, UUID partyId, String amount) {
        return partyVoucher(VoucherType.PAYMENT, partyType, partyId, amount);
    }

    private VoucherDraft receipt(PartyType partyType, UUID partyId, String amount) {
        return partyVoucher(VoucherType.RECEIPT, partyType, partyId, amount);
    }

    private VoucherDraft partyVoucher(VoucherType type, PartyType partyType, UUID partyId, String amount) {
        return VoucherDraft.builder()
            .voucherType(type)
            .accountId(cash.getId())
            .parties(List.of(new VoucherParty(partyId, partyType, new BigDecimal(amount))))
            .narration("integration test")
            .build();
    }

    @Test
    @DisplayName("Payment debits the party and credits the cash ledger")
    void testPaymentPolarity() {
        // When: paying 300 to an expense ledger from cash
        PostedVoucher posted = voucherService.postVoucher(payment(PartyType.LEDGER, expenses.getId(), "300"), ACTOR);

        // Then: both accounts move and the voucher is stored
        assertEquals(debit("300"), ledgerBalance(expenses));
        assertEquals(credit("300"), ledgerBalance(cash));
        assertEquals(2, posted.getApplied().getApplied().size());
        assertTrue(posted.getVoucher().isActive());
        assertEquals(0, posted.getVoucher().getTotalDebit().compareTo(new BigDecimal("300")));
        assertEquals(ACTOR, posted.getVoucher().getCreatedBy());
    }

    @Test
    @DisplayName("Receipt credits the customer and debits the cash ledger")
    void testReceiptPolarity() {
        voucherService.postVoucher(receipt(PartyType.CUSTOMER, customer.getId(), "200"), ACTOR);

        assertEquals(credit("200"), customerBalance(customer));
        assertEquals(debit("200"), ledgerBalance(cash));
    }

    @Test
    @DisplayName("Equal payment and receipt cancel out to zero")
    void testPaymentThenReceiptCancels() {
        voucherService.postVoucher(payment(PartyType.LEDGER, expenses.getId(), "150"), ACTOR);
        voucherService.postVoucher(receipt(PartyType.LEDGER, expenses.getId(), "150"), ACTOR);

        assertEquals(SignedBalance.ZERO, ledgerBalance(expenses));
        assertEquals(SignedBalance.ZERO, ledgerBalance(cash));
    }

    @Test
    @DisplayName("Vendor payment lands on the vendor's linked ledger")
    void testVendorPartyUsesLinkedLedger() {
        VendorEntity vendor = vendorRepository.save(
            VendorEntity.registerPayable("Agro Feeds " + suffix, null, new BigDecimal("2000"), ACTOR));
        LedgerEntity vendorLedger = ledgerRepository.save(LedgerEntity.registerForVendor(
            "Agro Feeds " + suffix, null, credit("2000"), vendor.getId(), ACTOR));

        voucherService.postVoucher(payment(PartyType.VENDOR, vendor.getId(), "300"), ACTOR);

        assertEquals(credit("1700"), ledgerBalance(vendorLedger));
        assertEquals(credit("2000"), vendorRepository.findById(vendor.getId()).orElseThrow().getOutstanding());
    }

    @Test
    @DisplayName("Journal entries resolve accounts by name, case-insensitively by slug")
    void testJournalByName() {
        VoucherDraft journal = VoucherDraft.builder()
            .voucherType(VoucherType.JOURNAL)
            .entries(List.of(
                new VoucherEntry("Office Expenses " + suffix, new BigDecimal("500"), null, "rent"),
                new VoucherEntry("cash-" + suffix, null, new BigDecimal("500"), null)))
            .build();

        PostedVoucher posted = voucherService.postVoucher(journal, ACTOR);

        assertEquals(debit("500"), ledgerBalance(expenses));
        assertEquals(credit("500"), ledgerBalance(cash));
        assertTrue(posted.getApplied().getSkipped().isEmpty());
    }

    @Test
    @DisplayName("Unknown journal account is skipped while the voucher is still stored")
    void testUnknownJournalAccount() {
        VoucherDraft journal = VoucherDraft.builder()
            .voucherType(VoucherType.CONTRA)
            .entries(List.of(
                new VoucherEntry("Cash " + suffix, new BigDecimal("80"), null, null),
                new VoucherEntry("No Such Bank " + suffix, null, new BigDecimal("80"), null)))
            .build();

        PostedVoucher posted = voucherService.postVoucher(journal, ACTOR);

        assertEquals(debit("80"), ledgerBalance(cash));
        assertEquals(1, posted.getApplied().getSkipped().size());
        assertTrue(voucherService.findVoucher(posted.getVoucher().getId()).isActive());
    }

    @Test
    @DisplayName("Editing a voucher replaces its effect")
    void testUpdateReplacesEffect() {
        PostedVoucher posted = voucherService.postVoucher(payment(PartyType.LEDGER, expenses.getId(), "300"), ACTOR);

        PostedVoucher updated = voucherService.updateVoucher(posted.getVoucher().getId(),
            receipt(PartyType.CUSTOMER, customer.getId(), "120"), "supervisor");

        assertEquals(SignedBalance.ZERO, ledgerBalance(expenses));
        assertEquals(credit("120"), customerBalance(customer));
        assertEquals(debit("120"), ledgerBalance(cash));
        assertEquals(posted.getVoucher().getVoucherNumber(), updated.getVoucher().getVoucherNumber());
        assertEquals(VoucherType.RECEIPT, updated.getVoucher().getVoucherType());
        assertEquals("supervisor", updated.getVoucher().getUpdatedBy());
        assertEquals(2, updated.getReversed().getApplied().size());
    }

    @Test
    @DisplayName("Deactivating a voucher backs out its effect once")
    void testDeactivateReverses() {
        PostedVoucher posted = voucherService.postVoucher(payment(PartyType.LEDGER, expenses.getId(), "75"), ACTOR);
        UUID voucherId = posted.getVoucher().getId();

        voucherService.deactivateVoucher(voucherId, ACTOR);
        voucherService.deactivateVoucher(voucherId, ACTOR);

        assertEquals(SignedBalance.ZERO, ledgerBalance(expenses));
        assertEquals(SignedBalance.ZERO, ledgerBalance(cash));
        assertFalse(voucherService.findVoucher(voucherId).isActive());
    }

    @Test
    @DisplayName("Deactivated ledger is skipped, other accounts still update")
    void testInactivePartySkipped() {
        LedgerEntity closed = LedgerEntity.register("Closed Ledger " + suffix, null, SignedBalance.ZERO, ACTOR);
        closed.deactivate(ACTOR);
        closed = ledgerRepository.save(closed);

        PostedVoucher posted = voucherService.postVoucher(payment(PartyType.LEDGER, closed.getId(), "40"), ACTOR);

        assertEquals(1, posted.getApplied().getSkipped().size());
        assertEquals(BalanceUpdateResult.Outcome.SKIPPED, posted.getApplied().getSkipped().get(0).getOutcome());
        assertEquals(credit("40"), ledgerBalance(cash));
    }

    @Test
    @DisplayName("Voucher numbers increase with every post")
    void testNumbersIncrease() {
        long expected = voucherService.peekNextVoucherNumber();

        long first = voucherService.postVoucher(payment(PartyType.LEDGER, expenses.getId(), "1"), ACTOR)
            .getVoucher().getVoucherNumber();
        long second = voucherService.postVoucher(payment(PartyType.LEDGER, expenses.getId(), "1"), ACTOR)
            .getVoucher().getVoucherNumber();

        assertEquals(expected, first);
        assertEquals(first + 1, second);
    }

    @Test
    @DisplayName("Live balances agree with the replay after posting, editing and deactivating")
    void testReconciliationAgrees() {
        PostedVoucher edited = voucherService.postVoucher(payment(PartyType.LEDGER, expenses.getId(), "300"), ACTOR);
        voucherService.updateVoucher(edited.getVoucher().getId(), payment(PartyType.LEDGER, expenses.getId(), "350"), ACTOR);
        PostedVoucher removed = voucherService.postVoucher(receipt(PartyType.CUSTOMER, customer.getId(), "90"), ACTOR);
        voucherService.deactivateVoucher(removed.getVoucher().getId(), ACTOR);
        voucherService.postVoucher(receipt(PartyType.CUSTOMER, customer.getId(), "60"), ACTOR);

        ReconciliationReport report = reconciliationService.reconcile();

        Set<UUID> drifted = report.getDrifted().stream().map(AccountDrift::getAccountId).collect(Collectors.toSet());
        assertFalse(drifted.contains(cash.getId()), "Cash ledger drifted: " + report.getDrifted());
        assertFalse(drifted.contains(expenses.getId()), "Expense ledger drifted: " + report.getDrifted());
        assertFalse(drifted.contains(customer.getId()), "Customer drifted: " + report.getDrifted());
        assertEquals(debit("350"), ledgerBalance(expenses));
        assertEquals(credit("60"), customerBalance(customer));
    }
}
