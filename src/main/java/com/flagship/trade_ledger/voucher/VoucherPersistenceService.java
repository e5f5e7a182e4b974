package com.flagship.trade_ledger.voucher;

import com.flagship.trade_ledger.exception.VoucherNotFoundException;
import com.flagship.trade_ledger.sequence.SequenceAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the voucher domain and {@link VoucherEntity}.
 *
 * Each write is one transaction. Balance updates are not part of
 * it: they run after commit so that a voucher is never lost because an
 * account update failed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoucherPersistenceService {

    private final VoucherRepository voucherRepository;
    private final SequenceAllocator sequenceAllocator;

    /**
     * Allocates the next voucher number and stores the voucher.
     */
    @Transactional
    public Voucher create(VoucherDraft draft, String actor) {
        long voucherNumber = sequenceAllocator.next(SequenceAllocator.VOUCHER_NUMBER);
        Voucher voucher = Voucher.builder()
            .id(UUID.randomUUID())
            .voucherNumber(voucherNumber)
            .voucherType(draft.getVoucherType())
            .date(draft.getDate() != null ? draft.getDate() : Instant.now())
            .parties(List.copyOf(draft.getParties()))
            .accountId(draft.getVoucherType().isPartyBased() ? draft.getAccountId() : null)
            .entries(List.copyOf(draft.getEntries()))
            .totalDebit(draft.totalDebit())
            .totalCredit(draft.totalCredit())
            .narration(draft.getNarration())
            .active(true)
            .createdBy(actor)
            .updatedBy(actor)
            .build();

        VoucherEntity saved = voucherRepository.save(VoucherEntity.fromDomain(voucher));
        log.debug("Saved voucher {} with number {}", saved.getId(), voucherNumber);
        return saved.toDomain();
    }

    /**
     * Replaces the shape of an active voucher. The number is preserved.
     */
    @Transactional
    public Voucher update(UUID voucherId, VoucherDraft draft, String actor) {
        VoucherEntity existing = loadActive(voucherId);
        Voucher edited = existing.toDomain().toBuilder()
            .voucherType(draft.getVoucherType())
            .date(draft.getDate() != null ? draft.getDate() : existing.getDate())
            .parties(List.copyOf(draft.getParties()))
            .accountId(draft.getVoucherType().isPartyBased() ? draft.getAccountId() : null)
            .entries(List.copyOf(draft.getEntries()))
            .totalDebit(draft.totalDebit())
            .totalCredit(draft.totalCredit())
            .narration(draft.getNarration())
            .updatedBy(actor)
            .build();

        existing.updateFromDomain(edited);
        VoucherEntity updated = voucherRepository.save(existing);
        log.debug("Updated voucher {}", updated.getId());
        return updated.toDomain();
    }

    /**
     * Soft-deletes a voucher.
     */
    @Transactional
    public Voucher deactivate(UUID voucherId, String actor) {
        VoucherEntity existing = loadActive(voucherId);
        existing.deactivate(actor);
        VoucherEntity saved = voucherRepository.save(existing);
        log.debug("Deactivated voucher {}", saved.getId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Voucher> findById(UUID voucherId) {
        return voucherRepository.findById(voucherId).map(VoucherEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Voucher> findActiveBetween(Instant from, Instant to) {
        return voucherRepository.findAllByActiveTrueAndDateBetweenOrderByVoucherNumberAsc(from, to).stream()
            .map(VoucherEntity::toDomain)
            .toList();
    }

    private VoucherEntity loadActive(UUID voucherId) {
        return voucherRepository.findById(voucherId)
            .filter(VoucherEntity::isActive)
            .orElseThrow(() -> new VoucherNotFoundException(voucherId));
    }
}
