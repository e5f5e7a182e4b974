package com.flagship.trade_ledger.voucher;

import com.flagship.trade_ledger.support.Actors;
import com.flagship.trade_ledger.voucher.dto.PostedVoucherResponse;
import com.flagship.trade_ledger.voucher.dto.VoucherRequest;
import com.flagship.trade_ledger.voucher.dto.VoucherResponse;
import com.flagship.trade_ledger.voucher.dto.VoucherStatsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for vouchers.
 *
 * A post always answers 201 once the voucher is stored; per-account balance
 * update problems are listed in {@code balance_updates} instead of failing
 * the request.
 */
@RestController
@RequestMapping("/api/vouchers")
@RequiredArgsConstructor
@Slf4j
public class VoucherController {

    private final VoucherService voucherService;

    @PostMapping
    public ResponseEntity<PostedVoucherResponse> postVoucher(
            @Valid @RequestBody VoucherRequest request,
            @RequestHeader(name = Actors.HEADER, defaultValue = Actors.SYSTEM) String actor) {
        log.info("Received voucher post request: type={}, actor={}", request.getVoucherType(), actor);
        PostedVoucher posted = voucherService.postVoucher(request.toDraft(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(PostedVoucherResponse.from(posted));
    }

    @PutMapping("/{id}")
    public ResponseEntity<PostedVoucherResponse> updateVoucher(
            @PathVariable("id") UUID id,
            @Valid @RequestBody VoucherRequest request,
            @RequestHeader(name = Actors.HEADER, defaultValue = Actors.SYSTEM) String actor) {
        return ResponseEntity.ok(PostedVoucherResponse.from(voucherService.updateVoucher(id, request.toDraft(), actor)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<PostedVoucherResponse> deactivateVoucher(
            @PathVariable("id") UUID id,
            @RequestHeader(name = Actors.HEADER, defaultValue = Actors.SYSTEM) String actor) {
        return ResponseEntity.ok(PostedVoucherResponse.from(voucherService.deactivateVoucher(id, actor)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<VoucherResponse> getVoucher(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(VoucherResponse.from(voucherService.findVoucher(id)));
    }

    @GetMapping
    public ResponseEntity<List<VoucherResponse>> listVouchers(
            @RequestParam(name = "type", required = false) VoucherType type,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(voucherService.listVouchers(type, from, to).stream()
            .map(VoucherResponse::from)
            .toList());
    }

    @GetMapping("/stats")
    public ResponseEntity<VoucherStatsResponse> getStats(
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(VoucherStatsResponse.from(voucherService.voucherStats(from, to)));
    }

    @GetMapping("/next-number")
    public ResponseEntity<Map<String, Long>> peekNextNumber() {
        return ResponseEntity.ok(Map.of("voucher_number", voucherService.peekNextVoucherNumber()));
    }
}
