package com.flagship.trade_ledger.balance;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A balance expressed as a non-negative magnitude and the side it rests on.
 *
 * This is the only place where debits and credits are netted against each
 * other. Both the posting path (live outstanding balances) and the replay path
 * (balance sheet) go through {@link #combine} and {@link #toSigned}, so their
 * sign semantics cannot drift apart.
 *
 * Zero is sign-agnostic and always normalised to DEBIT. When opposing amounts
 * cancel exactly, the result therefore rests on DEBIT.
 *
 * Magnitudes are kept at a scale of 2 so that equal balances compare equal.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SignedBalance {

    public static final int SCALE = 2;
    public static final SignedBalance ZERO = new SignedBalance(BigDecimal.ZERO.setScale(SCALE), BalanceSide.DEBIT);

    BigDecimal magnitude;
    BalanceSide side;

    public static SignedBalance of(BigDecimal magnitude, BalanceSide side) {
        if (magnitude == null) {
            throw new BalanceComputationException("Balance magnitude is required");
        }
        if (magnitude.signum() < 0) {
            throw new BalanceComputationException("Balance magnitude cannot be negative: " + magnitude);
        }
        BigDecimal scaled = magnitude.setScale(SCALE, RoundingMode.HALF_UP);
        if (scaled.signum() == 0) {
            return ZERO;
        }
        return new SignedBalance(scaled, side == null ? BalanceSide.DEBIT : side);
    }

    public static SignedBalance debit(BigDecimal magnitude) {
        return of(magnitude, BalanceSide.DEBIT);
    }

    public static SignedBalance credit(BigDecimal magnitude) {
        return of(magnitude, BalanceSide.CREDIT);
    }

    /**
     * Inverse of {@link #toSigned()}: non-negative values rest on DEBIT,
     * negative values on CREDIT.
     */
    public static SignedBalance fromSigned(BigDecimal signed) {
        if (signed == null) {
            throw new BalanceComputationException("Signed balance is required");
        }
        return signed.signum() >= 0
            ? of(signed, BalanceSide.DEBIT)
            : of(signed.negate(), BalanceSide.CREDIT);
    }

    /**
     * +magnitude for DEBIT, -magnitude for CREDIT.
     */
    public BigDecimal toSigned() {
        return side == BalanceSide.DEBIT ? magnitude : magnitude.negate();
    }

    /**
     * Applies a delta posted on the given side.
     *
     * Same side: magnitudes add. Opposite sides: the difference, resting on
     * the side of the larger operand (DEBIT on an exact tie).
     *
     * @throws BalanceComputationException if the amount is missing or negative
     */
    public SignedBalance combine(BigDecimal amount, BalanceSide deltaSide) {
        if (amount == null || amount.signum() < 0) {
            throw new BalanceComputationException("Delta amount must be non-negative: " + amount);
        }
        if (deltaSide == null) {
            throw new BalanceComputationException("Delta side is required");
        }
        if (deltaSide == side) {
            return of(magnitude.add(amount), side);
        }
        int comparison = magnitude.compareTo(amount);
        if (comparison == 0) {
            return ZERO;
        }
        return comparison > 0
            ? of(magnitude.subtract(amount), side)
            : of(amount.subtract(magnitude), deltaSide);
    }

    /**
     * Backs out a delta that was previously applied on the given side.
     */
    public SignedBalance reverse(BigDecimal amount, BalanceSide deltaSide) {
        if (deltaSide == null) {
            throw new BalanceComputationException("Delta side is required");
        }
        return combine(amount, deltaSide.opposite());
    }

    public boolean isZero() {
        return magnitude.signum() == 0;
    }

    @Override
    public String toString() {
        return magnitude.toPlainString() + " " + side;
    }
}
