package com.flagship.trade_ledger.balance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sign arithmetic shared by live posting and balance sheet replay.
 */
class SignedBalanceTest {

    private static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }

    @Nested
    @DisplayName("combine")
    class Combine {

        @Test
        @DisplayName("Same side adds magnitudes")
        void testSameSideAdds() {
            SignedBalance result = SignedBalance.debit(amount("100")).combine(amount("50"), BalanceSide.DEBIT);

            assertEquals(SignedBalance.debit(amount("150")), result);
        }

        @Test
        @DisplayName("Same-side deltas give the same result in either order")
        void testSameSideOrderIndependent() {
            SignedBalance start = SignedBalance.credit(amount("40"));

            SignedBalance firstThenSecond = start
                .combine(amount("125.25"), BalanceSide.CREDIT)
                .combine(amount("9.75"), BalanceSide.CREDIT);
            SignedBalance secondThenFirst = start
                .combine(amount("9.75"), BalanceSide.CREDIT)
                .combine(amount("125.25"), BalanceSide.CREDIT);

            assertEquals(firstThenSecond, secondThenFirst);
            assertEquals(SignedBalance.credit(amount("175")), firstThenSecond);

            SignedBalance debitStart = SignedBalance.ZERO;
            assertEquals(
                debitStart.combine(amount("30"), BalanceSide.DEBIT).combine(amount("0.01"), BalanceSide.DEBIT),
                debitStart.combine(amount("0.01"), BalanceSide.DEBIT).combine(amount("30"), BalanceSide.DEBIT));
        }

        @Test
        @DisplayName("Opposite side with smaller delta keeps the original side")
        void testOppositeSideSmallerDelta() {
            SignedBalance result = SignedBalance.credit(amount("2000")).combine(amount("300"), BalanceSide.DEBIT);

            assertEquals(BalanceSide.CREDIT, result.getSide());
            assertEquals(0, result.getMagnitude().compareTo(amount("1700")));
        }

        @Test
        @DisplayName("Opposite side with larger delta flips to the delta side")
        void testOppositeSideLargerDelta() {
            SignedBalance result = SignedBalance.debit(amount("100")).combine(amount("250.50"), BalanceSide.CREDIT);

            assertEquals(SignedBalance.credit(amount("150.50")), result);
        }

        @Test
        @DisplayName("Exact cancellation rests on DEBIT")
        void testExactTieIsZeroDebit() {
            SignedBalance result = SignedBalance.credit(amount("75")).combine(amount("75"), BalanceSide.DEBIT);

            assertTrue(result.isZero());
            assertEquals(BalanceSide.DEBIT, result.getSide());
            assertEquals(SignedBalance.ZERO, result);
        }

        @Test
        @DisplayName("Zero balance takes the side of the first delta")
        void testZeroTakesDeltaSide() {
            SignedBalance result = SignedBalance.ZERO.combine(amount("40"), BalanceSide.CREDIT);

            assertEquals(SignedBalance.credit(amount("40")), result);
        }

        @Test
        @DisplayName("Negative or missing amounts are rejected")
        void testInvalidAmounts() {
            SignedBalance balance = SignedBalance.debit(amount("10"));

            assertThrows(BalanceComputationException.class, () -> balance.combine(amount("-1"), BalanceSide.DEBIT));
            assertThrows(BalanceComputationException.class, () -> balance.combine(null, BalanceSide.DEBIT));
            assertThrows(BalanceComputationException.class, () -> balance.combine(amount("1"), null));
        }
    }

    @Nested
    @DisplayName("reverse")
    class Reverse {

        @Test
        @DisplayName("Reversing an applied delta restores the original balance")
        void testReverseUndoesCombine() {
            SignedBalance original = SignedBalance.credit(amount("500"));

            SignedBalance applied = original.combine(amount("800"), BalanceSide.DEBIT);
            SignedBalance restored = applied.reverse(amount("800"), BalanceSide.DEBIT);

            assertEquals(SignedBalance.debit(amount("300")), applied);
            assertEquals(original, restored);
        }
    }

    @Nested
    @DisplayName("signed conversion")
    class SignedConversion {

        @Test
        @DisplayName("DEBIT is positive and CREDIT is negative")
        void testToSigned() {
            assertEquals(0, SignedBalance.debit(amount("12.30")).toSigned().compareTo(amount("12.30")));
            assertEquals(0, SignedBalance.credit(amount("12.30")).toSigned().compareTo(amount("-12.30")));
        }

        @Test
        @DisplayName("fromSigned is the inverse of toSigned")
        void testFromSigned() {
            assertEquals(SignedBalance.credit(amount("1700")), SignedBalance.fromSigned(amount("-1700")));
            assertEquals(SignedBalance.debit(amount("5")), SignedBalance.fromSigned(amount("5")));
            assertEquals(SignedBalance.ZERO, SignedBalance.fromSigned(BigDecimal.ZERO));
        }

        @Test
        @DisplayName("Magnitudes are normalised to two decimals")
        void testScaleNormalisation() {
            assertEquals(SignedBalance.debit(amount("10")), SignedBalance.debit(amount("10.000")));
            assertEquals("10.00 DEBIT", SignedBalance.debit(amount("10")).toString());
        }

        @Test
        @DisplayName("Negative magnitudes cannot be constructed")
        void testNegativeMagnitude() {
            assertThrows(BalanceComputationException.class,
                () -> SignedBalance.of(amount("-0.01"), BalanceSide.DEBIT));
        }
    }
}
