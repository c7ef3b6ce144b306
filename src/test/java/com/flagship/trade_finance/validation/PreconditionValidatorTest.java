package com.flagship.trade_finance.validation;

import com.flagship.trade_finance.action.ActionRequest;
import com.flagship.trade_finance.error.ErrorKind;
import com.flagship.trade_finance.lifecycle.LifecycleStateMachine;
import com.flagship.trade_finance.offer.FundingOffer;
import com.flagship.trade_finance.reconcile.ShipmentSnapshot;
import com.flagship.trade_finance.shipment.Shipment;
import com.flagship.trade_finance.support.Shipments;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static com.flagship.trade_finance.support.Shipments.BUYER;
import static com.flagship.trade_finance.support.Shipments.HASH;
import static com.flagship.trade_finance.support.Shipments.INVESTOR;
import static com.flagship.trade_finance.support.Shipments.SELLER;
import static com.flagship.trade_finance.support.Shipments.tokens;
import static org.junit.jupiter.api.Assertions.*;

class PreconditionValidatorTest {

    private static final BigInteger RESERVE = BigInteger.TEN.pow(15);

    private final PreconditionValidator validator = new PreconditionValidator(new LifecycleStateMachine(), RESERVE);

    private static AccountSnapshot account(String account, long tokens, long allowance) {
        return AccountSnapshot.builder()
                .account(account)
                .tokenBalance(tokens(tokens))
                .allowance(tokens(allowance))
                .nativeBalance(RESERVE.multiply(BigInteger.TEN))
                .build();
    }

    private static ValidationContext context(ShipmentSnapshot snapshot, AccountSnapshot caller) {
        return ValidationContext.builder().snapshot(snapshot).caller(caller).build();
    }

    private static ValidationContext context(Shipment shipment, AccountSnapshot caller) {
        return context(Shipments.snapshot(shipment), caller);
    }

    @Nested
    @DisplayName("Pay")
    class Pay {

        private final Shipment shipment = Shipments.arrived(1000);

        @Test
        @DisplayName("Paying less than the declared value is INVALID_AMOUNT")
        void underpaymentRejected() {
            ValidationResult result = validator.validate(ActionRequest.pay(HASH, BUYER, tokens(900)),
                    context(shipment, account(BUYER, 2000, 2000)));

            assertFalse(result.isOk());
            assertEquals(ErrorKind.INVALID_AMOUNT, result.getKind());
        }

        @Test
        @DisplayName("Paying more than the declared value is INVALID_AMOUNT")
        void overpaymentRejected() {
            ValidationResult result = validator.validate(ActionRequest.pay(HASH, BUYER, tokens(1100)),
                    context(shipment, account(BUYER, 2000, 2000)));

            assertEquals(ErrorKind.INVALID_AMOUNT, result.getKind());
        }

        @Test
        @DisplayName("Exact payment with a short allowance passes and asks for approval")
        void exactPaymentNeedsApproval() {
            ValidationResult result = validator.validate(ActionRequest.pay(HASH, BUYER, tokens(1000)),
                    context(shipment, account(BUYER, 1000, 10)));

            assertTrue(result.isOk());
            assertTrue(result.isApprovalRequired());
            assertEquals(tokens(1000), result.getApprovalAmount());
        }

        @Test
        @DisplayName("Only the buyer can pay")
        void sellerCannotPay() {
            ValidationResult result = validator.validate(ActionRequest.pay(HASH, SELLER, tokens(1000)),
                    context(shipment, account(SELLER, 1000, 1000)));

            assertEquals(ErrorKind.UNAUTHORIZED, result.getKind());
        }

        @Test
        @DisplayName("Insufficient token balance is reported before the allowance")
        void balanceBeforeAllowance() {
            ValidationResult result = validator.validate(ActionRequest.pay(HASH, BUYER, tokens(1000)),
                    context(shipment, account(BUYER, 999, 0)));

            assertEquals(ErrorKind.INSUFFICIENT_BALANCE, result.getKind());
        }
    }

    @Nested
    @DisplayName("Fund")
    class Fund {

        @Test
        @DisplayName("Funding before it is enabled is refused")
        void notEnabled() {
            ValidationResult result = validator.validate(ActionRequest.fund(HASH, INVESTOR, tokens(10)),
                    context(Shipments.minted(1000), account(INVESTOR, 100, 100)));

            assertEquals(ErrorKind.FUNDING_NOT_ENABLED, result.getKind());
        }

        @Test
        @DisplayName("Funding past the declared value is refused")
        void exceedsDeclaredValue() {
            Shipment shipment = Shipments.fundingEnabled(1000).toBuilder().totalFunded(tokens(950)).build();

            ValidationResult result = validator.validate(ActionRequest.fund(HASH, INVESTOR, tokens(60)),
                    context(shipment, account(INVESTOR, 100, 100)));

            assertEquals(ErrorKind.EXCEEDS_DECLARED_VALUE, result.getKind());
        }

        @Test
        @DisplayName("A native balance below the reserve is refused")
        void nativeReserve() {
            AccountSnapshot poor = AccountSnapshot.builder()
                    .account(INVESTOR)
                    .tokenBalance(tokens(100))
                    .allowance(tokens(100))
                    .nativeBalance(BigInteger.ONE)
                    .build();

            ValidationResult result = validator.validate(ActionRequest.fund(HASH, INVESTOR, tokens(10)),
                    context(Shipments.fundingEnabled(1000), poor));

            assertEquals(ErrorKind.INSUFFICIENT_BALANCE, result.getKind());
        }

        @Test
        @DisplayName("Zero amount is INVALID_AMOUNT")
        void zeroAmount() {
            ValidationResult result = validator.validate(ActionRequest.fund(HASH, INVESTOR, BigInteger.ZERO),
                    context(Shipments.fundingEnabled(1000), account(INVESTOR, 100, 100)));

            assertEquals(ErrorKind.INVALID_AMOUNT, result.getKind());
        }

        @Test
        @DisplayName("Covered funding passes without approval")
        void passes() {
            ValidationResult result = validator.validate(ActionRequest.fund(HASH, INVESTOR, tokens(10)),
                    context(Shipments.fundingEnabled(1000), account(INVESTOR, 100, 100)));

            assertTrue(result.isOk());
            assertFalse(result.isApprovalRequired());
        }
    }

    @Nested
    @DisplayName("Offers")
    class Offers {

        private final FundingOffer open = FundingOffer.open(HASH, 0, INVESTOR, tokens(500), 1000);

        @Test
        @DisplayName("Accepting needs the investor's balance and allowance to cover the principal")
        void acceptNeedsInvestorAllowance() {
            ShipmentSnapshot snapshot = Shipments.snapshot(Shipments.fundingEnabled(1000), List.of(open), Map.of());
            ValidationContext context = ValidationContext.builder()
                    .snapshot(snapshot)
                    .caller(account(SELLER, 0, 0))
                    .offerInvestor(account(INVESTOR, 500, 499))
                    .build();

            ValidationResult result = validator.validate(ActionRequest.acceptOffer(HASH, SELLER, 0), context);

            assertEquals(ErrorKind.INSUFFICIENT_ALLOWANCE, result.getKind());
        }

        @Test
        @DisplayName("Accepting an accepted offer is ALREADY_ACCEPTED")
        void alreadyAccepted() {
            ShipmentSnapshot snapshot = Shipments.snapshot(
                    Shipments.fundingEnabled(1000).toBuilder().totalFunded(tokens(550)).build(),
                    List.of(open.accept()), Map.of(INVESTOR.toLowerCase(), tokens(550)));

            ValidationResult result = validator.validate(ActionRequest.acceptOffer(HASH, SELLER, 0),
                    context(snapshot, account(SELLER, 0, 0)));

            assertEquals(ErrorKind.ALREADY_ACCEPTED, result.getKind());
        }

        @Test
        @DisplayName("Creating an offer larger than the remaining capacity is refused")
        void createBeyondCapacity() {
            Shipment shipment = Shipments.fundingEnabled(1000).toBuilder().totalFunded(tokens(550)).build();

            ValidationResult result = validator.validate(ActionRequest.createOffer(HASH, INVESTOR, tokens(500), 0),
                    context(shipment, account(INVESTOR, 1000, 1000)));

            assertEquals(ErrorKind.EXCEEDS_DECLARED_VALUE, result.getKind());
        }
    }

    @Test
    @DisplayName("Enabling funding twice is refused")
    void enableFundingTwice() {
        ValidationResult first = validator.validate(ActionRequest.enableFunding(HASH, SELLER),
                context(Shipments.minted(1000), account(SELLER, 0, 0)));
        ValidationResult second = validator.validate(ActionRequest.enableFunding(HASH, SELLER),
                context(Shipments.fundingEnabled(1000), account(SELLER, 0, 0)));

        assertTrue(first.isOk());
        assertFalse(second.isOk());
        assertEquals(ErrorKind.UNAUTHORIZED, second.getKind());
        assertEquals("Funding is already enabled for this shipment", second.getDetail());
    }

    @Test
    @DisplayName("Redeeming needs claim tokens and repayments")
    void redeemNeedsRepayments() {
        Map<String, BigInteger> balances = Map.of(INVESTOR.toLowerCase(), tokens(550));
        Shipment unpaid = Shipments.arrived(1000);
        Shipment repaid = unpaid.toBuilder().totalRepaid(tokens(1000)).build();

        assertEquals(ErrorKind.INSUFFICIENT_BALANCE, validator.validate(ActionRequest.redeem(HASH, INVESTOR),
                context(Shipments.snapshot(unpaid, List.of(), balances), account(INVESTOR, 0, 0))).getKind());
        assertEquals(ErrorKind.INSUFFICIENT_BALANCE, validator.validate(ActionRequest.redeem(HASH, BUYER),
                context(Shipments.snapshot(repaid, List.of(), balances), account(BUYER, 0, 0))).getKind());
        assertTrue(validator.validate(ActionRequest.redeem(HASH, INVESTOR),
                context(Shipments.snapshot(repaid, List.of(), balances), account(INVESTOR, 0, 0))).isOk());
    }

    @Test
    @DisplayName("A provisional shipment is NOT_FOUND for every action")
    void provisionalIsNotFound() {
        ValidationResult result = validator.validate(ActionRequest.markReceived(HASH, BUYER),
                context(ShipmentSnapshot.provisional(Shipments.minted(1000)), account(BUYER, 0, 0)));

        assertEquals(ErrorKind.NOT_FOUND, result.getKind());
    }
}
