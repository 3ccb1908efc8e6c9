package com.flagship.bridge_ledger.conversion;

import com.flagship.bridge_ledger.error.InsufficientAmountException;
import com.flagship.bridge_ledger.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Fee-aware conversion between a chain token and the settlement unit.
 *
 * All amounts pivot through msats. The calculator is stateless: the quote is
 * passed with every call.
 *
 * <ul>
 *   <li>{@link #convertForward}: given a source amount, what does the recipient net?</li>
 *   <li>{@link #convertInverse}: given the net the recipient should get, what source amount is needed?</li>
 * </ul>
 */
@Component
@Slf4j
public class ConversionCalculator {

    static final int MAX_INVERSE_ITERATIONS = 8;

    private static final long SETTLEMENT_TOLERANCE_MSATS = 1_000;
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final FeeSchedule fees;
    private final long notificationThresholdMsats;

    public ConversionCalculator(FeeSchedule fees,
                                @Value("${conversion.minimum-invoice-payment-sats:250}") long minimumInvoicePaymentSats) {
        this.fees = fees;
        this.notificationThresholdMsats = minimumInvoicePaymentSats * 1000L;
    }

    public FeeSchedule getFees() {
        return fees;
    }

    /**
     * Converts {@code sourceAmount} of {@code from} into {@code to}.
     *
     * When the target is a chain token and the amount is above the notification
     * threshold, the cost of the on-chain notification is taken off before fees.
     * A chain token source converts all but its minimum unit, which comes back
     * as change, so net + fee + change is exactly the source.
     *
     * @throws ValidationException if the amount is not positive or the pair is unsupported
     * @throws InsufficientAmountException if fees exceed the amount
     * @throws com.flagship.bridge_ledger.error.ExchangeRateUnavailableException if the quote is unusable
     */
    public ConversionResult convertForward(BigDecimal sourceAmount, Currency from, Currency to, Quote quote) {
        requirePair(from, to);
        requirePositive(sourceAmount, from);
        quote.validate();

        BigDecimal amount = from.isChainToken() ? from.round(sourceAmount) : sourceAmount;
        ConversionSnapshot originalConv = ConversionSnapshot.of(amount, from, quote, fees);

        // One minimum unit of a chain token is held back and returned as the receipt
        BigDecimal toConvert = from.isChainToken() ? amount.subtract(from.minimumAmount()) : null;
        if (toConvert != null && toConvert.signum() <= 0) {
            long flatFee = fees.msatsFee(0);
            throw new InsufficientAmountException(amount, from.name(), flatFee, -flatFee);
        }
        ConversionSnapshot toConvertConv = toConvert != null
            ? ConversionSnapshot.of(toConvert, from, quote, fees)
            : originalConv;

        long available = toConvertConv.getMsats();
        long notificationMsats = 0;
        if (to.isChainToken() && available > notificationThresholdMsats) {
            notificationMsats = ConversionSnapshot.toMsats(to.minimumAmount(), to, quote);
            available -= notificationMsats;
        }

        long feeMsats = fees.msatsFee(available);
        long netMsats = available - feeMsats;
        if (netMsats < 0) {
            throw new InsufficientAmountException(amount, from.name(), feeMsats, netMsats);
        }

        ConversionSnapshot netConv = ConversionSnapshot.ofMsats(netMsats, quote, fees);
        ConversionSnapshot feeConv = ConversionSnapshot.ofMsats(feeMsats, quote, fees);
        ConversionSnapshot notificationConv = ConversionSnapshot.ofMsats(notificationMsats, quote, fees);

        ConversionResult.ConversionResultBuilder result = ConversionResult.builder()
            .from(from)
            .to(to)
            .original(amount)
            .originalConv(originalConv)
            .netConv(netConv)
            .feeConv(feeConv)
            .notificationFeeConv(notificationConv);

        if (toConvert != null) {
            BigDecimal fee = from.round(feeConv.valueIn(from));
            BigDecimal net = toConvert.subtract(fee);
            BigDecimal change = amount.subtract(net.add(fee));
            result.toConvert(toConvert)
                .toConvertConv(toConvertConv)
                .netToReceive(net)
                .fee(fee)
                .notificationFee(BigDecimal.ZERO.setScale(from.getScale()))
                .change(change)
                .changeConv(ConversionSnapshot.of(change, from, quote, fees));
        } else {
            long changeMsats = originalConv.getMsats() - (netMsats + feeMsats + notificationMsats);
            result.toConvert(fromMsats(available, from))
                .toConvertConv(ConversionSnapshot.ofMsats(available, quote, fees))
                .netToReceive(fromMsats(netMsats, from))
                .fee(fromMsats(feeMsats, from))
                .notificationFee(fromMsats(notificationMsats, from))
                .change(fromMsats(changeMsats, from))
                .changeConv(ConversionSnapshot.ofMsats(changeMsats, quote, fees));
        }

        ConversionResult converted = result.build();
        log.debug("Forward conversion: {}", converted);
        return converted;
    }

    /**
     * Finds the {@code from} amount that nets the recipient {@code targetNet} of {@code to}.
     *
     * The fee depends on the converted amount, so the required amount is found by
     * iterating {@code s = target + fee(s)}. The notification fee is added once the
     * iteration settles, and the answer is checked by converting it forward again.
     */
    public ConversionResult convertInverse(BigDecimal targetNet, Currency from, Currency to, Quote quote) {
        requirePair(from, to);
        requirePositive(targetNet, to);
        quote.validate();

        BigDecimal target = to.isChainToken() ? to.round(targetNet) : targetNet;
        long targetMsats = ConversionSnapshot.toMsats(target, to, quote);

        long required = solveRequiredMsats(targetMsats);
        ConversionResult forward = forwardFromRequired(required, from, to, quote);

        long shortfall = shortfallMsats(forward, target, targetMsats, to, quote);
        if (shortfall > 0) {
            log.debug("Inverse conversion short by {} msats for {} {}, correcting", shortfall, target, to);
            forward = forwardFromRequired(required + shortfall + fees.msatsFee(shortfall), from, to, quote);
            if (shortfallMsats(forward, target, targetMsats, to, quote) > 0) {
                throw new ValidationException(String.format(
                    "Inverse conversion of %s %s from %s did not reach its target", target, to, from));
            }
        }
        return forward;
    }

    private long solveRequiredMsats(long targetMsats) {
        long required = targetMsats;
        int iterations = 0;
        while (iterations < MAX_INVERSE_ITERATIONS) {
            iterations++;
            long next = targetMsats + fees.msatsFee(required);
            if (next == required) {
                break;
            }
            required = next;
        }
        log.debug("Inverse fee iteration settled at {} msats after {} iterations", required, iterations);
        return required;
    }

    private ConversionResult forwardFromRequired(long requiredMsats, Currency from, Currency to, Quote quote) {
        long withNotification = requiredMsats;
        if (to.isChainToken() && requiredMsats > notificationThresholdMsats) {
            withNotification += ConversionSnapshot.toMsats(to.minimumAmount(), to, quote);
        }
        BigDecimal source = sourceFor(withNotification, from, quote);
        if (from.isChainToken()) {
            source = source.add(from.minimumAmount());
        }
        return convertForward(source, from, to, quote);
    }

    private long shortfallMsats(ConversionResult forward, BigDecimal target, long targetMsats,
                                Currency to, Quote quote) {
        if (to.isChainToken()) {
            BigDecimal achieved = forward.netToReceiveIn(to);
            BigDecimal missing = target.subtract(achieved);
            if (missing.compareTo(to.getTolerance()) <= 0) {
                return 0;
            }
            return ConversionSnapshot.toMsats(missing, to, quote);
        }
        long missing = targetMsats - forward.getNetConv().getMsats();
        return missing > SETTLEMENT_TOLERANCE_MSATS ? missing : 0;
    }

    /**
     * Smallest source amount worth at least {@code msats}.
     */
    private BigDecimal sourceFor(long msats, Currency from, Quote quote) {
        BigDecimal value = BigDecimal.valueOf(msats);
        return switch (from) {
            case MSATS -> value;
            case SATS -> value.divide(THOUSAND, 0, RoundingMode.CEILING);
            default -> value.divide(quote.satsPer(from).multiply(THOUSAND), MathContext.DECIMAL128)
                .setScale(from.getScale(), RoundingMode.CEILING);
        };
    }

    private static BigDecimal fromMsats(long msats, Currency unit) {
        if (unit == Currency.SATS) {
            return BigDecimal.valueOf(msats).divide(THOUSAND, 0, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(msats);
    }

    private static void requirePair(Currency from, Currency to) {
        if (from == null || to == null) {
            throw new ValidationException("Conversion needs both a source and a target currency");
        }
        boolean chainToSettlement = from.isChainToken() && to.isSettlement();
        boolean settlementToChain = from.isSettlement() && to.isChainToken();
        if (!chainToSettlement && !settlementToChain) {
            throw new ValidationException("Unsupported conversion pair " + from + " -> " + to);
        }
    }

    private static void requirePositive(BigDecimal amount, Currency unit) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Conversion amount must be positive, got " + amount + " " + unit);
        }
    }
}
