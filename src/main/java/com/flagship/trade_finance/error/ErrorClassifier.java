package com.flagship.trade_finance.error;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps raw ledger rejections onto the {@link ErrorKind} taxonomy.
 *
 * Rules are evaluated in order and the first match wins. Every code rule is
 * evaluated before any text rule, so an exact failure code always takes
 * precedence over whatever the free text happens to contain. When nothing
 * matches the kind is {@link ErrorKind#UNKNOWN} and the original text is kept
 * as diagnostic detail.
 *
 * Stateless and free of I/O.
 */
@Component
public class ErrorClassifier {

    private static final Pattern REVERT_REASON =
            Pattern.compile("reverted with reason string '([^']+)'");
    private static final Pattern FAILED_PREFIX =
            Pattern.compile("^Failed to[^:]+:\\s*(.+)$", Pattern.DOTALL);
    private static final Pattern CONTRACT_PREFIX =
            Pattern.compile("^[A-Za-z0-9_]+:\\s*");

    private final List<ClassificationRule> codeRules = List.of(
            ClassificationRule.code(ErrorKind.NONCE_CONFLICT,
                    "NONCE_EXPIRED", "NONCE_TOO_LOW", "REPLACEMENT_UNDERPRICED"),
            ClassificationRule.code(ErrorKind.INSUFFICIENT_BALANCE, "INSUFFICIENT_FUNDS"),
            // ERC20InsufficientAllowance(address,uint256,uint256)
            ClassificationRule.code(ErrorKind.INSUFFICIENT_ALLOWANCE, "0xfb8f41b2"),
            // ERC20InsufficientBalance(address,uint256,uint256)
            ClassificationRule.code(ErrorKind.INSUFFICIENT_BALANCE, "0xe450d38c"),
            // SafeERC20FailedOperation(address)
            ClassificationRule.code(ErrorKind.INSUFFICIENT_BALANCE, "0x5274afe7")
    );

    private final List<ClassificationRule> textRules = List.of(
            ClassificationRule.text(ErrorKind.NONCE_CONFLICT,
                    "nonce too low", "nonce has already been used", "nonce expired",
                    "replacement transaction underpriced", "replacement fee too low"),
            ClassificationRule.text(ErrorKind.ALREADY_SETTLED,
                    "trade is settled", "already settled"),
            ClassificationRule.text(ErrorKind.ALREADY_ACCEPTED,
                    "offer already accepted", "already accepted"),
            ClassificationRule.text(ErrorKind.FUNDING_NOT_ENABLED,
                    "funding not enabled"),
            ClassificationRule.text(ErrorKind.EXCEEDS_DECLARED_VALUE,
                    "would exceed declared value", "exceeds declared value"),
            ClassificationRule.text(ErrorKind.UNAUTHORIZED,
                    "only seller", "only buyer", "only carrier", "only investor",
                    "not authorized", "unauthorized", "caller is not"),
            ClassificationRule.text(ErrorKind.INSUFFICIENT_ALLOWANCE,
                    "insufficientallowance", "insufficient allowance"),
            ClassificationRule.text(ErrorKind.INSUFFICIENT_BALANCE,
                    "insufficientbalance", "insufficient balance", "insufficient funds",
                    "exceeds balance", "safeerc20failedoperation", "nothing to redeem",
                    "no claim tokens", "no repayments available"),
            ClassificationRule.text(ErrorKind.NOT_FOUND,
                    "offer does not exist", "does not exist", "not found")
    );

    /**
     * Classifies a rejection signal.
     *
     * @param failure raw code and/or reason; may be null
     * @return classified error, never null
     */
    public ClassifiedError classify(LedgerFailure failure) {
        if (failure == null) {
            return ClassifiedError.of(ErrorKind.UNKNOWN, "");
        }
        String diagnostic = failure.describe();

        String code = failure.getCode();
        if (code != null && !code.isBlank()) {
            String normalizedCode = code.trim().toUpperCase(Locale.ROOT);
            for (ClassificationRule rule : codeRules) {
                if (rule.matchesCode(normalizedCode)) {
                    return ClassifiedError.of(rule.kind(), diagnostic);
                }
            }
        }

        String reason = failure.getReason();
        if (reason != null && !reason.isBlank()) {
            String text = extractReason(reason).toLowerCase(Locale.ROOT);
            for (ClassificationRule rule : textRules) {
                if (rule.matchesText(text)) {
                    return ClassifiedError.of(rule.kind(), diagnostic);
                }
            }
            // The raw text may carry the selector when no code was supplied
            String rawLower = reason.toLowerCase(Locale.ROOT);
            for (ClassificationRule rule : codeRules) {
                if (rule.appearsIn(rawLower)) {
                    return ClassifiedError.of(rule.kind(), diagnostic);
                }
            }
        }

        return ClassifiedError.of(ErrorKind.UNKNOWN, diagnostic);
    }

    /**
     * Convenience for callers holding only free text.
     */
    public ClassifiedError classify(String reason) {
        return classify(LedgerFailure.ofReason(reason));
    }

    /**
     * Strips wrapping added by clients and contracts:
     * "Failed to ...: inner", "reverted with reason string 'Contract: reason'".
     */
    String extractReason(String raw) {
        String text = raw.trim();
        Matcher failed = FAILED_PREFIX.matcher(text);
        if (failed.matches()) {
            text = failed.group(1).trim();
        }
        Matcher revert = REVERT_REASON.matcher(text);
        if (revert.find()) {
            text = CONTRACT_PREFIX.matcher(revert.group(1)).replaceFirst("");
        }
        return text;
    }

    private record ClassificationRule(ErrorKind kind, Set<String> codes, List<String> fragments) {

        static ClassificationRule code(ErrorKind kind, String... codes) {
            return new ClassificationRule(kind,
                    Set.of(java.util.Arrays.stream(codes)
                            .map(c -> c.toUpperCase(Locale.ROOT))
                            .toArray(String[]::new)),
                    List.of());
        }

        static ClassificationRule text(ErrorKind kind, String... fragments) {
            return new ClassificationRule(kind, Set.of(), List.of(fragments));
        }

        boolean matchesCode(String normalizedCode) {
            return codes.contains(normalizedCode);
        }

        boolean matchesText(String lowerText) {
            return fragments.stream().anyMatch(lowerText::contains);
        }

        boolean appearsIn(String lowerText) {
            return codes.stream()
                    .filter(c -> c.startsWith("0X"))
                    .map(c -> c.substring(2).toLowerCase(Locale.ROOT))
                    .anyMatch(lowerText::contains);
        }
    }
}
