package com.flagship.store_credit.code;

import com.flagship.store_credit.ledger.LedgerOutcome;
import com.flagship.store_credit.ledger.LedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and redeems one-time in-store redemption codes.
 *
 * Creating a code only checks that the wallet could cover it; the debit is
 * written when the code is redeemed, through {@link LedgerService#redeem}
 * with the code as idempotency reference. A retried redemption therefore
 * never debits twice, even if the code row was not marked used the first
 * time.
 */
@Service
@Slf4j
public class RedemptionCodeService {

    static final String REFERENCE_PREFIX = "code:";
    private static final int CODE_BYTES = 4;
    private static final int MAX_GENERATION_ATTEMPTS = 5;
    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private final RedemptionCodeRepository repository;
    private final LedgerService ledgerService;
    private final Clock clock;
    private final Duration ttl;
    private final SecureRandom random = new SecureRandom();

    public RedemptionCodeService(RedemptionCodeRepository repository,
                                 LedgerService ledgerService,
                                 Clock clock,
                                 @Value("${wallet.codes.ttl-minutes:15}") long ttlMinutes) {
        this.repository = repository;
        this.ledgerService = ledgerService;
        this.clock = clock;
        this.ttl = Duration.ofMinutes(ttlMinutes);
    }

    public CodeIssueResult createCode(UUID userId, BigDecimal amount) {
        Objects.requireNonNull(userId, "userId");
        BigDecimal available = ledgerService.getBalance(userId).getBalance();

        Optional<BigDecimal> normalized = ledgerService.normalizeAmount(amount);
        if (normalized.isEmpty()) {
            return CodeIssueResult.rejected(CodeIssueResult.Status.INVALID_AMOUNT, available);
        }
        if (normalized.get().compareTo(available) > 0) {
            log.info("Redemption code of {} refused for user {}: only {} available",
                    normalized.get(), userId, available);
            return CodeIssueResult.rejected(CodeIssueResult.Status.INSUFFICIENT_BALANCE, available);
        }

        RedemptionCode code = RedemptionCode.create(userId, generateUniqueCode(), normalized.get(),
                clock.instant(), ttl);
        repository.save(RedemptionCodeEntity.fromDomain(code));

        log.info("Created redemption code for user {}: amount={}, expiresAt={}",
                userId, code.getAmount(), code.getExpiresAt());
        return CodeIssueResult.created(code, available);
    }

    /**
     * Redeems a code; lookup is case-insensitive.
     */
    public CodeRedemptionResult redeemCode(String rawCode, String performedBy) {
        if (rawCode == null || rawCode.isBlank()) {
            return CodeRedemptionResult.of(CodeRedemptionResult.Status.INVALID_CODE, null);
        }
        String codeValue = rawCode.trim().toUpperCase(Locale.ROOT);

        Optional<RedemptionCodeEntity> found = repository.findByCode(codeValue);
        if (found.isEmpty()) {
            log.warn("Unknown redemption code presented by {}", performedBy);
            return CodeRedemptionResult.of(CodeRedemptionResult.Status.INVALID_CODE, null);
        }

        RedemptionCodeEntity entity = found.get();
        RedemptionCode code = entity.toDomain();
        if (code.isUsed()) {
            return CodeRedemptionResult.of(CodeRedemptionResult.Status.ALREADY_USED, code);
        }
        Instant now = clock.instant();
        if (code.isExpired(now)) {
            log.info("Redemption code for user {} expired at {}", code.getUserId(), code.getExpiresAt());
            return CodeRedemptionResult.of(CodeRedemptionResult.Status.EXPIRED, code);
        }

        LedgerOutcome outcome = ledgerService.redeem(code.getUserId(), code.getAmount(),
                REFERENCE_PREFIX + codeValue, "In-store redemption code", performedBy);

        switch (outcome.getStatus()) {
            case APPLIED -> {
                entity.markUsed(now, outcome.getTransaction().getId());
                RedemptionCode used = repository.save(entity).toDomain();
                log.info("Redemption code for user {} redeemed by {}: amount={}",
                        code.getUserId(), performedBy, code.getAmount());
                return CodeRedemptionResult.of(CodeRedemptionResult.Status.REDEEMED, used, outcome);
            }
            case DUPLICATE -> {
                // The debit exists already; the code row may have missed its update.
                entity.markUsed(now, outcome.getTransaction().getId());
                RedemptionCode used = repository.save(entity).toDomain();
                return CodeRedemptionResult.of(CodeRedemptionResult.Status.ALREADY_USED, used, outcome);
            }
            case INSUFFICIENT_BALANCE -> {
                return CodeRedemptionResult.of(CodeRedemptionResult.Status.INSUFFICIENT_BALANCE, code, outcome);
            }
            default -> throw new IllegalStateException(
                    "Unexpected ledger outcome " + outcome.getStatus() + " for redemption code");
        }
    }

    private String generateUniqueCode() {
        for (int attempt = 0; attempt < MAX_GENERATION_ATTEMPTS; attempt++) {
            byte[] bytes = new byte[CODE_BYTES];
            random.nextBytes(bytes);
            String candidate = HEX.formatHex(bytes);
            if (!repository.existsByCode(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not generate a unique redemption code after "
                + MAX_GENERATION_ATTEMPTS + " attempts");
    }
}
