package uk.gegc.inventra.features.tier.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uk.gegc.inventra.features.tier.domain.exception.FeatureLimitExceededException;
import uk.gegc.inventra.features.tier.domain.exception.UsageRecordAlreadyExistsException;
import uk.gegc.inventra.features.tier.domain.exception.UsageRecordNotFoundException;
import uk.gegc.inventra.shared.api.problem.ErrorTypes;
import uk.gegc.inventra.shared.api.problem.ProblemDetailBuilder;

/**
 * Maps tier domain exceptions to RFC 7807 Problem Detail responses.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(basePackages = "uk.gegc.inventra.features.tier.api")
public class TierErrorHandler {

    @ExceptionHandler(FeatureLimitExceededException.class)
    public ResponseEntity<ProblemDetail> handleFeatureLimitExceeded(FeatureLimitExceededException ex, HttpServletRequest request) {
        log.warn("Feature limit exceeded: feature={} reason={}", ex.getFeatureName(), ex.getReason().getValue());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.FORBIDDEN,
                ErrorTypes.FEATURE_LIMIT_EXCEEDED,
                "Feature Limit Exceeded",
                ex.getMessage(),
                request
        );
        problem.setProperty("feature", ex.getFeatureName());
        problem.setProperty("reason", ex.getReason().getValue());
        problem.setProperty("limit", ex.getLimit());
        problem.setProperty("currentUsage", ex.getCurrentUsage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
    }

    @ExceptionHandler(UsageRecordAlreadyExistsException.class)
    public ResponseEntity<ProblemDetail> handleUsageRecordConflict(UsageRecordAlreadyExistsException ex, HttpServletRequest request) {
        log.warn("Usage record conflict: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.USAGE_RECORD_CONFLICT,
                "Usage Record Conflict",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(UsageRecordNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleUsageRecordMissing(UsageRecordNotFoundException ex, HttpServletRequest request) {
        // Counters are provisioned on plan changes, so a missing row is a data error
        log.error("Usage record missing: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.USAGE_RECORD_MISSING,
                "Usage Record Missing",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler({PessimisticLockingFailureException.class, TransientDataAccessException.class})
    public ResponseEntity<ProblemDetail> handleStorageBusy(RuntimeException ex, HttpServletRequest request) {
        log.warn("Usage storage busy: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.SERVICE_UNAVAILABLE,
                ErrorTypes.STORAGE_BUSY,
                "Storage Busy",
                "The usage store is busy, please retry",
                request
        );
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
    }
}
