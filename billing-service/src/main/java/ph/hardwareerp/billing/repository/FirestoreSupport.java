package ph.hardwareerp.billing.repository;

import com.google.api.core.ApiFuture;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentSnapshot;
import lombok.extern.slf4j.Slf4j;
import ph.hardwareerp.common.exception.ExternalServiceException;
import ph.hardwareerp.common.exception.HardwareErpException;
import ph.hardwareerp.common.util.MoneyUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.concurrent.ExecutionException;

/**
 * Shared Firestore plumbing for the billing repositories.
 *
 * Every read and write is an I/O boundary. Failures are surfaced as
 * ExternalServiceException so callers re-fetch instead of assuming an outcome.
 */
@Slf4j
final class FirestoreSupport {

    static final String SERVICE_NAME = "Firestore";

    private FirestoreSupport() {
        // Utility class - no instantiation
    }

    static <T> T await(ApiFuture<T> future, String action) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            log.error("Interrupted while {}: {}", action, e.getMessage());
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(SERVICE_NAME, "Interrupted while " + action, e);
        } catch (ExecutionException e) {
            HardwareErpException business = findBusinessException(e);
            if (business != null) {
                throw business;
            }
            String rootMessage = resolveRootCauseMessage(e);
            log.error("Error {}: {}", action, rootMessage);
            throw new ExternalServiceException(SERVICE_NAME, "Failed " + action + ": " + rootMessage, e);
        }
    }

    static BigDecimal amount(DocumentSnapshot doc, String field) {
        Object value = doc.get(field);
        if (value instanceof Number) {
            return MoneyUtils.fromNumber((Number) value);
        }
        if (value instanceof String && !((String) value).isBlank()) {
            String text = (String) value;
            try {
                return MoneyUtils.round2(new BigDecimal(text.trim()));
            } catch (NumberFormatException e) {
                log.warn("Non-numeric {} on {}: {}", field, doc.getId(), text);
            }
        }
        return null;
    }

    static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        if (timestamp == null) {
            return null;
        }
        return LocalDateTime.ofInstant(timestamp.toDate().toInstant(), ZoneId.systemDefault());
    }

    static Timestamp toTimestamp(LocalDateTime dateTime) {
        return Timestamp.of(Date.from(dateTime.atZone(ZoneId.systemDefault()).toInstant()));
    }

    static LocalDate toLocalDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            return LocalDate.parse(text.substring(0, Math.min(10, text.length())));
        } catch (DateTimeParseException e) {
            log.warn("Unparseable date value: {}", text);
            return null;
        }
    }

    /**
     * Business exceptions thrown inside a transaction callback come back wrapped.
     */
    private static HardwareErpException findBusinessException(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof HardwareErpException && !(current instanceof ExternalServiceException)) {
                return (HardwareErpException) current;
            }
            current = current.getCause() != current ? current.getCause() : null;
        }
        return null;
    }

    private static String resolveRootCauseMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
