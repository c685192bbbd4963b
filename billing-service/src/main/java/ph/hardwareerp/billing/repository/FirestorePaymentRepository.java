package ph.hardwareerp.billing.repository;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.FieldValue;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QuerySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import ph.hardwareerp.common.dto.billing.PaymentDto;
import ph.hardwareerp.common.dto.billing.PaymentMethod;
import ph.hardwareerp.common.dto.billing.PaymentStatus;
import ph.hardwareerp.common.exception.ResourceNotFoundException;
import ph.hardwareerp.common.util.MoneyUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Payments stored in Firebase.
 *
 * Collection: payments
 * Document structure: {
 *   orderId: string,
 *   customerId: string,
 *   amount: number,
 *   method: "cash" | "cheque",
 *   status: "pending" | "received" | "rejected",
 *   chequeNumber, bankName, chequeDate (yyyy-MM-dd), receiptReference: string,
 *   createdAt: Timestamp,
 *   reviewedBy: string,
 *   reviewedAt: Timestamp
 * }
 *
 * Confirm and reject run as Firestore transactions: the payment is read inside
 * the transaction and written only if it is still pending. Firestore retries the
 * transaction on contention, so two reviewers racing on one payment see exactly
 * one successful write.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FirestorePaymentRepository implements PaymentRepository {

    static final String COLLECTION = "payments";
    static final String ORDERS_COLLECTION = "orders";

    private final Firestore firestore;

    @Override
    public List<PaymentDto> findByOrderId(String orderId) {
        QuerySnapshot snapshot = FirestoreSupport.await(
                firestore.collection(COLLECTION).whereEqualTo("orderId", orderId).get(),
                "fetching payments for order " + orderId);
        return snapshot.getDocuments().stream()
                .map(FirestorePaymentRepository::documentToDto)
                .toList();
    }

    @Override
    public Optional<PaymentDto> findById(String id) {
        DocumentSnapshot doc = FirestoreSupport.await(
                firestore.collection(COLLECTION).document(id).get(),
                "fetching payment " + id);
        if (!doc.exists()) {
            return Optional.empty();
        }
        return Optional.of(documentToDto(doc));
    }

    @Override
    public PaymentDto insertPending(PaymentDto payment) {
        DocumentReference docRef = firestore.collection(COLLECTION).document();
        LocalDateTime createdAt = payment.getCreatedAt() != null ? payment.getCreatedAt() : LocalDateTime.now();

        Map<String, Object> data = new HashMap<>();
        data.put("orderId", payment.getOrderId());
        data.put("customerId", payment.getCustomerId());
        data.put("amount", MoneyUtils.round2(payment.getAmount()).doubleValue());
        data.put("method", payment.getMethod().value());
        data.put("status", PaymentStatus.PENDING.value());
        data.put("chequeNumber", payment.getChequeNumber());
        data.put("bankName", payment.getBankName());
        data.put("chequeDate", payment.getChequeDate() != null ? payment.getChequeDate().toString() : null);
        data.put("receiptReference", payment.getReceiptReference());
        data.put("createdAt", FirestoreSupport.toTimestamp(createdAt));

        FirestoreSupport.await(docRef.create(data), "inserting payment for order " + payment.getOrderId());
        log.debug("Inserted pending payment {} for order {}", docRef.getId(), payment.getOrderId());

        return payment.toBuilder()
                .id(docRef.getId())
                .status(PaymentStatus.PENDING)
                .createdAt(createdAt)
                .build();
    }

    @Override
    public boolean updateStatusIfPending(String paymentId, PaymentStatus target, String reviewer,
                                         LocalDateTime reviewedAt) {
        if (target == PaymentStatus.PENDING) {
            throw new IllegalArgumentException("Target status must be terminal");
        }
        DocumentReference paymentRef = firestore.collection(COLLECTION).document(paymentId);
        Timestamp reviewedTimestamp = FirestoreSupport.toTimestamp(reviewedAt);

        Boolean applied = FirestoreSupport.await(firestore.runTransaction(transaction -> {
            DocumentSnapshot current = transaction.get(paymentRef).get();
            if (!current.exists()) {
                throw new ResourceNotFoundException("Payment", paymentId);
            }
            if (PaymentStatus.fromValue(current.getString("status")) != PaymentStatus.PENDING) {
                return false;
            }

            Map<String, Object> updates = new HashMap<>();
            updates.put("status", target.value());
            updates.put("reviewedBy", reviewer);
            updates.put("reviewedAt", reviewedTimestamp);
            transaction.update(paymentRef, updates);

            String orderId = current.getString("orderId");
            BigDecimal amount = FirestoreSupport.amount(current, "amount");
            if (target == PaymentStatus.RECEIVED && orderId != null && amount != null) {
                DocumentReference orderRef = firestore.collection(ORDERS_COLLECTION).document(orderId);
                transaction.update(orderRef, Map.of(
                        "paidAmount", FieldValue.increment(amount.doubleValue()),
                        "updatedAt", reviewedTimestamp));
            }
            return true;
        }), "updating status of payment " + paymentId);

        return Boolean.TRUE.equals(applied);
    }

    public static PaymentDto documentToDto(DocumentSnapshot doc) {
        return PaymentDto.builder()
                .id(doc.getId())
                .orderId(doc.getString("orderId"))
                .customerId(doc.getString("customerId"))
                .amount(FirestoreSupport.amount(doc, "amount"))
                .method(PaymentMethod.fromValue(doc.getString("method")))
                .status(PaymentStatus.fromValue(doc.getString("status")))
                .chequeNumber(doc.getString("chequeNumber"))
                .bankName(doc.getString("bankName"))
                .chequeDate(FirestoreSupport.toLocalDate(doc.getString("chequeDate")))
                .receiptReference(doc.getString("receiptReference"))
                .createdAt(FirestoreSupport.toLocalDateTime(doc.getTimestamp("createdAt")))
                .reviewedBy(doc.getString("reviewedBy"))
                .reviewedAt(FirestoreSupport.toLocalDateTime(doc.getTimestamp("reviewedAt")))
                .build();
    }
}
