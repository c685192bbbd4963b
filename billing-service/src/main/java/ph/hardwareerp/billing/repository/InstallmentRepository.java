package ph.hardwareerp.billing.repository;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QuerySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import ph.hardwareerp.common.dto.billing.InstallmentTermDto;

import java.util.List;

/**
 * Repository for installment rows written by the scheduling process.
 * Billing only reads them.
 *
 * Collection: order_installments
 * Document structure: {
 *   orderId: string,
 *   termNo: number,
 *   dueDate: string (yyyy-MM-dd),
 *   amountDue: number,
 *   amountPaid: number,
 *   status: "pending" | "paid"
 * }
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class InstallmentRepository {

    private static final String COLLECTION = "order_installments";

    private final Firestore firestore;

    /**
     * Find installment terms of an order in term order.
     */
    public List<InstallmentTermDto> findByOrderId(String orderId) {
        QuerySnapshot snapshot = FirestoreSupport.await(
                firestore.collection(COLLECTION)
                        .whereEqualTo("orderId", orderId)
                        .orderBy("termNo")
                        .get(),
                "fetching installments for order " + orderId);
        return snapshot.getDocuments().stream()
                .map(this::documentToDto)
                .toList();
    }

    private InstallmentTermDto documentToDto(DocumentSnapshot doc) {
        Long termNo = doc.getLong("termNo");
        return InstallmentTermDto.builder()
                .id(doc.getId())
                .orderId(doc.getString("orderId"))
                .termNo(termNo != null ? termNo.intValue() : 0)
                .dueDate(FirestoreSupport.toLocalDate(doc.getString("dueDate")))
                .amountDue(FirestoreSupport.amount(doc, "amountDue"))
                .amountPaid(FirestoreSupport.amount(doc, "amountPaid"))
                .status(doc.getString("status"))
                .build();
    }
}
