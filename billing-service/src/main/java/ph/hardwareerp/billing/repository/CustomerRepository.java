package ph.hardwareerp.billing.repository;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import ph.hardwareerp.common.dto.customer.CustomerDto;

import java.util.Optional;

/**
 * Repository for customers stored in Firebase.
 *
 * Structure in Firebase:
 * customers/{customerId}: {
 *   name: string,
 *   code: string,
 *   email: string,
 *   paymentType: "cash" | "credit"
 * }
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class CustomerRepository {

    private static final String COLLECTION = "customers";

    private final Firestore firestore;

    public Optional<CustomerDto> findById(String customerId) {
        if (customerId == null || customerId.isBlank()) {
            return Optional.empty();
        }
        DocumentSnapshot doc = FirestoreSupport.await(
                firestore.collection(COLLECTION).document(customerId).get(),
                "fetching customer " + customerId);
        if (!doc.exists()) {
            return Optional.empty();
        }
        return Optional.of(CustomerDto.builder()
                .id(doc.getId())
                .name(doc.getString("name"))
                .code(doc.getString("code"))
                .email(doc.getString("email"))
                .paymentType(doc.getString("paymentType"))
                .build());
    }
}
