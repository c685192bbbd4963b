package ph.hardwareerp.billing.infrastructure.firebase;

import com.google.cloud.firestore.DocumentChange;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreException;
import com.google.cloud.firestore.ListenerRegistration;
import com.google.cloud.firestore.QuerySnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import ph.hardwareerp.billing.repository.FirestorePaymentRepository;
import ph.hardwareerp.billing.service.PaymentStoreView;
import ph.hardwareerp.common.dto.billing.PaymentDto;

/**
 * Keeps the payment view current from Firestore change notifications, so reviewer
 * decisions made in other sessions reach this instance without polling.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.realtime.enabled", havingValue = "true")
public class PaymentChangeSubscriber {

    private static final String COLLECTION = "payments";

    private final Firestore firestore;
    private final PaymentStoreView paymentStoreView;

    private ListenerRegistration registration;

    @PostConstruct
    public void start() {
        registration = firestore.collection(COLLECTION).addSnapshotListener(this::onEvent);
        log.info("Subscribed to {} changes", COLLECTION);
    }

    @PreDestroy
    public void stop() {
        if (registration != null) {
            registration.remove();
            log.info("Unsubscribed from {} changes", COLLECTION);
        }
    }

    void onEvent(QuerySnapshot snapshot, FirestoreException error) {
        if (error != null) {
            onFailure(error);
            return;
        }
        if (snapshot == null) {
            return;
        }

        for (DocumentChange change : snapshot.getDocumentChanges()) {
            PaymentDto payment = FirestorePaymentRepository.documentToDto(change.getDocument());
            if (change.getType() == DocumentChange.Type.REMOVED) {
                paymentStoreView.remove(payment.getOrderId(), payment.getId());
            } else {
                paymentStoreView.apply(payment);
            }
        }
        log.debug("Applied {} payment changes", snapshot.getDocumentChanges().size());
        paymentStoreView.markLive();
    }

    /**
     * The listener is dead after an error; reads fall back to the repository.
     */
    void onFailure(Exception error) {
        log.error("Payment subscription failed: {}", error.getMessage(), error);
        paymentStoreView.reset();
    }
}
