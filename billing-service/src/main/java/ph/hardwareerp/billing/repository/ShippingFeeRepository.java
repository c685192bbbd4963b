package ph.hardwareerp.billing.repository;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import ph.hardwareerp.common.dto.billing.OrderDto;

import java.math.BigDecimal;

/**
 * Reads the shipping fee set by logistics on the truck delivery an order rides on.
 *
 * Collection: truck_deliveries
 * Document structure: { shippingFee: number, ... }
 *
 * Never cached: the fee can arrive after the order is completed.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ShippingFeeRepository {

    private static final String COLLECTION = "truck_deliveries";

    private final Firestore firestore;

    /**
     * Shipping fee for an order, or null when logistics has not set one yet.
     * Orders not assigned to a delivery fall back to the fee stored on the order.
     */
    public BigDecimal findShippingFee(OrderDto order) {
        String deliveryId = order.getTruckDeliveryId();
        if (deliveryId == null || deliveryId.isBlank()) {
            return order.getShippingFee();
        }

        DocumentSnapshot doc = FirestoreSupport.await(
                firestore.collection(COLLECTION).document(deliveryId).get(),
                "fetching shipping fee for delivery " + deliveryId);
        if (!doc.exists()) {
            log.debug("Delivery {} for order {} not found, no shipping fee yet", deliveryId, order.getId());
            return null;
        }
        return FirestoreSupport.amount(doc, "shippingFee");
    }
}
