package ph.hardwareerp.billing.repository;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QuerySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import ph.hardwareerp.common.dto.billing.OrderDto;
import ph.hardwareerp.common.dto.billing.OrderLineItemDto;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for customer orders stored in Firebase. Read-only for billing.
 *
 * Structure in Firebase:
 * orders/{orderId}: {
 *   customerId: string,
 *   status: "pending" | "completed" | "rejected",
 *   items: [{ productName, quantity, unitPrice, discountPercent }],
 *   salesTax: number,
 *   shippingFee: number,
 *   grandTotalWithInterest: number,
 *   perTermAmount: number,
 *   terms: string,
 *   truckDeliveryId: string,
 *   paidAmount: number
 * }
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class OrderRepository {

    private static final String COLLECTION = "orders";

    private final Firestore firestore;

    public Optional<OrderDto> findById(String orderId) {
        DocumentSnapshot doc = FirestoreSupport.await(
                firestore.collection(COLLECTION).document(orderId).get(),
                "fetching order " + orderId);
        if (!doc.exists()) {
            return Optional.empty();
        }
        return Optional.of(documentToDto(doc));
    }

    /**
     * Find orders of a customer with the given status.
     */
    public List<OrderDto> findByCustomerIdAndStatus(String customerId, String status) {
        QuerySnapshot snapshot = FirestoreSupport.await(
                firestore.collection(COLLECTION)
                        .whereEqualTo("customerId", customerId)
                        .whereEqualTo("status", status)
                        .get(),
                "fetching " + status + " orders for customer " + customerId);
        return snapshot.getDocuments().stream()
                .map(this::documentToDto)
                .toList();
    }

    private OrderDto documentToDto(DocumentSnapshot doc) {
        return OrderDto.builder()
                .id(doc.getId())
                .customerId(doc.getString("customerId"))
                .status(doc.getString("status"))
                .items(readItems(doc))
                .salesTax(FirestoreSupport.amount(doc, "salesTax"))
                .shippingFee(FirestoreSupport.amount(doc, "shippingFee"))
                .grandTotalOverride(FirestoreSupport.amount(doc, "grandTotalWithInterest"))
                .perTermAmount(FirestoreSupport.amount(doc, "perTermAmount"))
                .terms(doc.getString("terms"))
                .truckDeliveryId(doc.getString("truckDeliveryId"))
                .build();
    }

    @SuppressWarnings("unchecked")
    private List<OrderLineItemDto> readItems(DocumentSnapshot doc) {
        Object raw = doc.get("items");
        List<OrderLineItemDto> items = new ArrayList<>();
        if (!(raw instanceof List)) {
            return items;
        }
        for (Object entry : (List<Object>) raw) {
            if (!(entry instanceof Map)) {
                continue;
            }
            Map<String, Object> item = (Map<String, Object>) entry;
            items.add(OrderLineItemDto.builder()
                    .productName(item.get("productName") != null ? item.get("productName").toString() : null)
                    .quantity(decimal(item.get("quantity")))
                    .unitPrice(decimal(item.get("unitPrice")))
                    .discountPercent(decimal(item.get("discountPercent")))
                    .build());
        }
        return items;
    }

    private BigDecimal decimal(Object value) {
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).doubleValue());
        }
        return null;
    }
}
