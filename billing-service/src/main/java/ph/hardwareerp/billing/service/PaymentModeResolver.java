package ph.hardwareerp.billing.service;

import org.springframework.stereotype.Service;
import ph.hardwareerp.common.dto.billing.OrderDto;
import ph.hardwareerp.common.dto.billing.PaymentMode;
import ph.hardwareerp.common.dto.customer.CustomerDto;
import ph.hardwareerp.common.util.MoneyUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether the cash or the credit amount rules apply to an order.
 *
 * Installment hints on the order (a per-term amount, or terms text such as
 * "Net 30" or "6 months") win over the customer's flag. Customers without a
 * flag and without hints fall under credit rules.
 */
@Service
public class PaymentModeResolver {

    private static final Pattern INSTALLMENT_TERMS = Pattern.compile("credit|net|month|term|install");

    public PaymentMode resolve(CustomerDto customer, OrderDto order) {
        String paymentType = customer != null && customer.getPaymentType() != null
                ? customer.getPaymentType().trim().toLowerCase(Locale.ROOT)
                : "";

        if ("credit".equals(paymentType) || looksInstallment(order)) {
            return PaymentMode.CREDIT;
        }
        return "cash".equals(paymentType) ? PaymentMode.CASH : PaymentMode.CREDIT;
    }

    boolean looksInstallment(OrderDto order) {
        if (order == null) {
            return false;
        }
        if (MoneyUtils.isPositive(order.getPerTermAmount())) {
            return true;
        }
        String terms = order.getTerms() != null ? order.getTerms().toLowerCase(Locale.ROOT) : "";
        return INSTALLMENT_TERMS.matcher(terms).find();
    }
}
