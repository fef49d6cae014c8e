package com.flamingo.ai.rapiddocs.service.invoice;

import com.flamingo.ai.rapiddocs.domain.model.LineItemEntry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Computes invoice totals with {@link BigDecimal} arithmetic. */
@Component
public class InvoiceTotalsCalculator {

  private static final int SCALE = 2;

  /**
   * Line amounts and taxes are rounded half-up to cents individually; the invoice totals are the
   * sums of the rounded line values.
   */
  public InvoiceTotals calculate(List<LineItemEntry> items) {
    List<InvoiceTotals.LineTotal> lines = new ArrayList<>(items.size());
    BigDecimal subtotal = BigDecimal.ZERO.setScale(SCALE);
    BigDecimal tax = BigDecimal.ZERO.setScale(SCALE);

    for (LineItemEntry item : items) {
      BigDecimal quantity = BigDecimal.valueOf(item.quantity());
      BigDecimal unitPrice = BigDecimal.valueOf(item.unitPrice());
      BigDecimal taxRate = BigDecimal.valueOf(item.taxRate());

      BigDecimal amount = quantity.multiply(unitPrice).setScale(SCALE, RoundingMode.HALF_UP);
      BigDecimal lineTax = amount.multiply(taxRate).setScale(SCALE, RoundingMode.HALF_UP);
      lines.add(
          new InvoiceTotals.LineTotal(
              item.description(),
              quantity,
              unitPrice,
              taxRate,
              amount,
              lineTax,
              amount.add(lineTax)));
      subtotal = subtotal.add(amount);
      tax = tax.add(lineTax);
    }
    return new InvoiceTotals(lines, subtotal, tax, subtotal.add(tax));
  }
}
