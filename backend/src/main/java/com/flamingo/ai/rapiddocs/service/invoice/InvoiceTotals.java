package com.flamingo.ai.rapiddocs.service.invoice;

import java.math.BigDecimal;
import java.util.List;

/** Monetary totals of an invoice, all rounded to cents. */
public record InvoiceTotals(
    List<LineTotal> lines, BigDecimal subtotal, BigDecimal tax, BigDecimal total) {

  public InvoiceTotals {
    lines = List.copyOf(lines);
  }

  /** Per line: quantity × unit price, its tax and the sum of both. */
  public record LineTotal(
      String description,
      BigDecimal quantity,
      BigDecimal unitPrice,
      BigDecimal taxRate,
      BigDecimal amount,
      BigDecimal tax,
      BigDecimal total) {}
}
