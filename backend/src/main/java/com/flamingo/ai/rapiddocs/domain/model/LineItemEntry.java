package com.flamingo.ai.rapiddocs.domain.model;

/** An invoice line item. {@code taxRate} is a fraction in [0, 1] once defaults are applied. */
public record LineItemEntry(String description, double quantity, double unitPrice, double taxRate) {

  public LineItemEntry {
    description = description == null ? "" : description;
  }

  /**
   * Returns a copy with quantity, price and tax rate forced into their valid ranges.
   *
   * <p>Tax rates in (1, 100] are read as percentages and divided by 100; anything else outside
   * [0, 1] becomes 0.
   */
  public LineItemEntry normalized() {
    double qty = quantity <= 0 ? 1 : quantity;
    double price = unitPrice < 0 ? 0 : unitPrice;
    return new LineItemEntry(description, qty, price, normalizeTaxRate(taxRate));
  }

  public static double normalizeTaxRate(double rate) {
    if (rate >= 0 && rate <= 1) {
      return rate;
    }
    if (rate > 1 && rate <= 100) {
      return rate / 100;
    }
    return 0.0;
  }
}
