package com.flamingo.ai.rapiddocs.domain.model;

import java.util.List;
import lombok.Builder;

/**
 * Structured invoice data extracted from a prompt.
 *
 * <p>Missing scalars are represented as empty strings, never null. Owned by a single job.
 */
@Builder(toBuilder = true)
public record InvoiceExtraction(
    String invoiceNumber,
    String clientName,
    String clientAddress,
    String vendorName,
    String vendorAddress,
    String currency,
    String paymentTerms,
    String notes,
    List<LineItemEntry> lineItems) {

  public InvoiceExtraction {
    invoiceNumber = nullToEmpty(invoiceNumber);
    clientName = nullToEmpty(clientName);
    clientAddress = nullToEmpty(clientAddress);
    vendorName = nullToEmpty(vendorName);
    vendorAddress = nullToEmpty(vendorAddress);
    currency = nullToEmpty(currency);
    paymentTerms = nullToEmpty(paymentTerms);
    notes = nullToEmpty(notes);
    lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
  }

  /** An extraction with every field empty. */
  public static InvoiceExtraction empty() {
    return InvoiceExtraction.builder().build();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
