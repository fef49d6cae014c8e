package com.flamingo.ai.rapiddocs.service.extraction.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Structured output of the invoice extraction prompt. Every field is optional; the model may omit
 * any of them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvoiceExtractionPayload(
    @JsonProperty("invoice_number") @JsonAlias("invoiceNumber") String invoiceNumber,
    @JsonProperty("client_name") @JsonAlias("clientName") String clientName,
    @JsonProperty("client_address") @JsonAlias("clientAddress") String clientAddress,
    @JsonProperty("vendor_name") @JsonAlias("vendorName") String vendorName,
    @JsonProperty("vendor_address") @JsonAlias("vendorAddress") String vendorAddress,
    String currency,
    @JsonProperty("payment_terms") @JsonAlias("paymentTerms") String paymentTerms,
    String notes,
    @JsonProperty("line_items") @JsonAlias("lineItems") List<LineItem> lineItems) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record LineItem(
      String description,
      Double quantity,
      @JsonProperty("unit_price") @JsonAlias("unitPrice") Double unitPrice,
      @JsonProperty("tax_rate") @JsonAlias("taxRate") Double taxRate // fraction 0-1
      ) {}
}
