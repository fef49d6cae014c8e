package com.flamingo.ai.rapiddocs.service.extraction;

import com.flamingo.ai.rapiddocs.config.GenerationConfig;
import com.flamingo.ai.rapiddocs.domain.model.InvoiceExtraction;
import com.flamingo.ai.rapiddocs.domain.model.LineItemEntry;
import com.flamingo.ai.rapiddocs.service.extraction.dto.InvoiceExtractionPayload;
import com.flamingo.ai.rapiddocs.service.generation.TextGenerator;
import dev.langchain4j.model.input.PromptTemplate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Extracts invoice fields through a structured-output model call. */
@Component
@RequiredArgsConstructor
@Slf4j
public class InvoiceAiExtractor implements AiExtractor<InvoiceExtraction> {

  private static final PromptTemplate EXTRACTION_PROMPT =
      PromptTemplate.from(
          """
          You are an expert invoice data extractor. Analyze the following user prompt and extract
          structured invoice information.

          USER PROMPT:
          {{prompt}}

          Return a JSON object with these fields:
          - invoice_number (string): invoice number if mentioned, else empty
          - client_name (string): who the invoice is TO (client, customer, recipient)
          - client_address (string)
          - vendor_name (string): who the invoice is FROM (vendor, company, sender)
          - vendor_address (string)
          - currency (string): currency code (USD, EUR, GBP, ...)
          - payment_terms (string)
          - notes (string)
          - line_items (array of objects): description (string), quantity (number),
            unit_price (number), tax_rate (number, decimal 0-1)

          Parsing rules:
          - "Vendor: X" or "from X" means X is the vendor name
          - "Customer: X", "Client: X" or "to X" means X is the client name
          - "Customer: Person at Company, Address" means client_name is "Person at Company" and
            client_address is the address
          - "X hours of consulting at $Y/hour" means quantity=X, unit_price=Y
          - "X units of Y at $Z each" means quantity=X, description=Y, unit_price=Z
          - "Item ($X x Y)" means description=Item, unit_price=X, quantity=Y
          - $ means USD, EUR or euro means EUR, GBP or pound means GBP
          - "tax rate: N%" applies tax_rate N/100 to ALL line items
          - Leave a field empty when the prompt does not mention it
          """);

  private final TextGenerator textGenerator;
  private final GenerationConfig generationConfig;

  @Override
  public InvoiceExtraction extract(String prompt) {
    if (!textGenerator.isActive()) {
      log.debug("Text generator inactive, skipping AI invoice extraction");
      return InvoiceExtraction.empty();
    }
    try {
      String instruction =
          EXTRACTION_PROMPT.apply(Map.of("prompt", prompt == null ? "" : prompt)).text();
      InvoiceExtractionPayload payload =
          textGenerator.generateStructured(
              instruction,
              InvoiceExtractionPayload.class,
              generationConfig.getExtraction().getMaxTokens());
      InvoiceExtraction result = toExtraction(payload);
      log.debug(
          "AI extracted: vendor='{}', client='{}', items={}",
          result.vendorName(),
          result.clientName(),
          result.lineItems().size());
      return result;
    } catch (RuntimeException e) {
      log.warn("AI invoice extraction failed, continuing with regex result: {}", e.getMessage());
      return InvoiceExtraction.empty();
    }
  }

  static InvoiceExtraction toExtraction(InvoiceExtractionPayload payload) {
    List<LineItemEntry> lineItems =
        payload.lineItems() == null
            ? List.of()
            : payload.lineItems().stream()
                .filter(Objects::nonNull)
                .filter(item -> item.description() != null && !item.description().isBlank())
                .map(
                    item ->
                        new LineItemEntry(
                            item.description().trim(),
                            item.quantity() != null ? item.quantity() : 1,
                            item.unitPrice() != null ? item.unitPrice() : 0,
                            item.taxRate() != null ? item.taxRate() : 0))
                .toList();

    String invoiceNumber = trim(payload.invoiceNumber());
    return InvoiceExtraction.builder()
        .invoiceNumber(invoiceNumber.isEmpty() ? InvoiceNumbers.next() : invoiceNumber)
        .clientName(trim(payload.clientName()))
        .clientAddress(trim(payload.clientAddress()))
        .vendorName(trim(payload.vendorName()))
        .vendorAddress(trim(payload.vendorAddress()))
        .currency(trim(payload.currency()))
        .paymentTerms(trim(payload.paymentTerms()))
        .notes(trim(payload.notes()))
        .lineItems(lineItems)
        .build();
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
