package com.flamingo.ai.rapiddocs.service.extraction;

import static com.flamingo.ai.rapiddocs.service.extraction.PlaceholderSentinels.orDefault;
import static com.flamingo.ai.rapiddocs.service.extraction.PlaceholderSentinels.pickBest;

import com.flamingo.ai.rapiddocs.domain.model.InvoiceExtraction;
import com.flamingo.ai.rapiddocs.domain.model.LineItemEntry;
import java.util.List;
import org.springframework.stereotype.Component;

/** Merges invoice extractions, AI first, and fills the remaining gaps with generic defaults. */
@Component
public class InvoiceExtractionMerger implements ExtractionMerger<InvoiceExtraction> {

  static final String DEFAULT_CURRENCY = "USD";
  static final String DEFAULT_PAYMENT_TERMS = "Net 30 days";
  static final String DEFAULT_NOTES = "Thank you for your business!";

  public static final List<LineItemEntry> DEFAULT_LINE_ITEMS =
      List.of(
          new LineItemEntry("Professional Services", 10, 150.00, 0.0),
          new LineItemEntry("Consultation Hours", 5, 200.00, 0.0));

  @Override
  public InvoiceExtraction merge(InvoiceExtraction ai, InvoiceExtraction regex) {
    List<LineItemEntry> lineItems =
        hasRealItems(ai.lineItems()) ? ai.lineItems() : regex.lineItems();

    InvoiceExtraction merged =
        InvoiceExtraction.builder()
            .invoiceNumber(orDefault(ai.invoiceNumber(), regex.invoiceNumber()))
            .vendorName(
                pickBest(ai.vendorName(), regex.vendorName(), PlaceholderSentinels.VENDOR_NAMES))
            .vendorAddress(
                pickBest(
                    ai.vendorAddress(),
                    regex.vendorAddress(),
                    PlaceholderSentinels.VENDOR_ADDRESSES))
            .clientName(
                pickBest(ai.clientName(), regex.clientName(), PlaceholderSentinels.CLIENT_NAMES))
            .clientAddress(
                pickBest(
                    ai.clientAddress(),
                    regex.clientAddress(),
                    PlaceholderSentinels.CLIENT_ADDRESSES))
            .currency(orDefault(ai.currency(), regex.currency()))
            .paymentTerms(orDefault(ai.paymentTerms(), regex.paymentTerms()))
            .notes(orDefault(ai.notes(), regex.notes()))
            .lineItems(lineItems)
            .build();
    return fillDefaults(merged);
  }

  @Override
  public InvoiceExtraction fillDefaults(InvoiceExtraction result) {
    List<LineItemEntry> items =
        result.lineItems().isEmpty() ? DEFAULT_LINE_ITEMS : result.lineItems();

    return result.toBuilder()
        .invoiceNumber(orDefault(result.invoiceNumber(), InvoiceNumbers.next()))
        .vendorName(orDefault(result.vendorName(), PlaceholderSentinels.DEFAULT_VENDOR_NAME))
        .vendorAddress(
            orDefault(result.vendorAddress(), PlaceholderSentinels.DEFAULT_VENDOR_ADDRESS))
        .clientName(orDefault(result.clientName(), PlaceholderSentinels.DEFAULT_CLIENT_NAME))
        .clientAddress(
            orDefault(result.clientAddress(), PlaceholderSentinels.DEFAULT_CLIENT_ADDRESS))
        .currency(orDefault(result.currency(), DEFAULT_CURRENCY))
        .paymentTerms(orDefault(result.paymentTerms(), DEFAULT_PAYMENT_TERMS))
        .notes(orDefault(result.notes(), DEFAULT_NOTES))
        .lineItems(items.stream().map(LineItemEntry::normalized).toList())
        .build();
  }

  private static boolean hasRealItems(List<LineItemEntry> items) {
    return !items.isEmpty()
        && !items.stream()
            .allMatch(
                item ->
                    PlaceholderSentinels.LINE_ITEM_DESCRIPTIONS.contains(item.description()));
  }
}
