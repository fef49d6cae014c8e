package com.flamingo.ai.rapiddocs.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.rapiddocs.domain.model.InvoiceExtraction;
import com.flamingo.ai.rapiddocs.domain.model.LineItemEntry;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class InvoiceRegexExtractorTest {

  private static final String ACME_PROMPT =
      "Vendor: Acme Corp, 1 Main St. Customer: Jane Doe at Widgets Inc, 2 Oak Ave. "
          + "Items: Widget ($10 x 3), Gadget ($25 x 2). tax rate: 8%.";

  private final InvoiceRegexExtractor extractor = new InvoiceRegexExtractor();

  @Nested
  @DisplayName("Parties")
  class Parties {

    @Test
    void shouldSplitLabeledVendorIntoNameAndAddress() {
      InvoiceExtraction result = extractor.extract(ACME_PROMPT);

      assertThat(result.vendorName()).isEqualTo("Acme Corp");
      assertThat(result.vendorAddress()).isEqualTo("1 Main St");
    }

    @Test
    void shouldKeepCompanyWithPerson_whenClientIsPersonAtCompany() {
      InvoiceExtraction result = extractor.extract(ACME_PROMPT);

      assertThat(result.clientName()).isEqualTo("Jane Doe at Widgets Inc");
      assertThat(result.clientAddress()).isEqualTo("2 Oak Ave");
    }

    @Test
    void shouldFallBackToFromAndBillTo_whenNoLabels() {
      InvoiceExtraction result =
          extractor.extract("Invoice from Northwind Traders to Contoso Ltd for design work");

      assertThat(result.vendorName()).isEqualTo("Northwind Traders");
      assertThat(result.clientName()).isEqualTo("Contoso Ltd");
      assertThat(result.vendorAddress()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Line items")
  class LineItems {

    @Test
    void shouldParseItemsBlockWithTaxRate() {
      List<LineItemEntry> items = extractor.extract(ACME_PROMPT).lineItems();

      assertThat(items).hasSize(2);
      assertThat(items.get(0).description()).isEqualTo("Widget");
      assertThat(items.get(0).unitPrice()).isEqualTo(10.0);
      assertThat(items.get(0).quantity()).isEqualTo(3.0);
      assertThat(items.get(1).description()).isEqualTo("Gadget");
      assertThat(items.get(1).unitPrice()).isEqualTo(25.0);
      assertThat(items.get(1).quantity()).isEqualTo(2.0);
      assertThat(items)
          .allSatisfy(item -> assertThat(item.taxRate()).isCloseTo(0.08, within(1e-9)));
    }

    @Test
    void shouldParseHourPhrasing() {
      List<LineItemEntry> items =
          extractor.extract("Bill 10 hours of consulting at $150 per hour").lineItems();

      assertThat(items).hasSize(1);
      assertThat(items.get(0).description()).isEqualTo("consulting");
      assertThat(items.get(0).quantity()).isEqualTo(10.0);
      assertThat(items.get(0).unitPrice()).isEqualTo(150.0);
    }

    @Test
    void shouldParseQuantityPhrasing() {
      List<LineItemEntry> items = extractor.extract("5 licenses at $200 each").lineItems();

      assertThat(items).extracting(LineItemEntry::description).containsExactly("licenses");
      assertThat(items.get(0).unitPrice()).isEqualTo(200.0);
    }

    @Test
    void shouldReturnNoItems_whenPromptHasNone() {
      assertThat(extractor.extract("Please create an invoice").lineItems()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Currency, terms and notes")
  class Other {

    @Test
    void shouldDefaultToUsd() {
      assertThat(extractor.extract(ACME_PROMPT).currency()).isEqualTo("USD");
    }

    @Test
    void shouldDetectEuroAndPound() {
      assertThat(extractor.extract("Total 300 euros").currency()).isEqualTo("EUR");
      assertThat(extractor.extract("Total £300").currency()).isEqualTo("GBP");
    }

    @Test
    void shouldNotTreatWordsContainingEurAsEuro() {
      assertThat(extractor.extract("Amateur league sponsorship").currency()).isEqualTo("USD");
    }

    @Test
    void shouldExtractPaymentTermsAndNotes() {
      InvoiceExtraction result =
          extractor.extract("Payment terms: Net 15. Notes: Thanks for the quick turnaround.");

      assertThat(result.paymentTerms()).isEqualTo("Net 15");
      assertThat(result.notes()).isEqualTo("Thanks for the quick turnaround");
    }

    @Test
    void shouldAlwaysSynthesizeInvoiceNumber() {
      assertThat(extractor.extract(ACME_PROMPT).invoiceNumber()).matches("INV-\\d{8}-\\d{4}");
    }
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(
      strings = {"   ", "((($$$ x x x", "Items: (", "tax rate: %", "1.2.3 hours of x at $1.2.3"})
  void shouldNeverThrow(String prompt) {
    assertThatCode(() -> extractor.extract(prompt)).doesNotThrowAnyException();
  }
}
