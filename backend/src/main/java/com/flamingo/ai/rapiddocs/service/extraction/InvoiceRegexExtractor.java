package com.flamingo.ai.rapiddocs.service.extraction;

import com.flamingo.ai.rapiddocs.domain.model.InvoiceExtraction;
import com.flamingo.ai.rapiddocs.domain.model.LineItemEntry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts invoice fields from labeled or relational phrasing in a prompt.
 *
 * <p>Recognized forms: {@code Vendor: Name, Address}, {@code from Name}, {@code Customer: Person
 * at Company, Address}, {@code bill to Name}, {@code Items: Name ($P x Q), ...}, {@code N hours of
 * X at $P}, {@code N things at $P each}, {@code tax rate: N%}, {@code payment terms: ...} and
 * {@code notes: ...}.
 */
@Component
@Slf4j
public class InvoiceRegexExtractor implements RegexExtractor<InvoiceExtraction> {

  private static final int FLAGS = Pattern.CASE_INSENSITIVE;

  private static final Pattern VENDOR_LABEL =
      Pattern.compile("vendor[:\\s]+\\s*([^.]+?)(?:\\.\\s|$)", FLAGS);
  private static final Pattern FROM =
      Pattern.compile(
          "\\bfrom\\s+([A-Z][A-Za-z0-9\\s&.]+?)(?:\\s+to\\s|\\s+for\\s|,|\\.|$)", FLAGS);
  private static final Pattern CLIENT_LABEL =
      Pattern.compile("(?:customer|client)[:\\s]+\\s*([^.]+?)(?:\\.\\s|$)", FLAGS);
  private static final Pattern BILL_TO =
      Pattern.compile(
          "(?:\\bto\\b|bill\\s+to)[:\\s]+\\s*([A-Z][A-Za-z0-9\\s&.]+?)"
              + "(?:\\s+for\\s|\\s+invoice|,|\\.|$)",
          FLAGS);

  private static final Pattern TAX_RATE =
      Pattern.compile("tax(?:\\s+rate)?[:\\s]+(\\d+(?:\\.\\d+)?)\\s*%", FLAGS);
  private static final Pattern PAYMENT_TERMS =
      Pattern.compile("payment\\s+terms?[:\\s]+([^.]+?)(?:\\.|$)", FLAGS);
  private static final Pattern NOTES =
      Pattern.compile(
          "notes?[:\\s]+\\s*(.+?)(?:\\s*(?:payment|tax|items?|vendor|customer|client)[:\\s]|$)",
          FLAGS | Pattern.DOTALL);

  private static final Pattern ITEMS_BLOCK =
      Pattern.compile("items?[:\\s]+\\s*([^.]+?)(?:\\.\\s|\\.\\s*$|$)", FLAGS);
  private static final Pattern BLOCK_ITEM =
      Pattern.compile("([^(,]+?)\\s*\\(\\s*\\$?([\\d.]+)\\s*x\\s*(\\d+)\\s*\\)", FLAGS);
  private static final Pattern HOURS_ITEM =
      Pattern.compile(
          "(\\d+(?:\\.\\d+)?)\\s*(?:hours?|hrs?|units?)\\s+(?:of\\s+)?(.+?)\\s+at\\s+"
              + "\\$?(\\d+(?:[.,]\\d+)?)\\s*(?:per\\s+hour|/\\s*h(?:ou)?r|each|per\\s+unit)?",
          FLAGS);
  private static final Pattern QUANTITY_ITEM =
      Pattern.compile(
          "(\\d+(?:\\.\\d+)?)\\s+([a-zA-Z][a-zA-Z\\s]+?)\\s+at\\s+\\$?(\\d+(?:[.,]\\d+)?)"
              + "\\s*(?:each|per\\s+unit|apiece)?",
          FLAGS);

  private static final Pattern EUR = Pattern.compile("€|\\beur(?:os?)?\\b", FLAGS);
  private static final Pattern GBP = Pattern.compile("£|\\bgbp\\b|\\bpounds?\\b", FLAGS);

  @Override
  public InvoiceExtraction extract(String prompt) {
    String text = prompt == null ? "" : prompt;
    String[] vendor = extractVendor(text);
    String[] client = extractClient(text);
    double taxRate = extractTaxRate(text);

    InvoiceExtraction result =
        InvoiceExtraction.builder()
            .invoiceNumber(InvoiceNumbers.next())
            .vendorName(vendor[0])
            .vendorAddress(vendor[1])
            .clientName(client[0])
            .clientAddress(client[1])
            .currency(detectCurrency(text))
            .paymentTerms(firstGroup(PAYMENT_TERMS, text))
            .notes(extractNotes(text))
            .lineItems(extractLineItems(text, taxRate))
            .build();

    log.debug(
        "Regex extracted: vendor='{}', client='{}', items={}",
        result.vendorName(),
        result.clientName(),
        result.lineItems().size());
    return result;
  }

  private static String[] extractVendor(String text) {
    Matcher label = VENDOR_LABEL.matcher(text);
    if (label.find()) {
      return splitNameAndAddress(label.group(1).trim());
    }
    Matcher from = FROM.matcher(text);
    if (from.find()) {
      return new String[] {stripTrailing(from.group(1).trim(), ",."), ""};
    }
    return new String[] {"", ""};
  }

  private static String[] extractClient(String text) {
    Matcher label = CLIENT_LABEL.matcher(text);
    if (label.find()) {
      String full = label.group(1).trim();
      int at = full.indexOf(" at ");
      if (at < 0) {
        return splitNameAndAddress(full);
      }
      // "Person at Company, Address": the company belongs to the name
      String person = full.substring(0, at).trim();
      String[] company = splitNameAndAddress(full.substring(at + 4).trim());
      return new String[] {person + " at " + company[0], company[1]};
    }
    Matcher billTo = BILL_TO.matcher(text);
    if (billTo.find()) {
      return new String[] {stripTrailing(billTo.group(1).trim(), ",."), ""};
    }
    return new String[] {"", ""};
  }

  private static String[] splitNameAndAddress(String text) {
    String[] parts = text.split(",");
    String name = parts[0].trim();
    String address =
        Arrays.stream(parts).skip(1).map(String::trim).collect(Collectors.joining(", "));
    return new String[] {name, address};
  }

  private static String detectCurrency(String text) {
    if (EUR.matcher(text).find()) {
      return "EUR";
    }
    if (GBP.matcher(text).find()) {
      return "GBP";
    }
    return "USD";
  }

  private static double extractTaxRate(String text) {
    Matcher matcher = TAX_RATE.matcher(text);
    return matcher.find() ? Double.parseDouble(matcher.group(1)) / 100 : 0.0;
  }

  private static String extractNotes(String text) {
    Matcher matcher = NOTES.matcher(text);
    if (!matcher.find()) {
      return "";
    }
    return stripTrailing(matcher.group(1).trim(), ".");
  }

  /** Block items first; hour/unit phrasing only when none matched, quantity phrasing last. */
  static List<LineItemEntry> extractLineItems(String text, double taxRate) {
    List<LineItemEntry> items = new ArrayList<>();

    Matcher block = ITEMS_BLOCK.matcher(text);
    if (block.find()) {
      Matcher item = BLOCK_ITEM.matcher(block.group(1));
      while (item.find()) {
        String description = cleanDescription(item.group(1));
        Double price = parseNumber(item.group(2));
        if (!description.isEmpty() && price != null) {
          items.add(
              new LineItemEntry(description, Double.parseDouble(item.group(3)), price, taxRate));
        }
      }
    }

    if (items.isEmpty()) {
      Matcher hours = HOURS_ITEM.matcher(text);
      while (hours.find()) {
        String description = cleanDescription(hours.group(2));
        Double price = parseNumber(hours.group(3));
        if (!description.isEmpty() && price != null) {
          items.add(
              new LineItemEntry(description, Double.parseDouble(hours.group(1)), price, taxRate));
        }
      }
    }

    if (items.isEmpty()) {
      Matcher quantity = QUANTITY_ITEM.matcher(text);
      while (quantity.find()) {
        String description = cleanDescription(quantity.group(2));
        Double price = parseNumber(quantity.group(3));
        boolean duplicate =
            items.stream().anyMatch(i -> i.description().equalsIgnoreCase(description));
        if (!description.isEmpty() && price != null && !duplicate) {
          items.add(
              new LineItemEntry(
                  description, Double.parseDouble(quantity.group(1)), price, taxRate));
        }
      }
    }
    return items;
  }

  private static String cleanDescription(String raw) {
    return stripTrailing(raw.trim(), ",").trim();
  }

  /** Parses "1,500" or "12.50"; null when the text is not a number (e.g. "1.2.3"). */
  private static Double parseNumber(String raw) {
    try {
      return Double.parseDouble(raw.replace(",", ""));
    } catch (NumberFormatException e) {
      log.debug("Ignoring unparsable amount '{}'", raw);
      return null;
    }
  }

  private static String firstGroup(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    return matcher.find() ? matcher.group(1).trim() : "";
  }

  private static String stripTrailing(String value, String chars) {
    int end = value.length();
    while (end > 0 && chars.indexOf(value.charAt(end - 1)) >= 0) {
      end--;
    }
    return value.substring(0, end);
  }
}
