package com.flamingo.ai.rapiddocs.service.importer;

import com.flamingo.ai.rapiddocs.domain.enums.VisualizationType;
import com.flamingo.ai.rapiddocs.domain.model.LineItemEntry;
import com.flamingo.ai.rapiddocs.domain.model.StatisticEntry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One row of an imported file, keyed by lower-cased column header.
 *
 * <p>Column names are matched loosely: each target field accepts a list of aliases and the first
 * alias present in the row wins.
 */
public record ImportedRecord(int rowNumber, Map<String, String> values) {

  static final List<String> NAME_COLUMNS =
      List.of("name", "label", "title", "statistic", "stat_name");
  static final List<String> VALUE_COLUMNS =
      List.of("value", "amount", "number", "quantity", "stat_value");
  static final List<String> UNIT_COLUMNS = List.of("unit", "units", "measurement", "uom");
  static final List<String> TYPE_COLUMNS =
      List.of("visualization_type", "viz_type", "chart_type", "chart", "type");
  static final List<String> CATEGORY_COLUMNS = List.of("category", "group", "cat");
  static final List<String> DESCRIPTION_COLUMNS =
      List.of("description", "desc", "details", "notes");

  static final List<String> ITEM_COLUMNS = List.of("description", "item", "desc", "name");
  static final List<String> QUANTITY_COLUMNS = List.of("quantity", "qty", "hours", "units");
  static final List<String> PRICE_COLUMNS = List.of("unit_price", "price", "rate", "amount");
  static final List<String> TAX_COLUMNS = List.of("tax_rate", "tax", "vat");

  public ImportedRecord {
    Map<String, String> normalized = new LinkedHashMap<>();
    if (values != null) {
      values.forEach(
          (key, value) -> {
            if (key != null) {
              String column = key.strip().toLowerCase(Locale.ROOT);
              normalized.put(column, value == null ? "" : value.strip());
            }
          });
    }
    values = Collections.unmodifiableMap(normalized);
  }

  /** The first non-empty value among {@code aliases}, or empty. */
  public String first(List<String> aliases) {
    for (String alias : aliases) {
      String value = values.get(alias);
      if (value != null && !value.isEmpty()) {
        return value;
      }
    }
    return "";
  }

  /**
   * Reads the row as a statistic. Missing name becomes "Unnamed", missing unit "units", a missing
   * or unknown chart type BAR and an unparsable value 0.
   */
  public StatisticEntry toStatistic() {
    String name = first(NAME_COLUMNS);
    String unit = first(UNIT_COLUMNS);
    String category = first(CATEGORY_COLUMNS);
    String description = first(DESCRIPTION_COLUMNS);
    return new StatisticEntry(
        name.isEmpty() ? "Unnamed" : name,
        parseNumber(first(VALUE_COLUMNS), 0),
        unit.isEmpty() ? "units" : unit,
        VisualizationType.fromName(first(TYPE_COLUMNS)),
        category.isEmpty() ? null : category,
        description.isEmpty() ? null : description);
  }

  /** Reads the row as an invoice line item; range normalization is left to the caller. */
  public LineItemEntry toLineItem() {
    return new LineItemEntry(
        first(ITEM_COLUMNS),
        parseNumber(first(QUANTITY_COLUMNS), 1),
        parseNumber(first(PRICE_COLUMNS), 0),
        parseNumber(first(TAX_COLUMNS), 0));
  }

  /** Accepts "1,500", "$12.50" and "8%"; anything else yields {@code fallback}. */
  static double parseNumber(String raw, double fallback) {
    String cleaned = raw.replace(",", "").replace("$", "").replace("%", "").strip();
    if (cleaned.isEmpty()) {
      return fallback;
    }
    try {
      return Double.parseDouble(cleaned);
    } catch (NumberFormatException e) {
      return fallback;
    }
  }
}
