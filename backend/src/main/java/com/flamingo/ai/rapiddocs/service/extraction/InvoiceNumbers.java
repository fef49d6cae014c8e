package com.flamingo.ai.rapiddocs.service.extraction;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;

/** Synthesizes invoice numbers of the form {@code INV-yyyyMMdd-NNNN}. */
final class InvoiceNumbers {

  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

  private InvoiceNumbers() {}

  static String next() {
    int suffix = ThreadLocalRandom.current().nextInt(1000, 10000);
    return "INV-" + LocalDate.now().format(DATE) + "-" + suffix;
  }
}
