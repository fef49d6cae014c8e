package com.flamingo.ai.rapiddocs.api.dto.request;

import com.flamingo.ai.rapiddocs.domain.model.LineItemEntry;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** An invoice line item supplied explicitly with an invoice request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineItemRequest {

  @NotBlank(message = "Line item description is required")
  private String description;

  @NotNull(message = "Quantity is required")
  @Positive(message = "Quantity must be positive")
  private Double quantity;

  @NotNull(message = "Unit price is required")
  @PositiveOrZero(message = "Unit price must not be negative")
  private Double unitPrice;

  @DecimalMin(value = "0.0", message = "Tax rate must be between 0 and 1")
  @DecimalMax(value = "1.0", message = "Tax rate must be between 0 and 1")
  @Builder.Default
  private Double taxRate = 0.0;

  public LineItemEntry toEntry() {
    return new LineItemEntry(description, quantity, unitPrice, taxRate == null ? 0 : taxRate);
  }
}
