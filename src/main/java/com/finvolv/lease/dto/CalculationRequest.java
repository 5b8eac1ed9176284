package com.finvolv.lease.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Multipart fields of a calculation upload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalculationRequest {

    @NotNull(message = "Missing file")
    @Size(min = 1, message = "The uploaded file is empty")
    private byte[] workbook;

    @NotBlank(message = "Missing start month (expected yyyy-MM or yyyy-MM-dd)")
    private String start;

    @NotBlank(message = "Missing end month (expected yyyy-MM or yyyy-MM-dd)")
    private String end;

    private boolean diagnostics;
}
