package com.finvolv.lease.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Base64 encoded output workbooks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutputFiles {

    private String lease;
    private String single;
    private String income;
}
