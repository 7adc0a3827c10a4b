package com.lynkvertx.evfeas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result DTO for a multi-file upload. Files are reported in upload order;
 * a failed file does not prevent the others from being analysed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchAnalysisResultDTO {

    private List<FileAnalysisDTO> files;

    private int analysedCount;

    private int failedCount;
}
