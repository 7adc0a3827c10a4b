package com.lynkvertx.evfeas.controller;

import com.lynkvertx.evfeas.dto.AnalysisRequestDTO;
import com.lynkvertx.evfeas.dto.ApiResponse;
import com.lynkvertx.evfeas.dto.BatchAnalysisResultDTO;
import com.lynkvertx.evfeas.dto.ChargerMixRequestDTO;
import com.lynkvertx.evfeas.dto.ChargerMixResultDTO;
import com.lynkvertx.evfeas.dto.FileAnalysisDTO;
import com.lynkvertx.evfeas.service.FeasibilityAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import javax.validation.Valid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * EV Charger Feasibility REST Controller
 */
@RestController
@RequestMapping("/api/feasibility")
@RequiredArgsConstructor
@Tag(name = "Feasibility", description = "Load profile analysis and charger capacity APIs")
public class FeasibilityController {

    private final FeasibilityAnalysisService analysisService;

    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Analyse load profiles",
        description = "Normalize each uploaded CSV/Excel file into an hourly max-demand profile and evaluate charger headroom")
    public ResponseEntity<ApiResponse<BatchAnalysisResultDTO>> analyze(
            @RequestPart("files") List<MultipartFile> files,
            @Valid @RequestPart(value = "request", required = false) AnalysisRequestDTO request) {
        BatchAnalysisResultDTO result = analysisService.analyze(files, request != null ? request : new AnalysisRequestDTO());

        List<String> warnings = new ArrayList<>();
        for (FileAnalysisDTO file : result.getFiles()) {
            if (file.getWarnings() != null) {
                file.getWarnings().forEach(w -> warnings.add(file.getFileName() + ": " + w));
            }
        }
        return ResponseEntity.ok(ApiResponse.success("Analysis completed", result, warnings));
    }

    @PostMapping(value = "/export", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = "text/csv")
    @Operation(summary = "Export analysis CSV", description = "Analyse a single file and download its per-hour records as CSV")
    public ResponseEntity<byte[]> export(
            @RequestPart("file") MultipartFile file,
            @Valid @RequestPart(value = "request", required = false) AnalysisRequestDTO request) throws IOException {
        String csv = analysisService.exportCsv(file, request != null ? request : new AnalysisRequestDTO());
        ContentDisposition disposition = ContentDisposition.attachment()
            .filename(file.getOriginalFilename() + "_analysis.csv")
            .build();
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
            .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
            .body(csv.getBytes(StandardCharsets.UTF_8));
    }

    @PostMapping("/charger-mix")
    @Operation(summary = "Approximate charger mix",
        description = "Greedy largest-first allocation of charger units into each hour's headroom (not guaranteed optimal)")
    public ResponseEntity<ApiResponse<ChargerMixResultDTO>> chargerMix(@Valid @RequestBody ChargerMixRequestDTO request) {
        ChargerMixResultDTO result = analysisService.chargerMix(request);
        return ResponseEntity.ok(ApiResponse.success("Charger mix calculated", result));
    }
}
