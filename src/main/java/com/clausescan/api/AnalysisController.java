package com.clausescan.api;

import com.clausescan.processing.catalog.PatternCatalog;
import com.clausescan.processing.model.AnalysisResult;
import com.clausescan.shared.dto.AnalyzeTextRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Analysis", description = "Single-document analysis endpoints")
public class AnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisGateway analysisGateway;
    private final PatternCatalog catalog;

    public AnalysisController(AnalysisGateway analysisGateway, PatternCatalog catalog) {
        this.analysisGateway = analysisGateway;
        this.catalog = catalog;
    }

    @PostMapping(value = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Analyze pasted text",
               description = "Classifies the text, scores its risk and returns key points, red flags and a checklist")
    public ResponseEntity<AnalysisResult> analyze(@Valid @RequestBody AnalyzeTextRequest request) {
        logger.info("Received analyze request: {} characters", request.getText().length());
        return ResponseEntity.ok(analysisGateway.analyze(request.getText()));
    }

    @PostMapping(value = "/analyze/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Analyze an uploaded file",
               description = "Accepts .txt, .pdf or image files. Images yield no text because OCR is not bundled.")
    public ResponseEntity<AnalysisResult> analyzeUpload(
            @Parameter(description = "Document to analyze")
            @RequestParam("file") MultipartFile file) throws IOException {
        logger.info("Received upload request: filename={}, size={}, contentType={}",
                file.getOriginalFilename(), file.getSize(), file.getContentType());
        return ResponseEntity.ok(analysisGateway.analyzeUpload(file.getOriginalFilename(), file.getBytes()));
    }

    @GetMapping("/catalog")
    @Operation(summary = "Describe the loaded pattern catalog")
    public ResponseEntity<Map<String, Object>> catalog() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("version", catalog.getVersion());
        response.put("documentTypes", catalog.getClassificationRules().size());
        response.put("universalKeyPoints", catalog.getUniversalKeyPointCategories().size());
        response.put("riskPatterns", catalog.getRiskPatterns().size());
        response.put("redFlagPatterns", catalog.getRedFlagPatterns().size());
        response.put("checklistRules", catalog.getChecklistRules().size());
        return ResponseEntity.ok(response);
    }
}
