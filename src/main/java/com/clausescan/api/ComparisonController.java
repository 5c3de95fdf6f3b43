package com.clausescan.api;

import com.clausescan.processing.model.ComparisonResult;
import com.clausescan.processing.model.NamedDocument;
import com.clausescan.processing.model.RankingResult;
import com.clausescan.shared.dto.CompareRequest;
import com.clausescan.shared.dto.DocumentInput;
import com.clausescan.shared.dto.RankRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
@Tag(name = "Comparison", description = "Multi-document comparison and ranking")
public class ComparisonController {

    private static final Logger logger = LoggerFactory.getLogger(ComparisonController.class);

    private final AnalysisGateway analysisGateway;

    public ComparisonController(AnalysisGateway analysisGateway) {
        this.analysisGateway = analysisGateway;
    }

    @PostMapping("/compare")
    @Operation(summary = "Compare two documents", description = "Analyzes both documents and reports which is safer")
    public ResponseEntity<ComparisonResult> compare(@Valid @RequestBody CompareRequest request) {
        NamedDocument left = toNamed(request.getLeft(), "Document A");
        NamedDocument right = toNamed(request.getRight(), "Document B");
        logger.info("Received compare request: left='{}', right='{}'", left.getName(), right.getName());
        return ResponseEntity.ok(analysisGateway.compare(left, right));
    }

    @PostMapping("/rank")
    @Operation(summary = "Rank 2-8 documents", description = "Orders documents from riskiest (rank 1) to safest")
    public ResponseEntity<RankingResult> rank(@Valid @RequestBody RankRequest request) {
        logger.info("Received rank request: {} documents", request.getDocuments().size());
        List<NamedDocument> documents = request.getDocuments().stream()
                .map(input -> new NamedDocument(input.getName(), input.getText()))
                .collect(Collectors.toList());
        return ResponseEntity.ok(analysisGateway.rank(documents));
    }

    private static NamedDocument toNamed(DocumentInput input, String defaultName) {
        String name = input.getName() != null && !input.getName().isBlank() ? input.getName().strip() : defaultName;
        return new NamedDocument(name, input.getText());
    }
}
