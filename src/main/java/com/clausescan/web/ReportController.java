package com.clausescan.web;

import com.clausescan.api.AnalysisGateway;
import com.clausescan.processing.catalog.PatternCatalog;
import com.clausescan.processing.model.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Renders the HTML report for text submitted through the paste form.
 */
@Controller
public class ReportController {

    private static final Logger logger = LoggerFactory.getLogger(ReportController.class);

    private final AnalysisGateway analysisGateway;
    private final PatternCatalog catalog;

    public ReportController(AnalysisGateway analysisGateway, PatternCatalog catalog) {
        this.analysisGateway = analysisGateway;
        this.catalog = catalog;
    }

    @PostMapping("/analyze")
    public String analyze(@RequestParam(value = "text", required = false) String text,
                          @RequestParam(value = "name", required = false) String name,
                          Model model) {
        model.addAttribute("catalogVersion", catalog.getVersion());
        if (text == null || text.isBlank()) {
            model.addAttribute("error", "Paste the text of a document to analyze.");
            return "index";
        }
        logger.info("Rendering report page: {} characters", text.length());

        AnalysisResult result;
        try {
            result = analysisGateway.analyze(text);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected form submission: {}", e.getMessage());
            model.addAttribute("error", e.getMessage());
            model.addAttribute("text", text);
            return "index";
        }

        model.addAttribute("name", name != null && !name.isBlank() ? name.strip() : "Pasted document");
        model.addAttribute("result", result);
        return "report";
    }
}
