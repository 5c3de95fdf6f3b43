package com.clausescan.web;

import com.clausescan.processing.catalog.PatternCatalog;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Controller for the root landing page with the paste form.
 */
@Controller
public class HomeController {

    private final PatternCatalog catalog;

    public HomeController(PatternCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/")
    public String index(Model model) {
        model.addAttribute("catalogVersion", catalog.getVersion());
        return "index";
    }
}
