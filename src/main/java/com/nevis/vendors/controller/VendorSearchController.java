package com.nevis.vendors.controller;

import com.nevis.vendors.config.PipelineProperties;
import com.nevis.vendors.exception.WrongQueryException;
import com.nevis.vendors.service.VendorSearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/vendors")
@RequiredArgsConstructor
public class VendorSearchController {

    private static final int MAX_LIMIT = 100;

    private final VendorSearchService vendorSearchService;
    private final PipelineProperties pipelineProperties;

    @GetMapping("/search")
    public ResponseEntity<VendorSearchResponse> search(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "category", required = false) String category,
        @RequestParam(name = "k", required = false) Integer limit,
        @RequestParam(name = "optimize", defaultValue = "true") boolean optimize) {

        int k = limit != null ? limit : pipelineProperties.topK();
        if (k < 1 || k > MAX_LIMIT) {
            throw new WrongQueryException("Parameter 'k' must be between 1 and " + MAX_LIMIT);
        }

        return ResponseEntity.ok(VendorSearchResponse.from(vendorSearchService.search(query, category, k, optimize)));
    }
}
