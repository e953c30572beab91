package com.findex.backend.controller;

import com.findex.backend.service.ExportRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/regions")
@RequiredArgsConstructor
@Tag(name = "Regions")
public class RegionController {

    private final ExportRunService exportRunService;

    @GetMapping
    @Operation(summary = "List regions available for export, filtered by name prefix")
    public ResponseEntity<List<String>> listRegions(@RequestParam(value = "prefix", required = false) String prefix) {
        return ResponseEntity.ok(exportRunService.listRegions(prefix));
    }
}
