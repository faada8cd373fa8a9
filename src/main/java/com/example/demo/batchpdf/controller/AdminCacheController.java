package com.example.demo.batchpdf.controller;

import com.example.demo.batchpdf.service.CacheInspectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.CacheManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only cache inspection. Converted templates stay cached for the life of
 * the process, so there is no eviction endpoint.
 */
@RestController
@RequestMapping("/api/admin/cache")
@RequiredArgsConstructor
public class AdminCacheController {
    private final CacheInspectionService inspectionService;
    private final CacheManager cacheManager;

    @GetMapping
    public ResponseEntity<List<String>> listCaches() {
        return ResponseEntity.ok(List.copyOf(cacheManager.getCacheNames()));
    }

    @GetMapping("/{cacheName}")
    public ResponseEntity<Map<String, Object>> inspectCache(@PathVariable String cacheName) {
        return ResponseEntity.ok(inspectionService.inspectCache(cacheName));
    }

    @GetMapping("/all")
    public ResponseEntity<List<Map<String, Object>>> inspectAll() {
        return ResponseEntity.ok(inspectionService.inspectAllCaches());
    }
}
