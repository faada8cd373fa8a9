package com.example.demo.batchpdf.service;

import com.example.demo.batchpdf.conversion.ConversionEngine;
import com.example.demo.batchpdf.export.NativeOfficeChannel;
import com.example.demo.batchpdf.model.DocumentKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reports which export engines this host can use.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnvironmentInspector {
    private final ConversionEngine conversionEngine;
    private final NativeOfficeChannel nativeChannel;

    public Map<String, Object> inspect() {
        Map<String, Object> out = new LinkedHashMap<>();

        Optional<String> version = conversionEngine.detectVersion();
        Map<String, Object> engine = new LinkedHashMap<>();
        engine.put("name", conversionEngine.getName());
        engine.put("available", version.isPresent());
        version.ifPresent(v -> engine.put("version", v));
        out.put("conversionEngine", engine);

        Map<String, Object> office = new LinkedHashMap<>();
        office.put("os", System.getProperty("os.name"));
        office.put("word", nativeChannel.isReady(DocumentKind.WORD_PROCESSING));
        office.put("powerpoint", nativeChannel.isReady(DocumentKind.SLIDE_DECK));
        out.put("nativeOffice", office);

        log.info("[Check] {}: {} ({})", conversionEngine.getName(),
                version.isPresent() ? "OK" : "NOT FOUND", version.orElse("-"));
        log.info("[Check] OS: {} | Word: {} | PowerPoint: {}", office.get("os"), office.get("word"), office.get("powerpoint"));
        return out;
    }
}
