package com.example.demo.batchpdf.conversion;

import com.example.demo.batchpdf.aspect.LogExecutionTime;
import com.example.demo.batchpdf.config.CacheConfiguration;
import com.example.demo.batchpdf.exception.ConversionException;
import com.example.demo.batchpdf.exception.UnsupportedTemplateFormatException;
import com.example.demo.batchpdf.model.DocumentKind;
import com.github.benmanes.caffeine.cache.Cache;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Turns legacy or open-format templates into the canonical editable form
 * (.docx / .pptx) so the document walker only deals with two formats.
 *
 * Converted copies are cached per source file for the lifetime of the process.
 * The cache's compute-if-absent guarantees one conversion per key; callers
 * asking for the same key meanwhile wait for that result. A conversion that
 * throws leaves no entry behind, so the next request tries again.
 */
@Slf4j
@Component
public class FormatNormalizer {
    static final Map<String, DocumentKind> LEGACY_FORMATS = Map.of(
            "doc", DocumentKind.WORD_PROCESSING,
            "odt", DocumentKind.WORD_PROCESSING,
            "rtf", DocumentKind.WORD_PROCESSING,
            "ppt", DocumentKind.SLIDE_DECK,
            "odp", DocumentKind.SLIDE_DECK);

    private final ConversionEngine conversionEngine;
    private final Cache<Object, Object> cache;
    private final List<Path> scratchDirs = new CopyOnWriteArrayList<>();

    public FormatNormalizer(ConversionEngine conversionEngine, CacheManager cacheManager) {
        this.conversionEngine = conversionEngine;
        org.springframework.cache.Cache springCache = cacheManager.getCache(CacheConfiguration.NORMALIZED_TEMPLATES);
        if (!(springCache instanceof CaffeineCache)) {
            throw new IllegalStateException("Cache '" + CacheConfiguration.NORMALIZED_TEMPLATES
                    + "' must be a CaffeineCache");
        }
        this.cache = ((CaffeineCache) springCache).getNativeCache();
    }

    /**
     * Returns a path to an editable .docx/.pptx for the given template.
     *
     * @throws UnsupportedTemplateFormatException for extensions outside the conversion table
     * @throws ConversionException if the conversion engine fails or produces nothing
     */
    @LogExecutionTime("FormatNormalizer.normalize")
    public Path normalize(Path source) {
        if (DocumentKind.fromPath(source).isPresent()) {
            return source;
        }
        String extension = DocumentKind.extensionOf(source);
        DocumentKind target = LEGACY_FORMATS.get(extension);
        if (target == null) {
            throw new UnsupportedTemplateFormatException("." + extension);
        }

        String key = cacheKey(source);
        Object cached = cache.get(key, k -> convert(source, target));
        return (Path) cached;
    }

    public boolean isCached(Path source) {
        return cache.getIfPresent(cacheKey(source)) != null;
    }

    static String cacheKey(Path source) {
        try {
            return source.toRealPath().toString();
        } catch (IOException e) {
            return source.toAbsolutePath().normalize().toString();
        }
    }

    private Path convert(Path source, DocumentKind target) {
        log.info("Converting {} to .{}", source.getFileName(), target.getExtension());
        Path scratch;
        try {
            scratch = Files.createTempDirectory("batchpdf-convert-");
        } catch (IOException e) {
            throw new ConversionException(ConversionException.CONVERSION_FAILED,
                    "Could not create a scratch directory: " + e.getMessage(), e);
        }
        scratchDirs.add(scratch);

        Path produced = conversionEngine.convert(source, scratch, target.getExtension());
        Path expected = scratch.resolve(DocumentKind.stemOf(source) + "." + target.getExtension());
        if (produced == null || !Files.exists(produced)) {
            if (!Files.exists(expected)) {
                throw new ConversionException(ConversionException.MISSING_ARTIFACT,
                        "Conversion of " + source.getFileName() + " produced no ." + target.getExtension());
            }
            produced = expected;
        }
        log.debug("Converted {} -> {}", source, produced);
        return produced;
    }

    @PreDestroy
    public void cleanup() {
        for (Path dir : scratchDirs) {
            try {
                FileSystemUtils.deleteRecursively(dir);
            } catch (IOException e) {
                log.warn("Could not delete scratch directory {}: {}", dir, e.getMessage());
            }
        }
        scratchDirs.clear();
        cache.invalidateAll();
    }
}
