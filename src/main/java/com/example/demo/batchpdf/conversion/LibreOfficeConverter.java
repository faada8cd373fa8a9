package com.example.demo.batchpdf.conversion;

import com.example.demo.batchpdf.config.BatchPdfProperties;
import com.example.demo.batchpdf.exception.ConversionException;
import com.example.demo.batchpdf.model.DocumentKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs LibreOffice headless: {@code soffice --headless --convert-to <fmt> --outdir <dir> <file>}.
 *
 * --convert-to must come before --outdir, and the input file last.
 * The call blocks until soffice exits; no timeout is imposed here.
 */
@Slf4j
@Component
public class LibreOfficeConverter implements ConversionEngine {
    private static final String DEFAULT_BINARY = "soffice";

    private final BatchPdfProperties properties;

    public LibreOfficeConverter(BatchPdfProperties properties) {
        this.properties = properties;
    }

    String binary() {
        String configured = properties.getSofficeBin();
        return configured == null || configured.isBlank() ? DEFAULT_BINARY : configured;
    }

    List<String> buildCommand(Path input, Path outputDir, String targetFormat, String formatOptions) {
        String conversion = formatOptions == null || formatOptions.isBlank()
                ? targetFormat
                : targetFormat + ":" + formatOptions;
        List<String> cmd = new ArrayList<>();
        cmd.add(binary());
        cmd.add("--headless");
        cmd.add("--convert-to");
        cmd.add(conversion);
        cmd.add("--outdir");
        cmd.add(outputDir.toAbsolutePath().toString());
        cmd.add(input.toAbsolutePath().toString());
        return cmd;
    }

    @Override
    public Path convert(Path input, Path outputDir, String targetFormat, String formatOptions) {
        List<String> cmd = buildCommand(input, outputDir, targetFormat, formatOptions);
        log.debug("Running: {}", String.join(" ", cmd));

        ProcessResult result = run(cmd);
        if (result.exitCode != 0) {
            throw new ConversionException(ConversionException.CONVERSION_FAILED,
                    "LibreOffice returned a non-zero exit code (" + result.exitCode + ").\n"
                            + "CMD: " + String.join(" ", cmd) + "\n"
                            + "STDOUT:\n" + result.stdout + "\n\n"
                            + "STDERR:\n" + result.stderr);
        }

        String extension = targetFormat.split(":", 2)[0];
        Path produced = outputDir.resolve(DocumentKind.stemOf(input) + "." + extension);
        if (!Files.exists(produced)) {
            throw new ConversionException(ConversionException.MISSING_ARTIFACT,
                    "LibreOffice did not produce " + produced.getFileName() + ".\n"
                            + "STDOUT:\n" + result.stdout + "\n\nSTDERR:\n" + result.stderr);
        }
        return produced;
    }

    @Override
    public Optional<String> detectVersion() {
        try {
            ProcessResult result = run(List.of(binary(), "--version"));
            if (result.exitCode != 0) {
                return Optional.empty();
            }
            String banner = result.stdout.isBlank() ? result.stderr.trim() : result.stdout.trim();
            return Optional.of(banner);
        } catch (ConversionException e) {
            log.debug("LibreOffice not available: {}", e.getDescription());
            return Optional.empty();
        }
    }

    @Override
    public String getName() {
        return "LibreOffice";
    }

    /**
     * Runs a command with stdout and stderr redirected to temp files, so neither
     * pipe can fill up and block the child process.
     */
    private ProcessResult run(List<String> cmd) {
        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("batchpdf-soffice-", ".out");
            stderr = Files.createTempFile("batchpdf-soffice-", ".err");
            Process process = new ProcessBuilder(cmd)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile())
                    .start();
            int exitCode = process.waitFor();
            return new ProcessResult(exitCode, readOutput(stdout), readOutput(stderr));
        } catch (IOException e) {
            throw new ConversionException(ConversionException.CONVERSION_FAILED,
                    "Could not run " + cmd.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversionException(ConversionException.CONVERSION_FAILED,
                    "Interrupted while waiting for " + cmd.get(0), e);
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    /**
     * Console output may use the platform code page; malformed bytes are replaced, not rejected.
     */
    private static String readOutput(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}", file, e);
        }
    }

    private static final class ProcessResult {
        private final int exitCode;
        private final String stdout;
        private final String stderr;

        private ProcessResult(int exitCode, String stdout, String stderr) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
        }
    }
}
