package com.example.demo.batchpdf.export;

import com.example.demo.batchpdf.model.DocumentKind;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Microsoft Word / PowerPoint automation over COM, driven from a PowerShell session.
 *
 * Only available on Windows. The applications are started once, on the first
 * readiness check, and quit when the application context closes.
 */
@Slf4j
@Component
public class MsOfficeChannel implements NativeOfficeChannel {
    static final int WD_FORMAT_PDF = 17;
    static final int PP_SAVE_AS_PDF = 32;

    private final boolean windows;
    private final Map<DocumentKind, Boolean> readiness = new EnumMap<>(DocumentKind.class);
    private PowerShellSession session;
    private boolean probed;

    public MsOfficeChannel() {
        this(System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows"));
    }

    MsOfficeChannel(boolean windows) {
        this.windows = windows;
    }

    @Override
    public synchronized boolean isReady(DocumentKind kind) {
        probeOnce();
        return readiness.getOrDefault(kind, false);
    }

    private void probeOnce() {
        if (probed) {
            return;
        }
        probed = true;
        if (!windows) {
            log.debug("Not running on Windows; MS Office export disabled");
            return;
        }
        try {
            session = PowerShellSession.start();
        } catch (IOException e) {
            log.info("PowerShell not available, MS Office export disabled: {}", e.getMessage());
            return;
        }
        readiness.put(DocumentKind.WORD_PROCESSING, probe(
                "$word = New-Object -ComObject Word.Application; $word.Visible = $false; $word.DisplayAlerts = 0",
                "Word"));
        readiness.put(DocumentKind.SLIDE_DECK, probe(
                "$ppt = New-Object -ComObject PowerPoint.Application",
                "PowerPoint"));
    }

    private boolean probe(String script, String application) {
        try {
            session.run(script);
            log.info("{} automation available", application);
            return true;
        } catch (IOException e) {
            log.info("{} automation not available: {}", application, e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized boolean exportFixedLayout(Path input, Path output) {
        Optional<DocumentKind> kind = DocumentKind.fromPath(input);
        if (kind.isEmpty() || !isReady(kind.get())) {
            return false;
        }
        String in = PowerShellSession.quote(input.toAbsolutePath().toString());
        String out = PowerShellSession.quote(output.toAbsolutePath().toString());
        String script = kind.get() == DocumentKind.WORD_PROCESSING
                ? "$d = $word.Documents.Open(" + in + ", $false, $true); "
                        + "try { $d.SaveAs([ref]" + out + ", [ref]" + WD_FORMAT_PDF + ") } finally { $d.Close($false) }"
                : "$p = $ppt.Presentations.Open(" + in + ", $true, $false, $false); "
                        + "try { $p.SaveAs(" + out + ", " + PP_SAVE_AS_PDF + ") } finally { $p.Close() }";
        try {
            session.run(script);
        } catch (IOException e) {
            log.warn("MS Office export of {} failed: {}", input.getFileName(), e.getMessage());
            return false;
        }
        return Files.exists(output);
    }

    @Override
    @PreDestroy
    public synchronized void shutdown() {
        if (session == null) {
            return;
        }
        try {
            session.run("if ($word) { $word.Quit() }; if ($ppt) { $ppt.Quit() }");
        } catch (IOException e) {
            log.warn("Could not quit office applications cleanly: {}", e.getMessage());
        } finally {
            session.close();
            session = null;
            readiness.clear();
        }
    }
}
