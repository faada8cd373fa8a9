package com.example.demo.batchpdf.export;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * A long-lived {@code powershell -Command -} process fed one statement line at a time.
 * Variables set by one {@link #run(String)} call stay visible to the next, so COM
 * objects created during the probe are reused for every export.
 */
@Slf4j
final class PowerShellSession implements Closeable {
    private static final String MARKER = "__BATCHPDF_DONE_";

    private final Process process;
    private final BufferedWriter stdin;
    private final BufferedReader stdout;
    private long sequence;

    private PowerShellSession(Process process) {
        this.process = process;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.stdout = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
    }

    static PowerShellSession start() throws IOException {
        Process process = new ProcessBuilder("powershell.exe", "-NoLogo", "-NoProfile", "-NonInteractive", "-Command", "-")
                .redirectErrorStream(true)
                .start();
        return new PowerShellSession(process);
    }

    /**
     * Runs a single-line script and returns its output lines.
     *
     * @throws IOException when the script throws or the process has gone away
     */
    synchronized List<String> run(String script) throws IOException {
        if (!process.isAlive()) {
            throw new IOException("PowerShell session is no longer running");
        }
        String marker = MARKER + (sequence++);
        stdin.write("try { " + script + "; Write-Output '" + marker + ":OK' } "
                + "catch { Write-Output $_.Exception.Message; Write-Output '" + marker + ":ERR' }");
        stdin.newLine();
        stdin.flush();

        List<String> lines = new ArrayList<>();
        String line;
        while ((line = stdout.readLine()) != null) {
            if (line.startsWith(marker)) {
                if (line.endsWith(":ERR")) {
                    throw new IOException(String.join(System.lineSeparator(), lines));
                }
                return lines;
            }
            lines.add(line);
        }
        throw new IOException("PowerShell session ended unexpectedly: " + String.join(" ", lines));
    }

    static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public synchronized void close() {
        try {
            stdin.write("exit");
            stdin.newLine();
            stdin.flush();
            if (!process.waitFor(10, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (IOException e) {
            log.debug("PowerShell session already closed: {}", e.getMessage());
            process.destroyForcibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }
}
