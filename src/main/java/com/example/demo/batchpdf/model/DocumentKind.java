package com.example.demo.batchpdf.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * The two canonical (directly editable) document kinds.
 */
public enum DocumentKind {
    WORD_PROCESSING("docx"),
    SLIDE_DECK("pptx");

    private final String extension;

    DocumentKind(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static Optional<DocumentKind> fromPath(Path path) {
        String ext = extensionOf(path);
        for (DocumentKind kind : values()) {
            if (kind.extension.equals(ext)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Lower-case extension without the dot, or "" when the file name has none.
     */
    public static String extensionOf(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String stemOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
