package com.repo.query.service.chunk;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * static extension -> language table. The table decides which files are discovered;
 * chunking accepts any file and tags unknown extensions as "unknown".
 */
public final class SourceLanguages {
    public static final String UNKNOWN = "unknown";

    private static final Map<String, String> EXTENSION_LANGUAGES;

    static {
        Map<String, String> table = new LinkedHashMap<>();
        table.put(".py", "python");
        table.put(".js", "javascript");
        table.put(".ts", "typescript");
        table.put(".jsx", "javascript");
        table.put(".tsx", "typescript");
        table.put(".java", "java");
        table.put(".cpp", "cpp");
        table.put(".c", "c");
        table.put(".h", "c");
        table.put(".hpp", "cpp");
        table.put(".go", "go");
        table.put(".rs", "rust");
        table.put(".rb", "ruby");
        table.put(".php", "php");
        table.put(".swift", "swift");
        table.put(".kt", "kotlin");
        table.put(".scala", "scala");
        table.put(".cs", "csharp");
        EXTENSION_LANGUAGES = Collections.unmodifiableMap(table);
    }

    private SourceLanguages() {
    }

    public static Set<String> supportedExtensions() {
        return EXTENSION_LANGUAGES.keySet();
    }

    public static boolean isSupported(Path file) {
        return EXTENSION_LANGUAGES.containsKey(extensionOf(file));
    }

    public static String languageOf(Path file) {
        return EXTENSION_LANGUAGES.getOrDefault(extensionOf(file), UNKNOWN);
    }

    /**
     * the last ".xxx" of the file name, case preserved; dot-files such as ".bashrc" have no extension
     *
     * @param file
     * @return the extension including its dot, or an empty string
     */
    static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) return "";
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) return "";
        return fileName.substring(dot);
    }
}
