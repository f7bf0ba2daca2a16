package com.codearena.harness;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Strips the parts of a Go submission that the harness supplies itself:
 * the {@code package} clause, imports and any {@code func main}.
 * Every other line is kept verbatim. Removed import specs are returned so the
 * harness can re-declare the ones the remaining code still uses.
 */
public final class GoSourceCleaner {

    private static final Pattern MAIN_DECL = Pattern.compile("^func\\s+main\\s*\\(");

    /** {@code import (}, {@code import "path"} or {@code import alias "path"}. */
    private static final Pattern IMPORT_DECL =
            Pattern.compile("^import(\\s*[(\"`]|\\s+[A-Za-z_.]\\w*\\s+[\"`])");

    private GoSourceCleaner() {}

    /**
     * @param body    the submission with package, imports and main removed
     * @param imports import specs as written, e.g. {@code "strings"} or {@code str "strings"}
     */
    public record CleanedSource(String body, Set<String> imports) {
        public CleanedSource {
            imports = Set.copyOf(imports);
        }
    }

    public static CleanedSource clean(String code) {
        var kept = new ArrayList<String>();
        var imports = new LinkedHashSet<String>();

        boolean inImportBlock = false;
        boolean inMain = false;
        boolean mainOpened = false;
        int mainDepth = 0;

        for (String line : (code == null ? "" : code).split("\\R", -1)) {
            String trimmed = line.trim();

            if (inMain) {
                for (char c : line.toCharArray()) {
                    if (c == '{') { mainDepth++; mainOpened = true; }
                    else if (c == '}') mainDepth--;
                }
                if (mainOpened && mainDepth <= 0) inMain = false;
                continue;
            }
            if (inImportBlock) {
                if (trimmed.startsWith(")")) {
                    inImportBlock = false;
                } else if (!trimmed.isEmpty() && !trimmed.startsWith("//")) {
                    imports.add(trimmed);
                }
                continue;
            }
            if (trimmed.startsWith("package ")) {
                continue;
            }
            if (IMPORT_DECL.matcher(trimmed).find()) {
                String rest = trimmed.substring("import".length()).trim();
                if (rest.startsWith("(")) {
                    String inline = rest.substring(1).trim();
                    if (inline.endsWith(")")) {
                        addSpecs(imports, inline.substring(0, inline.length() - 1));
                    } else {
                        addSpecs(imports, inline);
                        inImportBlock = true;
                    }
                } else {
                    imports.add(rest);
                }
                continue;
            }
            if (MAIN_DECL.matcher(trimmed).find()) {
                inMain = true;
                mainOpened = false;
                mainDepth = 0;
                for (char c : line.toCharArray()) {
                    if (c == '{') { mainDepth++; mainOpened = true; }
                    else if (c == '}') mainDepth--;
                }
                if (mainOpened && mainDepth <= 0) inMain = false;
                continue;
            }
            kept.add(line);
        }

        return new CleanedSource(trimBlankLines(kept), imports);
    }

    /**
     * Package name an import spec binds: its alias if it has one, otherwise the
     * last element of its path.
     */
    static String packageName(String spec) {
        String s = spec.trim();
        int quote = s.indexOf('"');
        if (quote < 0) quote = s.indexOf('`');
        if (quote > 0) {
            return s.substring(0, quote).trim();
        }
        String path = s.replace("\"", "").replace("`", "").trim();
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static void addSpecs(Set<String> imports, String text) {
        for (String spec : text.split(";")) {
            if (!spec.isBlank()) imports.add(spec.trim());
        }
    }

    private static String trimBlankLines(List<String> lines) {
        int start = 0;
        int end = lines.size();
        while (start < end && lines.get(start).isBlank()) start++;
        while (end > start && lines.get(end - 1).isBlank()) end--;
        return String.join("\n", lines.subList(start, end));
    }
}
