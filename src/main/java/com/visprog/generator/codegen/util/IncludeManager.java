package com.visprog.generator.codegen.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects the headers a generated translation unit needs, deduplicated and sorted.
 */
public class IncludeManager {

    private final Set<String> includes = new TreeSet<>();

    /**
     * Adds a header. Accepts {@code <vector>}, {@code "my.h"}, {@code #include <vector>}
     * or a bare name, which is treated as a system header.
     */
    public void addInclude(String header) {
        if (header == null || header.isBlank()) {
            return;
        }

        String normalized = header.trim();
        if (normalized.startsWith("#include")) {
            normalized = normalized.substring("#include".length()).trim();
        }
        if (!normalized.startsWith("<") && !normalized.startsWith("\"")) {
            normalized = "<" + normalized + ">";
        }

        includes.add(normalized);
    }

    public void addIncludes(Iterable<String> headers) {
        for (String header : headers) {
            addInclude(header);
        }
    }

    public boolean contains(String header) {
        return includes.contains(header);
    }

    public List<String> getIncludes() {
        return new ArrayList<>(includes);
    }

    /**
     * Include directives, one per header.
     */
    public List<String> generateIncludes() {
        List<String> lines = new ArrayList<>(includes.size());
        for (String include : includes) {
            lines.add("#include " + include);
        }
        return lines;
    }
}
