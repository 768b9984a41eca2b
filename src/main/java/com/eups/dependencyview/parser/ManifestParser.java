package com.eups.dependencyview.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the direct dependencies declared by a package manifest ({@code the.manifest}).
 *
 * Only {@code >merge pkg=<name>} directives declare dependencies; every other line,
 * {@code >self} included, is ignored. Declaration order and repeats are preserved.
 */
public class ManifestParser {
    private static final Logger log = LoggerFactory.getLogger(ManifestParser.class);

    public static final String MERGE_DIRECTIVE = ">merge";
    public static final String PACKAGE_KEY = "pkg=";

    public List<String> parse(List<String> lines) {
        List<String> dependencies = new ArrayList<>();

        for (String line : lines) {
            if (!line.startsWith(MERGE_DIRECTIVE)) {
                continue;
            }

            String name = extractPackageName(line);
            if (name.isEmpty()) {
                log.debug("Ignoring merge directive without a package name: {}", line.strip());
                continue;
            }
            dependencies.add(name);
        }

        log.debug("Parsed manifest: {} dependencies {}", dependencies.size(), dependencies);
        return dependencies;
    }

    private static String extractPackageName(String line) {
        int key = line.indexOf(PACKAGE_KEY, MERGE_DIRECTIVE.length());
        if (key < 0) {
            return "";
        }

        int start = key + PACKAGE_KEY.length();
        int end = start;
        while (end < line.length() && !Character.isWhitespace(line.charAt(end))) {
            end++;
        }
        return line.substring(start, end);
    }
}
