package com.eups.dependencyview.parser;

import com.eups.dependencyview.model.IndexEntry;
import com.eups.dependencyview.model.PackageIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Parser for the repository package index ({@code current.list}).
 *
 * Format:
 * - Optional title line: EUPS distribution ...
 * - Comments: # comment
 * - Top-level package: name architecture version
 * - Package in a subdirectory: name architecture version directory
 *
 * Any other token count is skipped. A name listed twice keeps the last line's fields.
 */
public class IndexParser {
    private static final Logger log = LoggerFactory.getLogger(IndexParser.class);

    public static final String TITLE_MARKER = "EUPS distribution";

    private final boolean reportSkippedLines;

    public IndexParser() {
        this(false);
    }

    /**
     * @param reportSkippedLines log malformed lines at warn instead of debug
     */
    public IndexParser(boolean reportSkippedLines) {
        this.reportSkippedLines = reportSkippedLines;
    }

    public PackageIndex parse(List<String> lines) {
        PackageIndex.PackageIndexBuilder index = PackageIndex.builder();

        int first = 0;
        if (!lines.isEmpty() && lines.get(0).startsWith(TITLE_MARKER)) {
            first = 1;
        }

        for (String line : lines.subList(first, lines.size())) {
            if (line.startsWith("#")) {
                continue;
            }

            String[] tokens = tokenize(line);
            if (tokens.length == 4) {
                index.entry(tokens[0], new IndexEntry(tokens[1], tokens[2], tokens[3]));
            } else if (tokens.length == 3) {
                index.entry(tokens[0], new IndexEntry(tokens[1], tokens[2], ""));
            } else {
                String stripped = line.strip();
                index.skippedLine(stripped);
                if (reportSkippedLines) {
                    log.warn("Skipped malformed line: \"{}\"", stripped);
                } else {
                    log.debug("Skipped malformed line: \"{}\"", stripped);
                }
            }
        }

        PackageIndex parsed = index.build();
        log.debug("Parsed package index: {} packages, {} skipped lines",
                parsed.size(), parsed.getSkippedLines().size());
        return parsed;
    }

    private static String[] tokenize(String line) {
        String stripped = line.strip();
        return stripped.isEmpty() ? new String[0] : stripped.split("\\s+");
    }
}
