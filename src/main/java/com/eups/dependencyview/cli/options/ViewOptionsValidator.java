package com.eups.dependencyview.cli.options;

import com.eups.dependencyview.exception.InvalidOptionsException;
import com.eups.dependencyview.view.ViewConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks option values and turns them into a {@link ViewConfig}. The package name itself is
 * checked by the command, since its absence is reported as a usage error.
 */
public class ViewOptionsValidator {

    public ViewConfig validate(ViewOptions o) {
        List<String> problems = new ArrayList<>();

        String baseUrl = normalizeBaseUrl(o.getBaseUrl());
        if (baseUrl.isEmpty()) {
            problems.add("Base URL must not be blank (--base-url / -u).");
        } else if (!isHttpUrl(baseUrl)) {
            problems.add("Base URL must start with http:// or https://. Got: " + baseUrl);
        }

        checkTimeout("Connect timeout", o.getConnectTimeoutMs(), problems);
        checkTimeout("Read timeout", o.getReadTimeoutMs(), problems);

        if (o.getOutputFile() != null && o.getOutputFile().toString().isBlank()) {
            problems.add("Output file must not be blank (--output / -o).");
        }

        if (!problems.isEmpty()) {
            throw new InvalidOptionsException(problems);
        }

        return ViewConfig.builder()
                .packageName(o.getPackageName())
                .baseUrl(baseUrl)
                .title(o.getTitle())
                .outputFile(o.getOutputFile())
                .connectTimeoutMs(o.getConnectTimeoutMs())
                .readTimeoutMs(o.getReadTimeoutMs())
                .verbose(o.isVerbose())
                .build();
    }

    /**
     * The HTTP client accepts timeouts up to {@link Integer#MAX_VALUE} milliseconds.
     */
    private static void checkTimeout(String label, long millis, List<String> problems) {
        if (millis < 0) {
            problems.add(label + " must be >= 0. Got: " + millis);
        } else if (millis > Integer.MAX_VALUE) {
            problems.add(label + " must be <= " + Integer.MAX_VALUE + " ms. Got: " + millis);
        }
    }

    private static String normalizeBaseUrl(String raw) {
        if (raw == null) {
            return "";
        }
        String url = raw.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    private static boolean isHttpUrl(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
