package com.eups.dependencyview.view;

import com.eups.dependencyview.fetch.FetcherSettings;
import com.eups.dependencyview.model.RepositoryLayout;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration for one dependency view run.
 */
@Data
@Builder
public class ViewConfig {
    private String packageName;

    @Builder.Default
    private String baseUrl = RepositoryLayout.DEFAULT_BASE_URL;

    private String title;
    private Path outputFile;

    @Builder.Default
    private long connectTimeoutMs = 10_000;

    @Builder.Default
    private long readTimeoutMs = 30_000;

    private boolean verbose;

    public String getIndexUrl() {
        return RepositoryLayout.indexUrl(baseUrl);
    }

    /**
     * Explicit title if one was given, otherwise "Dependencies for &lt;package&gt;".
     */
    public String getEffectiveTitle() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        return "Dependencies for " + packageName;
    }

    public FetcherSettings toFetcherSettings() {
        return FetcherSettings.builder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .readTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
