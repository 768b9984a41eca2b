package com.eups.dependencyview.fetch;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

/**
 * Transport settings for {@link HttpDocumentFetcher}. A zero duration disables that timeout.
 */
@Value
@Builder(toBuilder = true)
public class FetcherSettings {

    @NonNull
    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(10);

    @NonNull
    @Builder.Default
    Duration readTimeout = Duration.ofSeconds(30);

    @NonNull
    @Builder.Default
    String userAgent = "eups-dependency-view/1.0.0";

    public static FetcherSettings defaults() {
        return FetcherSettings.builder().build();
    }
}
