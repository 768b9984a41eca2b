package com.eups.dependencyview.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One resolved package: its name, the version pinned by the index, and where it lives in the repository.
 *
 * Pure structure only. The resource URL is derived on demand from the other fields.
 */
@Value
@Builder(toBuilder = true)
public class PackageCoordinate {

    public static final String GENERIC_ARCHITECTURE = "generic";

    @NonNull
    String name;

    @NonNull
    String version;

    /**
     * Only non-generic architectures show up in the resource URL.
     */
    @NonNull
    @Builder.Default
    String architecture = GENERIC_ARCHITECTURE;

    /**
     * Optional repository subdirectory such as {@code external}; empty for top-level packages.
     */
    @NonNull
    @Builder.Default
    String directory = "";

    @NonNull
    String baseUrl;

    public String getResourceUrl() {
        StringBuilder url = new StringBuilder(baseUrl);
        if (!directory.isEmpty()) {
            url.append('/').append(directory);
        }
        url.append('/').append(name).append('/').append(version);
        if (!GENERIC_ARCHITECTURE.equals(architecture)) {
            url.append('/').append(architecture);
        }
        return url.toString();
    }
}
