package com.eups.dependencyview.resolver;

import com.eups.dependencyview.exception.PackageLookupException;
import com.eups.dependencyview.model.IndexEntry;
import com.eups.dependencyview.model.PackageCoordinate;
import com.eups.dependencyview.model.PackageIndex;
import com.eups.dependencyview.model.RepositoryLayout;

import java.util.Objects;

/**
 * Turns package names into coordinates using the fields the index lists for them.
 */
public class CoordinateLookup {

    private final PackageIndex index;
    private final String baseUrl;

    public CoordinateLookup(PackageIndex index, String baseUrl) {
        this.index = Objects.requireNonNull(index, "index");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    }

    /**
     * @throws PackageLookupException if the index has no entry for {@code packageName}
     */
    public PackageCoordinate lookup(String packageName) {
        IndexEntry entry = index.find(packageName)
                .orElseThrow(() -> new PackageLookupException(packageName, getIndexUrl()));

        return PackageCoordinate.builder()
                .name(packageName)
                .architecture(entry.getArchitecture())
                .version(entry.getVersion())
                .directory(entry.getDirectory())
                .baseUrl(baseUrl)
                .build();
    }

    public boolean isKnown(String packageName) {
        return index.contains(packageName);
    }

    public String getIndexUrl() {
        return RepositoryLayout.indexUrl(baseUrl);
    }
}
