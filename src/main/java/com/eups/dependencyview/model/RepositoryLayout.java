package com.eups.dependencyview.model;

import lombok.experimental.UtilityClass;

/**
 * Where documents live in a package repository.
 */
@UtilityClass
public class RepositoryLayout {

    public static final String DEFAULT_BASE_URL = "http://dev.lsstcorp.org/dmspkgs";
    public static final String INDEX_DOCUMENT = "current.list";
    public static final String MANIFEST_DOCUMENT = "the.manifest";

    public static String indexUrl(String baseUrl) {
        return baseUrl + "/" + INDEX_DOCUMENT;
    }

    public static String manifestUrl(PackageCoordinate coordinate) {
        return coordinate.getResourceUrl() + "/" + MANIFEST_DOCUMENT;
    }
}
