package com.eups.dependencyview.exception;

/**
 * Raised when a package name (the root or any dependency) is not present in the package index.
 */
public class PackageLookupException extends DependencyViewException {

    private static final long serialVersionUID = 1L;

    private final String packageName;
    private final String indexUrl;

    public PackageLookupException(String packageName, String indexUrl) {
        super(String.format("Error: \"%s\" is not in %s.", packageName, indexUrl));
        this.packageName = packageName;
        this.indexUrl = indexUrl;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getIndexUrl() {
        return indexUrl;
    }
}
