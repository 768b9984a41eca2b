package com.eups.dependencyview.exception;

/**
 * Raised when a remote document (the package index or a manifest) cannot be retrieved.
 */
public class DocumentFetchException extends DependencyViewException {

    private static final long serialVersionUID = 1L;

    private final String url;

    public DocumentFetchException(String url, String reason) {
        super("Failed to fetch " + url + ": " + reason);
        this.url = url;
    }

    public DocumentFetchException(String url, Throwable cause) {
        super("Failed to fetch " + url + ": " + cause.getMessage(), cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
