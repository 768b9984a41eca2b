package com.eups.dependencyview.fetch;

import com.eups.dependencyview.exception.DocumentFetchException;

import java.util.List;

/**
 * Retrieves a remote text document as lines.
 */
public interface DocumentFetcher {

    /**
     * @param url absolute URL of the document
     * @return the document's lines, without line terminators
     * @throws DocumentFetchException if the host is unreachable, the response is not successful,
     *         or the transfer times out
     */
    List<String> fetch(String url);
}
