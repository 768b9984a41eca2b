package com.eups.dependencyview.fetch;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.eups.dependencyview.exception.DocumentFetchException;

/**
 * Serves documents from memory and records every requested URL in order.
 */
public class InMemoryDocumentFetcher implements DocumentFetcher {

    public static final String BASE_URL = "http://repo.test/dmspkgs";

    private final Map<String, List<String>> documents = new HashMap<>();
    private final Set<String> failing = new HashSet<>();
    private final List<String> requested = new ArrayList<>();

    public InMemoryDocumentFetcher index(String... lines) {
        documents.put(BASE_URL + "/current.list", List.of(lines));
        return this;
    }

    /**
     * Registers the manifest of a generic, top-level package.
     */
    public InMemoryDocumentFetcher manifest(String name, String version, String... lines) {
        return document(BASE_URL + "/" + name + "/" + version + "/the.manifest", lines);
    }

    public InMemoryDocumentFetcher document(String url, String... lines) {
        documents.put(url, List.of(lines));
        return this;
    }

    public InMemoryDocumentFetcher failOn(String url) {
        failing.add(url);
        return this;
    }

    @Override
    public List<String> fetch(String url) {
        requested.add(url);
        if (failing.contains(url)) {
            throw new DocumentFetchException(url, "HTTP 503 Service Unavailable");
        }
        List<String> lines = documents.get(url);
        if (lines == null) {
            throw new DocumentFetchException(url, "HTTP 404 Not Found");
        }
        return lines;
    }

    public List<String> getRequested() {
        return requested;
    }
}
