package com.eups.dependencyview.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed repository index: package name to the coordinate fields listed for it.
 *
 * Built once per run and read-only afterwards. Lines the parser could not use are kept in
 * {@link #getSkippedLines()} so callers can report them.
 */
@Value
@Builder
public class PackageIndex {

    @Singular("entry")
    Map<String, IndexEntry> entries;

    @Singular
    List<String> skippedLines;

    public boolean contains(String packageName) {
        return entries.containsKey(packageName);
    }

    public Optional<IndexEntry> find(String packageName) {
        return Optional.ofNullable(entries.get(packageName));
    }

    public Set<String> getPackageNames() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }
}
