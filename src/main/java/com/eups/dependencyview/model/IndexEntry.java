package com.eups.dependencyview.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Coordinate fields of one package as listed in the repository index.
 */
@Value
public class IndexEntry {

    @NonNull
    String architecture;

    @NonNull
    String version;

    @NonNull
    String directory;
}
