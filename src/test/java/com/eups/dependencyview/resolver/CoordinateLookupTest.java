package com.eups.dependencyview.resolver;

import com.eups.dependencyview.exception.PackageLookupException;
import com.eups.dependencyview.model.PackageCoordinate;
import com.eups.dependencyview.model.PackageIndex;
import com.eups.dependencyview.parser.IndexParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CoordinateLookupTest {

    private static final String BASE = "http://repo.test/dmspkgs";

    private final PackageIndex index = new IndexParser().parse(List.of(
            "afw generic 1.0",
            "boost Linux 1.37 external"
    ));
    private final CoordinateLookup lookup = new CoordinateLookup(index, BASE);

    @Test
    void testLookupCopiesIndexFields() {
        PackageCoordinate boost = lookup.lookup("boost");

        assertThat(boost.getName()).isEqualTo("boost");
        assertThat(boost.getArchitecture()).isEqualTo("Linux");
        assertThat(boost.getVersion()).isEqualTo("1.37");
        assertThat(boost.getDirectory()).isEqualTo("external");
        assertThat(boost.getBaseUrl()).isEqualTo(BASE);
    }

    @Test
    void testUnknownPackageNamesPackageAndIndex() {
        assertThatThrownBy(() -> lookup.lookup("missing"))
                .isInstanceOf(PackageLookupException.class)
                .hasMessage("Error: \"missing\" is not in http://repo.test/dmspkgs/current.list.")
                .satisfies(e -> assertThat(((PackageLookupException) e).getPackageName()).isEqualTo("missing"));
    }

    @Test
    void testIsKnown() {
        assertThat(lookup.isKnown("afw")).isTrue();
        assertThat(lookup.isKnown("AFW")).isFalse();
    }
}
