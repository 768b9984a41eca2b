package com.eups.dependencyview.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PackageCoordinateTest {

    private static final String BASE = "http://dev.lsstcorp.org/dmspkgs";

    @Test
    void testGenericTopLevelPackage() {
        PackageCoordinate afw = PackageCoordinate.builder()
                .name("afw")
                .version("3.3.14")
                .baseUrl(BASE)
                .build();

        assertThat(afw.getArchitecture()).isEqualTo("generic");
        assertThat(afw.getDirectory()).isEmpty();
        assertThat(afw.getResourceUrl()).isEqualTo(BASE + "/afw/3.3.14");
        assertThat(RepositoryLayout.manifestUrl(afw)).isEqualTo(BASE + "/afw/3.3.14/the.manifest");
    }

    @Test
    void testExternalPackageWithArchitecture() {
        PackageCoordinate boost = PackageCoordinate.builder()
                .name("boost")
                .version("1.37.0")
                .architecture("Linux64")
                .directory("external")
                .baseUrl(BASE)
                .build();

        assertThat(boost.getResourceUrl()).isEqualTo(BASE + "/external/boost/1.37.0/Linux64");
    }

    @Test
    void testResourceUrlFollowsFieldChanges() {
        PackageCoordinate original = PackageCoordinate.builder()
                .name("foo")
                .version("1.0")
                .baseUrl(BASE)
                .build();

        PackageCoordinate moved = original.toBuilder().directory("external").version("2.0").build();

        assertThat(original.getResourceUrl()).isEqualTo(BASE + "/foo/1.0");
        assertThat(moved.getResourceUrl()).isEqualTo(BASE + "/external/foo/2.0");
    }

    @Test
    void testIndexUrl() {
        assertThat(RepositoryLayout.indexUrl(BASE)).isEqualTo(BASE + "/current.list");
    }

    @Test
    void testNameIsRequired() {
        assertThatThrownBy(() -> PackageCoordinate.builder().version("1.0").baseUrl(BASE).build())
                .isInstanceOf(NullPointerException.class);
    }
}
