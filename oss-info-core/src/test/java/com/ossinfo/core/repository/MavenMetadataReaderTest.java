package com.ossinfo.core.repository;

import com.ossinfo.core.model.MavenMetadata;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MavenMetadataReader}.
 */
class MavenMetadataReaderTest {

    private final MavenMetadataReader reader = new MavenMetadataReader();

    @Test
    void read_repositoryMetadata_returnsVersions() throws Exception {
        MavenMetadata metadata = reader.read(RepositoryResources.read("androidx/core/core-ktx/maven-metadata.xml"));

        assertThat(metadata.groupId()).isEqualTo("androidx.core");
        assertThat(metadata.artifactId()).isEqualTo("core-ktx");
        assertThat(metadata.version()).isNull();
        assertThat(metadata.latestVersion()).isEqualTo("1.12.0");
        assertThat(metadata.releaseVersion()).isEqualTo("1.12.0");
        assertThat(metadata.preferredVersion()).contains("1.12.0");
    }

    @Test
    void read_topLevelVersionOnly_returnsVersion() throws ArtifactFetchException {
        MavenMetadata metadata = reader.read("""
            <metadata>
              <groupId>javax.inject</groupId>
              <artifactId>javax.inject</artifactId>
              <version>1</version>
            </metadata>
            """);

        assertThat(metadata.version()).isEqualTo("1");
        assertThat(metadata.latestVersion()).isNull();
        assertThat(metadata.releaseVersion()).isNull();
        assertThat(metadata.preferredVersion()).contains("1");
    }

    @Test
    void read_missingArtifactId_throws() {
        assertThatThrownBy(() -> reader.read("<metadata><groupId>g</groupId></metadata>"))
            .isInstanceOf(ArtifactFetchException.class)
            .hasMessage("Missing <artifactId> in maven-metadata.xml");
    }

    @Test
    void read_notXml_throws() {
        assertThatThrownBy(() -> reader.read("Not Found"))
            .isInstanceOf(ArtifactFetchException.class)
            .hasMessageStartingWith("Failed to parse maven-metadata.xml");
    }
}
