package com.ossinfo.core.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.ossinfo.core.model.MavenMetadata;

/**
 * Reads the artifact-level {@code maven-metadata.xml} of a Maven repository.
 *
 * <pre>{@code
 * <metadata>
 *   <groupId>androidx.core</groupId>
 *   <artifactId>core-ktx</artifactId>
 *   <versioning>
 *     <latest>1.12.0</latest>
 *     <release>1.12.0</release>
 *     ...
 *   </versioning>
 * </metadata>
 * }</pre>
 */
public class MavenMetadataReader extends AbstractXmlReader<MavenMetadata> {

    @Override
    protected MavenMetadata map(JsonNode root) throws ArtifactFetchException {
        JsonNode versioning = root.get("versioning");
        return new MavenMetadata(
            requireText(root, "groupId"),
            requireText(root, "artifactId"),
            extractText(root, "version"),
            extractText(versioning, "latest"),
            extractText(versioning, "release")
        );
    }

    @Override
    protected String documentName() {
        return "maven-metadata.xml";
    }
}
