package com.ossinfo.core.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.ossinfo.core.model.ArtifactInfo;
import com.ossinfo.core.model.License;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the descriptive part of a {@code pom.xml}: coordinates, packaging, name, description
 * and licenses. Dependencies and build sections are ignored.
 *
 * @see <a href="https://maven.apache.org/pom.html">POM Reference</a>
 */
public class PomReader extends AbstractXmlReader<ArtifactInfo> {

    @Override
    protected ArtifactInfo map(JsonNode root) throws ArtifactFetchException {
        return new ArtifactInfo(
            extractText(root, "groupId"),
            requireText(root, "artifactId"),
            extractText(root, "version"),
            extractText(root, "packaging"),
            extractText(root, "name"),
            extractText(root, "description"),
            extractLicenses(root.get("licenses"))
        );
    }

    @Override
    protected String documentName() {
        return "pom.xml";
    }

    private List<License> extractLicenses(JsonNode licensesNode) {
        List<License> licenses = new ArrayList<>();
        if (licensesNode == null || !licensesNode.isObject()) {
            return licenses;
        }
        for (JsonNode license : normalizeToArray(licensesNode.get("license"))) {
            String name = extractText(license, "name");
            if (name == null || name.isEmpty()) {
                log.debug("Skipping license without a name in pom.xml");
                continue;
            }
            licenses.add(License.fromName(name));
        }
        return licenses;
    }
}
