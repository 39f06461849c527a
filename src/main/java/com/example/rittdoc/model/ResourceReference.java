package com.example.rittdoc.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A tracked resource: an image, or a chapter document that links can point at.
 * Owned by the job's reference mapper. Chapters hold only ids in {@link #referencedIn}.
 */
@Data
@NoArgsConstructor
public class ResourceReference {
    private String originalPath;
    private String intermediateName;
    private String finalName;
    private ResourceKind kind;
    private ResourceGeometry geometry;
    private Set<String> referencedIn = new LinkedHashSet<>();
    private boolean existsInOutput;

    public ResourceReference(String originalPath, String intermediateName, ResourceKind kind, ResourceGeometry geometry) {
        this.originalPath = originalPath;
        this.intermediateName = intermediateName;
        this.kind = kind;
        this.geometry = geometry;
    }

    @JsonProperty("originalFilename")
    public String getOriginalFilename() {
        int slash = originalPath.lastIndexOf('/');
        return slash >= 0 ? originalPath.substring(slash + 1) : originalPath;
    }
}
