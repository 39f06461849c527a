package com.example.rittdoc.dto.conversion;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.jsoup.nodes.Element;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One chapter of the intermediate tree. {@code root} is the {@code <chapter>} element.
 */
@Data
@NoArgsConstructor
public class StructuredChapter {
    private String id;
    private String sourcePath;
    private Element root;

    /** Namespaced ids that occurred more than once; later occurrences were given a numeric suffix. */
    private Set<String> renamedDuplicateIds = new LinkedHashSet<>();

    public StructuredChapter(String id, String sourcePath, Element root) {
        this.id = id;
        this.sourcePath = sourcePath;
        this.root = root;
    }

    public String getFileName() {
        return id + ".xml";
    }
}
