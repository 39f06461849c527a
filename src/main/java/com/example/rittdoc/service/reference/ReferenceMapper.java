package com.example.rittdoc.service.reference;

import com.example.rittdoc.exception.DuplicateResourceException;
import com.example.rittdoc.exception.UnknownResourceException;
import com.example.rittdoc.model.CrossReference;
import com.example.rittdoc.model.ExcludedChapter;
import com.example.rittdoc.model.ReferenceProblem;
import com.example.rittdoc.model.ReferenceValidation;
import com.example.rittdoc.model.ResourceGeometry;
import com.example.rittdoc.model.ResourceKind;
import com.example.rittdoc.model.ResourceReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of every resource of one conversion job, from its original path through the intermediate name
 * given at extraction to the final name given at packaging.
 * <p>
 * One instance belongs to one job and is passed explicitly through the pipeline. All mutating calls are
 * serialized on the instance.
 */
public class ReferenceMapper {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceMapper.class);

    private final ObjectMapper objectMapper;
    private final Map<String, ResourceReference> resources = new LinkedHashMap<>();
    private final Map<String, String> byIntermediateName = new HashMap<>();
    private final List<CrossReference> crossReferences = new ArrayList<>();
    private final List<ExcludedChapter> excludedChapters = new ArrayList<>();
    private final Instant created = Instant.now();

    public ReferenceMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public synchronized ResourceReference register(String originalPath, String intermediateName,
                                                   ResourceKind kind, ResourceGeometry geometry) {
        if (resources.containsKey(originalPath)) {
            throw new DuplicateResourceException("Resource already registered: " + originalPath);
        }
        if (byIntermediateName.containsKey(intermediateName)) {
            throw new DuplicateResourceException("Intermediate name already in use: " + intermediateName);
        }
        ResourceReference resource = new ResourceReference(originalPath, intermediateName, kind, geometry);
        resources.put(originalPath, resource);
        byIntermediateName.put(intermediateName, originalPath);
        logger.debug("Registered {} {} as {}", kind, originalPath, intermediateName);
        return resource;
    }

    /**
     * Notes that {@code chapterId} references the resource. Repeated calls have no further effect.
     */
    public synchronized void recordReference(String originalPath, String chapterId) {
        require(originalPath).getReferencedIn().add(chapterId);
    }

    /**
     * Records a link or image source met in a chapter. A null {@code targetPath} marks it unresolved.
     */
    public synchronized void recordCrossReference(ResourceKind kind, String sourceChapter, String originalHref,
                                                  String targetPath, String targetAnchor) {
        if (targetPath != null) {
            recordReference(targetPath, sourceChapter);
        } else {
            logger.warn("Unresolved {} reference '{}' in {}", kind, originalHref, sourceChapter);
        }
        crossReferences.add(new CrossReference(kind, sourceChapter, originalHref, targetPath, targetAnchor));
    }

    public synchronized void finalizeResource(String originalPath, String finalName) {
        require(originalPath).setFinalName(finalName);
    }

    /**
     * Withdraws every reference made by a chapter that was dropped from the output.
     */
    public synchronized void retractChapter(String chapterId, String sourcePath, String reason) {
        resources.values().forEach(r -> r.getReferencedIn().remove(chapterId));
        crossReferences.removeIf(ref -> chapterId.equals(ref.getSourceChapter()));
        excludedChapters.add(new ExcludedChapter(chapterId, sourcePath, reason));
        logger.warn("Retracted references of excluded chapter {}: {}", chapterId, reason);
    }

    public synchronized Optional<ResourceReference> findByIntermediateName(String intermediateName) {
        String original = byIntermediateName.get(intermediateName);
        return original == null ? Optional.empty() : Optional.of(resources.get(original));
    }

    public synchronized Optional<ResourceReference> find(String originalPath) {
        return Optional.ofNullable(resources.get(originalPath));
    }

    public synchronized List<ResourceReference> getResources() {
        return new ArrayList<>(resources.values());
    }

    public synchronized List<CrossReference> getCrossReferences() {
        return new ArrayList<>(crossReferences);
    }

    public synchronized List<ExcludedChapter> getExcludedChapters() {
        return new ArrayList<>(excludedChapters);
    }

    /**
     * Checks that every resource reached a final name present under {@code outputRoot} and that every
     * recorded reference points at such a resource. Advisory: the caller decides what to do with problems.
     */
    public synchronized ReferenceValidation validate(Path outputRoot) {
        List<ReferenceProblem> problems = new ArrayList<>();
        for (ResourceReference resource : resources.values()) {
            if (resource.getFinalName() == null) {
                resource.setExistsInOutput(false);
                problems.add(new ReferenceProblem(ReferenceProblem.Type.MISSING_FINAL_NAME,
                        resource.getOriginalPath(), "No final name assigned to " + resource.getIntermediateName()));
                continue;
            }
            boolean exists = Files.isRegularFile(outputRoot.resolve(resource.getFinalName()));
            resource.setExistsInOutput(exists);
            if (!exists) {
                problems.add(new ReferenceProblem(ReferenceProblem.Type.FINAL_FILE_NOT_FOUND,
                        resource.getOriginalPath(), "Missing in output: " + resource.getFinalName()));
            }
        }
        for (CrossReference ref : crossReferences) {
            ResourceReference target = ref.getTargetPath() == null ? null : resources.get(ref.getTargetPath());
            if (target == null || target.getFinalName() == null) {
                problems.add(new ReferenceProblem(ReferenceProblem.Type.UNRESOLVED_REFERENCE,
                        ref.getOriginalHref(), "Referenced from " + ref.getSourceChapter() + " but never resolved"));
            }
        }
        logger.info("Reference validation: {} resources, {} references, {} problems",
                resources.size(), crossReferences.size(), problems.size());
        return new ReferenceValidation(problems.isEmpty(), problems);
    }

    /**
     * Writes the whole registry as a JSON audit record.
     */
    public synchronized void export(Path path) {
        Map<String, Object> record = new LinkedHashMap<>();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("created", created.toString());
        metadata.put("totalResources", resources.size());
        metadata.put("totalCrossReferences", crossReferences.size());
        record.put("metadata", metadata);
        record.put("resources", resources.values());
        record.put("crossReferences", crossReferences);
        record.put("chapterMap", chapterMap());
        record.put("excludedChapters", excludedChapters);
        record.put("statistics", statistics());

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), record);
            logger.info("Reference mapping exported to {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not export reference mapping to " + path, e);
        }
    }

    /**
     * Drops all state, ending the mapper's job-scoped lifetime.
     */
    public synchronized void clear() {
        resources.clear();
        byIntermediateName.clear();
        crossReferences.clear();
        excludedChapters.clear();
    }

    private Map<String, Set<String>> chapterMap() {
        Map<String, Set<String>> map = new LinkedHashMap<>();
        for (ResourceReference resource : resources.values()) {
            for (String chapter : resource.getReferencedIn()) {
                map.computeIfAbsent(chapter, c -> new LinkedHashSet<>()).add(resource.getOriginalPath());
            }
        }
        return map;
    }

    private Map<String, Object> statistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("images", resources.values().stream().filter(r -> r.getKind() == ResourceKind.IMAGE).count());
        stats.put("linkTargets", resources.values().stream().filter(r -> r.getKind() == ResourceKind.LINK).count());
        stats.put("vectorImages", resources.values().stream()
                .filter(r -> r.getGeometry() != null && r.getGeometry().isVector()).count());
        stats.put("finalized", resources.values().stream().filter(r -> r.getFinalName() != null).count());
        stats.put("unreferenced", resources.values().stream().filter(r -> r.getReferencedIn().isEmpty()).count());
        stats.put("unresolvedReferences", crossReferences.stream().filter(r -> r.getTargetPath() == null).count());
        return stats;
    }

    private ResourceReference require(String originalPath) {
        ResourceReference resource = resources.get(originalPath);
        if (resource == null) {
            throw new UnknownResourceException("Unknown resource: " + originalPath);
        }
        return resource;
    }
}
