package com.example.rittdoc.service.packaging;

import com.example.rittdoc.dto.conversion.StructuredChapter;
import com.example.rittdoc.dto.conversion.StructuredDocument;
import com.example.rittdoc.exception.PackagingException;
import com.example.rittdoc.model.ResourceKind;
import com.example.rittdoc.model.ResourceReference;
import com.example.rittdoc.service.reference.ReferenceMapper;
import com.example.rittdoc.xml.DocBook;
import com.example.rittdoc.xml.DocBookXmlWriter;
import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.model.ZipParameters;
import net.lingala.zip4j.model.enums.CompressionMethod;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lays out a RittDoc package and zips it.
 * <p>
 * Layout: {@code Book.XML} at the root declaring one external entity per chapter, one {@code chNNNN.xml} per
 * chapter, images under {@code MultiMedia/} and the DTD under {@code RITTDOCdtd/v1.1/}. Images get their final
 * name from the first chapter that shows them ({@code Ch0001f01.png}, numbered per chapter); images no
 * chapter shows go to {@code MultiMedia/SharedImages/} under their intermediate name.
 */
@Service
public class RittDocPackager {

    private static final Logger logger = LoggerFactory.getLogger(RittDocPackager.class);

    static final String SHARED_IMAGES = DocBook.MEDIA_DIRECTORY + "/SharedImages";

    /**
     * @param mediaDir  directory holding extracted images under their intermediate names
     * @param dtd       DTD copied into the package
     * @param outputDir directory receiving {@code <baseName>_package/} and {@code <baseName>.zip}
     */
    public PackageResult pack(StructuredDocument document, ReferenceMapper mapper, Path mediaDir, Path dtd,
                              Path outputDir, String baseName) {
        logger.info("Packaging {} chapters of {}", document.getChapters().size(), document.getSourceName());
        if (document.getBookInfo() == null) {
            throw new PackagingException("Document has no bookinfo, run the compliance transform first");
        }

        PackageResult result = new PackageResult();
        Path stagingDir = outputDir.resolve(baseName + "_package");
        try {
            FileSystemUtils.deleteRecursively(stagingDir);
            Files.createDirectories(stagingDir.resolve(DocBook.MEDIA_DIRECTORY));
            result.setStagingDir(stagingDir);

            int images = 0;
            for (StructuredChapter chapter : document.getChapters()) {
                images += placeChapterImages(chapter, mapper, mediaDir, stagingDir);
            }
            images += placeSharedImages(mapper, mediaDir, stagingDir);
            result.setImageCount(images);

            for (StructuredChapter chapter : document.getChapters()) {
                mapper.find(chapter.getSourcePath())
                        .filter(r -> r.getKind() == ResourceKind.LINK)
                        .ifPresent(r -> mapper.finalizeResource(r.getOriginalPath(), chapter.getFileName()));
                Files.writeString(stagingDir.resolve(chapter.getFileName()),
                        DocBookXmlWriter.toDocument(chapter.getRoot()), StandardCharsets.UTF_8);
                result.getChapterFiles().add(chapter.getFileName());
            }

            copyDtd(dtd, stagingDir.resolve(DocBook.DTD_DIRECTORY));
            Files.writeString(stagingDir.resolve(DocBook.BOOK_FILE_NAME), bookXml(document), StandardCharsets.UTF_8);

            Path archive = outputDir.resolve(baseName + ".zip");
            zip(stagingDir, archive);
            result.setArchivePath(archive);
        } catch (IOException e) {
            logger.error("Packaging of {} failed: {}", document.getSourceName(), e.getMessage(), e);
            throw new PackagingException("Could not package " + document.getSourceName() + ": " + e.getMessage(), e);
        }

        logger.info("Package written to {} ({} chapters, {} images)", result.getArchivePath(),
                result.getChapterFiles().size(), result.getImageCount());
        return result;
    }

    /**
     * Assigns final names to the images a chapter shows, in order of first appearance, and rewrites the
     * chapter's file references to them.
     */
    private int placeChapterImages(StructuredChapter chapter, ReferenceMapper mapper, Path mediaDir,
                                   Path stagingDir) throws IOException {
        int placed = 0;
        int figureNumber = 0;
        String prefix = Character.toUpperCase(chapter.getId().charAt(0)) + chapter.getId().substring(1);
        for (Element imageData : chapter.getRoot().getElementsByTag("imagedata")) {
            Optional<ResourceReference> resource = mapper.findByIntermediateName(imageData.attr("fileref"));
            if (resource.isEmpty() || resource.get().getKind() != ResourceKind.IMAGE) {
                continue;
            }
            ResourceReference image = resource.get();
            if (image.getFinalName() == null) {
                figureNumber++;
                String finalName = String.format("%s/%sf%02d%s", DocBook.MEDIA_DIRECTORY, prefix, figureNumber,
                        extension(image.getIntermediateName()));
                copyImage(mediaDir.resolve(image.getIntermediateName()), stagingDir.resolve(finalName));
                mapper.finalizeResource(image.getOriginalPath(), finalName);
                placed++;
            }
            imageData.attr("fileref", image.getFinalName());
        }
        return placed;
    }

    private int placeSharedImages(ReferenceMapper mapper, Path mediaDir, Path stagingDir) throws IOException {
        int placed = 0;
        for (ResourceReference resource : mapper.getResources()) {
            if (resource.getKind() != ResourceKind.IMAGE || resource.getFinalName() != null) {
                continue;
            }
            String finalName = SHARED_IMAGES + "/" + resource.getIntermediateName();
            copyImage(mediaDir.resolve(resource.getIntermediateName()), stagingDir.resolve(finalName));
            mapper.finalizeResource(resource.getOriginalPath(), finalName);
            placed++;
        }
        if (placed > 0) {
            logger.info("{} images not shown by any chapter kept under {}", placed, SHARED_IMAGES);
        }
        return placed;
    }

    private static void copyImage(Path source, Path target) throws IOException {
        if (!Files.isRegularFile(source)) {
            logger.warn("Image {} is missing from the media directory", source.getFileName());
            return;
        }
        Files.createDirectories(target.getParent());
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(dot) : "";
    }

    private static void copyDtd(Path dtd, Path targetDir) throws IOException {
        Files.createDirectories(targetDir);
        try (Stream<Path> files = Files.list(dtd.getParent())) {
            List<Path> modules = files.filter(Files::isRegularFile)
                    .filter(f -> f.getFileName().toString().matches("(?i).*\\.(dtd|mod|ent)$"))
                    .collect(Collectors.toList());
            for (Path file : modules) {
                Files.copy(file, targetDir.resolve(file.getFileName().toString()), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        if (!dtd.getFileName().toString().equals(DocBook.DTD_FILE_NAME)) {
            Files.copy(dtd, targetDir.resolve(DocBook.DTD_FILE_NAME), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * The book skeleton: DOCTYPE with one entity per chapter, bookinfo, then the entity references.
     */
    static String bookXml(StructuredDocument document) {
        StringBuilder xml = new StringBuilder(DocBookXmlWriter.XML_DECLARATION).append('\n');
        xml.append("<!DOCTYPE book PUBLIC \"").append(DocBook.PUBLIC_ID).append("\" \"")
                .append(DocBook.DTD_SYSTEM_ID).append("\" [\n");
        for (StructuredChapter chapter : document.getChapters()) {
            xml.append("  <!ENTITY ").append(chapter.getId()).append(" SYSTEM \"")
                    .append(chapter.getFileName()).append("\">\n");
        }
        xml.append("]>\n");
        xml.append("<book>\n");
        StringBuilder bookInfo = new StringBuilder();
        writeIndented(document.getBookInfo(), bookInfo);
        xml.append(bookInfo);
        for (StructuredChapter chapter : document.getChapters()) {
            xml.append("  &").append(chapter.getId()).append(";\n");
        }
        xml.append("</book>\n");
        return xml.toString();
    }

    private static void writeIndented(Element element, StringBuilder out) {
        for (String line : DocBookXmlWriter.toXml(element).split("\n")) {
            out.append("  ").append(line).append('\n');
        }
    }

    private void zip(Path stagingDir, Path archive) throws IOException {
        Files.deleteIfExists(archive);
        List<Path> files;
        try (Stream<Path> walk = Files.walk(stagingDir)) {
            files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toCollection(ArrayList::new));
        }
        try (ZipFile zipFile = new ZipFile(archive.toFile())) {
            // Book.XML leads the archive
            files.sort((a, b) -> Boolean.compare(!a.getFileName().toString().equals(DocBook.BOOK_FILE_NAME),
                    !b.getFileName().toString().equals(DocBook.BOOK_FILE_NAME)));
            for (Path path : files) {
                String entryName = stagingDir.relativize(path).toString().replace("\\", "/");
                ZipParameters fileParams = new ZipParameters();
                fileParams.setCompressionMethod(CompressionMethod.DEFLATE);
                fileParams.setFileNameInZip(entryName);
                zipFile.addFile(path.toFile(), fileParams);
            }
        }
        logger.debug("Zipped {} files into {}", files.size(), archive.getFileName());
    }
}
