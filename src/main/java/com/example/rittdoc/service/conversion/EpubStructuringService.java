package com.example.rittdoc.service.conversion;

import com.example.rittdoc.dto.conversion.EpubPackage;
import com.example.rittdoc.dto.conversion.StructuredChapter;
import com.example.rittdoc.dto.conversion.StructuredDocument;
import com.example.rittdoc.exception.ExtractionException;
import com.example.rittdoc.model.ResourceGeometry;
import com.example.rittdoc.model.ResourceKind;
import com.example.rittdoc.model.SourceFormat;
import com.example.rittdoc.service.reference.ReferenceMapper;
import com.example.rittdoc.xml.DocBook;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns an EPUB package into the intermediate DocBook tree: one chapter per spine document, in spine order.
 * <p>
 * Manifest images are written to the media work directory under intermediate names and registered with the
 * job's {@link ReferenceMapper}, as is every spine document so that cross-document links can be tracked.
 */
@Service
public class EpubStructuringService {

    private static final Logger logger = LoggerFactory.getLogger(EpubStructuringService.class);

    public StructuredDocument structure(EpubPackage epub, ReferenceMapper mapper, Path mediaDir) {
        logger.info("Structuring EPUB {} ({} spine documents)", epub.getSourceName(), epub.getSpine().size());
        registerImages(epub, mapper, mediaDir);

        Map<String, String> chapterIds = new LinkedHashMap<>();
        int index = 1;
        for (EpubPackage.SpineDocument document : epub.getSpine()) {
            if (chapterIds.containsKey(document.getPath())) {
                logger.warn("Spine lists {} more than once, later occurrences skipped", document.getPath());
                continue;
            }
            String chapterId = DocBook.chapterId(index++);
            chapterIds.put(document.getPath(), chapterId);
            mapper.register(document.getPath(), chapterId, ResourceKind.LINK, null);
        }

        StructuredDocument result = new StructuredDocument();
        result.setSourceFormat(SourceFormat.EPUB);
        result.setSourceName(epub.getSourceName());
        result.setMetadata(epub.getMetadata());

        for (EpubPackage.SpineDocument document : epub.getSpine()) {
            String chapterId = chapterIds.get(document.getPath());
            if (result.findChapter(chapterId).isPresent()) {
                continue;
            }
            Document html = Jsoup.parse(document.getContent(), document.getPath());
            Element chapter = new XhtmlChapterConverter(chapterId, document.getPath(), chapterIds, mapper).convert(html);
            result.getChapters().add(new StructuredChapter(chapterId, document.getPath(), chapter));
            logger.debug("{} -> {} '{}'", document.getPath(), chapterId, chapter.child(0).text());
        }

        logger.info("EPUB {} structured into {} chapters", epub.getSourceName(), result.getChapters().size());
        return result;
    }

    private void registerImages(EpubPackage epub, ReferenceMapper mapper, Path mediaDir) {
        try {
            Files.createDirectories(mediaDir);
            int counter = 0;
            for (EpubPackage.ManifestImage image : epub.getImages()) {
                if (image.getData() == null || image.getData().length == 0) {
                    logger.warn("Skipping empty image {}", image.getPath());
                    continue;
                }
                counter++;
                String intermediateName = String.format("img_%04d%s", counter, extension(image));
                Files.write(mediaDir.resolve(intermediateName), image.getData());
                mapper.register(image.getPath(), intermediateName, ResourceKind.IMAGE, geometry(image));
            }
            logger.info("Registered {} images from {}", counter, epub.getSourceName());
        } catch (IOException e) {
            throw new ExtractionException("Could not write EPUB images to " + mediaDir + ": " + e.getMessage(), e);
        }
    }

    private static String extension(EpubPackage.ManifestImage image) {
        String name = image.getPath().substring(image.getPath().lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            return name.substring(dot).toLowerCase(Locale.ROOT);
        }
        String subtype = image.getMediaType().substring(image.getMediaType().indexOf('/') + 1);
        if (subtype.startsWith("svg")) {
            return ".svg";
        }
        return "." + (subtype.equals("jpeg") ? "jpg" : subtype);
    }

    private static ResourceGeometry geometry(EpubPackage.ManifestImage image) throws IOException {
        boolean vector = image.getMediaType().contains("svg");
        ResourceGeometry geometry = new ResourceGeometry(null, null, vector, image.getData().length);
        if (!vector) {
            BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(image.getData()));
            if (decoded != null) {
                geometry.setWidth(decoded.getWidth());
                geometry.setHeight(decoded.getHeight());
            } else {
                logger.debug("No ImageIO reader for {}, dimensions unknown", image.getPath());
            }
        }
        return geometry;
    }
}
