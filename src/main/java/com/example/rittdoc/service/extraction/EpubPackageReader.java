package com.example.rittdoc.service.extraction;

import com.example.rittdoc.dto.conversion.BookMetadata;
import com.example.rittdoc.dto.conversion.EpubPackage;
import com.example.rittdoc.exception.ExtractionException;
import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.model.FileHeader;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opens an EPUB with zip4j and reads the package document: metadata, manifest images and the spine.
 */
@Service
public class EpubPackageReader {

    private static final Logger logger = LoggerFactory.getLogger(EpubPackageReader.class);

    private static final String CONTAINER_PATH = "META-INF/container.xml";
    private static final Pattern YEAR = Pattern.compile("(\\d{4})");

    public EpubPackage read(Path epubFile) {
        logger.info("Reading EPUB package: {}", epubFile.getFileName());
        if (!Files.isRegularFile(epubFile)) {
            throw new ExtractionException("EPUB file not found: " + epubFile);
        }

        EpubPackage epub = new EpubPackage();
        epub.setSourceName(epubFile.getFileName().toString());

        try (ZipFile zipFile = new ZipFile(epubFile.toFile())) {
            if (!zipFile.isValidZipFile()) {
                throw new ExtractionException("Not a valid EPUB archive: " + epubFile.getFileName());
            }
            Map<String, FileHeader> entries = new HashMap<>();
            for (FileHeader header : zipFile.getFileHeaders()) {
                if (!header.isDirectory()) {
                    entries.put(header.getFileName(), header);
                }
            }

            String opfPath = findPackageDocument(zipFile, entries);
            epub.setOpfPath(opfPath);
            Document opf = Jsoup.parse(readText(zipFile, entries.get(opfPath)), "", Parser.xmlParser());
            String opfDir = opfPath.contains("/") ? opfPath.substring(0, opfPath.lastIndexOf('/') + 1) : "";

            epub.setMetadata(readMetadata(opf));

            Map<String, Element> manifest = new HashMap<>();
            for (Element item : opf.getElementsByTag("item")) {
                manifest.put(item.attr("id"), item);
                String mediaType = item.attr("media-type");
                if (mediaType.startsWith("image/")) {
                    String path = resolve(opfDir, item.attr("href"));
                    FileHeader header = entries.get(path);
                    if (header == null) {
                        logger.warn("Manifest image {} is missing from the archive", path);
                        continue;
                    }
                    epub.getImages().add(new EpubPackage.ManifestImage(path, mediaType, readBytes(zipFile, header)));
                }
            }

            for (Element itemref : opf.getElementsByTag("itemref")) {
                Element item = manifest.get(itemref.attr("idref"));
                if (item == null) {
                    logger.warn("Spine references unknown manifest item '{}'", itemref.attr("idref"));
                    continue;
                }
                String path = resolve(opfDir, item.attr("href"));
                FileHeader header = entries.get(path);
                if (header == null) {
                    throw new ExtractionException("Spine document missing from archive: " + path);
                }
                epub.getSpine().add(new EpubPackage.SpineDocument(path, item.attr("media-type"), readText(zipFile, header)));
            }
            if (epub.getSpine().isEmpty()) {
                throw new ExtractionException("EPUB spine is empty: " + epubFile.getFileName());
            }
        } catch (IOException e) {
            logger.error("Error reading EPUB {}: {}", epubFile.getFileName(), e.getMessage(), e);
            throw new ExtractionException("Could not read EPUB " + epubFile.getFileName() + ": " + e.getMessage(), e);
        }

        logger.info("EPUB {}: {} spine documents, {} images", epub.getSourceName(),
                epub.getSpine().size(), epub.getImages().size());
        return epub;
    }

    private String findPackageDocument(ZipFile zipFile, Map<String, FileHeader> entries) throws IOException {
        FileHeader container = entries.get(CONTAINER_PATH);
        if (container != null) {
            Document doc = Jsoup.parse(readText(zipFile, container), "", Parser.xmlParser());
            Element rootFile = doc.getElementsByTag("rootfile").first();
            if (rootFile != null && entries.containsKey(rootFile.attr("full-path"))) {
                return rootFile.attr("full-path");
            }
        }
        // Tolerate packages with a broken container by looking for any OPF
        return entries.keySet().stream()
                .filter(name -> name.toLowerCase(Locale.ROOT).endsWith(".opf"))
                .sorted()
                .findFirst()
                .orElseThrow(() -> new ExtractionException("No package document (.opf) found in EPUB"));
    }

    private BookMetadata readMetadata(Document opf) {
        BookMetadata metadata = new BookMetadata();
        metadata.setTitle(firstText(opf, "dc:title"));
        for (Element creator : dublinCore(opf, "dc:creator")) {
            if (StringUtils.isNotBlank(creator.text())) {
                metadata.getAuthors().add(creator.text().trim());
            }
        }
        metadata.setPublisher(firstText(opf, "dc:publisher"));
        metadata.setLanguage(firstText(opf, "dc:language"));

        String date = firstText(opf, "dc:date");
        if (date != null) {
            Matcher matcher = YEAR.matcher(date);
            metadata.setPublicationDate(matcher.find() ? matcher.group(1) : date);
        }

        for (Element identifier : dublinCore(opf, "dc:identifier")) {
            String value = identifier.text().trim();
            String lower = value.toLowerCase(Locale.ROOT);
            boolean isbnScheme = identifier.attr("opf:scheme").equalsIgnoreCase("isbn");
            boolean looksLikeIsbn = !lower.startsWith("urn:uuid:") && value.replaceAll("[^0-9Xx]", "").length() >= 10;
            if (lower.startsWith("urn:isbn:") || isbnScheme || looksLikeIsbn) {
                metadata.setIsbn(lower.startsWith("urn:isbn:") ? value.substring("urn:isbn:".length()) : value);
                break;
            }
        }

        String rights = firstText(opf, "dc:rights");
        if (rights != null) {
            Matcher matcher = YEAR.matcher(rights);
            if (matcher.find()) {
                metadata.setCopyrightYear(matcher.group(1));
                String holder = rights.substring(matcher.end()).replaceAll("^[\\s,.]+", "").trim();
                metadata.setCopyrightHolder(StringUtils.trimToNull(holder));
            }
        }
        return metadata;
    }

    /**
     * Dublin Core elements, with or without the {@code dc:} prefix.
     */
    private static Elements dublinCore(Document opf, String prefixedName) {
        Elements elements = opf.getElementsByTag(prefixedName);
        if (elements.isEmpty()) {
            Element metadata = opf.getElementsByTag("metadata").first();
            if (metadata != null) {
                elements = metadata.getElementsByTag(prefixedName.substring(3));
            }
        }
        return elements;
    }

    private static String firstText(Document opf, String prefixedName) {
        Element element = dublinCore(opf, prefixedName).first();
        return element == null ? null : StringUtils.trimToNull(element.text());
    }

    /**
     * Resolves an href against the directory of the referring document into a normalized archive path.
     */
    public static String resolve(String baseDir, String href) {
        String decoded = URLDecoder.decode(href.replace("+", "%2B"), StandardCharsets.UTF_8);
        String combined = decoded.startsWith("/") ? decoded.substring(1) : baseDir + decoded;
        Deque<String> parts = new ArrayDeque<>();
        for (String part : combined.split("/")) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            if (part.equals("..")) {
                if (!parts.isEmpty()) {
                    parts.removeLast();
                }
            } else {
                parts.addLast(part);
            }
        }
        return String.join("/", parts);
    }

    private static String readText(ZipFile zipFile, FileHeader header) throws IOException {
        return new String(readBytes(zipFile, header), StandardCharsets.UTF_8);
    }

    private static byte[] readBytes(ZipFile zipFile, FileHeader header) throws IOException {
        try (InputStream is = zipFile.getInputStream(header)) {
            return is.readAllBytes();
        }
    }
}
