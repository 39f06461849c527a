package com.example.rittdoc.service.validation;

import com.example.rittdoc.exception.PackagingException;
import com.example.rittdoc.exception.SchemaValidationUnavailableException;
import com.example.rittdoc.model.FindingCategory;
import com.example.rittdoc.model.FindingSeverity;
import com.example.rittdoc.model.ValidationFinding;
import com.example.rittdoc.model.ValidationReport;
import com.example.rittdoc.xml.DocBook;
import net.lingala.zip4j.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates a RittDoc package against the DTD and reports every violation with the chapter file, line and
 * column where it occurs.
 * <p>
 * {@code Book.XML} pulls its chapters in through external entities, so validating it as one document would
 * report positions relative to the expanded text. Instead the book skeleton is validated with the chapter
 * entities resolved to nothing, and every chapter file is validated on its own as a {@code chapter} document.
 * IDs must be unique across the whole book, so duplicates between chapter files are reported separately,
 * and a reference a chapter cannot resolve on its own is only reported when no other chapter defines the id.
 */
@Service
public class EntityTrackingDtdValidator {

    private static final Logger logger = LoggerFactory.getLogger(EntityTrackingDtdValidator.class);

    private static final String LOCALE_PROPERTY = "http://apache.org/xml/properties/locale";
    private static final Pattern ENTITY_DECLARATION = Pattern.compile("<!ENTITY\\s+(\\S+)\\s+SYSTEM\\s+\"([^\"]+)\"\\s*>");
    private static final Pattern XML_DECLARATION = Pattern.compile("^\\s*<\\?xml[^>]*\\?>");
    private static final Pattern ID_ATTRIBUTE = Pattern.compile("\\sid=\"([^\"]*)\"");
    private static final Pattern UNRESOLVED_IDREF =
            Pattern.compile("An element with the identifier \"([^\"]+)\" must appear in the document");

    private final Executor validationExecutor;
    private final Supplier<DocumentBuilderFactory> factorySupplier;

    @Autowired
    public EntityTrackingDtdValidator(@Qualifier("validationExecutor") Executor validationExecutor) {
        this(validationExecutor, DocumentBuilderFactory::newInstance);
    }

    EntityTrackingDtdValidator(Executor validationExecutor, Supplier<DocumentBuilderFactory> factorySupplier) {
        this.validationExecutor = validationExecutor;
        this.factorySupplier = factorySupplier;
    }

    /**
     * Validates an unpacked package directory holding {@code Book.XML} and its chapter files.
     *
     * @param dtd the RittDoc DTD all files are validated against
     * @throws SchemaValidationUnavailableException when no validating parser can be set up
     */
    public ValidationReport validatePackage(Path packageDir, Path dtd) {
        ensureCapability();
        ValidationReport report = new ValidationReport();
        report.setDtd(dtd.getFileName().toString());
        report.setPerformed(true);

        Path book = packageDir.resolve(DocBook.BOOK_FILE_NAME);
        if (!Files.isRegularFile(book)) {
            report.getFindings().add(new ValidationFinding(DocBook.BOOK_FILE_NAME, 0, 0, FindingCategory.XML_SYNTAX,
                    DocBook.BOOK_FILE_NAME + " not found in package", FindingSeverity.FATAL));
            return report;
        }

        Map<String, String> chapterEntities;
        try {
            chapterEntities = entityDeclarations(Files.readString(book, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PackagingException("Could not read " + book + ": " + e.getMessage(), e);
        }

        report.getValidatedFiles().add(DocBook.BOOK_FILE_NAME);
        report.getFindings().addAll(validateBook(book, dtd, chapterEntities));

        List<String> chapterFiles = new ArrayList<>(chapterEntities.values());
        List<CompletableFuture<List<ValidationFinding>>> futures = new ArrayList<>();
        for (String chapterFile : chapterFiles) {
            Path file = packageDir.resolve(chapterFile);
            futures.add(CompletableFuture.supplyAsync(() -> validateChapter(file, chapterFile, dtd), validationExecutor));
        }
        List<ValidationFinding> chapterFindings = new ArrayList<>();
        for (CompletableFuture<List<ValidationFinding>> future : futures) {
            chapterFindings.addAll(join(future));
        }
        report.getValidatedFiles().addAll(chapterFiles);

        Set<String> bookIds = new HashSet<>();
        List<ValidationFinding> duplicates = crossChapterDuplicateIds(packageDir, chapterFiles, bookIds);
        int resolved = chapterFindings.size();
        chapterFindings.removeIf(finding -> resolvedElsewhere(finding, bookIds));
        resolved -= chapterFindings.size();
        if (resolved > 0) {
            logger.debug("{} references resolved against other chapters", resolved);
        }
        report.getFindings().addAll(chapterFindings);
        report.getFindings().addAll(duplicates);

        logger.info("DTD validation of {} files finished with {} findings",
                report.getValidatedFiles().size(), report.getFindings().size());
        return report;
    }

    /**
     * Unpacks a RittDoc zip and validates it. Without an explicit {@code dtd}, the DTD shipped in the
     * archive is used.
     */
    public ValidationReport validateArchive(Path archive, Path dtd) {
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("rittdoc-validate-");
            try (ZipFile zipFile = new ZipFile(archive.toFile())) {
                zipFile.extractAll(workDir.toString());
            }
            Path effectiveDtd = dtd != null ? dtd : workDir.resolve(DocBook.DTD_SYSTEM_ID);
            if (!Files.isRegularFile(effectiveDtd)) {
                throw new SchemaValidationUnavailableException("No DTD available for " + archive.getFileName());
            }
            return validatePackage(workDir, effectiveDtd);
        } catch (IOException e) {
            throw new PackagingException("Could not unpack " + archive + " for validation: " + e.getMessage(), e);
        } finally {
            if (workDir != null) {
                try {
                    FileSystemUtils.deleteRecursively(workDir);
                } catch (IOException e) {
                    logger.warn("Could not delete validation work directory {}: {}", workDir, e.getMessage());
                }
            }
        }
    }

    /**
     * Chapter entity names mapped to their system ids, in declaration order.
     */
    static Map<String, String> entityDeclarations(String bookXml) {
        Map<String, String> entities = new LinkedHashMap<>();
        Matcher matcher = ENTITY_DECLARATION.matcher(bookXml);
        while (matcher.find()) {
            entities.put(matcher.group(1), matcher.group(2));
        }
        return entities;
    }

    private List<ValidationFinding> validateBook(Path book, Path dtd, Map<String, String> chapterEntities) {
        FindingCollector collector = new FindingCollector(DocBook.BOOK_FILE_NAME);
        try {
            DocumentBuilder builder = newBuilder(collector);
            builder.setEntityResolver((publicId, systemId) -> {
                if (systemId != null && chapterEntities.values().stream().anyMatch(systemId::endsWith)) {
                    // chapters are validated on their own
                    return new InputSource(new StringReader(""));
                }
                return resolve(systemId, dtd);
            });
            builder.parse(book.toFile());
        } catch (SAXException e) {
            collector.unreported(e);
        } catch (IOException e) {
            collector.unreported(e);
        }
        return collector.findings;
    }

    List<ValidationFinding> validateChapter(Path file, String fileName, Path dtd) {
        FindingCollector collector = new FindingCollector(fileName);
        if (!Files.isRegularFile(file)) {
            collector.findings.add(new ValidationFinding(fileName, 0, 0, FindingCategory.XML_SYNTAX,
                    "Chapter file declared in " + DocBook.BOOK_FILE_NAME + " is missing", FindingSeverity.FATAL));
            return collector.findings;
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            InputSource source = new InputSource(new StringReader(withDoctype(content, dtd)));
            source.setSystemId(file.toUri().toString());
            DocumentBuilder builder = newBuilder(collector);
            builder.setEntityResolver((publicId, systemId) -> resolve(systemId, dtd));
            builder.parse(source);
        } catch (SAXException e) {
            collector.unreported(e);
        } catch (IOException e) {
            collector.unreported(e);
        }
        logger.debug("{}: {} findings", fileName, collector.findings.size());
        return collector.findings;
    }

    /**
     * Puts a chapter DOCTYPE right behind the XML declaration, on the same line, so reported line numbers
     * stay those of the file.
     */
    static String withDoctype(String content, Path dtd) {
        String doctype = "<!DOCTYPE chapter SYSTEM \"" + dtd.toUri() + "\">";
        Matcher declaration = XML_DECLARATION.matcher(content);
        if (declaration.find()) {
            return content.substring(0, declaration.end()) + doctype + content.substring(declaration.end());
        }
        return doctype + content;
    }

    /**
     * A chapter referencing an id it does not define itself is fine as long as another chapter defines it.
     */
    static boolean resolvedElsewhere(ValidationFinding finding, Set<String> bookIds) {
        if (finding.getDescription() == null) {
            return false;
        }
        Matcher matcher = UNRESOLVED_IDREF.matcher(finding.getDescription());
        return matcher.find() && bookIds.contains(matcher.group(1));
    }

    /**
     * Reports ids defined by more than one chapter and collects every chapter id into {@code bookIds}.
     */
    private List<ValidationFinding> crossChapterDuplicateIds(Path packageDir, List<String> chapterFiles,
                                                             Set<String> bookIds) {
        List<ValidationFinding> findings = new ArrayList<>();
        Map<String, String> owners = new HashMap<>();
        for (String chapterFile : chapterFiles) {
            Path file = packageDir.resolve(chapterFile);
            if (!Files.isRegularFile(file)) {
                continue;
            }
            List<String> lines;
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new PackagingException("Could not read " + file + ": " + e.getMessage(), e);
            }
            Map<String, Boolean> seenInFile = new HashMap<>();
            for (int i = 0; i < lines.size(); i++) {
                Matcher matcher = ID_ATTRIBUTE.matcher(lines.get(i));
                while (matcher.find()) {
                    String id = matcher.group(1);
                    bookIds.add(id);
                    if (seenInFile.put(id, Boolean.TRUE) != null) {
                        continue;
                    }
                    String owner = owners.putIfAbsent(id, chapterFile);
                    if (owner != null) {
                        findings.add(new ValidationFinding(chapterFile, i + 1, matcher.start(1) + 1,
                                FindingCategory.INVALID_ATTRIBUTE_VALUE,
                                "ID \"" + id + "\" is already defined in " + owner, FindingSeverity.ERROR));
                    }
                }
            }
        }
        return findings;
    }

    private void ensureCapability() {
        newFactory();
    }

    private DocumentBuilderFactory newFactory() {
        DocumentBuilderFactory factory = factorySupplier.get();
        if (factory == null) {
            throw new SchemaValidationUnavailableException("No XML parser available for DTD validation");
        }
        factory.setValidating(true);
        factory.setNamespaceAware(false);
        factory.setExpandEntityReferences(true);
        if (!factory.isValidating()) {
            throw new SchemaValidationUnavailableException("XML parser does not support DTD validation");
        }
        try {
            factory.setAttribute(LOCALE_PROPERTY, Locale.ENGLISH);
        } catch (IllegalArgumentException e) {
            logger.debug("Parser does not accept a message locale, using the default: {}", e.getMessage());
        }
        return factory;
    }

    private DocumentBuilder newBuilder(ErrorHandler errorHandler) {
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(errorHandler);
            return builder;
        } catch (ParserConfigurationException e) {
            throw new SchemaValidationUnavailableException("Could not configure a validating parser: " + e.getMessage(), e);
        }
    }

    private static InputSource resolve(String systemId, Path dtd) {
        if (systemId != null && systemId.endsWith(DocBook.DTD_FILE_NAME)) {
            InputSource source = new InputSource(dtd.toUri().toString());
            source.setSystemId(dtd.toUri().toString());
            return source;
        }
        if (systemId != null && (systemId.startsWith("http:") || systemId.startsWith("https:"))) {
            logger.warn("Refusing to fetch remote entity {}", systemId);
            return new InputSource(new StringReader(""));
        }
        return null;
    }

    private static List<ValidationFinding> join(CompletableFuture<List<ValidationFinding>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    /**
     * Maps a parser message onto a finding category.
     */
    static FindingCategory categorize(String message) {
        if (message == null) {
            return FindingCategory.INVALID_CONTENT_MODEL;
        }
        if (message.contains("is incomplete")) {
            return FindingCategory.MISSING_REQUIRED_CHILD;
        }
        if (message.startsWith("Element type") && message.contains("must be declared")) {
            return FindingCategory.UNDECLARED_ELEMENT;
        }
        if (message.contains("is required and must be specified")) {
            return FindingCategory.MISSING_REQUIRED_ATTRIBUTE;
        }
        if ((message.startsWith("Attribute") && message.contains("must be declared"))
                || message.contains("must have a value from the list")
                || message.contains("must be unique")
                || message.contains("must be a name")
                || message.contains("must appear in the document")
                || message.contains("with value")) {
            return FindingCategory.INVALID_ATTRIBUTE_VALUE;
        }
        return FindingCategory.INVALID_CONTENT_MODEL;
    }

    /**
     * Collects the findings of one file. Parser warnings are not findings.
     */
    private static final class FindingCollector implements ErrorHandler {
        private final String fileName;
        private final List<ValidationFinding> findings = new ArrayList<>();

        FindingCollector(String fileName) {
            this.fileName = fileName;
        }

        @Override
        public void warning(SAXParseException exception) {
            logger.debug("{}:{}: {}", fileName, exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) {
            findings.add(new ValidationFinding(fileName, exception.getLineNumber(), exception.getColumnNumber(),
                    categorize(exception.getMessage()), exception.getMessage(), FindingSeverity.ERROR));
        }

        @Override
        public void fatalError(SAXParseException exception) {
            findings.add(new ValidationFinding(fileName, exception.getLineNumber(), exception.getColumnNumber(),
                    FindingCategory.XML_SYNTAX, exception.getMessage(), FindingSeverity.FATAL));
        }

        /**
         * Records a parse abort unless the handler has already seen it.
         */
        void unreported(Exception e) {
            boolean alreadyReported = e instanceof SAXParseException
                    && findings.stream().anyMatch(f -> f.getSeverity() == FindingSeverity.FATAL);
            if (!alreadyReported) {
                int line = e instanceof SAXParseException ? ((SAXParseException) e).getLineNumber() : 0;
                int column = e instanceof SAXParseException ? ((SAXParseException) e).getColumnNumber() : 0;
                findings.add(new ValidationFinding(fileName, line, column, FindingCategory.XML_SYNTAX,
                        String.valueOf(e.getMessage()), FindingSeverity.FATAL));
            }
        }
    }
}
