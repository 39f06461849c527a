package com.example.rittdoc.service.conversion;

import com.example.rittdoc.config.ConversionConfig;
import com.example.rittdoc.dto.conversion.StructuredChapter;
import com.example.rittdoc.dto.conversion.StructuredDocument;
import com.example.rittdoc.exception.ComplianceTransformException;
import com.example.rittdoc.exception.ConversionException;
import com.example.rittdoc.model.ChapterFailurePolicy;
import com.example.rittdoc.model.ConversionResult;
import com.example.rittdoc.model.JobStatus;
import com.example.rittdoc.model.ReferenceValidation;
import com.example.rittdoc.model.SourceFormat;
import com.example.rittdoc.model.TransformReport;
import com.example.rittdoc.model.ValidationReport;
import com.example.rittdoc.service.compliance.DtdComplianceTransformer;
import com.example.rittdoc.service.extraction.EpubPackageReader;
import com.example.rittdoc.service.extraction.PdfLayoutExtractor;
import com.example.rittdoc.service.packaging.PackageResult;
import com.example.rittdoc.service.packaging.RittDocPackager;
import com.example.rittdoc.service.reference.ReferenceMapper;
import com.example.rittdoc.service.reference.ReferenceMapperFactory;
import com.example.rittdoc.service.validation.EntityTrackingDtdValidator;
import com.example.rittdoc.service.validation.SchemaLocator;
import com.example.rittdoc.service.validation.ValidationReportWriter;
import com.example.rittdoc.xml.DocBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Runs one conversion job from source file to validated RittDoc package.
 * <p>
 * Stages run in sequence, each on the complete output of the previous one: extraction, structuring,
 * compliance transform, packaging, reference validation and DTD validation. A fresh {@link ReferenceMapper}
 * is created per job. Both audit files are written whatever the outcome.
 */
@Service
public class ConversionOrchestrationService {

    private static final Logger logger = LoggerFactory.getLogger(ConversionOrchestrationService.class);

    @Autowired
    private ConversionConfig conversionConfig;

    @Autowired
    private PdfLayoutExtractor pdfLayoutExtractor;

    @Autowired
    private PdfStructuringService pdfStructuringService;

    @Autowired
    private EpubPackageReader epubPackageReader;

    @Autowired
    private EpubStructuringService epubStructuringService;

    @Autowired
    private DtdComplianceTransformer complianceTransformer;

    @Autowired
    private SchemaLocator schemaLocator;

    @Autowired
    private RittDocPackager packager;

    @Autowired
    private EntityTrackingDtdValidator validator;

    @Autowired
    private ValidationReportWriter validationReportWriter;

    @Autowired
    private ReferenceMapperFactory referenceMapperFactory;

    /**
     * Converts into the configured output directory.
     */
    public ConversionResult convert(Path source) {
        return convert(source, conversionConfig.getOutputDir());
    }

    /**
     * @throws com.example.rittdoc.exception.UnsupportedSourceFormatException for anything but PDF and EPUB,
     *                                                                         before any work is done
     */
    public ConversionResult convert(Path source, Path outputDir) {
        SourceFormat format = SourceFormat.fromPath(source);
        String baseName = baseName(source);

        ConversionResult result = new ConversionResult();
        result.setSourceName(source.getFileName().toString());
        result.setSourceFormat(format);
        result.setReferenceMappingPath(outputDir.resolve(baseName + "_reference_mapping.json"));
        result.setValidationReportPath(outputDir.resolve(baseName + "_validation_report.json"));

        ReferenceMapper mapper = referenceMapperFactory.newMapper();
        ValidationReport validation = ValidationReport.notPerformed("Job stopped before DTD validation");
        Path workDir = outputDir.resolve(baseName + "_work");
        long started = System.currentTimeMillis();

        try {
            Files.createDirectories(workDir);
            Path mediaDir = workDir.resolve("media");

            logger.info("Job {}: Starting Step 1 - Extraction and structuring ({})", baseName, format);
            StructuredDocument document = format == SourceFormat.PDF
                    ? pdfStructuringService.structure(pdfLayoutExtractor.extract(source, mediaDir), mapper)
                    : epubStructuringService.structure(epubPackageReader.read(source), mapper, mediaDir);

            logger.info("Job {}: Starting Step 2 - DTD compliance transform of {} chapters",
                    baseName, document.getChapters().size());
            TransformReport transformReport = transformChapters(document, mapper);
            complianceTransformer.resolveLinks(document, transformReport);
            complianceTransformer.transformBookInfo(document, transformReport);
            logger.info("Job {}: {} compliance fixes applied", baseName, transformReport.getTotal());

            logger.info("Job {}: Starting Step 3 - Packaging", baseName);
            Path dtd = schemaLocator.locate(workDir);
            PackageResult packageResult = packager.pack(document, mapper, mediaDir, dtd, outputDir, baseName);
            result.setArchivePath(packageResult.getArchivePath());
            result.setChapterCount(packageResult.getChapterFiles().size());

            logger.info("Job {}: Starting Step 4 - Reference and DTD validation", baseName);
            ReferenceValidation references = mapper.validate(packageResult.getStagingDir());
            result.getReferenceProblems().addAll(references.getProblems());
            validation = validator.validatePackage(packageResult.getStagingDir(),
                    packageResult.getStagingDir().resolve(DocBook.DTD_SYSTEM_ID));
            result.setValidationPassed(validation.isPassed());
            result.setFindingCount(validation.getFindings().size());

            result.getExcludedChapters().addAll(mapper.getExcludedChapters());
            result.setStatus(status(result));
        } catch (ConversionException | IOException | UncheckedIOException e) {
            logger.error("Job {} failed: {}", baseName, e.getMessage(), e);
            result.setStatus(JobStatus.FAILED);
            result.setFailureReason(e.getClass().getSimpleName() + ": " + e.getMessage());
            result.getExcludedChapters().clear();
            result.getExcludedChapters().addAll(mapper.getExcludedChapters());
            if (!validation.isPerformed()) {
                validation.setNote("Job failed before DTD validation: " + e.getMessage());
            }
        } finally {
            writeAuditFiles(result, mapper, validation);
            deleteWorkDir(workDir);
            mapper.clear();
        }

        logger.info("Job {} finished with status {} in {} ms (chapters: {}, findings: {}, reference problems: {})",
                baseName, result.getStatus(), System.currentTimeMillis() - started, result.getChapterCount(),
                result.getFindingCount(), result.getReferenceProblems().size());
        return result;
    }

    /**
     * Transforms chapter by chapter. Under {@link ChapterFailurePolicy#EXCLUDE} a failing chapter is dropped
     * and its references retracted; under {@link ChapterFailurePolicy#ABORT} the failure ends the job.
     */
    TransformReport transformChapters(StructuredDocument document, ReferenceMapper mapper) {
        TransformReport report = new TransformReport();
        Iterator<StructuredChapter> chapters = document.getChapters().iterator();
        while (chapters.hasNext()) {
            StructuredChapter chapter = chapters.next();
            try {
                complianceTransformer.transformChapter(chapter, report);
            } catch (ComplianceTransformException e) {
                if (conversionConfig.getFailurePolicy() == ChapterFailurePolicy.ABORT) {
                    throw e;
                }
                logger.warn("Excluding chapter {} ({}): {}", chapter.getId(), chapter.getSourcePath(), e.getMessage());
                mapper.retractChapter(chapter.getId(), chapter.getSourcePath(), e.getMessage());
                chapters.remove();
            }
        }
        return report;
    }

    private static JobStatus status(ConversionResult result) {
        if (!result.isValidationPassed()) {
            return JobStatus.FAILED;
        }
        if (!result.getReferenceProblems().isEmpty() || !result.getExcludedChapters().isEmpty()) {
            return JobStatus.SUCCESS_WITH_WARNINGS;
        }
        return JobStatus.SUCCESS;
    }

    private void writeAuditFiles(ConversionResult result, ReferenceMapper mapper, ValidationReport validation) {
        try {
            mapper.export(result.getReferenceMappingPath());
        } catch (UncheckedIOException e) {
            logger.error("Could not write reference mapping for {}: {}", result.getSourceName(), e.getMessage(), e);
            result.setReferenceMappingPath(null);
        }
        try {
            validationReportWriter.write(validation, result.getValidationReportPath());
        } catch (UncheckedIOException e) {
            logger.error("Could not write validation report for {}: {}", result.getSourceName(), e.getMessage(), e);
            result.setValidationReportPath(null);
        }
    }

    private static void deleteWorkDir(Path workDir) {
        try {
            FileSystemUtils.deleteRecursively(workDir);
        } catch (IOException e) {
            logger.warn("Could not delete work directory {}: {}", workDir, e.getMessage());
        }
    }

    static String baseName(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
