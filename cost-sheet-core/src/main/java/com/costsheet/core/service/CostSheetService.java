package com.costsheet.core.service;

import com.costsheet.core.aggregate.AggregationEngine;
import com.costsheet.core.aggregate.PricingSummary;
import com.costsheet.core.config.CostSheetConfig;
import com.costsheet.core.config.FeatureFlags;
import com.costsheet.core.document.DisplayValues;
import com.costsheet.core.document.DocumentContext;
import com.costsheet.core.document.DocumentContextBuilder;
import com.costsheet.core.document.QuotationKind;
import com.costsheet.core.exception.CostSheetException;
import com.costsheet.core.exception.ProjectValidationException;
import com.costsheet.core.exception.SheetPoolExhaustedException;
import com.costsheet.core.exception.TemplateException;
import com.costsheet.core.exception.ValidationIssue;
import com.costsheet.core.exception.WorkbookFormatException;
import com.costsheet.core.exception.WorkbookIntegrityException;
import com.costsheet.core.model.Project;
import com.costsheet.core.pricing.ModelExceptionTable;
import com.costsheet.core.pricing.PricingAnomaly;
import com.costsheet.core.pricing.PricingRuleEngine;
import com.costsheet.core.pricing.SharedCostScope;
import com.costsheet.core.renderer.ClasspathTemplateSource;
import com.costsheet.core.renderer.DocxTemplateRenderer;
import com.costsheet.core.renderer.FileSystemTemplateSource;
import com.costsheet.core.renderer.GeneratedFile;
import com.costsheet.core.renderer.OutputFileNames;
import com.costsheet.core.renderer.QuotationBundler;
import com.costsheet.core.renderer.TemplateRenderer;
import com.costsheet.core.renderer.TemplateSource;
import com.costsheet.core.validation.ProjectValidator;
import com.costsheet.core.workbook.ReadReport;
import com.costsheet.core.workbook.ReadResult;
import com.costsheet.core.workbook.SpreadsheetReader;
import com.costsheet.core.workbook.SpreadsheetSynthesizer;
import com.costsheet.core.workbook.TemplateWorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Public entry points of the cost sheet pipeline.
 *
 * <p>Every operation returns a {@link GenerationResult}. Domain exceptions and unexpected
 * runtime failures are turned into a failed result naming the stage that failed; nothing
 * is thrown to the caller.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CostSheetService service = new CostSheetService(ConfigLoader.load(Path.of("costsheet.yaml")));
 * GenerationResult sheet = service.generateCostSheet(project);
 * GenerationResult quote = service.generateQuotation(sheet.artifact().orElseThrow().content());
 * }</pre>
 */
public class CostSheetService {

    private static final Logger log = LoggerFactory.getLogger(CostSheetService.class);

    private final CostSheetConfig config;
    private final ProjectValidator validator;
    private final AggregationEngine aggregation;
    private final SpreadsheetSynthesizer synthesizer;
    private final SpreadsheetReader reader;
    private final DocumentContextBuilder contextBuilder;
    private final TemplateRenderer renderer;
    private final QuotationBundler bundler;

    public CostSheetService(CostSheetConfig config) {
        this(config, defaultTemplateSource(config));
    }

    /**
     * Creates a service reading quotation templates from the given source.
     *
     * @param config configuration
     * @param templates quotation template source
     */
    public CostSheetService(CostSheetConfig config, TemplateSource templates) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(templates, "templates must not be null");
        SharedCostScope scope = config.pricing().sharedCostScope();
        FeatureFlags features = config.featureFlags();
        PricingRuleEngine pricing = new PricingRuleEngine(config.pricing().policy(), ModelExceptionTable.load());

        this.validator = new ProjectValidator();
        this.aggregation = new AggregationEngine(pricing, scope, features);
        this.synthesizer = new SpreadsheetSynthesizer(new TemplateWorkbookFactory(), config.workbook(), features, scope);
        this.reader = new SpreadsheetReader(pricing, scope, features);
        this.contextBuilder = new DocumentContextBuilder(pricing, features,
            new DisplayValues(config.documents().currencySymbol()));
        this.renderer = new DocxTemplateRenderer(templates);
        this.bundler = new QuotationBundler();
    }

    private static TemplateSource defaultTemplateSource(CostSheetConfig config) {
        String directory = config.documents().templateDirectory();
        if (directory == null || directory.isBlank()) {
            return new ClasspathTemplateSource();
        }
        return new FileSystemTemplateSource(Path.of(directory));
    }

    /**
     * Checks a project without pricing it.
     *
     * @param project project to check
     * @return validation issues, empty when valid
     */
    public List<ValidationIssue> validate(Project project) {
        Objects.requireNonNull(project, "project must not be null");
        return validator.validate(project);
    }

    /**
     * Validates and prices a project without producing files.
     *
     * @param project project to price
     * @return result carrying the pricing summary
     */
    public GenerationResult price(Project project) {
        Objects.requireNonNull(project, "project must not be null");
        Run run = new Run(project);
        try {
            PricingSummary summary = validateAndPrice(run, project);
            return GenerationResult.succeeded(project, summary, List.of(), anomalyWarnings(summary));
        } catch (RuntimeException e) {
            return failed(run, e);
        }
    }

    /**
     * Generates the cost sheet workbook for a project.
     *
     * @param project project to write
     * @return result carrying the workbook artifact
     */
    public GenerationResult generateCostSheet(Project project) {
        Objects.requireNonNull(project, "project must not be null");
        Run run = new Run(project);
        try {
            PricingSummary summary = validateAndPrice(run, project);
            GeneratedFile workbook = writeCostSheet(run, project, summary);
            return GenerationResult.succeeded(project, summary, List.of(workbook), anomalyWarnings(summary));
        } catch (RuntimeException e) {
            return failed(run, e);
        }
    }

    /**
     * Reads a cost sheet workbook back into a project and its pricing.
     *
     * @param workbook workbook bytes
     * @return result carrying the recovered project and summary, no artifacts
     */
    public GenerationResult readCostSheet(byte[] workbook) {
        Objects.requireNonNull(workbook, "workbook must not be null");
        Run run = new Run(null);
        try {
            ReadResult read = read(run, workbook);
            return GenerationResult.succeeded(read.project(), read.summary(), List.of(), readWarnings(read));
        } catch (RuntimeException e) {
            return failed(run, e);
        }
    }

    /**
     * Generates the quotation document(s) for a project.
     *
     * @param project project to quote
     * @return result carrying one quotation, or a ZIP bundle when several quotation kinds apply
     */
    public GenerationResult generateQuotation(Project project) {
        Objects.requireNonNull(project, "project must not be null");
        Run run = new Run(project);
        try {
            PricingSummary summary = validateAndPrice(run, project);
            GeneratedFile quotation = writeQuotation(run, project, summary);
            return GenerationResult.succeeded(project, summary, List.of(quotation), anomalyWarnings(summary));
        } catch (RuntimeException e) {
            return failed(run, e);
        }
    }

    /**
     * Generates the quotation document(s) from an existing cost sheet workbook.
     *
     * @param workbook workbook bytes
     * @return result carrying one quotation, or a ZIP bundle when several quotation kinds apply
     */
    public GenerationResult generateQuotation(byte[] workbook) {
        Objects.requireNonNull(workbook, "workbook must not be null");
        Run run = new Run(null);
        try {
            ReadResult read = read(run, workbook);
            GeneratedFile quotation = writeQuotation(run, read.project(), read.summary());
            return GenerationResult.succeeded(read.project(), read.summary(), List.of(quotation), readWarnings(read));
        } catch (RuntimeException e) {
            return failed(run, e);
        }
    }

    /**
     * Reads a cost sheet, advances its revision letter and writes it again.
     *
     * @param workbook workbook bytes
     * @return result carrying the revised workbook
     */
    public GenerationResult revise(byte[] workbook) {
        Objects.requireNonNull(workbook, "workbook must not be null");
        Run run = new Run(null);
        try {
            ReadResult read = read(run, workbook);
            Project revised = read.project().withNextRevision();
            run.project = revised;
            log.info("Revising cost sheet {} to revision {}", revised.info().number(), revised.info().revision());

            PricingSummary summary = validateAndPrice(run, revised);
            GeneratedFile file = writeCostSheet(run, revised, summary);
            List<String> warnings = new ArrayList<>(readWarnings(read));
            warnings.addAll(anomalyWarnings(summary));
            return GenerationResult.succeeded(revised, summary, List.of(file), warnings);
        } catch (RuntimeException e) {
            return failed(run, e);
        }
    }

    public CostSheetConfig config() {
        return config;
    }

    private PricingSummary validateAndPrice(Run run, Project project) {
        run.stage = GenerationFailure.Stage.VALIDATION;
        validator.requireValid(project);
        run.stage = GenerationFailure.Stage.PRICING;
        return aggregation.aggregate(project);
    }

    private ReadResult read(Run run, byte[] workbook) {
        run.stage = GenerationFailure.Stage.READ;
        ReadResult read = reader.read(workbook);
        run.project = read.project();
        return read;
    }

    private GeneratedFile writeCostSheet(Run run, Project project, PricingSummary summary) {
        run.stage = GenerationFailure.Stage.WORKBOOK;
        byte[] bytes = synthesizer.synthesize(project, summary);
        String name = OutputFileNames.of(project.info(), OutputFileNames.COST_SHEET, OutputFileNames.XLSX);
        return new GeneratedFile(name, bytes, GeneratedFile.XLSX);
    }

    private GeneratedFile writeQuotation(Run run, Project project, PricingSummary summary) {
        run.stage = GenerationFailure.Stage.DOCUMENT;
        DocumentContext context = contextBuilder.build(project, summary);

        List<QuotationKind> kinds = QuotationKind.applicableTo(context);
        if (kinds.isEmpty()) {
            throw new CostSheetException("No quotation applies to project " + project.info().number());
        }

        run.stage = GenerationFailure.Stage.RENDER;
        List<GeneratedFile> documents = new ArrayList<>();
        for (QuotationKind kind : kinds) {
            byte[] bytes = renderer.render(config.documents().templateId(kind), context);
            String name = OutputFileNames.of(project.info(), kind.artifactKind(), OutputFileNames.DOCX);
            documents.add(new GeneratedFile(name, bytes, GeneratedFile.DOCX));
            log.info("Rendered {} for project {}", kind.artifactKind(), project.info().number());
        }

        if (documents.size() == 1) {
            return documents.get(0);
        }
        String name = OutputFileNames.of(project.info(), OutputFileNames.QUOTATIONS, OutputFileNames.ZIP);
        return new GeneratedFile(name, bundler.bundle(documents), GeneratedFile.ZIP);
    }

    private static List<String> anomalyWarnings(PricingSummary summary) {
        return summary.anomalies().stream().map(PricingAnomaly::message).toList();
    }

    private static List<String> readWarnings(ReadResult read) {
        List<String> warnings = new ArrayList<>();
        for (ReadReport.SkippedSheet skipped : read.report().skipped()) {
            warnings.add("Skipped sheet '" + skipped.sheetName() + "': " + skipped.reason());
        }
        warnings.addAll(read.report().warnings());
        warnings.addAll(anomalyWarnings(read.summary()));
        return warnings;
    }

    private GenerationResult failed(Run run, RuntimeException e) {
        String subject = run.project == null ? "workbook" : run.project.info().number();
        GenerationFailure failure;
        List<ValidationIssue> issues = List.of();

        if (e instanceof ProjectValidationException invalid) {
            issues = invalid.getIssues();
            failure = new GenerationFailure(GenerationFailure.Stage.VALIDATION, subject, "invalid-project", e.getMessage());
        } else if (e instanceof SheetPoolExhaustedException exhausted) {
            failure = new GenerationFailure(run.stage, exhausted.getKind().label(), "sheet-pool-exhausted", e.getMessage());
        } else if (e instanceof WorkbookIntegrityException) {
            failure = new GenerationFailure(run.stage, subject, "workbook-integrity", e.getMessage());
        } else if (e instanceof WorkbookFormatException) {
            failure = new GenerationFailure(run.stage, subject, "not-a-workbook", e.getMessage());
        } else if (e instanceof TemplateException template) {
            String rule = template.getReason() == TemplateException.Reason.NOT_FOUND
                ? "template-not-found"
                : "template-render-error";
            failure = new GenerationFailure(run.stage, template.getTemplateId(), rule, e.getMessage());
        } else if (e instanceof CostSheetException) {
            failure = new GenerationFailure(run.stage, subject, "cost-sheet-error", e.getMessage());
        } else {
            log.error("Unexpected failure during {} for {}", run.stage, subject, e);
            failure = new GenerationFailure(run.stage, subject, "unexpected-error", String.valueOf(e.getMessage()));
            return GenerationResult.failed(run.project, failure, issues);
        }

        log.error("{}", failure);
        return GenerationResult.failed(run.project, failure, issues);
    }

    /**
     * Progress of one service call.
     */
    private static final class Run {
        private Project project;
        private GenerationFailure.Stage stage = GenerationFailure.Stage.VALIDATION;

        private Run(Project project) {
            this.project = project;
        }
    }
}
