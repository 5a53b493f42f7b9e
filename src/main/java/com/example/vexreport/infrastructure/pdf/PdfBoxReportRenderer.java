package com.example.vexreport.infrastructure.pdf;

import com.example.vexreport.application.port.ReportRenderer;
import com.example.vexreport.domain.model.BomComponent;
import com.example.vexreport.domain.model.BomDocument;
import com.example.vexreport.domain.model.BomMetadata;
import com.example.vexreport.domain.model.BomVulnerability;
import com.example.vexreport.domain.model.ConversionSettings;
import com.example.vexreport.domain.model.VulnerabilityRating;
import com.example.vexreport.infrastructure.exception.ReportRenderingException;
import com.example.vexreport.infrastructure.pdf.PdfPageWriter.Segment;
import com.example.vexreport.infrastructure.pdf.PdfPageWriter.TextStyle;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Infrastructure service that lays out a {@link BomDocument} as a PDF report with PDFBox.
 * Sections: title, document information, BOM summary, vulnerabilities (or a "no vulnerabilities" banner)
 * and the component list, depending on the run settings.
 */
@Service
public class PdfBoxReportRenderer implements ReportRenderer {

    static final String NO_VULNERABILITIES_MESSAGE = "No Vulnerabilities reported";
    private static final DateTimeFormatter TIMESTAMP_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);
    private static final Color TEXT_COLOR = Color.BLACK;
    private static final Color VERSION_COLOR = new Color(90, 90, 90);
    private static final Color COMPONENT_COLOR = new Color(0, 0, 140);
    private static final Color CVE_COLOR = new Color(160, 0, 0);
    private static final Color NO_VULNS_COLOR = new Color(0, 100, 0);
    private static final float INDENT = 18f;

    /**
     * Renders the report and saves it to {@code destination}.
     *
     * @param document    parsed document
     * @param settings    run settings controlling titles and optional sections
     * @param destination target PDF file
     * @throws ReportRenderingException when the PDF cannot be laid out or saved
     */
    @Override
    public void render(BomDocument document, ConversionSettings settings, Path destination) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(destination, "destination");
        try (PDDocument pdf = new PDDocument()) {
            Styles styles = Styles.create();
            String title = settings.effectiveReportTitle();

            PDDocumentInformation info = pdf.getDocumentInformation();
            info.setTitle(settings.effectivePdfMetaName());
            info.setCreator("vexreport");
            info.setCreationDate(Calendar.getInstance());

            try (PdfPageWriter writer = new PdfPageWriter(pdf, title, styles.regular().font())) {
                writer.paragraph(0f, title, styles.title());
                writer.gap(12f);
                renderMetadata(writer, document.metadata(), styles);
                renderSummary(writer, document, styles);
                if (!settings.pureBomNoVulns()) {
                    renderVulnerabilities(writer, document, settings, styles);
                }
                if (settings.pureBomNoVulns() || settings.showComponents()) {
                    renderComponents(writer, document.components(), styles);
                }
            }
            pdf.save(destination.toFile());
        } catch (IOException | RuntimeException ex) {
            throw new ReportRenderingException("Unable to write the PDF report " + destination + ": " + ex.getMessage(), ex);
        }
    }

    private void renderMetadata(PdfPageWriter writer, BomMetadata metadata, Styles styles) throws IOException {
        if (metadata == null) {
            return;
        }
        writer.paragraph(0f, "Document Information", styles.header());
        writer.gap(6f);
        if (metadata.timestamp() != null) {
            writer.paragraph(0f, "Date: " + TIMESTAMP_FORMATTER.format(metadata.timestamp()), styles.italic());
        }
        writer.gap(6f);
        if (!metadata.tools().isEmpty()) {
            writer.paragraph(0f, "Tools:", styles.bold());
            for (BomComponent tool : metadata.tools()) {
                List<Segment> segments = new ArrayList<>();
                segments.add(new Segment("- " + tool.name(), styles.regular()));
                if (tool.version() != null) {
                    segments.add(new Segment(" (" + tool.version() + ")", styles.version()));
                }
                writer.paragraph(INDENT, segments.toArray(Segment[]::new));
            }
            writer.gap(6f);
        }
        if (metadata.component() != null) {
            BomComponent subject = metadata.component();
            List<Segment> segments = new ArrayList<>();
            segments.add(new Segment("Component name : ", styles.bold()));
            segments.add(new Segment(subject.name(), styles.regular()));
            if (subject.version() != null) {
                segments.add(new Segment(" (" + subject.version() + ")", styles.version()));
            }
            writer.paragraph(0f, segments.toArray(Segment[]::new));
        }
        writer.gap(12f);
    }

    private void renderSummary(PdfPageWriter writer, BomDocument document, Styles styles) throws IOException {
        writer.paragraph(0f, new Segment("BOM Format: ", styles.bold()), new Segment("CycloneDX", styles.regular()));
        writer.paragraph(0f, new Segment("Specification Version: ", styles.bold()),
                new Segment(Objects.toString(document.specVersion(), "unknown"), styles.regular()));
        writer.paragraph(0f, new Segment("Version: ", styles.bold()),
                new Segment(String.valueOf(document.version()), styles.regular()));
        if (document.serialNumber() != null) {
            writer.paragraph(0f, new Segment("Serial Number: ", styles.bold()),
                    new Segment(document.serialNumber(), styles.regular()));
        }
        writer.gap(20f);
    }

    private void renderVulnerabilities(PdfPageWriter writer,
                                       BomDocument document,
                                       ConversionSettings settings,
                                       Styles styles) throws IOException {
        boolean vulnerabilitiesAvailable = document.hasVulnerabilities();
        if (!vulnerabilitiesAvailable && !settings.showNoVulnsMsg()) {
            return;
        }
        writer.paragraph(0f, "Vulnerabilities", styles.header());
        writer.gap(8f);

        Map<String, BomComponent> componentsByRef = indexByRef(document.components());
        int number = 1;
        for (BomVulnerability vulnerability : document.vulnerabilities()) {
            renderVulnerability(writer, number++, vulnerability, componentsByRef, styles);
        }

        if (!vulnerabilitiesAvailable) {
            writer.framedBanner(NO_VULNERABILITIES_MESSAGE, styles.noVulnerabilities());
            writer.gap(12f);
        }
    }

    private void renderVulnerability(PdfPageWriter writer,
                                     int number,
                                     BomVulnerability vulnerability,
                                     Map<String, BomComponent> componentsByRef,
                                     Styles styles) throws IOException {
        List<Segment> heading = new ArrayList<>();
        heading.add(new Segment(number + ". ", styles.bold()));
        heading.add(new Segment(Objects.toString(vulnerability.id(), "Unnamed vulnerability"), styles.cveId()));
        if (vulnerability.sourceName() != null) {
            heading.add(new Segment(" (" + vulnerability.sourceName() + ")", styles.version()));
        }
        writer.paragraph(0f, heading.toArray(Segment[]::new));

        String description = vulnerability.description() != null ? vulnerability.description() : vulnerability.detail();
        writer.paragraph(INDENT, "Description: ", styles.bold());
        for (String line : Objects.toString(description, "No description available").split("\\R")) {
            writer.paragraph(INDENT, line.strip(), styles.regular());
        }
        writer.gap(4f);

        for (VulnerabilityRating rating : vulnerability.ratings()) {
            if (rating.severity() == null) {
                continue;
            }
            StringBuilder detail = new StringBuilder(rating.severity())
                    .append(" (")
                    .append(rating.method() != null ? rating.method() : "N/A");
            if (rating.score() != null) {
                detail.append(", score ").append(rating.score());
            }
            if (rating.sourceName() != null) {
                detail.append(" - Source: ").append(rating.sourceName());
            }
            detail.append(')');
            writer.paragraph(INDENT, new Segment("- Severity: ", styles.bold()), new Segment(detail.toString(), styles.regular()));
        }

        List<BomComponent> affected = new ArrayList<>();
        for (String ref : vulnerability.affectedRefs()) {
            BomComponent component = componentsByRef.get(ref);
            if (component != null) {
                affected.add(component);
            }
        }
        if (!componentsByRef.isEmpty() && !vulnerability.affectedRefs().isEmpty()) {
            List<Segment> segments = new ArrayList<>();
            segments.add(new Segment("Affected Document Components : [ ", styles.bold()));
            for (int i = 0; i < affected.size(); i++) {
                if (i > 0) {
                    segments.add(new Segment(", ", styles.regular()));
                }
                segments.add(new Segment(affected.get(i).name(), styles.componentName()));
                segments.add(new Segment(": " + Objects.toString(affected.get(i).version(), "undefined"), styles.version()));
            }
            segments.add(new Segment(" ]", styles.bold()));
            writer.gap(4f);
            writer.paragraph(INDENT, segments.toArray(Segment[]::new));
        }
        writer.gap(12f);
    }

    private void renderComponents(PdfPageWriter writer, List<BomComponent> components, Styles styles) throws IOException {
        if (components.isEmpty()) {
            return;
        }
        writer.paragraph(0f, "Components", styles.header());
        writer.gap(6f);
        for (BomComponent component : components) {
            writer.paragraph(INDENT, new Segment("Name: ", styles.regular()), new Segment(component.name(), styles.componentName()));
            if (component.version() != null) {
                writer.paragraph(INDENT, new Segment("Version: ", styles.regular()), new Segment(component.version(), styles.version()));
            }
            writer.gap(6f);
        }
    }

    private Map<String, BomComponent> indexByRef(List<BomComponent> components) {
        Map<String, BomComponent> byRef = new HashMap<>(components.size() * 2);
        for (BomComponent component : components) {
            if (component.bomRef() != null) {
                byRef.put(component.bomRef(), component);
            }
        }
        return byRef;
    }

    /**
     * Font set for one document. Standard 14 fonts need no embedding.
     */
    private record Styles(
            TextStyle title,
            TextStyle header,
            TextStyle regular,
            TextStyle bold,
            TextStyle italic,
            TextStyle version,
            TextStyle componentName,
            TextStyle cveId,
            TextStyle noVulnerabilities
    ) {
        static Styles create() {
            PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
            PDType1Font italic = new PDType1Font(Standard14Fonts.FontName.HELVETICA_OBLIQUE);
            return new Styles(
                    new TextStyle(bold, 20f, TEXT_COLOR),
                    new TextStyle(bold, 15f, TEXT_COLOR),
                    new TextStyle(regular, 10f, TEXT_COLOR),
                    new TextStyle(bold, 10f, TEXT_COLOR),
                    new TextStyle(italic, 10f, TEXT_COLOR),
                    new TextStyle(italic, 10f, VERSION_COLOR),
                    new TextStyle(bold, 10f, COMPONENT_COLOR),
                    new TextStyle(bold, 11f, CVE_COLOR),
                    new TextStyle(bold, 16f, NO_VULNS_COLOR)
            );
        }
    }
}
