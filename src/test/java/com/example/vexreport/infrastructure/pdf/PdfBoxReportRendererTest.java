package com.example.vexreport.infrastructure.pdf;

import com.example.vexreport.domain.model.BomComponent;
import com.example.vexreport.domain.model.BomDocument;
import com.example.vexreport.domain.model.BomMetadata;
import com.example.vexreport.domain.model.BomVulnerability;
import com.example.vexreport.domain.model.ConversionSettings;
import com.example.vexreport.domain.model.VulnerabilityRating;
import com.example.vexreport.infrastructure.exception.ReportRenderingException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Smoke tests that render reports and read them back with PDFBox.
 */
class PdfBoxReportRendererTest {

    private final PdfBoxReportRenderer renderer = new PdfBoxReportRenderer();

    @TempDir
    Path tempDir;

    /**
     * A VEX document lists its vulnerabilities with ratings and resolved components.
     */
    @Test
    void rendersVulnerabilities() throws IOException {
        Path destination = tempDir.resolve("vex.pdf");
        ConversionSettings settings = ConversionSettings.defaults(tempDir);

        renderer.render(vexDocument("Remote code execution via JNDI lookups."), settings, destination);

        try (PDDocument pdf = Loader.loadPDF(destination.toFile())) {
            String text = new PDFTextStripper().getText(pdf);
            assertThat(pdf.getDocumentInformation().getTitle()).isEqualTo(ConversionSettings.DEFAULT_PDF_META_NAME);
            assertThat(text)
                    .contains(ConversionSettings.DEFAULT_REPORT_TITLE)
                    .contains("Document Information")
                    .contains("acme-scanner")
                    .contains("CycloneDX")
                    .contains("Vulnerabilities")
                    .contains("CVE-2021-44228")
                    .contains("Remote code execution")
                    .contains("CRITICAL")
                    .contains("Affected Document Components")
                    .contains("log4j-core")
                    .doesNotContain(PdfBoxReportRenderer.NO_VULNERABILITIES_MESSAGE);
        }
    }

    @Test
    void rendersBannerWhenNothingIsReported() throws IOException {
        Path destination = tempDir.resolve("clean.pdf");

        renderer.render(cleanDocument(), ConversionSettings.defaults(tempDir), destination);

        assertThat(textOf(destination)).contains(PdfBoxReportRenderer.NO_VULNERABILITIES_MESSAGE);
    }

    @Test
    void omitsBannerWhenDisabled() throws IOException {
        Path destination = tempDir.resolve("clean.pdf");
        ConversionSettings settings = new ConversionSettings(tempDir, null, null, 1, false, false, false, null, null);

        renderer.render(cleanDocument(), settings, destination);

        assertThat(textOf(destination))
                .doesNotContain(PdfBoxReportRenderer.NO_VULNERABILITIES_MESSAGE)
                .doesNotContain("Components");
    }

    /**
     * Plain bills of materials skip the vulnerability section and always list components.
     */
    @Test
    void pureBomSkipsVulnerabilities() throws IOException {
        Path destination = tempDir.resolve("bom.pdf");
        ConversionSettings settings = new ConversionSettings(tempDir, null, null, 1, true, true, false, null, null);

        renderer.render(vexDocument("ignored"), settings, destination);

        try (PDDocument pdf = Loader.loadPDF(destination.toFile())) {
            String text = new PDFTextStripper().getText(pdf);
            assertThat(pdf.getDocumentInformation().getTitle()).isEqualTo(ConversionSettings.DEFAULT_PDF_META_NAME_BOM);
            assertThat(text)
                    .contains(ConversionSettings.DEFAULT_REPORT_TITLE_BOM)
                    .contains("Components")
                    .contains("guava")
                    .doesNotContain("CVE-2021-44228");
        }
    }

    /**
     * Long text flows over several pages, each following page carrying the running header.
     */
    @Test
    void wrapsLongDescriptionsOverSeveralPages() throws IOException {
        Path destination = tempDir.resolve("long.pdf");
        String description = "Overflowing description line with several words. ".repeat(600)
                + " Averyveryveryveryveryveryveryveryveryveryveryveryveryveryveryveryveryveryveryveryverylongtoken";

        renderer.render(vexDocument(description), ConversionSettings.defaults(tempDir), destination);

        try (PDDocument pdf = Loader.loadPDF(destination.toFile())) {
            assertThat(pdf.getNumberOfPages()).isGreaterThan(1);
            assertThat(new PDFTextStripper().getText(pdf)).contains("Page 2");
        }
    }

    @Test
    void replacesCharactersOutsideTheFont() throws IOException {
        Path destination = tempDir.resolve("glyphs.pdf");

        renderer.render(vexDocument("Affects 漢字 parsing\u0007 code"), ConversionSettings.defaults(tempDir), destination);

        assertThat(textOf(destination)).contains("Affects ??").doesNotContain("漢");
    }

    @Test
    void failsWhenDestinationIsNotWritable() {
        Path destination = tempDir.resolve("missing-dir").resolve("vex.pdf");

        assertThrows(ReportRenderingException.class,
                () -> renderer.render(cleanDocument(), ConversionSettings.defaults(tempDir), destination));
    }

    private String textOf(Path destination) throws IOException {
        try (PDDocument pdf = Loader.loadPDF(destination.toFile())) {
            return new PDFTextStripper().getText(pdf);
        }
    }

    private BomDocument vexDocument(String description) {
        BomComponent log4j = new BomComponent("pkg:maven/log4j-core@2.14.1", "log4j-core", "2.14.1");
        BomComponent guava = new BomComponent("pkg:maven/guava@31.1-jre", "guava", "31.1-jre");
        BomVulnerability vulnerability = new BomVulnerability(
                "CVE-2021-44228",
                "NVD",
                description,
                null,
                List.of(new VulnerabilityRating("CRITICAL", "10.0", "CVSSV31", "NVD")),
                List.of("pkg:maven/log4j-core@2.14.1"));
        BomMetadata metadata = new BomMetadata(Instant.parse("2024-01-15T10:00:00Z"),
                List.of(new BomComponent(null, "acme-scanner", "2.3.1")),
                new BomComponent("acme-app", "acme-app", "1.0.0"));
        return new BomDocument("1.4", 1, "urn:uuid:1234", metadata, List.of(log4j, guava), List.of(vulnerability));
    }

    private BomDocument cleanDocument() {
        return new BomDocument("1.5", 2, null, null,
                List.of(new BomComponent("pkg:npm/lodash@4.17.21", "lodash", "4.17.21")), List.of());
    }
}
