package com.example.vexreport.infrastructure.cyclonedx;

import com.example.vexreport.domain.model.BomComponent;
import com.example.vexreport.domain.model.BomDocument;
import com.example.vexreport.domain.model.BomMetadata;
import com.example.vexreport.domain.model.BomVulnerability;
import com.example.vexreport.domain.model.VulnerabilityRating;

import org.cyclonedx.model.Bom;
import org.cyclonedx.model.Component;
import org.cyclonedx.model.Metadata;
import org.cyclonedx.model.Service;
import org.cyclonedx.model.Tool;
import org.cyclonedx.model.metadata.ToolInformation;
import org.cyclonedx.model.vulnerability.Vulnerability;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Infrastructure helper that turns the CycloneDX library model into the DTOs consumed by the domain.
 * Hides the library classes from the rest of the application.
 */
@org.springframework.stereotype.Service
public class CycloneDxBomMapper {

    /**
     * Maps a parsed CycloneDX BOM.
     *
     * @param bom library model, never {@code null}
     * @return domain document
     */
    public BomDocument toDocument(Bom bom) {
        Objects.requireNonNull(bom, "bom");
        return new BomDocument(
                bom.getSpecVersion(),
                bom.getVersion(),
                bom.getSerialNumber(),
                toMetadata(bom.getMetadata()),
                mapAll(bom.getComponents(), this::toComponent),
                mapAll(bom.getVulnerabilities(), this::toVulnerability)
        );
    }

    /**
     * Maps the metadata block, merging the legacy tool list with tool components and services.
     *
     * @param metadata library metadata or {@code null}
     * @return domain metadata or {@code null}
     */
    @SuppressWarnings("deprecation")
    private BomMetadata toMetadata(Metadata metadata) {
        if (metadata == null) {
            return null;
        }
        List<BomComponent> tools = new ArrayList<>();
        if (metadata.getTools() != null) {
            for (Tool tool : metadata.getTools()) {
                if (tool != null && tool.getName() != null) {
                    tools.add(new BomComponent(null, tool.getName(), tool.getVersion()));
                }
            }
        }
        ToolInformation toolChoice = metadata.getToolChoice();
        if (toolChoice != null) {
            tools.addAll(mapAll(toolChoice.getComponents(), this::toComponent));
            if (toolChoice.getServices() != null) {
                for (Service service : toolChoice.getServices()) {
                    if (service != null && service.getName() != null) {
                        tools.add(new BomComponent(null, service.getName(), service.getVersion()));
                    }
                }
            }
        }
        Instant timestamp = metadata.getTimestamp() != null ? metadata.getTimestamp().toInstant() : null;
        BomComponent subject = metadata.getComponent() != null ? toComponent(metadata.getComponent()) : null;
        return new BomMetadata(timestamp, tools, subject);
    }

    private BomComponent toComponent(Component component) {
        return new BomComponent(component.getBomRef(), component.getName(), component.getVersion());
    }

    private BomVulnerability toVulnerability(Vulnerability vulnerability) {
        List<VulnerabilityRating> ratings = mapAll(vulnerability.getRatings(), this::toRating);
        List<String> affectedRefs = new ArrayList<>();
        if (vulnerability.getAffects() != null) {
            for (Vulnerability.Affect affect : vulnerability.getAffects()) {
                if (affect != null && affect.getRef() != null) {
                    affectedRefs.add(affect.getRef());
                }
            }
        }
        return new BomVulnerability(
                vulnerability.getId(),
                sourceName(vulnerability.getSource()),
                vulnerability.getDescription(),
                vulnerability.getDetail(),
                ratings,
                affectedRefs
        );
    }

    private VulnerabilityRating toRating(Vulnerability.Rating rating) {
        return new VulnerabilityRating(
                rating.getSeverity() != null ? rating.getSeverity().name() : null,
                rating.getScore() != null ? rating.getScore().toString() : null,
                rating.getMethod() != null ? rating.getMethod().name() : null,
                sourceName(rating.getSource())
        );
    }

    private String sourceName(Vulnerability.Source source) {
        return source != null ? source.getName() : null;
    }

    /**
     * Applies {@code mapper} to every non-null element.
     *
     * @param values source list, may be {@code null}
     * @param mapper element mapper
     * @return mapped list, empty when the source is missing
     */
    private static <S, T> List<T> mapAll(List<S> values, Function<S, T> mapper) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(mapper)
                .toList();
    }
}
