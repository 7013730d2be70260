package com.docvalidator.core.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Lookup of {@link ReportRenderer}s registered via SPI.
 */
public final class ReportRenderers {

    private static final Logger log = LoggerFactory.getLogger(ReportRenderers.class);

    private ReportRenderers() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Lists the registered renderers sorted by id.
     *
     * @return available renderers
     */
    public static List<ReportRenderer> available() {
        List<ReportRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(ReportRenderer.class).forEach(renderers::add);
        renderers.sort(Comparator.comparing(ReportRenderer::getId));
        return renderers;
    }

    /**
     * Finds the renderer for a format name (case-insensitive).
     *
     * @param format format name such as {@code text} or {@code json}
     * @return matching renderer
     * @throws IllegalArgumentException if no renderer handles the format
     */
    public static ReportRenderer forFormat(String format) {
        String id = format == null ? "text" : format.toLowerCase(Locale.ROOT);
        List<ReportRenderer> renderers = available();
        for (ReportRenderer renderer : renderers) {
            if (renderer.getId().equals(id)) {
                log.debug("Using {} renderer", id);
                return renderer;
            }
        }
        throw new IllegalArgumentException("Unknown output format '" + format + "' (available: "
            + renderers.stream().map(ReportRenderer::getId).collect(Collectors.joining(", ")) + ")");
    }
}
