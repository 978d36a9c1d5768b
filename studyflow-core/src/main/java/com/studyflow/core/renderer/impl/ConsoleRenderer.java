package com.studyflow.core.renderer.impl;

import com.studyflow.core.renderer.OutputBundle;
import com.studyflow.core.renderer.OutputDocument;
import com.studyflow.core.renderer.OutputRenderer;
import com.studyflow.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints exported documents to a terminal, optionally with ANSI colours.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colours ("true"/"false", default "true")</li>
 *   <li>{@code console.separator} - separator repeated between documents (default "---")</li>
 *   <li>{@code console.showHeaders} - print a header per document (default "true")</li>
 * </ul>
 *
 * <p>Disable colours when output is redirected to a file or consumed by another tool.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int LINE_WIDTH = 80;

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(OutputBundle bundle, RenderContext context) {
        boolean colors = context.getBooleanSetting("console.colors", true);
        boolean headers = context.getBooleanSetting("console.showHeaders", true);
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);
        int total = bundle.documents().size();
        log.debug("Printing {} document(s) (colors: {}, headers: {})", total, colors, headers);

        out.println(paint(colors, ANSI_BOLD + ANSI_GREEN, "Exported " + total + " document(s)"));
        for (int i = 0; i < total; i++) {
            OutputDocument document = bundle.documents().get(i);
            out.println();
            out.println(paint(colors, ANSI_YELLOW, separatorLine(separator)));
            if (headers) {
                out.println(paint(colors, ANSI_BOLD + ANSI_CYAN,
                    "Document " + (i + 1) + "/" + total + ": " + document.relativePath()));
                if (document.contentType() != null && !document.contentType().isEmpty()) {
                    out.println(paint(colors, ANSI_YELLOW, "Type: " + document.contentType()));
                }
                out.println();
            }
            out.println(document.content());
        }
        out.println(paint(colors, ANSI_YELLOW, separatorLine(separator)));
        out.flush();
    }

    private static String paint(boolean colors, String code, String text) {
        return colors ? code + text + ANSI_RESET : text;
    }

    private static String separatorLine(String separator) {
        return separator.repeat(Math.max(1, LINE_WIDTH / Math.max(1, separator.length())));
    }
}
