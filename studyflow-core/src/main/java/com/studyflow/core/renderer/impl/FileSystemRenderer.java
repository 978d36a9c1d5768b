package com.studyflow.core.renderer.impl;

import com.studyflow.core.renderer.OutputBundle;
import com.studyflow.core.renderer.OutputDocument;
import com.studyflow.core.renderer.OutputRenderer;
import com.studyflow.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes exported documents below the output directory, creating directories as needed.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code filesystem.overwrite} - replace existing files ("true"/"false", default "true")</li>
 * </ul>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(OutputBundle bundle, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        boolean overwrite = context.getBooleanSetting("filesystem.overwrite", true);
        log.info("Writing {} document(s) to {}", bundle.documents().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (OutputDocument document : bundle.documents()) {
            writeDocument(outputDir, document, overwrite);
        }
    }

    private void writeDocument(Path outputDir, OutputDocument document, boolean overwrite) {
        Path target = outputDir.resolve(document.relativePath()).normalize();
        if (!target.startsWith(outputDir)) {
            throw new IllegalStateException("Document path escapes output directory: " + document.relativePath());
        }
        if (!overwrite && Files.exists(target)) {
            log.warn("Skipping existing file {}", target);
            return;
        }

        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, document.content());
            log.debug("Wrote {} ({} chars)", document.relativePath(), document.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + document.relativePath(), e);
        }
    }
}
