package com.studyflow.core.renderer;

/**
 * Writes exported documents to an output destination.
 *
 * <p>Renderers are discovered through {@link java.util.ServiceLoader}. Register
 * implementations in {@code META-INF/services/com.studyflow.core.renderer.OutputRenderer}.
 *
 * @see OutputBundle
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the lowercase identifier used on the command line (e.g. "filesystem").
     *
     * @return renderer id
     */
    String getId();

    /**
     * Writes every document of the bundle.
     *
     * @param bundle documents to render
     * @param context destination and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(OutputBundle bundle, RenderContext context);
}
