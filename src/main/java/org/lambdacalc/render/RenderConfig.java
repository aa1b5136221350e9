package org.lambdacalc.render;

import java.util.Objects;

/**
 * Renderer configuration options.
 *
 * @param separator                   placed between the parts of applications and abstractions
 * @param indent                      repeated once per tree level in {@link TreeRenderer#trace}
 * @param parenthesizeAbstractionBody wrap abstraction bodies in parentheses when rendering
 */
public record RenderConfig(
    String separator,
    String indent,
    boolean parenthesizeAbstractionBody
) {
    public static final RenderConfig DEFAULT = new RenderConfig("_", "----", true);

    public RenderConfig {
        Objects.requireNonNull(separator, "separator");
        Objects.requireNonNull(indent, "indent");
    }
}
