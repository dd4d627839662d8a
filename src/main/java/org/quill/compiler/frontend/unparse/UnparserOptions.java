package org.quill.compiler.frontend.unparse;

import com.typesafe.config.Config;

/**
 * Settings of the {@link Unparser}.
 *
 * @param operatorSpacing Whether binary, conditional and assignment operators are surrounded by spaces.
 * @param maxLength Maximum length of the regenerated text; longer output is cut and ends in {@code ...}.
 *                  0 means unlimited.
 */
public record UnparserOptions(boolean operatorSpacing, int maxLength) {

    /** The settings used by {@code toString()} on nodes. */
    public static final UnparserOptions DEFAULTS = new UnparserOptions(true, 0);

    private static final String OPERATOR_SPACING_KEY = "operator-spacing";
    private static final String MAX_LENGTH_KEY = "max-length";

    public UnparserOptions {
        if (maxLength < 0) {
            throw new IllegalArgumentException("max-length must not be negative: " + maxLength);
        }
    }

    /**
     * Reads the options from an {@code unparse} configuration block. Missing keys keep their defaults.
     *
     * @param config The configuration block.
     * @return The options.
     */
    public static UnparserOptions from(Config config) {
        boolean spacing = config.hasPath(OPERATOR_SPACING_KEY)
                ? config.getBoolean(OPERATOR_SPACING_KEY)
                : DEFAULTS.operatorSpacing();
        int maxLength = config.hasPath(MAX_LENGTH_KEY)
                ? config.getInt(MAX_LENGTH_KEY)
                : DEFAULTS.maxLength();
        return new UnparserOptions(spacing, maxLength);
    }
}
