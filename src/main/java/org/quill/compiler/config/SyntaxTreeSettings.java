package org.quill.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.quill.compiler.frontend.parser.ast.AstFactory;
import org.quill.compiler.frontend.parser.ast.NodeIdAllocator;
import org.quill.compiler.frontend.unparse.Unparser;
import org.quill.compiler.frontend.unparse.UnparserOptions;

/**
 * Typed view of the {@code quill.syntax-tree} configuration block.
 * <pre>
 * quill.syntax-tree {
 *   node-ids.first-id = 1
 *   unparse {
 *     operator-spacing = true
 *     max-length = 0
 *   }
 * }
 * </pre>
 *
 * @param firstNodeId The first id handed out by allocators created from these settings.
 * @param unparserOptions The options for unparsers created from these settings.
 */
public record SyntaxTreeSettings(long firstNodeId, UnparserOptions unparserOptions) {

    public static final String ROOT_PATH = "quill.syntax-tree";

    public static final SyntaxTreeSettings DEFAULTS = new SyntaxTreeSettings(1L, UnparserOptions.DEFAULTS);

    public SyntaxTreeSettings {
        if (firstNodeId < 0) {
            throw new IllegalArgumentException("first-id must not be negative: " + firstNodeId);
        }
        if (unparserOptions == null) {
            throw new IllegalArgumentException("Unparser options must not be null");
        }
    }

    /**
     * Reads the settings from a full application configuration.
     *
     * @param config The configuration, usually from {@link ConfigLoader#load()}.
     * @return The settings; {@link #DEFAULTS} if the block is absent.
     * @throws ConfigException.WrongType if a value has the wrong type.
     */
    public static SyntaxTreeSettings from(Config config) {
        if (!config.hasPath(ROOT_PATH)) {
            return DEFAULTS;
        }
        Config tree = config.getConfig(ROOT_PATH);
        long firstId = tree.hasPath("node-ids.first-id")
                ? tree.getLong("node-ids.first-id")
                : DEFAULTS.firstNodeId();
        UnparserOptions options = tree.hasPath("unparse")
                ? UnparserOptions.from(tree.getConfig("unparse"))
                : UnparserOptions.DEFAULTS;
        return new SyntaxTreeSettings(firstId, options);
    }

    public NodeIdAllocator newAllocator() {
        return new NodeIdAllocator(firstNodeId);
    }

    public AstFactory newFactory() {
        return new AstFactory(newAllocator());
    }

    public Unparser newUnparser() {
        return new Unparser(unparserOptions);
    }
}
