package org.quill.compiler.util;

import org.quill.compiler.frontend.parser.ast.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility class for dumping syntax trees while debugging.
 */
public final class AstDump {

	private static final Logger LOG = LoggerFactory.getLogger(AstDump.class);

	/** Default directory of {@link #dump(String, AstNode)}. */
	public static final Path DEFAULT_ROOT = Path.of("build", "ast-dumps");

	private AstDump() {}

	/**
	 * Renders an indented outline of a tree, one node per line:
	 * kind and id, span, and for leaves their text.
	 * @param node The root of the tree.
	 * @return The outline, ending in a line break.
	 */
	public static String render(AstNode node) {
		StringBuilder sb = new StringBuilder();
		render(node, 0, sb);
		return sb.toString();
	}

	private static void render(AstNode node, int depth, StringBuilder sb) {
		sb.append("  ".repeat(depth));
		if (node == null) {
			sb.append("<null>\n");
			return;
		}
		sb.append(node.describe()).append(' ').append(node.span());
		if (node.children().isEmpty()) {
			sb.append(" `").append(node.unparse()).append('`');
		}
		sb.append('\n');
		for (AstNode child : node.children()) {
			render(child, depth + 1, sb);
		}
	}

	/**
	 * Writes the outline of a tree to {@code build/ast-dumps/<name>.txt}.
	 * @param name The name of the dump, used for the file name.
	 * @param node The root of the tree.
	 * @return The written file, or {@code null} if it could not be written.
	 */
	public static Path dump(String name, AstNode node) {
		return dump(DEFAULT_ROOT, name, node);
	}

	/**
	 * Writes the outline of a tree to {@code <root>/<name>.txt}.
	 * Failures are logged, never thrown.
	 * @param root The directory to write to.
	 * @param name The name of the dump, used for the file name.
	 * @param node The root of the tree.
	 * @return The written file, or {@code null} if it could not be written.
	 */
	public static Path dump(Path root, String name, AstNode node) {
		Path file = root.resolve(sanitize(name) + ".txt");
		try {
			Files.createDirectories(root);
			Files.writeString(file, render(node));
			LOG.debug("Wrote syntax tree dump {}", file);
			return file;
		} catch (IOException e) {
			LOG.warn("Could not write syntax tree dump {}: {}", file, e.getMessage());
			return null;
		}
	}

	static String sanitize(String s) { return s.replaceAll("[^A-Za-z0-9_.-]", "_"); }
}
