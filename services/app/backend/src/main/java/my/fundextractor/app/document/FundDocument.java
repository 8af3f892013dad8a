package my.fundextractor.app.document;

import my.fundextractor.app.util.TextCleaning;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A parsed fund page. The tree is never mutated after parsing; the flattened text is computed once.
 */
public final class FundDocument {
	private static final Set<String> NON_CONTENT_TAGS = Set.of("script", "style", "template", "noscript");

	private final Document tree;
	private final String text;
	private final String title;

	FundDocument(Document tree) {
		this.tree = tree;
		this.text = flatten(tree);
		this.title = TextCleaning.collapseWhitespace(tree.title());
	}

	public Document tree() {
		return tree;
	}

	public String text() {
		return text;
	}

	public String title() {
		return title;
	}

	public Element body() {
		return tree.body();
	}

	/**
	 * Body text nodes whose text matches {@code label}, in document order.
	 */
	public List<TextNode> textNodesMatching(Pattern label) {
		List<TextNode> found = new ArrayList<>();
		Element body = body();
		if (body == null) {
			return found;
		}
		NodeTraversor.traverse((node, depth) -> {
			if (node instanceof TextNode textNode
					&& !insideNonContent(textNode)
					&& label.matcher(textNode.getWholeText()).find()) {
				found.add(textNode);
			}
		}, body);
		return found;
	}

	/**
	 * Joins every non-blank text node below {@code root} with single spaces, skipping script-like content.
	 * Adjacent inline elements therefore never glue their words together.
	 */
	public static String flatten(Node root) {
		if (root == null) {
			return "";
		}
		StringBuilder builder = new StringBuilder();
		NodeTraversor.traverse(new NodeVisitor() {
			@Override
			public void head(Node node, int depth) {
				if (!(node instanceof TextNode textNode) || insideNonContent(textNode)) {
					return;
				}
				String value = textNode.getWholeText();
				if (value.isBlank()) {
					return;
				}
				if (builder.length() > 0) {
					builder.append(' ');
				}
				builder.append(value.trim());
			}

			@Override
			public void tail(Node node, int depth) {
			}
		}, root);
		return TextCleaning.collapseWhitespace(builder.toString());
	}

	private static boolean insideNonContent(TextNode node) {
		Node parent = node.parent();
		return parent instanceof Element element && NON_CONTENT_TAGS.contains(element.normalName());
	}
}
