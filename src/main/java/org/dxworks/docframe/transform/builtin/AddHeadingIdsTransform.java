package org.dxworks.docframe.transform.builtin;

import org.dxworks.docframe.ast.Heading;
import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.ast.NodeText;
import org.dxworks.docframe.ast.NodeTransformer;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stores a slug of each heading's text under the {@code id} metadata key. Repeated slugs get a
 * counter suffix ({@code intro}, {@code intro-2}). An instance numbers headings across one run,
 * so create a new one per document.
 */
public class AddHeadingIdsTransform extends NodeTransformer {

    public static final String ID_KEY = "id";

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WORD_BREAKS = Pattern.compile("[\\s_]+", Pattern.UNICODE_CHARACTER_CLASS);

    private final String idPrefix;
    private final String separator;
    private final Map<String, Integer> idCounts = new HashMap<>();

    public AddHeadingIdsTransform(String idPrefix, String separator) {
        this.idPrefix = idPrefix == null ? "" : idPrefix;
        this.separator = separator == null ? "-" : separator;
    }

    @Override
    public Node visit(Heading heading) {
        String slug = slugify(NodeText.of(heading));
        int count = idCounts.merge(slug, 1, Integer::sum);
        if (count > 1) {
            slug = slug + separator + count;
        }
        Heading copy = (Heading) super.visit(heading);
        copy.metadata.put(ID_KEY, idPrefix + slug);
        return copy;
    }

    String slugify(String text) {
        String slug = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
        slug = WORD_BREAKS.matcher(slug).replaceAll(Matcher.quoteReplacement(separator));
        if (!separator.isEmpty()) {
            while (slug.startsWith(separator)) {
                slug = slug.substring(separator.length());
            }
            while (slug.endsWith(separator)) {
                slug = slug.substring(0, slug.length() - separator.length());
            }
        }
        return slug.isEmpty() ? "heading" : slug;
    }
}
