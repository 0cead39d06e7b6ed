package org.dxworks.docframe.transform.builtin;

import org.dxworks.docframe.transform.ParameterSpec;
import org.dxworks.docframe.transform.TransformMetadata;

import java.util.List;

/**
 * Transforms registered by {@link org.dxworks.docframe.transform.TransformRegistry#initialize()}.
 * Cleanup runs first (priority 50), rewrites next (100), then heading ids (150) and
 * metadata enrichment last (200).
 */
public final class BuiltinTransforms {

    public static final String REMOVE_IMAGES = "remove-images";
    public static final String REMOVE_NODES = "remove-nodes";
    public static final String HEADING_OFFSET = "heading-offset";
    public static final String LINK_REWRITER = "link-rewriter";
    public static final String TEXT_REPLACER = "text-replacer";
    public static final String ADD_HEADING_IDS = "add-heading-ids";
    public static final String REMOVE_BOILERPLATE = "remove-boilerplate";
    public static final String ADD_CONVERSION_TIMESTAMP = "add-conversion-timestamp";
    public static final String WORD_COUNT = "word-count";

    private static final String AUTHOR = "docframe";

    private BuiltinTransforms() {
    }

    public static List<TransformMetadata> all() {
        return List.of(
                TransformMetadata.builder(REMOVE_IMAGES, parameters -> new RemoveImagesTransform())
                        .description("Remove all images")
                        .priority(50)
                        .author(AUTHOR)
                        .tags("images", "cleanup")
                        .build(),
                TransformMetadata.builder(REMOVE_NODES,
                                parameters -> new RemoveNodesTransform(parameters.getStringList("node_types")))
                        .description("Remove every node of the given types")
                        .parameter("node_types", ParameterSpec.stringList(null).required()
                                .help("Node types to remove, e.g. Image or code_block"))
                        .priority(50)
                        .author(AUTHOR)
                        .tags("cleanup")
                        .build(),
                TransformMetadata.builder(REMOVE_BOILERPLATE,
                                parameters -> new RemoveBoilerplateTransform(parameters.getStringList("patterns")))
                        .description("Remove paragraphs matching boilerplate patterns")
                        .parameter("patterns", ParameterSpec.stringList(RemoveBoilerplateTransform.DEFAULT_PATTERNS)
                                .help("Case-insensitive regular expressions matched against paragraph text"))
                        .priority(50)
                        .author(AUTHOR)
                        .tags("cleanup")
                        .build(),
                TransformMetadata.builder(HEADING_OFFSET,
                                parameters -> new HeadingOffsetTransform(parameters.getInt("offset")))
                        .description("Shift heading levels")
                        .parameter("offset", ParameterSpec.integer(1)
                                .help("Levels to add (negative to promote); results are clamped to 1..6"))
                        .author(AUTHOR)
                        .tags("headings")
                        .build(),
                TransformMetadata.builder(LINK_REWRITER,
                                parameters -> new LinkRewriterTransform(parameters.getString("pattern"),
                                        parameters.getString("replacement")))
                        .description("Rewrite link URLs with a regular expression")
                        .parameter("pattern", ParameterSpec.string(null).required().help("Regular expression"))
                        .parameter("replacement", ParameterSpec.string(null).required().help("Replacement, $1 for groups"))
                        .author(AUTHOR)
                        .tags("links")
                        .build(),
                TransformMetadata.builder(TEXT_REPLACER,
                                parameters -> new TextReplacerTransform(parameters.getString("find"),
                                        parameters.getString("replace")))
                        .description("Replace text")
                        .parameter("find", ParameterSpec.string(null).required().help("Literal text to find"))
                        .parameter("replace", ParameterSpec.string(null).required().help("Replacement text"))
                        .author(AUTHOR)
                        .tags("text")
                        .build(),
                TransformMetadata.builder(ADD_HEADING_IDS,
                                parameters -> new AddHeadingIdsTransform(parameters.getString("id_prefix"),
                                        parameters.getString("separator")))
                        .description("Add unique slug ids to headings")
                        .parameter("id_prefix", ParameterSpec.string("").help("Prefix for every id"))
                        .parameter("separator", ParameterSpec.string("-").help("Word separator"))
                        .priority(150)
                        .author(AUTHOR)
                        .tags("headings", "metadata")
                        .build(),
                TransformMetadata.builder(ADD_CONVERSION_TIMESTAMP,
                                parameters -> new AddConversionTimestampTransform(parameters.getString("field_name"),
                                        parameters.getString("format")))
                        .description("Record the conversion time in document metadata")
                        .parameter("field_name", ParameterSpec.string("conversion_timestamp").help("Metadata key"))
                        .parameter("format", ParameterSpec.string(AddConversionTimestampTransform.ISO)
                                .help("iso, unix or a date-time pattern"))
                        .priority(200)
                        .author(AUTHOR)
                        .tags("metadata")
                        .build(),
                TransformMetadata.builder(WORD_COUNT,
                                parameters -> new WordCountTransform(parameters.getString("word_field"),
                                        parameters.getString("char_field")))
                        .description("Count words and characters into document metadata")
                        .parameter("word_field", ParameterSpec.string("word_count").help("Metadata key for words"))
                        .parameter("char_field", ParameterSpec.string("char_count").help("Metadata key for characters"))
                        .priority(200)
                        .author(AUTHOR)
                        .tags("metadata", "statistics")
                        .build()
        );
    }
}
