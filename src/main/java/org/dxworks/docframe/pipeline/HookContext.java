package org.dxworks.docframe.pipeline;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State shared by the hooks of one conversion: the current document, the formats involved,
 * a scratch map hooks can use to pass values to each other and, for element hooks, the path
 * from the root to the node being visited.
 */
public final class HookContext {

    private final String sourceFormat;
    private final String targetFormat;
    private final Map<String, Object> shared = new LinkedHashMap<>();
    private final List<Node> nodePath = new ArrayList<>();
    private Document document;
    private String transformName;

    HookContext(Document document, String sourceFormat, String targetFormat) {
        this.document = document;
        this.sourceFormat = sourceFormat;
        this.targetFormat = targetFormat;
    }

    public Document getDocument() {
        return document;
    }

    /** Document-level metadata of the current document. */
    public Map<String, Object> getMetadata() {
        return document.metadata;
    }

    /** Empty when only transforming an already parsed document. */
    public Optional<String> getSourceFormat() {
        return Optional.ofNullable(sourceFormat);
    }

    public Optional<String> getTargetFormat() {
        return Optional.ofNullable(targetFormat);
    }

    /** Set while the {@link HookPoint#PRE_TRANSFORM} and {@link HookPoint#POST_TRANSFORM} hooks run. */
    public Optional<String> getTransformName() {
        return Optional.ofNullable(transformName);
    }

    public Map<String, Object> getShared() {
        return shared;
    }

    public Object getShared(String key, Object defaultValue) {
        return shared.getOrDefault(key, defaultValue);
    }

    public void setShared(String key, Object value) {
        shared.put(key, value);
    }

    /**
     * Ancestors of the visited node, root first, ending with the node itself. Empty outside element hooks.
     */
    public List<Node> getNodePath() {
        return Collections.unmodifiableList(nodePath);
    }

    void setDocument(Document document) {
        this.document = document;
    }

    void setTransformName(String transformName) {
        this.transformName = transformName;
    }

    void enter(Node node) {
        nodePath.add(node);
    }

    void replaceCurrent(Node node) {
        nodePath.set(nodePath.size() - 1, node);
    }

    void leave() {
        nodePath.remove(nodePath.size() - 1);
    }
}
