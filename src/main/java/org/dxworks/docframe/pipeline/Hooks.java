package org.dxworks.docframe.pipeline;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.exception.DocframeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Hooks attached to a conversion. Hooks of one target run by ascending priority, then in
 * registration order, each receiving the result of the previous one.
 * <p>
 * A hook that throws is logged and skipped, and the value it received is passed on. In strict
 * mode the failure aborts the conversion instead.
 */
public final class Hooks {

    private static final Logger LOG = LoggerFactory.getLogger(Hooks.class);

    static final Hooks NONE = builder().build();

    private final Map<HookPoint, List<DocumentHook>> documentHooks;
    private final Map<Class<? extends Node>, List<ElementHook<?>>> elementHooks;
    private final List<OutputHook> outputHooks;
    private final boolean strict;

    private Hooks(Builder builder) {
        Map<HookPoint, List<DocumentHook>> byPoint = new EnumMap<>(HookPoint.class);
        builder.documentHooks.forEach((point, hooks) -> byPoint.put(point, ordered(hooks)));
        this.documentHooks = byPoint;
        Map<Class<? extends Node>, List<ElementHook<?>>> byType = new LinkedHashMap<>();
        builder.elementHooks.forEach((type, hooks) -> byType.put(type, ordered(hooks)));
        this.elementHooks = byType;
        this.outputHooks = ordered(builder.outputHooks);
        this.strict = builder.strict;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isStrict() {
        return strict;
    }

    public boolean isEmpty() {
        return documentHooks.isEmpty() && elementHooks.isEmpty() && outputHooks.isEmpty();
    }

    public boolean hasElementHooks() {
        return !elementHooks.isEmpty();
    }

    public boolean hasOutputHooks() {
        return !outputHooks.isEmpty();
    }

    Document runDocumentHooks(HookPoint point, Document document, HookContext context) {
        Document current = document;
        for (DocumentHook hook : documentHooks.getOrDefault(point, List.of())) {
            Document result;
            try {
                result = hook.apply(current, context);
            } catch (RuntimeException e) {
                failed(point.name(), e);
                continue;
            }
            if (result == null) {
                throw new DocframeException("A " + point + " hook removed the document");
            }
            current = result;
            context.setDocument(current);
        }
        return current;
    }

    /**
     * Walks {@code document} and runs the element hooks of every node's type.
     */
    Document applyElementHooks(Document document, HookContext context) {
        if (!hasElementHooks()) {
            return document;
        }
        Node result = new ElementHookTransformer(this, context).transform(document);
        if (!(result instanceof Document transformed)) {
            throw new DocframeException("An element hook removed or replaced the document root");
        }
        context.setDocument(transformed);
        return transformed;
    }

    /**
     * Runs the hooks registered for the type of {@code node}. Stops early when a hook removes the node
     * or replaces it with another variant, since the remaining hooks expect the original type.
     */
    Node runElementHooks(Node node, HookContext context) {
        List<ElementHook<?>> hooks = elementHooks.get(node.getClass());
        if (hooks == null) {
            return node;
        }
        Node current = node;
        for (ElementHook<?> registered : hooks) {
            @SuppressWarnings("unchecked")
            ElementHook<Node> hook = (ElementHook<Node>) registered;
            Node result;
            try {
                result = hook.apply(current, context);
            } catch (RuntimeException e) {
                failed(node.nodeType(), e);
                continue;
            }
            if (result == null || result.getClass() != node.getClass()) {
                return result;
            }
            current = result;
        }
        return current;
    }

    String runOutputHooks(String output, HookContext context) {
        String current = output;
        for (OutputHook hook : outputHooks) {
            String result;
            try {
                result = hook.apply(current, context);
            } catch (RuntimeException e) {
                failed("post-render", e);
                continue;
            }
            if (result == null) {
                throw new DocframeException("A post-render hook removed the output");
            }
            current = result;
        }
        return current;
    }

    private void failed(String target, RuntimeException e) {
        if (strict) {
            throw new DocframeException("Hook for " + target + " failed: " + e.getMessage(), e);
        }
        LOG.warn("Hook for {} failed, continuing without it: {}", target, e.getMessage(), e);
    }

    private static <H> List<H> ordered(List<Registration<H>> registrations) {
        List<Registration<H>> sorted = new ArrayList<>(registrations);
        // stable, so equal priorities keep registration order
        sorted.sort(Comparator.comparingInt((Registration<H> registration) -> registration.priority));
        List<H> hooks = new ArrayList<>(sorted.size());
        for (Registration<H> registration : sorted) {
            hooks.add(registration.hook);
        }
        return List.copyOf(hooks);
    }

    private static final class Registration<H> {
        final int priority;
        final H hook;

        Registration(int priority, H hook) {
            this.priority = priority;
            this.hook = Objects.requireNonNull(hook, "hook");
        }
    }

    public static final class Builder {
        private static final int DEFAULT_PRIORITY = 100;

        private final Map<HookPoint, List<Registration<DocumentHook>>> documentHooks = new EnumMap<>(HookPoint.class);
        private final Map<Class<? extends Node>, List<Registration<ElementHook<?>>>> elementHooks = new LinkedHashMap<>();
        private final List<Registration<OutputHook>> outputHooks = new ArrayList<>();
        private boolean strict;

        private Builder() {
        }

        public Builder on(HookPoint point, DocumentHook hook) {
            return on(point, hook, DEFAULT_PRIORITY);
        }

        public Builder on(HookPoint point, DocumentHook hook, int priority) {
            documentHooks.computeIfAbsent(Objects.requireNonNull(point, "point"), key -> new ArrayList<>())
                    .add(new Registration<>(priority, hook));
            return this;
        }

        public <T extends Node> Builder onElement(Class<T> type, ElementHook<T> hook) {
            return onElement(type, hook, DEFAULT_PRIORITY);
        }

        public <T extends Node> Builder onElement(Class<T> type, ElementHook<T> hook, int priority) {
            elementHooks.computeIfAbsent(Objects.requireNonNull(type, "type"), key -> new ArrayList<>())
                    .add(new Registration<>(priority, hook));
            return this;
        }

        public Builder postRender(OutputHook hook) {
            return postRender(hook, DEFAULT_PRIORITY);
        }

        public Builder postRender(OutputHook hook, int priority) {
            outputHooks.add(new Registration<>(priority, hook));
            return this;
        }

        /** Makes a failing hook abort the conversion instead of being skipped. */
        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Hooks build() {
            return new Hooks(this);
        }
    }
}
