package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A list of terms, each followed by one or more descriptions.
 */
public final class DefinitionList extends Node {

    /** One term with its descriptions. Not a node on its own. */
    public static final class Item {
        public DefinitionTerm term;
        public List<DefinitionDescription> descriptions = new ArrayList<>();

        public Item(DefinitionTerm term, List<DefinitionDescription> descriptions) {
            this.term = term;
            this.descriptions = new ArrayList<>(descriptions);
        }
    }

    public List<Item> items = new ArrayList<>();

    public DefinitionList(List<Item> items) {
        this.items = new ArrayList<>(items);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "DefinitionList";
    }

    @Override
    public List<Node> children() {
        List<Node> all = new ArrayList<>();
        for (Item item : items) {
            all.add(item.term);
            all.addAll(item.descriptions);
        }
        return Collections.unmodifiableList(all);
    }
}
