package org.dxworks.docframe.ast;

/**
 * Plain-text content of a subtree: text, code and math literals concatenated,
 * image alt text included, soft breaks as spaces and hard breaks as newlines.
 */
public final class NodeText {

    private NodeText() {
    }

    public static String of(Node node) {
        StringBuilder text = new StringBuilder();
        new TextAppender(text).walk(node);
        return text.toString();
    }

    private static class TextAppender extends AbstractNodeVisitor {
        private final StringBuilder text;

        TextAppender(StringBuilder text) {
            this.text = text;
        }

        @Override
        public Void visit(Text node) {
            text.append(node.content);
            return null;
        }

        @Override
        public Void visit(Code node) {
            text.append(node.content);
            return null;
        }

        @Override
        public Void visit(CodeBlock node) {
            text.append(node.content);
            return null;
        }

        @Override
        public Void visit(MathInline node) {
            text.append(node.content);
            return null;
        }

        @Override
        public Void visit(MathBlock node) {
            text.append(node.content);
            return null;
        }

        @Override
        public Void visit(Image node) {
            text.append(node.altText);
            return null;
        }

        @Override
        public Void visit(LineBreak node) {
            text.append(node.soft ? " " : "\n");
            return null;
        }
    }
}
