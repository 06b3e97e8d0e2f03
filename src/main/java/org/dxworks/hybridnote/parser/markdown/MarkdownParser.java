package org.dxworks.hybridnote.parser.markdown;

import org.commonmark.ext.front.matter.YamlFrontMatterBlock;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.front.matter.YamlFrontMatterVisitor;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.CustomBlock;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.dxworks.hybridnote.SyntaxKind;
import org.dxworks.hybridnote.model.BlockAst;
import org.dxworks.hybridnote.model.BlockMetadata;
import org.dxworks.hybridnote.model.markdown.MarkdownAst;
import org.dxworks.hybridnote.model.markdown.MarkdownElement;
import org.dxworks.hybridnote.parser.BlockParser;
import org.dxworks.hybridnote.parser.ParsedBlock;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Markdown prose via commonmark-java, with GFM tables and YAML front matter.
 *
 * The block is a heading block only when it holds a single heading. Front matter keys become
 * properties; an {@code id} key becomes the block id. Rendering returns the source, so the parser
 * is lossless.
 */
public class MarkdownParser implements BlockParser {

    private final Parser parser;

    public MarkdownParser() {
        // Build parser with source spans enabled for block nodes
        this.parser = Parser.builder()
                .extensions(List.of(
                        TablesExtension.create(),
                        YamlFrontMatterExtension.create()
                ))
                .includeSourceSpans(IncludeSourceSpans.BLOCKS)
                .build();
    }

    @Override
    public SyntaxKind getSyntaxKind() {
        return SyntaxKind.MARKDOWN;
    }

    @Override
    public boolean canHandle(String text) {
        if (text.isBlank() || text.contains("$$")) {
            return false;
        }
        String first = text.stripLeading();
        return !first.startsWith("```") && !first.toUpperCase(Locale.ROOT).startsWith("#+BEGIN_");
    }

    @Override
    public ParsedBlock parse(String rawText, int lineOffset) {
        Node document = parser.parse(rawText);

        List<MarkdownElement> elements = new ArrayList<>();
        document.accept(new MarkdownElementVisitor(elements, lineOffset));

        Map<String, String> frontMatter = extractFrontMatter(document);
        MarkdownAst ast = new MarkdownAst(elements, frontMatter, rawText);

        BlockMetadata.Builder metadata = BlockMetadata.builder();
        if (ast.isSingleHeading()) {
            metadata.headingLevel((Integer) elements.get(0).properties.get("level"));
        }
        frontMatter.forEach((key, value) -> {
            if ("id".equalsIgnoreCase(key)) {
                metadata.id(value);
            } else {
                metadata.property(key, value);
            }
        });
        return new ParsedBlock(ast, metadata.build());
    }

    @Override
    public String render(BlockAst ast, BlockMetadata metadata) {
        if (!(ast instanceof MarkdownAst markdown)) {
            throw new IllegalArgumentException("Expected a Markdown block, got " + ast.getSyntax());
        }
        return markdown.getSource();
    }

    private Map<String, String> extractFrontMatter(Node document) {
        Node first = document.getFirstChild();
        if (!(first instanceof YamlFrontMatterBlock)) {
            return Map.of();
        }
        YamlFrontMatterVisitor visitor = new YamlFrontMatterVisitor();
        document.accept(visitor);
        Map<String, String> frontMatter = new LinkedHashMap<>();
        visitor.getData().forEach((key, values) -> frontMatter.put(key, String.join(", ", values)));
        return frontMatter;
    }

    private static class MarkdownElementVisitor extends AbstractVisitor {
        private final List<MarkdownElement> elements;
        private final List<MarkdownElement> elementStack = new ArrayList<>();
        private final int lineOffset;

        MarkdownElementVisitor(List<MarkdownElement> elements, int lineOffset) {
            this.elements = elements;
            this.lineOffset = lineOffset;
        }

        @Override
        public void visit(Heading heading) {
            Map<String, Object> properties = new HashMap<>();
            properties.put("level", heading.getLevel());
            properties.put("text", extractText(heading));
            addElementToCurrentContext(createElement("heading", heading, properties));
        }

        @Override
        public void visit(Paragraph paragraph) {
            Image standaloneImage = getStandaloneImage(paragraph);
            if (standaloneImage != null) {
                Map<String, Object> properties = new HashMap<>();
                properties.put("altText", extractText(standaloneImage));
                properties.put("destination", standaloneImage.getDestination());
                addElementToCurrentContext(createElement("image", paragraph, properties));
            } else {
                addElementToCurrentContext(createElement("paragraph", paragraph, null));
            }
        }

        @Override
        public void visit(FencedCodeBlock codeBlock) {
            Map<String, Object> properties = null;
            if (codeBlock.getInfo() != null && !codeBlock.getInfo().trim().isEmpty()) {
                properties = new HashMap<>();
                properties.put("language", codeBlock.getInfo().trim());
            }
            addElementToCurrentContext(createElement("code_block", codeBlock, properties));
        }

        @Override
        public void visit(IndentedCodeBlock codeBlock) {
            addElementToCurrentContext(createElement("code_block", codeBlock, null));
        }

        @Override
        public void visit(CustomBlock customBlock) {
            if (customBlock instanceof YamlFrontMatterBlock) {
                // Front matter goes to metadata, not to the outline.
                return;
            }
            if (customBlock instanceof TableBlock table) {
                addElementToCurrentContext(createElement("table", table, null));
                return;
            }
            super.visit(customBlock);
        }

        @Override
        public void visit(BulletList bulletList) {
            withElementContext(createElement("bullet_list", bulletList, null), () -> super.visit(bulletList));
        }

        @Override
        public void visit(OrderedList orderedList) {
            withElementContext(createElement("ordered_list", orderedList, null), () -> super.visit(orderedList));
        }

        @Override
        public void visit(ListItem listItem) {
            withElementContext(createElement("list_item", listItem, null), () -> super.visit(listItem));
        }

        @Override
        public void visit(BlockQuote blockQuote) {
            withElementContext(createElement("block_quote", blockQuote, null), () -> super.visit(blockQuote));
        }

        @Override
        public void visit(ThematicBreak thematicBreak) {
            addElementToCurrentContext(createElement("thematic_break", thematicBreak, null));
        }

        @Override
        public void visit(HtmlBlock htmlBlock) {
            addElementToCurrentContext(createElement("html_block", htmlBlock, null));
        }

        private void addElementToCurrentContext(MarkdownElement element) {
            if (!elementStack.isEmpty()) {
                MarkdownElement parent = elementStack.get(elementStack.size() - 1);
                if (parent.children == null) {
                    parent.children = new ArrayList<>();
                }
                parent.children.add(element);
                return;
            }
            elements.add(element);
        }

        private void withElementContext(MarkdownElement element, Runnable visitorAction) {
            addElementToCurrentContext(element);
            elementStack.add(element);
            try {
                visitorAction.run();
            } finally {
                elementStack.remove(elementStack.size() - 1);
            }
        }

        private Image getStandaloneImage(Paragraph paragraph) {
            Node first = paragraph.getFirstChild();
            if (first instanceof Image image && first.getNext() == null) {
                return image;
            }
            return null;
        }

        private MarkdownElement createElement(String type, Node node, Map<String, Object> properties) {
            MarkdownElement element = new MarkdownElement();
            element.type = type;
            element.line = lineOffset + firstLineIndex(node);
            element.lines = computeLineSpan(node);
            element.properties = properties;
            element.children = null;
            return element;
        }

        private int firstLineIndex(Node node) {
            if (node.getSourceSpans() == null || node.getSourceSpans().isEmpty()) {
                return 0;
            }
            int minLine = Integer.MAX_VALUE;
            for (SourceSpan span : node.getSourceSpans()) {
                minLine = Math.min(minLine, span.getLineIndex());
            }
            return minLine;
        }

        private int computeLineSpan(Node node) {
            if (node == null || node.getSourceSpans() == null || node.getSourceSpans().isEmpty()) {
                return 1;
            }

            int minLine = Integer.MAX_VALUE;
            int maxLine = Integer.MIN_VALUE;

            for (SourceSpan span : node.getSourceSpans()) {
                int line = span.getLineIndex();
                minLine = Math.min(minLine, line);
                maxLine = Math.max(maxLine, line);
            }

            return (maxLine - minLine) + 1;
        }

        private String extractText(Node node) {
            StringBuilder text = new StringBuilder();
            Node child = node.getFirstChild();
            while (child != null) {
                if (child instanceof Text literal) {
                    text.append(literal.getLiteral());
                } else {
                    // Recursively extract text from nested nodes (e.g., bold, italic)
                    text.append(extractText(child));
                }
                child = child.getNext();
            }
            return text.toString().trim();
        }
    }
}
