package org.dxworks.hybridnote.parser.org;

import org.dxworks.hybridnote.SyntaxKind;
import org.dxworks.hybridnote.detector.Lines;
import org.dxworks.hybridnote.model.BlockAst;
import org.dxworks.hybridnote.model.BlockMetadata;
import org.dxworks.hybridnote.model.org.OrgBlock;
import org.dxworks.hybridnote.model.org.OrgHeadline;
import org.dxworks.hybridnote.model.org.OrgParagraph;
import org.dxworks.hybridnote.parser.BlockParseException;
import org.dxworks.hybridnote.parser.BlockParser;
import org.dxworks.hybridnote.parser.ParsedBlock;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Org-mode headlines, {@code #+BEGIN_/#+END_} blocks and keyword paragraphs.
 *
 * Normalization: a headline is rendered with single spaces between stars, TODO keyword, title and
 * tags. Everything else, including the lines below a headline, is kept verbatim.
 */
public class OrgParser implements BlockParser {

    public static final Set<String> DEFAULT_TODO_KEYWORDS = Set.of("TODO", "DONE");

    private static final Pattern HEADLINE = Pattern.compile("^(\\*+)(?:\\s+(.*))?$");
    private static final Pattern TAGS = Pattern.compile("^(.*?)\\s+(:(?:[\\w@#%]+:)+)\\s*$");
    private static final Pattern BLOCK_BEGIN = Pattern.compile("^#\\+BEGIN_(\\S+)(?:\\s+(.*))?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern BLOCK_END = Pattern.compile("^#\\+END_(\\S+).*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern KEYWORD = Pattern.compile("^#\\+(\\w+):\\s*(.*?)\\s*$");
    private static final Pattern PROPERTIES_START = Pattern.compile("^\\s*:PROPERTIES:\\s*$");
    private static final Pattern PROPERTIES_END = Pattern.compile("^\\s*:END:\\s*$");
    private static final Pattern PROPERTY_LINE = Pattern.compile("^\\s*:([\\w-]+):\\s*(.*?)\\s*$");
    private static final Pattern PLANNING = Pattern.compile("(SCHEDULED|DEADLINE|CLOSED):\\s*([<\\[][^>\\]]*[>\\]])");

    private final Set<String> todoKeywords;

    public OrgParser() {
        this(DEFAULT_TODO_KEYWORDS);
    }

    public OrgParser(Set<String> todoKeywords) {
        this.todoKeywords = Set.copyOf(todoKeywords);
    }

    @Override
    public SyntaxKind getSyntaxKind() {
        return SyntaxKind.ORG;
    }

    @Override
    public boolean canHandle(String text) {
        String trimmed = text.stripLeading();
        String upper = trimmed.toUpperCase(Locale.ROOT);
        return HEADLINE.matcher(Lines.content(firstLine(trimmed))).matches()
                || upper.startsWith("#+BEGIN_")
                || upper.startsWith("#+TITLE:")
                || upper.startsWith("#+AUTHOR:")
                || upper.startsWith(":PROPERTIES:");
    }

    @Override
    public ParsedBlock parse(String rawText, int lineOffset) throws BlockParseException {
        List<String> lines = Lines.split(rawText);
        if (lines.isEmpty()) {
            return ParsedBlock.of(new OrgParagraph("", Map.of()));
        }

        String first = Lines.content(lines.get(0));
        Matcher headline = HEADLINE.matcher(first);
        if (headline.matches()) {
            return parseHeadline(headline, lines, lineOffset);
        }

        Matcher begin = BLOCK_BEGIN.matcher(first.trim());
        if (begin.matches()) {
            return parseBlock(begin, lines, lineOffset);
        }

        return parseParagraph(rawText, lines);
    }

    @Override
    public String render(BlockAst ast, BlockMetadata metadata) {
        if (ast instanceof OrgHeadline headline) {
            return renderHeadline(headline) + headline.getLineTerminator() + headline.getBody();
        }
        if (ast instanceof OrgBlock block) {
            return block.getBeginLine() + block.getContents() + block.getEndLine() + block.getTrailing();
        }
        if (ast instanceof OrgParagraph paragraph) {
            return paragraph.getText();
        }
        throw new IllegalArgumentException("Expected an Org structure, got " + ast.getSyntax());
    }

    private ParsedBlock parseHeadline(Matcher headline, List<String> lines, int lineOffset) throws BlockParseException {
        int level = headline.group(1).length();
        String rest = headline.group(2) == null ? "" : headline.group(2).trim();
        if (rest.isEmpty()) {
            throw new BlockParseException("headline has no title", lineOffset);
        }

        String todo = null;
        int space = rest.indexOf(' ');
        String firstWord = space == -1 ? rest : rest.substring(0, space);
        if (todoKeywords.contains(firstWord)) {
            todo = firstWord;
            rest = space == -1 ? "" : rest.substring(space + 1).trim();
        }

        List<String> tags = new ArrayList<>();
        Matcher tagMatcher = TAGS.matcher(rest);
        if (tagMatcher.matches()) {
            String tagGroup = tagMatcher.group(2);
            tags.addAll(Arrays.asList(tagGroup.substring(1, tagGroup.length() - 1).split(":")));
            rest = tagMatcher.group(1).trim();
        }

        String body = String.join("", lines.subList(1, lines.size()));
        OrgHeadline ast = new OrgHeadline(level, todo, rest, tags, Lines.terminator(lines.get(0)), body);

        BlockMetadata.Builder metadata = BlockMetadata.builder()
                .headingLevel(level)
                .todoState(todo);
        readPlanningAndDrawer(lines, metadata);
        if (!tags.isEmpty()) {
            metadata.property("tags", String.join(":", tags));
        }
        return new ParsedBlock(ast, metadata.build());
    }

    /**
     * Planning line and property drawer directly under the headline, in that order; both optional.
     */
    private void readPlanningAndDrawer(List<String> lines, BlockMetadata.Builder metadata) {
        int i = 1;
        if (i < lines.size()) {
            Matcher planning = PLANNING.matcher(Lines.content(lines.get(i)));
            boolean found = false;
            while (planning.find()) {
                metadata.property(planning.group(1), planning.group(2));
                found = true;
            }
            if (found) {
                i++;
            }
        }

        if (i >= lines.size() || !PROPERTIES_START.matcher(Lines.content(lines.get(i))).matches()) {
            return;
        }
        for (i = i + 1; i < lines.size(); i++) {
            String line = Lines.content(lines.get(i));
            if (PROPERTIES_END.matcher(line).matches()) {
                return;
            }
            Matcher property = PROPERTY_LINE.matcher(line);
            if (property.matches()) {
                String key = property.group(1);
                String value = property.group(2);
                if ("ID".equalsIgnoreCase(key)) {
                    metadata.id(value);
                } else {
                    metadata.property(key, value);
                }
            }
        }
    }

    private ParsedBlock parseBlock(Matcher begin, List<String> lines, int lineOffset) throws BlockParseException {
        String blockType = begin.group(1).toUpperCase(Locale.ROOT);
        String parameters = begin.group(2) == null ? "" : begin.group(2).trim();

        int endIndex = -1;
        for (int i = 1; i < lines.size(); i++) {
            Matcher end = BLOCK_END.matcher(Lines.content(lines.get(i)).trim());
            if (end.matches() && end.group(1).toUpperCase(Locale.ROOT).equals(blockType)) {
                endIndex = i;
                break;
            }
        }
        if (endIndex == -1) {
            throw new BlockParseException("unterminated #+BEGIN_" + blockType + " block", lineOffset);
        }

        OrgBlock ast = new OrgBlock(
                blockType,
                parameters,
                lines.get(0),
                String.join("", lines.subList(1, endIndex)),
                lines.get(endIndex),
                String.join("", lines.subList(endIndex + 1, lines.size())));

        BlockMetadata.Builder metadata = BlockMetadata.builder().property("block_type", blockType);
        if (ast.isSourceBlock() && !parameters.isEmpty()) {
            metadata.property("language", parameters.split("\\s+", 2)[0]);
        }
        return new ParsedBlock(ast, metadata.build());
    }

    private ParsedBlock parseParagraph(String rawText, List<String> lines) {
        Map<String, String> keywords = new LinkedHashMap<>();
        for (String line : lines) {
            Matcher keyword = KEYWORD.matcher(Lines.content(line).trim());
            if (keyword.matches()) {
                keywords.put(keyword.group(1).toUpperCase(Locale.ROOT), keyword.group(2));
            }
        }

        BlockMetadata.Builder metadata = BlockMetadata.builder();
        keywords.forEach(metadata::property);
        return new ParsedBlock(new OrgParagraph(rawText, keywords), metadata.build());
    }

    private static String renderHeadline(OrgHeadline headline) {
        StringBuilder sb = new StringBuilder("*".repeat(headline.getLevel()));
        if (headline.getTodoKeyword() != null) {
            sb.append(' ').append(headline.getTodoKeyword());
        }
        if (!headline.getTitle().isEmpty()) {
            sb.append(' ').append(headline.getTitle());
        }
        if (!headline.getTags().isEmpty()) {
            sb.append(" :").append(String.join(":", headline.getTags())).append(':');
        }
        return sb.toString();
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline == -1 ? text : text.substring(0, newline + 1);
    }
}
