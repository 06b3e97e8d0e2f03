package org.dxworks.hybridnote;

import org.dxworks.hybridnote.parser.BlockParser;
import org.dxworks.hybridnote.parser.IdentityParser;
import org.dxworks.hybridnote.parser.ParserRegistrationException;
import org.dxworks.hybridnote.parser.code.CodeFenceParser;
import org.dxworks.hybridnote.parser.latex.LatexParser;
import org.dxworks.hybridnote.parser.markdown.MarkdownParser;
import org.dxworks.hybridnote.parser.org.OrgParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsers by syntax kind, in registration order.
 *
 * A block is resolved to the parser registered for its own kind, else to the first parser whose
 * {@code canHandle} accepts the text, else to {@link IdentityParser}. Resolution never fails.
 */
public class ParserRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ParserRegistry.class);

    private final Map<SyntaxKind, BlockParser> parsers = new LinkedHashMap<>();

    public static ParserRegistry withDefaults() {
        ParserRegistry registry = new ParserRegistry();
        registry.register(new MarkdownParser());
        registry.register(new OrgParser());
        registry.register(new LatexParser());
        registry.register(new CodeFenceParser());
        return registry;
    }

    /**
     * @throws ParserRegistrationException if a parser is already registered for the same kind
     */
    public ParserRegistry register(BlockParser parser) {
        Objects.requireNonNull(parser, "parser");
        SyntaxKind kind = parser.getSyntaxKind();
        if (parsers.containsKey(kind)) {
            throw new ParserRegistrationException(kind);
        }
        parsers.put(kind, parser);
        logger.debug("Registered {} for {}", parser.getClass().getSimpleName(), kind);
        return this;
    }

    public Optional<BlockParser> get(SyntaxKind kind) {
        return Optional.ofNullable(parsers.get(kind));
    }

    public boolean isRegistered(SyntaxKind kind) {
        return parsers.containsKey(kind);
    }

    public List<SyntaxKind> registeredKinds() {
        return new ArrayList<>(parsers.keySet());
    }

    public BlockParser resolve(SyntaxKind kind, String rawText) {
        BlockParser exact = parsers.get(kind);
        if (exact != null) {
            return exact;
        }
        for (BlockParser candidate : parsers.values()) {
            if (candidate.canHandle(rawText)) {
                logger.debug("No parser registered for {}, {} accepted the block", kind, candidate.getSyntaxKind());
                return candidate;
            }
        }
        logger.debug("No parser accepted a {} block, keeping it verbatim", kind);
        return IdentityParser.INSTANCE;
    }
}
