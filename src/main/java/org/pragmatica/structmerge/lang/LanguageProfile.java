package org.pragmatica.structmerge.lang;

import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.grammar.GrammarParser;
import org.pragmatica.structmerge.parser.ParserConfig;
import org.pragmatica.structmerge.parser.PegEngine;
import org.pragmatica.structmerge.tree.KindTable;
import org.pragmatica.structmerge.tree.Revision;
import org.pragmatica.structmerge.tree.SyntaxTree;
import org.pragmatica.structmerge.tree.TreeBuilder;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything the merge engine needs to know about one language: the files it applies to,
 * its PEG grammar and the capabilities of its node kinds.
 *
 * <p>The grammar is compiled on first use; a profile is safe to share between merges running
 * on different threads.
 */
public final class LanguageProfile {
    private final String name;
    private final List<FileCriterion> criteria;
    private final String grammarText;
    private final KindTable kindTable;
    private final ParserConfig parserConfig;
    private volatile PegEngine engine;

    private LanguageProfile(String name,
                            List<FileCriterion> criteria,
                            String grammarText,
                            KindTable kindTable,
                            ParserConfig parserConfig) {
        this.name = name;
        this.criteria = List.copyOf(criteria);
        this.grammarText = grammarText;
        this.kindTable = kindTable;
        this.parserConfig = parserConfig;
    }

    public static LanguageProfile create(String name,
                                         List<FileCriterion> criteria,
                                         String grammarText,
                                         KindTable kindTable) {
        return new LanguageProfile(name, criteria, grammarText, kindTable, ParserConfig.DEFAULT);
    }

    public LanguageProfile withParserConfig(ParserConfig config) {
        return new LanguageProfile(name, criteria, grammarText, kindTable, config);
    }

    public String name() {
        return name;
    }

    public List<FileCriterion> criteria() {
        return criteria;
    }

    public KindTable kindTable() {
        return kindTable;
    }

    public boolean matches(Path path) {
        return criteria.stream().anyMatch(criterion -> criterion.matches(path));
    }

    /**
     * Parse one revision's text into its syntax tree.
     */
    public SyntaxTree parse(String text, Revision revision) throws ParseException {
        var cst = engine().parseCst(text);
        return TreeBuilder.create(kindTable).build(cst, text, revision);
    }

    /**
     * The compiled grammar. Fails if the grammar text itself is malformed.
     */
    public PegEngine engine() throws ParseException {
        var current = engine;
        if (current == null) {
            synchronized (this) {
                current = engine;
                if (current == null) {
                    current = PegEngine.create(GrammarParser.parse(grammarText), parserConfig);
                    engine = current;
                }
            }
        }
        return current;
    }

    @Override
    public String toString() {
        return name;
    }
}
