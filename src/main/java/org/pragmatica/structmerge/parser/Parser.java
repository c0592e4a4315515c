package org.pragmatica.structmerge.parser;

import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.tree.CstNode;

/**
 * Parser interface - parses input text according to a grammar.
 */
public interface Parser {

    /**
     * Parse the whole input from the grammar's start rule and return the lossless CST.
     */
    CstNode parseCst(String input) throws ParseException;

    /**
     * Parse the whole input starting from a specific rule.
     */
    CstNode parseCst(String input, String startRule) throws ParseException;
}
