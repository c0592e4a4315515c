package org.pragmatica.structmerge.parser;

/**
 * Parser configuration options.
 *
 * @param packratEnabled memoise rule results per input position
 * @param maxRuleDepth   maximum nesting of rule invocations before the input is rejected; every
 *                       rule level takes several interpreter frames, the default stays well within
 *                       a default thread stack
 */
public record ParserConfig(boolean packratEnabled, int maxRuleDepth) {
    public static final int DEFAULT_MAX_RULE_DEPTH = 256;
    public static final ParserConfig DEFAULT = new ParserConfig(true, DEFAULT_MAX_RULE_DEPTH);

    public ParserConfig {
        if (maxRuleDepth < 1) {
            throw new IllegalArgumentException("maxRuleDepth must be positive, got " + maxRuleDepth);
        }
    }

    public ParserConfig withPackrat(boolean enabled) {
        return new ParserConfig(enabled, maxRuleDepth);
    }

    public ParserConfig withMaxRuleDepth(int depth) {
        return new ParserConfig(packratEnabled, depth);
    }
}
