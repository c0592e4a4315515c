package org.pragmatica.structmerge.lang;

import org.pragmatica.structmerge.tree.KindTable;

import java.util.List;

/**
 * Languages shipped with the library.
 */
public final class Languages {
    public static final String JSON = "json";
    public static final String STARLARK = "starlark";

    private static final String JSON_GRAMMAR = """
        # RFC 8259 JSON
        Document <- _Value
        _Value   <- Object / Array / String / Number / Literal
        Object   <- '{' (Member (',' Member)*)? '}'
        Member   <- String ':' _Value
        Array    <- '[' (_Value (',' _Value)*)? ']'
        String   <- < '"' ('\\\\' . / [^"\\\\])* '"' >
        Number   <- < '-'? [0-9]+ ('.' [0-9]+)? ([eE] [+\\-]? [0-9]+)? >
        Literal  <- < ('true' / 'false' / 'null') ![a-zA-Z0-9_] >
        %whitespace <- [ \\t\\r\\n]*
        """;

    private static final String STARLARK_GRAMMAR = """
        # Declarative subset of Starlark used by Bazel and Buck build files
        Module              <- _Statement*
        _Statement          <- Load / Assignment / ExpressionStatement
        Load                <- 'load' '(' Arguments? ')'
        Assignment          <- Identifier '=' !'=' _Expression
        ExpressionStatement <- _Expression
        _Expression         <- Concatenation / _Primary
        Concatenation       <- _Primary ('+' _Primary)+
        _Primary            <- Call / List / Dict / String / Number / Identifier
        Call                <- Identifier '(' Arguments? ')'
        Arguments           <- _Argument (',' _Argument)* ','?
        _Argument           <- KeywordArgument / _Expression
        KeywordArgument     <- Identifier '=' !'=' _Expression
        List                <- '[' (_Expression (',' _Expression)* ','?)? ']'
        Dict                <- '{' (Entry (',' Entry)* ','?)? '}'
        Entry               <- _Expression ':' _Expression
        String              <- < '"' ('\\\\' . / [^"\\\\\\n])* '"' / "'" ('\\\\' . / [^'\\\\\\n])* "'" >
        Number              <- < '-'? [0-9]+ >
        Identifier          <- < [a-zA-Z_] [a-zA-Z0-9_]* ('.' [a-zA-Z_] [a-zA-Z0-9_]*)* >
        %whitespace         <- ([ \\t\\r\\n]+ / '#' [^\\n]*)*
        """;

    private Languages() {}

    /**
     * JSON documents. Object members are unordered and identified by their key.
     */
    public static LanguageProfile json() {
        var kinds = KindTable.builder()
                             .unordered("Object", ",", "{", "}")
                             .identity("Member", "String")
                             .build();
        return LanguageProfile.create(JSON, List.of(FileCriterion.byExtension("json")), JSON_GRAMMAR, kinds);
    }

    /**
     * Bazel and Buck build files. List and dict literals are unordered, keyword arguments are
     * identified by their name and dict entries by their key.
     */
    public static LanguageProfile starlark() {
        var kinds = KindTable.builder()
                             .unordered("List", ",", "[", "]")
                             .unordered("Dict", ",", "{", "}")
                             .identity("KeywordArgument", "Identifier")
                             .identity("Entry", "String")
                             .build();
        var criteria = List.of(FileCriterion.byExtension("bzl"),
                               FileCriterion.byExtension("star"),
                               FileCriterion.byExtension("bazel"),
                               FileCriterion.byExtension("sky"),
                               FileCriterion.byName("BUILD"),
                               FileCriterion.byName("WORKSPACE"),
                               FileCriterion.byName("BUCK"));
        return LanguageProfile.create(STARLARK, criteria, STARLARK_GRAMMAR, kinds);
    }
}
