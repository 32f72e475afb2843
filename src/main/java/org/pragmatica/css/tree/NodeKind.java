package org.pragmatica.css.tree;

/**
 * Closed set of syntactic categories a {@link Node} can carry.
 */
public enum NodeKind {
    // Tokens produced by the lexer
    EOF_TOKEN("end of input"),
    WHITESPACE("whitespace"),
    COMMENT("comment"),
    IDENTIFIER("identifier"),
    AT_KEYWORD("@-keyword"),
    STRING("string"),
    NUMBER("number"),
    HASH("hash"),
    URL("url"),
    VARIABLE("variable"),
    COLON("':'"),
    SEMICOLON("';'"),
    COMMA("','"),
    EXCLAMATION("'!'"),
    DELIMITER("delimiter"),
    OPEN_CURLYBRACKET("'{'"),
    CLOSE_CURLYBRACKET("'}'"),
    OPEN_SQUAREBRACKET("'['"),
    CLOSE_SQUAREBRACKET("']'"),
    OPEN_PARENTHESIS("'('"),
    CLOSE_PARENTHESIS("')'"),
    FUNCTION("function"),
    CDO("'<!--'"),
    CDC("'-->'"),

    // Structural kinds introduced by the parser and the compiler
    LIST("list"),
    DECLARATION("declaration"),
    VARIABLE_DECLARATION("variable declaration"),
    COMPONENT_VALUE("component value");

    private final String display;

    NodeKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }

    /**
     * Whether a node of this kind owns a block that must be closed by a matching token.
     */
    public boolean opensBlock() {
        return switch (this) {
            case OPEN_CURLYBRACKET, OPEN_SQUAREBRACKET, OPEN_PARENTHESIS, FUNCTION -> true;
            default -> false;
        };
    }

    public boolean closesBlock() {
        return switch (this) {
            case CLOSE_CURLYBRACKET, CLOSE_SQUAREBRACKET, CLOSE_PARENTHESIS -> true;
            default -> false;
        };
    }

    /**
     * The token kind that terminates a block opened by this kind.
     */
    public NodeKind closing() {
        return switch (this) {
            case OPEN_CURLYBRACKET -> CLOSE_CURLYBRACKET;
            case OPEN_SQUAREBRACKET -> CLOSE_SQUAREBRACKET;
            case OPEN_PARENTHESIS, FUNCTION -> CLOSE_PARENTHESIS;
            default -> throw new IllegalArgumentException(this + " does not open a block");
        };
    }

    @Override
    public String toString() {
        return display;
    }
}
