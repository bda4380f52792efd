package nl.bytesoflife.deltaoutline.lexer;

public enum TokenType {
    COMMAND,
    NUMBER
}
