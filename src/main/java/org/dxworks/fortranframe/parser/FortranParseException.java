package org.dxworks.fortranframe.parser;

import org.dxworks.fortranframe.model.Node;
import org.dxworks.fortranframe.model.Origin;

/**
 * Fatal parse error. Parsing stops at the first one; there is no partial result.
 */
public class FortranParseException extends RuntimeException {

    public enum ErrorKind {
        CONTINUATION,
        UNCLASSIFIABLE,
        BLOCK_MISMATCH,
        UNTERMINATED_BLOCK
    }

    private final ErrorKind errorKind;
    private final int line;

    public FortranParseException(ErrorKind errorKind, int line, String message) {
        super("Line " + line + ": " + message);
        this.errorKind = errorKind;
        this.line = line;
    }

    public static FortranParseException continuation(int line) {
        return new FortranParseException(ErrorKind.CONTINUATION, line, "no preceding line to continue");
    }

    public static FortranParseException unclassifiable(Origin origin, String text) {
        return new FortranParseException(ErrorKind.UNCLASSIFIABLE, origin.physicalLine,
                "unclassifiable statement: " + text);
    }

    public static FortranParseException blockMismatch(Origin origin, String expected, Node actual, String text) {
        return new FortranParseException(ErrorKind.BLOCK_MISMATCH, origin.physicalLine,
                "expected open '" + expected + "' but innermost block is '" + actual.kind
                        + "' (opened at line " + actual.origin.physicalLine + "): " + text);
    }

    public static FortranParseException unterminated(Node innermost) {
        return new FortranParseException(ErrorKind.UNTERMINATED_BLOCK, innermost.origin.physicalLine,
                "unterminated block '" + innermost.kind + "': " + innermost.rawText);
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public int getLine() {
        return line;
    }
}
