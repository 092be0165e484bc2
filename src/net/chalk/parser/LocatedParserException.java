package net.chalk.parser;

/**
 * A ParserException that has an associated TextLocation.
 */
public class LocatedParserException extends ParserException {

    private final TextLocation location;

    public LocatedParserException(TextLocation pos) {
        super();
        location = pos;
    }
    public LocatedParserException(TextLocation pos, String message) {
        super(message);
        location = pos;
    }
    public LocatedParserException(TextLocation pos, Throwable cause) {
        super(cause);
        location = pos;
    }
    public LocatedParserException(TextLocation pos, String message,
                                  Throwable cause) {
        super(message, cause);
        location = pos;
    }

    public TextLocation getLocation() {
        return location;
    }

    public String toDiagnostic() {
        TextLocation loc = getLocation();
        String ret = super.toDiagnostic();
        if (loc == null) return ret;
        return String.format("%s (line %d column %d)", ret, loc.getLine(),
                             loc.getColumn());
    }

}
