package net.chalk.parser;

/**
 * Generic superclass for checked front end exceptions.
 * Not to be confused with the specific SyntaxException.
 */
public class ParserException extends Exception {

    public ParserException() {
        super();
    }
    public ParserException(String message) {
        super(message);
    }
    public ParserException(Throwable cause) {
        super(cause);
    }
    public ParserException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * A short lower-case phrase naming the kind of error, used as the
     * prefix of diagnostics.
     */
    public String getCategory() {
        return "error";
    }

    /**
     * A single-line human-readable description of this exception.
     */
    public String toDiagnostic() {
        return getCategory() + ": " + getMessage();
    }

}
