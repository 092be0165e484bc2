package net.chalk.parser;

import net.chalk.util.Formats;

/**
 * Thrown when no entry of the token table matches the input at the scanner
 * position.
 */
public class LexicalException extends LocatedParserException {

    private final String remainingInput;

    public LexicalException(TextLocation pos, String remainingInput) {
        super(pos, "no token found at the start of " +
              Formats.formatString(remainingInput));
        if (remainingInput == null)
            throw new NullPointerException(
                "Remaining input may not be null");
        this.remainingInput = remainingInput;
    }

    public String getCategory() {
        return "lexical error";
    }

    public String getRemainingInput() {
        return remainingInput;
    }

}
