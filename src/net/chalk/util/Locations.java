package net.chalk.util;

import net.chalk.parser.TextLocation;

/* FIXME: Add support for non-BMP characters and for fullwidth ones. */
public final class Locations {

    public static class FixedLocation implements TextLocation {

        private final long line;
        private final long column;
        private final long characterIndex;

        public FixedLocation(long line, long column, long characterIndex) {
            this.line = line;
            this.column = column;
            this.characterIndex = characterIndex;
        }
        public FixedLocation(TextLocation other) {
            this(other.getLine(), other.getColumn(),
                 other.getCharacterIndex());
        }

        public String toString() {
            return String.format("line %d column %d (char %d)", getLine(),
                                 getColumn(), getCharacterIndex());
        }

        public boolean equals(Object other) {
            if (! (other instanceof TextLocation)) return false;
            TextLocation co = (TextLocation) other;
            return (line == co.getLine() &&
                    column == co.getColumn() &&
                    characterIndex == co.getCharacterIndex());
        }

        public int hashCode() {
            return (int) (line ^ line >>> 31 ^ column ^ column >>> 31 ^
                characterIndex ^ characterIndex >>> 31);
        }

        public long getLine() {
            return line;
        }

        public long getColumn() {
            return column;
        }

        public long getCharacterIndex() {
            return characterIndex;
        }

    }

    public static class LocationTracker implements TextLocation {

        public static final int DEFAULT_TAB_SIZE = 8;

        private long line;
        private long column;
        private long characterIndex;
        private boolean inNL;
        private final int tabSize;

        public LocationTracker(int tabSize) {
            if (tabSize <= 0)
                throw new IllegalArgumentException("Invalid tab size " +
                    tabSize);
            this.line = 1;
            this.column = 1;
            this.characterIndex = 0;
            this.inNL = false;
            this.tabSize = tabSize;
        }
        public LocationTracker() {
            this(DEFAULT_TAB_SIZE);
        }

        public String toString() {
            return String.format("%s@%h[line=%s,column=%s,char=%s,inNL=%s," +
                "tabSize=%s]", getClass().getName(), this, getLine(),
                getColumn(), getCharacterIndex(), inNL, getTabSize());
        }

        public long getLine() {
            return line;
        }

        public long getColumn() {
            return column;
        }

        public long getCharacterIndex() {
            return characterIndex;
        }

        public int getTabSize() {
            return tabSize;
        }

        public TextLocation snapshot() {
            return new FixedLocation(this);
        }

        @SuppressWarnings("fallthrough")
        public void advance(char ch) {
            characterIndex++;
            switch (ch) {
                case '\t':
                    column = (column + tabSize - 1) / tabSize * tabSize + 1;
                    break;
                case '\n':
                    // The second half of a CR-LF pair.
                    if (inNL) break;
                    // Intentionally falling through.
                case '\r':
                    line++;
                    column = 1;
                    break;
                default:
                    column++;
                    break;
            }
            inNL = (ch == '\r');
        }
        public void advance(CharSequence data, int offset, int size) {
            for (int i = offset, ei = offset + size; i < ei; i++) {
                advance(data.charAt(i));
            }
        }

    }

    // Prevent construction.
    private Locations() {}

}
