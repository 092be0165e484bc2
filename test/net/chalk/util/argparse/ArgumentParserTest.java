package net.chalk.util.argparse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ArgumentParserTest {

    private ArgumentParser parser;
    private Option<Integer> count;
    private Option<Boolean> verbose;
    private Option<List<KeyValue>> defines;
    private Argument<File> input;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("prog", "0.1", "Test program.");
        count = parser.add(Option.of(Integer.class, "count", 'n',
                                     "How many."));
        verbose = parser.add(Option.flag("verbose", 'v', "Be verbose."));
        defines = parser.add(Option.ofAccum(KeyValue.class, "define", 'D',
                                            "Define a value."));
        input = parser.add(Argument.of(File.class, "input", "Input file."));
    }

    @Test
    public void defaults() throws Exception {
        ParseResult r = parser.parse(new String[0]);
        assertNull(r.get(count));
        assertFalse(r.get(verbose));
        assertTrue(r.get(defines).isEmpty());
        assertNull(r.get(input));
        assertFalse(r.contains(input));
    }

    @Test
    public void longAndShortForms() throws Exception {
        ParseResult r = parser.parse(new String[] { "--count=3", "-v",
            "-Da=1", "--define", "b=2", "file.txt" });
        assertEquals(Integer.valueOf(3), r.get(count));
        assertTrue(r.get(verbose));
        assertEquals(Arrays.asList(new KeyValue("a", "1"),
                                   new KeyValue("b", "2")), r.get(defines));
        assertEquals(new File("file.txt"), r.get(input));
    }

    @Test
    public void shortOptionClusters() throws Exception {
        ParseResult r = parser.parse(new String[] { "-vn", "5" });
        assertTrue(r.get(verbose));
        assertEquals(Integer.valueOf(5), r.get(count));
        r = parser.parse(new String[] { "-vn7" });
        assertEquals(Integer.valueOf(7), r.get(count));
    }

    @Test
    public void dashIsPositional() throws Exception {
        assertEquals(new File("-"),
                     parser.parse(new String[] { "-" }).get(input));
        assertEquals(new File("-v"),
                     parser.parse(new String[] { "--", "-v" }).get(input));
    }

    @Test
    public void errors() {
        assertThrows(ParsingException.class,
            () -> parser.parse(new String[] { "--bogus" }));
        assertThrows(ParsingException.class,
            () -> parser.parse(new String[] { "-x" }));
        assertThrows(ParsingException.class,
            () -> parser.parse(new String[] { "-n" }));
        assertThrows(ParsingException.class,
            () -> parser.parse(new String[] { "--verbose=yes" }));
        assertThrows(ParsingException.class,
            () -> parser.parse(new String[] { "a", "b" }));
        ParsingException exc = assertThrows(ParsingException.class,
            () -> parser.parse(new String[] { "-n", "many" }));
        assertEquals("Invalid integer: many for option --count",
                     exc.getMessage());
        assertThrows(ParsingException.class,
            () -> parser.parse(new String[] { "-D", "novalue" }));
    }

    @Test
    public void requiredArguments() {
        ArgumentParser p = new ArgumentParser("prog", null, null);
        p.add(Argument.of(String.class, "name", "A name.").required());
        ParsingException exc = assertThrows(ParsingException.class,
            () -> p.parse(new String[0]));
        assertEquals("Missing required argument <name>", exc.getMessage());
    }

    @Test
    public void duplicatesAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> parser.add(Option.flag("verbose", null, "Again.")));
        assertThrows(IllegalArgumentException.class,
            () -> parser.add(Option.flag("other", 'v', "Clash.")));
    }

    @Test
    public void usageAndHelp() {
        parser.addStandardOptions();
        assertEquals("USAGE: prog [-n <INT>] [-v] [-D <KEY>=<VALUE>] " +
                     "[-?] [-V] [<input>]", parser.formatUsageLine());
        String help = parser.formatFullHelp();
        assertTrue(help.startsWith(parser.formatUsageLine() +
                                   "\nTest program.\n"));
        assertTrue(help.contains("--count"));
        assertTrue(help.contains("may be repeated"));
    }

}
