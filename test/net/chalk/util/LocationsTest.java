package net.chalk.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import net.chalk.parser.TextLocation;
import org.junit.jupiter.api.Test;

public class LocationsTest {

    @Test
    public void tracksLinesAndColumns() {
        Locations.LocationTracker tr = new Locations.LocationTracker();
        tr.advance("ab\ncd", 0, 4);
        assertEquals(2, tr.getLine());
        assertEquals(2, tr.getColumn());
        assertEquals(4, tr.getCharacterIndex());
    }

    @Test
    public void crlfCountsAsOneLineBreak() {
        Locations.LocationTracker tr = new Locations.LocationTracker();
        tr.advance("a\r\nb\rc", 0, 6);
        assertEquals(3, tr.getLine());
        assertEquals(2, tr.getColumn());
    }

    @Test
    public void tabsAdvanceToNextStop() {
        Locations.LocationTracker tr = new Locations.LocationTracker(4);
        tr.advance('\t');
        assertEquals(5, tr.getColumn());
        tr.advance('x');
        tr.advance('\t');
        assertEquals(9, tr.getColumn());
    }

    @Test
    public void snapshotsAreFrozen() {
        Locations.LocationTracker tr = new Locations.LocationTracker();
        TextLocation before = tr.snapshot();
        tr.advance('x');
        assertEquals(new Locations.FixedLocation(1, 1, 0), before);
        assertEquals("line 1 column 2 (char 1)", tr.snapshot().toString());
    }

}
