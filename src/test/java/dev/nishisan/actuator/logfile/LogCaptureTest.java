package dev.nishisan.actuator.logfile;

import dev.nishisan.actuator.common.InvalidArgumentException;
import dev.nishisan.actuator.common.RangeNotSatisfiableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogCaptureTest {

    private LogCapture capture;

    @BeforeEach
    void setUp() {
        capture = new LogCapture();
        capture.append("first line");
        capture.append("second line");
    }

    @Test
    void rangeReportsCapturedLength() {
        // two lines plus their terminators
        long expected = "first line\nsecond line\n".length();
        LogFileRange range = capture.getRange();

        assertEquals(0, range.start());
        assertEquals(expected, range.end());
        assertEquals(expected, range.total());
    }

    @Test
    void openEndedRangeReturnsWholeLog() {
        LogSlice slice = capture.getLogfile("bytes=0-");

        assertEquals("first line\nsecond line\n", slice.contentAsString());
        assertEquals(0, slice.start());
        assertEquals(22, slice.end());
        assertEquals(23, slice.total());
        assertEquals("bytes 0-22/22", slice.contentRange());
    }

    @Test
    void suffixRangeReturnsTail() {
        LogSlice slice = capture.getLogfile("bytes=-5");

        assertEquals("line\n", slice.contentAsString());
        assertEquals(18, slice.start());
        assertEquals(22, slice.end());
    }

    @Test
    void suffixLongerThanLogReturnsWholeLog() {
        LogSlice slice = capture.getLogfile("bytes=-1000");

        assertEquals(0, slice.start());
        assertEquals("first line\nsecond line\n", slice.contentAsString());
    }

    @Test
    void closedRangeIsInclusive() {
        LogSlice slice = capture.getLogfile("bytes=0-4");

        assertEquals("first", slice.contentAsString());
        assertEquals("bytes 0-4/4", slice.contentRange());
    }

    @Test
    void endBeyondLengthIsClamped() {
        LogSlice slice = capture.getLogfile("bytes=11-500");

        assertEquals("second line\n", slice.contentAsString());
        assertEquals(22, slice.end());
    }

    @Test
    void startBeyondLengthIsNotSatisfiable() {
        RangeNotSatisfiableException e = assertThrows(RangeNotSatisfiableException.class,
                () -> capture.getLogfile("bytes=100-"));
        assertEquals(23, e.totalLength());
    }

    @Test
    void emptyLogIsNotSatisfiable() {
        LogCapture empty = new LogCapture();
        assertThrows(RangeNotSatisfiableException.class, () -> empty.getLogfile("bytes=0-"));
        assertThrows(RangeNotSatisfiableException.class, () -> empty.getLogfile("bytes=-10"));
    }

    @Test
    void malformedHeadersAreRejected() {
        assertThrows(InvalidArgumentException.class, () -> capture.getLogfile(""));
        assertThrows(InvalidArgumentException.class, () -> capture.getLogfile("bytes=-"));
        assertThrows(InvalidArgumentException.class, () -> capture.getLogfile("lines=0-10"));
        assertThrows(InvalidArgumentException.class, () -> capture.getLogfile("bytes=0-1,5-9"));
        assertThrows(InvalidArgumentException.class, () -> capture.getLogfile("bytes=99999999999999999999-"));
    }

    @Test
    void multiByteCharactersAreCountedInBytes() {
        LogCapture utf = new LogCapture();
        utf.append("ação");

        // "ação" is 6 bytes in UTF-8, plus the newline
        assertEquals(7, utf.length());
        assertEquals("ação\n", utf.getLogfile("bytes=0-").contentAsString());
    }

    @Test
    void resetDiscardsContent() {
        capture.reset();
        assertEquals(0, capture.length());
    }
}
