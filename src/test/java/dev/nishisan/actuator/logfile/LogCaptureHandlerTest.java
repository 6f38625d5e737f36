package dev.nishisan.actuator.logfile;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class LogCaptureHandlerTest {

    private final Logger logger = Logger.getLogger("dev.nishisan.actuator.test.capture");
    private LogCapture capture;
    private LogCaptureHandler handler;

    @BeforeEach
    void setUp() {
        capture = new LogCapture();
        handler = new LogCaptureHandler(capture);
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.ALL);
        logger.addHandler(handler);
    }

    @AfterEach
    void tearDown() {
        logger.removeHandler(handler);
        logger.setUseParentHandlers(true);
        logger.setLevel(null);
    }

    @Test
    void capturesFormattedLines() {
        logger.info("hello capture");
        logger.warning("second message");

        String content = capture.getLogfile("bytes=0-").contentAsString();
        String[] lines = content.split("\n");
        assertEquals(2, lines.length);
        assertTrue(lines[0].contains("INFO"), lines[0]);
        assertTrue(lines[0].contains("dev.nishisan.actuator.test.capture"), lines[0]);
        assertTrue(lines[0].endsWith("hello capture"), lines[0]);
        assertTrue(lines[1].contains("WARNING"), lines[1]);
    }

    @Test
    void includesStackTraceOfThrown() {
        logger.log(Level.SEVERE, "boom", new IllegalStateException("bad state"));

        String content = capture.getLogfile("bytes=0-").contentAsString();
        assertTrue(content.contains("boom"));
        assertTrue(content.contains("java.lang.IllegalStateException: bad state"));
    }

    @Test
    void respectsHandlerLevel() {
        handler.setLevel(Level.WARNING);
        logger.info("filtered");
        logger.warning("kept");

        String content = capture.getLogfile("bytes=0-").contentAsString();
        assertFalse(content.contains("filtered"));
        assertTrue(content.contains("kept"));
    }

    @Test
    void closedHandlerStopsCapturing() {
        handler.close();
        logger.severe("after close");

        assertEquals(0, capture.length());
    }

    @Test
    void customPatternIsApplied() {
        LogCapture custom = new LogCapture();
        LogCaptureHandler patterned = new LogCaptureHandler(custom, new LogLineFormatter("[%2$s] %5$s"), Level.ALL);
        logger.addHandler(patterned);
        try {
            logger.info("plain");
        } finally {
            logger.removeHandler(patterned);
        }

        assertEquals("[INFO] plain\n", custom.getLogfile("bytes=0-").contentAsString());
    }
}
