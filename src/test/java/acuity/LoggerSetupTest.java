package acuity;

import java.io.File;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.junit.Assume;
import org.junit.Test;
import static org.junit.Assert.*;

public class LoggerSetupTest {

    @Test
    public void logFileLocationComesFromTheSystemProperty() {
        String logFile = System.getProperty("acuity.logFile");
        Assume.assumeNotNull(logFile);

        assertEquals(logFile, Cfg.logFile);
        Logger logger = LoggerSetup.setupLogger(Level.CONFIG);

        boolean fileHandler = false;
        for (Handler handler : logger.getHandlers()) {
            fileHandler |= handler instanceof FileHandler;
            assertEquals(Level.CONFIG, handler.getLevel());
        }
        assertTrue(fileHandler);
        assertTrue(new File(logFile).isFile());
        assertFalse(new File(logFile).getAbsoluteFile().equals(new File("acuity.log").getAbsoluteFile()));
    }
}
