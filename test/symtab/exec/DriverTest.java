package symtab.exec;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import symtab.hir.FunDec;
import symtab.hir.Program;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;

import static org.junit.Assert.*;

public class DriverTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final Driver driver =
            new Driver(new Program(Collections.<FunDec>emptyList()));

    @After
    public void tearDown() {
        Driver.setOptionValue("verbosity", "0");
        Driver.setOptionValue("range", "1");
        Driver.setOptionValue("help", null);
    }

    @Test
    public void testParseCommandLine() {
        assertTrue(driver.parseCommandLine(
                new String[] {"-verbosity=2", "-range=0"}));
        assertEquals("2", Driver.getOptionValue("verbosity"));
        assertEquals("0", Driver.getOptionValue("range"));
    }

    @Test
    public void testFlagWithoutValue() {
        assertTrue(driver.parseCommandLine(new String[] {"-range"}));
        assertEquals("1", Driver.getOptionValue("range"));
    }

    @Test
    public void testUnrecognizedOptionsIgnored() {
        assertTrue(driver.parseCommandLine(
                new String[] {"-no-such-option=3", "stray", "-verbosity=1"}));
        assertNull(Driver.getOptionValue("no-such-option"));
        assertEquals("1", Driver.getOptionValue("verbosity"));
    }

    @Test
    public void testHelpStopsTheRun() {
        assertFalse(driver.parseCommandLine(new String[] {"-help"}));
        assertNull(Driver.getOptionValue("help"));
    }

    @Test
    public void testIntOptionValue() {
        Driver.setOptionValue("range", "0");
        assertEquals(0, Driver.getIntOptionValue("range", 1));
        Driver.setOptionValue("range", "often");
        assertEquals(1, Driver.getIntOptionValue("range", 1));
        assertEquals(7, Driver.getIntOptionValue("no-such-option", 7));
    }

    @Test
    public void testOptionsFileRoundTrip() throws IOException {
        File options_file = new File(folder.getRoot(), "options");
        Driver.setOptionValue("verbosity", "3");
        driver.dumpOptionsFile(options_file);
        assertTrue(options_file.exists());

        Driver.setOptionValue("verbosity", "0");
        driver.loadOptionsFile(options_file);
        assertEquals("3", Driver.getOptionValue("verbosity"));
        assertEquals("1", Driver.getOptionValue("range"));
    }

    @Test
    public void testDumpKeepsExistingFile() throws IOException {
        File options_file = folder.newFile("existing");
        FileWriter writer = new FileWriter(options_file);
        writer.write("range=0\n");
        writer.close();

        driver.dumpOptionsFile(options_file);
        String content = new String(Files.readAllBytes(options_file.toPath()),
                                    StandardCharsets.UTF_8);
        assertEquals("range=0\n", content);
    }

    @Test
    public void testLoadMissingFile() {
        driver.loadOptionsFile(new File(folder.getRoot(), "missing"));
        assertEquals("1", Driver.getOptionValue("range"));
    }

    @Test
    public void testRun() {
        driver.run(new String[] {"-range=0"});
        assertNotNull(driver.getRangePropagation());
        assertTrue(driver.getRangePropagation().getSafeIndexings().isEmpty());
    }

    @Test
    public void testRunWithHelpRunsNoPass() {
        driver.run(new String[] {"-help"});
        assertNull(driver.getRangePropagation());
    }
}
