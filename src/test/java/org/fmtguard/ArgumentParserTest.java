package org.fmtguard;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class ArgumentParserTest {

    @Test
    public void testAllOptions() {
        ArgumentParser.CheckerOptions options = ArgumentParser.parseArguments(
                new String[]{"--optimize", "opt.c", "--typecast=cast.c", "-dj", "main.c"});
        assertEquals("main.c", options.fileName);
        assertEquals(Paths.get("opt.c"), options.optimizePath);
        assertEquals(Paths.get("cast.c"), options.typecastPath);
        assertTrue(options.debug);
        assertTrue(options.json);
        assertFalse(options.help);
    }

    @Test
    public void testDefaults() {
        ArgumentParser.CheckerOptions options = ArgumentParser.parseArguments(new String[]{"main.c"});
        assertNull(options.optimizePath);
        assertNull(options.typecastPath);
        assertFalse(options.json);
        assertFalse(options.debug);
    }

    @Test
    public void testHelpAndVersionNeedNoFile() {
        assertTrue(ArgumentParser.parseArguments(new String[]{"--help"}).help);
        assertTrue(ArgumentParser.parseArguments(new String[]{"-v"}).version);
    }

    @Test
    public void testDoubleDashEndsOptions() {
        ArgumentParser.CheckerOptions options = ArgumentParser.parseArguments(new String[]{"--", "-odd.c"});
        assertEquals("-odd.c", options.fileName);
    }

    @Test
    public void testStandardInput() {
        assertEquals("-", ArgumentParser.parseArguments(new String[]{"-"}).fileName);
    }

    @Test
    public void testInvalidCommandLines() {
        assertThrows(UsageException.class, () -> ArgumentParser.parseArguments(new String[0]));
        assertThrows(UsageException.class, () -> ArgumentParser.parseArguments(new String[]{"a.c", "b.c"}));
        assertThrows(UsageException.class, () -> ArgumentParser.parseArguments(new String[]{"--frobnicate", "a.c"}));
        assertThrows(UsageException.class, () -> ArgumentParser.parseArguments(new String[]{"-x", "a.c"}));
        assertThrows(UsageException.class, () -> ArgumentParser.parseArguments(new String[]{"a.c", "--optimize"}));
        assertThrows(UsageException.class, () -> ArgumentParser.parseArguments(new String[]{"--json=yes", "a.c"}));
    }

    @Test
    public void testErrorMessage() {
        UsageException e = assertThrows(UsageException.class,
                () -> ArgumentParser.parseArguments(new String[]{"--typecast"}));
        assertEquals("Option --typecast requires a path", e.getMessage());
    }
}
