package com.contextsmith.ahocorasick.tools;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class AhoCorasickMainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String input, String... args) throws Exception {
        InputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
        return AhoCorasickMain.run(args, in, new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"));
    }

    private String output() throws Exception {
        return out.toString("UTF-8");
    }

    @Test
    public void testScanTextFile() throws Exception {
        assertEquals(AhoCorasickMain.EXIT_OK, run("", "--patterns", "keywords.txt", "--text", "ushers.txt"));
        String output = output();
        assertTrue(output, output.contains("1\t4\tshe"));
        assertTrue(output, output.contains("2\t4\the"));
        assertTrue(output, output.contains("2\t6\thers"));
        assertTrue(output, output.contains("11\t14\this"));
        assertTrue(output, output.contains("15\t19\thers"));
        assertTrue(output, output.contains("Found 6 match(es)!"));
    }

    @Test
    public void testDeterministicFlag() throws Exception {
        assertEquals(AhoCorasickMain.EXIT_OK, run("", "-p", "keywords.txt", "-t", "ushers.txt", "-d"));
        assertTrue(output().contains("Found 6 match(es)!"));
    }

    @Test
    public void testInteractive() throws Exception {
        assertEquals(AhoCorasickMain.EXIT_OK, run("ushers\nnothing at all\nexit\nhe\n", "--patterns", "keywords.txt"));
        String output = output();
        assertTrue(output, output.contains("Found 3 match(es)!"));
        assertTrue(output, output.contains("Found 0 match(es)!"));
        assertFalse(output, output.contains("Found 1 match(es)!"));
    }

    @Test
    public void testExitIgnoresCase() throws Exception {
        assertEquals(AhoCorasickMain.EXIT_OK, run("EXIT\nushers\n", "--patterns", "keywords.txt"));
        assertFalse(output().contains("match(es)!"));
    }

    @Test
    public void testUsage() throws Exception {
        assertEquals(AhoCorasickMain.EXIT_USAGE, run("", "--text", "ushers.txt"));
        assertTrue(err.toString("UTF-8").contains(AhoCorasickMain.USAGE));
    }

    @Test
    public void testUnknownArgument() throws Exception {
        assertEquals(AhoCorasickMain.EXIT_USAGE, run("", "--patterns", "keywords.txt", "--verbose"));
        assertTrue(err.toString("UTF-8").contains("--verbose"));
    }

    @Test
    public void testMissingDictionary() throws Exception {
        assertEquals(AhoCorasickMain.EXIT_ERROR, run("", "--patterns", "missing-keywords.txt"));
        assertTrue(err.toString("UTF-8").contains("Could not locate: missing-keywords.txt"));
    }
}
