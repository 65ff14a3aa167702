package com.contextsmith.ahocorasick.keyword;

import org.junit.Test;

import static org.junit.Assert.*;

public class KeywordLineProcessorTest {

    @Test
    public void testProcessLine() throws Exception {
        KeywordMatcher matcher = new KeywordMatcher();
        KeywordLineProcessor processor = new KeywordLineProcessor(matcher);

        assertTrue(processor.processLine("  alpha  "));
        assertTrue(processor.processLine(""));
        assertTrue(processor.processLine("   "));
        assertTrue(processor.processLine("# beta"));
        assertTrue(processor.processLine("gamma\tvalue one\tvalue two"));
        assertTrue(processor.processLine("delta epsilon"));

        assertEquals(Integer.valueOf(3), processor.getResult());
        matcher.compile();
        assertTrue(matcher.contains("alpha"));
        assertTrue(matcher.contains("gamma"));
        assertTrue(matcher.contains("delta epsilon"));
        assertFalse(matcher.contains("# beta"));
        assertFalse(matcher.contains("value one"));
    }
}
