package me.golemcore.memory.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FactChunkParserTest {

    private static final String TEN_WORDS = "User is Brazilian and recently moved to Tokyo for work.";

    private final FactChunkParser parser = new FactChunkParser("|", 10, 200);

    @Test
    void splitsTrimsAndDropsEmptyFragments() {
        assertEquals(List.of("a", "b c", "d"), parser.split("  a | b c ||  | d |"));
    }

    @Test
    void blankOrNullInputYieldsNothing() {
        assertTrue(parser.split(null).isEmpty());
        assertTrue(parser.split("   ").isEmpty());
        assertTrue(parser.parse("|||").isEmpty());
    }

    @Test
    void outputWithoutDelimiterIsOneCandidate() {
        assertEquals(List.of(TEN_WORDS), parser.parse(TEN_WORDS));
    }

    @Test
    void appliesInclusiveWordBounds() {
        String nineWords = "one two three four five six seven eight nine";
        String tenWords = nineWords + " ten";
        String twoHundred = "word ".repeat(200).trim();
        String twoHundredOne = "word ".repeat(201).trim();

        List<String> parsed = parser.parse(String.join(" | ", nineWords, tenWords, twoHundred, twoHundredOne));

        assertEquals(List.of(tenWords, twoHundred), parsed);
    }

    @Test
    void everyParsedFragmentRespectsBounds() {
        String raw = "short | " + TEN_WORDS + " | " + "x ".repeat(250) + " | tiny fact here";

        for (String fragment : parser.parse(raw)) {
            int words = FactChunkParser.wordCount(fragment);
            assertTrue(words >= 10 && words <= 200, fragment);
        }
    }

    @Test
    void wordCountCollapsesWhitespace() {
        assertEquals(0, FactChunkParser.wordCount("   "));
        assertEquals(3, FactChunkParser.wordCount("  a\tb \n c "));
    }

    @Test
    void multiCharacterDelimiterIsTakenLiterally() {
        FactChunkParser custom = new FactChunkParser("||", 1, 10);

        assertEquals(List.of("a | b", "c"), custom.parse("a | b || c"));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new FactChunkParser("", 10, 200));
        assertThrows(IllegalArgumentException.class, () -> new FactChunkParser("|", 20, 10));
    }
}
