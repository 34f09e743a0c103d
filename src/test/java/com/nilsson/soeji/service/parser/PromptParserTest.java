package com.nilsson.soeji.service.parser;

import com.nilsson.soeji.model.GenerationMetadata;
import com.nilsson.soeji.model.TagSource;
import com.nilsson.soeji.model.WeightedTag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 Unit tests for {@link PromptParser}: the weight grammar, group expansion and the cross-field
 merge of a full NovelAI comment.
 */
class PromptParserTest {

    private static final double DELTA = 1e-9;

    private final PromptParser parser = new PromptParser();

    // ------------------------------------------------------------------------
    // Weight grammar
    // ------------------------------------------------------------------------

    @Test
    void testParseTagWeight_braces() {
        ParsedTag emphasized = PromptParser.parseTagWeight("{{long hair}}");
        ParsedTag deemphasized = PromptParser.parseTagWeight("[[[smile]]]");

        assertEquals("long_hair", emphasized.getName());
        assertEquals(1.05 * 1.05, emphasized.getWeight(), DELTA);
        assertEquals("smile", deemphasized.getName());
        assertEquals(Math.pow(0.95, 3), deemphasized.getWeight(), DELTA);
    }

    @Test
    void testParseTagWeight_curlyTakesPrecedenceOverSquare() {
        ParsedTag mixed = PromptParser.parseTagWeight("{[tag]}");

        assertEquals("tag", mixed.getName());
        assertEquals(1.05, mixed.getWeight(), DELTA);
    }

    @Test
    void testParseTagWeight_explicitWeight() {
        ParsedTag strong = PromptParser.parseTagWeight("1.5::Red Eyes::");
        ParsedTag negative = PromptParser.parseTagWeight("-2::bad anatomy::");
        ParsedTag bare = PromptParser.parseTagWeight("::plain::");

        assertEquals("red_eyes", strong.getName());
        assertEquals(1.5, strong.getWeight(), DELTA);
        assertFalse(strong.isNegative());

        assertEquals("bad_anatomy", negative.getName());
        assertEquals(2.0, negative.getWeight(), DELTA);
        assertTrue(negative.isNegative());

        assertEquals("plain", bare.getName());
        assertEquals(1.0, bare.getWeight(), DELTA);
    }

    @Test
    void testParseTagWeight_normalizesWhitespaceAndCase() {
        ParsedTag tag = PromptParser.parseTagWeight("  Looking   At\tViewer ");

        assertEquals("looking_at_viewer", tag.getName());
        assertEquals(1.0, tag.getWeight(), DELTA);
    }

    @Test
    void testParseTagWeight_rejectsEmptyAndNumericFragments() {
        assertNull(PromptParser.parseTagWeight(""));
        assertNull(PromptParser.parseTagWeight("   "));
        assertNull(PromptParser.parseTagWeight("{}"));
        assertNull(PromptParser.parseTagWeight("1.5"));
        assertNull(PromptParser.parseTagWeight("-0.5 + 2"));
        assertNull(PromptParser.parseTagWeight(null));
    }

    // ------------------------------------------------------------------------
    // Group expansion
    // ------------------------------------------------------------------------

    @Test
    void testExpandControlSyntax_groups() {
        assertEquals("{{a}}, {{b}}", PromptParser.expandControlSyntax("{{a, b}}"));
        assertEquals("[c], [d]", PromptParser.expandControlSyntax("[c, d]"));
        assertEquals("2::a::, 2::b::", PromptParser.expandControlSyntax("2::a, b::"));
    }

    @Test
    void testExpandControlSyntax_leavesUnbalancedAndSingleTagGroups() {
        assertEquals("{{a, b}", PromptParser.expandControlSyntax("{{a, b}"));
        assertEquals("{{solo}}", PromptParser.expandControlSyntax("{{solo}}"));
    }

    @Test
    void testExtractWeightedTags_dedupesWithinField() {
        List<WeightedTag> tags = PromptParser.extractWeightedTags("cat, {cat}, dog, , 1.2", TagSource.PROMPT, false);

        assertEquals(List.of("cat", "dog"), names(tags));
        assertEquals(1.0, tags.get(0).getWeight(), DELTA);
    }

    @Test
    void testExtractWeightedTags_negativeFieldMarksEverything() {
        List<WeightedTag> tags = PromptParser.extractWeightedTags("lowres, 2::blurry::", TagSource.NEGATIVE, true);

        assertTrue(tags.stream().allMatch(WeightedTag::isNegative));
        assertEquals(2.0, tags.get(1).getWeight(), DELTA);
    }

    // ------------------------------------------------------------------------
    // Full comments
    // ------------------------------------------------------------------------

    @Test
    void testParse_fullNovelAIComment() {
        String comment = """
                {
                  "prompt": "1girl, {{long hair}}, 1girl",
                  "uc": "lowres, 1girl",
                  "seed": 3000000000,
                  "steps": 28,
                  "scale": 5.0,
                  "sampler": "k_euler_ancestral",
                  "width": 832,
                  "height": 1216,
                  "v4_prompt": {
                    "caption": {
                      "base_caption": "1girl, smile",
                      "char_captions": [
                        {"char_caption": "girl, red eyes", "centers": [{"x": 0.5, "y": 0.5}]}
                      ]
                    }
                  }
                }
                """;

        GenerationMetadata metadata = parser.parse(comment);

        assertEquals("1girl, {{long hair}}, 1girl", metadata.getPrompt());
        assertEquals("lowres, 1girl", metadata.getNegativePrompt());
        assertEquals(3000000000L, metadata.getSeed());
        assertEquals(28, metadata.getSteps());
        assertEquals(5.0, metadata.getScale(), DELTA);
        assertEquals("k_euler_ancestral", metadata.getSampler());
        assertEquals(832, metadata.getWidth());
        assertEquals(1216, metadata.getHeight());
        assertEquals("1girl, smile", metadata.getV4BaseCaption());
        assertEquals(1, metadata.getV4CharCaptions().size());
        assertEquals(0.5, metadata.getV4CharCaptions().get(0).getCenters().get(0).getX(), DELTA);
        assertEquals(comment, metadata.getRawComment());

        List<WeightedTag> tags = metadata.getTags();
        assertEquals(List.of("1girl", "long_hair", "smile", "girl", "red_eyes", "lowres"), names(tags));
        assertEquals(TagSource.PROMPT, tags.get(0).getSource());
        assertFalse(tags.get(0).isNegative(), "positive use wins over the later negative one");
        assertEquals(TagSource.V4_BASE, tags.get(2).getSource());
        assertEquals(TagSource.V4_CHAR, tags.get(4).getSource());
        assertEquals(TagSource.NEGATIVE, tags.get(5).getSource());
        assertTrue(tags.get(5).isNegative());
    }

    @Test
    void testParse_negativeFallsBackToV4NegativeCaption() {
        String comment = "{\"prompt\":\"cat\",\"v4_negative_prompt\":{\"caption\":{\"base_caption\":\"bad hands\"}}}";

        GenerationMetadata metadata = parser.parse(comment);

        assertEquals("bad hands", metadata.getNegativePrompt());
        assertEquals(List.of("cat", "bad_hands"), names(metadata.getTags()));
        assertTrue(metadata.getTags().get(1).isNegative());
    }

    @Test
    void testParse_nonJsonKeepsRawText() {
        GenerationMetadata text = parser.parse("masterpiece, 1girl");
        GenerationMetadata array = parser.parse("[1, 2, 3]");
        GenerationMetadata nothing = parser.parse(null);

        assertTrue(text.isEmpty());
        assertEquals("masterpiece, 1girl", text.getRawComment());
        assertTrue(array.isEmpty());
        assertEquals("[1, 2, 3]", array.getRawComment());
        assertTrue(nothing.isEmpty());
        assertEquals("", nothing.getRawComment());
    }

    @Test
    void testParse_wrongFieldTypesAreIgnored() {
        GenerationMetadata metadata = parser.parse("{\"prompt\": 42, \"seed\": \"abc\", \"steps\": 20}");

        assertNull(metadata.getPrompt());
        assertNull(metadata.getSeed());
        assertEquals(20, metadata.getSteps());
        assertTrue(metadata.getTags().isEmpty());
    }

    private static List<String> names(List<WeightedTag> tags) {
        return tags.stream().map(WeightedTag::getName).collect(Collectors.toList());
    }
}
