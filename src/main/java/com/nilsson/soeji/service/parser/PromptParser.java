package com.nilsson.soeji.service.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nilsson.soeji.model.CharCaption;
import com.nilsson.soeji.model.GenerationMetadata;
import com.nilsson.soeji.model.TagSource;
import com.nilsson.soeji.model.WeightedTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 <h2>PromptParser</h2>
 <p>
 Turns the JSON comment NovelAI writes into a PNG into a {@link GenerationMetadata} record,
 extracting weighted tags from every prompt-bearing field.
 </p>

 <h3>Tag grammar:</h3>
 <ul>
 <li><b>Emphasis:</b> {@code {tag}} multiplies the weight by 1.05 per brace level.</li>
 <li><b>De-emphasis:</b> {@code [tag]} multiplies the weight by 0.95 per bracket level.</li>
 <li><b>Explicit weight:</b> {@code 1.5::tag::}; a negative number marks the tag negative and
 the weight becomes its absolute value.</li>
 <li><b>Groups:</b> {@code {{a, b}}} and {@code -1::a, b::} apply to every comma-separated member.</li>
 </ul>

 <h3>Field order:</h3>
 <p>
 Fields are processed as prompt, v4 base caption, each v4 character caption, then the negative
 prompt. A tag name emitted by an earlier field is never emitted again by a later one.
 </p>
 <p>
 Parsing never fails: a comment that is not a JSON object yields an empty record that still
 carries the raw comment.
 </p>
 */
public class PromptParser {

    private static final Logger logger = LoggerFactory.getLogger(PromptParser.class);

    static final double EMPHASIS_MULTIPLIER = 1.05;
    static final double DEEMPHASIS_MULTIPLIER = 0.95;

    private static final Pattern EXPLICIT_GROUP = Pattern.compile("(-?\\d+(?:\\.\\d+)?)::((?:[^:]|:[^:])+)::");
    private static final Pattern CURLY_GROUP = Pattern.compile("(\\{+)([^{}]+)(\\}+)");
    private static final Pattern SQUARE_GROUP = Pattern.compile("(\\[+)([^\\[\\]]+)(\\]+)");
    private static final Pattern EXPLICIT_WEIGHT = Pattern.compile("^(-?\\d+(?:\\.\\d+)?)?::(.+)::$");
    private static final Pattern NUMERIC_FRAGMENT = Pattern.compile("^[\\d\\s.+-]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final ObjectMapper mapper;

    public PromptParser() {
        this(new ObjectMapper());
    }

    public PromptParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // --- Public API ---

    public GenerationMetadata parse(String rawComment) {
        String raw = rawComment == null ? "" : rawComment;

        JsonNode root;
        try {
            root = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).readTree(raw);
        } catch (JsonProcessingException e) {
            logger.debug("Comment is not JSON, keeping raw text only: {}", e.getOriginalMessage());
            return GenerationMetadata.empty(raw);
        }
        if (root == null || !root.isObject()) {
            return GenerationMetadata.empty(raw);
        }

        GenerationMetadata metadata = GenerationMetadata.empty(raw);
        String prompt = text(root, "prompt");
        JsonNode caption = root.path("v4_prompt").path("caption");
        String baseCaption = text(caption, "base_caption");
        List<CharCaption> charCaptions = charCaptions(caption.get("char_captions"));
        String uc = text(root, "uc");
        String negativeBase = text(root.path("v4_negative_prompt").path("caption"), "base_caption");

        Map<String, WeightedTag> merged = new LinkedHashMap<>();
        if (isPresent(prompt)) {
            addAll(merged, extractWeightedTags(prompt, TagSource.PROMPT, false));
        }
        if (isPresent(baseCaption)) {
            addAll(merged, extractWeightedTags(baseCaption, TagSource.V4_BASE, false));
        }
        if (charCaptions != null) {
            for (CharCaption charCaption : charCaptions) {
                if (isPresent(charCaption.getCharCaption())) {
                    addAll(merged, extractWeightedTags(charCaption.getCharCaption(), TagSource.V4_CHAR, false));
                }
            }
        }
        if (isPresent(uc)) {
            addAll(merged, extractWeightedTags(uc, TagSource.NEGATIVE, true));
        } else if (isPresent(negativeBase)) {
            addAll(merged, extractWeightedTags(negativeBase, TagSource.NEGATIVE, true));
        }

        metadata.setPrompt(prompt);
        metadata.setSeed(longValue(root.get("seed")));
        metadata.setSteps(intValue(root.get("steps")));
        metadata.setScale(doubleValue(root.get("scale")));
        metadata.setWidth(intValue(root.get("width")));
        metadata.setHeight(intValue(root.get("height")));
        metadata.setSampler(text(root, "sampler"));
        metadata.setV4BaseCaption(baseCaption);
        metadata.setV4CharCaptions(charCaptions);
        metadata.setNegativePrompt(uc != null ? uc : negativeBase);
        metadata.setTags(new ArrayList<>(merged.values()));
        return metadata;
    }

    /**
     Extracts the tags of one prompt field. Duplicate names within the field keep their first
     occurrence. When {@code negativeField} is set every tag is marked negative regardless of
     its own syntax.
     */
    public static List<WeightedTag> extractWeightedTags(String prompt, TagSource source, boolean negativeField) {
        if (prompt == null || prompt.isEmpty()) return Collections.emptyList();

        List<WeightedTag> tags = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String part : expandControlSyntax(prompt).split(",")) {
            ParsedTag parsed = parseTagWeight(part);
            if (parsed == null || !seen.add(parsed.getName())) continue;
            tags.add(new WeightedTag(parsed.getName(), parsed.getWeight(), negativeField || parsed.isNegative(), source));
        }
        return tags;
    }

    /**
     Rewrites comma-grouped weight and bracket expressions so that every comma-separated
     segment names exactly one tag. Groups without a comma, and bracket runs whose opening and
     closing depth differ, are left untouched.
     */
    public static String expandControlSyntax(String prompt) {
        String result = replaceAll(EXPLICIT_GROUP, prompt, m -> {
            String weight = m.group(1);
            return splitGroup(m.group(2)).stream()
                    .map(tag -> weight + "::" + tag + "::")
                    .collect(Collectors.joining(", "));
        });
        result = expandBrackets(result, CURLY_GROUP);
        return expandBrackets(result, SQUARE_GROUP);
    }

    /**
     Extracts name and weight from one prompt segment.

     @return the parsed tag, or {@code null} when nothing tag-like remains after stripping syntax
     */
    public static ParsedTag parseTagWeight(String part) {
        if (part == null) return null;
        String tagName = part.strip();
        if (tagName.isEmpty()) return null;

        double weight = 1.0;
        boolean negative = false;

        Matcher explicit = EXPLICIT_WEIGHT.matcher(tagName);
        if (explicit.matches()) {
            String weightText = explicit.group(1);
            tagName = explicit.group(2).strip();
            if (weightText != null && !weightText.isEmpty()) {
                double value = Double.parseDouble(weightText);
                negative = value < 0;
                weight = Math.abs(value);
            }
        } else {
            int curly = 0;
            while (tagName.startsWith("{") && tagName.endsWith("}")) {
                tagName = unwrap(tagName);
                curly++;
            }
            int square = 0;
            while (tagName.startsWith("[") && tagName.endsWith("]")) {
                tagName = unwrap(tagName);
                square++;
            }
            if (curly > 0) {
                weight = Math.pow(EMPHASIS_MULTIPLIER, curly);
            } else if (square > 0) {
                weight = Math.pow(DEEMPHASIS_MULTIPLIER, square);
            }
        }

        tagName = tagName.strip();
        if (tagName.isEmpty() || NUMERIC_FRAGMENT.matcher(tagName).matches()) {
            return null;
        }

        String normalized = WHITESPACE.matcher(tagName.toLowerCase(Locale.ROOT)).replaceAll("_");
        if (normalized.isEmpty()) return null;
        return new ParsedTag(normalized, weight, negative);
    }

    private static String unwrap(String text) {
        return text.length() < 2 ? "" : text.substring(1, text.length() - 1);
    }

    // --- Expansion Helpers ---

    private static String expandBrackets(String input, Pattern group) {
        return replaceAll(group, input, m -> {
            String open = m.group(1);
            String content = m.group(2);
            String close = m.group(3);
            if (!content.contains(",") || open.length() != close.length()) {
                return m.group();
            }
            return splitGroup(content).stream()
                    .map(tag -> open + tag + close)
                    .collect(Collectors.joining(", "));
        });
    }

    private static List<String> splitGroup(String content) {
        return Arrays.stream(content.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static String replaceAll(Pattern pattern, String input, java.util.function.Function<Matcher, String> replacer) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacer.apply(matcher)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    // --- JSON Helpers ---

    private static void addAll(Map<String, WeightedTag> merged, List<WeightedTag> tags) {
        for (WeightedTag tag : tags) {
            merged.putIfAbsent(tag.getName(), tag);
        }
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static Long longValue(JsonNode node) {
        if (node == null || !node.isNumber() || !node.canConvertToLong()) return null;
        return node.longValue();
    }

    private static Integer intValue(JsonNode node) {
        if (node == null || !node.isNumber() || !node.canConvertToInt()) return null;
        return node.intValue();
    }

    private static Double doubleValue(JsonNode node) {
        if (node == null || !node.isNumber()) return null;
        return node.doubleValue();
    }

    private static List<CharCaption> charCaptions(JsonNode node) {
        if (node == null || !node.isArray()) return null;
        List<CharCaption> captions = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isObject()) continue;
            List<CharCaption.Center> centers = new ArrayList<>();
            for (JsonNode center : item.path("centers")) {
                if (center.isObject()) {
                    centers.add(new CharCaption.Center(center.path("x").asDouble(), center.path("y").asDouble()));
                }
            }
            captions.add(new CharCaption(text(item, "char_caption"), centers));
        }
        return captions;
    }
}
