package com.nilsson.soeji.service.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.nilsson.soeji.model.CharCaption;
import com.nilsson.soeji.model.GenerationMetadata;
import com.nilsson.soeji.model.ImageRecord;
import com.nilsson.soeji.model.ImageTagRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 <h2>ImageDocument</h2>
 <p>
 Denormalized projection of an image for the {@code images} collection. The tag associations are
 partitioned into facet arrays:
 </p>
 <ul>
 <li>{@code tags}: every tag name.</li>
 <li>{@code userTags}: tags a user attached by hand.</li>
 <li>{@code negativeTags}: metadata tags from the negative prompt or with a negative weight.</li>
 <li>{@code positiveTags}: the remaining metadata tags.</li>
 </ul>
 <p>
 {@code weightedTags} keeps weight, sign and source of every association.
 </p>
 */
@JsonPropertyOrder({"id", "filename", "storageKey", "prompt", "v4BaseCaption", "v4CharCaptions",
        "tags", "positiveTags", "negativeTags", "userTags", "weightedTags",
        "seed", "width", "height", "hasLosslessDerivative", "createdAt"})
public final class ImageDocument {

    public static final String TAGS = "tags";
    public static final String POSITIVE_TAGS = "positiveTags";
    public static final String NEGATIVE_TAGS = "negativeTags";
    public static final String USER_TAGS = "userTags";
    public static final String WEIGHTED_TAGS = "weightedTags";
    public static final String HAS_LOSSLESS_DERIVATIVE = "hasLosslessDerivative";

    private final long id;
    private final String filename;
    private final String storageKey;
    private final String prompt;
    private final String v4BaseCaption;
    private final String v4CharCaptions;
    private final List<String> tags;
    private final List<String> positiveTags;
    private final List<String> negativeTags;
    private final List<String> userTags;
    private final List<WeightedTagDocument> weightedTags;
    private final Long seed;
    private final Integer width;
    private final Integer height;
    private final boolean hasLosslessDerivative;
    private final long createdAt;

    @JsonCreator
    public ImageDocument(@JsonProperty("id") long id,
                         @JsonProperty("filename") String filename,
                         @JsonProperty("storageKey") String storageKey,
                         @JsonProperty("prompt") String prompt,
                         @JsonProperty("v4BaseCaption") String v4BaseCaption,
                         @JsonProperty("v4CharCaptions") String v4CharCaptions,
                         @JsonProperty("tags") List<String> tags,
                         @JsonProperty("positiveTags") List<String> positiveTags,
                         @JsonProperty("negativeTags") List<String> negativeTags,
                         @JsonProperty("userTags") List<String> userTags,
                         @JsonProperty("weightedTags") List<WeightedTagDocument> weightedTags,
                         @JsonProperty("seed") Long seed,
                         @JsonProperty("width") Integer width,
                         @JsonProperty("height") Integer height,
                         @JsonProperty("hasLosslessDerivative") boolean hasLosslessDerivative,
                         @JsonProperty("createdAt") long createdAt) {
        this.id = id;
        this.filename = filename;
        this.storageKey = storageKey;
        this.prompt = prompt;
        this.v4BaseCaption = v4BaseCaption;
        this.v4CharCaptions = v4CharCaptions;
        this.tags = copy(tags);
        this.positiveTags = copy(positiveTags);
        this.negativeTags = copy(negativeTags);
        this.userTags = copy(userTags);
        this.weightedTags = weightedTags == null ? List.of() : List.copyOf(weightedTags);
        this.seed = seed;
        this.width = width;
        this.height = height;
        this.hasLosslessDerivative = hasLosslessDerivative;
        this.createdAt = createdAt;
    }

    /**
     Builds the document from an image loaded with its metadata and tag associations.
     */
    public static ImageDocument from(ImageRecord image) {
        List<String> all = new ArrayList<>();
        List<String> positive = new ArrayList<>();
        List<String> negative = new ArrayList<>();
        List<String> user = new ArrayList<>();
        List<WeightedTagDocument> weighted = new ArrayList<>();

        for (ImageTagRecord tag : image.getTags()) {
            all.add(tag.tagName);
            weighted.add(WeightedTagDocument.of(tag));
            if (tag.source.isUser()) {
                user.add(tag.tagName);
            } else if (tag.negative) {
                negative.add(tag.tagName);
            } else {
                positive.add(tag.tagName);
            }
        }

        GenerationMetadata metadata = image.getMetadata();
        return new ImageDocument(
                image.getId(),
                image.getFilename(),
                image.getStorageKey(),
                metadata == null ? null : metadata.getPrompt(),
                metadata == null ? null : metadata.getV4BaseCaption(),
                metadata == null ? null : joinCharCaptions(metadata.getV4CharCaptions()),
                all, positive, negative, user, weighted,
                metadata == null ? null : metadata.getSeed(),
                image.getWidth(),
                image.getHeight(),
                image.hasLosslessDerivative(),
                image.getCreatedAt().toEpochMilli());
    }

    static String joinCharCaptions(List<CharCaption> captions) {
        if (captions == null || captions.isEmpty()) return null;
        return captions.stream()
                .map(CharCaption::getCharCaption)
                .filter(Objects::nonNull)
                .collect(Collectors.joining("\n"));
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    // --- Accessors ---

    @JsonProperty("id")
    public long getId() {
        return id;
    }

    @JsonProperty("filename")
    public String getFilename() {
        return filename;
    }

    @JsonProperty("storageKey")
    public String getStorageKey() {
        return storageKey;
    }

    @JsonProperty("prompt")
    public String getPrompt() {
        return prompt;
    }

    @JsonProperty("v4BaseCaption")
    public String getV4BaseCaption() {
        return v4BaseCaption;
    }

    @JsonProperty("v4CharCaptions")
    public String getV4CharCaptions() {
        return v4CharCaptions;
    }

    @JsonProperty("tags")
    public List<String> getTags() {
        return tags;
    }

    @JsonProperty("positiveTags")
    public List<String> getPositiveTags() {
        return positiveTags;
    }

    @JsonProperty("negativeTags")
    public List<String> getNegativeTags() {
        return negativeTags;
    }

    @JsonProperty("userTags")
    public List<String> getUserTags() {
        return userTags;
    }

    @JsonProperty("weightedTags")
    public List<WeightedTagDocument> getWeightedTags() {
        return weightedTags;
    }

    @JsonProperty("seed")
    public Long getSeed() {
        return seed;
    }

    @JsonProperty("width")
    public Integer getWidth() {
        return width;
    }

    @JsonProperty("height")
    public Integer getHeight() {
        return height;
    }

    @JsonProperty("hasLosslessDerivative")
    public boolean hasLosslessDerivative() {
        return hasLosslessDerivative;
    }

    @JsonProperty("createdAt")
    public long getCreatedAt() {
        return createdAt;
    }
}
