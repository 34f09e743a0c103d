package com.nilsson.soeji.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 <h2>GenerationMetadata</h2>
 <p>
 Structured form of the generation record embedded in a NovelAI PNG: the scalar sampler
 settings, the prompt texts, the v4 structured captions and the deduplicated tag list.
 </p>
 <p>
 Every scalar is nullable. The raw comment is always kept verbatim, even when it could not be
 decoded, so a record can be re-parsed later. The same shape is serialized into the
 {@code .metadata.json} sidecar.
 </p>
 */
@JsonPropertyOrder({"prompt", "negativePrompt", "seed", "steps", "scale", "sampler", "width", "height",
        "tags", "v4BaseCaption", "v4CharCaptions", "rawComment"})
public class GenerationMetadata {

    private String prompt;
    private String negativePrompt;
    private Long seed;
    private Integer steps;
    private Double scale;
    private String sampler;
    private Integer width;
    private Integer height;
    private List<WeightedTag> tags = new ArrayList<>();
    private String v4BaseCaption;
    private List<CharCaption> v4CharCaptions;
    private String rawComment = "";

    public static GenerationMetadata empty(String rawComment) {
        GenerationMetadata metadata = new GenerationMetadata();
        metadata.setRawComment(rawComment);
        return metadata;
    }

    /**
     Lets the PNG header override the declared {@code width}/{@code height}. A {@code null}
     header leaves the declared values in place.
     */
    public void applyHeaderDimensions(ImageDimensions header) {
        if (header == null) return;
        width = header.getWidth();
        height = header.getHeight();
    }

    // --- Accessors ---

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public String getNegativePrompt() {
        return negativePrompt;
    }

    public void setNegativePrompt(String negativePrompt) {
        this.negativePrompt = negativePrompt;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public Integer getSteps() {
        return steps;
    }

    public void setSteps(Integer steps) {
        this.steps = steps;
    }

    public Double getScale() {
        return scale;
    }

    public void setScale(Double scale) {
        this.scale = scale;
    }

    public String getSampler() {
        return sampler;
    }

    public void setSampler(String sampler) {
        this.sampler = sampler;
    }

    public Integer getWidth() {
        return width;
    }

    public void setWidth(Integer width) {
        this.width = width;
    }

    public Integer getHeight() {
        return height;
    }

    public void setHeight(Integer height) {
        this.height = height;
    }

    public List<WeightedTag> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public void setTags(List<WeightedTag> tags) {
        this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
    }

    public String getV4BaseCaption() {
        return v4BaseCaption;
    }

    public void setV4BaseCaption(String v4BaseCaption) {
        this.v4BaseCaption = v4BaseCaption;
    }

    public List<CharCaption> getV4CharCaptions() {
        return v4CharCaptions;
    }

    public void setV4CharCaptions(List<CharCaption> v4CharCaptions) {
        this.v4CharCaptions = v4CharCaptions == null ? null : List.copyOf(v4CharCaptions);
    }

    public String getRawComment() {
        return rawComment;
    }

    public void setRawComment(String rawComment) {
        this.rawComment = rawComment == null ? "" : rawComment;
    }

    /**
     True when nothing beyond the raw comment could be recovered.
     */
    @JsonIgnore
    public boolean isEmpty() {
        return prompt == null && negativePrompt == null && seed == null && steps == null
                && scale == null && sampler == null && width == null && height == null
                && tags.isEmpty() && v4BaseCaption == null && v4CharCaptions == null;
    }
}
