package com.nilsson.soeji.model;

import java.util.Objects;

/**
 A row of the tag catalog. The category is taken from a {@code category:value} name prefix when
 the tag is first created and never changes afterwards.
 */
public class TagRecord {

    public final long id;
    public final String name;
    public final String category;

    public TagRecord(long id, String name, String category) {
        this.id = id;
        this.name = name;
        this.category = category;
    }

    /**
     Category implied by a tag name: the text before the first colon, if the colon is not the
     first character.
     */
    public static String categoryOf(String name) {
        int colon = name.indexOf(':');
        return colon > 0 ? name.substring(0, colon) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TagRecord)) return false;
        TagRecord that = (TagRecord) o;
        return id == that.id && name.equals(that.name) && Objects.equals(category, that.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, category);
    }

    @Override
    public String toString() {
        return "TagRecord{" + id + ", " + name + "}";
    }
}
