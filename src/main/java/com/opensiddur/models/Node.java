package com.opensiddur.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A node of a source or compiled document tree.
 * Serialized with a "kind" discriminator so that documents round-trip through JSON.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ElementNode.class, name = "element"),
    @JsonSubTypes.Type(value = TextNode.class, name = "text"),
    @JsonSubTypes.Type(value = MilestoneNode.class, name = "milestone"),
    @JsonSubTypes.Type(value = AnchorNode.class, name = "anchor"),
    @JsonSubTypes.Type(value = TransclusionRef.class, name = "transclude"),
    @JsonSubTypes.Type(value = DeclareBlock.class, name = "declare"),
    @JsonSubTypes.Type(value = EndDeclare.class, name = "endDeclare"),
    @JsonSubTypes.Type(value = ConditionalBlock.class, name = "conditional"),
    @JsonSubTypes.Type(value = EndConditional.class, name = "endConditional")
})
public abstract class Node {

    /**
     * Name used for this node in node paths (e.g. "p" for a paragraph element).
     */
    public abstract String pathName();

    /**
     * True for transclusion, declare and conditional markers, which never appear in compiled output.
     */
    @JsonIgnore
    public boolean isScaffolding() {
        return false;
    }

    /**
     * Deep copy. Source documents are never modified; the compiler copies what it keeps.
     */
    public abstract Node copy();
}
