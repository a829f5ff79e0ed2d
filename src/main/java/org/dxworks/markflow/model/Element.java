package org.dxworks.markflow.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One render-ready output element. Elements are never changed once they are
 * part of the output sequence.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextBox.class, name = "text_box"),
        @JsonSubTypes.Type(value = Spacer.class, name = "spacer"),
        @JsonSubTypes.Type(value = Table.class, name = "table")
})
public interface Element {
}
