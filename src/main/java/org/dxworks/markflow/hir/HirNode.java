package org.dxworks.markflow.hir;

import org.dxworks.markflow.html.Attr;
import org.dxworks.markflow.html.TagName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class HirNode {
    private final TagName tag;
    private final List<Attr> attributes;
    private final List<HirContent> content = new ArrayList<>();

    HirNode(TagName tag, List<Attr> attributes) {
        this.tag = tag;
        this.attributes = List.copyOf(attributes);
    }

    public TagName getTag() {
        return tag;
    }

    public List<Attr> getAttributes() {
        return attributes;
    }

    public List<HirContent> getContent() {
        return Collections.unmodifiableList(content);
    }

    void addContent(HirContent item) {
        content.add(item);
    }
}
