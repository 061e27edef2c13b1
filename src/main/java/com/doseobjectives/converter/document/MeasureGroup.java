package com.doseobjectives.converter.document;

import java.util.List;

/**
 * One importable template: its preview header and its measure items.
 */
public final class MeasureGroup {

    private final String id;
    private final PreviewHeader preview;
    private final List<MeasureItem> items;

    public MeasureGroup(String id, PreviewHeader preview, List<MeasureItem> items) {
        this.id = id;
        this.preview = preview;
        this.items = List.copyOf(items);
    }

    public String getId() {
        return id;
    }

    public PreviewHeader getPreview() {
        return preview;
    }

    public List<MeasureItem> getItems() {
        return items;
    }
}
