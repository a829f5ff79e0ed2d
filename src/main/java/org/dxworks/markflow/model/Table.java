package org.dxworks.markflow.model;

import java.util.ArrayList;
import java.util.List;

public class Table implements Element {
    public List<List<TextBox>> rows = new ArrayList<>();

    public void pushRow() {
        rows.add(new ArrayList<>());
    }

    /** Appends a cell to the last row, starting a row first when there is none. */
    public void pushCell(TextBox cell) {
        if (rows.isEmpty()) {
            pushRow();
        }
        rows.get(rows.size() - 1).add(cell);
    }
}
