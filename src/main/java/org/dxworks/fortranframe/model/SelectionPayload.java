package org.dxworks.fortranframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

public class SelectionPayload implements NodePayload {
    public final List<SelectionCase> cases = new ArrayList<>();

    @JsonIgnore
    private int cursor = -1;

    void openCase(String condition) {
        cases.add(new SelectionCase(condition));
        cursor = cases.size() - 1;
    }

    /** The case currently receiving statements, or null before the first case label. */
    SelectionCase currentCase() {
        return cursor < 0 ? null : cases.get(cursor);
    }
}
