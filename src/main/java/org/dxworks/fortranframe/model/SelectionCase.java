package org.dxworks.fortranframe.model;

import java.util.ArrayList;
import java.util.List;

public class SelectionCase {
    public final String condition; // "(1, 2)", "(:0)", "default"
    public final List<Node> statements = new ArrayList<>();

    public SelectionCase(String condition) {
        this.condition = condition;
    }
}
