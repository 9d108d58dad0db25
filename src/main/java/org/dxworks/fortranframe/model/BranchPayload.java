package org.dxworks.fortranframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Else branch of a conditional ({@code else}) or of a where-loop ({@code elsewhere}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BranchPayload implements NodePayload {
    public List<Node> elseChildren; // null until an else branch is seen
    public final boolean chained;   // synthesized for an "else if"; closes with its parent

    BranchPayload(boolean chained) {
        this.chained = chained;
    }

    @JsonIgnore
    public boolean isInElse() {
        return elseChildren != null;
    }

    void enterElse() {
        elseChildren = new ArrayList<>();
    }
}
