package org.dxworks.fortranframe.model;

public class LabeledLoopPayload implements NodePayload {
    public final int label;

    LabeledLoopPayload(int label) {
        this.label = label;
    }

    public boolean closesOn(String statementLabel) {
        if (statementLabel == null) {
            return false;
        }
        try {
            return Integer.parseInt(statementLabel.trim()) == label;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
