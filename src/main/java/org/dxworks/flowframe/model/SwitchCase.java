package org.dxworks.flowframe.model;

import java.util.ArrayList;
import java.util.List;

public class SwitchCase {
    public String value;
    public boolean isDefault;
    public List<FlowNode> body = new ArrayList<>();

    public SwitchCase(String value, boolean isDefault, List<FlowNode> body) {
        this.value = value;
        this.isDefault = isDefault;
        this.body = body;
    }
}
