package org.dxworks.flowframe.model;

import java.util.ArrayList;
import java.util.List;

public class ParallelNode extends FlowNode {
    public static final String MODE_ALL = "all";
    public static final String MODE_ALL_SETTLED = "allSettled";

    public String mode;
    public String callee;
    public List<FlowNode> children = new ArrayList<>();

    public ParallelNode(String id, String mode, String callee) {
        super(id);
        this.mode = mode;
        this.callee = callee;
    }
}
