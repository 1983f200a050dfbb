package org.dxworks.flowframe.model;

public class StreamNode extends FlowNode {
    public static final String WRITE = "write";
    public static final String READ = "read";
    public static final String FOR_EACH = "forEach";

    public String streamType;
    public String namespace;
    public String callee;

    public StreamNode(String id, String streamType, String callee) {
        super(id);
        this.streamType = streamType;
        this.callee = callee;
    }
}
