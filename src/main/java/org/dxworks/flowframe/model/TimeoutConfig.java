package org.dxworks.flowframe.model;

public class TimeoutConfig {
    // Long, Double or "<dynamic>"
    public Object ms;
}
