package org.dxworks.flowframe.model;

public class RetryConfig {
    // Long, Double or "<dynamic>"
    public Object attempts;
    public String backoff;
    public Object baseDelay;
    public String retryOn;
}
