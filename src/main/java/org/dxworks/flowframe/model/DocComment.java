package org.dxworks.flowframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed documentation comment: free text before the first tag plus the recognised tags.
 */
public class DocComment {
    public String description;
    public List<JsDocParam> params = new ArrayList<>();
    public String returns;
    public List<String> throwsDescriptions = new ArrayList<>();
    public String example;

    public boolean isEmpty() {
        return description == null && params.isEmpty() && returns == null
                && throwsDescriptions.isEmpty() && example == null;
    }
}
