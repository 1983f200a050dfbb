package org.dxworks.flowframe.model;

public class JsDocParam {
    public String name;
    public String description;

    public JsDocParam(String name, String description) {
        this.name = name;
        this.description = description;
    }
}
