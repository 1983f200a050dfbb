package org.dxworks.flowframe.model;

import java.util.ArrayList;
import java.util.List;

public class DependencyInfo {
    public String name;
    public String typeSignature;
    public List<String> errorTypes = new ArrayList<>();

    public DependencyInfo(String name, String typeSignature, List<String> errorTypes) {
        this.name = name;
        this.typeSignature = typeSignature;
        this.errorTypes = errorTypes;
    }
}
