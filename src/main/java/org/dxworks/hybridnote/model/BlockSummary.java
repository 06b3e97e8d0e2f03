package org.dxworks.hybridnote.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

@JsonPropertyOrder({"index", "syntax", "startLine", "endLine", "headingLevel", "id", "todoState",
        "properties", "dirty", "error"})
public class BlockSummary {
    public int index;
    public String syntax; // e.g. markdown, org, latex, code:python
    public int startLine;
    public int endLine;
    public Integer headingLevel; // nullable
    public String id; // nullable
    public String todoState; // nullable
    public Map<String, String> properties; // nullable when empty
    public boolean dirty;
    public String error; // parse error message, nullable
}
