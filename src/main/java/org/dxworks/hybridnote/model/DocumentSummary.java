package org.dxworks.hybridnote.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"kind", "filePath", "id", "title", "proseSyntax", "totalLines", "blockCount",
        "headings", "todos", "failedBlocks", "notices", "blocks"})
public class DocumentSummary {
    public String kind = "document";
    public String filePath;
    public String id;
    public String title;
    public String proseSyntax; // markdown or org
    public int totalLines;
    public int blockCount;
    public List<Integer> headings = new ArrayList<>(); // block indices
    public List<Integer> todos = new ArrayList<>(); // block indices
    public List<Integer> failedBlocks = new ArrayList<>(); // block indices
    public List<String> notices = new ArrayList<>(); // recovery messages
    public List<BlockSummary> blocks = new ArrayList<>();
}
