package org.dxworks.hybridnote.model.markdown;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class MarkdownElement {
    public String type; // heading, paragraph, code_block, table, bullet_list, ordered_list, list_item, block_quote, thematic_break, html_block, image
    public int line; // document line where the element starts
    public int lines; // number of lines spanned by this element
    public Map<String, Object> properties; // optional, e.g. level/text for headings, language for code blocks
    public List<MarkdownElement> children; // optional nested elements (e.g. list -> list_item -> paragraph)
}
