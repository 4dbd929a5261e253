package org.dxworks.codesync.change;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.codesync.mutation.MemberKind;

import java.util.ArrayList;
import java.util.List;

/**
 * One edit of a change request. Which fields are read depends on the operation:
 * <ul>
 *   <li>{@code insert_member}: {@code target} (type path), {@code kind}, {@code code}</li>
 *   <li>{@code replace_member}: {@code target} (member path), {@code code}</li>
 *   <li>{@code insert_import}: {@code code} (the import statement)</li>
 *   <li>{@code insert_annotation}, {@code replace_doc_comment}: {@code target}, {@code code}</li>
 *   <li>{@code update_section}: {@code title}, {@code content}</li>
 *   <li>{@code add_section}: {@code parent} (absent for the document root), {@code title}, {@code content},
 *       {@code level}</li>
 *   <li>{@code replace_table}, {@code append_table_rows}: {@code title}, {@code table_index}, {@code rows}</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EditInstruction {
    public EditOperation operation;
    public String file;
    public String target;
    public MemberKind kind;
    public String code;
    public String title;
    public String parent;
    public String content;
    public Integer level;
    @JsonProperty("table_index")
    public Integer tableIndex;
    public List<List<String>> rows = new ArrayList<>();

    /** Short description used in reports, e.g. {@code insert_member Service.java -> Service}. */
    public String describe() {
        String name = operation == null ? "unknown" : operation.name().toLowerCase();
        String selector = target != null ? target : title;
        return name + " " + file + (selector != null ? " -> " + selector : "");
    }
}
