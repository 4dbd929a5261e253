package org.dxworks.codesync.change;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.codesync.Language;

public enum EditOperation {
    @JsonProperty("insert_member")
    INSERT_MEMBER(Language.JAVA),
    @JsonProperty("replace_member")
    REPLACE_MEMBER(Language.JAVA),
    @JsonProperty("insert_import")
    INSERT_IMPORT(Language.JAVA),
    @JsonProperty("insert_annotation")
    INSERT_ANNOTATION(Language.JAVA),
    @JsonProperty("replace_doc_comment")
    REPLACE_DOC_COMMENT(Language.JAVA),
    @JsonProperty("update_section")
    UPDATE_SECTION(Language.MARKDOWN),
    @JsonProperty("add_section")
    ADD_SECTION(Language.MARKDOWN),
    @JsonProperty("replace_table")
    REPLACE_TABLE(Language.MARKDOWN),
    @JsonProperty("append_table_rows")
    APPEND_TABLE_ROWS(Language.MARKDOWN);

    private final Language language;

    EditOperation(Language language) {
        this.language = language;
    }

    /** Kind of file the operation edits. */
    public Language getLanguage() {
        return language;
    }
}
