package org.dxworks.codesync.model.markdown;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.dxworks.codesync.model.TreeNode;

import java.util.LinkedHashMap;
import java.util.Map;

public class Section extends TreeNode<Section> {
    public static final int ROOT_LEVEL = 0;

    public String title;
    public int level; // 1-n for headings, 0 for the synthetic root
    public String content = "";
    public Map<String, Object> metadata = new LinkedHashMap<>();
    public int startLine;
    public int endLine;

    public Section(String title, int level, String content) {
        this.title = title;
        this.level = level;
        this.content = content == null ? "" : content;
    }

    public static Section root() {
        return new Section("", ROOT_LEVEL, "");
    }

    @JsonIgnore
    public boolean isRoot() {
        return level == ROOT_LEVEL;
    }

    @Override
    public String label() {
        return title;
    }
}
