package org.dxworks.codesync.change;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A requirement change together with the edits that implement it in sources and design documents.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChangeRequest {
    @JsonProperty("change_type")
    public ChangeType changeType = ChangeType.OTHER;
    @JsonProperty("feature_name")
    public String featureName = "";
    public String description = "";
    @JsonProperty("affected_components")
    public List<String> affectedComponents = new ArrayList<>();
    @JsonProperty("design_doc_sections")
    public List<String> designDocSections = new ArrayList<>();
    public List<String> requirements = new ArrayList<>();
    @JsonProperty("additional_info")
    public Map<String, Object> additionalInfo = new LinkedHashMap<>();
    public List<EditInstruction> edits = new ArrayList<>();
}
