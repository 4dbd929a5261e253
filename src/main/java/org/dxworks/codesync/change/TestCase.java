package org.dxworks.codesync.change;

import java.util.ArrayList;
import java.util.List;

/**
 * One row of a generated test specification.
 */
public class TestCase {
    public static final String NOT_RUN = "Not run";

    public String id;
    public String category;
    public String subCategory;
    public String item;
    public List<String> conditions = new ArrayList<>();
    public List<String> steps = new ArrayList<>();
    public List<String> expectedResults = new ArrayList<>();
    public String actualResult;
    public String status = NOT_RUN;
    public String notes;

    public TestCase(String id, String category, String subCategory, String item) {
        this.id = id;
        this.category = category;
        this.subCategory = subCategory;
        this.item = item;
    }
}
