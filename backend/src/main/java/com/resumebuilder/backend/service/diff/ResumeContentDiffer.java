package com.resumebuilder.backend.service.diff;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NumericNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shallow structural diff of two resume contents.
 * <p>
 * Only top-level keys are compared. A change anywhere inside a section such as
 * {@code experience} marks the whole section as modified. Values are compared
 * structurally: object key order is ignored and numbers compare by value, so
 * {@code 1} and {@code 1.0} are equal. Array element order is significant.
 */
@Component
public class ResumeContentDiffer {

    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.equals(b)) {
            return 0;
        }
        if (a instanceof NumericNode && b instanceof NumericNode) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return 1;
    };

    public VersionDiff diff(JsonNode oldContent, JsonNode newContent) {
        Set<String> oldKeys = topLevelKeys(oldContent);
        Set<String> newKeys = topLevelKeys(newContent);

        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<String> modified = new ArrayList<>();

        for (String key : newKeys) {
            if (!oldKeys.contains(key)) {
                added.add(key);
            }
        }
        for (String key : oldKeys) {
            if (!newKeys.contains(key)) {
                removed.add(key);
            } else if (!sameValue(oldContent.get(key), newContent.get(key))) {
                modified.add(key);
            }
        }
        return new VersionDiff(added, removed, modified);
    }

    private boolean sameValue(JsonNode left, JsonNode right) {
        return left.equals(NUMERIC_AWARE, right);
    }

    private Set<String> topLevelKeys(JsonNode content) {
        Set<String> keys = new TreeSet<>();
        if (content == null || !content.isObject()) {
            return keys;
        }
        Iterator<String> names = content.fieldNames();
        while (names.hasNext()) {
            keys.add(names.next());
        }
        return keys;
    }
}
