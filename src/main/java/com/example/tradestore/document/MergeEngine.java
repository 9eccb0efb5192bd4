package com.example.tradestore.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Deep merge of a partial update onto an existing trade document.
 * <p>
 * For every key of the patch:
 * <ul>
 *     <li>object over object recurses;</li>
 *     <li>null over an object removes the key;</li>
 *     <li>null over anything else (scalar, array, absent) sets the key to null;</li>
 *     <li>any other value replaces the base value, arrays wholesale.</li>
 * </ul>
 * Keys only in the base are kept. The base is never mutated.
 */
@Slf4j
@Component
public class MergeEngine {

    public ObjectNode merge(ObjectNode base, JsonNode patch) {
        if (patch == null || !patch.isObject()) {
            throw new IllegalArgumentException("Patch must be a JSON object");
        }
        ObjectNode result = base.deepCopy();
        mergeInto(result, (ObjectNode) patch);
        return result;
    }

    private void mergeInto(ObjectNode target, ObjectNode patch) {
        Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            JsonNode existing = target.get(key);

            if (value.isNull()) {
                if (existing != null && existing.isObject()) {
                    log.debug("Merge removes subtree '{}'", key);
                    target.remove(key);
                } else {
                    target.putNull(key);
                }
            } else if (value.isObject() && existing != null && existing.isObject()) {
                mergeInto((ObjectNode) existing, (ObjectNode) value);
            } else {
                target.set(key, value.deepCopy());
            }
        }
    }
}
