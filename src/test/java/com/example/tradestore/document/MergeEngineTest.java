package com.example.tradestore.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.example.tradestore.TradeFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MergeEngineTest {

    private final MergeEngine mergeEngine = new MergeEngine();

    @Test
    void shouldRemoveObjectSubtreeOnNull() {
        ObjectNode merged = mergeEngine.merge(json("{\"a\": {\"b\": 1, \"c\": 2}}"), json("{\"a\": null}"));

        assertThat(merged.has("a")).isFalse();
        assertThat(merged).isEqualTo(json("{}"));
    }

    @Test
    void shouldSetLeafToNullOnNull() {
        ObjectNode merged = mergeEngine.merge(json("{\"a\": 1}"), json("{\"a\": null}"));

        assertThat(merged.has("a")).isTrue();
        assertThat(merged.get("a").isNull()).isTrue();
    }

    @Test
    void shouldSetAbsentKeyToNullOnNull() {
        ObjectNode merged = mergeEngine.merge(json("{\"b\": 1}"), json("{\"a\": null}"));

        assertThat(merged).isEqualTo(json("{\"b\": 1, \"a\": null}"));
    }

    @Test
    void shouldSetArrayToNullOnNull() {
        ObjectNode merged = mergeEngine.merge(json("{\"legs\": [1, 2]}"), json("{\"legs\": null}"));

        assertThat(merged.get("legs").isNull()).isTrue();
    }

    @Test
    void shouldPreserveSiblings() {
        ObjectNode merged = mergeEngine.merge(
                json("{\"leg1\": {\"notional\": 1000000, \"rate\": 0.045}}"),
                json("{\"leg1\": {\"rate\": 0.048}}"));

        assertThat(merged).isEqualTo(json("{\"leg1\": {\"notional\": 1000000, \"rate\": 0.048}}"));
    }

    @Test
    void shouldReplaceArraysWholesale() {
        ObjectNode merged = mergeEngine.merge(
                json("{\"legs\": [{\"ccy\": \"USD\"}, {\"ccy\": \"EUR\"}]}"),
                json("{\"legs\": [{\"ccy\": \"GBP\"}]}"));

        assertThat(merged).isEqualTo(json("{\"legs\": [{\"ccy\": \"GBP\"}]}"));
    }

    @Test
    void shouldReplaceScalarWithObjectAndObjectWithScalar() {
        ObjectNode merged = mergeEngine.merge(
                json("{\"a\": 1, \"b\": {\"x\": 1}}"),
                json("{\"a\": {\"y\": 2}, \"b\": \"flat\"}"));

        assertThat(merged).isEqualTo(json("{\"a\": {\"y\": 2}, \"b\": \"flat\"}"));
    }

    @Test
    void shouldNeverMutateBaseOrAliasPatch() {
        ObjectNode base = json("{\"a\": {\"b\": 1}, \"c\": [1]}");
        ObjectNode baseCopy = base.deepCopy();
        ObjectNode patch = json("{\"a\": {\"d\": {\"e\": 1}}, \"c\": null}");

        ObjectNode merged = mergeEngine.merge(base, patch);
        ((ObjectNode) merged.at("/a/d")).put("e", 99);

        assertThat(base).isEqualTo(baseCopy);
        assertThat(patch.at("/a/d/e").intValue()).isEqualTo(1);
    }

    @Test
    void shouldRejectNonObjectPatch() {
        assertThatThrownBy(() -> mergeEngine.merge(json("{}"), JsonNodeFactory.instance.arrayNode()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Randomized documents with a fixed seed; every result is checked key by key against the merge rules.
     */
    @Test
    void shouldSatisfyMergeRulesForRandomDocuments() {
        Random random = new Random(20260120L);
        for (int i = 0; i < 500; i++) {
            ObjectNode base = randomObject(random, 3);
            ObjectNode patch = randomObject(random, 3);
            ObjectNode baseCopy = base.deepCopy();

            ObjectNode merged = mergeEngine.merge(base, patch);

            assertThat(base).isEqualTo(baseCopy);
            assertMergeRules(base, patch, merged);
        }
    }

    @Test
    void shouldBeIdempotentForPatchesWithoutNulls() {
        Random random = new Random(7L);
        for (int i = 0; i < 200; i++) {
            ObjectNode base = randomObject(random, 3);
            ObjectNode patch = stripNulls(randomObject(random, 3));

            ObjectNode once = mergeEngine.merge(base, patch);
            ObjectNode twice = mergeEngine.merge(once, patch);

            assertThat(twice).isEqualTo(once);
        }
    }

    private void assertMergeRules(ObjectNode base, ObjectNode patch, ObjectNode merged) {
        Iterator<String> baseKeys = base.fieldNames();
        while (baseKeys.hasNext()) {
            String key = baseKeys.next();
            if (!patch.has(key)) {
                assertThat(merged.get(key)).isEqualTo(base.get(key));
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            JsonNode existing = base.get(key);
            if (value.isNull()) {
                if (existing != null && existing.isObject()) {
                    assertThat(merged.has(key)).isFalse();
                } else {
                    assertThat(merged.get(key).isNull()).isTrue();
                }
            } else if (value.isObject() && existing != null && existing.isObject()) {
                assertMergeRules((ObjectNode) existing, (ObjectNode) value, (ObjectNode) merged.get(key));
            } else {
                assertThat(merged.get(key)).isEqualTo(value);
            }
        }
    }

    private ObjectNode randomObject(Random random, int depth) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        int size = random.nextInt(4);
        for (int i = 0; i < size; i++) {
            // small key space so base and patch overlap often
            node.set("k" + random.nextInt(4), randomValue(random, depth - 1));
        }
        return node;
    }

    private JsonNode randomValue(Random random, int depth) {
        int kind = random.nextInt(depth > 0 ? 6 : 4);
        JsonNodeFactory factory = JsonNodeFactory.instance;
        return switch (kind) {
            case 0 -> factory.nullNode();
            case 1 -> factory.numberNode(random.nextInt(100));
            case 2 -> factory.textNode("s" + random.nextInt(5));
            case 3 -> factory.booleanNode(random.nextBoolean());
            case 4 -> {
                List<JsonNode> items = new ArrayList<>();
                for (int i = 0; i < random.nextInt(3); i++) {
                    items.add(randomValue(random, depth - 1));
                }
                yield factory.arrayNode().addAll(items);
            }
            default -> randomObject(random, depth);
        };
    }

    private ObjectNode stripNulls(ObjectNode node) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            result.set(field.getKey(), value.isObject() ? stripNulls((ObjectNode) value) : value);
        }
        return result;
    }
}
