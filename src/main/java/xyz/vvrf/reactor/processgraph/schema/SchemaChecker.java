package xyz.vvrf.reactor.processgraph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.networknt.schema.JsonMetaSchema;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.NonValidationKeyword;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 使用 JSON Schema (2020-12) 校验值。
 * <p>
 * openEO 的约定:
 * <ul>
 *     <li>schema 可以是 schema 数组，等价于 {@code anyOf}；</li>
 *     <li>{@code subtype} 等 openEO 关键字不参与校验；</li>
 *     <li>不能表示为 JSON 的值 (不透明的数据句柄) 只在 schema 为空或带有 {@code subtype} 时被接受。</li>
 * </ul>
 * 编译后的 schema 按内容缓存在 Caffeine 中。线程安全。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SchemaChecker {

    public static final long DEFAULT_CACHE_SIZE = 512;

    private static final List<String> OPENEO_KEYWORDS = Collections.unmodifiableList(Arrays.asList(
            "subtype", "parameters", "returns", "dimensions", "experimental"));

    private static final JsonSchemaFactory SCHEMA_FACTORY = createFactory();

    private final ObjectMapper objectMapper;
    private final Cache<JsonNode, JsonSchema> schemaCache;

    public SchemaChecker(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_CACHE_SIZE);
    }

    public SchemaChecker(ObjectMapper objectMapper, long cacheSize) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("Schema cache size must be positive.");
        }
        this.schemaCache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .build();
        log.info("SchemaChecker 已创建，schema 缓存上限: {}", cacheSize);
    }

    private static JsonSchemaFactory createFactory() {
        JsonMetaSchema base = JsonMetaSchema.getV202012();
        JsonMetaSchema openEoMetaSchema = JsonMetaSchema.builder(base.getUri(), base)
                .addKeywords(OPENEO_KEYWORDS.stream().map(NonValidationKeyword::new).collect(Collectors.toList()))
                .build();
        return JsonSchemaFactory.builder(JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012))
                .addMetaSchema(openEoMetaSchema)
                .build();
    }

    /**
     * 校验单个值。
     *
     * @param value  待校验的值 (Java 对象，可以为 null)
     * @param schema openEO schema，为 null 或空对象时不做约束
     * @return 违规信息列表，为空表示通过
     */
    public List<String> check(Object value, JsonNode schema) {
        if (isUnconstrained(schema)) {
            return Collections.emptyList();
        }

        JsonNode jsonValue;
        try {
            jsonValue = (value instanceof JsonNode) ? (JsonNode) value : objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            if (declaresSubtype(schema)) {
                log.trace("值类型 {} 无法表示为 JSON，但 schema 声明了 subtype，按不透明数据接受。", value.getClass().getName());
                return Collections.emptyList();
            }
            return Collections.singletonList(String.format(
                    "value of type %s is not representable as JSON and the schema declares no subtype",
                    value.getClass().getName()));
        }

        JsonSchema compiled = compile(schema);
        Set<ValidationMessage> messages = compiled.validate(jsonValue);
        if (messages.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> violations = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            violations.add(message.getMessage());
        }
        Collections.sort(violations);
        return violations;
    }

    /**
     * 编译 (并缓存) schema。
     */
    JsonSchema compile(JsonNode schema) {
        JsonNode normalized = normalize(schema);
        return schemaCache.get(normalized, key -> {
            log.debug("编译 JSON Schema: {}", key);
            JsonSchema compiled = SCHEMA_FACTORY.getSchema(key);
            compiled.initializeValidators();
            return compiled;
        });
    }

    public long getCachedSchemaCount() {
        return schemaCache.estimatedSize();
    }

    /**
     * null、JSON null、空对象以及空数组都视为无约束。
     */
    public static boolean isUnconstrained(JsonNode schema) {
        if (schema == null || schema.isNull() || schema.isMissingNode()) {
            return true;
        }
        return (schema.isObject() || schema.isArray()) && schema.size() == 0;
    }

    /**
     * openEO schema 数组转换为 {@code {"anyOf": [...]}}。
     */
    static JsonNode normalize(JsonNode schema) {
        if (schema.isArray()) {
            ObjectNode wrapper = JsonNodeFactory.instance.objectNode();
            ArrayNode anyOf = wrapper.putArray("anyOf");
            anyOf.addAll((ArrayNode) schema);
            return wrapper;
        }
        return schema;
    }

    static boolean declaresSubtype(JsonNode schema) {
        if (schema == null) {
            return false;
        }
        if (schema.isArray()) {
            for (JsonNode alternative : schema) {
                if (declaresSubtype(alternative)) {
                    return true;
                }
            }
            return false;
        }
        if (!schema.isObject()) {
            return false;
        }
        if (schema.hasNonNull("subtype")) {
            return true;
        }
        for (String combinator : Arrays.asList("anyOf", "oneOf", "allOf")) {
            JsonNode alternatives = schema.get(combinator);
            if (alternatives != null && alternatives.isArray()) {
                Iterator<JsonNode> it = alternatives.elements();
                while (it.hasNext()) {
                    if (declaresSubtype(it.next())) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
