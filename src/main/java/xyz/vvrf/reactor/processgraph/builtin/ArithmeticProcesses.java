package xyz.vvrf.reactor.processgraph.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import xyz.vvrf.reactor.processgraph.core.BuiltinProcess;
import xyz.vvrf.reactor.processgraph.core.ProcessInvoker;
import xyz.vvrf.reactor.processgraph.core.ProcessParameter;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;

/**
 * openEO 风格的基础算术内置处理: add、subtract、multiply、divide、sum、product、absolute。
 * 任一操作数为 null (无数据) 时结果为 null；sum / product 在 {@code ignore_nodata} 为 true (默认) 时跳过 null。
 * 结果统一为 {@link Double}。
 *
 * @author ruifeng.wen
 */
public final class ArithmeticProcesses {

    public static final String ADD = "add";
    public static final String SUBTRACT = "subtract";
    public static final String MULTIPLY = "multiply";
    public static final String DIVIDE = "divide";
    public static final String SUM = "sum";
    public static final String PRODUCT = "product";
    public static final String ABSOLUTE = "absolute";

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private ArithmeticProcesses() {}

    /**
     * 全部算术处理，按 ID 排序。
     */
    public static List<BuiltinProcess> all() {
        return Collections.unmodifiableList(Arrays.asList(
                absolute(), add(), divide(), multiply(), product(), subtract(), sum()));
    }

    public static BuiltinProcess add() {
        return binary(ADD, "Addition of two numbers", Double::sum);
    }

    public static BuiltinProcess subtract() {
        return binary(SUBTRACT, "Subtraction of two numbers", (x, y) -> x - y);
    }

    public static BuiltinProcess multiply() {
        return binary(MULTIPLY, "Multiplication of two numbers", (x, y) -> x * y);
    }

    /**
     * 除以 0 得到 IEEE 754 的无穷大或 NaN。
     */
    public static BuiltinProcess divide() {
        return binary(DIVIDE, "Division of two numbers", (x, y) -> x / y);
    }

    public static BuiltinProcess sum() {
        return reducer(SUM, "Compute the sum by adding up numbers", 0d, Double::sum);
    }

    public static BuiltinProcess product() {
        return reducer(PRODUCT, "Compute the product by multiplying numbers", 1d, (x, y) -> x * y);
    }

    public static BuiltinProcess absolute() {
        return BuiltinProcess.builder()
                .id(ABSOLUTE)
                .summary("Absolute value")
                .parameter(ProcessParameter.required("x", nullableNumber()))
                .returns(nullableNumber())
                .invoker(ProcessInvoker.blocking(arguments -> {
                    Double x = toDouble(arguments.get("x"));
                    return x == null ? null : Math.abs(x);
                }))
                .build();
    }

    private static BuiltinProcess binary(String id, String summary, DoubleBinaryOperator operator) {
        return BuiltinProcess.builder()
                .id(id)
                .summary(summary)
                .parameter(ProcessParameter.required("x", nullableNumber()))
                .parameter(ProcessParameter.required("y", nullableNumber()))
                .returns(nullableNumber())
                .invoker(ProcessInvoker.blocking(arguments -> {
                    Double x = toDouble(arguments.get("x"));
                    Double y = toDouble(arguments.get("y"));
                    if (x == null || y == null) {
                        return null;
                    }
                    return operator.applyAsDouble(x, y);
                }))
                .build();
    }

    private static BuiltinProcess reducer(String id, String summary, double identity, DoubleBinaryOperator operator) {
        ObjectNode dataSchema = JSON.objectNode();
        dataSchema.put("type", "array");
        dataSchema.set("items", nullableNumber());
        ObjectNode flagSchema = JSON.objectNode();
        flagSchema.put("type", "boolean");

        return BuiltinProcess.builder()
                .id(id)
                .summary(summary)
                .parameter(ProcessParameter.required("data", dataSchema))
                .parameter(ProcessParameter.withDefault("ignore_nodata", flagSchema, Boolean.TRUE))
                .returns(nullableNumber())
                .invoker(ProcessInvoker.blocking(arguments -> reduce(arguments, identity, operator)))
                .build();
    }

    private static Double reduce(Map<String, Object> arguments, double identity, DoubleBinaryOperator operator) {
        List<?> data = (List<?>) arguments.get("data");
        boolean ignoreNodata = !Boolean.FALSE.equals(arguments.get("ignore_nodata"));
        double accumulator = identity;
        int counted = 0;
        for (Object element : data) {
            Double value = toDouble(element);
            if (value == null) {
                if (ignoreNodata) {
                    continue;
                }
                return null;
            }
            accumulator = operator.applyAsDouble(accumulator, value);
            counted++;
        }
        // 没有任何有效值时视为无数据
        return counted == 0 ? null : accumulator;
    }

    private static Double toDouble(Object value) {
        return value == null ? null : ((Number) value).doubleValue();
    }

    private static JsonNode nullableNumber() {
        ObjectNode schema = JSON.objectNode();
        ArrayNode types = schema.putArray("type");
        types.add("number");
        types.add("null");
        return schema;
    }
}
