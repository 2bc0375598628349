package xyz.vvrf.reactor.processgraph.schema;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 单条 Schema 违规: 哪个参数 (返回值为 {@value #RETURN}) 以及原因。
 */
@Getter
@EqualsAndHashCode
public final class SchemaViolation {

    public static final String RETURN = "return";

    private final String parameter;
    private final String message;

    public SchemaViolation(String parameter, String message) {
        this.parameter = Objects.requireNonNull(parameter, "参数名不能为空");
        this.message = Objects.requireNonNull(message, "违规信息不能为空");
    }

    @Override
    public String toString() {
        return "'" + parameter + "': " + message;
    }
}
