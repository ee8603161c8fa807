package solidrail.ir;

import solidrail.types.Mutability;
import solidrail.types.StaticType;
import solidrail.types.Visibility;

import java.util.List;

/**
 * @param returnType null when the function returns nothing
 */
public record FunctionSpec(
        String name,
        Kind kind,
        List<Parameter> parameters,
        Visibility visibility,
        Mutability mutability,
        StaticType returnType,
        List<Statement> body
) {
    public enum Kind { CONSTRUCTOR, FUNCTION }

    public FunctionSpec {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    public boolean isConstructor() {
        return kind == Kind.CONSTRUCTOR;
    }
}
