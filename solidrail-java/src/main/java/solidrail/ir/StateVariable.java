package solidrail.ir;

import solidrail.types.StaticType;
import solidrail.types.Visibility;

/**
 * @param initializer rendered initial value, or null when declared without one
 */
public record StateVariable(
        String name,
        StaticType type,
        Visibility visibility,
        boolean constant,
        String initializer
) {}
