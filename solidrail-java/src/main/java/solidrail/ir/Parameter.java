package solidrail.ir;

import solidrail.types.StaticType;

public record Parameter(String name, StaticType type) {}
