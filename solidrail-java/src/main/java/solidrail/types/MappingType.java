package solidrail.types;

public record MappingType(StaticType key, StaticType value) implements StaticType {

    /** Integer amounts keyed by account, the shape of a token balance table. */
    public boolean isBalanceLike() {
        return key.equals(ElementaryType.ADDRESS) && value.isNumeric();
    }

    @Override
    public String typeName() {
        return "mapping(" + key.typeName() + " => " + value.typeName() + ")";
    }

    @Override
    public String toString() {
        return typeName();
    }
}
