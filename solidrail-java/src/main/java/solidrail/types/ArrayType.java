package solidrail.types;

public record ArrayType(StaticType element) implements StaticType {

    @Override
    public String typeName() {
        return element.typeName() + "[]";
    }

    @Override
    public boolean isReferenceType() {
        return true;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
