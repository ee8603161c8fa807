package solidrail.types;

public record EnumType(String name) implements StaticType {

    @Override
    public String typeName() {
        return name;
    }

    @Override
    public int storageBytes() {
        return 1;
    }

    @Override
    public String toString() {
        return name;
    }
}
