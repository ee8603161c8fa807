package solidrail.types;

/**
 * A Solidity type as it appears in declarations.
 */
public sealed interface StaticType permits ElementaryType, ArrayType, MappingType, EnumType {

    /** Canonical Solidity spelling, e.g. {@code uint256}, {@code mapping(address => uint256)}. */
    String typeName();

    /**
     * Bytes occupied in a storage slot. Dynamic and composite types take a whole slot.
     */
    default int storageBytes() {
        return 32;
    }

    /** Needs a data location ({@code memory}) when used as a parameter or return value. */
    default boolean isReferenceType() {
        return false;
    }

    default boolean isNumeric() {
        return false;
    }
}
