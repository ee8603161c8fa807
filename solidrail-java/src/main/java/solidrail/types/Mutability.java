package solidrail.types;

public enum Mutability {
    NONE(""),
    PURE("pure"),
    VIEW("view"),
    PAYABLE("payable");

    private final String keyword;

    Mutability(String keyword) {
        this.keyword = keyword;
    }

    /** Empty for {@link #NONE}. */
    public String keyword() {
        return keyword;
    }
}
