package solidrail.types;

public enum Visibility {
    PUBLIC("public"),
    PRIVATE("private"),
    INTERNAL("internal");

    private final String keyword;

    Visibility(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
