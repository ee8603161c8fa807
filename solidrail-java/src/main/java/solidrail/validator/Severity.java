package solidrail.validator;

public enum Severity {
    ERROR,
    WARNING
}
