package solidrail;

/**
 * Root of every failure raised by the transpiler pipeline.
 */
public class SolidRailException extends RuntimeException {

    public SolidRailException(String message) {
        super(message);
    }

    public SolidRailException(String message, Throwable cause) {
        super(message, cause);
    }
}
