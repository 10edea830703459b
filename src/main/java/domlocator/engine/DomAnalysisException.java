package domlocator.engine;

/**
 * Unchecked exception thrown by analysis components when a pass, a query or
 * a browser dereference cannot be completed.
 */
public class DomAnalysisException extends RuntimeException {

    public DomAnalysisException(String msg) {
        super(msg);
    }

    public DomAnalysisException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
