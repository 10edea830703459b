package domlocator.engine;

/**
 * Raised between phases when the analysing thread has been interrupted.
 * Partial results of the pass are discarded.
 */
public class AnalysisCancelledException extends DomAnalysisException {

    public AnalysisCancelledException(String msg) {
        super(msg);
    }
}
