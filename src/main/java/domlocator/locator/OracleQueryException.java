package domlocator.locator;

import domlocator.engine.DomAnalysisException;

/** A locator expression could not be evaluated against the document. */
public class OracleQueryException extends DomAnalysisException {

    private final String expression;

    public OracleQueryException(String expression, Throwable cause) {
        super("Cannot evaluate '" + expression + "': " + cause.getMessage(), cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
