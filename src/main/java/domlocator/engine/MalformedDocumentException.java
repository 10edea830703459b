package domlocator.engine;

/** The document has no usable root element, so no pass can run over it. */
public class MalformedDocumentException extends DomAnalysisException {

    public MalformedDocumentException(String msg) {
        super(msg);
    }
}
