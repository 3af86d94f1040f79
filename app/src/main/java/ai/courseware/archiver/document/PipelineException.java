package ai.courseware.archiver.document;

/**
 * Base type for failures raised while turning one page into output documents.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
