package ai.courseware.archiver.extract;

import ai.courseware.archiver.document.PipelineException;

/**
 * Raised when no content region can be located on a page.
 */
public class ExtractionException extends PipelineException {

    public ExtractionException(String message) {
        super(message);
    }
}
