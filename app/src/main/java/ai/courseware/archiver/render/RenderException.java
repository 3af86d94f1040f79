package ai.courseware.archiver.render;

import ai.courseware.archiver.document.PipelineException;

/**
 * Raised when a section cannot be converted to the requested output.
 */
public class RenderException extends PipelineException {

    public RenderException(String message) {
        super(message);
    }
}
