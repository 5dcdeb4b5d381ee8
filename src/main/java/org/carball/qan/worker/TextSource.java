package org.carball.qan.worker;

/**
 * Looks up the human readable text of a class, e.g. the normalized statement of a digest.
 */
@FunctionalInterface
public interface TextSource {

    String fetchText(String classId) throws WorkerException;

    /**
     * For sources whose class id already is readable text.
     */
    static TextSource identity() {
        return classId -> classId;
    }
}
