package ae.teletronics.attachment.domain;

/**
 * Where an in-memory attachment stands between upload and removal.
 */
public enum AttachmentState {
    /** Nothing assigned since the instance was opened. */
    UNMODIFIED,
    /** Upload data assigned and held in temp files. */
    STAGED,
    /** Constraints checked; the next save may write. */
    VALIDATED,
    /** Bytes written to the backend, temp files gone. */
    PERSISTED,
    /** Backend object removed. */
    DELETED
}
