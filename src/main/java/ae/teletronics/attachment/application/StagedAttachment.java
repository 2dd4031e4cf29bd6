package ae.teletronics.attachment.application;

import ae.teletronics.attachment.domain.AttachmentState;
import ae.teletronics.attachment.domain.model.Attachment;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory attachment instance: the record plus the temp files holding its staged data.
 *
 * Temp files are kept most-recent-first; the head is the current version of the data.
 * Several versions can exist while processors derive new data from the upload. The list is
 * cleared after a successful save and when the instance is closed.
 *
 * Not thread-safe: one instance belongs to one request.
 */
public final class StagedAttachment implements AutoCloseable {

    private final Attachment record;
    private final AttachmentLifecycle lifecycle;
    private final Deque<Path> tempPaths = new ArrayDeque<>();
    private AttachmentState state;
    private boolean saveDue;
    private boolean uncommitted;
    private String supersededKey;

    StagedAttachment(Attachment record, AttachmentLifecycle lifecycle) {
        this.record = Objects.requireNonNull(record, "record");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.state = record.getStorageKey() != null ? AttachmentState.PERSISTED : AttachmentState.UNMODIFIED;
    }

    public Attachment record() { return record; }

    public AttachmentState state() { return state; }

    /** Latest staged temp file, if any. */
    public Optional<Path> tempPath() {
        return Optional.ofNullable(tempPaths.peekFirst());
    }

    /** Snapshot of the staged temp files, most recent first. */
    public List<Path> tempPaths() {
        return List.copyOf(tempPaths);
    }

    /** True if the next save writes to storage. */
    public boolean hasStagedData() {
        Path head = tempPaths.peekFirst();
        return head != null && Files.isRegularFile(head);
    }

    @Override
    public void close() {
        lifecycle.discard(this);
    }

    /* lifecycle bookkeeping */

    void push(Path tmp) {
        tempPaths.addFirst(tmp);
    }

    List<Path> drain() {
        List<Path> out = new ArrayList<>(tempPaths);
        tempPaths.clear();
        return out;
    }

    void setState(AttachmentState state) {
        this.state = state;
    }

    boolean isSaveDue() { return saveDue; }

    void setSaveDue(boolean saveDue) { this.saveDue = saveDue; }

    /** True between a SAVE that wrote to storage and the matching commit or rollback. */
    public boolean isUncommitted() { return uncommitted; }

    /** Key the record pointed at before the uncommitted SAVE; null for a new record. */
    String supersededKey() { return supersededKey; }

    void markUncommitted(String supersededKey) {
        this.uncommitted = true;
        this.supersededKey = supersededKey;
    }

    void clearUncommitted() {
        this.uncommitted = false;
        this.supersededKey = null;
    }

    @Override
    public String toString() {
        return "StagedAttachment{" +
                "record=" + record +
                ", state=" + state +
                ", tempPaths=" + tempPaths.size() +
                '}';
    }
}
