package ae.teletronics.attachment.application;

import ae.teletronics.attachment.application.dto.BufferUpload;
import ae.teletronics.attachment.application.dto.RawUpload;
import ae.teletronics.attachment.application.dto.UploadInput;
import ae.teletronics.attachment.application.dto.UploadedFile;
import ae.teletronics.attachment.application.exceptions.AttachmentException;
import ae.teletronics.attachment.application.util.TempFiles;
import ae.teletronics.attachment.domain.AttachmentOptions;
import ae.teletronics.attachment.domain.AttachmentState;
import ae.teletronics.attachment.domain.FieldError;
import ae.teletronics.attachment.domain.Filenames;
import ae.teletronics.attachment.domain.LifecycleEvent;
import ae.teletronics.attachment.domain.model.Attachment;
import ae.teletronics.attachment.ports.AttachmentProcessor;
import ae.teletronics.attachment.ports.FileTypeDetector;
import ae.teletronics.attachment.ports.StoragePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Drives an attachment from upload to storage and back out.
 *
 * <pre>
 *   UNMODIFIED -assign-> STAGED -VALIDATE-> VALIDATED -SAVE-> PERSISTED -DESTROY-> DELETED
 * </pre>
 *
 * The owning code calls {@link #assign} when upload data arrives and {@link #transition} at its own
 * validate/save/destroy points. Validation fails closed: a refused VALIDATE blocks the SAVE.
 * A SAVE only writes when data was staged since the last save, so repeated saves are free.
 * An object replaced by a SAVE stays in storage until {@link #commit}; {@link #rollback} removes
 * the new one instead when the record could not be stored.
 */
public class AttachmentLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AttachmentLifecycle.class);

    static final String OCTET_STREAM = "application/octet-stream";
    private static final String DEFAULT_FILENAME = "attachment";
    private static final Pattern DOTS_ONLY = Pattern.compile("\\.+");

    private final AttachmentOptions options;
    private final StoragePort storage;
    private final FileTypeDetector typeDetector;
    private final TempFiles tempFiles;
    private final List<AttachmentProcessor> processors;
    private final AttachmentValidator validator = new AttachmentValidator();

    public AttachmentLifecycle(AttachmentOptions options,
                               StoragePort storage,
                               FileTypeDetector typeDetector,
                               TempFiles tempFiles,
                               List<AttachmentProcessor> processors) {
        this.options = Objects.requireNonNull(options, "options");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.typeDetector = Objects.requireNonNull(typeDetector, "typeDetector");
        this.tempFiles = Objects.requireNonNull(tempFiles, "tempFiles");
        this.processors = processors == null ? List.of() : List.copyOf(processors);
    }

    public AttachmentOptions getOptions() {
        return options;
    }

    /** Wraps a new or loaded record. A record with a storage key starts out PERSISTED. */
    public StagedAttachment open(Attachment record) {
        return new StagedAttachment(record, this);
    }

    /* -------------------- Upload intake -------------------- */

    /**
     * Stages upload data and updates the record's filename and content type.
     *
     * @return false when the input is null or empty; the record is left untouched then
     */
    public boolean assign(StagedAttachment staged, UploadInput input) {
        ensureNotDeleted(staged);
        if (input == null) return false;

        Attachment record = staged.record();
        if (input instanceof UploadedFile file) {
            if (file.size() == 0) return skipEmpty(record);
            Path tmp = stage(() -> tempFiles.copy(file.source(), tempBaseName(file.originalFilename())));
            record.setContentType(detectContentType(file.contentType(), file.originalFilename(), tmp));
            record.setFilename(file.originalFilename());
            push(staged, tmp);
        } else if (input instanceof BufferUpload buffer) {
            if (buffer.size() == 0) return skipEmpty(record);
            Path tmp = stage(() -> tempFiles.write(buffer.data(), tempBaseName(buffer.filename())));
            record.setContentType(detectContentType(buffer.contentType(), buffer.filename(), tmp));
            record.setFilename(buffer.filename());
            push(staged, tmp);
        } else if (input instanceof RawUpload raw) {
            if (raw.isEmpty()) return skipEmpty(record);
            if (raw.tempfile() == null) {
                throw new IllegalArgumentException("Raw upload without a tempfile");
            }
            Path tmp = stage(() -> tempFiles.copy(raw.tempfile(), tempBaseName(raw.filename())));
            record.setContentType(raw.contentType());
            record.setFilename(raw.filename());
            push(staged, tmp);
        } else {
            throw new IllegalArgumentException("Unsupported upload input: " + input.getClass().getName());
        }
        log.debug("Staged upload for attachment {} ({}, {})", record.getId(), record.getFilename(), record.getContentType());
        return true;
    }

    /**
     * Stages raw bytes as the newest version of the data, leaving filename and content type alone.
     * Null is ignored.
     */
    public void setTempData(StagedAttachment staged, byte[] data) {
        ensureNotDeleted(staged);
        if (data == null) return;
        Path tmp = stage(() -> tempFiles.write(data, tempBaseName(staged.record().getFilename())));
        push(staged, tmp);
    }

    /** Reads the latest staged data into memory; empty when nothing is staged. */
    public Optional<byte[]> tempData(StagedAttachment staged) {
        if (!staged.hasStagedData()) return Optional.empty();
        try {
            return Optional.of(Files.readAllBytes(staged.tempPath().orElseThrow()));
        } catch (IOException e) {
            throw new AttachmentException("Could not read staged data", e);
        }
    }

    /** Opens the persisted bytes of a record. */
    public StoragePort.StoredObject retrieve(Attachment record) throws IOException {
        if (record.getStorageKey() == null) {
            throw new AttachmentException("Attachment " + record.getId() + " has no stored data");
        }
        return storage.load(record.getStorageKey());
    }

    /* -------------------- State machine -------------------- */

    public TransitionResult transition(StagedAttachment staged, LifecycleEvent event) throws IOException {
        return switch (event) {
            case VALIDATE -> validate(staged);
            case SAVE -> save(staged);
            case DESTROY -> destroy(staged);
            case DISCARD -> {
                discard(staged);
                yield TransitionResult.done(staged.state(), false);
            }
        };
    }

    private TransitionResult validate(StagedAttachment staged) throws IOException {
        ensureNotDeleted(staged);
        Attachment record = staged.record();
        boolean due = staged.hasStagedData();
        if (due) {
            record.setSize(Files.size(staged.tempPath().orElseThrow()));
        }

        List<FieldError> errors = validator.validate(record, options);
        if (!errors.isEmpty()) {
            log.debug("Attachment {} rejected: {}", record.getId(), errors);
            return TransitionResult.rejected(staged.state(), errors);
        }

        if (due) {
            for (AttachmentProcessor processor : processors) {
                processor.process(staged, this);
            }
            // processors may have staged a derived version
            record.setSize(Files.size(staged.tempPath().orElseThrow()));
        }
        staged.setSaveDue(due);
        staged.setState(AttachmentState.VALIDATED);
        return TransitionResult.done(AttachmentState.VALIDATED, false);
    }

    private TransitionResult save(StagedAttachment staged) throws IOException {
        ensureNotDeleted(staged);
        if (staged.state() != AttachmentState.VALIDATED) {
            TransitionResult validated = validate(staged);
            if (!validated.ok()) return validated;
        }

        Attachment record = staged.record();
        if (!staged.isSaveDue()) {
            log.debug("Attachment {} has no staged data, nothing to store", record.getId());
            AttachmentState state = record.getStorageKey() != null ? AttachmentState.PERSISTED : staged.state();
            staged.setState(state);
            return TransitionResult.done(state, false);
        }

        Path head = staged.tempPath().orElseThrow();
        String currentKey = record.getStorageKey();
        String supersededKey = staged.isUncommitted() ? staged.supersededKey() : currentKey;
        StoragePort.StorageSaveResult saved = storage.save(() -> Files.newInputStream(head), storageKeyFor(record));
        record.setStorageKey(saved.storageKey());
        record.setSize(saved.size());
        log.info("Stored attachment {} at {} ({} bytes)", record.getId(), saved.storageKey(), saved.size());

        // an earlier uncommitted write nobody will ever point at
        if (staged.isUncommitted() && currentKey != null
                && !currentKey.equals(saved.storageKey()) && !currentKey.equals(supersededKey)) {
            storage.delete(currentKey);
        }
        staged.markUncommitted(supersededKey);

        clearTempFiles(staged);
        staged.setSaveDue(false);
        staged.setState(AttachmentState.PERSISTED);
        return TransitionResult.done(AttachmentState.PERSISTED, true);
    }

    /**
     * Removes the object an uncommitted SAVE replaced. Call once the record pointing at the new
     * key is durable. No-op when the last SAVE kept the key or nothing was written.
     */
    public void commit(StagedAttachment staged) throws IOException {
        if (!staged.isUncommitted()) return;
        String superseded = staged.supersededKey();
        staged.clearUncommitted();
        String current = staged.record().getStorageKey();
        if (superseded != null && !superseded.equals(current)) {
            storage.delete(superseded);
            log.info("Removed previous object {} of attachment {}", superseded, staged.record().getId());
        }
    }

    /**
     * Undoes the storage side of an uncommitted SAVE: the new object is removed and the record
     * points at its previous key again. An object overwritten in place under the same key stays.
     */
    public void rollback(StagedAttachment staged) throws IOException {
        if (!staged.isUncommitted()) return;
        Attachment record = staged.record();
        String superseded = staged.supersededKey();
        String written = record.getStorageKey();
        staged.clearUncommitted();
        record.setStorageKey(superseded);
        staged.setState(superseded != null ? AttachmentState.PERSISTED : AttachmentState.UNMODIFIED);
        if (written != null && !written.equals(superseded)) {
            storage.delete(written);
            log.info("Removed uncommitted object {} of attachment {}", written, record.getId());
        }
    }

    private TransitionResult destroy(StagedAttachment staged) throws IOException {
        if (staged.state() == AttachmentState.DELETED) {
            return TransitionResult.done(AttachmentState.DELETED, false);
        }
        clearTempFiles(staged);
        staged.setSaveDue(false);
        commit(staged);

        Attachment record = staged.record();
        boolean deleted = false;
        if (record.getStorageKey() != null) {
            storage.delete(record.getStorageKey());
            log.info("Deleted stored object {} of attachment {}", record.getStorageKey(), record.getId());
            deleted = true;
        }
        staged.setState(AttachmentState.DELETED);
        return TransitionResult.done(AttachmentState.DELETED, deleted);
    }

    /** Drops staged data without touching storage. */
    void discard(StagedAttachment staged) {
        clearTempFiles(staged);
        staged.setSaveDue(false);
        AttachmentState state = staged.state();
        if (state == AttachmentState.STAGED || state == AttachmentState.VALIDATED) {
            staged.setState(staged.record().getStorageKey() != null
                    ? AttachmentState.PERSISTED
                    : AttachmentState.UNMODIFIED);
        }
    }

    /* -------------------- Helpers -------------------- */

    /**
     * Storage key of a record: {@code <prefix>/<p1>/<p2>/<id>/<filename>}, with p1 and p2 taken from the id.
     */
    public String storageKeyFor(Attachment record) {
        String id = record.getId();
        if (id == null || id.isBlank()) {
            throw new AttachmentException("Attachment needs an id before it can be stored");
        }
        String compact = id.replace("-", "");
        String filename = keySegment(record.getFilename());
        StringBuilder key = new StringBuilder(options.getPathPrefix()).append('/');
        if (compact.length() >= 4) {
            key.append(compact, 0, 2).append('/').append(compact, 2, 4).append('/');
        }
        return key.append(compact).append('/').append(filename).toString();
    }

    private String detectContentType(String declared, String filename, Path staged) {
        String type = declared == null ? null : declared.strip();
        if (type != null && !OCTET_STREAM.equals(type)) {
            return type;
        }
        try {
            return typeDetector.detect(() -> Files.newInputStream(staged), filename).orElse(type);
        } catch (IOException e) {
            throw new AttachmentException("Content type detection failed for " + filename, e);
        }
    }

    private static boolean skipEmpty(Attachment record) {
        log.debug("Ignoring empty upload for attachment {}", record.getId());
        return false;
    }

    private static String tempBaseName(String filename) {
        return keySegment(Filenames.sanitize(filename));
    }

    // "." and ".." would resolve to a parent directory shared with other records
    private static String keySegment(String name) {
        if (name == null || name.isBlank() || DOTS_ONLY.matcher(name).matches()) {
            return DEFAULT_FILENAME;
        }
        return name;
    }

    private static Path stage(TempFileWriter writer) {
        try {
            return writer.write();
        } catch (IOException e) {
            throw new AttachmentException("Could not stage upload data", e);
        }
    }

    private static void push(StagedAttachment staged, Path tmp) {
        staged.push(tmp);
        staged.setSaveDue(false);
        staged.setState(AttachmentState.STAGED);
    }

    private void clearTempFiles(StagedAttachment staged) {
        for (Path tmp : staged.drain()) {
            tempFiles.delete(tmp);
        }
    }

    private static void ensureNotDeleted(StagedAttachment staged) {
        if (staged.state() == AttachmentState.DELETED) {
            throw new AttachmentException("Attachment " + staged.record().getId() + " was destroyed");
        }
    }

    @FunctionalInterface
    private interface TempFileWriter {
        Path write() throws IOException;
    }
}
