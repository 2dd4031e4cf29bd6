package ae.teletronics.attachment.adapters.web;

import ae.teletronics.attachment.adapters.web.dto.AttachmentDto;
import ae.teletronics.attachment.application.AttachmentService;
import ae.teletronics.attachment.application.dto.AttachmentContent;
import ae.teletronics.attachment.application.dto.UploadedFile;
import ae.teletronics.attachment.domain.model.Attachment;
import ae.teletronics.attachment.ports.StoragePort;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/attachments")
public class AttachmentController {

    private final AttachmentService attachments;

    public AttachmentController(AttachmentService attachments) {
        this.attachments = attachments;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public AttachmentDto create(@RequestParam("file") MultipartFile file) throws IOException {
        return AttachmentDto.from(attachments.create(toUpload(file)));
    }

    @PutMapping(path = "/{id}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AttachmentDto replace(@PathVariable("id") String id,
                                 @RequestParam("file") MultipartFile file) throws IOException {
        return AttachmentDto.from(attachments.replace(id, toUpload(file)));
    }

    @GetMapping("/{id}")
    public AttachmentDto get(@PathVariable("id") String id) {
        return AttachmentDto.from(attachments.find(id));
    }

    @GetMapping("/{id}/data")
    public ResponseEntity<InputStreamResource> data(@PathVariable("id") String id) throws IOException {
        AttachmentContent content = attachments.open(id);
        Attachment record = content.record();
        StoragePort.StoredObject stored = content.data();

        return ResponseEntity.ok()
                .contentType(mediaTypeOf(record.getContentType()))
                .contentLength(stored.size())
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(record.getFilename()).build().toString())
                .body(new InputStreamResource(stored.source().openStream()));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("id") String id) throws IOException {
        attachments.destroy(id);
    }

    // stored types are not checked for syntax; an unparseable one is served as raw bytes
    private static MediaType mediaTypeOf(String contentType) {
        if (!StringUtils.hasText(contentType)) return MediaType.APPLICATION_OCTET_STREAM;
        try {
            return MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    private static UploadedFile toUpload(MultipartFile file) {
        // re-openable per call
        return new UploadedFile(file.getContentType(), file.getOriginalFilename(), file.getSize(), file::getInputStream);
    }
}
