package ae.teletronics.attachment.adapters.web;

import ae.teletronics.attachment.application.AttachmentService;
import ae.teletronics.attachment.application.dto.AttachmentContent;
import ae.teletronics.attachment.application.dto.UploadedFile;
import ae.teletronics.attachment.application.exceptions.AttachmentValidationException;
import ae.teletronics.attachment.application.exceptions.NotFoundException;
import ae.teletronics.attachment.application.exceptions.ThumbnailException;
import ae.teletronics.attachment.domain.FieldError;
import ae.teletronics.attachment.domain.model.Attachment;
import ae.teletronics.attachment.ports.StoragePort;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpMethod;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = AttachmentController.class)
class AttachmentControllerSliceUnitTest {

    @Autowired MockMvc mvc;

    @MockBean AttachmentService attachments;

    private static Attachment attachment(String id, String filename, String contentType, long size) {
        Attachment a = new Attachment(id);
        a.setFilename(filename);
        a.setContentType(contentType);
        a.setSize(size);
        a.setStorageKey("attachments/" + id + "/" + filename);
        return a;
    }

    private static AttachmentContent download(Attachment record, String body) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        return new AttachmentContent(record, new StoragePort.StoredObject(record.getStorageKey(), bytes.length,
                () -> new ByteArrayInputStream(bytes)));
    }

    @Test
    void post_multipart_creates_attachment() throws Exception {
        when(attachments.create(any())).thenReturn(attachment("ID1", "a.txt", "text/plain", 5));
        MockMultipartFile file = new MockMultipartFile("file", "a.txt", "text/plain", "hello".getBytes());

        mvc.perform(multipart("/attachments").file(file))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id", is("ID1")))
                .andExpect(jsonPath("$.filename", is("a.txt")))
                .andExpect(jsonPath("$.size", is(5)));

        ArgumentCaptor<UploadedFile> captor = ArgumentCaptor.forClass(UploadedFile.class);
        verify(attachments).create(captor.capture());
        UploadedFile upload = captor.getValue();
        assertThat(upload.contentType()).isEqualTo("text/plain");
        assertThat(upload.originalFilename()).isEqualTo("a.txt");
        assertThat(upload.size()).isEqualTo(5L);
        assertThat(upload.source().openStream().readAllBytes()).containsExactly("hello".getBytes());
    }

    @Test
    void put_multipart_replaces_data() throws Exception {
        when(attachments.replace(eq("ID1"), any())).thenReturn(attachment("ID1", "b.txt", "text/plain", 3));
        MockMultipartFile file = new MockMultipartFile("file", "b.txt", "text/plain", "abc".getBytes());

        mvc.perform(multipart(HttpMethod.PUT, "/attachments/ID1").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.filename", is("b.txt")));
    }

    @Test
    void validation_failure_is_422_with_field_errors() throws Exception {
        when(attachments.create(any())).thenThrow(new AttachmentValidationException(
                List.of(FieldError.notIncluded("size", "1..1048576"))));
        MockMultipartFile file = new MockMultipartFile("file", "big.bin", "application/octet-stream", new byte[16]);

        mvc.perform(multipart("/attachments").file(file))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code", is("VALIDATION_ERROR")))
                .andExpect(jsonPath("$.fields", hasSize(1)))
                .andExpect(jsonPath("$.fields[0].attribute", is("size")))
                .andExpect(jsonPath("$.fields[0].allowed", is("1..1048576")));
    }

    @Test
    void missing_file_part_is_400() throws Exception {
        mvc.perform(multipart("/attachments"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("BAD_REQUEST")));

        verifyNoInteractions(attachments);
    }

    @Test
    void thumbnail_failure_is_reported_with_its_own_code() throws Exception {
        when(attachments.create(any())).thenThrow(new ThumbnailException("Unreadable image x.png"));
        MockMultipartFile file = new MockMultipartFile("file", "x.png", "image/png", new byte[]{1});

        mvc.perform(multipart("/attachments").file(file))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code", is("THUMBNAIL_ERROR")));
    }

    @Test
    void get_metadata_ok_and_unknown_is_404() throws Exception {
        when(attachments.find("ID1")).thenReturn(attachment("ID1", "a.txt", "text/plain", 5));
        when(attachments.find("NF")).thenThrow(new NotFoundException("Attachment not found"));

        mvc.perform(get("/attachments/ID1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.contentType", is("text/plain")));

        mvc.perform(get("/attachments/NF"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code", is("NOT_FOUND")));
    }

    @Test
    void download_streams_bytes_as_attachment() throws Exception {
        when(attachments.open("ID1")).thenReturn(download(attachment("ID1", "a.txt", "text/plain", 2), "hi"));

        mvc.perform(get("/attachments/ID1/data"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", org.hamcrest.Matchers.startsWith("text/plain")))
                .andExpect(header().string("Content-Disposition", containsString("filename=\"a.txt\"")))
                .andExpect(content().bytes("hi".getBytes(StandardCharsets.UTF_8)));

        verify(attachments, never()).find(anyString());
    }

    @Test
    void download_with_unparseable_stored_type_falls_back_to_octet_stream() throws Exception {
        when(attachments.open("ID2")).thenReturn(download(attachment("ID2", "g.bin", "garbage", 2), "hi"));

        mvc.perform(get("/attachments/ID2/data"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", "application/octet-stream"))
                .andExpect(content().bytes("hi".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void concurrent_update_is_409_stale_update() throws Exception {
        when(attachments.replace(eq("ID1"), any())).thenThrow(new OptimisticLockingFailureException("stale"));
        MockMultipartFile file = new MockMultipartFile("file", "b.txt", "text/plain", "abc".getBytes());

        mvc.perform(multipart(HttpMethod.PUT, "/attachments/ID1").file(file))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code", is("STALE_UPDATE")));
    }

    @Test
    void delete_is_204() throws Exception {
        mvc.perform(delete("/attachments/ID1"))
                .andExpect(status().isNoContent());

        verify(attachments).destroy("ID1");
    }
}
