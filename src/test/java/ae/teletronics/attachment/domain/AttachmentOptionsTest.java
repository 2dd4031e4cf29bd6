package ae.teletronics.attachment.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttachmentOptionsTest {

    @Test
    void defaults_allow_any_type_between_one_byte_and_one_megabyte() {
        AttachmentOptions options = AttachmentOptions.defaults();

        assertThat(options.restrictsContentType()).isFalse();
        assertThat(options.getSize()).isEqualTo(new SizeRange(1, 1048576));
        assertThat(options.getPathPrefix()).isEqualTo("attachments");
        assertThat(options.getStorage()).isEqualTo(AttachmentOptions.FILE_SYSTEM);
    }

    @Test
    void image_shorthand_expands_to_known_image_types() {
        AttachmentOptions options = AttachmentOptions.builder()
                .contentType("image", "application/pdf")
                .build();

        assertThat(options.getContentTypes())
                .containsAll(AttachmentOptions.IMAGE_CONTENT_TYPES)
                .contains("application/pdf")
                .doesNotContain("image")
                .hasSize(AttachmentOptions.IMAGE_CONTENT_TYPES.size() + 1);
    }

    @Test
    void explicit_range_overrides_min_and_max() {
        AttachmentOptions options = AttachmentOptions.builder()
                .minSize(10)
                .maxSize(20)
                .size(100, 200)
                .build();

        assertThat(options.getSize()).isEqualTo(new SizeRange(100, 200));
    }

    @Test
    void only_max_set_keeps_default_min() {
        AttachmentOptions options = AttachmentOptions.builder().maxSize(1024).build();

        assertThat(options.getSize()).isEqualTo(new SizeRange(1, 1024));
    }

    @Test
    void leading_slash_is_dropped_from_path_prefix() {
        AttachmentOptions options = AttachmentOptions.builder().pathPrefix("/public/uploads/").build();

        assertThat(options.getPathPrefix()).isEqualTo("public/uploads");
    }

    @Test
    void isImage_matches_image_list_only() {
        assertThat(AttachmentOptions.isImage("image/png")).isTrue();
        assertThat(AttachmentOptions.isImage("image/x-citrix-pjpeg")).isTrue();
        assertThat(AttachmentOptions.isImage("application/pdf")).isFalse();
        assertThat(AttachmentOptions.isImage(null)).isFalse();
    }

    @Test
    void size_range_parses_and_rejects_garbage() {
        assertThat(SizeRange.parse("1..1048576")).isEqualTo(new SizeRange(1, 1048576));
        assertThat(SizeRange.parse(" 5 .. 10 ")).isEqualTo(new SizeRange(5, 10));

        assertThatThrownBy(() -> SizeRange.parse("10")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SizeRange.parse("a..b")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SizeRange(10, 5)).isInstanceOf(IllegalArgumentException.class);
    }
}
