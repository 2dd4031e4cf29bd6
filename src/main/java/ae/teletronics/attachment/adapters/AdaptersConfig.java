package ae.teletronics.attachment.adapters;

import ae.teletronics.attachment.adapters.detection.TikaFileTypeDetector;
import ae.teletronics.attachment.adapters.processing.ImageDimensionsProcessor;
import ae.teletronics.attachment.adapters.storage.LocalFsStorageAdapter;
import ae.teletronics.attachment.application.AttachmentLifecycle;
import ae.teletronics.attachment.application.util.TempFiles;
import ae.teletronics.attachment.domain.AttachmentOptions;
import ae.teletronics.attachment.domain.SizeRange;
import ae.teletronics.attachment.ports.AttachmentProcessor;
import ae.teletronics.attachment.ports.FileTypeDetector;
import ae.teletronics.attachment.ports.StoragePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

@Configuration
@Profile("!test")
public class AdaptersConfig {

    private static final Logger log = LoggerFactory.getLogger(AdaptersConfig.class);

    @Bean
    @ConditionalOnMissingBean(AttachmentOptions.class)
    public AttachmentOptions attachmentOptions(
            @Value("${attachment.content-type:}") String contentTypes,
            @Value("${attachment.min-size:1}") long minSize,
            @Value("${attachment.max-size:1048576}") long maxSize,
            @Value("${attachment.size:}") String size,
            @Value("${attachment.path-prefix:attachments}") String pathPrefix,
            @Value("${attachment.storage:file_system}") String storage
    ) {
        AttachmentOptions.Builder builder = AttachmentOptions.builder()
                .contentTypes(StringUtils.commaDelimitedListToSet(contentTypes))
                .minSize(minSize)
                .maxSize(maxSize)
                .pathPrefix(pathPrefix)
                .storage(storage);
        if (StringUtils.hasText(size)) {
            builder.size(SizeRange.parse(size));
        }
        AttachmentOptions options = builder.build();
        log.info("Attachment options: {}", options);
        return options;
    }

    @Bean
    @ConditionalOnMissingBean(StoragePort.class)
    public StoragePort storagePort(
            AttachmentOptions options,
            @Value("${storage.base-path:/data/storage}") String basePath,
            @Value("${storage.fsync-on-write:false}") boolean fsyncOnWrite
    ) throws IOException {
        if (!AttachmentOptions.FILE_SYSTEM.equals(options.getStorage())) {
            throw new IllegalStateException("Unknown storage backend: " + options.getStorage());
        }
        Path root = Paths.get(basePath).toAbsolutePath().normalize();
        Files.createDirectories(root);
        return new LocalFsStorageAdapter(root, fsyncOnWrite);
    }

    @Bean
    @ConditionalOnMissingBean(FileTypeDetector.class)
    public FileTypeDetector fileTypeDetector() {
        return new TikaFileTypeDetector();
    }

    @Bean
    @ConditionalOnMissingBean(TempFiles.class)
    public TempFiles tempFiles(
            @Value("${attachment.tempfile-path:${java.io.tmpdir}/attachment_lifecycle}") String tempfilePath
    ) throws IOException {
        return new TempFiles(Paths.get(tempfilePath).toAbsolutePath().normalize());
    }

    @Bean
    public AttachmentProcessor imageDimensionsProcessor() {
        return new ImageDimensionsProcessor();
    }

    @Bean
    public AttachmentLifecycle attachmentLifecycle(AttachmentOptions options,
                                                   StoragePort storage,
                                                   FileTypeDetector typeDetector,
                                                   TempFiles tempFiles,
                                                   List<AttachmentProcessor> processors) {
        return new AttachmentLifecycle(options, storage, typeDetector, tempFiles, processors);
    }
}
