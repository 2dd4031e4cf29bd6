package ae.teletronics.attachment.adapters.persistence;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;

/**
 * Enables auditing so Attachment.createdAt / updatedAt are filled on save.
 */
@Configuration
@EnableMongoAuditing
public class MongoPersistenceConfig {
}
