package ae.teletronics.attachment.adapters.persistence.repo;

import ae.teletronics.attachment.domain.model.Attachment;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface AttachmentRepository extends MongoRepository<Attachment, String> {
}
