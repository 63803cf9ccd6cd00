package io.github.drompincen.collabsync.persistence.repository;

import io.github.drompincen.collabsync.persistence.document.ClientProfileDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ClientProfileRepository extends MongoRepository<ClientProfileDocument, String> {
}
