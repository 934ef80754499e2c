package com.deepansh.memorychat.memory;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MemoryDocumentRepository extends MongoRepository<MemoryDocument, String> {

    long countByNamespace(String namespace);

    List<MemoryDocument> findByNamespaceOrderByCreatedAtDesc(String namespace, Pageable pageable);

    List<MemoryDocument> findByNamespaceOrderByCreatedAtAsc(String namespace, Pageable pageable);
}
