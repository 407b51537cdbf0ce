package com.flamingo.ai.papersearch.domain.repository;

import com.flamingo.ai.papersearch.domain.entity.Document;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for paper documents. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  List<Document> findAllByOrderByUploadedAtDesc();
}
