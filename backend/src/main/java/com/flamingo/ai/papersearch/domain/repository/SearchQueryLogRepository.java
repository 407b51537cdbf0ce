package com.flamingo.ai.papersearch.domain.repository;

import com.flamingo.ai.papersearch.domain.entity.SearchQueryLog;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for the search audit log. */
@Repository
public interface SearchQueryLogRepository extends JpaRepository<SearchQueryLog, UUID> {}
