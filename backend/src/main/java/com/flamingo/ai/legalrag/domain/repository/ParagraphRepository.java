package com.flamingo.ai.legalrag.domain.repository;

import com.flamingo.ai.legalrag.domain.entity.Paragraph;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Paragraph entities. */
@Repository
public interface ParagraphRepository extends JpaRepository<Paragraph, Long> {

  /** Finds all paragraphs whose id is in the given collection; unknown ids are ignored. */
  List<Paragraph> findByIdIn(Collection<Long> ids);
}
