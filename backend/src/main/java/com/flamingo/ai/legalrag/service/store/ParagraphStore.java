package com.flamingo.ai.legalrag.service.store;

import com.flamingo.ai.legalrag.domain.entity.Paragraph;
import com.flamingo.ai.legalrag.domain.repository.ParagraphRepository;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable table of paragraph records. Assigns the identifier that the keyword and vector indexes
 * reuse, and hydrates search hits back into full records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParagraphStore {

  private final ParagraphRepository paragraphRepository;

  /**
   * Stores a new paragraph and returns its assigned identifier.
   *
   * @param paragraph the paragraph to store; its id must be unset
   * @return the assigned id
   * @throws IllegalArgumentException if the text is blank or the id is already set
   */
  @Transactional
  public long put(Paragraph paragraph) {
    validate(paragraph);
    return paragraphRepository.save(paragraph).getId();
  }

  /**
   * Stores a batch of new paragraphs in one transaction.
   *
   * @return the stored paragraphs with their assigned ids, in input order
   */
  @Transactional
  public List<Paragraph> putAll(List<Paragraph> paragraphs) {
    paragraphs.forEach(this::validate);
    return paragraphRepository.saveAll(paragraphs);
  }

  /**
   * Loads the paragraphs with the given ids. Ids without a stored record are omitted.
   *
   * @param ids the ids to load
   * @return map from id to paragraph
   */
  @Transactional(readOnly = true)
  public Map<Long, Paragraph> getMany(Collection<Long> ids) {
    if (ids.isEmpty()) {
      return Map.of();
    }
    Map<Long, Paragraph> byId = new HashMap<>();
    for (Paragraph paragraph : paragraphRepository.findByIdIn(ids)) {
      byId.put(paragraph.getId(), paragraph);
    }
    return byId;
  }

  @Transactional(readOnly = true)
  public long count() {
    return paragraphRepository.count();
  }

  @Transactional
  public void deleteAll(Collection<Long> ids) {
    if (!ids.isEmpty()) {
      paragraphRepository.deleteAllByIdInBatch(ids);
      log.info("Deleted {} paragraphs from record store", ids.size());
    }
  }

  /** Removes every record. Identifiers already handed out are still never reused. */
  @Transactional
  public void clear() {
    paragraphRepository.deleteAllInBatch();
    log.info("Cleared record store");
  }

  private void validate(Paragraph paragraph) {
    if (paragraph.getId() != null) {
      throw new IllegalArgumentException(
          "Paragraph already has id " + paragraph.getId() + "; ids are assigned by the store");
    }
    if (paragraph.getText() == null || paragraph.getText().isBlank()) {
      throw new IllegalArgumentException(
          String.format(
              "Paragraph text must not be empty (doc %d, chapter %d, paragraph %d)",
              paragraph.getDocId(), paragraph.getChapterId(), paragraph.getParagraphId()));
    }
  }
}
