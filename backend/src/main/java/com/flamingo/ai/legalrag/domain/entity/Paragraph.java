package com.flamingo.ai.legalrag.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A cleaned paragraph of a legal document. The generated {@code id} is the join key shared with
 * the keyword index and the vector index.
 *
 * <p>The table is created by {@code schema.sql} with an {@code AUTOINCREMENT} key, so SQLite never
 * hands out an id again, even after the highest row was deleted.
 */
@Entity
@Table(name = "paragraphs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Paragraph {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private Integer docId;

  @Column(nullable = false)
  private Integer chapterId;

  @Column(nullable = false)
  private Integer paragraphId;

  /** HTML-stripped, whitespace-normalized text. */
  @Column(nullable = false)
  private String text;
}
