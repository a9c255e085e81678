package com.flamingo.ai.legalrag.service.health;

import com.flamingo.ai.legalrag.api.dto.response.SystemStats;
import com.flamingo.ai.legalrag.service.store.ParagraphStore;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Implementation of HealthService backed by the record store. */
@Service
@RequiredArgsConstructor
public class HealthServiceImpl implements HealthService {

  private final ParagraphStore paragraphStore;

  @Override
  @Timed(value = "health.stats", description = "Time to get system stats")
  public SystemStats getSystemStats() {
    return SystemStats.builder()
        .totalParagraphs(paragraphStore.count())
        .timestamp(LocalDateTime.now())
        .build();
  }
}
