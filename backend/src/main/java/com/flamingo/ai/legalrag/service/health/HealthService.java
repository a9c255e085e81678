package com.flamingo.ai.legalrag.service.health;

import com.flamingo.ai.legalrag.api.dto.response.SystemStats;

/** Service interface for health checks and corpus statistics. */
public interface HealthService {

  /**
   * Gets corpus statistics from the record store.
   *
   * @return system statistics
   */
  SystemStats getSystemStats();
}
