package com.jay.aurora.layer1_data;

import com.jay.aurora.model.PortfolioContext;

import java.util.Optional;

/**
 * Layer 1 — Portfolio storage backend. An empty result means the ticker is analysed stand-alone.
 */
public interface PortfolioStore {

    Optional<PortfolioContext> findContext(String ticker);
}
