package com.jay.aurora.model;

import com.jay.aurora.model.enums.PortfolioAction;

import java.util.List;

/** Action for one position plus the reasons that produced it. Every reason names its threshold. */
public record PortfolioActionSuggestion(PortfolioAction action, List<String> reasoning) {}
