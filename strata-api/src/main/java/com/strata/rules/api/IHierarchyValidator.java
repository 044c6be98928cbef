package com.strata.rules.api;

import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.ValidationReport;

import java.util.Map;

/**
 * Validates a whole rule set for cycles, orphans and conflicts.
 */
public interface IHierarchyValidator {

    ValidationReport validate(Map<String, ParsedRule> allRules);
}
