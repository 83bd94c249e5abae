package com.anthem.iamx.graph.policy;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Outcome of evaluating a set of documents, with the statements that decided it.
 */
@Value
public class EvaluationResult {

    Decision decision;
    List<StatementMatch> matchedAllows;
    List<StatementMatch> matchedDenies;

    /**
     * Matching statements whose Condition block was ignored.
     */
    public List<StatementMatch> getAmbiguities() {
        return Stream.concat(matchedDenies.stream(), matchedAllows.stream())
                .filter(StatementMatch::isConditioned)
                .collect(Collectors.toList());
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOW;
    }
}
