package com.anthem.iamx.graph.policy;

import com.anthem.iamx.graph.model.PolicyDocument;
import com.anthem.iamx.graph.model.Statement;
import com.anthem.iamx.graph.pattern.WildcardPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Allow/deny evaluation of identity policies.
 *
 * <p>Evaluation always scans every statement of every document before deciding:
 * a Deny anywhere wins over any number of Allows, independent of statement or
 * document order. Condition blocks are not evaluated; a conditioned statement whose
 * action and resource match counts as matching, so results may over-report allows
 * but never hide a deny.
 *
 * <p>Stateless and safe to share between threads.
 */
public class PolicyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluator.class);

    /**
     * True iff the statement's action and resource elements both match the concrete pair.
     */
    public boolean matches(Statement statement, String action, String resource) {
        return statement.getActions().matches(action)
                && statement.effectiveResources().matches(resource);
    }

    public Decision evaluate(Collection<PolicyDocument> documents, String action, String resource) {
        return evaluateDetailed(documents, action, resource).getDecision();
    }

    /**
     * Evaluate a concrete (action, resource) pair and report the deciding statements.
     */
    public EvaluationResult evaluateDetailed(Collection<PolicyDocument> documents, String action, String resource) {
        List<StatementMatch> allows = new ArrayList<>();
        List<StatementMatch> denies = new ArrayList<>();

        for (PolicyDocument document : documents) {
            for (Statement statement : document.getStatements()) {
                if (!matches(statement, action, resource)) {
                    continue;
                }
                StatementMatch match = new StatementMatch(document, statement);
                if (statement.isDeny()) {
                    denies.add(match);
                } else {
                    allows.add(match);
                }
            }
        }

        Decision decision;
        if (!denies.isEmpty()) {
            decision = Decision.DENY;
        } else if (!allows.isEmpty()) {
            decision = Decision.ALLOW;
        } else {
            decision = Decision.IMPLICIT_DENY;
        }

        log.debug("Evaluated action={}, resource={}, documents={}, decision={}",
                action, resource, documents.size(), decision);
        return new EvaluationResult(decision, allows, denies);
    }

    /**
     * True if the statement applies to at least one concrete (action, resource) pair
     * described by the query patterns.
     */
    public boolean overlaps(Statement statement, WildcardPattern action, WildcardPattern resource) {
        return statement.getActions().overlaps(action)
                && statement.effectiveResources().overlaps(resource);
    }

    /**
     * True if the statement applies to every concrete (action, resource) pair described
     * by the query patterns. Used to decide whether a Deny cancels a whole query.
     */
    public boolean covers(Statement statement, WildcardPattern action, WildcardPattern resource) {
        return statement.getActions().covers(action)
                && statement.effectiveResources().covers(resource);
    }
}
