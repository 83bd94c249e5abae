package com.anthem.iamx.graph.query;

import com.anthem.iamx.graph.Attribution;
import com.anthem.iamx.graph.PermissionGraph;
import com.anthem.iamx.graph.PolicyGrant;
import com.anthem.iamx.graph.exception.QueryCancelledException;
import com.anthem.iamx.graph.model.Identity;
import com.anthem.iamx.graph.model.Statement;
import com.anthem.iamx.graph.pattern.PatternSet;
import com.anthem.iamx.graph.pattern.WildcardPattern;
import com.anthem.iamx.graph.policy.PolicyEvaluator;
import com.anthem.iamx.graph.policy.StatementMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Answers who-can-do and what-can-do queries over a built {@link PermissionGraph}.
 *
 * <p>Both queries only read the graph. All traversal state (visited roles, memoized role
 * access) lives in local variables, so one engine can serve concurrent queries.
 */
public class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private final PermissionGraph graph;
    private final PolicyEvaluator evaluator;

    public QueryEngine(PermissionGraph graph, PolicyEvaluator evaluator) {
        this.graph = graph;
        this.evaluator = evaluator;
    }

    public PermissionGraph getGraph() {
        return graph;
    }

    public List<AccessEntry> whoCanDo(String actionPattern) {
        return whoCanDo(actionPattern, "*");
    }

    /**
     * Identities allowed to perform some action matching {@code actionPattern} on some
     * resource matching {@code resourcePattern}.
     *
     * @see #whoCanDoReport(String, String)
     */
    public List<AccessEntry> whoCanDo(String actionPattern, String resourcePattern) {
        return whoCanDoReport(actionPattern, resourcePattern).getEntries();
    }

    /**
     * Identities allowed to perform some action matching {@code actionPattern} on some
     * resource matching {@code resourcePattern}.
     *
     * <p>An identity qualifies when one of its Allow statements overlaps the query and no
     * Deny statement covers the whole query. A user or role that does not qualify on its
     * own policies still qualifies if a role it can assume (directly or through a chain)
     * does; the entry is then attributed to the shortest such chain.
     *
     * <p>Conditions are treated as always true, so a conditioned Deny can drop an identity
     * that some request contexts would allow. Such identities are listed in
     * {@link WhoCanDoReport#getExclusions()} and logged at WARN.
     *
     * @throws com.anthem.iamx.graph.exception.InvalidPatternException if a pattern is empty or malformed
     * @throws QueryCancelledException if the calling thread is interrupted
     */
    public WhoCanDoReport whoCanDoReport(String actionPattern, String resourcePattern) {
        WildcardPattern action = PatternValidator.validate("action", actionPattern);
        WildcardPattern resource = PatternValidator.validate("resource", resourcePattern);
        String query = "who-can-do " + actionPattern + " " + resourcePattern;

        Map<String, Optional<AccessEntry>> roleAccess = new HashMap<>();
        Map<String, Set<Identity>> assumable = new HashMap<>();
        WhoCanDoReport.WhoCanDoReportBuilder report = WhoCanDoReport.builder()
                .action(actionPattern)
                .resource(resourcePattern);
        int matched = 0;

        Iterator<Identity> identities = graph.allIdentities().iterator();
        while (identities.hasNext()) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Query cancelled: query={}, matched={}", query, matched);
                throw new QueryCancelledException(query);
            }
            Identity identity = identities.next();

            Set<QueryWarning> conditionedDenies = new LinkedHashSet<>();
            Optional<AccessEntry> granted = access(identity, graph.effectivePolicyGrants(identity), action, resource,
                    conditionedDenies);
            if (granted.isEmpty() && identity.getType().canAssumeRoles()) {
                granted = viaAssumedRole(identity, action, resource, roleAccess, assumable);
            }

            if (granted.isPresent()) {
                logAmbiguities(identity.getArn(), granted.get().getWarnings());
                report.entry(granted.get());
                matched++;
            } else if (!conditionedDenies.isEmpty()) {
                log.warn("Identity excluded by conditioned Deny: identity={}, query={}", identity.getArn(), query);
                logAmbiguities(identity.getArn(), conditionedDenies);
                report.exclusion(ExcludedIdentity.builder()
                        .identityArn(identity.getArn())
                        .identityName(identity.getName())
                        .identityType(identity.getType())
                        .warnings(conditionedDenies)
                        .build());
            }
        }

        log.info("who-can-do completed: action={}, resource={}, identities={}",
                actionPattern, resourcePattern, matched);
        return report.build();
    }

    /**
     * Every grant reachable from the identity: its own and group-inherited policies, then the
     * policies of each role it can assume, followed transitively. Each role is expanded at most
     * once per query, so cyclic trust chains terminate.
     *
     * @param reference ARN, {@code Type:name} or display name
     * @throws com.anthem.iamx.graph.exception.UnknownIdentityException if the identity is not in the graph
     */
    public PermissionReport whatCanDo(String reference) {
        Identity identity = graph.findIdentity(reference);

        Map<Object, PermissionTuple> tuples = new LinkedHashMap<>();
        Set<QueryWarning> warnings = new LinkedHashSet<>();
        List<Attribution> roleChains = new ArrayList<>();

        List<PolicyGrant> own = graph.effectivePolicyGrants(identity);
        own.forEach(grant -> collect(grant.getDocument().getStatements(), grant, grant.getAttribution(), tuples, warnings));

        Set<String> visited = new HashSet<>();
        visited.add(identity.getArn());
        Deque<Hop> queue = new ArrayDeque<>();
        queue.add(new Hop(identity, Attribution.direct()));

        while (!queue.isEmpty()) {
            Hop hop = queue.poll();
            for (Identity role : graph.assumableRoles(hop.principal)) {
                if (!visited.add(role.getArn())) {
                    continue;
                }
                Attribution chain = hop.attribution.thenRole(role.getName());
                roleChains.add(chain);
                for (PolicyGrant grant : graph.effectivePolicyGrants(role)) {
                    collect(grant.getDocument().getStatements(), grant, chain, tuples, warnings);
                }
                queue.add(new Hop(role, chain));
            }
        }

        for (QueryWarning warning : warnings) {
            log.warn("Condition ignored: identity={}, statement={}", identity.getArn(), warning.getLocation());
        }
        log.info("what-can-do completed: identity={}, tuples={}, assumableRoles={}",
                identity.getArn(), tuples.size(), roleChains.size());

        return PermissionReport.builder()
                .identityArn(identity.getArn())
                .identityName(identity.getName())
                .identityType(identity.getType())
                .permissions(List.copyOf(tuples.values()))
                .assumableRoles(List.copyOf(roleChains))
                .warnings(List.copyOf(warnings))
                .effectivePolicies(graph.effectivePolicies(identity))
                .evaluator(evaluator)
                .build();
    }

    private Optional<AccessEntry> viaAssumedRole(Identity start, WildcardPattern action, WildcardPattern resource,
                                                 Map<String, Optional<AccessEntry>> roleAccess,
                                                 Map<String, Set<Identity>> assumable) {
        Set<String> visited = new HashSet<>();
        visited.add(start.getArn());
        Deque<Hop> queue = new ArrayDeque<>();
        queue.add(new Hop(start, Attribution.direct()));

        while (!queue.isEmpty()) {
            Hop hop = queue.poll();
            Set<Identity> roles = assumable.computeIfAbsent(hop.principal.getArn(),
                    arn -> graph.assumableRoles(hop.principal));
            for (Identity role : roles) {
                if (!visited.add(role.getArn())) {
                    continue;
                }
                Attribution chain = hop.attribution.thenRole(role.getName());
                // the role's own exclusion is reported when the role itself is visited
                Optional<AccessEntry> granted = roleAccess.computeIfAbsent(role.getArn(),
                        arn -> access(role, graph.effectivePolicyGrants(role), action, resource, new HashSet<>()));
                if (granted.isPresent()) {
                    AccessEntry entry = granted.get();
                    return Optional.of(entry.toBuilder()
                            .identityArn(start.getArn())
                            .identityName(start.getName())
                            .identityType(start.getType())
                            .attribution(chain)
                            .build());
                }
                queue.add(new Hop(role, chain));
            }
        }
        return Optional.empty();
    }

    /**
     * Decide the query for one identity's grants. Empty when nothing overlaps, when a Deny
     * covers the whole query, or when every overlapping Allow pattern is itself covered by
     * a Deny. If an overlapping Allow was dropped and a conditioned Deny took part, that
     * Deny's warning goes to {@code conditionedDenies}.
     */
    private Optional<AccessEntry> access(Identity identity, List<PolicyGrant> grants,
                                         WildcardPattern action, WildcardPattern resource,
                                         Set<QueryWarning> conditionedDenies) {
        List<Statement> denies = new ArrayList<>();
        Set<QueryWarning> denyWarnings = new LinkedHashSet<>();
        boolean covered = false;

        for (PolicyGrant grant : grants) {
            for (Statement statement : grant.getDocument().getStatements()) {
                if (!statement.isDeny() || !evaluator.overlaps(statement, action, resource)) {
                    continue;
                }
                if (evaluator.covers(statement, action, resource)) {
                    if (!statement.hasCondition()) {
                        return Optional.empty();
                    }
                    covered = true;
                }
                denies.add(statement);
                if (statement.hasCondition()) {
                    denyWarnings.add(QueryWarning.ambiguity(new StatementMatch(grant.getDocument(), statement)));
                }
            }
        }

        Set<String> actions = new LinkedHashSet<>();
        Set<String> resources = new LinkedHashSet<>();
        Set<String> sources = new LinkedHashSet<>();
        Set<QueryWarning> warnings = new LinkedHashSet<>(denyWarnings);
        Attribution attribution = null;
        boolean allowOverlaps = false;

        for (PolicyGrant grant : grants) {
            for (Statement statement : grant.getDocument().getStatements()) {
                if (!statement.isAllow() || !evaluator.overlaps(statement, action, resource)) {
                    continue;
                }
                allowOverlaps = true;
                if (covered || !survivesDenies(statement, action, resource, denies)) {
                    continue;
                }
                actions.add(describe(statement.getActions()));
                resources.add(describe(statement.effectiveResources()));
                sources.add(grant.getDocument().getId());
                if (attribution == null) {
                    attribution = grant.getAttribution();
                }
                if (statement.hasCondition()) {
                    warnings.add(QueryWarning.ambiguity(new StatementMatch(grant.getDocument(), statement)));
                }
            }
        }

        if (attribution == null) {
            if (allowOverlaps) {
                conditionedDenies.addAll(denyWarnings);
            }
            return Optional.empty();
        }
        return Optional.of(AccessEntry.builder()
                .identityArn(identity.getArn())
                .identityName(identity.getName())
                .identityType(identity.getType())
                .matchedActions(actions)
                .matchedResources(resources)
                .sourcePolicies(sources)
                .attribution(attribution)
                .warnings(warnings)
                .build());
    }

    /**
     * True if some (action, resource) pattern pair of the Allow statement that overlaps the
     * query is not covered by a single Deny statement. Negated elements are kept as they are.
     */
    private boolean survivesDenies(Statement allow, WildcardPattern action, WildcardPattern resource,
                                   List<Statement> denies) {
        PatternSet allowActions = allow.getActions();
        PatternSet allowResources = allow.effectiveResources();
        if (denies.isEmpty() || allowActions.isNegated() || allowResources.isNegated()) {
            return true;
        }
        for (WildcardPattern a : allowActions.getPatterns()) {
            if (!a.overlaps(action)) {
                continue;
            }
            for (WildcardPattern r : allowResources.getPatterns()) {
                if (r.overlaps(resource) && denies.stream().noneMatch(d -> evaluator.covers(d, a, r))) {
                    return true;
                }
            }
        }
        return false;
    }

    private void collect(List<Statement> statements, PolicyGrant grant, Attribution attribution,
                         Map<Object, PermissionTuple> tuples, Set<QueryWarning> warnings) {
        String source = grant.getDocument().getId();
        for (Statement statement : statements) {
            if (statement.hasCondition()) {
                warnings.add(QueryWarning.ambiguity(new StatementMatch(grant.getDocument(), statement)));
            }
            for (String action : patterns(statement.getActions())) {
                for (String resource : patterns(statement.effectiveResources())) {
                    PermissionTuple tuple = PermissionTuple.builder()
                            .action(action)
                            .notAction(statement.getActions().isNegated())
                            .resource(resource)
                            .notResource(statement.effectiveResources().isNegated())
                            .effect(statement.getEffect())
                            .sourcePolicy(source)
                            .attribution(attribution)
                            .conditioned(statement.hasCondition())
                            .build();
                    tuples.putIfAbsent(tuple.key(), tuple);
                }
            }
        }
    }

    // a negated set stays one tuple: splitting NotAction [a, b] would change its meaning
    private static List<String> patterns(PatternSet set) {
        return set.isNegated() ? List.of(String.join(",", set.getValues())) : set.getValues();
    }

    private static String describe(PatternSet set) {
        String values = String.join(",", set.getValues());
        return set.isNegated() ? "NOT(" + values + ")" : values;
    }

    private static void logAmbiguities(String identityArn, Collection<QueryWarning> warnings) {
        for (QueryWarning warning : warnings) {
            log.warn("Condition ignored: identity={}, statement={}", identityArn, warning.getLocation());
        }
    }

    private static final class Hop {
        private final Identity principal;
        private final Attribution attribution;

        private Hop(Identity principal, Attribution attribution) {
            this.principal = principal;
            this.attribution = attribution;
        }
    }
}
