package com.anthem.iamx.graph.policy;

import com.anthem.iamx.graph.model.Identity;
import com.anthem.iamx.graph.model.PolicyDocument;
import com.anthem.iamx.graph.model.Statement;
import com.anthem.iamx.graph.pattern.WildcardPattern;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a role's trust policy lets a given user or role assume it.
 *
 * <p>A statement applies when its actions cover {@code sts:AssumeRole} and one of its
 * {@code AWS} principal values names the identity: the identity ARN (wildcards allowed),
 * {@code *}, or the identity's account as a bare id or {@code arn:aws:iam::<id>:root}.
 * Service and federated principals never match an identity of the snapshot.
 * A matching Deny statement wins.
 */
public class TrustPolicyEvaluator {

    public static final String ASSUME_ROLE_ACTION = "sts:AssumeRole";
    public static final String AWS_PRINCIPAL = "AWS";

    private static final Pattern ACCOUNT_ID = Pattern.compile("^\\d{12}$");
    private static final Pattern ACCOUNT_ROOT = Pattern.compile("^arn:aws[a-z-]*:iam::(\\d{12}):root$");

    public boolean allowsAssumption(PolicyDocument trustPolicy, Identity principal) {
        return evaluate(trustPolicy, principal).isAllowed();
    }

    /**
     * Evaluate the trust policy for one principal, keeping the statements that decided.
     */
    public EvaluationResult evaluate(PolicyDocument trustPolicy, Identity principal) {
        List<StatementMatch> allows = new ArrayList<>();
        List<StatementMatch> denies = new ArrayList<>();

        if (principal.getType().canAssumeRoles()) {
            for (Statement statement : trustPolicy.getStatements()) {
                if (!statement.getActions().matches(ASSUME_ROLE_ACTION) || !principalMatches(statement, principal)) {
                    continue;
                }
                StatementMatch match = new StatementMatch(trustPolicy, statement);
                if (statement.isDeny()) {
                    denies.add(match);
                } else {
                    allows.add(match);
                }
            }
        }

        Decision decision = !denies.isEmpty() ? Decision.DENY
                : !allows.isEmpty() ? Decision.ALLOW
                : Decision.IMPLICIT_DENY;
        return new EvaluationResult(decision, allows, denies);
    }

    /**
     * True if one of the statement's AWS principal values names the identity.
     */
    public boolean principalMatches(Statement statement, Identity principal) {
        List<String> values = statement.getPrincipals().get(AWS_PRINCIPAL);
        if (values == null) {
            return false;
        }
        for (String value : values) {
            if (principalValueMatches(value, principal)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Match a single AWS principal value against an identity.
     */
    public boolean principalValueMatches(String value, Identity principal) {
        if ("*".equals(value)) {
            return true;
        }
        String account = principal.getAccountId();
        if (ACCOUNT_ID.matcher(value).matches()) {
            return value.equals(account);
        }
        var root = ACCOUNT_ROOT.matcher(value);
        if (root.matches()) {
            return root.group(1).equals(account);
        }
        return WildcardPattern.of(value).matches(principal.getArn());
    }
}
