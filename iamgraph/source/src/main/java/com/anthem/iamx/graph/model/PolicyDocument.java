package com.anthem.iamx.graph.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Ordered collection of statements.
 *
 * <p>Managed documents are identified by their ARN. Inline and trust documents are
 * identified by the owning identity: {@code <owner arn>#<inline name>} and
 * {@code <role arn>#trust}.
 */
@Value
public class PolicyDocument {

    String id;
    String name;
    PolicyKind kind;
    String ownerArn;
    boolean awsManaged;
    String version;
    List<Statement> statements;

    @Builder
    public PolicyDocument(String id, String name, PolicyKind kind, String ownerArn, boolean awsManaged,
                          String version, List<Statement> statements) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.ownerArn = ownerArn;
        this.awsManaged = awsManaged;
        this.version = version;
        this.statements = statements == null ? List.of() : List.copyOf(statements);
    }

    public static String inlineId(String ownerArn, String inlineName) {
        return ownerArn + "#" + inlineName;
    }

    public static String trustId(String roleArn) {
        return roleArn + "#trust";
    }

    public boolean isManaged() {
        return kind == PolicyKind.MANAGED;
    }

    public boolean isInline() {
        return kind == PolicyKind.INLINE;
    }
}
