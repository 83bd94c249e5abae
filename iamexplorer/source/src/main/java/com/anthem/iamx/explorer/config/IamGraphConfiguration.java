package com.anthem.iamx.explorer.config;

import com.anthem.iamx.explorer.render.DotRenderer;
import com.anthem.iamx.graph.GraphBuilder;
import com.anthem.iamx.graph.io.GraphSerializer;
import com.anthem.iamx.graph.policy.PolicyEvaluator;
import com.anthem.iamx.graph.policy.TrustPolicyEvaluator;
import com.anthem.iamx.graph.snapshot.PolicyDocumentCodec;
import com.anthem.iamx.graph.snapshot.SnapshotReader;
import com.anthem.iamx.graph.snapshot.SnapshotWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the plain graph library into the Spring context.
 */
@Configuration
@EnableConfigurationProperties(IamxProperties.class)
public class IamGraphConfiguration {

    @Bean
    public PolicyDocumentCodec policyDocumentCodec(ObjectMapper objectMapper) {
        return new PolicyDocumentCodec(objectMapper);
    }

    @Bean
    public PolicyEvaluator policyEvaluator() {
        return new PolicyEvaluator();
    }

    @Bean
    public TrustPolicyEvaluator trustPolicyEvaluator() {
        return new TrustPolicyEvaluator();
    }

    @Bean
    public GraphBuilder graphBuilder(PolicyDocumentCodec codec, TrustPolicyEvaluator trustPolicyEvaluator) {
        return new GraphBuilder(codec, trustPolicyEvaluator);
    }

    @Bean
    public GraphSerializer graphSerializer(ObjectMapper objectMapper, PolicyDocumentCodec codec,
                                           GraphBuilder graphBuilder) {
        return new GraphSerializer(objectMapper, codec, graphBuilder);
    }

    @Bean
    public SnapshotReader snapshotReader(ObjectMapper objectMapper) {
        return new SnapshotReader(objectMapper);
    }

    @Bean
    public SnapshotWriter snapshotWriter(ObjectMapper objectMapper) {
        return new SnapshotWriter(objectMapper);
    }

    @Bean
    public DotRenderer dotRenderer() {
        return new DotRenderer();
    }
}
