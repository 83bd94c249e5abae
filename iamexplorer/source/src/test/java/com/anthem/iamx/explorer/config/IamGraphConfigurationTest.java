package com.anthem.iamx.explorer.config;

import com.anthem.iamx.explorer.render.DotRenderer;
import com.anthem.iamx.fetcher.FetcherConfig;
import com.anthem.iamx.graph.GraphBuilder;
import com.anthem.iamx.graph.io.GraphSerializer;
import com.anthem.iamx.graph.snapshot.SnapshotReader;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class IamGraphConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(IamGraphConfiguration.class, AwsConfiguration.class);

    @Test
    void wiresGraphServicesWithDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(GraphBuilder.class)
                    .hasSingleBean(GraphSerializer.class)
                    .hasSingleBean(SnapshotReader.class)
                    .hasSingleBean(DotRenderer.class);

            IamxProperties properties = context.getBean(IamxProperties.class);
            assertThat(properties.getGraphFile()).isEqualTo("iam_graph.json");
            assertThat(properties.getBatch().getWorkers()).isEqualTo(4);

            FetcherConfig fetcherConfig = context.getBean(FetcherConfig.class);
            assertThat(fetcherConfig.isLocal()).isFalse();
            assertThat(fetcherConfig.getRegion()).isEqualTo("us-east-1");
        });
    }

    @Test
    void bindsIamxProperties() {
        contextRunner
                .withPropertyValues(
                        "iamx.graph-file=/tmp/g.json",
                        "iamx.format=json",
                        "iamx.batch.workers=2",
                        "iamx.batch.timeout=5s",
                        "iamx.aws.profile=audit",
                        "iamx.aws.region=eu-west-1",
                        "iamx.aws.include-aws-managed=true")
                .run(context -> {
                    IamxProperties properties = context.getBean(IamxProperties.class);
                    assertThat(properties.getGraphFile()).isEqualTo("/tmp/g.json");
                    assertThat(properties.getFormat()).isEqualTo("json");
                    assertThat(properties.getBatch().getTimeout()).isEqualTo(Duration.ofSeconds(5));

                    FetcherConfig fetcherConfig = context.getBean(FetcherConfig.class);
                    assertThat(fetcherConfig.getProfile()).isEqualTo("audit");
                    assertThat(fetcherConfig.getRegion()).isEqualTo("eu-west-1");
                    assertThat(fetcherConfig.isIncludeAwsManaged()).isTrue();
                });
    }

    @Test
    void localProfileTargetsLocalStack() {
        contextRunner
                .withInitializer(context -> context.getEnvironment().setActiveProfiles("local"))
                .run(context -> {
                    FetcherConfig fetcherConfig = context.getBean(FetcherConfig.class);
                    assertThat(fetcherConfig.isLocal()).isTrue();
                    assertThat(fetcherConfig.getEndpoint()).isEqualTo("http://localhost:4566");
                });
    }
}
