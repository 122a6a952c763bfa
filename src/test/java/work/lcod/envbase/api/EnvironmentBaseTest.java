package work.lcod.envbase.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.envbase.cloud.NoStackUpdatesException;
import work.lcod.envbase.cloud.StackNotFoundException;
import work.lcod.envbase.config.ConfigLoader;
import work.lcod.envbase.config.ConfigValidationException;
import work.lcod.envbase.config.DatabaseConfigHandler;
import work.lcod.envbase.deploy.DeployOutcome;
import work.lcod.envbase.monitor.MonitorState;
import work.lcod.envbase.monitor.StackEventHandler;
import work.lcod.envbase.monitor.StackStatuses;
import work.lcod.envbase.shared.HandlerRegistrationException;
import work.lcod.envbase.support.FakeCloud;
import work.lcod.envbase.template.Output;
import work.lcod.envbase.template.Parameter;
import work.lcod.envbase.template.Template;
import work.lcod.envbase.template.ValueRef;

class EnvironmentBaseTest {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path projectDir;

    private FakeCloud cloud;

    @BeforeEach
    void setUp() {
        cloud = new FakeCloud();
    }

    @Test
    void initWritesDefaultsIncludingHandlerSections() throws Exception {
        try (var env = environment(EnvironmentOptions.builder().projectDirectory(projectDir).build())) {
            env.addConfigHandler(new DatabaseConfigHandler());

            Path written = env.initAction();

            assertEquals(projectDir.resolve(ConfigLoader.DEFAULT_CONFIG_FILENAME), written);
            JsonNode config = JSON.readTree(written.toFile());
            assertEquals("environmentbase", config.at("/global/environment_name").asText());
            assertEquals("db.t3.micro", config.at("/db/primarydb/instance_class").asText());
        }
    }

    @Test
    void initKeepsAnExistingFile() throws Exception {
        Path file = projectDir.resolve(ConfigLoader.DEFAULT_CONFIG_FILENAME);
        Files.writeString(file, "{}");

        try (var env = environment(EnvironmentOptions.builder().projectDirectory(projectDir).build())) {
            env.initAction();
        }

        assertEquals("{}", Files.readString(file));
    }

    @Test
    void createWritesRootTemplateWithChildStacks() throws Exception {
        var env = new EnvironmentBase(options(), ignored -> cloud, CLOCK) {
            @Override
            protected void buildTemplate() {
                var database = new Template("db");
                database.addOutput(Output.of("dbEndpoint", ValueRef.getAtt("database", "Endpoint.Address")));
                addChildTemplate(database);
                var app = new Template("app");
                app.addParameter(Parameter.of("dbEndpoint", "String"));
                addChildTemplate(app);
            }
        };
        env.addManualParameterBinding("vpcCidr", "10.0.0.0/16");

        Path file = env.createAction();

        assertEquals(projectDir.resolve("templates").resolve("demo.template"), file);
        JsonNode root = JSON.readTree(file.toFile());
        assertEquals("demo environment", root.get("Description").asText());
        assertTrue(root.at("/Parameters/ec2Key").isObject());
        assertTrue(root.at("/Parameters/remoteAccessLocation").isObject());
        assertTrue(root.at("/Parameters/vpcId").isObject());
        assertTrue(root.at("/Parameters/vpcCidr").isMissingNode());
        assertEquals("AWS::S3::Bucket", root.at("/Resources/utilityBucket/Type").asText());
        assertEquals("demo-logs", root.at("/Resources/utilityBucket/Properties/BucketName").asText());
        assertEquals("10.0.0.0/16", root.at("/Resources/dbStack/Properties/Parameters/vpcCidr").asText());
        assertEquals("utilityBucket", root.at("/Resources/dbStack/Properties/Parameters/utilityBucket/Ref").asText());
        assertEquals("dbStack", root.at("/Resources/appStack/DependsOn/0").asText());
        assertEquals("dbStack", root.at("/Resources/appStack/Properties/Parameters/dbEndpoint/Fn::GetAtt/0").asText());
        assertTrue(root.at("/Mappings/RegionMap").isObject());
        assertTrue(root.at("/Outputs/templateValidationHash").isObject());
        assertEquals(2, cloud.count("putObject"));
        assertTrue(Files.isRegularFile(projectDir.resolve("ami_cache.json")));
    }

    @Test
    void createWithoutChildrenNeverTouchesTheCloud() {
        var env = new EnvironmentBase(options(), ignored -> {
            throw new AssertionError("cloud clients must not be created");
        }, CLOCK);

        env.createAction();

        assertTrue(Files.isRegularFile(projectDir.resolve("templates").resolve("demo.template")));
    }

    @Test
    void invalidConfigStopsBeforeAnyCloudCall() {
        var config = demoConfig();
        config.remove("network");
        var env = environment(EnvironmentOptions.builder().projectDirectory(projectDir).config(config).build());

        assertThrows(ConfigValidationException.class, env::createAction);
        assertThrows(ConfigValidationException.class, env::deployAction);
        assertTrue(cloud.calls.isEmpty());
    }

    @Test
    void deployWithoutHandlersSkipsTheNotificationChannel() {
        var env = environment(options());
        env.createAction();
        env.addDeployParameter("ec2Key", "ops");
        cloud.updateFailure = new StackNotFoundException("demo", "update", "does not exist", null);

        var report = env.deployAction();

        assertEquals(DeployOutcome.CREATED, report.outcome());
        assertTrue(report.monitor().isEmpty());
        assertEquals(List.of("updateStack", "createStack"), cloud.calls);
        assertEquals(Map.of("ec2Key", "ops"), cloud.creates.get(0).parameters());
        assertEquals("demo", cloud.creates.get(0).stackName());
    }

    @Test
    void deployMonitorsUntilTerminalStatusAndTearsDownChannel() {
        var env = environment(options());
        env.createAction();
        var seen = new ArrayList<String>();
        StackEventHandler handler = event -> {
            seen.add(event.status());
            return false;
        };
        env.addStackEventHandler(handler);
        cloud.enqueue(FakeCloud.event("demo", "demo", StackStatuses.STACK_RESOURCE_TYPE, "UPDATE_IN_PROGRESS"))
            .enqueue(FakeCloud.event("demo", "demo", StackStatuses.STACK_RESOURCE_TYPE, "UPDATE_COMPLETE"));

        var report = env.deployAction();

        assertEquals(DeployOutcome.UPDATED, report.outcome());
        assertEquals(MonitorState.TERMINATED, report.monitor().orElseThrow().state());
        assertEquals(List.of("UPDATE_IN_PROGRESS", "UPDATE_COMPLETE"), seen);
        assertEquals(1, cloud.count("deleteTopic"));
        assertEquals(1, cloud.count("deleteQueue"));
        assertEquals(1, cloud.updates.get(0).notificationTopics().size());
    }

    @Test
    void unchangedStackIsNotMonitored() {
        var env = environment(options());
        env.createAction();
        env.addStackEventHandler((StackEventHandler) event -> false);
        cloud.updateFailure = new NoStackUpdatesException("demo", "No updates are to be performed.", null);

        var report = env.deployAction();

        assertEquals(DeployOutcome.UNCHANGED, report.outcome());
        assertTrue(report.monitor().isEmpty());
        assertEquals(0, cloud.receiveRounds());
        assertEquals(1, cloud.count("deleteQueue"));
    }

    @Test
    void handlersAreRejectedAtRegistration() {
        var env = environment(options());

        assertThrows(HandlerRegistrationException.class, () -> env.addStackEventHandler(new Object()));
        assertThrows(HandlerRegistrationException.class, () -> env.addConfigHandler(new Object()));
        assertTrue(env.stackEventHandlers().isEmpty());
    }

    @Test
    void handlerListsArePerInstance() {
        var first = environment(options());
        var second = environment(options());
        first.addStackEventHandler((StackEventHandler) event -> true);
        first.addDeployParameter("a", "b");

        assertEquals(1, first.stackEventHandlers().size());
        assertTrue(second.stackEventHandlers().isEmpty());
        assertTrue(second.deployParameters().isEmpty());
    }

    @Test
    void configHandlersMustPrecedeLoading() {
        var env = environment(options());
        env.loadConfig();

        assertThrows(IllegalStateException.class, () -> env.addConfigHandler(new DatabaseConfigHandler()));
    }

    @Test
    void deleteTargetsTheEnvironmentStack() {
        var env = environment(options());

        assertEquals("demo", env.deleteAction());
        assertEquals(List.of("demo"), cloud.deletedStacks);
    }

    @Test
    void closeReleasesCloudClients() {
        var env = environment(options());
        env.deleteAction();

        env.close();

        assertTrue(cloud.closed());
    }

    @Test
    @SuppressWarnings("unchecked")
    void databasePasswordsFollowTheProcessEnvironment() {
        try (var env = environment(EnvironmentOptions.builder().projectDirectory(projectDir).build())) {
            env.addConfigHandler(new DatabaseConfigHandler());

            env.loadDatabasePasswordsFromEnv();

            var primary = (Map<String, Object>) ((Map<String, Object>) env.loadConfig().get("db")).get("primarydb");
            String fromEnv = System.getenv("PRIMARYDB_PASSWORD");
            assertEquals(fromEnv == null || fromEnv.isEmpty() ? "changeme" : fromEnv, primary.get("password"));
        }
    }

    @Test
    void suppliedConfigIsNotMutated() {
        var config = demoConfig();
        var env = environment(EnvironmentOptions.builder().projectDirectory(projectDir).config(config).build());

        env.loadConfig().put("extra", Map.of());

        assertFalse(config.containsKey("extra"));
    }

    private EnvironmentBase environment(EnvironmentOptions options) {
        return new EnvironmentBase(options, ignored -> cloud, CLOCK);
    }

    private EnvironmentOptions options() {
        return EnvironmentOptions.builder().projectDirectory(projectDir).config(demoConfig()).build();
    }

    private static Map<String, Object> demoConfig() {
        var config = new LinkedHashMap<String, Object>();
        config.put("global", new LinkedHashMap<>(Map.of(
            "environment_name", "demo",
            "output", "demo.template",
            "print_debug", false
        )));
        var template = new LinkedHashMap<String, Object>();
        template.put("description", "demo environment");
        template.put("ec2_key_default", "demo-key");
        template.put("s3_template_prefix", "envs/demo");
        template.put("template_bucket", "demo-templates");
        template.put("template_upload_acl", "private");
        template.put("timeout_in_minutes", 30);
        template.put("utility_bucket", "demo-logs");
        config.put("template", template);
        config.put("aws", new LinkedHashMap<>(Map.of("region_name", "us-east-1")));
        config.put("network", new LinkedHashMap<>(Map.of("az_count", 2, "subnet_types", List.of("public", "private"))));
        return config;
    }
}
