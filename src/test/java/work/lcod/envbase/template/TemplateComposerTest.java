package work.lcod.envbase.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.envbase.support.FakeCloud;

class TemplateComposerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Test
    void attachesChildAsNestedStack() {
        var cloud = new FakeCloud();
        var root = new Template("root");
        var composer = composer(root, cloud, Map.of());

        var stack = composer.addChildTemplate(new Template("web"));

        assertEquals("webStack", stack.name());
        assertEquals(Resource.STACK_TYPE, stack.type());
        String key = "templates/web." + NOW.getEpochSecond() + ".template";
        assertEquals("https://envbucket.s3.amazonaws.com/" + key, stack.properties().get("TemplateURL"));
        assertTrue(cloud.objects.containsKey("envbucket/" + key));
        assertEquals(45, stack.properties().get("TimeoutInMinutes"));
        assertTrue(root.resources().containsKey("webStack"));
    }

    @Test
    void childReceivesCommonParametersAndAmiMap() {
        var root = new Template("root");
        var child = new Template("web");
        composer(root, new FakeCloud(), Map.of()).addChildTemplate(child);

        var names = child.parameters().keySet();
        assertTrue(names.containsAll(List.of(
            "vpcCidr", "vpcId", "commonSecurityGroup", "utilityBucket",
            "availabilityZone1", "availabilityZone2",
            "publicSubnet1", "privateSubnet1", "publicSubnet2", "privateSubnet2",
            "ec2Key"
        )));
        assertFalse(names.contains("availabilityZone3"));
        assertTrue(child.mappings().containsKey(Template.AMI_MAPPING));
    }

    @Test
    void bindingsAreResolvedAgainstTheRoot() {
        var root = new Template("root");
        root.addParameter(Parameter.of("ec2Key", "String"));
        var composer = composer(root, new FakeCloud(), Map.of("vpcCidr", "10.0.0.0/16"));

        var stack = composer.addChildTemplate(new Template("web"));

        @SuppressWarnings("unchecked")
        var parameters = (Map<String, ValueRef>) stack.properties().get("Parameters");
        assertEquals(ValueRef.literal("10.0.0.0/16"), parameters.get("vpcCidr"));
        assertEquals(ValueRef.ref("ec2Key"), parameters.get("ec2Key"));
        assertEquals(ValueRef.getAtt("privateSubnet1", "AvailabilityZone"), parameters.get("availabilityZone1"));
        assertEquals(ValueRef.ref("vpcId"), parameters.get("vpcId"));
        assertTrue(root.parameters().containsKey("vpcId"));
    }

    @Test
    void buildHookRunsAfterCommonParametersAndBeforeUpload() {
        var cloud = new FakeCloud();
        var root = new Template("root");
        var child = new Template("db") {
            @Override
            protected void buildHook() {
                addResource(Resource.of("database", "AWS::RDS::DBInstance", Map.of(
                    "DBSubnetGroupName", ValueRef.ref("privateSubnet1")
                )));
                addOutput(Output.of("dbEndpoint", ValueRef.getAtt("database", "Endpoint.Address")));
            }
        };

        composer(root, cloud, Map.of()).addChildTemplate(child);

        String uploaded = cloud.objects.values().iterator().next();
        assertTrue(uploaded.contains("AWS::RDS::DBInstance"));
        assertTrue(uploaded.contains("dbEndpoint"));
    }

    @Test
    void laterChildDependsOnSiblingWhoseOutputItReads() {
        var root = new Template("root");
        var composer = composer(root, new FakeCloud(), Map.of());
        var database = new Template("db");
        database.addOutput(Output.of("dbEndpoint", ValueRef.getAtt("database", "Endpoint.Address")));
        var app = new Template("app");
        app.addParameter(Parameter.of("dbEndpoint", "String"));

        composer.addChildTemplate(database);
        var appStack = composer.addChildTemplate(app, UploadTarget.defaults(), List.of("networkStack"));

        assertEquals(List.of("networkStack", "dbStack"), List.copyOf(appStack.dependsOn()));
        assertEquals(List.of("dbEndpoint"), composer.outputRegistry().outputsOf("db"));
        assertFalse(root.parameters().containsKey("dbEndpoint"));
    }

    @Test
    void attachingTheSameChildTwiceKeepsTheFirstStack() {
        var cloud = new FakeCloud();
        var root = new Template("root");
        var composer = composer(root, cloud, Map.of());
        int[] hookRuns = {0};
        var child = new Template("app") {
            @Override
            protected void buildHook() {
                hookRuns[0]++;
                addResource(Resource.of("server", "AWS::EC2::Instance", Map.of()));
            }
        };

        var first = composer.addChildTemplate(child);
        int childParameters = child.parameters().size();
        int rootParameters = root.parameters().size();
        var second = composer.addChildTemplate(child);

        assertSame(first, second);
        assertEquals(1, hookRuns[0]);
        assertEquals(1, cloud.count("putObject"));
        assertEquals(childParameters, child.parameters().size());
        assertEquals(rootParameters, root.parameters().size());
        assertEquals(1, root.resources().size());
    }

    @Test
    void explicitUploadTargetOverridesConfiguredBucket() {
        var cloud = new FakeCloud();
        var composer = composer(new Template("root"), cloud, Map.of());

        var stack = composer.addChildTemplate(new Template("web"), new UploadTarget("other", "", "public-read"), List.of());

        String key = "web." + NOW.getEpochSecond() + ".template";
        assertEquals("https://other.s3.amazonaws.com/" + key, stack.properties().get("TemplateURL"));
    }

    @Test
    void uploadWithoutBucketFails() {
        var settings = new ComposerSettings(1, List.of("private"), "key", null, "", "private", 60, Map.of());
        var composer = new TemplateComposer(new Template("root"), settings, new FakeCloud(),
            new TemplateRenderer(), Map.of(), null);

        assertThrows(IllegalStateException.class, () -> composer.addChildTemplate(new Template("web")));
    }

    @Test
    void settingsComeFromTemplateAndNetworkSections() {
        var config = Map.<String, Object>of(
            "template", Map.of("template_bucket", "b", "s3_template_prefix", "p", "timeout_in_minutes", 15),
            "network", Map.of("az_count", 3, "subnet_types", List.of("public"))
        );

        var settings = ComposerSettings.fromConfig(config, Map.of());

        assertEquals("b", settings.templateBucket());
        assertEquals("p", settings.templatePrefix());
        assertEquals("private", settings.templateUploadAcl());
        assertEquals(15, settings.timeoutInMinutes());
        assertEquals(3, settings.azCount());
        assertEquals(List.of("public"), settings.subnetTypes());
    }

    private static TemplateComposer composer(Template root, FakeCloud cloud, Map<String, Object> manualBindings) {
        var settings = new ComposerSettings(
            2,
            List.of("public", "private"),
            "default-key",
            "envbucket",
            "templates",
            "private",
            45,
            Map.of("us-east-1", Map.of("amazonLinuxAmiId", "ami-1"))
        );
        var clock = Clock.fixed(NOW, ZoneOffset.UTC);
        return new TemplateComposer(root, settings, cloud, new TemplateRenderer(clock), manualBindings, clock);
    }
}
