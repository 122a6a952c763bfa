package work.lcod.envbase.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class StackEventParserTest {
    private static final String MESSAGE = String.join("\n",
        "StackId='arn:aws:cloudformation:us-east-1:000000000000:stack/demo/1'",
        "Timestamp='2024-05-01T10:15:30.000Z'",
        "EventId='1'",
        "LogicalResourceId='demo'",
        "Namespace='000000000000'",
        "PhysicalResourceId='arn:aws:cloudformation:us-east-1:000000000000:stack/demo/1'",
        "ResourceProperties='{\"Timeout\":\"60\"}'",
        "ResourceStatus='CREATE_COMPLETE'",
        "ResourceStatusReason=''",
        "ResourceType='AWS::CloudFormation::Stack'",
        "StackName='demo'",
        ""
    );

    @Test
    void parsesSnsEnvelope() {
        String body = "{\"Type\":\"Notification\",\"Message\":\"" + MESSAGE.replace("\"", "\\\"").replace("\n", "\\n") + "\"}";

        var event = StackEventParser.parse(body);

        assertEquals("CREATE_COMPLETE", event.status());
        assertEquals("AWS::CloudFormation::Stack", event.resourceType());
        assertEquals("demo", event.logicalResourceId());
        assertEquals("demo", event.stackName());
        assertEquals("", event.statusReason());
        assertEquals(Map.of("Timeout", "60"), event.properties());
        assertTrue(event.isStackResource());
    }

    @Test
    void bareMessageIsParsedDirectly() {
        var event = StackEventParser.parse(MESSAGE);
        assertEquals("CREATE_COMPLETE", event.status());
    }

    @Test
    void unparseablePropertiesStayRawText() {
        var event = StackEventParser.parse("ResourceStatus='CREATE_IN_PROGRESS'\nResourceProperties='{not json'\n");

        assertEquals("CREATE_IN_PROGRESS", event.status());
        assertEquals("{not json", event.properties());
    }

    @Test
    void garbageNeverFails() {
        var event = StackEventParser.parse("{\"Message\": 42}");
        assertNull(event.status());
        assertNull(event.properties());

        var empty = StackEventParser.parse(null);
        assertTrue(empty.fields().isEmpty());
    }

    @Test
    void unquotedValuesAndReasonsWithSpaces() {
        var fields = StackEventParser.parseFields("ResourceStatus=UPDATE_FAILED\nResourceStatusReason='Resource creation cancelled'\n");

        assertEquals("UPDATE_FAILED", fields.get("ResourceStatus"));
        assertEquals("Resource creation cancelled", fields.get("ResourceStatusReason"));
    }
}
