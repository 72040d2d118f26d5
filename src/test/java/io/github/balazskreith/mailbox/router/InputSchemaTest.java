package io.github.balazskreith.mailbox.router;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class InputSchemaTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final InputSchema schema = InputSchema.object()
            .required("name", InputSchema.FieldType.STRING)
            .optional("optionalDelay", InputSchema.FieldType.NUMBER)
            .build();

    @Test
    void shouldAcceptValidInputAndStripUndeclaredFields() {
        var input = this.mapper.createObjectNode()
                .put("name", "foo")
                .put("optionalDelay", 10)
                .put("nickname", "bar");

        var result = this.schema.validate(input);

        Assertions.assertTrue(result.isValid());
        Assertions.assertEquals("foo", result.input().get("name").asText());
        Assertions.assertEquals(10, result.input().get("optionalDelay").asInt());
        Assertions.assertFalse(result.input().has("nickname"));
    }

    @Test
    void shouldAcceptMissingOptionalField() {
        var result = this.schema.validate(this.mapper.createObjectNode().put("name", "foo"));

        Assertions.assertTrue(result.isValid());
        Assertions.assertFalse(result.input().has("optionalDelay"));
    }

    @Test
    void shouldRejectWrongType() {
        var result = this.schema.validate(this.mapper.createObjectNode().put("name", 1));

        Assertions.assertFalse(result.isValid());
        Assertions.assertNull(result.input());
        Assertions.assertEquals("invalid_type: expected string, received number at \"name\"", result.message());
    }

    @Test
    void shouldRejectMissingRequiredField() {
        var result = this.schema.validate(this.mapper.createObjectNode());

        Assertions.assertEquals("invalid_type: expected string, received undefined at \"name\"", result.message());
    }

    @Test
    void shouldReportEveryIssue() {
        var input = this.mapper.createObjectNode().put("name", true).put("optionalDelay", "soon");

        var result = this.schema.validate(input);

        Assertions.assertTrue(result.message().contains("at \"name\""));
        Assertions.assertTrue(result.message().contains("at \"optionalDelay\""));
    }

    @Test
    void shouldRejectInputThatIsNotAnObject() {
        Assertions.assertEquals("invalid_type: expected object, received null", this.schema.validate(NullNode.getInstance()).message());
        Assertions.assertEquals("invalid_type: expected object, received array", this.schema.validate(this.mapper.createArrayNode()).message());
    }
}
