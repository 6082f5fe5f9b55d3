package com.account.relationship.assessment;

import com.account.relationship.core.model.BadDomainFlag;
import com.account.relationship.core.model.RelationshipFlags;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AssessmentPayloadWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AssessmentPayloadWriter writer = new AssessmentPayloadWriter(mapper);

    @Test
    @DisplayName("Payload JSON groups fields by section and trust tier")
    void structure() throws Exception {
        AssessmentPayload payload = AssessmentPayloadBuilder.build(AssessmentPayloadBuilderTest.CUSTOMER,
                AssessmentPayloadBuilderTest.PARENT, AssessmentPayloadBuilderTest.shellFlags());

        JsonNode json = mapper.readTree(writer.write(payload));

        assertEquals("001000000000001", json.get("record_id").asText());
        assertEquals("Acme West LLC", json.at("/customer/trusted/Name").asText());
        assertEquals("Acme West", json.at("/customer/semi_reliable/Enrichment_Company_Name").asText());
        assertEquals("Acme Corporation", json.at("/parent/trusted/Name").asText());
        assertTrue(json.at("/flags/Has_Shell").asBoolean());
        assertEquals(100, json.at("/flags/Customer_Shell_Coherence/score").asInt());
        assertEquals("Customer Billing Address vs Parent Enrichment Address",
                json.at("/flags/Address_Consistency/fields_compared").asText());
        assertFalse(json.has("fields"));
    }

    @Test
    @DisplayName("The parent key is omitted when there is no parent")
    void noParentKey() throws Exception {
        AssessmentPayload payload = AssessmentPayloadBuilder.build(AssessmentPayloadBuilderTest.CUSTOMER, null,
                RelationshipFlags.badDomain(BadDomainFlag.bad("Website domain 'example.com'")));

        JsonNode json = mapper.readTree(writer.write(payload));

        assertFalse(json.has("parent"));
        assertTrue(json.at("/flags/Bad_Domain/is_bad").asBoolean());
        assertTrue(json.at("/flags/Customer_Consistency").isMissingNode());
    }

    @Test
    @DisplayName("Pretty output is indented and equivalent")
    void pretty() throws Exception {
        AssessmentPayload payload = AssessmentPayloadBuilder.build(AssessmentPayloadBuilderTest.CUSTOMER,
                AssessmentPayloadBuilderTest.PARENT, AssessmentPayloadBuilderTest.shellFlags());

        String pretty = writer.writePretty(payload);

        assertTrue(pretty.contains("\n"));
        assertEquals(mapper.readTree(writer.write(payload)), mapper.readTree(pretty));
    }
}
