package com.witty.infrastructure.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.witty.infrastructure.adapter.template.PromptTemplateRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MockInterpretationAdapterTest {

    private static final String INPUT = "If Alice owns a red car, then she prefers driving.";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PromptTemplateRegistry templates = new PromptTemplateRegistry();
    private MockInterpretationAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new MockInterpretationAdapter(objectMapper, new DefaultResourceLoader());
        ReflectionTestUtils.setField(adapter, "responsesLocations", new String[] {"classpath:mock/canned-responses.json"});
        adapter.loadCannedResponses();
    }

    private AdapterResponse request(String templateId, String input) {
        AdapterRequest request = templates.get(templateId).toRequest(input, null, 1);
        return adapter.request(request, Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Known (template, input) pair returns the canned JSON")
    void cannedResponse() {
        AdapterResponse response = request(PromptTemplateRegistry.SEGMENT, INPUT);

        assertThat(response.parsed()).isPresent();
        assertThat(response.parsedJson().path("claims")).hasSize(2);
        assertThat(response.adapterProvenance().adapterId()).isEqualTo("mock");
        assertThat(response.adapterProvenance().templateId()).isEqualTo(PromptTemplateRegistry.SEGMENT);
    }

    @Test
    @DisplayName("Unknown pair returns MOCK text without JSON")
    void unknownPair() {
        AdapterResponse response = request(PromptTemplateRegistry.SEGMENT, "Nobody registered this.");

        assertThat(response.parsed()).isEmpty();
        assertThat(response.text()).startsWith("MOCK: ");
    }

    @Test
    @DisplayName("Request ids are stable for the same template and input")
    void stableRequestIds() {
        String first = request(PromptTemplateRegistry.SYMBOLIZE, INPUT).adapterProvenance().requestId();
        String second = request(PromptTemplateRegistry.SYMBOLIZE, INPUT).adapterProvenance().requestId();
        String other = request(PromptTemplateRegistry.SEGMENT, INPUT).adapterProvenance().requestId();

        assertThat(first).isEqualTo(second).hasSize(12).isNotEqualTo(other);
    }

    @Test
    @DisplayName("A later responses file overrides an earlier one")
    void laterLocationOverrides(@TempDir Path dir) throws Exception {
        ArrayNode entries = objectMapper.createArrayNode();
        entries.addObject()
                .put("template_id", PromptTemplateRegistry.SEGMENT)
                .put("input", INPUT)
                .set("response", objectMapper.createObjectNode().put("confidence", 0.1));
        Path file = dir.resolve("override.json");
        objectMapper.writeValue(file.toFile(), entries);

        MockInterpretationAdapter overridden = new MockInterpretationAdapter(objectMapper, new DefaultResourceLoader());
        ReflectionTestUtils.setField(overridden, "responsesLocations",
                new String[] {"classpath:mock/canned-responses.json", file.toUri().toString()});
        overridden.loadCannedResponses();

        AdapterRequest request = templates.get(PromptTemplateRegistry.SEGMENT).toRequest(INPUT, null, 1);
        assertThat(overridden.request(request, Duration.ofSeconds(1)).parsedJson().path("confidence").asDouble())
                .isEqualTo(0.1);
        assertThat(request(PromptTemplateRegistry.SEGMENT, INPUT).parsedJson().path("confidence").asDouble())
                .isNotEqualTo(0.1);
    }

    @Test
    @DisplayName("An entry without a response fails loading")
    void entryWithoutResponse(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "[{\"template_id\": \"segment_v1\", \"input\": \"x\"}]");

        MockInterpretationAdapter broken = new MockInterpretationAdapter(objectMapper, new DefaultResourceLoader());
        ReflectionTestUtils.setField(broken, "responsesLocations", new String[] {file.toUri().toString()});

        assertThatThrownBy(broken::loadCannedResponses)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("without a response");
    }
}
