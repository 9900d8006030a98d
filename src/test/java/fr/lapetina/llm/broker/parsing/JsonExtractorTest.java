package fr.lapetina.llm.broker.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonExtractorTest {

    @Test
    @DisplayName("should return bare JSON unchanged")
    void shouldReturnBareJson() {
        assertThat(JsonExtractor.extract("{\"a\":1}")).isEqualTo("{\"a\":1}");
    }

    @Test
    @DisplayName("should prefer a fenced json block")
    void shouldPreferFencedBlock() {
        String raw = "Here you go {not this}:\n```json\n{\"city\":\"Paris\"}\n```\nAnything else?";

        assertThat(JsonExtractor.extract(raw)).isEqualTo("{\"city\":\"Paris\"}");
    }

    @Test
    @DisplayName("should accept an unlabelled fence")
    void shouldAcceptUnlabelledFence() {
        assertThat(JsonExtractor.extract("```\n[1, 2]\n```")).isEqualTo("[1, 2]");
    }

    @Test
    @DisplayName("should strip surrounding prose")
    void shouldStripProse() {
        String raw = "Sure! {\"items\": [{\"x\": 1}]} Hope this helps.";

        assertThat(JsonExtractor.extract(raw)).isEqualTo("{\"items\": [{\"x\": 1}]}");
    }

    @Test
    @DisplayName("should pick an array when it comes first")
    void shouldPickLeadingArray() {
        assertThat(JsonExtractor.extract("Result: [{\"a\":1},{\"a\":2}]")).isEqualTo("[{\"a\":1},{\"a\":2}]");
    }

    @Test
    @DisplayName("should fail when no JSON value is present")
    void shouldFailWithoutJson() {
        assertThatThrownBy(() -> JsonExtractor.extract("I cannot answer that."))
                .isInstanceOf(OutputDecodingException.class);
        assertThatThrownBy(() -> JsonExtractor.extract("  "))
                .isInstanceOf(OutputDecodingException.class);
        assertThatThrownBy(() -> JsonExtractor.extract("} oops {"))
                .isInstanceOf(OutputDecodingException.class);
    }
}
