package fr.lapetina.resilient.client.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.resilient.client.domain.model.ServiceResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonCodecTest {

    private static final URI ENDPOINT = URI.create("https://primary.test");

    public static class Overview {
        public String status;
        public int services;
    }

    @Test
    @DisplayName("should pass string bodies through unchanged")
    void shouldPassStringsThrough() {
        assertThat(JsonCodec.encodeBody("{\"already\":\"json\"}")).isEqualTo("{\"already\":\"json\"}");
    }

    @Test
    @DisplayName("should serialise object bodies without null fields")
    void shouldSerialiseObjects() {
        Overview overview = new Overview();
        overview.services = 4;

        assertThat(JsonCodec.encodeBody(overview)).isEqualTo("{\"services\":4}");
        assertThat(JsonCodec.encodeBody(Map.of("a", 1))).isEqualTo("{\"a\":1}");
    }

    @Test
    @DisplayName("should bind payloads and ignore unknown fields")
    void shouldReadPayload() {
        ServiceResponse response = ServiceResponse.of(ENDPOINT, 200,
                "{\"status\":\"healthy\",\"services\":7,\"uptime\":\"3d\"}");

        Overview overview = JsonCodec.read(response, Overview.class);
        JsonNode tree = JsonCodec.readTree(response);

        assertThat(overview.status).isEqualTo("healthy");
        assertThat(overview.services).isEqualTo(7);
        assertThat(tree.path("uptime").asText()).isEqualTo("3d");
    }

    @Test
    @DisplayName("should report invalid JSON with the endpoint")
    void shouldReportInvalidJson() {
        ServiceResponse response = ServiceResponse.of(ENDPOINT, 200, "<html>");

        assertThatThrownBy(() -> JsonCodec.readTree(response))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("primary.test");
    }
}
