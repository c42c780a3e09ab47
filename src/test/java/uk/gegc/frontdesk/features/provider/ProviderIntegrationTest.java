package uk.gegc.frontdesk.features.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import uk.gegc.frontdesk.BaseIntegrationTest;
import uk.gegc.frontdesk.features.provider.api.dto.CreateProviderRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ProviderIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private ObjectMapper objectMapper;

    private JsonNode register(CreateProviderRequest request) throws Exception {
        String body = mockMvc.perform(post("/api/v1/providers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    @Test
    @DisplayName("registered provider reads back with its fields, equal timestamps and active")
    void roundTrip() throws Exception {
        JsonNode created = register(new CreateProviderRequest(
                "City Diagnostic Labs", "laboratory", "555-0100", "desk@citylabs.example", "12 Harbour Road"));
        long id = created.get("id").asLong();

        String body = mockMvc.perform(get("/api/v1/providers/{id}", id))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode fetched = objectMapper.readTree(body);

        assertThat(fetched.get("name").asText()).isEqualTo("City Diagnostic Labs");
        assertThat(fetched.get("sector").asText()).isEqualTo("laboratory");
        assertThat(fetched.get("phone").asText()).isEqualTo("555-0100");
        assertThat(fetched.get("email").asText()).isEqualTo("desk@citylabs.example");
        assertThat(fetched.get("address").asText()).isEqualTo("12 Harbour Road");
        assertThat(fetched.get("active").asBoolean()).isTrue();
        assertThat(fetched.get("createdAt").asText()).isEqualTo(fetched.get("updatedAt").asText());
    }

    @Test
    @DisplayName("deactivate, reactivate through PATCH, then delete")
    void deactivateAndDelete() throws Exception {
        long id = register(new CreateProviderRequest("Harbour Kayaks", "water_sports", null, null, null)).get("id").asLong();

        mockMvc.perform(post("/api/v1/providers/{id}/deactivate", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(patch("/api/v1/providers/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\":true,\"phone\":\"555-0999\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(true))
                .andExpect(jsonPath("$.phone").value("555-0999"))
                .andExpect(jsonPath("$.name").value("Harbour Kayaks"));

        mockMvc.perform(delete("/api/v1/providers/{id}", id))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/v1/providers/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("sector filter is case-insensitive and results keep registration order")
    void listBySector() throws Exception {
        long first = register(new CreateProviderRequest("Lab One", "laboratory", null, null, null)).get("id").asLong();
        register(new CreateProviderRequest("Smile Co", "dental", null, null, null));
        long second = register(new CreateProviderRequest("Lab Two", "Laboratory", null, null, null)).get("id").asLong();

        mockMvc.perform(get("/api/v1/providers").param("sector", "LABORATORY"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content.length()").value(2))
                .andExpect(jsonPath("$.content[0].id").value(first))
                .andExpect(jsonPath("$.content[1].id").value(second));
    }

    @Test
    @DisplayName("sector catalog includes the sectors with booking rules")
    void sectorCatalog() throws Exception {
        mockMvc.perform(get("/api/v1/providers/sectors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recommended.length()").value(18))
                .andExpect(jsonPath("$.withBookingRules[0]").value("hospitality"))
                .andExpect(jsonPath("$.withBookingRules[1]").value("laboratory"))
                .andExpect(jsonPath("$.withBookingRules[2]").value("transportation"));
    }

    @Test
    @DisplayName("health endpoint reports UP")
    void health() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
