package com.flagship.bookkeeping.asset;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST surface for the fixed-asset register, depreciation and health.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class FixedAssetControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_bookkeeping")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private long createAsset(String body) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/fixed-assets")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asLong();
    }

    @Test
    @DisplayName("Asset with a sale shows the loss in the yearly schedule")
    void testAssetSaleSchedule() throws Exception {
        // Given: A machine acquired January 2026
        long id = createAsset("""
            {"name": "Lathe", "acquisition_date": "2026-01-10", "useful_life": 4, "acquisition_cost": 1200001}
            """);

        // When: It is sold in June
        mockMvc.perform(put("/api/fixed-assets/{id}/disposal", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"disposal_type\": \"SALE\", \"disposal_date\": \"2026-06-30\", \"disposal_proceeds\": 700000}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.disposal_type").value("SALE"))
            .andExpect(jsonPath("$.disposed").value(true));

        // Then: The 2026 schedule carries the sale
        mockMvc.perform(get("/api/depreciation/{year}", 2026))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.asset_id == " + id + ")].depreciation_amount").value(150000))
            .andExpect(jsonPath("$[?(@.asset_id == " + id + ")].gain_or_loss").value(-350001))
            .andExpect(jsonPath("$[?(@.asset_id == " + id + ")].closing_book_value").value(0));

        // And: Cancelling restores the full life
        mockMvc.perform(delete("/api/fixed-assets/{id}/disposal", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.disposed").value(false));
        mockMvc.perform(get("/api/fixed-assets/{id}/schedule", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(4))
            .andExpect(jsonPath("$[0].annual_rate").value(0.25));
    }

    @Test
    @DisplayName("Invalid register requests map to 400 and 404")
    void testErrors() throws Exception {
        mockMvc.perform(post("/api/fixed-assets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Freebie\", \"acquisition_date\": \"2026-01-01\", \"useful_life\": 3, \"acquisition_cost\": 0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.acquisitionCost").exists());

        long id = createAsset("""
            {"name": "Desk", "acquisition_date": "2026-05-01", "useful_life": 8, "acquisition_cost": 80001}
            """);
        mockMvc.perform(put("/api/fixed-assets/{id}/disposal", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\": \"RETIREMENT\", \"date\": \"2026-04-30\"}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(delete("/api/fixed-assets/{id}", id))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/fixed-assets/{id}", id))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Health endpoints report the database and the chart of accounts")
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.database").value("UP"))
            .andExpect(jsonPath("$.schema_version").value(2));

        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.components.chartOfAccounts.status").value("UP"));
    }
}
