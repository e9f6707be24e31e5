package com.tribunal.records.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
@DisplayName("CaseVictimController Tests")
class CaseVictimControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private long caseId;
    private long victimId;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("INSERT INTO proceso (observaciones) VALUES ('Expediente de prueba')");
        caseId = jdbcTemplate.queryForObject(
                "SELECT id_proceso FROM proceso WHERE observaciones = 'Expediente de prueba'", Long.class);
        jdbcTemplate.update("INSERT INTO victima (nombre, iniciales) VALUES ('Marta', 'M.R.')");
        victimId = jdbcTemplate.queryForObject("SELECT id_victima FROM victima WHERE nombre = 'Marta'", Long.class);
    }

    @Test
    @DisplayName("Should associate a victim with 201 and list it")
    void shouldAssociateAndList() throws Exception {
        mockMvc.perform(post("/api/procesos/" + caseId + "/victimas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"victima_id\": " + victimId + "}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.leftId").value(caseId))
                .andExpect(jsonPath("$.data.rightId").value(victimId));

        mockMvc.perform(get("/api/procesos/" + caseId + "/victimas"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].iniciales").value("M.R."));

        mockMvc.perform(get("/api/procesos/" + caseId + "/victimas/count"))
                .andExpect(jsonPath("$.data.total").value(1));

        mockMvc.perform(get("/api/victimas/" + victimId + "/procesos"))
                .andExpect(jsonPath("$.data[0].id_proceso").value(caseId));
    }

    @Test
    @DisplayName("Should answer 409 for an existing link")
    void shouldRejectExistingLink() throws Exception {
        jdbcTemplate.update("INSERT INTO proceso_victima (proceso_id, victima_id) VALUES (?, ?)", caseId, victimId);

        mockMvc.perform(post("/api/procesos/" + caseId + "/victimas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"victima_id\": " + victimId + "}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT"));
    }

    @Test
    @DisplayName("Should answer 404 for a missing case or victim")
    void shouldRejectMissingEntities() throws Exception {
        mockMvc.perform(post("/api/procesos/999999/victimas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"victima_id\": " + victimId + "}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Case 999999 does not exist"));

        mockMvc.perform(post("/api/procesos/" + caseId + "/victimas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"victima_id\": 999999}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Victim 999999 does not exist"));
    }

    @Test
    @DisplayName("Should answer 400 with field errors for a missing victim id")
    void shouldRejectMissingVictimId() throws Exception {
        mockMvc.perform(post("/api/procesos/" + caseId + "/victimas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.fieldErrors[0].field").value("victimaId"));
    }

    @Test
    @DisplayName("Should report one outcome per id in a bulk association")
    void shouldAssociateMany() throws Exception {
        mockMvc.perform(post("/api/procesos/" + caseId + "/victimas/multiples")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"victimas_ids\": [" + victimId + ", 999999]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].status").value("ASSOCIATED"))
                .andExpect(jsonPath("$.data[0].reason").doesNotExist())
                .andExpect(jsonPath("$.data[1].status").value("FAILED"))
                .andExpect(jsonPath("$.data[1].reason").value("Victim 999999 does not exist"));
    }

    @Test
    @DisplayName("Should answer 400 for an empty bulk association")
    void shouldRejectEmptyBulk() throws Exception {
        mockMvc.perform(post("/api/procesos/" + caseId + "/victimas/multiples")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"victimas_ids\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors[0].field").value("victimasIds"));
    }

    @Test
    @DisplayName("Should check and remove a link")
    void shouldCheckAndRemoveLink() throws Exception {
        jdbcTemplate.update("INSERT INTO proceso_victima (proceso_id, victima_id) VALUES (?, ?)", caseId, victimId);

        mockMvc.perform(get("/api/procesos/" + caseId + "/victimas/" + victimId))
                .andExpect(jsonPath("$.data.associated").value(true));

        mockMvc.perform(delete("/api/procesos/" + caseId + "/victimas/" + victimId))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/procesos/" + caseId + "/victimas/" + victimId))
                .andExpect(jsonPath("$.data.associated").value(false));

        mockMvc.perform(delete("/api/procesos/" + caseId + "/victimas/" + victimId))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should answer 400 for a non-positive id")
    void shouldRejectNonPositiveId() throws Exception {
        mockMvc.perform(get("/api/procesos/0/victimas"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("ID must be a positive integer"));
    }
}
