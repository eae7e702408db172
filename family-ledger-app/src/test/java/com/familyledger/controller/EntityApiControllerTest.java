package com.familyledger.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Sql(scripts = {"/reset.sql", "/accounts.sql"}, executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
class EntityApiControllerTest {

    private static final RequestPostProcessor ALICE = user("alice");
    private static final RequestPostProcessor BOB = user("bob");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private long createPerson(String givenName, String birthDate) throws Exception {
        String body = objectMapper.writeValueAsString(
            Map.of("givenName", givenName, "familyName", "Worthington", "birthDate", birthDate));
        String response = mockMvc.perform(post("/api/people").with(ALICE)
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).get("id").asLong();
    }

    private String json(Map<String, ?> body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    @Nested
    @DisplayName("authentication")
    class Authentication {

        @Test
        void healthIsPublic() throws Exception {
            mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
        }

        @Test
        void collectionsRequireAuthentication() throws Exception {
            mockMvc.perform(get("/api/people")).andExpect(status().isUnauthorized());
        }

        @Test
        void registeredAccountCanAuthenticate() throws Exception {
            mockMvc.perform(post("/api/accounts").contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("username", "carol", "password", "s3cret-pass", "displayName", "Carol"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.username").value("carol"));

            mockMvc.perform(get("/api/people").with(httpBasic("carol", "s3cret-pass")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
            mockMvc.perform(get("/api/people").with(httpBasic("carol", "wrong-pass")))
                .andExpect(status().isUnauthorized());
        }

        @Test
        void duplicateUsernameConflicts() throws Exception {
            mockMvc.perform(post("/api/accounts").contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("username", "alice", "password", "another-pass"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conflict"));
        }
    }

    @Nested
    @DisplayName("entity collections")
    class Collections {

        @Test
        void createThenGet() throws Exception {
            long id = createPerson("Chris", "1975-09-30");

            mockMvc.perform(get("/api/people/" + id).with(ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("person"))
                .andExpect(jsonPath("$.givenName").value("Chris"))
                .andExpect(jsonPath("$.birthDate").value("1975-09-30"))
                .andExpect(jsonPath("$.privacy").value("private"))
                .andExpect(jsonPath("$.version").value(1));
        }

        @Test
        void listFiltersByQueryParameters() throws Exception {
            createPerson("Chris", "1975-09-30");
            createPerson("Timothy", "1973-01-20");

            mockMvc.perform(get("/api/people").param("givenName", "Timothy").with(ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].givenName").value("Timothy"));
        }

        @Test
        void unknownCollectionIsNotFound() throws Exception {
            mockMvc.perform(get("/api/dragons").with(ALICE))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
        }

        @Test
        void missingRequiredFieldIsBadRequest() throws Exception {
            mockMvc.perform(post("/api/people").with(ALICE)
                    .contentType(MediaType.APPLICATION_JSON).content(json(Map.of("givenName", "Chris"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));
        }

        @Test
        void patchWithStaleIfMatchConflicts() throws Exception {
            long id = createPerson("Chris", "1975-09-30");

            mockMvc.perform(patch("/api/people/" + id).with(ALICE).header("If-Match", "1")
                    .contentType(MediaType.APPLICATION_JSON).content(json(Map.of("gender", "M"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(2));
            mockMvc.perform(patch("/api/people/" + id).with(ALICE).header("If-Match", "\"1\"")
                    .contentType(MediaType.APPLICATION_JSON).content(json(Map.of("gender", "F"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conflict"));
        }

        @Test
        void deletedRecordIsHiddenUnlessTombstonesRequested() throws Exception {
            long id = createPerson("Chris", "1975-09-30");

            mockMvc.perform(delete("/api/people/" + id).with(ALICE)).andExpect(status().isNoContent());

            mockMvc.perform(get("/api/people/" + id).with(ALICE)).andExpect(status().isNotFound());
            mockMvc.perform(get("/api/people/" + id).param("includeTombstoned", "true").with(ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(true));
        }

        @Test
        void purgeRequiresConfirmation() throws Exception {
            long id = createPerson("Chris", "1975-09-30");

            mockMvc.perform(delete("/api/people/" + id + "/purge").with(ALICE))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));
            mockMvc.perform(delete("/api/people/" + id + "/purge").param("confirm", "true").with(ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.purged").value("person#" + id));
            mockMvc.perform(get("/api/people/" + id).param("includeTombstoned", "true").with(ALICE))
                .andExpect(status().isNotFound());
        }

        @Test
        void otherAccountIsForbidden() throws Exception {
            long id = createPerson("Chris", "1975-09-30");

            mockMvc.perform(get("/api/people/" + id).with(BOB))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("forbidden"));
        }
    }

    @Nested
    @DisplayName("relationship errors")
    class RelationshipErrors {

        @Test
        void selfLoopIsUnprocessable() throws Exception {
            long id = createPerson("Chris", "1975-09-30");

            mockMvc.perform(post("/api/relationships").with(ALICE).contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("person1Id", id, "person2Id", id, "type", "parent"))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("invalid_relationship"));
        }

        @Test
        void cycleIsConflict() throws Exception {
            long parent = createPerson("Jonathan", "1948-02-11");
            long child = createPerson("Chris", "1975-09-30");
            mockMvc.perform(post("/api/relationships").with(ALICE).contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("person1Id", parent, "person2Id", child, "type", "parent"))))
                .andExpect(status().isCreated());

            mockMvc.perform(post("/api/relationships").with(ALICE).contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("person1Id", child, "person2Id", parent, "type", "parent"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("cycle_detected"));
        }

        @Test
        void duplicateIsConflict() throws Exception {
            long a = createPerson("Chris", "1975-09-30");
            long b = createPerson("Sarah", "1976-04-02");
            mockMvc.perform(post("/api/relationships").with(ALICE).contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("person1Id", a, "person2Id", b, "type", "spouse"))))
                .andExpect(status().isCreated());

            mockMvc.perform(post("/api/relationships").with(ALICE).contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("person1Id", b, "person2Id", a, "type", "spouse"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("duplicate_relationship"));
        }
    }

    @Nested
    @DisplayName("graph, export and audit")
    class GraphExportAudit {

        @Test
        void ancestorsEndpoint() throws Exception {
            long parent = createPerson("Jonathan", "1948-02-11");
            long child = createPerson("Chris", "1975-09-30");
            mockMvc.perform(post("/api/relationships").with(ALICE).contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("person1Id", parent, "person2Id", child, "type", "parent"))))
                .andExpect(status().isCreated());

            mockMvc.perform(get("/api/people/" + child + "/ancestors").with(ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].generation").value(1))
                .andExpect(jsonPath("$[0].person.givenName").value("Jonathan"));
        }

        @Test
        void exportReturnsJsonProjection() throws Exception {
            createPerson("Chris", "1975-09-30");

            String body = mockMvc.perform(get("/api/export").with(ALICE))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

            JsonNode document = objectMapper.readTree(body);
            assertThat(document.get("people")).hasSize(1);
            assertThat(document.get("accountId").asLong()).isEqualTo(1000L);
        }

        @Test
        void revisionHistoryAndAsOf() throws Exception {
            long id = createPerson("Chris", "1975-09-30");

            mockMvc.perform(get("/api/revisions/person/" + id).with(ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].operation").value("create"))
                .andExpect(jsonPath("$[0].entityKind").value("person"))
                .andExpect(jsonPath("$[0].diff.givenName.after").value("Chris"));
            mockMvc.perform(get("/api/revisions/person/" + id + "/as-of").param("at", "2999-01-01T00:00:00Z").with(ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fields.givenName").value("Chris"))
                .andExpect(jsonPath("$.version").value(1));
            mockMvc.perform(get("/api/revisions/person/" + id + "/as-of").param("at", "1999-01-01T00:00:00Z").with(ALICE))
                .andExpect(status().isNotFound());
        }

        @Test
        void revisionQueryRejectsMalformedInstant() throws Exception {
            mockMvc.perform(get("/api/revisions").param("from", "yesterday").with(ALICE))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));
        }
    }
}
