package com.familyledger.service;

import com.familyledger.LedgerFixtures;
import com.familyledger.exception.ForbiddenException;
import com.familyledger.exception.NotFoundException;
import com.familyledger.exception.ValidationException;
import com.familyledger.model.AncestryEntry;
import com.familyledger.model.EntityKind;
import com.familyledger.model.Event;
import com.familyledger.model.Person;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import java.util.List;
import java.util.Map;

import static com.familyledger.LedgerFixtures.ALICE;
import static com.familyledger.LedgerFixtures.BOB;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Structure:
 *     Arthur (1910) ─┬─ Constance (1912)
 *                    │
 *               Jonathan (1948) ─┬─ Patricia (1950)
 *                                │
 *          ┌──────────┬──────────┴─┐
 *          │          │            │
 *      Timothy     Chris        Rebecca       Stuart (half-sibling of Chris, no shared parent stored)
 *      (1973)      (1975)       (1975)
 *                    │
 *                  Hugo (2005)
 */
@SpringBootTest
@ActiveProfiles("test")
@Sql(scripts = {"/reset.sql", "/accounts.sql"}, executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
class GraphTraversalServiceTest {

    @Autowired
    private GraphTraversalService traversalService;

    @Autowired
    private EntityStore entityStore;

    private LedgerFixtures alice;

    private long arthur;
    private long constance;
    private long jonathan;
    private long patricia;
    private long timothy;
    private long chris;
    private long rebecca;
    private long stuart;
    private long hugo;

    @BeforeEach
    void setUp() {
        alice = new LedgerFixtures(entityStore, ALICE);
        arthur = alice.person("Arthur", "1910-05-01");
        constance = alice.person("Constance", "1912-07-19");
        jonathan = alice.person("Jonathan", "1948-02-11");
        patricia = alice.person("Patricia", "1950-12-03");
        rebecca = alice.person("Rebecca", "1975-09-30");
        chris = alice.person("Chris", "1975-09-30");
        timothy = alice.person("Timothy", "1973-01-20");
        stuart = alice.person("Stuart");
        hugo = alice.person("Hugo", "2005-06-06");

        alice.parent(arthur, jonathan);
        alice.parent(constance, jonathan);
        alice.relationship(arthur, constance, "spouse");
        alice.relationship(patricia, jonathan, "spouse");
        for (long child : List.of(timothy, chris, rebecca)) {
            alice.parent(jonathan, child);
            alice.parent(patricia, child);
        }
        alice.relationship(stuart, chris, "half_sibling");
        alice.parent(chris, hugo);
    }

    private static List<Long> ids(List<Person> people) {
        return people.stream().map(Person::id).toList();
    }

    // ========== ANCESTORS ==========

    @Nested
    @DisplayName("ancestors")
    class Ancestors {

        @Test
        void walksGenerationsNearestFirst() {
            List<AncestryEntry> result = traversalService.ancestors(ALICE, hugo, null);

            assertThat(result)
                .extracting(e -> e.person().id(), AncestryEntry::generation)
                .containsExactly(
                    tuple(chris, 1),
                    tuple(jonathan, 2),
                    tuple(patricia, 2),
                    tuple(arthur, 3),
                    tuple(constance, 3));
        }

        @Test
        void stopsAtMaxDepth() {
            List<AncestryEntry> result = traversalService.ancestors(ALICE, hugo, 2);

            assertThat(result).extracting(e -> e.person().id()).containsExactly(chris, jonathan, patricia);
        }

        @Test
        void reportsPedigreeCollapseOnce() {
            long cousin = alice.person("Grace", "2006-01-01");
            alice.parent(rebecca, cousin);
            long child = alice.person("Zachary", "2030-01-01");
            alice.parent(hugo, child);
            alice.parent(cousin, child);

            List<AncestryEntry> result = traversalService.ancestors(ALICE, child, null);

            assertThat(result).extracting(e -> e.person().id()).doesNotHaveDuplicates();
            assertThat(result).filteredOn(e -> e.person().id() == jonathan)
                .extracting(AncestryEntry::generation).containsExactly(3);
        }

        @Test
        void rejectsDepthOutsideConfiguredRange() {
            assertThatThrownBy(() -> traversalService.ancestors(ALICE, hugo, 0))
                .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> traversalService.ancestors(ALICE, hugo, 500))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        void skipsTombstonedAncestors() {
            entityStore.softDelete(ALICE, EntityKind.PERSON, jonathan);

            List<AncestryEntry> result = traversalService.ancestors(ALICE, hugo, null);

            assertThat(result).extracting(e -> e.person().id()).containsExactly(chris, patricia);
        }
    }

    // ========== DESCENDANTS ==========

    @Nested
    @DisplayName("descendants")
    class Descendants {

        @Test
        void ordersEachGenerationByBirthThenId() {
            List<AncestryEntry> result = traversalService.descendants(ALICE, arthur, null);

            // Rebecca and Chris share a birth date; Rebecca was stored first
            assertThat(result)
                .extracting(e -> e.person().id(), AncestryEntry::generation)
                .containsExactly(
                    tuple(jonathan, 1),
                    tuple(timothy, 2),
                    tuple(rebecca, 2),
                    tuple(chris, 2),
                    tuple(hugo, 3));
        }

        @Test
        void leafHasNoDescendants() {
            assertThat(traversalService.descendants(ALICE, hugo, null)).isEmpty();
        }

        @Test
        void unknownPersonIsNotFound() {
            assertThatThrownBy(() -> traversalService.descendants(ALICE, 999_999L, null))
                .isInstanceOf(NotFoundException.class);
        }

        @Test
        void anotherAccountsPersonIsForbidden() {
            assertThatThrownBy(() -> traversalService.descendants(BOB, arthur, null))
                .isInstanceOf(ForbiddenException.class);
        }
    }

    // ========== IMMEDIATE FAMILY ==========

    @Nested
    @DisplayName("immediate family")
    class ImmediateFamily {

        @Test
        void parentsAndChildren() {
            assertThat(ids(traversalService.parents(ALICE, chris))).containsExactly(jonathan, patricia);
            assertThat(ids(traversalService.children(ALICE, jonathan))).containsExactly(timothy, rebecca, chris);
        }

        @Test
        void spousesReadBothOrientations() {
            assertThat(ids(traversalService.spouses(ALICE, jonathan))).containsExactly(patricia);
            assertThat(ids(traversalService.spouses(ALICE, patricia))).containsExactly(jonathan);
        }

        @Test
        void partnersCountAsSpouses() {
            long partner = alice.person("Sarah", "1976-04-02");
            alice.relationship(partner, chris, "partner");

            assertThat(ids(traversalService.spouses(ALICE, chris))).containsExactly(partner);
        }

        @Test
        void siblingsCombineSharedParentsAndExplicitEdges() {
            List<Person> siblings = traversalService.siblings(ALICE, chris);

            // Stuart has no birth date, so sorts last
            assertThat(ids(siblings)).containsExactly(timothy, rebecca, stuart);
        }

        @Test
        void tombstonedChildDropsOut() {
            entityStore.softDelete(ALICE, EntityKind.PERSON, timothy);

            assertThat(ids(traversalService.children(ALICE, jonathan))).containsExactly(rebecca, chris);
        }
    }

    // ========== TIMELINE ==========

    @Nested
    @DisplayName("timeline")
    class Timeline {

        @Test
        void ordersEventsByDateWithUndatedLast() {
            long wedding = alice.event("Wedding", "2001-03-15");
            long christening = alice.event("Christening", "1975-11-02");
            long undated = alice.event("Family photo", null);
            alice.attend(wedding, chris);
            alice.attend(undated, chris);
            long created = entityStore.create(ALICE, EntityKind.EVENT,
                Map.of("title", "Graduation", "eventDate", "1997-07-01", "createdBy", chris));
            alice.attend(christening, chris);

            List<Event> timeline = traversalService.timeline(ALICE, chris);

            assertThat(timeline).extracting(Event::id).containsExactly(christening, created, wedding, undated);
        }

        @Test
        void eventBothAttendedAndCreatedAppearsOnce() {
            long wedding = entityStore.create(ALICE, EntityKind.EVENT,
                Map.of("title", "Wedding", "eventDate", "2001-03-15", "createdBy", chris));
            alice.attend(wedding, chris);

            assertThat(traversalService.timeline(ALICE, chris)).extracting(Event::id).containsExactly(wedding);
        }

        @Test
        void tombstonedEventDropsOut() {
            long wedding = alice.event("Wedding", "2001-03-15");
            alice.attend(wedding, chris);
            entityStore.softDelete(ALICE, EntityKind.EVENT, wedding);

            assertThat(traversalService.timeline(ALICE, chris)).isEmpty();
        }
    }
}
