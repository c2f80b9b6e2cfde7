import io.github.flameyossnowy.tabula.api.exceptions.QueryNotRecognizedException;
import io.github.flameyossnowy.tabula.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.tabula.api.json.SchemaJsonReader;
import io.github.flameyossnowy.tabula.api.operation.RecordOperation;
import io.github.flameyossnowy.tabula.api.options.Query;
import io.github.flameyossnowy.tabula.api.options.QueryResult;
import io.github.flameyossnowy.tabula.api.options.RelatedRecordsFilter;
import io.github.flameyossnowy.tabula.api.record.GraphRecord;
import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import io.github.flameyossnowy.tabula.api.record.RelationshipData;
import io.github.flameyossnowy.tabula.api.schema.RecordSchema;
import io.github.flameyossnowy.tabula.sqlite.SQLiteRecordSource;
import io.github.flameyossnowy.tabula.sqlite.credentials.SQLiteCredentials;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteRecordSourceTest {
    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @TempDir
    Path directory;

    private MutableClock clock;
    private SQLiteRecordSource source;

    static RecordSchema solarSystem() throws IOException {
        try (InputStream stream = SQLiteRecordSourceTest.class.getResourceAsStream("/solar-system.json")) {
            return new SchemaJsonReader().read(stream);
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        clock = new MutableClock(START);
        source = SQLiteRecordSource.builder(solarSystem())
            .withCredentials(new SQLiteCredentials(directory.resolve("records.db")))
            .withClock(clock)
            .build();
    }

    @AfterEach
    void tearDown() {
        source.close();
    }

    private static GraphRecord planet(String id, String name, int sequence) {
        return GraphRecord.builder("planet", id).attribute("name", name).attribute("sequence", sequence).build();
    }

    private static RecordIdentity id(String type, String id) {
        return new RecordIdentity(type, id);
    }

    private static List<String> ids(List<GraphRecord> records) {
        return records.stream().map(GraphRecord::id).toList();
    }

    private void addPlanets() {
        source.update(List.of(
            RecordOperation.addRecord(planet("mercury", "Mercury", 1)),
            RecordOperation.addRecord(planet("venus", "Venus", 2)),
            RecordOperation.addRecord(planet("earth", "Earth", 3)),
            RecordOperation.addRecord(planet("jupiter", "Jupiter", 5))));
    }

    /*
     * Records
     */

    @Test
    void added_record_reads_back_with_declared_attributes() {
        GraphRecord added = source.update(RecordOperation.addRecord(GraphRecord.builder("planet", "earth")
            .attribute("name", "Earth")
            .attribute("sequence", 3)
            .attribute("habitable", true)
            .attribute("firstSeen", LocalDate.of(1543, 5, 24))
            .attribute("discoveredAt", Instant.parse("1543-05-24T12:00:00Z"))
            .attribute("color", "blue")
            .attribute("createdAt", Instant.parse("1999-01-01T00:00:00Z"))
            .build()));

        GraphRecord found = source.findRecord("planet", "earth");
        assertEquals(added, found);

        assertEquals("Earth", found.attribute("name"));
        assertEquals(3, ((Number) found.attribute("sequence")).intValue());
        assertEquals(true, found.attribute("habitable"));
        assertEquals(LocalDate.of(1543, 5, 24), found.attribute("firstSeen"));
        assertEquals(Instant.parse("1543-05-24T12:00:00Z"), found.attribute("discoveredAt"));
        assertEquals(START, found.attribute("createdAt"));
        assertEquals(START, found.attribute("updatedAt"));
        assertFalse(found.attributes().containsKey("color"));
    }

    @Test
    void record_without_id_gets_one_assigned() {
        GraphRecord added = source.update(RecordOperation.addRecord(GraphRecord.builder("author").attribute("name", "Le Guin").build()));

        assertNotNull(added.id());
        assertEquals("Le Guin", source.findRecord("author", added.id()).attribute("name"));
    }

    @Test
    void update_merges_attributes_and_bumps_updated_at() {
        source.update(RecordOperation.addRecord(planet("earth", "Earth", 3)));
        clock.advance(Duration.ofMinutes(5));

        GraphRecord updated = source.update(RecordOperation.updateRecord(GraphRecord.builder("planet", "earth")
            .attribute("name", "Terra")
            .build()));

        assertEquals("Terra", updated.attribute("name"));
        assertEquals(3, ((Number) updated.attribute("sequence")).intValue());
        assertEquals(START, updated.attribute("createdAt"));
        assertEquals(START.plus(Duration.ofMinutes(5)), updated.attribute("updatedAt"));
    }

    @Test
    void update_with_null_clears_the_attribute() {
        source.update(RecordOperation.addRecord(planet("earth", "Earth", 3)));
        GraphRecord updated = source.update(RecordOperation.updateRecord(GraphRecord.builder("planet", "earth")
            .attribute("sequence", null)
            .build()));

        assertFalse(updated.attributes().containsKey("sequence"));
        assertEquals("Earth", updated.attribute("name"));
    }

    @Test
    void replace_attribute_patches_one_column() {
        source.update(RecordOperation.addRecord(planet("earth", "Earth", 3)));
        clock.advance(Duration.ofSeconds(30));

        GraphRecord patched = source.update(RecordOperation.replaceAttribute(id("planet", "earth"), "habitable", true));

        assertEquals(true, patched.attribute("habitable"));
        assertEquals("Earth", patched.attribute("name"));
        assertEquals(START.plusSeconds(30), patched.attribute("updatedAt"));

        GraphRecord cleared = source.update(RecordOperation.replaceAttribute(id("planet", "earth"), "name", null));
        assertNull(cleared.attribute("name"));
    }

    @Test
    void replace_attribute_rejects_unknown_and_reserved_names() {
        source.update(RecordOperation.addRecord(planet("earth", "Earth", 3)));

        assertThrows(IllegalArgumentException.class,
            () -> source.update(RecordOperation.replaceAttribute(id("planet", "earth"), "color", "blue")));
        assertThrows(IllegalArgumentException.class,
            () -> source.update(RecordOperation.replaceAttribute(id("planet", "earth"), "updatedAt", Instant.now())));
    }

    @Test
    void remove_returns_the_record_as_it_was() {
        source.update(RecordOperation.addRecord(planet("pluto", "Pluto", 9)));

        GraphRecord removed = source.update(RecordOperation.removeRecord(id("planet", "pluto")));

        assertEquals("Pluto", removed.attribute("name"));
        assertThrows(RecordNotFoundException.class, () -> source.findRecord("planet", "pluto"));
    }

    @Test
    void removing_a_missing_record_names_it() {
        RecordNotFoundException exception = assertThrows(RecordNotFoundException.class,
            () -> source.update(RecordOperation.removeRecord(id("author", "1"))));

        assertEquals("Record not found: author:1", exception.getMessage());
        assertEquals("author", exception.getType());
        assertEquals("1", exception.getId());
    }

    @Test
    void every_addressed_record_must_exist() {
        assertThrows(RecordNotFoundException.class,
            () -> source.update(RecordOperation.updateRecord(planet("vulcan", "Vulcan", 0))));
        assertThrows(RecordNotFoundException.class,
            () -> source.update(RecordOperation.replaceAttribute(id("planet", "vulcan"), "name", "x")));
        assertThrows(RecordNotFoundException.class,
            () -> source.update(RecordOperation.addToRelatedRecords(id("planet", "vulcan"), "moons", id("moon", "luna"))));
        assertThrows(RecordNotFoundException.class, () -> source.findRecord("planet", "vulcan"));
    }

    /*
     * Transactions
     */

    @Test
    void failing_operation_rolls_back_the_whole_batch() {
        assertThrows(RecordNotFoundException.class, () -> source.update(List.of(
            RecordOperation.addRecord(planet("earth", "Earth", 3)),
            RecordOperation.removeRecord(id("author", "1")))));

        assertTrue(source.query(Query.findRecords("planet").build()).records().isEmpty());
    }

    @Test
    void later_operations_see_earlier_ones() {
        List<GraphRecord> results = source.update(List.of(
            RecordOperation.addRecord(planet("earth", "Earth", 3)),
            RecordOperation.addRecord(GraphRecord.builder("moon", "luna").attribute("name", "Luna").hasOne("planet", "planet", "earth").build()),
            RecordOperation.replaceAttribute(id("planet", "earth"), "name", "Terra")));

        assertEquals(3, results.size());
        assertEquals("Terra", results.get(2).attribute("name"));
    }

    @Test
    void empty_batches_do_nothing() {
        assertTrue(source.update(List.of()).isEmpty());
        assertTrue(source.query(List.of()).isEmpty());
    }

    /*
     * Queries
     */

    @Test
    void filter_keeps_matching_records() {
        addPlanets();

        List<GraphRecord> found = source.query(Query.findRecords("planet").where("sequence").gt(2).sort("sequence").build()).records();

        assertEquals(List.of("earth", "jupiter"), ids(found));
    }

    @Test
    void filters_combine_conjunctively() {
        addPlanets();

        List<GraphRecord> found = source.query(Query.findRecords("planet")
            .where("sequence").gte(2)
            .where("sequence").lt(5)
            .sort("sequence")
            .build()).records();

        assertEquals(List.of("venus", "earth"), ids(found));
        assertEquals(List.of("earth"), ids(source.query(Query.findRecords("planet").where("name").eq("Earth").build()).records()));
    }

    @Test
    void composite_sort_applies_keys_in_order() {
        source.update(List.of(
            RecordOperation.addRecord(GraphRecord.builder("planet", "a").attribute("name", "B").attribute("sequence", 1).build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "b").attribute("name", "A").attribute("sequence", 1).build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "c").attribute("name", "C").attribute("sequence", 2).build())));

        List<GraphRecord> found = source.query(Query.findRecords("planet").sort("-sequence", "name").build()).records();

        assertEquals(List.of("c", "b", "a"), ids(found));
    }

    @Test
    void page_windows_the_sorted_result() {
        addPlanets();

        List<GraphRecord> page = source.query(Query.findRecords("planet").sort("sequence").page(1, 2).build()).records();
        assertEquals(List.of("venus", "earth"), ids(page));

        List<GraphRecord> offsetOnly = source.query(Query.findRecords("planet").sort("sequence").offset(3).build()).records();
        assertEquals(List.of("jupiter"), ids(offsetOnly));
    }

    @Test
    void datetime_sort_and_filter_are_chronological() {
        source.update(List.of(
            RecordOperation.addRecord(GraphRecord.builder("planet", "a").attribute("discoveredAt", Instant.parse("2020-01-01T00:00:00Z")).build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "b").attribute("discoveredAt", Instant.parse("2020-01-01T00:00:00.500Z")).build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "c").attribute("discoveredAt", Instant.parse("2020-01-01T00:00:01Z")).build())));

        assertEquals(List.of("a", "b", "c"), ids(source.query(Query.findRecords("planet").sort("discoveredAt").build()).records()));
        assertEquals(List.of("c", "b", "a"), ids(source.query(Query.findRecords("planet").sort("-discoveredAt").build()).records()));

        List<GraphRecord> later = source.query(Query.findRecords("planet")
            .where("discoveredAt").gt(Instant.parse("2020-01-01T00:00:00Z"))
            .sort("discoveredAt")
            .build()).records();
        assertEquals(List.of("b", "c"), ids(later));

        List<GraphRecord> upToHalf = source.query(Query.findRecords("planet")
            .where("discoveredAt").lte("2020-01-01T00:00:00.500Z")
            .sort("discoveredAt")
            .build()).records();
        assertEquals(List.of("a", "b"), ids(upToHalf));
    }

    @Test
    void datetime_text_is_normalized_before_storage() {
        source.update(List.of(
            RecordOperation.addRecord(GraphRecord.builder("planet", "east").attribute("discoveredAt", "2020-01-01T02:00:00+02:00").build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "west").attribute("discoveredAt", "2019-12-31T23:30:00Z").build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "dated").attribute("firstSeen", "2020-01-02").build())));

        assertEquals(Instant.parse("2020-01-01T00:00:00Z"), source.findRecord("planet", "east").attribute("discoveredAt"));
        assertEquals(LocalDate.of(2020, 1, 2), source.findRecord("planet", "dated").attribute("firstSeen"));
        assertEquals(List.of("west", "east"), ids(source.query(Query.findRecords("planet")
            .where("discoveredAt").gte("2019-01-01T00:00:00Z")
            .sort("discoveredAt")
            .build()).records()));
        assertEquals(List.of("east"), ids(source.query(Query.findRecords("planet")
            .where("discoveredAt").eq(Instant.parse("2020-01-01T00:00:00Z"))
            .build()).records()));

        source.update(RecordOperation.replaceAttribute(id("planet", "west"), "discoveredAt", "2021-06-01T00:00:00Z"));
        assertEquals(List.of("east", "west"), ids(source.query(Query.findRecords("planet")
            .where("discoveredAt").gte("2019-01-01T00:00:00Z")
            .sort("discoveredAt")
            .build()).records()));

        assertThrows(IllegalArgumentException.class, () -> source.update(RecordOperation.addRecord(
            GraphRecord.builder("planet", "bad").attribute("discoveredAt", "yesterday").build())));
        assertThrows(RecordNotFoundException.class, () -> source.findRecord("planet", "bad"));
    }

    @Test
    void server_timestamps_sort_chronologically_below_a_second() {
        source.update(RecordOperation.addRecord(planet("first", "First", 1)));
        clock.advance(Duration.ofMillis(500));
        source.update(RecordOperation.addRecord(planet("second", "Second", 2)));
        clock.advance(Duration.ofMillis(500));
        source.update(RecordOperation.addRecord(planet("third", "Third", 3)));

        assertEquals(List.of("first", "second", "third"), ids(source.query(Query.findRecords("planet").sort("createdAt").build()).records()));
        assertEquals(List.of("second", "third"), ids(source.query(Query.findRecords("planet")
            .where("createdAt").gt(START)
            .sort("createdAt")
            .build()).records()));
        assertEquals(START.plusMillis(500), source.findRecord("planet", "second").attribute("createdAt"));
    }

    @Test
    void unsupported_filter_is_not_recognized() {
        addPlanets();

        RelatedRecordsFilter filter = new RelatedRecordsFilter("moons", List.of(id("moon", "luna")), "equal");
        QueryNotRecognizedException exception = assertThrows(QueryNotRecognizedException.class,
            () -> source.query(Query.findRecords("planet").where(filter).build()));
        assertSame(filter, exception.getSpecifier());

        assertThrows(QueryNotRecognizedException.class,
            () -> source.query(Query.findRecords("planet").sort("color").build()));
    }

    @Test
    void find_by_identity_list_keeps_order_and_drops_misses() {
        addPlanets();
        source.update(RecordOperation.addRecord(GraphRecord.builder("moon", "luna").attribute("name", "Luna").build()));

        List<GraphRecord> found = source.query(Query.findRecords(List.of(
            id("planet", "jupiter"),
            id("moon", "luna"),
            id("planet", "vulcan"),
            id("planet", "mercury")))).records();

        assertEquals(List.of("jupiter", "luna", "mercury"), ids(found));
        assertEquals("moon", found.get(1).type());
    }

    @Test
    void long_identity_lists_are_looked_up_in_chunks() {
        addPlanets();

        List<RecordIdentity> wanted = new ArrayList<>();
        for (int i = 0; i < 40_000; i++) wanted.add(id("planet", "missing-" + i));
        wanted.add(id("planet", "earth"));
        wanted.add(20_000, id("planet", "mercury"));

        List<GraphRecord> found = source.query(Query.findRecords(wanted)).records();

        assertEquals(List.of("mercury", "earth"), ids(found));
    }

    @Test
    void one_batch_answers_several_queries() {
        addPlanets();

        List<QueryResult> results = source.query(List.of(
            Query.findRecord("planet", "earth"),
            Query.findRecords("planet").limit(2).build()));

        assertFalse(results.get(0).isCollection());
        assertEquals("earth", results.get(0).record().id());
        assertEquals(2, results.get(1).records().size());
    }

    /*
     * One-to-many
     */

    @Test
    void has_one_is_embedded_and_followed() {
        source.update(List.of(
            RecordOperation.addRecord(planet("earth", "Earth", 3)),
            RecordOperation.addRecord(GraphRecord.builder("moon", "luna").attribute("name", "Luna").hasOne("planet", "planet", "earth").build())));

        GraphRecord luna = source.findRecord("moon", "luna");
        RelationshipData.HasOne planet = (RelationshipData.HasOne) luna.relationship("planet");
        assertEquals(id("planet", "earth"), planet.identity());

        GraphRecord related = source.query(Query.findRelatedRecord(id("moon", "luna"), "planet")).record();
        assertEquals("Earth", related.attribute("name"));

        assertEquals(List.of("luna"), ids(source.query(Query.findRelatedRecords(id("planet", "earth"), "moons").build()).records()));
        assertNull(source.findRecord("planet", "earth").relationship("moons"));
    }

    @Test
    void unset_has_one_finds_nothing() {
        source.update(RecordOperation.addRecord(GraphRecord.builder("moon", "luna").attribute("name", "Luna").build()));
        assertNull(source.query(Query.findRelatedRecord(id("moon", "luna"), "planet")).record());
    }

    @Test
    void has_one_target_must_exist() {
        assertThrows(RecordNotFoundException.class, () -> source.update(RecordOperation.addRecord(
            GraphRecord.builder("moon", "luna").hasOne("planet", "planet", "vulcan").build())));
    }

    @Test
    void replace_related_record_sets_and_clears_the_key() {
        source.update(List.of(
            RecordOperation.addRecord(planet("earth", "Earth", 3)),
            RecordOperation.addRecord(planet("mars", "Mars", 4)),
            RecordOperation.addRecord(GraphRecord.builder("moon", "luna").hasOne("planet", "planet", "earth").build())));

        source.update(RecordOperation.replaceRelatedRecord(id("moon", "luna"), "planet", id("planet", "mars")));
        assertEquals("mars", source.query(Query.findRelatedRecord(id("moon", "luna"), "planet")).record().id());
        assertTrue(source.query(Query.findRelatedRecords(id("planet", "earth"), "moons").build()).records().isEmpty());

        GraphRecord cleared = source.update(RecordOperation.replaceRelatedRecord(id("moon", "luna"), "planet", null));
        assertNull(cleared.relationship("planet"));
    }

    @Test
    void adding_a_planet_with_moons_claims_them() {
        source.update(List.of(
            RecordOperation.addRecord(GraphRecord.builder("moon", "phobos").attribute("name", "Phobos").build()),
            RecordOperation.addRecord(GraphRecord.builder("moon", "deimos").attribute("name", "Deimos").build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "mars")
                .attribute("name", "Mars")
                .hasMany("moons", id("moon", "phobos"), id("moon", "deimos"))
                .build())));

        List<GraphRecord> moons = source.query(Query.findRelatedRecords(id("planet", "mars"), "moons").sort("name").build()).records();
        assertEquals(List.of("deimos", "phobos"), ids(moons));

        RelationshipData.HasOne owner = (RelationshipData.HasOne) source.findRecord("moon", "phobos").relationship("planet");
        assertEquals(id("planet", "mars"), owner.identity());
    }

    @Test
    void related_records_are_filtered_sorted_and_paged() {
        source.update(List.of(
            RecordOperation.addRecord(GraphRecord.builder("moon", "io").attribute("name", "Io").build()),
            RecordOperation.addRecord(GraphRecord.builder("moon", "europa").attribute("name", "Europa").build()),
            RecordOperation.addRecord(GraphRecord.builder("moon", "ganymede").attribute("name", "Ganymede").build()),
            RecordOperation.addRecord(GraphRecord.builder("moon", "callisto").attribute("name", "Callisto").build()),
            RecordOperation.addRecord(GraphRecord.builder("moon", "amalthea").attribute("name", "Amalthea").build()),
            RecordOperation.addRecord(GraphRecord.builder("moon", "luna").attribute("name", "Luna").build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "jupiter")
                .attribute("name", "Jupiter")
                .hasMany("moons", id("moon", "io"), id("moon", "europa"), id("moon", "ganymede"), id("moon", "callisto"), id("moon", "amalthea"))
                .build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "earth").hasMany("moons", id("moon", "luna")).build())));

        List<GraphRecord> page = source.query(Query.findRelatedRecords(id("planet", "jupiter"), "moons")
            .where("name").gt("B")
            .sort("name")
            .page(1, 2)
            .build()).records();
        assertEquals(List.of("europa", "ganymede"), ids(page));

        List<GraphRecord> rest = source.query(Query.findRelatedRecords(id("planet", "jupiter"), "moons")
            .sort("-name")
            .offset(3)
            .build()).records();
        assertEquals(List.of("callisto", "amalthea"), ids(rest));

        List<GraphRecord> limited = source.query(Query.findRelatedRecords(id("planet", "jupiter"), "moons")
            .where("name").lt("Io")
            .sort("name")
            .limit(2)
            .build()).records();
        assertEquals(List.of("amalthea", "callisto"), ids(limited));
    }

    @Test
    void add_then_remove_related_returns_to_empty() {
        source.update(List.of(
            RecordOperation.addRecord(planet("mars", "Mars", 4)),
            RecordOperation.addRecord(GraphRecord.builder("moon", "phobos").build())));

        source.update(RecordOperation.addToRelatedRecords(id("planet", "mars"), "moons", id("moon", "phobos")));
        assertEquals(1, source.query(Query.findRelatedRecords(id("planet", "mars"), "moons").build()).records().size());

        source.update(RecordOperation.removeFromRelatedRecords(id("planet", "mars"), "moons", id("moon", "phobos")));
        assertTrue(source.query(Query.findRelatedRecords(id("planet", "mars"), "moons").build()).records().isEmpty());
        assertNull(source.findRecord("moon", "phobos").relationship("planet"));
    }

    @Test
    void removing_from_the_wrong_owner_leaves_the_link() {
        source.update(List.of(
            RecordOperation.addRecord(planet("earth", "Earth", 3)),
            RecordOperation.addRecord(planet("mars", "Mars", 4)),
            RecordOperation.addRecord(GraphRecord.builder("moon", "luna").hasOne("planet", "planet", "earth").build())));

        source.update(RecordOperation.removeFromRelatedRecords(id("planet", "mars"), "moons", id("moon", "luna")));

        assertEquals(List.of("luna"), ids(source.query(Query.findRelatedRecords(id("planet", "earth"), "moons").build()).records()));
    }

    @Test
    void linking_a_missing_record_fails() {
        source.update(RecordOperation.addRecord(planet("mars", "Mars", 4)));

        assertThrows(RecordNotFoundException.class,
            () -> source.update(RecordOperation.addToRelatedRecords(id("planet", "mars"), "moons", id("moon", "ghost"))));
    }

    @Test
    void relationship_kind_must_match_the_operation() {
        source.update(List.of(
            RecordOperation.addRecord(planet("mars", "Mars", 4)),
            RecordOperation.addRecord(GraphRecord.builder("moon", "phobos").build())));

        assertThrows(IllegalArgumentException.class,
            () -> source.update(RecordOperation.replaceRelatedRecord(id("planet", "mars"), "moons", id("moon", "phobos"))));
        assertThrows(IllegalArgumentException.class,
            () -> source.update(RecordOperation.addToRelatedRecords(id("moon", "phobos"), "planet", id("planet", "mars"))));
        assertThrows(IllegalArgumentException.class,
            () -> source.update(RecordOperation.addToRelatedRecords(id("planet", "mars"), "rings", id("moon", "phobos"))));
        assertThrows(IllegalArgumentException.class,
            () -> source.update(RecordOperation.addToRelatedRecords(id("planet", "mars"), "moons", id("tag", "phobos"))));
        assertThrows(IllegalArgumentException.class,
            () -> source.query(Query.findRelatedRecord(id("planet", "mars"), "moons")));
    }

    /*
     * Many-to-many
     */

    @Test
    void join_table_links_both_sides() {
        source.update(List.of(
            RecordOperation.addRecord(GraphRecord.builder("tag", "rocky").attribute("label", "rocky").build()),
            RecordOperation.addRecord(GraphRecord.builder("tag", "inner").attribute("label", "inner").build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "mars")
                .attribute("name", "Mars")
                .hasMany("tags", id("tag", "rocky"), id("tag", "inner"))
                .build()),
            RecordOperation.addRecord(planet("venus", "Venus", 2))));

        source.update(RecordOperation.addToRelatedRecords(id("tag", "rocky"), "planets", id("planet", "venus")));

        List<GraphRecord> tags = source.query(Query.findRelatedRecords(id("planet", "mars"), "tags").sort("label").build()).records();
        assertEquals(List.of("inner", "rocky"), ids(tags));

        List<GraphRecord> planets = source.query(Query.findRelatedRecords(id("tag", "rocky"), "planets").sort("-name").build()).records();
        assertEquals(List.of("venus", "mars"), ids(planets));

        List<GraphRecord> filtered = source.query(Query.findRelatedRecords(id("tag", "rocky"), "planets")
            .where("name").eq("Mars")
            .build()).records();
        assertEquals(List.of("mars"), ids(filtered));
    }

    @Test
    void join_table_records_are_filtered_sorted_and_paged() {
        source.update(List.of(
            RecordOperation.addRecord(GraphRecord.builder("tag", "rocky").attribute("label", "rocky").build()),
            RecordOperation.addRecord(GraphRecord.builder("tag", "inner").attribute("label", "inner").build()),
            RecordOperation.addRecord(GraphRecord.builder("tag", "red").attribute("label", "red").build()),
            RecordOperation.addRecord(GraphRecord.builder("tag", "dusty").attribute("label", "dusty").build()),
            RecordOperation.addRecord(GraphRecord.builder("tag", "cold").attribute("label", "cold").build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "mars")
                .attribute("name", "Mars")
                .hasMany("tags", id("tag", "rocky"), id("tag", "inner"), id("tag", "red"), id("tag", "dusty"), id("tag", "cold"))
                .build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "venus")
                .attribute("name", "Venus")
                .hasMany("tags", id("tag", "rocky"))
                .build())));

        List<GraphRecord> page = source.query(Query.findRelatedRecords(id("planet", "mars"), "tags")
            .where("label").gte("d")
            .sort("label")
            .page(1, 2)
            .build()).records();
        assertEquals(List.of("inner", "red"), ids(page));

        List<GraphRecord> rest = source.query(Query.findRelatedRecords(id("planet", "mars"), "tags")
            .sort("label")
            .offset(4)
            .build()).records();
        assertEquals(List.of("rocky"), ids(rest));

        assertEquals(List.of("venus"), ids(source.query(Query.findRelatedRecords(id("tag", "rocky"), "planets")
            .where("name").gte("M")
            .sort("name")
            .page(1, 1)
            .build()).records()));
    }

    @Test
    void adding_an_existing_link_inserts_nothing() {
        source.update(List.of(
            RecordOperation.addRecord(GraphRecord.builder("tag", "rocky").build()),
            RecordOperation.addRecord(planet("mars", "Mars", 4))));

        source.update(List.of(
            RecordOperation.addToRelatedRecords(id("planet", "mars"), "tags", id("tag", "rocky")),
            RecordOperation.addToRelatedRecords(id("planet", "mars"), "tags", id("tag", "rocky")),
            RecordOperation.addToRelatedRecords(id("tag", "rocky"), "planets", id("planet", "mars"))));

        assertEquals(1, source.query(Query.findRelatedRecords(id("planet", "mars"), "tags").build()).records().size());
    }

    @Test
    void replace_related_records_is_idempotent() {
        source.update(List.of(
            RecordOperation.addRecord(GraphRecord.builder("tag", "rocky").build()),
            RecordOperation.addRecord(GraphRecord.builder("tag", "inner").build()),
            RecordOperation.addRecord(GraphRecord.builder("tag", "giant").build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "mars").hasMany("tags", id("tag", "giant")).build())));

        List<RecordIdentity> wanted = List.of(id("tag", "rocky"), id("tag", "inner"));
        source.update(RecordOperation.replaceRelatedRecords(id("planet", "mars"), "tags", wanted));
        source.update(RecordOperation.replaceRelatedRecords(id("planet", "mars"), "tags", wanted));

        List<GraphRecord> tags = source.query(Query.findRelatedRecords(id("planet", "mars"), "tags").build()).records();
        assertEquals(List.of("inner", "rocky"), ids(tags).stream().sorted().toList());
        assertTrue(source.query(Query.findRelatedRecords(id("tag", "giant"), "planets").build()).records().isEmpty());
    }

    @Test
    void update_replaces_only_the_relationships_present() {
        source.update(List.of(
            RecordOperation.addRecord(GraphRecord.builder("tag", "rocky").build()),
            RecordOperation.addRecord(GraphRecord.builder("moon", "phobos").build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "mars")
                .hasMany("tags", id("tag", "rocky"))
                .hasMany("moons", id("moon", "phobos"))
                .build())));

        source.update(RecordOperation.updateRecord(GraphRecord.builder("planet", "mars").hasMany("tags", List.of()).build()));

        assertTrue(source.query(Query.findRelatedRecords(id("planet", "mars"), "tags").build()).records().isEmpty());
        assertEquals(List.of("phobos"), ids(source.query(Query.findRelatedRecords(id("planet", "mars"), "moons").build()).records()));
    }

    @Test
    void related_records_of_a_missing_owner_fail() {
        assertThrows(RecordNotFoundException.class,
            () -> source.query(Query.findRelatedRecords(id("planet", "vulcan"), "tags").build()));
    }

    @Test
    void removing_a_record_leaves_links_dangling() {
        source.update(List.of(
            RecordOperation.addRecord(GraphRecord.builder("tag", "rocky").build()),
            RecordOperation.addRecord(GraphRecord.builder("planet", "mars").hasMany("tags", id("tag", "rocky")).build())));

        source.update(RecordOperation.removeRecord(id("tag", "rocky")));

        assertTrue(source.query(Query.findRelatedRecords(id("planet", "mars"), "tags").build()).records().isEmpty());
        assertEquals("mars", source.findRecord("planet", "mars").id());
    }
}
