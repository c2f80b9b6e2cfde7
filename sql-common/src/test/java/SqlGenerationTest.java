import io.github.flameyossnowy.tabula.api.exceptions.QueryNotRecognizedException;
import io.github.flameyossnowy.tabula.api.options.AttributeFilter;
import io.github.flameyossnowy.tabula.api.options.AttributeSort;
import io.github.flameyossnowy.tabula.api.options.FilterOperator;
import io.github.flameyossnowy.tabula.api.options.FilterOption;
import io.github.flameyossnowy.tabula.api.options.OffsetLimitPage;
import io.github.flameyossnowy.tabula.api.options.PageOption;
import io.github.flameyossnowy.tabula.api.options.RelatedRecordsFilter;
import io.github.flameyossnowy.tabula.api.options.SortOption;
import io.github.flameyossnowy.tabula.api.options.SortOrder;
import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import io.github.flameyossnowy.tabula.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.tabula.sql.internals.mapping.ModelMapper;
import io.github.flameyossnowy.tabula.sql.internals.mapping.RelationMapping;
import io.github.flameyossnowy.tabula.sql.internals.mapping.TableMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlGenerationTest {
    private ModelMapper mapper;
    private QueryParseEngine sqlite;

    @BeforeEach
    void setUp() {
        mapper = new ModelMapper(ModelMapperTest.library());
        sqlite = new QueryParseEngine(QueryParseEngine.SQLType.SQLITE);
    }

    @Test
    void creates_record_table() {
        assertEquals(
            "CREATE TABLE \"books\" (\"id\" TEXT NOT NULL, "
                + "\"created_at\" DATETIME DEFAULT CURRENT_TIMESTAMP NOT NULL, "
                + "\"updated_at\" DATETIME DEFAULT CURRENT_TIMESTAMP NOT NULL, "
                + "\"title\" VARCHAR(255), \"page_count\" INTEGER, \"author_id\" TEXT, PRIMARY KEY (\"id\"))",
            sqlite.parseRepository(mapper.mapping("book")));
    }

    @Test
    void reserved_attribute_gets_no_second_column() {
        String ddl = sqlite.parseRepository(mapper.mapping("author"));
        assertTrue(ddl.startsWith("CREATE TABLE \"authors\""));
        assertEquals(ddl.indexOf("\"created_at\""), ddl.lastIndexOf("\"created_at\""));
        assertTrue(ddl.contains("\"portrait_id\" TEXT"));
    }

    @Test
    void column_types_follow_dialect() {
        String mysql = new QueryParseEngine(QueryParseEngine.SQLType.MYSQL).parseRepository(mapper.mapping("book"));
        assertTrue(mysql.contains("`id` VARCHAR(255) NOT NULL"));
        assertTrue(mysql.contains("`page_count` INTEGER"));

        String postgres = new QueryParseEngine(QueryParseEngine.SQLType.POSTGRESQL).parseRepository(mapper.mapping("book"));
        assertTrue(postgres.contains("\"created_at\" TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL"));
        assertTrue(postgres.contains("\"page_count\" BIGINT"));
    }

    @Test
    void creates_join_table_with_two_key_columns() {
        RelationMapping.JoinTable joinTable = (RelationMapping.JoinTable) mapper.mapping("book").relation("tags");
        assertEquals(
            "CREATE TABLE \"books_tags\" (\"books_id\" TEXT NOT NULL, \"tags_id\" TEXT NOT NULL)",
            sqlite.parseJoinTable(joinTable));
    }

    @Test
    void select_pushes_filter_sort_and_page_down() {
        List<FilterOption> filters = List.of(
            new AttributeFilter("pageCount", FilterOperator.GT, 2),
            new AttributeFilter("title", FilterOperator.EQUAL, null));
        List<SortOption> sort = List.of(new AttributeSort("title", SortOrder.DESCENDING), new AttributeSort("pageCount", SortOrder.ASCENDING));

        assertEquals(
            "SELECT * FROM \"books\" WHERE \"page_count\" > ? AND \"title\" IS NULL ORDER BY \"title\" DESC, \"page_count\" ASC LIMIT 2 OFFSET 1",
            sqlite.parseSelect(mapper.mapping("book"), filters, sort, new OffsetLimitPage(1, 2)));
    }

    @Test
    void offset_without_limit_per_dialect() {
        OffsetLimitPage page = new OffsetLimitPage(3, null);
        assertEquals(" LIMIT -1 OFFSET 3", QueryParseEngine.SQLType.SQLITE.parsePage(page));
        assertEquals(" LIMIT 18446744073709551615 OFFSET 3", QueryParseEngine.SQLType.MYSQL.parsePage(page));
        assertEquals(" OFFSET 3", QueryParseEngine.SQLType.POSTGRESQL.parsePage(page));
        assertEquals("", QueryParseEngine.SQLType.SQLITE.parsePage(new OffsetLimitPage(null, null)));
    }

    @Test
    void selects_related_records_by_target_key() {
        TableMapping book = mapper.mapping("book");
        RelationMapping books = mapper.mapping("author").relation("books");

        assertEquals(
            "SELECT * FROM \"books\" WHERE \"author_id\" = ? AND \"page_count\" >= ? ORDER BY \"title\" ASC",
            sqlite.parseSelectRelated(books, book, List.of(new AttributeFilter("pageCount", FilterOperator.GTE, 100)),
                List.of(new AttributeSort("title", SortOrder.ASCENDING)), null));
    }

    @Test
    void selects_related_records_through_join_table() {
        TableMapping tag = mapper.mapping("tag");
        RelationMapping tags = mapper.mapping("book").relation("tags");

        assertEquals(
            "SELECT t.* FROM \"tags\" t INNER JOIN \"books_tags\" j ON j.\"books_id\" = t.\"id\" WHERE j.\"tags_id\" = ?"
                + " AND t.\"label\" < ? ORDER BY t.\"label\" DESC LIMIT 5",
            sqlite.parseSelectRelated(tags, tag, List.of(new AttributeFilter("label", FilterOperator.LT, "m")),
                List.of(new AttributeSort("label", SortOrder.DESCENDING)), new OffsetLimitPage(null, 5)));
    }

    @Test
    void single_valued_relationship_has_no_related_collection() {
        RelationMapping author = mapper.mapping("book").relation("author");
        assertThrows(IllegalArgumentException.class,
            () -> sqlite.parseSelectRelated(author, mapper.mapping("author"), List.of(), List.of(), null));
    }

    @Test
    void writes_and_lookups() {
        assertEquals("SELECT * FROM \"books\" WHERE \"id\" = ?", sqlite.parseSelectById(mapper.mapping("book")));
        assertEquals("SELECT * FROM \"books\" WHERE \"id\" IN (?, ?, ?)", sqlite.parseSelectByIds(mapper.mapping("book"), 3));
        assertEquals("INSERT INTO \"books\" (\"id\", \"title\") VALUES (?, ?)", sqlite.parseInsert("books", List.of("id", "title")));
        assertEquals("UPDATE \"books\" SET \"updated_at\" = ? WHERE \"id\" = ?", sqlite.parseTouch(mapper.mapping("book")));
        assertEquals(
            "UPDATE \"books\" SET \"title\" = ?, \"author_id\" = NULL WHERE \"id\" = ?",
            sqlite.parseUpdate("books", List.of("title"), List.of("author_id"), List.of("id")));
        assertEquals("DELETE FROM \"books\" WHERE \"id\" = ?", sqlite.parseDelete("books", List.of("id")));
        assertEquals("SELECT \"id\" FROM \"books\" WHERE \"author_id\" = ?", sqlite.parseLinkedIds(mapper.mapping("author").relation("books")));

        RelationMapping.JoinTable joinTable = (RelationMapping.JoinTable) mapper.mapping("book").relation("tags");
        assertEquals("SELECT 1 FROM \"books_tags\" WHERE \"tags_id\" = ? AND \"books_id\" = ?", sqlite.parseLinkExists(joinTable));
    }

    @Test
    void repeated_statements_come_from_the_cache() {
        TableMapping book = mapper.mapping("book");
        assertSame(sqlite.parseSelectById(book), sqlite.parseSelectById(book));
    }

    @Test
    void nothing_to_update_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> sqlite.parseUpdate("books", List.of(), List.of(), List.of("id")));
    }

    @Test
    void unsupported_specifiers_fail_before_any_statement() {
        TableMapping book = mapper.mapping("book");

        RelatedRecordsFilter related = new RelatedRecordsFilter("author", List.of(new RecordIdentity("author", "1")), "equal");
        QueryNotRecognizedException filter = assertThrows(QueryNotRecognizedException.class,
            () -> sqlite.parseSelect(book, List.of(related), List.of(), null));
        assertSame(related, filter.getSpecifier());

        QueryNotRecognizedException attribute = assertThrows(QueryNotRecognizedException.class,
            () -> sqlite.parseSelect(book, List.of(new AttributeFilter("isbn", FilterOperator.EQUAL, "x")), List.of(), null));
        assertEquals("isbn", attribute.getSpecifier());

        SortOption relevance = () -> "relevance";
        assertThrows(QueryNotRecognizedException.class, () -> sqlite.parseSelect(book, List.of(), List.of(relevance), null));

        PageOption cursor = () -> "cursor";
        assertThrows(QueryNotRecognizedException.class, () -> sqlite.parseSelect(book, List.of(), List.of(), cursor));
    }
}
