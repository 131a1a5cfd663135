package com.hailmary.source;

import com.hailmary.config.SourceConfig;
import com.hailmary.exception.SyncConfigurationException;
import com.hailmary.model.ExtractionCursor;
import com.hailmary.model.SourceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JdbcRelationalStoreTest {

    private static final Instant T1000 = Instant.parse("2024-05-01T10:00:00Z");

    private NamedParameterJdbcTemplate jdbc;
    private JdbcTemplate plainJdbc;
    private JdbcRelationalStore store;
    private SourceConfig prospect;

    @BeforeEach
    void setUp() {
        jdbc = mock(NamedParameterJdbcTemplate.class);
        plainJdbc = mock(JdbcTemplate.class);
        when(jdbc.getJdbcTemplate()).thenReturn(plainJdbc);
        store = new JdbcRelationalStore(jdbc);

        prospect = new SourceConfig();
        prospect.setName("prospect");
        prospect.setRelation("Prospect");
        prospect.setPrimaryKey(List.of("id"));
        prospect.setTrackingColumn("updatedAt");
        prospect.setIndex("prospect");
    }

    private static SourceConfig view() {
        SourceConfig view = new SourceConfig();
        view.setName("company_prospect_view");
        view.setRelation("company_prospect_view");
        view.setPrimaryKey(List.of("company_id", "prospect_id"));
        view.setTrackingColumn("last_updated");
        view.setIndex("company_prospect_view");
        return view;
    }

    @Test
    void firstPage_filtersOnTrackingValueOnly() {
        assertThat(JdbcRelationalStore.buildPageQuery(prospect, ExtractionCursor.after(T1000))).isEqualTo(
                "SELECT * FROM \"Prospect\" WHERE \"updatedAt\" > :trackingValue"
                        + " ORDER BY \"updatedAt\" ASC, \"id\" ASC NULLS LAST LIMIT :limit");
    }

    @Test
    void followingPages_useKeysetOnTrackingValueAndPrimaryKey() {
        assertThat(JdbcRelationalStore.buildPageQuery(prospect, new ExtractionCursor(T1000, List.of(7L)))).isEqualTo(
                "SELECT * FROM \"Prospect\" WHERE \"updatedAt\" > :trackingValue"
                        + " OR (\"updatedAt\" = :trackingValue AND (\"id\" > :key0 OR \"id\" IS NULL))"
                        + " ORDER BY \"updatedAt\" ASC, \"id\" ASC NULLS LAST LIMIT :limit");
    }

    @Test
    void compositeKey_comparesColumnByColumn() {
        assertThat(JdbcRelationalStore.buildPageQuery(view(), new ExtractionCursor(T1000, List.of(3L, 9L))))
                .isEqualTo("SELECT * FROM \"company_prospect_view\" WHERE \"last_updated\" > :trackingValue"
                        + " OR (\"last_updated\" = :trackingValue AND"
                        + " (((\"company_id\" > :key0 OR \"company_id\" IS NULL))"
                        + " OR (\"company_id\" = :key0 AND (\"prospect_id\" > :key1 OR \"prospect_id\" IS NULL))))"
                        + " ORDER BY \"last_updated\" ASC, \"company_id\" ASC NULLS LAST,"
                        + " \"prospect_id\" ASC NULLS LAST LIMIT :limit");
    }

    @Test
    void compositeKey_nullPartAtCursorSortsLast() {
        List<Object> companyWithoutProspect = new ArrayList<>();
        companyWithoutProspect.add(3L);
        companyWithoutProspect.add(null);

        assertThat(JdbcRelationalStore.buildPageQuery(view(), new ExtractionCursor(T1000, companyWithoutProspect)))
                .contains("AND (\"company_id\" > :key0 OR \"company_id\" IS NULL))")
                .doesNotContain(":key1");
    }

    @Test
    @SuppressWarnings("unchecked")
    void compositeKey_toleratesNullPartAndJoinsDocumentId() {
        Map<String, Object> withProspect = new HashMap<>();
        withProspect.put("company_id", 3L);
        withProspect.put("prospect_id", 9L);
        withProspect.put("last_updated", Timestamp.from(T1000));
        Map<String, Object> withoutProspect = new HashMap<>();
        withoutProspect.put("company_id", 4L);
        withoutProspect.put("prospect_id", null);
        withoutProspect.put("last_updated", Timestamp.from(T1000));
        when(jdbc.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(List.of(withProspect, withoutProspect));

        List<Object> cursorKey = new ArrayList<>();
        cursorKey.add(2L);
        cursorKey.add(null);
        List<SourceRecord> page = store.fetchPage(view(), new ExtractionCursor(T1000, cursorKey), 10);

        assertThat(page).extracting(SourceRecord::getDocumentId).containsExactly("3:9", "4:");
        assertThat(page.get(1).getPrimaryKey()).containsExactly(4L, null);

        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbc).query(anyString(), params.capture(), any(RowMapper.class));
        MapSqlParameterSource bound = (MapSqlParameterSource) params.getValue();
        assertThat(bound.getValue("key0")).isEqualTo(2L);
        assertThat(bound.hasValue("key1")).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchPage_bindsCursorAndMapsRows() {
        Map<String, Object> row = new HashMap<>();
        row.put("id", 42L);
        row.put("firstName", "Ada");
        row.put("updatedAt", Timestamp.from(T1000));
        when(jdbc.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(List.of(row));

        List<SourceRecord> page = store.fetchPage(prospect, new ExtractionCursor(T1000.minusSeconds(60), List.of(7L)), 500);

        assertThat(page).singleElement().satisfies(record -> {
            assertThat(record.getPrimaryKey()).containsExactly(42L);
            assertThat(record.getDocumentId()).isEqualTo("42");
            assertThat(record.getTrackingValue()).isEqualTo(T1000);
            assertThat(record.get("firstName")).isEqualTo("Ada");
        });

        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbc).query(anyString(), params.capture(), any(RowMapper.class));
        MapSqlParameterSource bound = (MapSqlParameterSource) params.getValue();
        assertThat(bound.getValue("trackingValue")).isEqualTo(Timestamp.from(T1000.minusSeconds(60)));
        assertThat(bound.getValue("key0")).isEqualTo(7L);
        assertThat(bound.getValue("limit")).isEqualTo(500);
    }

    @Test
    @SuppressWarnings("unchecked")
    void nullPrimaryKey_isConfigurationError() {
        Map<String, Object> row = new HashMap<>();
        row.put("id", null);
        row.put("updatedAt", Timestamp.from(T1000));
        when(jdbc.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(List.of(row));

        assertThatThrownBy(() -> store.fetchPage(prospect, ExtractionCursor.after(Instant.EPOCH), 10))
                .isInstanceOf(SyncConfigurationException.class)
                .hasMessageContaining("Null primary key 'id'");
    }

    @Test
    void toInstant_acceptsDriverTimestampTypes() {
        assertThat(JdbcRelationalStore.toInstant(prospect, Timestamp.from(T1000))).isEqualTo(T1000);
        assertThat(JdbcRelationalStore.toInstant(prospect, OffsetDateTime.ofInstant(T1000, ZoneOffset.ofHours(2))))
                .isEqualTo(T1000);
        assertThat(JdbcRelationalStore.toInstant(prospect, T1000)).isEqualTo(T1000);
    }

    @Test
    void toInstant_rejectsNonTimestampTrackingColumn() {
        assertThatThrownBy(() -> JdbcRelationalStore.toInstant(prospect, "2024-05-01"))
                .isInstanceOf(SyncConfigurationException.class)
                .hasMessageContaining("is not a timestamp");
        assertThatThrownBy(() -> JdbcRelationalStore.toInstant(prospect, null))
                .isInstanceOf(SyncConfigurationException.class);
    }

    @Test
    void maxValue_ofEmptyRelationIsEmpty() {
        when(plainJdbc.queryForObject("SELECT MAX(\"last_updated\") FROM \"company_prospect_view\"", Timestamp.class))
                .thenReturn(null);

        assertThat(store.maxValue("company_prospect_view", "last_updated")).isEmpty();
    }

    @Test
    void maxValue_quotesIdentifiers() {
        when(plainJdbc.queryForObject(eq("SELECT MAX(\"updatedAt\") FROM \"Company\""), eq(Timestamp.class)))
                .thenReturn(Timestamp.from(T1000));

        assertThat(store.maxValue("Company", "updatedAt")).contains(T1000);
    }

    @Test
    void refreshMaterializedView_canRefreshConcurrently() {
        store.refreshMaterializedView("company_prospect_view", true);
        store.refreshMaterializedView("company_prospect_view", false);

        verify(plainJdbc).execute("REFRESH MATERIALIZED VIEW CONCURRENTLY \"company_prospect_view\"");
        verify(plainJdbc).execute("REFRESH MATERIALIZED VIEW \"company_prospect_view\"");
    }
}
