package org.moviegraph.service.schema;

import lombok.RequiredArgsConstructor;
import org.moviegraph.configuration.BuildProperties;
import org.moviegraph.configuration.NestedEntitySpec;
import org.moviegraph.models.enums.ColumnType;
import org.moviegraph.models.enums.Gender;
import org.moviegraph.models.enums.KeyType;
import org.moviegraph.models.enums.PersonRole;
import org.moviegraph.models.enums.ProductionStatus;
import org.moviegraph.models.table.ColumnDescriptor;
import org.moviegraph.models.table.Table;
import org.moviegraph.models.table.TableDescriptor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table shapes of the normalized schema. The movie, people and crew tables are fixed; one
 * entity/link pair is derived from every configured {@link NestedEntitySpec}.
 */
@Component
@RequiredArgsConstructor
public class SchemaCatalog {

    public static final String MOVIES = "movie_infos";
    public static final String RATINGS = "movie_ratings";
    public static final String PROD_STATUS = "prod_status";
    public static final String PEOPLE = "people";
    public static final String ROLES = "roles";
    public static final String GENDERS = "genders";
    public static final String MOVIE_CAST = "movie_cast";
    public static final String DEPARTMENTS = "departments";
    public static final String JOBS = "jobs";
    public static final String MOVIE_CREW = "movie_crew";

    public static final String MOVIE_ID = "movie_id";
    public static final String PEOPLE_ID = "people_id";
    public static final String DEPARTMENT_ID = "department_id";
    public static final String JOB_ID = "job_id";
    public static final String CHARACTER_NAME = "character_name";

    private final BuildProperties properties;

    public Table prodStatus() {
        Table table = new Table(TableDescriptor.lookup(PROD_STATUS, List.of(
                ColumnDescriptor.of("prod_status_id", ColumnType.INTEGER),
                ColumnDescriptor.varchar("prod_status_name", 50)), "prod_status_id"));
        for (ProductionStatus status : ProductionStatus.values()) {
            table.add(Map.of("prod_status_id", status.getId(), "prod_status_name", status.getLabel()));
        }
        return table;
    }

    public Table genders() {
        Table table = new Table(TableDescriptor.lookup(GENDERS, List.of(
                ColumnDescriptor.of("gender_id", ColumnType.INTEGER),
                ColumnDescriptor.varchar("gender_name", 50)), "gender_id"));
        for (Gender gender : Gender.values()) {
            table.add(Map.of("gender_id", gender.getId(), "gender_name", gender.getLabel()));
        }
        return table;
    }

    public Table roles() {
        Table table = new Table(TableDescriptor.lookup(ROLES, List.of(
                ColumnDescriptor.of("role_id", ColumnType.INTEGER),
                ColumnDescriptor.varchar("role_name", 50)), "role_id"));
        for (PersonRole role : PersonRole.values()) {
            table.add(Map.of("role_id", role.getId(), "role_name", role.getLabel()));
        }
        return table;
    }

    public TableDescriptor movies() {
        ColumnDescriptor originalLanguage = ColumnDescriptor.of("original_language_id", ColumnType.CODE);
        if (StringUtils.hasText(properties.getOriginalLanguageTable())) {
            originalLanguage = originalLanguage.references(properties.getOriginalLanguageTable(),
                    idColumn(properties.getOriginalLanguageTable()));
        }
        return TableDescriptor.entity(MOVIES, List.of(
                ColumnDescriptor.of(MOVIE_ID, ColumnType.INTEGER),
                ColumnDescriptor.of("movie_id_old", ColumnType.INTEGER).notNull(),
                ColumnDescriptor.varchar("title", 255),
                ColumnDescriptor.of("release_date", ColumnType.DATE),
                ColumnDescriptor.of("runtime", ColumnType.INTEGER),
                ColumnDescriptor.of("overview", ColumnType.TEXT),
                ColumnDescriptor.varchar("tagline", 512),
                ColumnDescriptor.of("budget", ColumnType.BIGINT),
                ColumnDescriptor.of("revenue", ColumnType.BIGINT),
                ColumnDescriptor.of("homepage", ColumnType.TEXT),
                originalLanguage,
                ColumnDescriptor.varchar("original_title", 255),
                ColumnDescriptor.of("prod_status_id", ColumnType.INTEGER).references(PROD_STATUS, "prod_status_id")),
                MOVIE_ID, "movie_id_old", KeyType.INTEGER);
    }

    public TableDescriptor ratings() {
        return TableDescriptor.link(RATINGS, List.of(
                movieReference(),
                ColumnDescriptor.of("popularity", ColumnType.DOUBLE),
                ColumnDescriptor.of("vote_average", ColumnType.DOUBLE),
                ColumnDescriptor.of("vote_count", ColumnType.INTEGER)), List.of(MOVIE_ID));
    }

    public TableDescriptor people() {
        return TableDescriptor.entity(PEOPLE, List.of(
                ColumnDescriptor.of(PEOPLE_ID, ColumnType.INTEGER),
                ColumnDescriptor.of("people_id_old", ColumnType.INTEGER).notNull(),
                ColumnDescriptor.varchar("people_name", 255),
                ColumnDescriptor.of("gender_id", ColumnType.INTEGER).notNull().references(GENDERS, "gender_id"),
                ColumnDescriptor.of("role_id", ColumnType.INTEGER).notNull().references(ROLES, "role_id")),
                PEOPLE_ID, "people_id_old", KeyType.INTEGER);
    }

    public TableDescriptor departments() {
        return TableDescriptor.entity(DEPARTMENTS, List.of(
                ColumnDescriptor.of(DEPARTMENT_ID, ColumnType.INTEGER),
                ColumnDescriptor.varchar("department_name", 255).notNull()),
                DEPARTMENT_ID, "department_name", KeyType.NAME);
    }

    public TableDescriptor jobs() {
        return TableDescriptor.entity(JOBS, List.of(
                ColumnDescriptor.of(JOB_ID, ColumnType.INTEGER),
                ColumnDescriptor.varchar("job_name", 255).notNull()),
                JOB_ID, "job_name", KeyType.NAME);
    }

    public TableDescriptor movieCast() {
        return TableDescriptor.link(MOVIE_CAST, List.of(
                movieReference(),
                peopleReference(),
                ColumnDescriptor.varchar(CHARACTER_NAME, 512)),
                List.of(MOVIE_ID, PEOPLE_ID, CHARACTER_NAME));
    }

    public TableDescriptor movieCrew() {
        return TableDescriptor.link(MOVIE_CREW, List.of(
                movieReference(),
                peopleReference(),
                ColumnDescriptor.of(DEPARTMENT_ID, ColumnType.INTEGER).references(DEPARTMENTS, DEPARTMENT_ID),
                ColumnDescriptor.of(JOB_ID, ColumnType.INTEGER).references(JOBS, JOB_ID)),
                List.of(MOVIE_ID, PEOPLE_ID, DEPARTMENT_ID, JOB_ID));
    }

    /**
     * Entity table of a nested field. {@code extraColumns} are catalog attributes stored next to
     * the name, prefixed like every other column: {@code name_en} becomes {@code language_name_en}.
     */
    public TableDescriptor nestedEntity(NestedEntitySpec spec, List<String> extraColumns) {
        String idColumn = idColumnOf(spec);
        String nameColumn = nameColumnOf(spec);
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(ColumnDescriptor.of(idColumn, keyColumnType(spec.getKeyType())));
        String naturalIdColumn;
        switch (spec.getKeyType()) {
            case INTEGER:
                naturalIdColumn = idColumn + "_old";
                columns.add(ColumnDescriptor.of(naturalIdColumn, ColumnType.INTEGER).notNull());
                break;
            case NAME:
                naturalIdColumn = nameColumn;
                break;
            case CODE:
            default:
                naturalIdColumn = idColumn;
                break;
        }
        int nameLength = spec.getNameLength() == null ? 255 : spec.getNameLength();
        ColumnDescriptor name = ColumnDescriptor.varchar(nameColumn, nameLength);
        columns.add(spec.getKeyType() == KeyType.NAME ? name.notNull() : name);
        for (String extra : extraColumns) {
            columns.add(ColumnDescriptor.varchar(extraColumnName(spec, extra), nameLength));
        }
        return TableDescriptor.entity(spec.getEntityTable(), columns, idColumn, naturalIdColumn, spec.getKeyType());
    }

    public TableDescriptor nestedLink(NestedEntitySpec spec) {
        String idColumn = idColumnOf(spec);
        return TableDescriptor.link(spec.getLinkTable(), List.of(
                movieReference(),
                ColumnDescriptor.of(idColumn, keyColumnType(spec.getKeyType())).references(spec.getEntityTable(), idColumn)),
                List.of(MOVIE_ID, idColumn));
    }

    public String idColumnOf(NestedEntitySpec spec) {
        return spec.getColumnPrefix() + "_id";
    }

    public String nameColumnOf(NestedEntitySpec spec) {
        return spec.getColumnPrefix() + "_name";
    }

    /**
     * Output column for each catalog attribute of a nested entity.
     */
    public Map<String, String> extraColumnNames(NestedEntitySpec spec, List<String> extraColumns) {
        Map<String, String> names = new LinkedHashMap<>();
        for (String extra : extraColumns) {
            names.put(extra, extraColumnName(spec, extra));
        }
        return names;
    }

    private String extraColumnName(NestedEntitySpec spec, String extra) {
        return spec.getColumnPrefix() + "_" + extra;
    }

    private String idColumn(String entityTable) {
        return properties.getNestedEntities().stream()
                .filter(spec -> entityTable.equals(spec.getEntityTable()))
                .findFirst()
                .map(this::idColumnOf)
                .orElseThrow(() -> new IllegalStateException("No nested entity is configured for table " + entityTable));
    }

    private ColumnType keyColumnType(KeyType keyType) {
        return keyType == KeyType.CODE ? ColumnType.CODE : ColumnType.INTEGER;
    }

    private ColumnDescriptor movieReference() {
        return ColumnDescriptor.of(MOVIE_ID, ColumnType.INTEGER).references(MOVIES, MOVIE_ID);
    }

    private ColumnDescriptor peopleReference() {
        return ColumnDescriptor.of(PEOPLE_ID, ColumnType.INTEGER).references(PEOPLE, PEOPLE_ID);
    }
}
