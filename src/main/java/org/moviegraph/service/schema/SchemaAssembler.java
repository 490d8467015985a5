package org.moviegraph.service.schema;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.moviegraph.configuration.BuildProperties;
import org.moviegraph.configuration.NestedEntitySpec;
import org.moviegraph.models.dto.EntityCandidate;
import org.moviegraph.models.dto.RawRow;
import org.moviegraph.models.dto.ReferenceData;
import org.moviegraph.models.dto.UnpackedRecord;
import org.moviegraph.models.table.NormalizedSchema;
import org.moviegraph.models.table.Table;
import org.moviegraph.models.table.TableDescriptor;
import org.moviegraph.service.transform.DuplicateEntityMerger;
import org.moviegraph.service.transform.EntityResolver;
import org.moviegraph.service.transform.IntegrityEnforcer;
import org.moviegraph.service.transform.LinkMaterializer;
import org.moviegraph.service.transform.NestedFieldUnpacker;
import org.moviegraph.service.transform.PersonRoleClassifier;
import org.moviegraph.service.transform.RawValueCleaner;
import org.moviegraph.service.transform.ResolvedEntities;
import org.moviegraph.service.transform.SurrogateKeyMap;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns the raw movie and credits relations into the normalized schema, entirely in memory.
 * <p>
 * Stages run in a fixed order: lookups, nested entities, movies, people, departments and jobs,
 * then every link table once all entity tables are resolved, then the equivalence merges and a
 * final integrity check.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaAssembler {

    static final String CAST = "cast";
    static final String CREW = "crew";

    private final SchemaCatalog catalog;
    private final BuildProperties properties;
    private final NestedFieldUnpacker unpacker;
    private final RawValueCleaner cleaner;
    private final EntityResolver entityResolver;
    private final PersonRoleClassifier roleClassifier;
    private final LinkMaterializer linkMaterializer;
    private final DuplicateEntityMerger merger;
    private final IntegrityEnforcer integrityEnforcer;

    public NormalizedSchema assemble(List<RawRow> infos, List<RawRow> credits, ReferenceData referenceData) {
        log.info("[assemble] start: {} movie rows, {} credits rows", infos.size(), credits.size());
        NormalizedSchema schema = new NormalizedSchema();
        schema.add(catalog.prodStatus());
        schema.add(catalog.genders());
        schema.add(catalog.roles());

        // nested entities
        List<NestedStage> nestedStages = new ArrayList<>();
        for (NestedEntitySpec spec : properties.getNestedEntities()) {
            nestedStages.add(resolveNested(schema, spec, infos, referenceData));
        }

        // movies
        TableDescriptor moviesDescriptor = catalog.movies();
        Set<Object> knownLanguages = originalLanguages(schema);
        ResolvedEntities movies = entityResolver.resolve(SchemaCatalog.MOVIES, moviesDescriptor.keyType(),
                infos.stream().map(row -> movieCandidate(row, knownLanguages)));
        schema.add(movies.toTable(moviesDescriptor, "title"));

        // people, departments, jobs
        List<UnpackedRecord> cast = unpackAll(credits, CAST);
        List<UnpackedRecord> crew = unpackAll(credits, CREW);
        ResolvedEntities people = roleClassifier.classify(SchemaCatalog.PEOPLE,
                cast.stream().map(this::personCandidate),
                crew.stream().map(this::personCandidate));
        schema.add(people.toTable(catalog.people(), "people_name"));

        TableDescriptor departmentsDescriptor = catalog.departments();
        ResolvedEntities departments = entityResolver.resolve(SchemaCatalog.DEPARTMENTS, departmentsDescriptor.keyType(),
                crew.stream().map(member -> nameCandidate(member, "department")));
        schema.add(departments.toTable(departmentsDescriptor, "department_name"));

        TableDescriptor jobsDescriptor = catalog.jobs();
        ResolvedEntities jobs = entityResolver.resolve(SchemaCatalog.JOBS, jobsDescriptor.keyType(),
                crew.stream().map(member -> nameCandidate(member, "job")));
        schema.add(jobs.toTable(jobsDescriptor, "job_name"));

        // links
        schema.add(linkMaterializer.materialize(catalog.ratings(),
                infos.stream().map(this::ratingRow),
                Map.of(SchemaCatalog.MOVIE_ID, movies)));

        for (NestedStage stage : nestedStages) {
            String idColumn = catalog.idColumnOf(stage.spec());
            schema.add(linkMaterializer.materialize(catalog.nestedLink(stage.spec()),
                    stage.records().stream().map(record -> nestedLinkRow(stage.spec(), idColumn, record)),
                    Map.of(SchemaCatalog.MOVIE_ID, movies, idColumn, stage.entities())));
        }

        schema.add(linkMaterializer.materialize(catalog.movieCast(),
                cast.stream().map(this::castRow),
                Map.of(SchemaCatalog.MOVIE_ID, movies, SchemaCatalog.PEOPLE_ID, people)));

        Map<String, SurrogateKeyMap> crewKeys = new LinkedHashMap<>();
        crewKeys.put(SchemaCatalog.MOVIE_ID, movies);
        crewKeys.put(SchemaCatalog.PEOPLE_ID, people);
        crewKeys.put(SchemaCatalog.DEPARTMENT_ID, departments);
        crewKeys.put(SchemaCatalog.JOB_ID, jobs);
        schema.add(linkMaterializer.materialize(catalog.movieCrew(), crew.stream().map(this::crewRow), crewKeys));

        // merges
        for (String entityTable : referenceData.equivalences().keySet()) {
            if (!schema.contains(entityTable)) {
                throw new IllegalStateException("Equivalence map given for unknown table " + entityTable);
            }
            merger.merge(schema, entityTable, referenceData.equivalences(entityTable));
        }

        integrityEnforcer.verify(schema);
        log.info("[assemble] done: {} tables, {} rows", schema.tables().size(), schema.totalRows());
        return schema;
    }

    private NestedStage resolveNested(NormalizedSchema schema, NestedEntitySpec spec, List<RawRow> infos,
                                      ReferenceData referenceData) {
        List<UnpackedRecord> records = unpackAll(infos, spec.getSourceField());
        List<ReferenceData.CatalogEntry> entries = referenceData.catalog(spec.getEntityTable());

        List<String> extras = new ArrayList<>();
        Stream<EntityCandidate> candidates;
        if (entries.isEmpty()) {
            candidates = records.stream().map(record -> new EntityCandidate(naturalIdOf(spec, record),
                    cleaner.text(record.text("name")), Map.of()));
        } else {
            for (ReferenceData.CatalogEntry entry : entries) {
                for (String attribute : entry.attributes().keySet()) {
                    if (!extras.contains(attribute)) {
                        extras.add(attribute);
                    }
                }
            }
            Map<String, String> columns = catalog.extraColumnNames(spec, extras);
            candidates = entries.stream().map(entry -> {
                Map<String, Object> attributes = new LinkedHashMap<>();
                entry.attributes().forEach((attribute, value) -> attributes.put(columns.get(attribute), value));
                return new EntityCandidate(entry.id(), entry.name(), attributes);
            });
            log.info("[assemble] {}: names taken from catalog of {} entries", spec.getEntityTable(), entries.size());
        }

        ResolvedEntities entities = entityResolver.resolve(spec.getEntityTable(), spec.getKeyType(), candidates);
        schema.add(entities.toTable(catalog.nestedEntity(spec, extras), catalog.nameColumnOf(spec)));
        return new NestedStage(spec, records, entities);
    }

    private Object naturalIdOf(NestedEntitySpec spec, UnpackedRecord record) {
        Object value = record.value(spec.getKeyPath());
        if (spec.isLanguageCodes() && value != null) {
            return cleaner.languageCode(value.toString());
        }
        return value;
    }

    private Set<Object> originalLanguages(NormalizedSchema schema) {
        String languageTable = properties.getOriginalLanguageTable();
        if (!StringUtils.hasText(languageTable)) {
            return null;
        }
        Table languages = schema.table(languageTable);
        return new HashSet<>(languages.columnValues(languages.descriptor().idColumn()));
    }

    private EntityCandidate movieCandidate(RawRow row, Set<Object> knownLanguages) {
        Map<String, Object> attributes = cleaner.movieInfo(row);
        Object title = attributes.remove("title");
        Object language = attributes.get("original_language_id");
        if (knownLanguages != null && language != null && !knownLanguages.contains(language)) {
            log.warn("Movie {} has original language '{}' missing from the language table, storing null",
                    row.naturalId(), language);
            attributes.put("original_language_id", null);
        }
        return new EntityCandidate(row.naturalId(), title == null ? null : title.toString(), attributes);
    }

    private List<UnpackedRecord> unpackAll(List<RawRow> rows, String field) {
        List<UnpackedRecord> records = new ArrayList<>();
        for (RawRow row : rows) {
            unpacker.unpack(row, field).forEach(records::add);
        }
        log.info("[unpack] {}: {} rows -> {} records", field, rows.size(), records.size());
        return records;
    }

    private EntityCandidate personCandidate(UnpackedRecord record) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(PersonRoleClassifier.GENDER, record.value("gender"));
        return new EntityCandidate(record.value("id"), record.text("name"), attributes);
    }

    private EntityCandidate nameCandidate(UnpackedRecord record, String field) {
        String name = record.text(field);
        return EntityCandidate.of(name, name);
    }

    private Map<String, Object> ratingRow(RawRow row) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(SchemaCatalog.MOVIE_ID, row.naturalId());
        values.putAll(cleaner.movieRating(row));
        return values;
    }

    private Map<String, Object> nestedLinkRow(NestedEntitySpec spec, String idColumn, UnpackedRecord record) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(SchemaCatalog.MOVIE_ID, record.parentId());
        values.put(idColumn, naturalIdOf(spec, record));
        return values;
    }

    private Map<String, Object> castRow(UnpackedRecord record) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(SchemaCatalog.MOVIE_ID, record.parentId());
        values.put(SchemaCatalog.PEOPLE_ID, record.value("id"));
        values.put(SchemaCatalog.CHARACTER_NAME, cleaner.characterName(record.text("character")));
        return values;
    }

    private Map<String, Object> crewRow(UnpackedRecord record) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(SchemaCatalog.MOVIE_ID, record.parentId());
        values.put(SchemaCatalog.PEOPLE_ID, record.value("id"));
        values.put(SchemaCatalog.DEPARTMENT_ID, record.text("department"));
        values.put(SchemaCatalog.JOB_ID, record.text("job"));
        return values;
    }

    private record NestedStage(NestedEntitySpec spec, List<UnpackedRecord> records, ResolvedEntities entities) {
    }
}
