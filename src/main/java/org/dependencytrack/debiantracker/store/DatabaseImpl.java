package org.dependencytrack.debiantracker.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dependencytrack.debiantracker.api.AffectedRange;
import org.dependencytrack.debiantracker.api.Database;
import org.dependencytrack.debiantracker.api.Source;
import org.dependencytrack.debiantracker.api.VulnerabilityRecord;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.reflect.ConstructorMapper;
import org.jdbi.v3.core.statement.Query;
import org.jdbi.v3.core.statement.Update;
import org.jdbi.v3.sqlite3.SQLitePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

public final class DatabaseImpl implements Database, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseImpl.class);

    private static final PropertyDiffer<VulnerabilityDataRecord> DATA_DIFFER = new PropertyDiffer<VulnerabilityDataRecord>()
            .withProperty("description", VulnerabilityDataRecord::description)
            .withProperty("scope", VulnerabilityDataRecord::scope)
            .withProperty("debianBug", VulnerabilityDataRecord::debianBug);

    private static final PropertyDiffer<AffectedRangeRecord> RANGE_DIFFER = new PropertyDiffer<AffectedRangeRecord>()
            .withProperty("ecosystem", AffectedRangeRecord::ecosystem)
            .withProperty("status", AffectedRangeRecord::status)
            .withProperty("lowerBound", AffectedRangeRecord::lowerBound)
            .withProperty("upperBound", AffectedRangeRecord::upperBound)
            .withProperty("fixedVersion", AffectedRangeRecord::fixedVersion)
            .withProperty("isEmpty", AffectedRangeRecord::isEmpty)
            .withProperty("lowConfidence", AffectedRangeRecord::lowConfidence)
            .withProperty("reason", AffectedRangeRecord::reason)
            .withProperty("urgency", AffectedRangeRecord::urgency)
            .withProperty("affectedRepositories", AffectedRangeRecord::affectedRepositories)
            .withProperty("purl", AffectedRangeRecord::purl)
            .withProperty("versions", AffectedRangeRecord::versions);

    private final Jdbi jdbi;
    private final Source source;
    private final ObjectMapper objectMapper;

    private DatabaseImpl(final Jdbi jdbi, final Source source) {
        this.jdbi = jdbi;
        this.source = source;
        this.objectMapper = new ObjectMapper();
    }

    public static DatabaseImpl forSource(final Path workspacePath, final Source source) {
        return open(workspacePath.resolve("%s.sqlite".formatted(source.name())), source);
    }

    public static DatabaseImpl open(final Path databaseFilePath, final Source source) {
        final var jdbi = Jdbi
                .create("jdbc:sqlite:" + databaseFilePath)
                .installPlugin(new SQLitePlugin());

        final var database = new DatabaseImpl(jdbi, source);
        database.createSchema();
        database.ensureSourceExists(source);

        return database;
    }

    @Override
    public void close() {
    }

    private void createSchema() {
        final byte[] schemaBytes;
        try (final InputStream inputStream = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (inputStream == null) {
                throw new IllegalStateException("Schema file not found");
            }

            schemaBytes = inputStream.readAllBytes();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema file", e);
        }

        jdbi.useHandle(handle -> {
            for (final String sqlStatement : new String(schemaBytes, StandardCharsets.UTF_8).split(";")) {
                if (!sqlStatement.isBlank()) {
                    handle.execute(sqlStatement);
                }
            }
        });
    }

    private void ensureSourceExists(final Source source) {
        jdbi.useTransaction(handle -> {
            final Update update = handle.createUpdate("""
                    insert into source(name, display_name, url)
                    values (:name, :displayName, :url)
                    on conflict (name) do update
                    set display_name = excluded.display_name
                      , url = excluded.url
                    """);

            update.bindMethods(source).execute();
        });
    }

    @Override
    public Map<String, String> getSourceMetadata() {
        return jdbi.withHandle(handle -> {
            final Query query = handle.createQuery("""
                    select key
                         , value
                      from source_metadata
                     where source_name = :name
                    """);

            return query
                    .bindMethods(source)
                    .map((rs, ctx) -> Map.entry(rs.getString("key"), rs.getString("value")))
                    .stream()
                    .collect(Collectors.toMap(
                            Map.Entry::getKey,
                            Map.Entry::getValue,
                            (a, b) -> b,
                            TreeMap::new));
        });
    }

    @Override
    public void putSourceMetadata(final String key, final String value) {
        jdbi.useHandle(handle -> {
            final Update update = handle.createUpdate("""
                    insert into source_metadata(
                      source_name
                    , key
                    , value
                    ) values(
                      :source.name
                    , :key
                    , :value
                    )
                    on conflict (source_name, key) do update
                    set value = :value
                      , updated_at = unixepoch()
                    where excluded.value != source_metadata.value
                    """);

            update
                    .bindMethods("source", source)
                    .bind("key", key)
                    .bind("value", value)
                    .execute();
        });
    }

    @Override
    public void storeVulnerabilities(final Collection<VulnerabilityRecord> vulns) {
        if (vulns.isEmpty()) {
            return;
        }

        final var vulnIds = new HashSet<String>();
        final var dataRecordByIdentity = new HashMap<DataIdentity, VulnerabilityDataRecord>(vulns.size());
        final var rangeRecordByIdentity = new HashMap<RangeIdentity, AffectedRangeRecord>();

        for (final VulnerabilityRecord vuln : vulns) {
            vulnIds.add(vuln.cveId());
            dataRecordByIdentity.put(
                    new DataIdentity(vuln.cveId(), vuln.packageName()),
                    VulnerabilityDataRecord.of(source, vuln));

            for (final AffectedRange range : vuln.ranges()) {
                rangeRecordByIdentity.put(
                        new RangeIdentity(vuln.cveId(), vuln.packageName(), range.release()),
                        AffectedRangeRecord.of(source, vuln, range, serializeRepositories(range)));
            }
        }

        jdbi.useTransaction(handle -> {
            final Map<DataIdentity, VulnerabilityDataRecord> existingDataRecordByIdentity =
                    getDataRecords(handle, vulnIds);
            final Map<RangeIdentity, AffectedRangeRecord> existingRangeRecordByIdentity =
                    getRangeRecords(handle, vulnIds);

            for (final Map.Entry<DataIdentity, VulnerabilityDataRecord> entry : dataRecordByIdentity.entrySet()) {
                final DataIdentity identity = entry.getKey();
                final VulnerabilityDataRecord dataRecord = entry.getValue();
                maybeCreateVulnerability(handle, identity.vulnId());

                final VulnerabilityDataRecord existingDataRecord = existingDataRecordByIdentity.get(identity);
                if (existingDataRecord == null) {
                    if (LOGGER.isDebugEnabled()) {
                        LOGGER.debug("{}: creating data {}", identity, dataRecord);
                    }
                    createDataRecord(handle, dataRecord);
                } else {
                    final Map<String, PropertyDiffer.Diff> diffs = DATA_DIFFER.diff(existingDataRecord, dataRecord);
                    if (!diffs.isEmpty()) {
                        LOGGER.info("{}: data has changed: {}", identity, diffs);
                        updateDataRecord(handle, dataRecord);
                    } else if (LOGGER.isDebugEnabled()) {
                        LOGGER.debug("{}: data has not changed", identity);
                    }
                }
            }

            final var rangeKeys = new HashSet<RangeIdentity>();
            rangeKeys.addAll(rangeRecordByIdentity.keySet());
            for (final RangeIdentity existingIdentity : existingRangeRecordByIdentity.keySet()) {
                // Only ranges of the vulnerabilities reported in this batch are subject to deletion.
                if (dataRecordByIdentity.containsKey(existingIdentity.dataIdentity())) {
                    rangeKeys.add(existingIdentity);
                }
            }

            for (final RangeIdentity rangeIdentity : rangeKeys) {
                final AffectedRangeRecord rangeRecord = rangeRecordByIdentity.get(rangeIdentity);
                final AffectedRangeRecord existingRangeRecord = existingRangeRecordByIdentity.get(rangeIdentity);

                if (rangeRecord == null) {
                    LOGGER.info("{}: deleting range because it is no longer reported", rangeIdentity);
                    deleteRangeRecord(handle, existingRangeRecord.id());
                } else if (existingRangeRecord == null) {
                    if (LOGGER.isDebugEnabled()) {
                        LOGGER.debug("{}: creating range {}", rangeIdentity, rangeRecord);
                    }
                    createRangeRecord(handle, rangeRecord);
                } else {
                    final Map<String, PropertyDiffer.Diff> diffs = RANGE_DIFFER.diff(existingRangeRecord, rangeRecord);
                    if (!diffs.isEmpty()) {
                        LOGGER.info("{}: range has changed: {}", rangeIdentity, diffs);
                        updateRangeRecord(handle, rangeRecord);
                    } else if (LOGGER.isDebugEnabled()) {
                        LOGGER.debug("{}: range has not changed", rangeIdentity);
                    }
                }
            }
        });
    }

    @Override
    public int deleteVulnerabilitiesExcept(
            final Map<String, Set<String>> retainedVulnIdsByPackage,
            final Set<String> untouchedPackages) {
        return jdbi.inTransaction(handle -> {
            final List<DataIdentity> existingIdentities = handle.createQuery("""
                            select vuln_id
                                 , package_name
                              from vuln_data
                             where source_name = :sourceName
                            """)
                    .bind("sourceName", source.name())
                    .map((rs, ctx) -> new DataIdentity(rs.getString("vuln_id"), rs.getString("package_name")))
                    .list();

            int deleted = 0;
            for (final DataIdentity identity : existingIdentities) {
                if (untouchedPackages.contains(identity.packageName())
                    || retainedVulnIdsByPackage.getOrDefault(identity.packageName(), Set.of()).contains(identity.vulnId())) {
                    continue;
                }

                LOGGER.info("{}: deleting vulnerability because it is no longer reported", identity);
                deleteVulnerability(handle, identity);
                deleted++;
            }

            return deleted;
        });
    }

    public List<AffectedRangeRecord> getRangeRecords(final String packageName, final String release) {
        return jdbi.withHandle(handle -> {
            final Query query = handle.createQuery("""
                    select *
                      from affected_range
                     where source_name = :sourceName
                       and package_name = :packageName
                       and release_name = :releaseName
                     order by vuln_id
                    """);

            return query
                    .bind("sourceName", source.name())
                    .bind("packageName", packageName)
                    .bind("releaseName", release)
                    .map(ConstructorMapper.of(AffectedRangeRecord.class))
                    .list();
        });
    }

    public List<VulnerabilityDataRecord> getDataRecords() {
        return jdbi.withHandle(handle -> handle.createQuery("""
                        select *
                          from vuln_data
                         where source_name = :sourceName
                         order by package_name, vuln_id
                        """)
                .bind("sourceName", source.name())
                .map(ConstructorMapper.of(VulnerabilityDataRecord.class))
                .list());
    }

    private String serializeRepositories(final AffectedRange range) {
        if (range.affectedRepositories().isEmpty()) {
            return null;
        }

        try {
            return objectMapper.writeValueAsString(range.affectedRepositories());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize affected repositories of " + range, e);
        }
    }

    private void maybeCreateVulnerability(final Handle handle, final String vulnId) {
        final Update update = handle.createUpdate("""
                insert into vuln(id) values(:vulnId)
                on conflict(id) do nothing
                """);

        update
                .bind("vulnId", vulnId)
                .execute();
    }

    private record DataIdentity(String vulnId, String packageName) {
    }

    private Map<DataIdentity, VulnerabilityDataRecord> getDataRecords(
            final Handle handle,
            final Collection<String> vulnIds) {
        final Query query = handle.createQuery(/* language=SQL */ """
                select *
                  from vuln_data
                 where source_name = :sourceName
                   and vuln_id in (<vulnIds>)
                """);

        return query
                .bind("sourceName", source.name())
                .bindList("vulnIds", vulnIds)
                .map(ConstructorMapper.of(VulnerabilityDataRecord.class))
                .stream()
                .collect(Collectors.toMap(
                        record -> new DataIdentity(record.vulnId(), record.packageName()),
                        Function.identity()));
    }

    private void createDataRecord(final Handle handle, final VulnerabilityDataRecord dataRecord) {
        final Update update = handle.createUpdate("""
                insert into vuln_data(
                  source_name
                , vuln_id
                , package_name
                , description
                , scope
                , debian_bug
                ) values(
                  :sourceName
                , :vulnId
                , :packageName
                , :description
                , :scope
                , :debianBug
                )
                """);

        update
                .bindMethods(dataRecord)
                .execute();
    }

    private void updateDataRecord(final Handle handle, final VulnerabilityDataRecord dataRecord) {
        final Update update = handle.createUpdate("""
                update vuln_data
                   set description = :description
                     , scope = :scope
                     , debian_bug = :debianBug
                     , updated_at = unixepoch()
                 where source_name = :sourceName
                   and vuln_id = :vulnId
                   and package_name = :packageName
                """);

        update
                .bindMethods(dataRecord)
                .execute();
    }

    private record RangeIdentity(String vulnId, String packageName, String releaseName) {

        private DataIdentity dataIdentity() {
            return new DataIdentity(vulnId, packageName);
        }

    }

    private Map<RangeIdentity, AffectedRangeRecord> getRangeRecords(
            final Handle handle,
            final Collection<String> vulnIds) {
        final Query query = handle.createQuery(/* language=SQL */ """
                select *
                  from affected_range
                 where source_name = :sourceName
                   and vuln_id in (<vulnIds>)
                """);

        return query
                .bind("sourceName", source.name())
                .bindList("vulnIds", vulnIds)
                .map(ConstructorMapper.of(AffectedRangeRecord.class))
                .stream()
                .collect(Collectors.toMap(
                        record -> new RangeIdentity(record.vulnId(), record.packageName(), record.releaseName()),
                        Function.identity()));
    }

    private void createRangeRecord(final Handle handle, final AffectedRangeRecord rangeRecord) {
        final Update update = handle.createUpdate("""
                insert into affected_range(
                  source_name
                , vuln_id
                , package_name
                , release_name
                , ecosystem
                , status
                , lower_bound
                , upper_bound
                , fixed_version
                , is_empty
                , low_confidence
                , reason
                , urgency
                , affected_repositories
                , purl
                , versions
                ) values(
                  :sourceName
                , :vulnId
                , :packageName
                , :releaseName
                , :ecosystem
                , :status
                , :lowerBound
                , :upperBound
                , :fixedVersion
                , :isEmpty
                , :lowConfidence
                , :reason
                , :urgency
                , :affectedRepositories
                , :purl
                , :versions
                )
                """);

        update
                .bindMethods(rangeRecord)
                .execute();
    }

    private void updateRangeRecord(final Handle handle, final AffectedRangeRecord rangeRecord) {
        final Update update = handle.createUpdate("""
                update affected_range
                   set ecosystem = :ecosystem
                     , status = :status
                     , lower_bound = :lowerBound
                     , upper_bound = :upperBound
                     , fixed_version = :fixedVersion
                     , is_empty = :isEmpty
                     , low_confidence = :lowConfidence
                     , reason = :reason
                     , urgency = :urgency
                     , affected_repositories = :affectedRepositories
                     , purl = :purl
                     , versions = :versions
                     , updated_at = unixepoch()
                 where source_name = :sourceName
                   and vuln_id = :vulnId
                   and package_name = :packageName
                   and release_name = :releaseName
                """);

        update
                .bindMethods(rangeRecord)
                .execute();
    }

    private void deleteVulnerability(final Handle handle, final DataIdentity identity) {
        for (final String tableName : List.of("affected_range", "vuln_data")) {
            final Update update = handle.createUpdate("""
                    delete
                      from <table>
                     where source_name = :sourceName
                       and vuln_id = :vulnId
                       and package_name = :packageName
                    """);

            update
                    .define("table", tableName)
                    .bind("sourceName", source.name())
                    .bind("vulnId", identity.vulnId())
                    .bind("packageName", identity.packageName())
                    .execute();
        }
    }

    private void deleteRangeRecord(final Handle handle, final long rangeId) {
        if (rangeId <= 0) {
            throw new IllegalArgumentException("Invalid range id: " + rangeId);
        }

        final Update update = handle.createUpdate("""
                delete
                  from affected_range
                 where id = :id
                """);

        update
                .bind("id", rangeId)
                .execute();
    }

}
