package org.dependencytrack.debiantracker.store;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.dependencytrack.debiantracker.api.VulnerabilityRecord;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

public final class SnapshotWriter {

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public void write(final Collection<VulnerabilityRecord> records, final OutputStream outputStream) throws IOException {
        final Writer writer = new OutputStreamWriter(outputStream, StandardCharsets.UTF_8);
        for (final VulnerabilityRecord record : records) {
            writer.write(objectMapper.writeValueAsString(record));
            writer.write('\n');
        }
        writer.flush();
    }

    public void write(final Collection<VulnerabilityRecord> records, final Path filePath) throws IOException {
        try (final OutputStream outputStream = Files.newOutputStream(filePath)) {
            write(records, outputStream);
        }
    }

}
