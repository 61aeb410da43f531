package org.dependencytrack.debiantracker.source.debian;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dependencytrack.debiantracker.api.VulnerabilityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.util.Objects.requireNonNull;

/**
 * A conversion pass over an already parsed tracker document.
 * <p>
 * Records are converted lazily, one package+CVE pair at a time, in document order.
 * Every call to {@link #iterator()} starts a new pass over the same document. A consumer
 * may stop pulling records at any time, no resources are held between records.
 */
public final class TrackerConversion implements Iterable<VulnerabilityRecord> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrackerConversion.class);

    private final TrackerDocumentLoader loader;
    private final ObjectNode document;
    private final SkippedEntryListener skippedListener;

    TrackerConversion(
            final TrackerDocumentLoader loader,
            final ObjectNode document,
            final SkippedEntryListener skippedListener) {
        this.loader = loader;
        this.document = document;
        this.skippedListener = skippedListener;
    }

    public List<String> packageNames() {
        final var packageNames = new ArrayList<String>(document.size());
        document.fieldNames().forEachRemaining(packageNames::add);
        return packageNames;
    }

    @Override
    public Iterator<VulnerabilityRecord> iterator() {
        return new RecordIterator(skippedListener);
    }

    public Stream<VulnerabilityRecord> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<VulnerabilityRecord> convertPackage(final String packageName) {
        requireNonNull(packageName, "packageName must not be null");

        final JsonNode packageNode = document.get(packageName);
        if (packageNode == null) {
            throw new NoSuchElementException("No package named " + packageName);
        }

        final var records = new ArrayList<VulnerabilityRecord>();
        final Iterator<Map.Entry<String, JsonNode>> cveIterator = cveIterator(packageName, packageNode, skippedListener);
        while (cveIterator.hasNext()) {
            final Map.Entry<String, JsonNode> cveEntry = cveIterator.next();
            final VulnerabilityRecord record = tryConvert(packageName, cveEntry, skippedListener);
            if (record != null) {
                records.add(record);
            }
        }

        return records;
    }

    public ConversionResult convertAll() {
        final var skippedEntries = new ArrayList<SkippedEntry>();
        final var recordIterator = new RecordIterator(entry -> {
            skippedEntries.add(entry);
            skippedListener.onSkipped(entry);
        });

        final var records = new ArrayList<VulnerabilityRecord>();
        recordIterator.forEachRemaining(records::add);
        records.sort(VulnerabilityRecord.CANONICAL_ORDER);

        LOGGER.info("Converted {} records; Skipped {} entries", records.size(), skippedEntries.size());
        return new ConversionResult(records, skippedEntries);
    }

    private VulnerabilityRecord tryConvert(
            final String packageName,
            final Map.Entry<String, JsonNode> cveEntry,
            final SkippedEntryListener listener) {
        try {
            return loader.convert(packageName, cveEntry.getKey(), cveEntry.getValue());
        } catch (StructuralException e) {
            LOGGER.warn("Skipping malformed entry: {}", e.getMessage());
            listener.onSkipped(SkippedEntry.of(e));
            return null;
        }
    }

    private static Iterator<Map.Entry<String, JsonNode>> cveIterator(
            final String packageName,
            final JsonNode packageNode,
            final SkippedEntryListener listener) {
        if (!packageNode.isObject()) {
            final var exception = new StructuralException(packageName, null, "Package entry is not an object");
            LOGGER.warn("Skipping malformed entry: {}", exception.getMessage());
            listener.onSkipped(SkippedEntry.of(exception));
            return Collections.emptyIterator();
        }

        return packageNode.fields();
    }

    private final class RecordIterator implements Iterator<VulnerabilityRecord> {

        private final SkippedEntryListener listener;
        private final Iterator<Map.Entry<String, JsonNode>> packageIterator;
        private String currentPackageName;
        private Iterator<Map.Entry<String, JsonNode>> cveIterator = Collections.emptyIterator();
        private VulnerabilityRecord nextRecord;

        private RecordIterator(final SkippedEntryListener listener) {
            this.listener = listener;
            this.packageIterator = document.fields();
        }

        @Override
        public boolean hasNext() {
            while (nextRecord == null) {
                if (cveIterator.hasNext()) {
                    nextRecord = tryConvert(currentPackageName, cveIterator.next(), listener);
                } else if (packageIterator.hasNext()) {
                    final Map.Entry<String, JsonNode> packageEntry = packageIterator.next();
                    currentPackageName = packageEntry.getKey();
                    cveIterator = cveIterator(currentPackageName, packageEntry.getValue(), listener);
                } else {
                    return false;
                }
            }

            return true;
        }

        @Override
        public VulnerabilityRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }

            final VulnerabilityRecord record = nextRecord;
            nextRecord = null;
            return record;
        }

    }

}
