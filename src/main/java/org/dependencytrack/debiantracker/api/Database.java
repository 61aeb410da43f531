package org.dependencytrack.debiantracker.api;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

public interface Database {

    Map<String, String> getSourceMetadata();

    void putSourceMetadata(final String key, final String value);

    void storeVulnerabilities(Collection<VulnerabilityRecord> vulns);

    int deleteVulnerabilitiesExcept(
            Map<String, Set<String>> retainedVulnIdsByPackage,
            Set<String> untouchedPackages);

}
