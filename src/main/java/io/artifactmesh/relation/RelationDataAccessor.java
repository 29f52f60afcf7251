package io.artifactmesh.relation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Small key/value channel shared by the nodes of one coordination group. Each unit owns its own
 * unit data; application data is written by the leader only. All values are strings.
 */
public interface RelationDataAccessor {
    String localUnit();

    void setUnitData(String key, String value);

    Optional<String> getUnitData(String unit, String key);

    List<String> allUnits();

    void setApplicationData(Map<String, String> values);

    Optional<String> getApplicationData(String key);

    Map<String, String> applicationData();

    default void setApplicationData(String key, String value) {
        setApplicationData(Map.of(key, value));
    }
}
