package com.acme.labinsight.model;

import com.acme.labinsight.model.Enums.PanelType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied panel. Values are strings or numbers keyed by the extraction
 * step's parameter keys; insertion order is kept for the generic pass-through.
 * Null values are allowed, null keys are not.
 */
public record RawPanel(String panelType, Map<String, Object> values) {

    public RawPanel {
        if (values == null) {
            values = Map.of();
        } else {
            Map<String, Object> copy = new LinkedHashMap<>(values);
            if (copy.containsKey(null)) {
                throw new IllegalArgumentException("Lab value with a null key in panel '" + panelType + "'");
            }
            values = Collections.unmodifiableMap(copy);
        }
    }

    public PanelType type() { return PanelType.fromTag(panelType); }
}
