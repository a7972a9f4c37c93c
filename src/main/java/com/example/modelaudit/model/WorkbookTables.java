package com.example.modelaudit.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class WorkbookTables {
    private final Map<String, CellTable> valueTables;
    private final Map<String, CellTable> formulaTables;

    public WorkbookTables(Map<String, CellTable> valueTables, Map<String, CellTable> formulaTables) {
        if (valueTables == null || formulaTables == null) {
            throw new IllegalArgumentException("Both value and formula tables are required");
        }
        if (!valueTables.keySet().equals(formulaTables.keySet())) {
            throw new IllegalArgumentException("Value and formula tables cover different sheets: "
                    + valueTables.keySet() + " vs " + formulaTables.keySet());
        }
        for (Map.Entry<String, CellTable> entry : valueTables.entrySet()) {
            CellTable formulas = formulaTables.get(entry.getKey());
            if (entry.getValue() == null || !entry.getValue().hasSameShape(formulas)) {
                throw new IllegalArgumentException("Value and formula tables differ in shape for sheet '"
                        + entry.getKey() + "'");
            }
        }
        this.valueTables = Collections.unmodifiableMap(new LinkedHashMap<>(valueTables));
        this.formulaTables = Collections.unmodifiableMap(new LinkedHashMap<>(formulaTables));
    }

    public Map<String, CellTable> getValueTables() {
        return valueTables;
    }

    public Map<String, CellTable> getFormulaTables() {
        return formulaTables;
    }

    public List<String> getSheetNames() {
        return List.copyOf(valueTables.keySet());
    }

    public int getSheetCount() {
        return valueTables.size();
    }
}
