package com.goormthonuniv.sitecheck.fetch;

import java.util.List;

public record PageForm(
        String action,
        String method,
        List<Field> fields
) {
    public PageForm {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public record Field(String type, String name, String placeholder) {}

    public boolean hasFieldType(String type) {
        return fields.stream().anyMatch(f -> type.equalsIgnoreCase(f.type()));
    }
}
