package com.mtsa.findings.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Row/column matrix attached to a section (e.g. a correlation matrix). Rendered once to the
 * target format instead of being patched as text.
 */
public record TabularContent(List<String> headers, List<List<String>> rows) {

    @JsonCreator
    public TabularContent(@JsonProperty("headers") List<String> headers,
                          @JsonProperty("rows") List<List<String>> rows) {
        this.headers = headers == null ? List.of() : List.copyOf(headers);
        this.rows = rows == null ? List.of() : rows.stream().map(r -> r == null ? List.<String>of() : List.copyOf(r)).toList();
    }

    public int columnCount() {
        int max = headers.size();
        for (List<String> row : rows) {
            max = Math.max(max, row.size());
        }
        return max;
    }

    public boolean isEmpty() {
        return headers.isEmpty() && rows.isEmpty();
    }
}
