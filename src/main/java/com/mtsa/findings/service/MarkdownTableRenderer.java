package com.mtsa.findings.service;

import com.mtsa.findings.model.TabularContent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@link TabularContent} as a GitHub-flavored Markdown table. Short rows are padded with
 * empty cells and pipes inside cells are escaped.
 */
@Component
public class MarkdownTableRenderer {

    public String render(TabularContent table) {
        if (table == null || table.isEmpty()) {
            return "";
        }
        int columns = table.columnCount();
        List<String> headers = new ArrayList<>(table.headers());
        while (headers.size() < columns) {
            headers.add("");
        }
        StringBuilder out = new StringBuilder();
        appendRow(out, headers, columns);
        out.append('|');
        for (int i = 0; i < columns; i++) {
            out.append(" --- |");
        }
        out.append('\n');
        for (List<String> row : table.rows()) {
            appendRow(out, row, columns);
        }
        return out.toString();
    }

    private void appendRow(StringBuilder out, List<String> cells, int columns) {
        out.append('|');
        for (int i = 0; i < columns; i++) {
            String cell = i < cells.size() ? cells.get(i) : "";
            out.append(' ').append(escape(cell)).append(" |");
        }
        out.append('\n');
    }

    private String escape(String cell) {
        if (cell == null) {
            return "";
        }
        return cell.replace("\r", " ").replace("\n", " ").replace("|", "\\|").trim();
    }
}
