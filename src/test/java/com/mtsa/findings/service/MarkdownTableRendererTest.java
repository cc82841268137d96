package com.mtsa.findings.service;

import com.mtsa.findings.model.TabularContent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownTableRendererTest {

    private final MarkdownTableRenderer renderer = new MarkdownTableRenderer();

    @Test
    void rendersHeaderSeparatorAndRows() {
        TabularContent table = new TabularContent(
                List.of("Source", "Google Trends", "Crossref"),
                List.of(List.of("Google Trends", "1.00", "0.42"),
                        List.of("Crossref", "0.42", "1.00")));

        assertThat(renderer.render(table)).isEqualTo(
                "| Source | Google Trends | Crossref |\n"
                        + "| --- | --- | --- |\n"
                        + "| Google Trends | 1.00 | 0.42 |\n"
                        + "| Crossref | 0.42 | 1.00 |\n");
    }

    @Test
    void padsShortRowsAndEscapesPipes() {
        TabularContent table = new TabularContent(
                List.of("A", "B"),
                List.of(List.of("x|y"), List.of("1", "2", "3")));

        String rendered = renderer.render(table);

        assertThat(rendered).startsWith("| A | B |  |\n| --- | --- | --- |\n");
        assertThat(rendered).contains("| x\\|y |  |  |\n");
        assertThat(rendered).contains("| 1 | 2 | 3 |\n");
    }

    @Test
    void emptyOrMissingTableRendersNothing() {
        assertThat(renderer.render(null)).isEmpty();
        assertThat(renderer.render(new TabularContent(List.of(), List.of()))).isEmpty();
    }
}
