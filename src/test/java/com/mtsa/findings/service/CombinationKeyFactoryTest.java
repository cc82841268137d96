package com.mtsa.findings.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mtsa.findings.model.AnalysisType;
import com.mtsa.findings.model.CombinationKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CombinationKeyFactoryTest {

    private CombinationKeyFactory factory;

    @BeforeEach
    void setUp() {
        factory = new CombinationKeyFactory(CombinationCatalog.defaults(), new ObjectMapper());
    }

    @Test
    void sourceOrderDoesNotChangeTheKey() {
        CombinationKey first = factory.canonicalize("Benchmarking", List.of("Google Trends", "Crossref"), "es");
        CombinationKey second = factory.canonicalize("Benchmarking", List.of("Crossref", "Google Trends"), "es");

        assertThat(first.hash()).isEqualTo(second.hash());
        assertThat(first).isEqualTo(second);
        assertThat(first.sources()).containsExactly("crossref", "google trends");
    }

    @Test
    void casingWhitespaceAndDuplicatesAreNormalized() {
        CombinationKey plain = factory.canonicalize("Benchmarking", List.of("Google Trends"), "es");
        CombinationKey messy = factory.canonicalize("  BENCHMARKING ", List.of("google   trends", "Google_Trends"), "ES");

        assertThat(messy.hash()).isEqualTo(plain.hash());
        assertThat(messy.sourceCount()).isEqualTo(1);
    }

    @Test
    void singleSourceKeyIsSingleAndLanguageDistinguishesKeys() {
        CombinationKey es = factory.canonicalize("Benchmarking", List.of("Google Trends"), "es");
        CombinationKey en = factory.canonicalize("Benchmarking", List.of("Google Trends"), "en");

        assertThat(es.analysisType()).isEqualTo(AnalysisType.SINGLE);
        assertThat(es.hash()).hasSize(64).isNotEqualTo(en.hash());
    }

    @Test
    void multipleSourcesProduceMultiKey() {
        CombinationKey key = factory.canonicalize("Calidad Total",
                List.of("Google Trends", "Google Books", "Bain Usability"), "en");

        assertThat(key.analysisType()).isEqualTo(AnalysisType.MULTI);
        assertThat(key.canonicalForm())
                .isEqualTo("{\"tool\":\"calidad total\",\"sources\":[\"bain usability\",\"google books\",\"google trends\"],\"language\":\"en\"}");
    }

    @Test
    void emptySourceSetIsRejected() {
        assertThatThrownBy(() -> factory.canonicalize("Benchmarking", List.of(), "es"))
                .isInstanceOf(InvalidCombinationException.class);
        assertThatThrownBy(() -> factory.canonicalize("Benchmarking", List.of("  "), "es"))
                .isInstanceOf(InvalidCombinationException.class);
    }

    @Test
    void unknownToolSourceOrLanguageIsRejected() {
        assertThatThrownBy(() -> factory.canonicalize("Six Sigma", List.of("Google Trends"), "es"))
                .isInstanceOf(InvalidCombinationException.class)
                .hasMessageContaining("Six Sigma");
        assertThatThrownBy(() -> factory.canonicalize("Benchmarking", List.of("Twitter"), "es"))
                .isInstanceOf(InvalidCombinationException.class);
        assertThatThrownBy(() -> factory.canonicalize("Benchmarking", List.of("Google Trends"), "fr"))
                .isInstanceOf(InvalidCombinationException.class);
    }

    @Test
    void enumerationCoversEveryToolSubsetAndLanguageOnce() {
        List<CombinationKey> keys = factory.enumerateAll();

        Set<String> hashes = new HashSet<>();
        keys.forEach(k -> hashes.add(k.hash()));
        assertThat(keys).hasSize(21 * 31 * 2);
        assertThat(hashes).hasSize(keys.size());
        assertThat(keys).filteredOn(k -> k.analysisType() == AnalysisType.SINGLE).hasSize(21 * 5 * 2);
    }
}
