package com.mtsa.findings.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mtsa.findings.model.AnalysisOutput;
import com.mtsa.findings.model.AnalysisSection;
import com.mtsa.findings.model.CombinationKey;
import com.mtsa.findings.model.GenerationRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BedrockAnalysisGeneratorTest {

    @Mock
    private BedrockRuntimeClient bedrockClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private BedrockAnalysisGenerator generator;
    private GenerationRequest singleRequest;
    private GenerationRequest multiRequest;

    @BeforeEach
    void setUp() {
        generator = new BedrockAnalysisGenerator(bedrockClient, objectMapper, "test-model", 2048);

        CombinationCatalog catalog = CombinationCatalog.defaults();
        CombinationKeyFactory keyFactory = new CombinationKeyFactory(catalog, objectMapper);
        CatalogDatasetSummaryProvider summaries = new CatalogDatasetSummaryProvider(catalog, "2025-01-01");
        singleRequest = request(catalog, summaries, keyFactory.canonicalize("Benchmarking", List.of("Google Trends"), "es"));
        multiRequest = request(catalog, summaries,
                keyFactory.canonicalize("Benchmarking", List.of("Google Trends", "Crossref"), "en"));
    }

    @Test
    void parsesSectionsAndStampsModelMetadata() throws Exception {
        ObjectNode sections = objectMapper.createObjectNode();
        sections.put("executive_summary", "Adoption peaked in 2008.");
        sections.put("principal_findings", "Interest declined steadily afterwards.");
        sections.put("conclusions", "The tool is mature.");
        sections.put("confidence_score", 0.7);
        stubModelText(objectMapper.writeValueAsString(sections));

        AnalysisOutput output = generator.generate(singleRequest);

        assertThat(output.section(AnalysisSection.EXECUTIVE_SUMMARY)).isEqualTo("Adoption peaked in 2008.");
        assertThat(output.section(AnalysisSection.CONCLUSIONS)).isEqualTo("The tool is mature.");
        assertThat(output.getGeneratorId()).isEqualTo("test-model");
        assertThat(output.getConfidenceScore()).isEqualTo(0.7);
        assertThat(output.getDataPoints()).isEqualTo(singleRequest.datasetSummary().dataPoints());
        assertThat(output.getLatencyMs()).isNotNull();
    }

    @Test
    void requestCarriesModelIdAndSectionListForMultiSource() throws Exception {
        stubModelText("{\"executive_summary\": \"x\"}");

        generator.generate(multiRequest);

        ArgumentCaptor<InvokeModelRequest> captor = ArgumentCaptor.forClass(InvokeModelRequest.class);
        verify(bedrockClient, times(1)).invokeModel(captor.capture());
        InvokeModelRequest sent = captor.getValue();
        assertThat(sent.modelId()).isEqualTo("test-model");
        String prompt = objectMapper.readTree(sent.body().asUtf8String())
                .path("messages").get(0).path("content").asText();
        assertThat(prompt).contains("Write in English", "correlation_analysis", "component_analysis", "Crossref");
        assertThat(objectMapper.readTree(sent.body().asUtf8String()).path("max_tokens").asInt()).isEqualTo(2048);
    }

    @Test
    void stripsCodeFencesAndMapsLegacySectionNames() {
        stubModelText("```json\n{\"fourier_analysis\": \"Annual cycle dominates.\", \"heatmap_analysis\": \"Strong link.\","
                + " \"tables\": {\"heatmap_analysis\": {\"headers\": [\"a\", \"b\"], \"rows\": [[\"1\", \"0.8\"]]}}}\n```");

        AnalysisOutput output = generator.generate(multiRequest);

        assertThat(output.section(AnalysisSection.SPECTRAL_ANALYSIS)).isEqualTo("Annual cycle dominates.");
        assertThat(output.section(AnalysisSection.CORRELATION_ANALYSIS)).isEqualTo("Strong link.");
        assertThat(output.table(AnalysisSection.CORRELATION_ANALYSIS).headers()).containsExactly("a", "b");
    }

    @Test
    void nonJsonOutputIsMalformed() {
        stubModelText("Here are the findings you asked for.");

        assertThatThrownBy(() -> generator.generate(singleRequest))
                .isInstanceOf(GeneratorException.class)
                .extracting(e -> ((GeneratorException) e).getReason())
                .isEqualTo(GeneratorException.Reason.MALFORMED_OUTPUT);
    }

    @Test
    void truncatedJsonIsMalformed() {
        stubModelText("{\"executive_summary\": \"cut off");

        assertThatThrownBy(() -> generator.generate(singleRequest))
                .isInstanceOf(GeneratorException.class)
                .extracting(e -> ((GeneratorException) e).getReason())
                .isEqualTo(GeneratorException.Reason.MALFORMED_OUTPUT);
    }

    @Test
    void throttlingIsReportedWithoutRetrying() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenThrow(BedrockRuntimeException.builder().statusCode(429).message("Too many requests").build());

        assertThatThrownBy(() -> generator.generate(singleRequest)).isInstanceOf(ThrottledException.class);
        verify(bedrockClient, times(1)).invokeModel(any(InvokeModelRequest.class));
    }

    @Test
    void callTimeoutIsClassifiedAsTimeout() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenThrow(ApiCallTimeoutException.create(1000));

        assertThatThrownBy(() -> generator.generate(singleRequest))
                .isInstanceOf(GeneratorException.class)
                .extracting(e -> ((GeneratorException) e).getReason())
                .isEqualTo(GeneratorException.Reason.TIMEOUT);
    }

    @Test
    void serverErrorIsProviderError() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenThrow(BedrockRuntimeException.builder().statusCode(500).message("Internal").build());

        assertThatThrownBy(() -> generator.generate(singleRequest))
                .isInstanceOf(GeneratorException.class)
                .isNotInstanceOf(ThrottledException.class)
                .extracting(e -> ((GeneratorException) e).getReason())
                .isEqualTo(GeneratorException.Reason.PROVIDER_ERROR);
    }

    private void stubModelText(String text) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode block = body.putArray("content").addObject();
        block.put("type", "text");
        block.put("text", text);
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenReturn(InvokeModelResponse.builder()
                .body(SdkBytes.fromUtf8String(body.toString()))
                .build());
    }

    private static GenerationRequest request(CombinationCatalog catalog,
                                             CatalogDatasetSummaryProvider summaries,
                                             CombinationKey key) {
        return new GenerationRequest(key,
                catalog.toolDisplayName(key.tool()),
                catalog.sourceDisplayNames(key.sources()),
                key.language(),
                summaries.summarize(key));
    }
}
