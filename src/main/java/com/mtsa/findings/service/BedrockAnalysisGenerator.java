package com.mtsa.findings.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mtsa.findings.model.AnalysisOutput;
import com.mtsa.findings.model.AnalysisSection;
import com.mtsa.findings.model.AnalysisType;
import com.mtsa.findings.model.DatasetSummary;
import com.mtsa.findings.model.GenerationRequest;
import com.mtsa.findings.model.TabularContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link AnalysisGenerator} backed by an Anthropic model on Amazon Bedrock. Asks for one JSON object
 * of named sections and makes exactly one call per request; throttling, timeouts and unparseable
 * output are reported as {@link GeneratorException}s for the caller to handle.
 */
@Service
public class BedrockAnalysisGenerator implements AnalysisGenerator {

    private static final Logger logger = LoggerFactory.getLogger(BedrockAnalysisGenerator.class);

    private static final List<AnalysisSection> SINGLE_SOURCE_SECTIONS = List.of(
            AnalysisSection.EXECUTIVE_SUMMARY,
            AnalysisSection.PRINCIPAL_FINDINGS,
            AnalysisSection.TEMPORAL_ANALYSIS,
            AnalysisSection.SEASONAL_ANALYSIS,
            AnalysisSection.SPECTRAL_ANALYSIS,
            AnalysisSection.STRATEGIC_SYNTHESIS,
            AnalysisSection.CONCLUSIONS);

    private static final List<AnalysisSection> MULTI_SOURCE_SECTIONS = List.of(AnalysisSection.values());

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final String modelId;
    private final int maxTokens;

    public BedrockAnalysisGenerator(BedrockRuntimeClient bedrockClient,
                                    ObjectMapper objectMapper,
                                    @Value("${aws.bedrock.modelId:anthropic.claude-3-5-sonnet-20240620-v1:0}") String modelId,
                                    @Value("${app.bedrock.maxTokens:4096}") int maxTokens) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.modelId = modelId;
        this.maxTokens = maxTokens;
    }

    @Override
    public String id() {
        return modelId;
    }

    @Override
    public AnalysisOutput generate(GenerationRequest request) {
        long started = System.nanoTime();
        logger.info("Invoking {} for {} ({} sources, {})", modelId, request.toolName(),
                request.sourceNames().size(), request.language());

        InvokeModelResponse response = invoke(buildRequest(createPrompt(request)));
        String responseBody = response.body().asUtf8String();
        AnalysisOutput output = parse(responseBody);
        output.setGeneratorId(modelId);
        output.setLatencyMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        if (output.getDataPoints() == null) {
            output.setDataPoints(request.datasetSummary().dataPoints());
        }
        logger.info("Model {} returned {} sections in {} ms", modelId, output.getSections().size(), output.getLatencyMs());
        return output;
    }

    private InvokeModelRequest buildRequest(String prompt) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("anthropic_version", "bedrock-2023-05-31");
        payload.put("max_tokens", maxTokens);
        ObjectNode userMessage = objectMapper.createObjectNode();
        userMessage.put("role", "user");
        userMessage.put("content", prompt);
        payload.putArray("messages").add(userMessage);
        try {
            return InvokeModelRequest.builder()
                    .modelId(modelId)
                    .contentType("application/json")
                    .accept("application/json")
                    .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new GeneratorException(GeneratorException.Reason.PROVIDER_ERROR, "Failed to serialize request payload", e);
        }
    }

    private InvokeModelResponse invoke(InvokeModelRequest request) {
        try {
            return bedrockClient.invokeModel(request);
        } catch (BedrockRuntimeException e) {
            String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
            boolean throttled = e.statusCode() == 429
                    || "ThrottlingException".equalsIgnoreCase(code)
                    || "TooManyRequestsException".equalsIgnoreCase(code)
                    || "ServiceQuotaExceededException".equalsIgnoreCase(code);
            if (throttled) {
                throw new ThrottledException("Bedrock throttled the request: " + e.getMessage(), e);
            }
            if (e.statusCode() == 408 || "ModelTimeoutException".equalsIgnoreCase(code)) {
                throw new GeneratorException(GeneratorException.Reason.TIMEOUT, "Model timed out: " + e.getMessage(), e);
            }
            throw new GeneratorException(GeneratorException.Reason.PROVIDER_ERROR, "Bedrock error: " + e.getMessage(), e);
        } catch (ApiCallTimeoutException | ApiCallAttemptTimeoutException e) {
            throw new GeneratorException(GeneratorException.Reason.TIMEOUT, "Bedrock call timed out", e);
        } catch (SdkClientException e) {
            throw new GeneratorException(GeneratorException.Reason.PROVIDER_ERROR, "Bedrock client error: " + e.getMessage(), e);
        }
    }

    AnalysisOutput parse(String responseBody) {
        JsonNode sections;
        try {
            JsonNode contentBlock = objectMapper.readTree(responseBody).path("content");
            if (!contentBlock.isArray() || contentBlock.isEmpty()) {
                throw new GeneratorException(GeneratorException.Reason.MALFORMED_OUTPUT, "Response has no content block");
            }
            String text = stripFences(contentBlock.get(0).path("text").asText(""));
            if (!text.startsWith("{") || !text.endsWith("}")) {
                throw new GeneratorException(GeneratorException.Reason.MALFORMED_OUTPUT, "Model output is not a JSON object");
            }
            sections = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new GeneratorException(GeneratorException.Reason.MALFORMED_OUTPUT, "Model output is not valid JSON", e);
        }

        Map<String, String> texts = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = sections.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isTextual() && AnalysisSection.fromKey(field.getKey()).isPresent()) {
                texts.put(AnalysisSection.fromKey(field.getKey()).get().key(), field.getValue().asText());
            }
        }

        Map<String, TabularContent> tables = new LinkedHashMap<>();
        JsonNode tableNode = sections.path("tables");
        if (tableNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> entries = tableNode.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                AnalysisSection.fromKey(entry.getKey()).ifPresent(section -> {
                    try {
                        tables.put(section.key(), objectMapper.treeToValue(entry.getValue(), TabularContent.class));
                    } catch (JsonProcessingException | IllegalArgumentException e) {
                        logger.warn("Ignoring malformed table for section {}: {}", section.key(), e.getMessage());
                    }
                });
            }
        }

        AnalysisOutput output = AnalysisOutput.builder()
                .sections(texts)
                .tables(tables)
                .build();
        JsonNode confidence = sections.path("confidence_score");
        if (confidence.isNumber()) {
            output.setConfidenceScore(confidence.asDouble());
        }
        JsonNode dataPoints = sections.path("data_points");
        if (dataPoints.canConvertToInt() && dataPoints.isNumber()) {
            output.setDataPoints(dataPoints.asInt());
        }
        return output;
    }

    private String stripFences(String raw) {
        String text = raw.trim();
        if (text.startsWith("```json")) {
            text = text.substring(7).trim();
        } else if (text.startsWith("```")) {
            text = text.substring(3).trim();
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3).trim();
        }
        return text;
    }

    private String createPrompt(GenerationRequest request) {
        boolean spanish = "es".equals(request.language());
        List<AnalysisSection> sections = request.analysisType() == AnalysisType.SINGLE
                ? SINGLE_SOURCE_SECTIONS
                : MULTI_SOURCE_SECTIONS;
        DatasetSummary summary = request.datasetSummary();

        StringBuilder prompt = new StringBuilder();
        prompt.append(spanish
                ? "Eres un analista doctoral de herramientas de gestión. Redacta en español.\n"
                : "You are a doctoral-level analyst of management tools. Write in English.\n");
        prompt.append("Management tool: ").append(request.toolName()).append('\n');
        prompt.append("Data sources: ").append(String.join(", ", request.sourceNames())).append('\n');
        prompt.append("Data as of: ").append(summary.asOf()).append(" (").append(summary.dataPoints()).append(" data points)\n");
        summary.attributes().forEach((k, v) -> prompt.append("- ").append(k).append(": ").append(v).append('\n'));
        prompt.append('\n');
        if (request.analysisType() == AnalysisType.SINGLE) {
            prompt.append("This is a single-source analysis. Do not write correlation or component analysis.\n");
        } else {
            prompt.append("This is a multi-source analysis. Correlation and component analysis are required.\n");
        }
        prompt.append("Return ONLY one JSON object with these string fields: ");
        for (int i = 0; i < sections.size(); i++) {
            if (i > 0) {
                prompt.append(", ");
            }
            prompt.append(sections.get(i).key());
        }
        prompt.append(".\nOptionally add \"confidence_score\" (0..1) and \"tables\": an object keyed by section name, ")
                .append("each {\"headers\": [..], \"rows\": [[..]]}. Do not embed Markdown tables in the text.\n");
        return prompt.toString();
    }
}
