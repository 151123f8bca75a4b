package com.resume.network.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Query oracle backed by a local Ollama server.
 *
 * Ollama must be running locally (default: http://localhost:11434).
 * The model is asked for a single JSON object in Ollama's JSON mode.
 *
 * Usage:
 * <pre>
 * OllamaQueryOracle oracle = OllamaQueryOracle.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("llama3.2")
 *     .build();
 *
 * ResumeNetworkService service = ResumeNetworkService.builder()
 *     .queryOracle(oracle)
 *     .build();
 * </pre>
 */
public class OllamaQueryOracle implements QueryOracle {
    private static final Logger log = LoggerFactory.getLogger(OllamaQueryOracle.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "llama3.2";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final int MAX_HINTS = 50;

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaQueryOracle(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public OracleResponse translate(OracleRequest request) {
        log.debug("oracle.request model={} text='{}'", model, request.text());
        String prompt = buildPrompt(request);
        String content = callOllama(prompt);
        log.debug("oracle.response model={} length={}", model, content.length());
        return new OracleResponse(content, getOracleName());
    }

    @Override
    public String getOracleName() {
        return "Ollama/" + model;
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Builds the prompt for query interpretation.
     */
    String buildPrompt(OracleRequest request) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("You translate recruiter search requests into JSON search filters.\n");
        prompt.append("Today is ").append(request.today()).append(".\n\n");
        prompt.append("Request: \"").append(request.text()).append("\"\n\n");

        appendHints(prompt, "Known organizations", request.knownOrganizations());
        appendHints(prompt, "Known skills", request.knownSkills());

        prompt.append("Respond with ONE JSON object using only these fields (omit unknown ones):\n");
        prompt.append("  \"organization\": string\n");
        prompt.append("  \"department\": string\n");
        prompt.append("  \"skills\": array of strings\n");
        prompt.append("  \"skill_mode\": \"all\" or \"any\"\n");
        prompt.append("  \"date_from\": \"YYYY-MM-DD\"\n");
        prompt.append("  \"date_to\": \"YYYY-MM-DD\" (exclusive)\n");
        prompt.append("  \"seniority\": \"junior\", \"mid\", \"senior\" or \"lead\"\n");
        prompt.append("  \"min_experience_years\": integer\n");
        prompt.append("  \"terms\": array of role or keyword strings\n");
        prompt.append("Do not add explanations.\n");

        return prompt.toString();
    }

    private static void appendHints(StringBuilder prompt, String label, List<String> hints) {
        if (hints.isEmpty()) {
            return;
        }
        List<String> shown = hints.size() > MAX_HINTS ? hints.subList(0, MAX_HINTS) : hints;
        prompt.append(label).append(": ").append(String.join(", ", shown)).append("\n\n");
    }

    /**
     * Calls the Ollama generate API in JSON mode.
     */
    private String callOllama(String prompt) {
        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(new OllamaRequest(model, prompt, false, "json"));
        } catch (JsonProcessingException e) {
            throw new OracleUnavailableException("Could not encode Ollama request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/generate"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new OracleUnavailableException("Error calling Ollama: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleUnavailableException("Interrupted while calling Ollama", e);
        }

        if (response.statusCode() != 200) {
            throw new OracleUnavailableException(
                    "Ollama returned status " + response.statusCode() + ": " + response.body());
        }

        try {
            OllamaResponse ollamaResponse = objectMapper.readValue(response.body(), OllamaResponse.class);
            if (ollamaResponse.response() == null) {
                throw new OracleUnavailableException("Ollama response has no content");
            }
            return ollamaResponse.response();
        } catch (JsonProcessingException e) {
            throw new OracleUnavailableException("Unreadable Ollama envelope: " + e.getOriginalMessage(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default Ollama oracle with llama3.2.
     */
    public static OllamaQueryOracle createDefault() {
        return builder().build();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public OllamaQueryOracle build() {
            return new OllamaQueryOracle(this);
        }
    }

    // Request/Response DTOs for Ollama API
    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaRequest(
            String model,
            String prompt,
            boolean stream,
            String format
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaResponse(
            String model,
            @JsonProperty("created_at") String createdAt,
            String response,
            boolean done
    ) {}
}
