package com.eainde.loganalyzer.config;

import com.eainde.loganalyzer.dedup.DedupStore;
import com.eainde.loganalyzer.dedup.FileDedupStore;
import com.eainde.loganalyzer.llm.ChatModelTransport;
import com.eainde.loganalyzer.llm.FindingsSynthesizer;
import com.eainde.loganalyzer.llm.LlmCallLoggingListener;
import com.eainde.loganalyzer.llm.LlmOptions;
import com.eainde.loganalyzer.llm.LlmTransport;
import com.eainde.loganalyzer.llm.PromptBuilder;
import com.eainde.loganalyzer.parse.EventParser;
import com.eainde.loganalyzer.parse.ExceptionExtractor;
import com.eainde.loganalyzer.parse.SignatureNormalizer;
import com.eainde.loganalyzer.report.ReportWriter;
import com.eainde.loganalyzer.thread.MdcAwareExecutor;
import com.eainde.loganalyzer.validate.ResultValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Wires the pipeline collaborators from {@code loganalyzer.*} properties.
 */
@Log4j2
@Configuration
public class LogAnalyzerConfig {

    static final String OPENAI_BASE_URL = "https://api.openai.com/v1";

    // ── Normalization ───────────────────────────────────────────────────

    @Value("${loganalyzer.signature.max-tokens:8}")
    private int signatureMaxTokens;

    @Value("${loganalyzer.signature.max-length:120}")
    private int signatureMaxLength;

    @Value("${loganalyzer.signature.strip-paths:true}")
    private boolean stripPaths;

    @Value("${loganalyzer.signature.strip-code-locations:true}")
    private boolean stripCodeLocations;

    @Value("${loganalyzer.signature.strip-identifiers:true}")
    private boolean stripIdentifiers;

    @Value("${loganalyzer.signature.strip-numbers:true}")
    private boolean stripNumbers;

    // ── Prompt and model ────────────────────────────────────────────────

    @Value("${loganalyzer.prompt.max-groups:20}")
    private int promptMaxGroups;

    @Value("${loganalyzer.prompt.max-example-length:240}")
    private int promptMaxExampleLength;

    @Value("${loganalyzer.prompt.max-tokens-per-group:5}")
    private int promptMaxTokensPerGroup;

    @Value("${loganalyzer.llm.provider:ollama}")
    private String provider;

    @Value("${loganalyzer.llm.model:mistral:latest}")
    private String model;

    @Value("${loganalyzer.llm.base-url:}")
    private String baseUrl;

    @Value("${loganalyzer.llm.api-key:}")
    private String apiKey;

    @Value("${loganalyzer.llm.temperature:0.0}")
    private double temperature;

    @Value("${loganalyzer.llm.timeout:60s}")
    private Duration timeout;

    @Value("${loganalyzer.llm.max-attempts:3}")
    private int maxAttempts;

    @Value("${loganalyzer.llm.initial-backoff:1s}")
    private Duration initialBackoff;

    @Value("${loganalyzer.llm.raw-output-dir:outputs/log_analyzer}")
    private String rawOutputDir;

    // ── Output ──────────────────────────────────────────────────────────

    @Value("${loganalyzer.output.directory:outputs/log_analyzer}")
    private String outputDirectory;

    @Value("${loganalyzer.output.json-file:log_findings.json}")
    private String jsonFile;

    @Value("${loganalyzer.output.markdown-file:log_summary.md}")
    private String markdownFile;

    @Value("${loganalyzer.output.top-root-causes:3}")
    private int topRootCauses;

    @Value("${loganalyzer.dedup.store:outputs/log_analyzer/created_bugs.json}")
    private String dedupStorePath;

    @Value("${loganalyzer.parallelism:4}")
    private int parallelism;

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "analysisExecutor", destroyMethod = "close")
    public MdcAwareExecutor analysisExecutor() {
        return new MdcAwareExecutor(parallelism, "log-reader-");
    }

    /** Model calls get their own threads so a hung call never starves file parsing. */
    @Bean(name = "llmExecutor", destroyMethod = "close")
    public MdcAwareExecutor llmExecutor() {
        return new MdcAwareExecutor(Math.max(1, maxAttempts), "llm-call-");
    }

    // =========================================================================
    //  Parsing and aggregation
    // =========================================================================

    @Bean
    public EventParser eventParser() {
        return new EventParser();
    }

    @Bean
    public SignatureNormalizer signatureNormalizer() {
        return SignatureNormalizer.builder()
                .maxTokens(signatureMaxTokens)
                .maxLength(signatureMaxLength)
                .stripPaths(stripPaths)
                .stripCodeLocations(stripCodeLocations)
                .stripIdentifiers(stripIdentifiers)
                .stripNumbers(stripNumbers)
                .build();
    }

    @Bean
    public ExceptionExtractor exceptionExtractor(SignatureNormalizer signatureNormalizer) {
        // marker tails are normalized like messages so variable data collapses into one token
        return new ExceptionExtractor(signatureNormalizer);
    }

    // =========================================================================
    //  Model
    // =========================================================================

    @Bean
    public ChatModel chatModel() {
        boolean ollama = "ollama".equals(provider.strip().toLowerCase(Locale.ROOT));
        String url = resolveBaseUrl(ollama);
        log.info("Using {} model {} at {}", ollama ? "ollama" : "openai", model, url);

        return OpenAiChatModel.builder()
                .baseUrl(url)
                // Ollama ignores the key but the client requires one
                .apiKey(apiKey.isBlank() && ollama ? "ollama" : apiKey)
                .modelName(model)
                .temperature(temperature)
                .timeout(timeout)
                .listeners(List.of(new LlmCallLoggingListener()))
                .build();
    }

    private String resolveBaseUrl(boolean ollama) {
        if (!ollama) {
            return baseUrl.isBlank() ? OPENAI_BASE_URL : baseUrl;
        }
        String url = baseUrl.isBlank() ? "http://localhost:11434" : baseUrl;
        url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        return url.endsWith("/v1") ? url : url + "/v1";
    }

    @Bean
    public LlmTransport llmTransport(ChatModel chatModel) {
        return new ChatModelTransport(chatModel);
    }

    @Bean
    public PromptBuilder promptBuilder(ObjectMapper objectMapper) {
        return new PromptBuilder(objectMapper, promptMaxGroups, promptMaxExampleLength, promptMaxTokensPerGroup);
    }

    @Bean
    public FindingsSynthesizer findingsSynthesizer(LlmTransport llmTransport,
                                                   ObjectMapper objectMapper,
                                                   @Qualifier("llmExecutor") MdcAwareExecutor llmExecutor) {
        return new FindingsSynthesizer(
                llmTransport,
                objectMapper,
                new LlmOptions(model, temperature, timeout),
                maxAttempts,
                initialBackoff,
                llmExecutor,
                rawOutputDir.isBlank() ? null : Path.of(rawOutputDir));
    }

    // =========================================================================
    //  Validation, output, dedup
    // =========================================================================

    @Bean
    public ResultValidator resultValidator(EventParser eventParser) {
        return new ResultValidator(eventParser);
    }

    @Bean
    public ReportWriter reportWriter(ObjectMapper objectMapper, Clock clock) {
        return new ReportWriter(objectMapper, Path.of(outputDirectory), jsonFile, markdownFile, topRootCauses, clock);
    }

    @Bean
    public DedupStore dedupStore(ObjectMapper objectMapper, Clock clock) {
        return new FileDedupStore(objectMapper, Path.of(dedupStorePath), clock);
    }
}
