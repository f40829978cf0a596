package com.example.filingcontacts.service.ai;

import com.example.filingcontacts.dto.RawContact;
import com.example.filingcontacts.exception.ContactExtractionException;
import com.example.filingcontacts.exception.FatalExtractionException;
import com.example.filingcontacts.exception.OverloadedException;
import com.example.filingcontacts.exception.PageLimitExceededException;
import com.example.filingcontacts.exception.RateLimitedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Contact extraction through the Google Gemini REST API.
 * Sends either the raw PDF (inline base64) or extracted text together with the
 * contact-extraction prompt, and reads the first JSON array out of the reply.
 */
@Service
public class GeminiVisionExtractionService implements VisionExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(GeminiVisionExtractionService.class);

    static final int MAX_TEXT_CHARS = 15000;
    private static final Pattern JSON_ARRAY = Pattern.compile("\\[[\\s\\S]*\\]");
    private static final TypeReference<List<RawContact>> CONTACT_LIST = new TypeReference<>() {};

    @Value("${gemini.api.key:}")
    private String apiKey;

    @Value("${gemini.api.enabled:true}")
    private boolean enabled;

    @Value("${gemini.api.model:gemini-2.5-flash}")
    private String modelName;

    @Value("${gemini.api.url:https://generativelanguage.googleapis.com/v1beta/models}")
    private String apiUrl;

    @Value("${gemini.api.max-pages:100}")
    private int maxPages;

    @Value("${gemini.api.timeout-seconds:120}")
    private long timeoutSeconds;

    @Value("${gemini.prompt.location:prompts/contact-extraction.txt}")
    private String promptLocation;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private String prompt;

    public GeminiVisionExtractionService() {
        this.webClient = WebClient.builder()
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                // inline PDFs are far bigger than the default 256 KB buffer
                .codecs(c -> c.defaultCodecs().maxInMemorySize(64 * 1024 * 1024))
                .build();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @PostConstruct
    public void loadPrompt() {
        try (InputStream in = new ClassPathResource(promptLocation).getInputStream()) {
            prompt = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            logger.info("✅ Loaded contact extraction prompt from {} ({} chars)", promptLocation, prompt.length());
        } catch (IOException e) {
            throw new IllegalStateException("Could not load prompt " + promptLocation, e);
        }
    }

    @Override
    public List<RawContact> extractContacts(byte[] pdfBytes, String fileName) {
        ensureConfigured();

        int pages = countPages(pdfBytes);
        if (pages > maxPages) {
            throw new PageLimitExceededException(maxPages,
                    fileName + " has " + pages + " pages, limit is " + maxPages);
        }

        logger.info("🤖 Gemini: extracting contacts from {} ({} pages, {} KB)", fileName, pages, pdfBytes.length / 1024);
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode parts = body.putArray("contents").addObject().putArray("parts");
        parts.addObject().put("text", prompt + "\n\nSource file: " + fileName);
        ObjectNode inline = parts.addObject().putObject("inline_data");
        inline.put("mime_type", "application/pdf");
        inline.put("data", Base64.getEncoder().encodeToString(pdfBytes));

        return parseContacts(post(body));
    }

    @Override
    public List<RawContact> extractContactsFromText(String text, String fileName) {
        ensureConfigured();
        if (StringUtils.isBlank(text)) {
            return new ArrayList<>();
        }

        String truncated = StringUtils.truncate(text, MAX_TEXT_CHARS);
        if (truncated.length() < text.length()) {
            logger.debug("Truncated text of {} from {} to {} chars", fileName, text.length(), truncated.length());
        }
        logger.info("🤖 Gemini: extracting contacts from text of {} ({} chars)", fileName, truncated.length());

        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("contents").addObject().putArray("parts").addObject()
                .put("text", prompt + "\n\nSource file: " + fileName + "\n\nDocument text:\n" + truncated);

        return parseContacts(post(body));
    }

    private String post(ObjectNode body) {
        String url = String.format("%s/%s:generateContent?key=%s", apiUrl, modelName, apiKey);
        try {
            return webClient.post()
                    .uri(url)
                    .bodyValue(body.toString())
                    .exchangeToMono(response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(responseBody -> response.statusCode().isError()
                                    ? Mono.error(mapHttpError(response.statusCode().value(), responseBody, maxPages))
                                    : Mono.just(responseBody)))
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .onErrorMap(TimeoutException.class,
                            e -> new OverloadedException("Gemini request timed out after " + timeoutSeconds + "s", e))
                    .block();
        } catch (ContactExtractionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FatalExtractionException("Gemini request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Maps an HTTP error from the Gemini API onto the extraction failure taxonomy.
     */
    static ContactExtractionException mapHttpError(int status, String body, int maxPages) {
        String snippet = StringUtils.abbreviate(StringUtils.defaultString(body), 300);
        if (status == 429) {
            return new RateLimitedException("Gemini rate limit exceeded (429): " + snippet);
        }
        if (status == 503 || status == 529) {
            return new OverloadedException("Gemini overloaded (" + status + "): " + snippet);
        }
        if (status == 400 && StringUtils.containsIgnoreCase(body, "page")) {
            return new PageLimitExceededException(maxPages, "Gemini rejected document page count: " + snippet);
        }
        return new FatalExtractionException("Gemini API error " + status + ": " + snippet);
    }

    /**
     * Pulls the model's text out of a generateContent reply and reads the first JSON array in it.
     */
    List<RawContact> parseContacts(String response) {
        if (StringUtils.isBlank(response)) {
            throw new FatalExtractionException("Gemini API response is empty");
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            if (root.has("error")) {
                throw new FatalExtractionException("Gemini API returned an error: "
                        + root.path("error").path("message").asText("Unknown error"));
            }

            StringBuilder text = new StringBuilder();
            JsonNode candidates = root.path("candidates");
            if (candidates.isArray() && candidates.size() > 0) {
                for (JsonNode part : candidates.get(0).path("content").path("parts")) {
                    text.append(part.path("text").asText(""));
                }
            }

            Matcher matcher = JSON_ARRAY.matcher(text);
            if (!matcher.find()) {
                logger.warn("⚠️ No JSON array in Gemini reply: {}", StringUtils.abbreviate(text.toString(), 500));
                return new ArrayList<>();
            }
            List<RawContact> contacts = objectMapper.readValue(matcher.group(), CONTACT_LIST);
            logger.debug("✅ Gemini returned {} contacts", contacts.size());
            return contacts;

        } catch (JsonProcessingException e) {
            throw new FatalExtractionException("Could not parse Gemini reply: " + e.getOriginalMessage(), e);
        }
    }

    private int countPages(byte[] pdfBytes) {
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            return document.getNumberOfPages();
        } catch (IOException e) {
            throw new FatalExtractionException("Could not read PDF for page count: " + e.getMessage(), e);
        }
    }

    private void ensureConfigured() {
        if (!isEnabled()) {
            throw new FatalExtractionException("Gemini API not enabled or API key not configured");
        }
    }

    public boolean isEnabled() {
        return enabled && apiKey != null && !apiKey.isEmpty();
    }
}
