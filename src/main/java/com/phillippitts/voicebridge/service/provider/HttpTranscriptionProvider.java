package com.phillippitts.voicebridge.service.provider;

import com.phillippitts.voicebridge.config.properties.ProviderProperties;
import com.phillippitts.voicebridge.exception.ProviderException;
import com.phillippitts.voicebridge.exception.ProviderExceptionBuilder;
import com.phillippitts.voicebridge.service.audio.AudioFormat;
import com.phillippitts.voicebridge.service.audio.WavWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Provider for OpenAI-compatible {@code /v1/audio/transcriptions} endpoints.
 *
 * <p>Each call sends one multipart/form-data request containing the segment as a file plus the
 * model and language fields, and reads {@code text} from the JSON response. Raw PCM segments are
 * wrapped in a WAV header first; encoded formats are sent as-is.
 *
 * <p>The endpoint reports no confidence, so a non-empty transcript scores 0.9 and an empty one
 * 0.0.
 *
 * <p>The blocking {@link HttpClient#send} call responds to interruption, which lets the
 * dispatcher abandon an attempt on timeout.
 */
public class HttpTranscriptionProvider extends AbstractTranscriptionProvider {

    private static final Logger LOG = LogManager.getLogger(HttpTranscriptionProvider.class);

    static final double CONFIDENCE_WITH_TEXT = 0.9;

    private final ProviderProperties.Definition definition;
    private final Duration requestTimeout;
    private HttpClient httpClient;

    public HttpTranscriptionProvider(ProviderProperties.Definition definition, Duration requestTimeout) {
        super(definition.name());
        this.definition = definition;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    protected void doInitialize() {
        if (definition.endpoint() == null || definition.endpoint().isBlank()) {
            throw new ProviderException("endpoint is not configured", getProviderName());
        }
        if (definition.apiKey() == null || definition.apiKey().isBlank()) {
            throw new ProviderException("api key is not configured", getProviderName());
        }
        try {
            URI.create(definition.endpoint());
        } catch (IllegalArgumentException e) {
            throw new ProviderException("invalid endpoint " + definition.endpoint(), getProviderName(), e);
        }
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(definition.connectTimeout())
                .build();
        LOG.info("HTTP provider {} initialized: endpoint={}, model={}, language={}",
                getProviderName(), definition.endpoint(), definition.model(), definition.language());
    }

    @Override
    protected void doClose() {
        // HttpClient has no close() before JDK 21; dropping the reference releases it.
        this.httpClient = null;
    }

    @Override
    public ProviderResponse transcribe(byte[] audio, String formatHint) {
        requireAudio(audio);
        ensureInitialized();
        HttpClient client;
        synchronized (lock) {
            client = this.httpClient;
        }

        long t0 = System.nanoTime();
        try {
            String boundary = UUID.randomUUID().toString();
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(definition.endpoint()))
                    .timeout(requestTimeout)
                    .header("Authorization", "Bearer " + definition.apiKey())
                    .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(buildMultipartBody(audio, formatHint, boundary)))
                    .build();

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            long ms = (System.nanoTime() - t0) / 1_000_000L;

            if (response.statusCode() / 100 != 2) {
                throw ProviderExceptionBuilder.create("Provider returned non-success status")
                        .provider(getProviderName())
                        .statusCode(response.statusCode())
                        .durationMs(ms)
                        .build();
            }
            ProviderResponse parsed = parseResponse(response.body());
            LOG.debug("Provider {} answered in {} ms (chars={})", getProviderName(), ms, parsed.text().length());
            return parsed;
        } catch (IOException | InterruptedException | RuntimeException e) {
            throw handleTranscriptionError(e);
        }
    }

    /**
     * Extracts {@code text} from the JSON body.
     *
     * @throws ProviderException if the body is not JSON or has no text field
     */
    ProviderResponse parseResponse(String body) {
        try {
            JSONObject json = new JSONObject(body);
            if (!json.has("text")) {
                throw new ProviderException("response has no text field", getProviderName());
            }
            String text = json.optString("text", "").trim();
            return new ProviderResponse(text, text.isEmpty() ? 0.0 : CONFIDENCE_WITH_TEXT);
        } catch (JSONException e) {
            throw new ProviderException("unparseable response", getProviderName(), e);
        }
    }

    /**
     * Builds the multipart body:
     * <pre>
     * --boundary
     * Content-Disposition: form-data; name="file"; filename="segment.wav"
     * Content-Type: audio/wav
     *
     * [binary data]
     * --boundary
     * Content-Disposition: form-data; name="model"
     *
     * whisper-1
     * --boundary
     * Content-Disposition: form-data; name="language"
     *
     * en
     * --boundary--
     * </pre>
     */
    private byte[] buildMultipartBody(byte[] audio, String formatHint, String boundary) throws IOException {
        boolean rawPcm = AudioFormat.isRawPcm(formatHint);
        byte[] file = rawPcm ? WavWriter.toWav(audio) : audio;
        String extension = rawPcm ? AudioFormat.WAV : AudioFormat.normalize(formatHint, AudioFormat.WEBM);

        ByteArrayOutputStream out = new ByteArrayOutputStream(file.length + 512);
        StringBuilder head = new StringBuilder()
                .append("--").append(boundary).append("\r\n")
                .append("Content-Disposition: form-data; name=\"file\"; filename=\"segment.")
                .append(extension).append("\"\r\n")
                .append("Content-Type: audio/").append(extension).append("\r\n\r\n");
        out.write(head.toString().getBytes(StandardCharsets.UTF_8));
        out.write(file);

        StringBuilder tail = new StringBuilder("\r\n");
        appendField(tail, boundary, "model", definition.model());
        appendField(tail, boundary, "language", definition.language());
        appendField(tail, boundary, "response_format", "json");
        tail.append("--").append(boundary).append("--\r\n");
        out.write(tail.toString().getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

    private static void appendField(StringBuilder sb, String boundary, String name, String value) {
        sb.append("--").append(boundary).append("\r\n")
                .append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n")
                .append(value).append("\r\n");
    }
}
