package net.cronhook.adapter.http;

import net.cronhook.core.model.ExecutionOutcome;
import net.cronhook.core.spi.ExecutionRunner;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Okio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Fires one POST per call. Any response counts as {@code success} unless {@code failOnHttpError}
 * is set, in which case non-2xx codes become {@code error}. Transport failures never escape.
 */
public final class OkHttpExecutionRunner implements ExecutionRunner, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OkHttpExecutionRunner.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final MediaType JSON = MediaType.get("application/json");
    private static final RequestBody EMPTY = RequestBody.create(new byte[0]);

    private final OkHttpClient client;
    private final boolean failOnHttpError;

    public OkHttpExecutionRunner(OkHttpClient client, boolean failOnHttpError) {
        this.client = client;
        this.failOnHttpError = failOnHttpError;
    }

    public static OkHttpExecutionRunner create(Duration timeout, boolean failOnHttpError) {
        return new OkHttpExecutionRunner(newClient(timeout), failOnHttpError);
    }

    /** Whole-call budget covers connect, upload and reading the response body. */
    public static OkHttpClient newClient(Duration timeout) {
        return new OkHttpClient.Builder()
                .callTimeout(timeout)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Override
    public ExecutionOutcome execute(String url, String body, String secret) {
        HttpUrl target = url == null ? null : HttpUrl.parse(url);
        if (target == null) {
            return ExecutionOutcome.transportFailure(0, "Invalid URL: " + url);
        }

        Request.Builder request = new Request.Builder()
                .url(target)
                .header("Content-Type", JSON.toString());
        if (secret != null && !secret.isEmpty()) {
            request.header("Authorization", "Bearer " + secret);
        }
        request.post(body == null || body.isEmpty()
                ? EMPTY
                : RequestBody.create(body.getBytes(StandardCharsets.UTF_8), JSON));

        long started = System.nanoTime();
        try (Response response = client.newCall(request.build()).execute()) {
            ResponseBody responseBody = response.body();
            if (responseBody != null) {
                responseBody.source().readAll(Okio.blackhole());
            }
            long durationMs = elapsedMs(started);
            int code = response.code();
            if (failOnHttpError && !response.isSuccessful()) {
                return ExecutionOutcome.rejected(code, durationMs, "HTTP " + code + ": " + response.message());
            }
            return ExecutionOutcome.responded(code, durationMs);
        } catch (IOException | RuntimeException e) {
            long durationMs = elapsedMs(started);
            log.debug("POST {} failed after {}ms", target.redact(), durationMs, e);
            return ExecutionOutcome.transportFailure(durationMs, describe(e));
        }
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
