package com.meganode.engine.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meganode.core.exception.RunnerApiException;
import com.meganode.core.model.UserPk;
import com.meganode.scheduler.ActivityReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Client for the upstream runner's callbacks.
 *
 * Usage:
 * <pre>
 * RunnerClient client = new RunnerClient("http://runner:5050");
 * client.reportActivity(Set.of(userPk));
 * </pre>
 */
public class RunnerClient implements ActivityReporter {

    private static final Logger log = LoggerFactory.getLogger(RunnerClient.class);

    static final String ACTIVITY_PATH = "/node/activity";
    static final String MEGA_READY_PATH = "/mega/ready";

    private final String runnerUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public RunnerClient(String runnerUrl) {
        this(runnerUrl, new ObjectMapper(), Duration.ofSeconds(10));
    }

    public RunnerClient(String runnerUrl, ObjectMapper objectMapper, Duration requestTimeout) {
        this.runnerUrl = stripTrailingSlash(runnerUrl);
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    /**
     * Tell the runner these users were recently active, one call per user.
     * Keeps going after a failed call and throws the first failure at the end.
     */
    @Override
    public void reportActivity(Set<UserPk> activeUsers) throws InterruptedException {
        RunnerApiException firstFailure = null;
        for (UserPk userPk : activeUsers) {
            try {
                post(ACTIVITY_PATH, Map.of("user_pk", userPk.hex()));
            } catch (RunnerApiException e) {
                log.warn("Activity notification for {} failed: {}", userPk.shortId(), e.getMessage());
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
        log.debug("Reported activity of {} users", activeUsers.size());
    }

    /**
     * Tell the runner this meganode is up and where to reach it.
     */
    public void megaReady(int megaId, int appPort, int lexePort) throws InterruptedException {
        post(MEGA_READY_PATH, Map.of(
            "mega_id", megaId,
            "app_port", appPort,
            "lexe_port", lexePort
        ));
        log.info("Notified runner that meganode {} is ready", megaId);
    }

    private void post(String path, Map<String, Object> payload) throws InterruptedException {
        String endpoint = runnerUrl + path;
        try {
            String body = objectMapper.writeValueAsString(payload);

            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() / 100 != 2) {
                throw new RunnerApiException(path, response.statusCode(), response.body());
            }
        } catch (IOException e) {
            throw new RunnerApiException(path, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
