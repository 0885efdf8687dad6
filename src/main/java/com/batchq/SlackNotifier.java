package com.batchq;

import com.batchq.Models.Job;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts finished and failed jobs to a Slack channel. Token and channel are read from the config on
 * every event, so changing them at runtime takes effect for the next job.
 */
public class SlackNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(SlackNotifier.class);
    static final URI POST_MESSAGE = URI.create("https://slack.com/api/chat.postMessage");

    private final Config config;
    private final HttpClient httpClient;

    public SlackNotifier(Config config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public void send(Job job, Event event) {
        if (event == Event.STARTED) return;
        String token = config.slack_token;
        String channel = config.slack_channel;
        if (token == null || channel == null) return;

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(POST_MESSAGE)
                    .timeout(Duration.ofSeconds(30))
                    .header("Content-Type", "application/json; charset=utf-8")
                    .header("Authorization", "Bearer " + token)
                    .POST(HttpRequest.BodyPublishers.ofString(body(channel, message(job, event))))
                    .build();
        } catch (JsonProcessingException e) {
            log.warn("Could not build Slack message for job {}: {}", job.id, e.getMessage());
            return;
        }
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()).whenComplete((response, error) -> {
            if (error != null) {
                log.warn("Slack notification for job {} failed: {}", job.id, error.toString());
            } else if (response.statusCode() != 200) {
                log.warn("Slack notification for job {} got HTTP {}", job.id, response.statusCode());
            }
        });
    }

    static String message(Job job, Event event) {
        String verb = event == Event.FAILED ? "failed" : "finished";
        return job.displayName() + " (#" + job.id + ") " + verb + " with exit code " + job.exit_code + " on " + job.node;
    }

    static String body(String channel, String text) throws JsonProcessingException {
        ObjectNode n = Models.JSON.createObjectNode();
        n.put("channel", channel);
        n.put("text", text);
        return Models.JSON.writeValueAsString(n);
    }
}
