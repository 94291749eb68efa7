package com.example.logfilter.rabbitmq.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;

/**
 * Files found for one RabbitMQ message id. Either path may be {@code null}.
 */
public record PairedFileData(
        @JsonProperty("messageId") String messageId,
        @JsonProperty("mainFile") Path mainFile,
        @JsonProperty("headersFile") Path headersFile,
        @JsonProperty("status") PairedFileStatus status,
        @JsonProperty("errorMessage") String errorMessage
) {
    public static PairedFileData createComplete(Path mainFile, Path headersFile, String messageId) {
        return new PairedFileData(messageId, mainFile, headersFile, PairedFileStatus.COMPLETE, null);
    }

    public static PairedFileData createPartial(Path mainFile, String messageId) {
        return new PairedFileData(messageId, mainFile, null, PairedFileStatus.PARTIAL, null);
    }

    public static PairedFileData createHeadersOnly(Path headersFile, String messageId) {
        return new PairedFileData(messageId, null, headersFile, PairedFileStatus.PARTIAL, null);
    }

    public static PairedFileData createFailed(String messageId, String errorMessage) {
        return new PairedFileData(messageId, null, null, PairedFileStatus.FAILED, errorMessage);
    }

    public PairedFileData withStatus(PairedFileStatus newStatus) {
        return new PairedFileData(messageId, mainFile, headersFile, newStatus, errorMessage);
    }

    @JsonIgnore
    public boolean hasMainFileOnly() {
        return mainFile != null && headersFile == null;
    }

    @JsonIgnore
    public boolean hasHeadersOnly() {
        return mainFile == null && headersFile != null;
    }

    @Override
    public String toString() {
        return switch (status) {
            case COMPLETE, UNIFIED_JSON -> status + ": " + messageId + " (Main: " + mainFile + ", Headers: " + headersFile + ")";
            case PARTIAL -> status + ": " + messageId + " (" + (mainFile != null ? "Main: " + mainFile : "Headers: " + headersFile) + ")";
            case FAILED -> status + ": " + messageId + " (" + errorMessage + ")";
        };
    }
}
