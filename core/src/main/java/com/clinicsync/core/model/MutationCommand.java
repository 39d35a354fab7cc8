package com.clinicsync.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializable description of deferred write work.
 * <p>
 * The queue never interprets {@code arguments}; at drain time the command is resolved
 * against the executor registered for {@code commandType}, so a rehydrated queue can
 * still execute it after a restart.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class MutationCommand {

    /**
     * Executor lookup key, e.g. {@code "patient.update"}.
     */
    @JsonProperty("commandType")
    String commandType;

    /**
     * JSON-compatible arguments handed to the executor.
     */
    @Singular
    @JsonProperty("arguments")
    Map<String, Object> arguments;

    @JsonCreator
    public MutationCommand(
        @JsonProperty("commandType") String commandType,
        @JsonProperty("arguments") Map<String, Object> arguments
    ) {
        if (commandType == null || commandType.isBlank()) {
            throw new IllegalArgumentException("commandType must not be blank");
        }
        this.commandType = commandType;
        this.arguments = arguments == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static MutationCommand of(String commandType, Map<String, Object> arguments) {
        return new MutationCommand(commandType, arguments);
    }
}
