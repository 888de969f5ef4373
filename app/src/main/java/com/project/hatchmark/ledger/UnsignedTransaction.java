package com.project.hatchmark.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Description of a registry call that still has to be signed by {@code sender}.
 *
 * <p>{@code arguments} are the values passed to the Move function, in call order.
 * {@code annotations} travel with the descriptor for the caller's benefit (for example which
 * input a dispute score was derived from) and are not part of the call.
 */
@JsonIgnoreProperties(value = {"target"}, allowGetters = true)
public record UnsignedTransaction(
        @JsonProperty("packageId") String packageId,
        @JsonProperty("module") String module,
        @JsonProperty("function") String function,
        @JsonProperty("arguments") Map<String, Object> arguments,
        @JsonProperty("sender") String sender,
        @JsonProperty("nonce") String nonce,
        @JsonProperty("annotations") Map<String, Object> annotations
) {

    public UnsignedTransaction {
        Objects.requireNonNull(packageId, "packageId must not be null");
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(sender, "sender must not be null");
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        annotations = annotations == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
    }

    /**
     * {@code <package>::<module>::<function>}.
     */
    @JsonProperty("target")
    public String target() {
        return packageId + "::" + module + "::" + function;
    }

    @JsonIgnore
    public String stringArgument(String name) {
        Object value = arguments.get(name);
        if (value == null) {
            throw new IllegalArgumentException("missing argument '" + name + "' for " + function);
        }
        return value.toString();
    }

    @JsonIgnore
    public long longArgument(String name) {
        Object value = arguments.get(name);
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(stringArgument(name));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("argument '" + name + "' is not a number: " + value, e);
        }
    }
}
