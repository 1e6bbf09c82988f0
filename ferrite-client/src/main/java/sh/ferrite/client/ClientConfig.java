// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.ferrite.core.codec.CodecHooks;
import sh.ferrite.core.codec.TextParsers;

/**
 * Settings of a {@link FerriteClient} that the call pipeline and the codecs depend on.
 *
 * <p>Null components fall back to their defaults: no prefix, UTF-8, no codec hooks and the
 * built-in text parsers.
 *
 * <pre>{@code
 * ClientConfig config = ClientConfig.parse("127.0.0.1:6379,prefix=app:,encoding=utf-8");
 *
 * ClientConfig custom = ClientConfig.builder()
 *         .prefix("app:")
 *         .codecHooks(JacksonCodecHooks.create())
 *         .build();
 * }</pre>
 *
 * @param host        {@code host:port} of the server, informational here
 * @param prefix      key prefix applied to every command, or {@code null}
 * @param charset     text encoding of values
 * @param codecHooks  serializer and deserializer for types without a built-in mapping
 * @param textParsers parsers used when decoding text into typed values
 */
public record ClientConfig(
        @Nullable String host,
        @Nullable String prefix,
        Charset charset,
        CodecHooks codecHooks,
        TextParsers textParsers) {

    public ClientConfig {
        prefix = prefix == null || prefix.isEmpty() ? null : prefix;
        charset = charset == null ? StandardCharsets.UTF_8 : charset;
        codecHooks = codecHooks == null ? CodecHooks.none() : codecHooks;
        textParsers = textParsers == null ? TextParsers.builtIn() : textParsers;
    }

    public static ClientConfig defaults() {
        return new ClientConfig(null, null, StandardCharsets.UTF_8, CodecHooks.none(), TextParsers.builtIn());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses a connection string such as {@code 127.0.0.1:6379,prefix=app:,encoding=utf-8}.
     *
     * <p>Segments are comma separated. The first segment without {@code =} is the host.
     * Keys are case-insensitive; unknown keys are ignored so that connection strings
     * written for the transport layer can be passed as they are.
     *
     * @param connectionString the connection string
     * @return the parsed configuration
     * @throws IllegalArgumentException if {@code encoding} names an unknown charset
     */
    public static ClientConfig parse(final String connectionString) {
        Objects.requireNonNull(connectionString, "connectionString");
        final Builder builder = builder();
        boolean hostSeen = false;
        for (String segment : connectionString.split(",")) {
            final String trimmed = segment.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            final int eq = trimmed.indexOf('=');
            if (eq < 0) {
                if (!hostSeen) {
                    builder.host(trimmed);
                    hostSeen = true;
                }
                continue;
            }
            final String key = trimmed.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            final String value = trimmed.substring(eq + 1).trim();
            switch (key) {
                case "prefix" -> builder.prefix(value);
                case "encoding" -> builder.charset(charsetOf(value));
                default -> {
                    // transport settings
                }
            }
        }
        return builder.build();
    }

    private static Charset charsetOf(final String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new IllegalArgumentException("Unknown encoding: " + name, e);
        }
    }

    public static final class Builder {

        private @Nullable String host;
        private @Nullable String prefix;
        private @Nullable Charset charset;
        private @Nullable CodecHooks codecHooks;
        private @Nullable TextParsers textParsers;

        private Builder() {}

        public Builder host(final @Nullable String host) {
            this.host = host;
            return this;
        }

        public Builder prefix(final @Nullable String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder charset(final @Nullable Charset charset) {
            this.charset = charset;
            return this;
        }

        public Builder codecHooks(final @Nullable CodecHooks codecHooks) {
            this.codecHooks = codecHooks;
            return this;
        }

        public Builder textParsers(final @Nullable TextParsers textParsers) {
            this.textParsers = textParsers;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(host, prefix, charset, codecHooks, textParsers);
        }
    }
}
