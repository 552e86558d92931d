package ca.gc.cra.conduit.infrastructure.profile;

import ca.gc.cra.conduit.domain.profile.Credential;
import ca.gc.cra.conduit.domain.profile.FlowControl;
import ca.gc.cra.conduit.domain.profile.Profile;
import ca.gc.cra.conduit.domain.profile.TransportConfig;
import ca.gc.cra.conduit.domain.profile.TransportKind;
import ca.gc.cra.conduit.logging.Logs;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Streams profiles as JSON with Jackson's generator.
 * <p>{@link #inspect(Profile)} produces a redacted description for diagnostics. {@link #xrayOutbound(Profile,
 * Credential)} produces an Xray-compatible outbound block and therefore contains the credential.</p>
 *
 * @since 0.1.0
 */
public final class ProfileJsonWriter {
  private final JsonFactory jsonFactory = new JsonFactory();
  private final boolean pretty;

  public ProfileJsonWriter(boolean pretty) {
    this.pretty = pretty;
  }

  /**
   * Describes a profile without any secret material.
   *
   * @param profile profile to describe
   * @return JSON document
   */
  public String inspect(Profile profile) {
    Objects.requireNonNull(profile, "profile");
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("id", profile.id());
      gen.writeStringField("name", profile.name());
      gen.writeStringField("credential", Logs.REDACTED_UUID);
      gen.writeObjectFieldStart("endpoint");
      gen.writeStringField("host", profile.endpoint().hostname());
      gen.writeNumberField("port", profile.endpoint().port());
      Optional<String> sni = profile.endpoint().sni();
      if (sni.isPresent()) {
        gen.writeStringField("serverName", sni.get());
      }
      gen.writeEndObject();
      gen.writeStringField("transport", profile.transport().kind().uriName());
      gen.writeStringField("flow", profile.flow() == FlowControl.NONE ? "none" : profile.flow().wireName());
      writeSecurity(gen, profile.transport());
      writeTransportSettings(gen, profile.transport());
      gen.writeObjectFieldStart("destination");
      gen.writeStringField("type", profile.destination().type().name());
      gen.writeStringField("host", profile.destination().host());
      gen.writeNumberField("port", profile.destination().port());
      gen.writeEndObject();
      gen.writeEndObject();
    });
  }

  /**
   * Renders the profile as an Xray outbound configuration.
   *
   * @param profile profile to export
   * @param credential credential embedded as the user id
   * @return JSON document containing the credential
   */
  public String xrayOutbound(Profile profile, Credential credential) {
    Objects.requireNonNull(profile, "profile");
    Objects.requireNonNull(credential, "credential");
    return write(gen -> {
      gen.writeStartObject();
      gen.writeArrayFieldStart("outbounds");
      gen.writeStartObject();
      gen.writeStringField("protocol", "vless");
      gen.writeObjectFieldStart("settings");
      gen.writeArrayFieldStart("vnext");
      gen.writeStartObject();
      gen.writeStringField("address", profile.endpoint().hostname());
      gen.writeNumberField("port", profile.endpoint().port());
      gen.writeArrayFieldStart("users");
      gen.writeStartObject();
      gen.writeStringField("id", credential.reveal());
      gen.writeStringField("encryption", "none");
      if (profile.flow() != FlowControl.NONE) {
        gen.writeStringField("flow", profile.flow().wireName());
      }
      gen.writeNumberField("level", 0);
      gen.writeEndObject();
      gen.writeEndArray();
      gen.writeEndObject();
      gen.writeEndArray();
      gen.writeEndObject();
      gen.writeObjectFieldStart("streamSettings");
      gen.writeStringField("network", xrayNetwork(profile.transport().kind()));
      writeSecurity(gen, profile.transport());
      writeTransportSettings(gen, profile.transport());
      gen.writeEndObject();
      gen.writeEndObject();
      gen.writeEndArray();
      gen.writeEndObject();
    });
  }

  private static void writeSecurity(JsonGenerator gen, TransportConfig transport) throws IOException {
    Optional<TransportConfig.Tls> tls = transport.tls();
    if (tls.isEmpty()) {
      gen.writeStringField("security", "none");
      return;
    }
    gen.writeStringField("security", "tls");
    gen.writeObjectFieldStart("tlsSettings");
    gen.writeStringField("serverName", tls.get().serverName());
    gen.writeBooleanField("allowInsecure", tls.get().allowInsecure());
    writeStrings(gen, "alpn", tls.get().alpn());
    gen.writeEndObject();
  }

  private static void writeTransportSettings(JsonGenerator gen, TransportConfig transport) throws IOException {
    if (transport instanceof TransportConfig.WebSocket ws) {
      gen.writeObjectFieldStart("wsSettings");
      gen.writeStringField("path", ws.path());
      if (!ws.headers().isEmpty()) {
        gen.writeObjectFieldStart("headers");
        for (Map.Entry<String, String> header : ws.headers().entrySet()) {
          gen.writeStringField(header.getKey(), header.getValue());
        }
        gen.writeEndObject();
      }
      gen.writeEndObject();
    } else if (transport instanceof TransportConfig.Grpc grpc) {
      gen.writeObjectFieldStart("grpcSettings");
      gen.writeStringField("serviceName", grpc.serviceName());
      gen.writeBooleanField("multiMode", grpc.multiMode());
      gen.writeEndObject();
    } else if (transport instanceof TransportConfig.Http2 h2) {
      gen.writeObjectFieldStart("httpSettings");
      gen.writeStringField("path", h2.path());
      writeStrings(gen, "host", h2.hosts());
      gen.writeEndObject();
    }
  }

  private static void writeStrings(JsonGenerator gen, String field, List<String> values) throws IOException {
    if (values.isEmpty()) {
      return;
    }
    gen.writeArrayFieldStart(field);
    for (String value : values) {
      gen.writeString(value);
    }
    gen.writeEndArray();
  }

  private static String xrayNetwork(TransportKind kind) {
    return switch (kind) {
      case TCP -> "tcp";
      case WEBSOCKET -> "ws";
      case GRPC -> "grpc";
      case HTTP2 -> "http";
    };
  }

  private String write(JsonBody body) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      body.write(gen);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render profile JSON", ex);
    }
    return out.toString();
  }

  @FunctionalInterface
  private interface JsonBody {
    void write(JsonGenerator gen) throws IOException;
  }
}
