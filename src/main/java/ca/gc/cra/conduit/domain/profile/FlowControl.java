package ca.gc.cra.conduit.domain.profile;

import java.util.Locale;

/**
 * Flow-control negotiation mode carried from the profile to the codec.
 *
 * @since 0.1.0
 */
public enum FlowControl {
  /** Plain pass-through after the header exchange. */
  NONE(""),
  /** Vision-style flow; negotiated once per session before forwarding starts. */
  XTLS_RPRX_VISION("xtls-rprx-vision");

  private final String wireName;

  FlowControl(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the name used in URIs and request addons; empty for {@link #NONE}.
   *
   * @return wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Parses the {@code flow} URI parameter.
   *
   * @param raw parameter value; {@code null}, blank or {@code none} map to {@link #NONE}
   * @return flow mode
   * @throws IllegalArgumentException for unsupported flows
   */
  public static FlowControl fromWireName(String raw) {
    if (raw == null || raw.isBlank()) {
      return NONE;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "none" -> NONE;
      case "xtls-rprx-vision" -> XTLS_RPRX_VISION;
      default -> throw new IllegalArgumentException("Unsupported flow: " + raw);
    };
  }
}
